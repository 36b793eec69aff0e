package com.phillippitts.gatesentry.presentation.dto;

import com.phillippitts.gatesentry.service.log.VisionLogEntry;

import java.time.Instant;

public record ThreatLogResponse(Instant timestamp, ProfileResponse.VisionView vision) {

    public static ThreatLogResponse from(VisionLogEntry entry) {
        return new ThreatLogResponse(entry.timestamp(), ProfileResponse.VisionView.from(entry.schema()));
    }
}
