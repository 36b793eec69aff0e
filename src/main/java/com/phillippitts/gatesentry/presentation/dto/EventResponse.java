package com.phillippitts.gatesentry.presentation.dto;

import com.phillippitts.gatesentry.service.events.GateEvent;

import java.time.Instant;
import java.util.Locale;

public record EventResponse(String type, String message, Instant at) {

    public static EventResponse from(GateEvent event) {
        return new EventResponse(event.type().name().toLowerCase(Locale.ROOT), event.message(), event.at());
    }
}
