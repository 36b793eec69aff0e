package com.phillippitts.gatesentry.service.log;

import com.phillippitts.gatesentry.domain.VisionSchema;

import java.time.Instant;

/**
 * One recorded frame verdict.
 *
 * @param sessionId session the frame belonged to
 * @param timestamp analysis time
 * @param schema    normalized verdict
 */
public record VisionLogEntry(String sessionId, Instant timestamp, VisionSchema schema) {
}
