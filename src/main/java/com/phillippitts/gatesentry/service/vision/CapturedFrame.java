package com.phillippitts.gatesentry.service.vision;

import java.time.Instant;
import java.util.Objects;

/**
 * One camera frame waiting for analysis.
 *
 * @param frameId    identifier returned to the uploader
 * @param sessionId  session the frame belongs to
 * @param image      encoded image bytes
 * @param mimeType   image media type
 * @param capturedAt capture time
 */
public record CapturedFrame(String frameId, String sessionId, byte[] image, String mimeType, Instant capturedAt) {

    public CapturedFrame {
        Objects.requireNonNull(frameId, "frameId");
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(image, "image");
        mimeType = mimeType == null || mimeType.isBlank() ? "image/jpeg" : mimeType;
        capturedAt = capturedAt == null ? Instant.now() : capturedAt;
    }
}
