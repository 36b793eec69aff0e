package com.phillippitts.gatesentry.service.vision;

/**
 * Raw image delivered by a {@link FrameSource}.
 *
 * @param data     encoded image bytes
 * @param mimeType image media type
 */
public record CapturedImage(byte[] data, String mimeType) {
}
