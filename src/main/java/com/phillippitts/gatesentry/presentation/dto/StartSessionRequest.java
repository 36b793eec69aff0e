package com.phillippitts.gatesentry.presentation.dto;

/**
 * Body of {@code POST /api/sessions}. The body itself and the camera id are optional.
 */
public record StartSessionRequest(String cameraId) {
}
