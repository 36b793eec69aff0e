package com.phillippitts.gatesentry.presentation.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Camera frame upload.
 *
 * @param image    base64 payload, plain or as a {@code data:} URL
 * @param mimeType image type; defaults to {@code image/jpeg}
 */
public record ImageRequest(@NotBlank String image, String mimeType) {
}
