package com.phillippitts.gatesentry.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record CameraRequest(@NotBlank String cameraId) {
}
