package com.phillippitts.gatesentry.presentation.dto;

public record SessionCreatedResponse(String sessionId) {
}
