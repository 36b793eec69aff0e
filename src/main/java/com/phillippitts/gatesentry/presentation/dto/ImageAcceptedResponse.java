package com.phillippitts.gatesentry.presentation.dto;

public record ImageAcceptedResponse(String status, String imageId) {

    public static ImageAcceptedResponse queued(String imageId) {
        return new ImageAcceptedResponse("queued", imageId);
    }
}
