package com.phillippitts.gatesentry.presentation.dto;

/**
 * One visitor line. A missing or blank message is answered with a reprompt.
 */
public record MessageRequest(String message) {

    public String messageOrEmpty() {
        return message == null ? "" : message;
    }
}
