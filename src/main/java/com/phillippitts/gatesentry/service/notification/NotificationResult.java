package com.phillippitts.gatesentry.service.notification;

/**
 * Outcome of a notification attempt.
 *
 * @param success whether the message was accepted for delivery
 * @param message human-readable status for logs
 */
public record NotificationResult(boolean success, String message) {

    public static NotificationResult sent(String message) {
        return new NotificationResult(true, message);
    }

    public static NotificationResult failed(String message) {
        return new NotificationResult(false, message);
    }
}
