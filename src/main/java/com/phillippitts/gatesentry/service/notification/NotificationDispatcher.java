package com.phillippitts.gatesentry.service.notification;

/** Delivers a message to an internal contact. */
public interface NotificationDispatcher {

    /**
     * Sends a message to the named contact.
     *
     * <p>Implementations report delivery problems through the result; an exception is treated the
     * same as {@code success=false}.
     */
    NotificationResult send(String contactName, String subject, String body);

    /** Name for logs. */
    String name();
}
