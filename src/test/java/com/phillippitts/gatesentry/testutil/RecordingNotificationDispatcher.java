package com.phillippitts.gatesentry.testutil;

import com.phillippitts.gatesentry.service.notification.NotificationDispatcher;
import com.phillippitts.gatesentry.service.notification.NotificationResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every notification; can be switched to report failure.
 */
public class RecordingNotificationDispatcher implements NotificationDispatcher {

    public record Sent(String contact, String subject, String body) {
    }

    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public RecordingNotificationDispatcher failing(boolean failing) {
        this.failing = failing;
        return this;
    }

    @Override
    public NotificationResult send(String contactName, String subject, String body) {
        if (failing) {
            return NotificationResult.failed("mail server unreachable");
        }
        sent.add(new Sent(contactName, subject, body));
        return NotificationResult.sent("sent to " + contactName);
    }

    @Override
    public String name() {
        return "recording";
    }

    public List<Sent> sent() {
        return List.copyOf(sent);
    }
}
