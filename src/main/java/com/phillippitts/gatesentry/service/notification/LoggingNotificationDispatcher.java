package com.phillippitts.gatesentry.service.notification;

import com.phillippitts.gatesentry.service.directory.ContactDirectory;
import com.phillippitts.gatesentry.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Log-only notification: resolves the contact's address and records the message instead of mailing it. */
@Component
class LoggingNotificationDispatcher implements NotificationDispatcher {
    private static final Logger LOG = LogManager.getLogger(LoggingNotificationDispatcher.class);

    private final ContactDirectory contacts;

    LoggingNotificationDispatcher(ContactDirectory contacts) {
        this.contacts = contacts;
    }

    @Override
    public NotificationResult send(String contactName, String subject, String body) {
        Optional<String> address = contacts.emailFor(contactName);
        if (address.isEmpty()) {
            LOG.warn("Notification skipped: contact not in directory");
            return NotificationResult.failed("Contact '" + contactName + "' not found. Available contacts: "
                    + String.join(", ", contacts.names()));
        }
        LOG.info("Notification to {} <{}>: subject='{}' (chars={})",
                contactName, address.get(), subject, body == null ? 0 : body.length());
        LOG.debug("Body preview: '{}'", LogSanitizer.truncate(body, 120));
        return NotificationResult.sent("Notification sent to " + contactName + " (" + address.get() + ")");
    }

    @Override
    public String name() {
        return "log";
    }
}
