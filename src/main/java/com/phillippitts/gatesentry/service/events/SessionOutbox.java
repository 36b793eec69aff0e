package com.phillippitts.gatesentry.service.events;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.service.queue.BoundedDropOldestQueue;
import com.phillippitts.gatesentry.service.session.SessionEndedEvent;
import com.phillippitts.gatesentry.service.session.SessionStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session mailbox of dispatched gate events, polled by clients.
 *
 * <p>Keeps the most recent entries per session; older ones are dropped. A mailbox exists from session
 * start to session end; events for any other id are discarded.
 */
@Component
public class SessionOutbox {

    private static final Logger LOG = LogManager.getLogger(SessionOutbox.class);

    private final int capacity;
    private final Map<String, BoundedDropOldestQueue<GateEvent>> boxes = new ConcurrentHashMap<>();

    public SessionOutbox(BridgeProperties props) {
        this.capacity = props.getOutboxCapacity();
    }

    @EventListener
    public void onSessionStarted(SessionStartedEvent started) {
        String id = started.sessionId();
        boxes.putIfAbsent(id, new BoundedDropOldestQueue<>("outbox-" + id, capacity));
    }

    @EventListener
    public void onGateNotification(GateNotificationEvent notification) {
        GateEvent event = notification.event();
        BoundedDropOldestQueue<GateEvent> box = boxes.computeIfPresent(event.sessionId(), (id, existing) -> {
            existing.offer(event).ifPresent(dropped ->
                    LOG.debug("Outbox full for session {}; dropped {}", id, dropped.type()));
            return existing;
        });
        if (box == null) {
            LOG.debug("No mailbox for session {}; {} discarded", event.sessionId(), event.type());
        }
    }

    @EventListener
    public void onSessionEnded(SessionEndedEvent ended) {
        boxes.remove(ended.sessionId());
    }

    /** Removes and returns every pending event for the session, oldest first. */
    public List<GateEvent> drain(String sessionId) {
        BoundedDropOldestQueue<GateEvent> box = boxes.get(sessionId);
        return box == null ? List.of() : box.drainAll();
    }
}
