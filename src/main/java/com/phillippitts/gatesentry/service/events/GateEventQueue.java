package com.phillippitts.gatesentry.service.events;

import com.phillippitts.gatesentry.config.properties.BridgeProperties;
import com.phillippitts.gatesentry.service.queue.BoundedDropOldestQueue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bounded queue of gate events waiting for the event loop. Producers never block; on overflow the
 * oldest event is dropped and logged.
 */
@Component
public class GateEventQueue {

    private static final Logger LOG = LogManager.getLogger(GateEventQueue.class);

    private final BoundedDropOldestQueue<GateEvent> queue;

    public GateEventQueue(BridgeProperties props) {
        this.queue = new BoundedDropOldestQueue<>("gate-events", props.getEventQueueCapacity());
    }

    public void offer(GateEvent event) {
        queue.offer(event).ifPresent(dropped ->
                LOG.warn("Gate event queue full; dropped {} for session {}", dropped.type(), dropped.sessionId()));
    }

    public List<GateEvent> pollBatch(int max) {
        return queue.pollBatch(max);
    }

    public int size() {
        return queue.size();
    }

    public long droppedCount() {
        return queue.droppedCount();
    }
}
