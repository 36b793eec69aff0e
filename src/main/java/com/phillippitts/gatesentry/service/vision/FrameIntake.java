package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.config.properties.VisionProperties;
import com.phillippitts.gatesentry.exception.InvalidFrameException;
import com.phillippitts.gatesentry.exception.SessionNotFoundException;
import com.phillippitts.gatesentry.service.metrics.GateMetrics;
import com.phillippitts.gatesentry.service.queue.BoundedDropOldestQueue;
import com.phillippitts.gatesentry.service.session.SessionStateStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Producer side of the vision pipeline: validates frames and puts them on the bounded frame queue.
 *
 * <p>Any number of producers may submit concurrently; the queue drops the oldest frame on overflow.
 */
@Component
public class FrameIntake {

    private static final Logger LOG = LogManager.getLogger(FrameIntake.class);

    private static final String DATA_URL_MARKER = ";base64,";

    private final BoundedDropOldestQueue<CapturedFrame> queue;
    private final SessionStateStore store;
    private final GateMetrics metrics;

    public FrameIntake(VisionProperties props, SessionStateStore store, GateMetrics metrics) {
        this.queue = new BoundedDropOldestQueue<>("frames", props.getFrameQueueCapacity());
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Accepts a base64 image, optionally in data-URL form ({@code data:image/png;base64,...}).
     *
     * @return frame id
     * @throws SessionNotFoundException if the session does not exist
     * @throws InvalidFrameException    if the payload is missing or not valid base64
     */
    public String submitBase64(String sessionId, String payload, String mimeType) {
        if (!store.exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        if (payload == null || payload.isBlank()) {
            throw new InvalidFrameException("image payload is empty");
        }
        String data = payload.trim();
        String type = mimeType;
        int marker = data.indexOf(DATA_URL_MARKER);
        if (data.startsWith("data:") && marker > 0) {
            type = data.substring("data:".length(), marker);
            data = data.substring(marker + DATA_URL_MARKER.length());
        }
        byte[] image;
        try {
            image = Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new InvalidFrameException("image payload is not valid base64", e);
        }
        if (image.length == 0) {
            throw new InvalidFrameException("image payload decodes to zero bytes");
        }
        return submit(sessionId, image, normalizeMime(type));
    }

    /** Queues raw image bytes for a session. Returns the frame id. */
    public String submit(String sessionId, byte[] image, String mimeType) {
        CapturedFrame frame = new CapturedFrame(UUID.randomUUID().toString(), sessionId, image, mimeType,
                Instant.now());
        queue.offer(frame).ifPresent(dropped -> {
            metrics.incrementFramesDropped("overflow", 1);
            LOG.warn("Frame queue full; dropped frame {} of session {}", dropped.frameId(), dropped.sessionId());
        });
        return frame.frameId();
    }

    /** Takes every pending frame, oldest first. Called only by the vision consumer. */
    List<CapturedFrame> drainAll() {
        return queue.drainAll();
    }

    public int pending() {
        return queue.size();
    }

    public long droppedCount() {
        return queue.droppedCount();
    }

    static String normalizeMime(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return "image/jpeg";
        }
        return mimeType.trim().toLowerCase(Locale.ROOT);
    }
}
