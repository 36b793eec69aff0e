package com.phillippitts.gatesentry.service.log;

import com.phillippitts.gatesentry.config.properties.VisionLogProperties;
import com.phillippitts.gatesentry.domain.ThreatLevel;
import com.phillippitts.gatesentry.domain.VisionSchema;
import com.phillippitts.gatesentry.service.session.SessionEndedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Bounded per-session log of vision verdicts, one JSON array file per session.
 *
 * <p>File: {@code <gate.vision-log.directory>/<sessionId>.json}. Only the newest
 * {@code gate.vision-log.max-entries} entries are kept. Writes go to a temp file first and are moved
 * into place.
 *
 * <p>I/O failures are logged and never propagate into the vision pipeline.
 */
@Component
public class VisionLogStore {

    private static final Logger LOG = LogManager.getLogger(VisionLogStore.class);

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path directory;
    private final int maxEntries;
    private final Lock lock = new ReentrantLock();

    public VisionLogStore(VisionLogProperties props) {
        this.directory = Paths.get(props.getDirectory());
        this.maxEntries = props.getMaxEntries();
    }

    public void append(String sessionId, VisionSchema schema, Instant at) {
        Path file = fileFor(sessionId);
        if (file == null) {
            return;
        }
        lock.lock();
        try {
            JSONArray entries = read(file);
            entries.put(toJson(sessionId, schema, at));
            JSONArray bounded = new JSONArray();
            for (int i = Math.max(0, entries.length() - maxEntries); i < entries.length(); i++) {
                bounded.put(entries.get(i));
            }
            write(file, bounded);
        } catch (IOException e) {
            LOG.warn("Could not append vision log for session {}: {}", sessionId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    /** Entries for the session, oldest first; empty if none were recorded. */
    public List<VisionLogEntry> entries(String sessionId) {
        Path file = fileFor(sessionId);
        if (file == null) {
            return List.of();
        }
        lock.lock();
        try {
            JSONArray arr = read(file);
            List<VisionLogEntry> out = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                out.add(fromJson(arr.getJSONObject(i)));
            }
            return out;
        } catch (IOException | JSONException | DateTimeParseException e) {
            LOG.warn("Could not read vision log for session {}: {}", sessionId, e.getMessage());
            return List.of();
        } finally {
            lock.unlock();
        }
    }

    public void clear(String sessionId) {
        Path file = fileFor(sessionId);
        if (file == null) {
            return;
        }
        lock.lock();
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not clear vision log for session {}: {}", sessionId, e.getMessage());
        } finally {
            lock.unlock();
        }
    }

    @EventListener
    public void onSessionEnded(SessionEndedEvent ended) {
        clear(ended.sessionId());
    }

    private Path fileFor(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            LOG.warn("Refusing vision log path for unsafe session id");
            return null;
        }
        return directory.resolve(sessionId + ".json");
    }

    private static JSONArray read(Path file) throws IOException {
        if (!Files.exists(file)) {
            return new JSONArray();
        }
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (content.isBlank()) {
            return new JSONArray();
        }
        try {
            return new JSONArray(content);
        } catch (JSONException e) {
            LOG.warn("Vision log {} is malformed; starting over", file.getFileName());
            return new JSONArray();
        }
    }

    private static void write(Path file, JSONArray entries) throws IOException {
        Files.createDirectories(file.getParent());
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, entries.toString(2), StandardCharsets.UTF_8);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
    }

    static JSONObject toJson(String sessionId, VisionSchema schema, Instant at) {
        return new JSONObject()
                .put("session_id", sessionId)
                .put("timestamp", at.toString())
                .put("face_detected", schema.faceDetected())
                .put("angry_face", schema.angryFace())
                .put("dangerous_object", schema.dangerousObject())
                .put("threat_level", schema.threatLevel().name().toLowerCase(Locale.ROOT))
                .put("details", schema.details());
    }

    static VisionLogEntry fromJson(JSONObject obj) {
        VisionSchema schema = new VisionSchema(
                obj.optBoolean("face_detected"),
                obj.optBoolean("angry_face"),
                obj.optBoolean("dangerous_object"),
                ThreatLevel.parse(obj.optString("threat_level", null)),
                obj.optString("details", ""));
        return new VisionLogEntry(obj.optString("session_id", ""), Instant.parse(obj.getString("timestamp")), schema);
    }
}
