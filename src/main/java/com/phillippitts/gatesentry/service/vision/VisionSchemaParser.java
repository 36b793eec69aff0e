package com.phillippitts.gatesentry.service.vision;

import com.phillippitts.gatesentry.domain.ThreatLevel;
import com.phillippitts.gatesentry.domain.VisionSchema;
import com.phillippitts.gatesentry.service.llm.ModelOutputs;
import com.phillippitts.gatesentry.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Normalizes a classifier answer into a {@link VisionSchema}.
 *
 * <p>Missing or mistyped flags become {@code false}, an unknown threat level becomes LOW and missing
 * details become "". Only an answer with no parseable JSON object yields empty.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class VisionSchemaParser {

    private static final Logger LOG = LogManager.getLogger(VisionSchemaParser.class);

    private VisionSchemaParser() {
    }

    static Optional<VisionSchema> parse(String raw) {
        Optional<String> json = ModelOutputs.firstJsonObject(raw);
        if (json.isEmpty()) {
            LOG.warn("Vision answer has no JSON object: '{}'", LogSanitizer.preview(raw));
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json.get());
            return Optional.of(new VisionSchema(
                    flag(obj, "face_detected"),
                    flag(obj, "angry_face"),
                    flag(obj, "dangerous_object"),
                    ThreatLevel.parse(obj.optString("threat_level", null)),
                    obj.optString("details", "")));
        } catch (JSONException e) {
            LOG.warn("Vision answer is not valid JSON: '{}'", LogSanitizer.preview(raw));
            return Optional.empty();
        }
    }

    /** Accepts JSON booleans and the strings "true"/"false"; anything else is false. */
    private static boolean flag(JSONObject obj, String key) {
        Object value = obj.opt(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value instanceof String s && Boolean.parseBoolean(s.trim());
    }
}
