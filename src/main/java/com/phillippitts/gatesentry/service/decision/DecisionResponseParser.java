package com.phillippitts.gatesentry.service.decision;

import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.service.llm.ModelOutputs;
import com.phillippitts.gatesentry.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.Optional;

/**
 * Parses the classifier's decision answer.
 *
 * <p>Accepts the first {@code {...}} block in the text. The result is empty when the JSON is malformed,
 * the decision id is unknown, or the confidence is missing or outside [0, 1]. Callers treat empty as
 * a fail-closed denial.
 *
 * <p>Thread-safe: all methods are static and stateless.
 */
final class DecisionResponseParser {

    private static final Logger LOG = LogManager.getLogger(DecisionResponseParser.class);

    private DecisionResponseParser() {
    }

    record ParsedDecision(Decision decision, double confidence, String reasoning) {
    }

    static Optional<ParsedDecision> parse(String raw) {
        Optional<String> json = ModelOutputs.firstJsonObject(raw);
        if (json.isEmpty()) {
            LOG.warn("Decision answer has no JSON object: '{}'", LogSanitizer.preview(raw));
            return Optional.empty();
        }
        try {
            JSONObject obj = new JSONObject(json.get());
            Optional<Decision> decision = Decision.fromId(obj.optString("decision", null));
            if (decision.isEmpty()) {
                LOG.warn("Decision answer has unknown decision: '{}'", obj.opt("decision"));
                return Optional.empty();
            }
            double confidence = obj.optDouble("confidence", Double.NaN);
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                LOG.warn("Decision answer has invalid confidence: {}", obj.opt("confidence"));
                return Optional.empty();
            }
            return Optional.of(new ParsedDecision(decision.get(), confidence, obj.optString("reasoning", "")));
        } catch (JSONException e) {
            LOG.warn("Decision answer is not valid JSON: '{}'", LogSanitizer.preview(raw));
            return Optional.empty();
        }
    }
}
