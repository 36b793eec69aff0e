package com.phillippitts.gatesentry.service.conversation;

import com.phillippitts.gatesentry.domain.Decision;
import com.phillippitts.gatesentry.domain.FieldValue;
import com.phillippitts.gatesentry.domain.ProfileField;
import com.phillippitts.gatesentry.domain.SessionState;
import com.phillippitts.gatesentry.domain.VisionSchema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of a session's profile and decision state.
 *
 * @param fields field key → value, {@code null} for unset, {@code "unknown"} when attempted
 */
public record ProfileSnapshot(
        String sessionId,
        Map<String, String> fields,
        boolean idVerified,
        boolean authenticated,
        Decision decision,
        double decisionConfidence,
        String decisionReasoning,
        VisionSchema visionSchema,
        boolean sessionActive,
        String cameraId,
        int messageCount
) {

    static final String UNKNOWN = "unknown";

    static ProfileSnapshot of(SessionState state) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (ProfileField f : ProfileField.values()) {
            FieldValue v = state.getProfile().get(f);
            fields.put(f.key(), switch (v.state()) {
                case UNSET -> null;
                case UNKNOWN -> UNKNOWN;
                case VALUE -> v.orElse(null);
            });
        }
        return new ProfileSnapshot(
                state.getSessionId(),
                Collections.unmodifiableMap(fields),
                state.getProfile().isIdVerified(),
                state.getProfile().isAuthenticated(),
                state.getDecision(),
                state.getDecisionConfidence(),
                state.getDecisionReasoning(),
                state.getVisionSchema(),
                state.isSessionActive(),
                state.getCameraId(),
                state.getMessages().size());
    }
}
