package com.phillippitts.gatesentry.presentation.dto;

import com.phillippitts.gatesentry.domain.VisionSchema;
import com.phillippitts.gatesentry.service.conversation.ProfileSnapshot;

import java.util.Locale;
import java.util.Map;

/**
 * Profile and decision state of a session.
 *
 * @param profile field key to value; {@code null} when never asked, {@code "unknown"} when not answered
 * @param vision  latest frame verdict, or {@code null} before the first analysed frame
 */
public record ProfileResponse(
        String sessionId,
        Map<String, String> profile,
        boolean idVerified,
        boolean authenticated,
        String decision,
        double decisionConfidence,
        String decisionReasoning,
        VisionView vision,
        boolean sessionActive,
        String cameraId,
        int messageCount
) {

    public static ProfileResponse from(ProfileSnapshot s) {
        return new ProfileResponse(
                s.sessionId(),
                s.fields(),
                s.idVerified(),
                s.authenticated(),
                s.decision().id(),
                s.decisionConfidence(),
                s.decisionReasoning(),
                VisionView.from(s.visionSchema()),
                s.sessionActive(),
                s.cameraId(),
                s.messageCount());
    }

    public record VisionView(boolean faceDetected, boolean angryFace, boolean dangerousObject,
                             String threatLevel, String details) {

        static VisionView from(VisionSchema schema) {
            if (schema == null) {
                return null;
            }
            return new VisionView(schema.faceDetected(), schema.angryFace(), schema.dangerousObject(),
                    schema.threatLevel().name().toLowerCase(Locale.ROOT), schema.details());
        }
    }
}
