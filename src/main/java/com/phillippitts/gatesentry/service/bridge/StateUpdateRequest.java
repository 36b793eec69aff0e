package com.phillippitts.gatesentry.service.bridge;

import com.phillippitts.gatesentry.domain.VisionSchema;

import java.util.Objects;

/**
 * Vision-originated mutation of one session, applied by the {@link StateBridge}.
 *
 * <p>Null fields are left untouched.
 *
 * @param action        always {@link Action#UPDATE}
 * @param sessionId     target session
 * @param visionSchema  latest frame verdict
 * @param sessionActive whether someone is in front of the camera
 * @param authenticated authentication flag set by an external identity check
 * @param attempts      failed application attempts so far
 */
public record StateUpdateRequest(
        Action action,
        String sessionId,
        VisionSchema visionSchema,
        Boolean sessionActive,
        Boolean authenticated,
        int attempts
) {

    public enum Action { UPDATE }

    public StateUpdateRequest {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(sessionId, "sessionId");
    }

    public static StateUpdateRequest vision(String sessionId, VisionSchema schema, Boolean sessionActive) {
        return new StateUpdateRequest(Action.UPDATE, sessionId, schema, sessionActive, null, 0);
    }

    public static StateUpdateRequest authenticated(String sessionId, boolean authenticated) {
        return new StateUpdateRequest(Action.UPDATE, sessionId, null, null, authenticated, 0);
    }

    StateUpdateRequest retried() {
        return new StateUpdateRequest(action, sessionId, visionSchema, sessionActive, authenticated, attempts + 1);
    }
}
