package com.phillippitts.gatesentry.domain;

import java.util.Objects;

/**
 * Normalized verdict for one analysed camera frame.
 *
 * @param faceDetected    a face is visible
 * @param angryFace       the visible face looks hostile
 * @param dangerousObject a weapon or other dangerous object is visible
 * @param threatLevel     overall threat level
 * @param details         free-text description from the classifier
 */
public record VisionSchema(
        boolean faceDetected,
        boolean angryFace,
        boolean dangerousObject,
        ThreatLevel threatLevel,
        String details
) {

    public VisionSchema {
        Objects.requireNonNull(threatLevel, "threatLevel");
        details = details == null ? "" : details;
    }

    /** Safe default used when classification fails: no face, low threat. */
    public static VisionSchema none() {
        return new VisionSchema(false, false, false, ThreatLevel.LOW, "");
    }

    public boolean isHighThreat() {
        return threatLevel == ThreatLevel.HIGH;
    }

    /** High threat with a dangerous object: the condition that raises an escalation. */
    public boolean requiresEscalation() {
        return threatLevel == ThreatLevel.HIGH && dangerousObject;
    }
}
