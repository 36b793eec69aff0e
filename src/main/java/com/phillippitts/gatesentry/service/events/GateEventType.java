package com.phillippitts.gatesentry.service.events;

/** Kinds of events surfaced to gate clients. */
public enum GateEventType {
    /** Nobody has been in front of the camera for a full detection window. */
    NO_FACE,
    /** High threat with a dangerous object seen by the camera. */
    THREAT_ESCALATION,
    /** Agent line produced outside a visitor turn (greeting, farewell, escalation turn reply). */
    AGENT_MESSAGE
}
