package com.phillippitts.gatesentry.service.bridge;

/** Change of {@code session_active} caused by one applied update. */
enum ActivationEdge {
    NONE,
    ACTIVATED,
    DEACTIVATED
}
