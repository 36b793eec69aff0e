package com.phillippitts.gatesentry.service.session;

/** Result of handing a finished turn back to the store. */
public enum CommitOutcome {
    /** Stored as-is; nothing changed concurrently. */
    COMMITTED,
    /** Stored after taking newer vision fields written by the bridge during the turn. */
    MERGED,
    /** Dropped: the session was reset by the bridge or removed while the turn ran. */
    DISCARDED
}
