package com.firmo.core.engine;

/**
 * Terminal status of one case.
 */
public enum OutcomeStatus {
    PASS,
    /** An assertion did not hold. */
    FAIL,
    /** The body (or a hook) raised something other than an assertion failure. */
    ERROR_RAISED,
    /** Not run: excluded, not focused, filtered out, or skipped from inside the body. */
    SKIPPED,
    /** Declared pending, or marked pending from inside the body. */
    PENDING;

    public boolean isFailure() {
        return this == FAIL || this == ERROR_RAISED;
    }
}
