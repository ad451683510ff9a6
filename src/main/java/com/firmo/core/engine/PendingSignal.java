package com.firmo.core.engine;

/**
 * Unwinds a case body after {@link CaseContext#pending(String)} or {@link CaseContext#skip(String)}.
 * Not an error; carries no stack trace.
 */
public final class PendingSignal extends RuntimeException {

    private final OutcomeStatus status;
    private final String reason;

    PendingSignal(OutcomeStatus status, String reason) {
        super(status + (reason == null || reason.isEmpty() ? "" : ": " + reason), null, false, false);
        this.status = status;
        this.reason = reason;
    }

    /** {@link OutcomeStatus#PENDING} or {@link OutcomeStatus#SKIPPED}. */
    public OutcomeStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
