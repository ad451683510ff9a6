package com.firmo.core.config;

/**
 * Resolved, immutable settings consumed by the framework core.
 * <p>
 * The core never reads configuration sources itself; the host (Spring via
 * {@link FirmoProperties}, or a test) builds one of these and passes it in.
 *
 * @param defaultTimeoutMs default bound for {@code waitUntil} and {@code parallel}
 * @param pollIntervalMs   default cadence at which {@code waitUntil} re-evaluates its predicate
 * @param tolerance        default absolute tolerance for numeric proximity matchers
 * @param caseTimeoutMs    default per-case timeout, 0 meaning unbounded
 */
public record FirmoSettings(
    long defaultTimeoutMs,
    long pollIntervalMs,
    double tolerance,
    long caseTimeoutMs
) {

    public static final long DEFAULT_TIMEOUT_MS = 1000;
    public static final long DEFAULT_POLL_INTERVAL_MS = 10;
    public static final double DEFAULT_TOLERANCE = 1e-9;

    public FirmoSettings {
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must be positive, got " + defaultTimeoutMs);
        }
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be positive, got " + pollIntervalMs);
        }
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("tolerance must be a non-negative number, got " + tolerance);
        }
        if (caseTimeoutMs < 0) {
            throw new IllegalArgumentException("caseTimeoutMs must not be negative, got " + caseTimeoutMs);
        }
    }

    /** Fallback values used when no configuration collaborator is present. */
    public static FirmoSettings defaults() {
        return new FirmoSettings(DEFAULT_TIMEOUT_MS, DEFAULT_POLL_INTERVAL_MS, DEFAULT_TOLERANCE, 0);
    }

    public FirmoSettings withDefaultTimeoutMs(long ms) {
        return new FirmoSettings(ms, pollIntervalMs, tolerance, caseTimeoutMs);
    }

    public FirmoSettings withPollIntervalMs(long ms) {
        return new FirmoSettings(defaultTimeoutMs, ms, tolerance, caseTimeoutMs);
    }

    public FirmoSettings withTolerance(double value) {
        return new FirmoSettings(defaultTimeoutMs, pollIntervalMs, value, caseTimeoutMs);
    }

    public FirmoSettings withCaseTimeoutMs(long ms) {
        return new FirmoSettings(defaultTimeoutMs, pollIntervalMs, tolerance, ms);
    }
}
