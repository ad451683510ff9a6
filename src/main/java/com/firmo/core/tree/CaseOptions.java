package com.firmo.core.tree;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-case configuration.
 *
 * @param expectError   errors raised by the code under test are captured instead of failing the case;
 *                      a case that captures nothing fails
 * @param timeoutMs     bound on the body's run time, 0 for the configured default
 * @param tags          tags for run filtering, in addition to those inherited from suites
 * @param pendingReason non-null marks the case pending; the body is never run
 */
public record CaseOptions(
    boolean expectError,
    long timeoutMs,
    Set<String> tags,
    String pendingReason
) {

    private static final CaseOptions DEFAULTS = new CaseOptions(false, 0, Set.of(), null);

    public CaseOptions {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must not be negative, got " + timeoutMs);
        }
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static CaseOptions defaults() {
        return DEFAULTS;
    }

    public boolean isPending() {
        return pendingReason != null;
    }

    public CaseOptions expectingError() {
        return new CaseOptions(true, timeoutMs, tags, pendingReason);
    }

    public CaseOptions timeout(long ms) {
        return new CaseOptions(expectError, ms, tags, pendingReason);
    }

    public CaseOptions tags(String... more) {
        var all = new LinkedHashSet<>(tags);
        all.addAll(List.of(more));
        return new CaseOptions(expectError, timeoutMs, all, pendingReason);
    }

    public CaseOptions pending(String reason) {
        return new CaseOptions(expectError, timeoutMs, tags, reason == null ? "" : reason);
    }
}
