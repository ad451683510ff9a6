package com.firmo.core.results;

import com.firmo.core.engine.Outcome;
import com.firmo.core.engine.OutcomeStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates outcomes of one run. The executor appends; consumers only ever see
 * {@link RunSummary} snapshots.
 */
public class ResultAggregator {

    private final String runId;
    private final Instant startedAt;
    private final long startedNanos;
    private final List<Outcome> outcomes = new ArrayList<>();
    private final Map<OutcomeStatus, Integer> counts = new EnumMap<>(OutcomeStatus.class);

    public ResultAggregator(String runId) {
        this.runId = runId;
        this.startedAt = Instant.now();
        this.startedNanos = System.nanoTime();
    }

    public synchronized void record(Outcome outcome) {
        outcomes.add(outcome);
        counts.merge(outcome.status(), 1, Integer::sum);
    }

    public synchronized int count(OutcomeStatus status) {
        return counts.getOrDefault(status, 0);
    }

    public synchronized RunSummary snapshot() {
        long elapsed = (System.nanoTime() - startedNanos) / 1_000_000;
        var failures = outcomes.stream().filter(o -> o.status().isFailure()).toList();
        return new RunSummary(runId, startedAt, elapsed, outcomes.size(),
                count(OutcomeStatus.PASS), count(OutcomeStatus.FAIL), count(OutcomeStatus.ERROR_RAISED),
                count(OutcomeStatus.SKIPPED), count(OutcomeStatus.PENDING),
                outcomes, failures);
    }
}
