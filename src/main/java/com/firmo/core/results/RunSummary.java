package com.firmo.core.results;

import com.firmo.core.engine.Outcome;
import com.firmo.core.engine.OutcomeStatus;

import java.time.Instant;
import java.util.List;

/**
 * Frozen snapshot of a run, handed to reporters. Nothing in it can be mutated.
 *
 * @param runId           identifier of the run
 * @param startedAt       when the run started
 * @param totalDurationMs wall-clock duration of the run
 * @param total           number of cases, including skipped and pending ones
 * @param passed          cases with status PASS
 * @param failed          cases with status FAIL
 * @param errors          cases with status ERROR_RAISED
 * @param skipped         cases with status SKIPPED
 * @param pending         cases with status PENDING
 * @param outcomes        every outcome in execution order
 * @param failures        FAIL and ERROR_RAISED outcomes in execution order
 */
public record RunSummary(
    String runId,
    Instant startedAt,
    long totalDurationMs,
    int total,
    int passed,
    int failed,
    int errors,
    int skipped,
    int pending,
    List<Outcome> outcomes,
    List<Outcome> failures
) {

    public RunSummary {
        outcomes = List.copyOf(outcomes);
        failures = List.copyOf(failures);
    }

    /** True when nothing failed or errored. */
    public boolean successful() {
        return failed == 0 && errors == 0;
    }

    public int count(OutcomeStatus status) {
        return switch (status) {
            case PASS -> passed;
            case FAIL -> failed;
            case ERROR_RAISED -> errors;
            case SKIPPED -> skipped;
            case PENDING -> pending;
        };
    }
}
