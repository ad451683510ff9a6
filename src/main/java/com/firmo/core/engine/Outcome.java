package com.firmo.core.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Immutable result of one case.
 *
 * @param caseName      the case's own name
 * @param suitePath     enclosing suite names, outermost first
 * @param status        terminal status
 * @param durationMs    time spent in the body, hooks excluded; 0 when the body never ran
 * @param failureDetail set for {@link OutcomeStatus#FAIL} and {@link OutcomeStatus#ERROR_RAISED}
 * @param reason        skip or pending reason, may be null
 * @param tags          effective tags of the case
 * @param timestamp     when the case finished
 */
public record Outcome(
    String caseName,
    List<String> suitePath,
    OutcomeStatus status,
    long durationMs,
    FailureDetail failureDetail,
    String reason,
    Set<String> tags,
    Instant timestamp
) {

    public Outcome {
        suitePath = List.copyOf(suitePath);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    /** {@code "A / B / case"}. */
    @JsonProperty("path_string")
    public String pathString() {
        var parts = new ArrayList<>(suitePath);
        parts.add(caseName);
        return String.join(" / ", parts);
    }

    /** Suite path joined with dots, the way JUnit-style reports name a test's class. */
    @JsonProperty("classname")
    public String classname() {
        return suitePath.isEmpty() ? "firmo" : String.join(".", suitePath);
    }
}
