package com.firmo.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle event emitted while a test run executes.
 *
 * @param eventType event type from {@link FirmoEvents} (e.g. "case.finished")
 * @param runId     the run this event belongs to
 * @param caseName  "suite / path / case" for case-level events, suite path for suite events, null for run events
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record FirmoEvent(
    String eventType,
    String runId,
    String caseName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
