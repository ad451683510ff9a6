package com.firmo.core.plan;

/**
 * Whether one node runs and, if not, why.
 *
 * @param willRun    true when the node is eligible to execute
 * @param skipReason human-readable reason when {@code willRun} is false, otherwise null
 */
public record PlanDecision(boolean willRun, String skipReason) {

    static final PlanDecision RUN = new PlanDecision(true, null);

    static PlanDecision skip(String reason) {
        return new PlanDecision(false, reason);
    }
}
