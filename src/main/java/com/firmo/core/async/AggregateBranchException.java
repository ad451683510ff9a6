package com.firmo.core.async;

import java.util.List;

/**
 * Raised by {@code parallel} when at least one branch was rejected. Lists every failed or
 * timed-out branch with its index and original message; the other branches are still
 * available through {@link #getBranches()}.
 */
public class AggregateBranchException extends RuntimeException {

    /**
     * @param index   branch position in the submitted list
     * @param state   {@link BranchState#REJECTED} or {@link BranchState#TIMED_OUT}
     * @param message the branch error's message
     */
    public record BranchFailure(int index, BranchState state, String message) {}

    private final List<BranchFailure> failures;
    private final List<PendingAsyncTask<?>> branches;

    public AggregateBranchException(List<BranchFailure> failures, List<? extends PendingAsyncTask<?>> branches) {
        super(render(failures));
        this.failures = List.copyOf(failures);
        this.branches = List.copyOf(branches);
        for (PendingAsyncTask<?> branch : branches) {
            if (branch.error() != null) addSuppressed(branch.error());
        }
    }

    public List<BranchFailure> getFailures() {
        return failures;
    }

    /** Every branch of the group, in submission order, including the successful ones. */
    public List<PendingAsyncTask<?>> getBranches() {
        return branches;
    }

    private static String render(List<BranchFailure> failures) {
        var sb = new StringBuilder("One or more parallel operations failed:");
        for (BranchFailure f : failures) {
            sb.append("\n  Branch #").append(f.index())
              .append(f.state() == BranchState.TIMED_OUT ? " timed out: " : " failed: ")
              .append(f.message());
        }
        return sb.toString();
    }
}
