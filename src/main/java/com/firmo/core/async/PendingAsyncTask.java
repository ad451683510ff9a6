package com.firmo.core.async;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One branch of a parallel group. Starts {@link BranchState#RUNNING} and moves to a terminal
 * state exactly once; later attempts to settle it are ignored.
 *
 * @param <T> branch result type
 */
public final class PendingAsyncTask<T> {

    private final int index;
    private final long startedNanos = System.nanoTime();
    private final AtomicReference<BranchState> state = new AtomicReference<>(BranchState.RUNNING);
    private volatile T result;
    private volatile Throwable error;
    private volatile long durationMs = -1;

    public PendingAsyncTask(int index) {
        this.index = index;
    }

    /** @return true if this call settled the branch */
    public boolean resolve(T value) {
        if (!state.compareAndSet(BranchState.RUNNING, BranchState.RESOLVED)) return false;
        result = value;
        stamp();
        return true;
    }

    public boolean reject(Throwable cause) {
        if (!state.compareAndSet(BranchState.RUNNING, BranchState.REJECTED)) return false;
        error = cause;
        stamp();
        return true;
    }

    public boolean timeOut(long timeoutMs) {
        if (!state.compareAndSet(BranchState.RUNNING, BranchState.TIMED_OUT)) return false;
        error = new AsyncTimeoutException("Branch #" + index + " timed out after " + timeoutMs + "ms", timeoutMs);
        stamp();
        return true;
    }

    /** Position of the branch in the submitted task list. */
    public int index() {
        return index;
    }

    public BranchState state() {
        return state.get();
    }

    /** Result of a resolved branch, otherwise null. */
    public T result() {
        return result;
    }

    /** Cause of a rejected or timed-out branch, otherwise null. */
    public Throwable error() {
        return error;
    }

    /** Time from dispatch to settlement, or -1 while running. */
    public long durationMs() {
        return durationMs;
    }

    private void stamp() {
        durationMs = (System.nanoTime() - startedNanos) / 1_000_000;
    }

    @Override
    public String toString() {
        return "Branch#" + index + "[" + state.get() + "]";
    }
}
