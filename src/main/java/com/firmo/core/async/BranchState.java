package com.firmo.core.async;

public enum BranchState {
    RUNNING,
    RESOLVED,
    REJECTED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
