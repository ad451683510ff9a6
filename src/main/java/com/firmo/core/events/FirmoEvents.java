package com.firmo.core.events;

/**
 * Event type names published on the {@link EventBus}.
 */
public final class FirmoEvents {

    public static final String RUN_STARTED = "run.started";
    public static final String SUITE_STARTED = "suite.started";
    public static final String CASE_STARTED = "case.started";
    public static final String CASE_FINISHED = "case.finished";
    public static final String RUN_FINISHED = "run.finished";

    private FirmoEvents() {}
}
