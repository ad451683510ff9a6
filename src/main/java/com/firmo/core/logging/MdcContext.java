package com.firmo.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Firmo-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String SUITE_PATH = "suitePath";
    public static final String CASE_NAME = "caseName";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setCase(String runId, String suitePath, String caseName) {
        MDC.put(RUN_ID, runId);
        MDC.put(SUITE_PATH, suitePath);
        MDC.put(CASE_NAME, caseName);
    }

    /** Removes the case keys but keeps the run id. */
    public static void clearCase() {
        MDC.remove(SUITE_PATH);
        MDC.remove(CASE_NAME);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(SUITE_PATH);
        MDC.remove(CASE_NAME);
    }

    /** Copy of the current thread's MDC, for handing to a worker thread. */
    public static Map<String, String> snapshot() {
        Map<String, String> copy = MDC.getCopyOfContextMap();
        return copy == null ? Map.of() : copy;
    }

    /** Installs a snapshot taken on another thread. */
    public static void restore(Map<String, String> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) {
            MDC.clear();
        } else {
            MDC.setContextMap(snapshot);
        }
    }
}
