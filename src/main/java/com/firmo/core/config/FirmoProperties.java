package com.firmo.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "firmo")
public class FirmoProperties {

    private Async async = new Async();
    private Matchers matchers = new Matchers();
    private Run run = new Run();

    // -- Flattened accessors (delegate to nested) --
    public long getDefaultTimeoutMs() { return async.defaultTimeoutMs; }
    public long getPollIntervalMs() { return async.pollIntervalMs; }
    public double getTolerance() { return matchers.tolerance; }
    public long getCaseTimeoutMs() { return run.caseTimeoutMs; }

    /**
     * Snapshot of the bound values as the immutable settings object the core consumes.
     *
     * @throws IllegalArgumentException if any bound value is out of range
     */
    public FirmoSettings toSettings() {
        return new FirmoSettings(async.defaultTimeoutMs, async.pollIntervalMs,
                matchers.tolerance, run.caseTimeoutMs);
    }

    public Async getAsync() { return async; }
    public void setAsync(Async async) { this.async = async; }
    public Matchers getMatchers() { return matchers; }
    public void setMatchers(Matchers matchers) { this.matchers = matchers; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }

    public static class Async {
        private long defaultTimeoutMs = FirmoSettings.DEFAULT_TIMEOUT_MS;
        private long pollIntervalMs = FirmoSettings.DEFAULT_POLL_INTERVAL_MS;

        public long getDefaultTimeoutMs() { return defaultTimeoutMs; }
        public void setDefaultTimeoutMs(long defaultTimeoutMs) { this.defaultTimeoutMs = defaultTimeoutMs; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    public static class Matchers {
        private double tolerance = FirmoSettings.DEFAULT_TOLERANCE;

        public double getTolerance() { return tolerance; }
        public void setTolerance(double tolerance) { this.tolerance = tolerance; }
    }

    public static class Run {
        private long caseTimeoutMs = 0;

        public long getCaseTimeoutMs() { return caseTimeoutMs; }
        public void setCaseTimeoutMs(long caseTimeoutMs) { this.caseTimeoutMs = caseTimeoutMs; }
    }
}
