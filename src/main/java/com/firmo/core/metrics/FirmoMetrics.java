package com.firmo.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for test runs.
 */
@Service
public class FirmoMetrics {

    private final MeterRegistry registry;

    public FirmoMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param status outcome status name, e.g. "PASS" or "ERROR_RAISED"
     */
    public void recordCaseResult(String status) {
        Counter.builder("firmo.cases.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCaseDuration(long ms) {
        Timer.builder("firmo.case.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRunDuration(long ms) {
        Timer.builder("firmo.run.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records the terminal state of one parallel branch.
     *
     * @param state "resolved", "rejected" or "timed_out"
     */
    public void recordBranch(String state) {
        Counter.builder("firmo.parallel.branches")
                .description("Parallel branches by terminal state")
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void recordParallelWidth(int branches) {
        DistributionSummary.builder("firmo.parallel.width")
                .description("Number of branches per parallel group")
                .register(registry)
                .record(branches);
    }
}
