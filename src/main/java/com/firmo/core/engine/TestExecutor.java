package com.firmo.core.engine;

import com.firmo.core.async.AsyncCoordinator;
import com.firmo.core.async.AsyncTimeoutException;
import com.firmo.core.async.WorkerThreads;
import com.firmo.core.config.FirmoSettings;
import com.firmo.core.events.EventBus;
import com.firmo.core.events.FirmoEvent;
import com.firmo.core.events.FirmoEvents;
import com.firmo.core.expect.AssertionFailure;
import com.firmo.core.expect.ExpectationUsageException;
import com.firmo.core.logging.MdcContext;
import com.firmo.core.metrics.FirmoMetrics;
import com.firmo.core.plan.PlanDecision;
import com.firmo.core.plan.ResolvedPlan;
import com.firmo.core.results.ResultAggregator;
import com.firmo.core.results.RunSummary;
import com.firmo.core.tree.Hook;
import com.firmo.core.tree.TestNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a resolved plan, case by case, in declaration order, on the calling thread.
 * <p>
 * Per case: setup hooks outermost-first, then the body, then teardown hooks innermost-first.
 * Teardown runs on every exit path. Every throwable is classified into an {@link Outcome};
 * nothing escapes a case. Duration covers the body only.
 */
@Service
public class TestExecutor {

    private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

    private static final ExecutorService CASE_WORKERS = WorkerThreads.newCachedPool("firmo-case");

    private final FirmoSettings settings;
    private final EventBus eventBus;
    private final FirmoMetrics metrics;

    @Autowired
    public TestExecutor(FirmoSettings settings, EventBus eventBus, @Autowired(required = false) FirmoMetrics metrics) {
        this.settings = settings;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public TestExecutor(FirmoSettings settings) {
        this(settings, new EventBus(), null);
    }

    public RunSummary run(ResolvedPlan plan) {
        return run(plan, UUID.randomUUID().toString().substring(0, 8));
    }

    public RunSummary run(ResolvedPlan plan, String runId) {
        var aggregator = new ResultAggregator(runId);
        MdcContext.setRun(runId);
        try {
            log.info("Run {} started: {} case(s), {} runnable", runId,
                    plan.tree().cases().size(), plan.runnableCaseCount());
            publish(FirmoEvents.RUN_STARTED, runId, null,
                    Map.of("cases", plan.tree().cases().size(), "runnable", plan.runnableCaseCount()));

            walk(plan.tree().root(), plan, runId, aggregator);

            RunSummary summary = aggregator.snapshot();
            if (metrics != null) {
                metrics.recordRunDuration(summary.totalDurationMs());
            }
            log.info("Run {} finished in {}ms: {} passed, {} failed, {} errors, {} skipped, {} pending",
                    runId, summary.totalDurationMs(), summary.passed(), summary.failed(),
                    summary.errors(), summary.skipped(), summary.pending());
            publish(FirmoEvents.RUN_FINISHED, runId, null, Map.of(
                    "total", summary.total(), "passed", summary.passed(), "failed", summary.failed(),
                    "errors", summary.errors(), "skipped", summary.skipped(), "pending", summary.pending(),
                    "durationMs", summary.totalDurationMs()));
            return summary;
        } finally {
            MdcContext.clear();
        }
    }

    private void walk(TestNode suite, ResolvedPlan plan, String runId, ResultAggregator aggregator) {
        for (TestNode child : suite.children()) {
            if (child.isCase()) {
                aggregator.record(runCase(child, plan.decision(child), runId));
            } else {
                if (hasRunnableCase(child, plan)) {
                    String path = String.join(" / ", pathOf(child));
                    log.debug("Entering suite {}", path);
                    publish(FirmoEvents.SUITE_STARTED, runId, path, Map.of("suite", child.name()));
                }
                walk(child, plan, runId, aggregator);
            }
        }
    }

    Outcome runCase(TestNode node, PlanDecision decision, String runId) {
        List<String> suitePath = node.suitePath();
        if (!decision.willRun()) {
            return counted(outcome(node, OutcomeStatus.SKIPPED, 0, null, decision.skipReason()));
        }
        if (node.options().isPending()) {
            return counted(outcome(node, OutcomeStatus.PENDING, 0, null, node.options().pendingReason()));
        }

        String pathString = String.join(" / ", pathOf(node));
        MdcContext.setCase(runId, String.join(" / ", suitePath), node.name());
        try {
            publish(FirmoEvents.CASE_STARTED, runId, pathString, Map.of());
            Outcome outcome = execute(node, suitePath);
            logOutcome(pathString, outcome);
            counted(outcome);
            if (metrics != null) {
                metrics.recordCaseDuration(outcome.durationMs());
            }
            publish(FirmoEvents.CASE_FINISHED, runId, pathString,
                    Map.of("status", outcome.status().name(), "durationMs", outcome.durationMs()));
            return outcome;
        } finally {
            MdcContext.clearCase();
        }
    }

    private Outcome execute(TestNode node, List<String> suitePath) {
        List<TestNode> scopes = new ArrayList<>();
        for (TestNode n = node.parent(); n != null; n = n.parent()) {
            scopes.add(0, n);
        }

        var ctx = new CaseContext(node.name(), suitePath, node.options().expectError(), settings,
                new AsyncCoordinator(settings, metrics));

        OutcomeStatus status = null;
        FailureDetail detail = null;
        String reason = null;
        long durationMs = 0;

        // setup, outermost-first
        try {
            for (TestNode scope : scopes) {
                for (Hook hook : scope.beforeHooks()) {
                    hook.run();
                }
            }
        } catch (PendingSignal signal) {
            status = signal.getStatus();
            reason = signal.getReason();
        } catch (Exception | AssertionError e) {
            if (e instanceof InterruptedException) Thread.currentThread().interrupt();
            status = OutcomeStatus.ERROR_RAISED;
            detail = FailureDetail.from("before hook failed: ", e);
        }

        if (status == null) {
            long start = System.nanoTime();
            Throwable raised = runBody(node, ctx);
            durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            if (raised == null) {
                if (ctx.expectsError() && !ctx.hasCapturedError()) {
                    status = OutcomeStatus.FAIL;
                    detail = FailureDetail.of("Expected an error but none was raised");
                } else {
                    status = OutcomeStatus.PASS;
                }
            } else if (raised instanceof PendingSignal signal) {
                status = signal.getStatus();
                reason = signal.getReason();
            } else if (raised instanceof AssertionFailure) {
                status = OutcomeStatus.FAIL;
                detail = FailureDetail.from(raised);
            } else if (raised instanceof ExpectationUsageException || raised instanceof CaseTimeout) {
                status = OutcomeStatus.ERROR_RAISED;
                detail = FailureDetail.from(raised instanceof CaseTimeout t ? t.timeout : raised);
            } else if (ctx.expectsError()) {
                log.debug("Expected error escaped the body: {}", raised.toString());
                status = OutcomeStatus.PASS;
            } else {
                status = OutcomeStatus.ERROR_RAISED;
                detail = FailureDetail.from(raised);
            }
        }

        // teardown, innermost-first, on every path
        for (int i = scopes.size() - 1; i >= 0; i--) {
            for (Hook hook : scopes.get(i).afterHooks()) {
                try {
                    hook.run();
                } catch (Exception | AssertionError e) {
                    if (e instanceof InterruptedException) Thread.currentThread().interrupt();
                    log.warn("after hook failed for {}: {}", node.name(), e.getMessage(), e);
                    if (status == OutcomeStatus.PASS) {
                        status = OutcomeStatus.ERROR_RAISED;
                        detail = FailureDetail.from("after hook failed: ", e);
                    }
                }
            }
        }

        return outcome(node, status, durationMs, detail, reason);
    }

    /**
     * @return what the body raised, or null
     */
    private Throwable runBody(TestNode node, CaseContext ctx) {
        long timeoutMs = node.options().timeoutMs() > 0 ? node.options().timeoutMs() : settings.caseTimeoutMs();
        if (timeoutMs <= 0) {
            try {
                node.body().run(ctx);
                return null;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return e;
            } catch (Exception | AssertionError e) {
                return e;
            }
        }

        Map<String, String> mdc = MdcContext.snapshot();
        Future<Throwable> future = CASE_WORKERS.submit(() -> {
            MdcContext.restore(mdc);
            try {
                node.body().run(ctx);
                return null;
            } catch (Exception | AssertionError e) {
                return e;
            } finally {
                MdcContext.clear();
            }
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new CaseTimeout(new AsyncTimeoutException("Test timed out after " + timeoutMs + "ms", timeoutMs));
        } catch (ExecutionException e) {
            return e.getCause();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return e;
        }
    }

    private static boolean hasRunnableCase(TestNode suite, ResolvedPlan plan) {
        for (TestNode child : suite.children()) {
            if (child.isCase() ? plan.willRun(child) : hasRunnableCase(child, plan)) return true;
        }
        return false;
    }

    private static List<String> pathOf(TestNode node) {
        var path = new ArrayList<>(node.suitePath());
        path.add(node.name());
        return path;
    }

    private static Outcome outcome(TestNode node, OutcomeStatus status, long durationMs,
                                   FailureDetail detail, String reason) {
        return new Outcome(node.name(), node.suitePath(), status, durationMs, detail, reason,
                node.effectiveTags(), Instant.now());
    }

    private Outcome counted(Outcome outcome) {
        if (metrics != null) {
            metrics.recordCaseResult(outcome.status().name());
        }
        return outcome;
    }

    private void logOutcome(String path, Outcome outcome) {
        switch (outcome.status()) {
            case FAIL, ERROR_RAISED -> log.warn("{} {} ({}ms): {}", outcome.status(), path, outcome.durationMs(),
                    outcome.failureDetail() == null ? "" : outcome.failureDetail().message());
            default -> log.debug("{} {} ({}ms)", outcome.status(), path, outcome.durationMs());
        }
    }

    private void publish(String type, String runId, String caseName, Map<String, Object> payload) {
        eventBus.publish(new FirmoEvent(type, runId, caseName, payload, Instant.now()));
    }

    /** Marks a per-case time bound being exceeded, so it is never mistaken for an expected error. */
    private static final class CaseTimeout extends RuntimeException {
        private final AsyncTimeoutException timeout;

        CaseTimeout(AsyncTimeoutException timeout) {
            super(timeout.getMessage(), timeout, false, false);
            this.timeout = timeout;
        }
    }
}
