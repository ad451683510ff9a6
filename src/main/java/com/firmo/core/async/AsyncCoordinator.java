package com.firmo.core.async;

import com.firmo.core.config.FirmoSettings;
import com.firmo.core.logging.MdcContext;
import com.firmo.core.matcher.ThrowingSupplier;
import com.firmo.core.metrics.FirmoMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Wait points available to a case body: fixed delays, polled conditions and parallel fan-out.
 * <p>
 * Parallel branches run on daemon worker threads that inherit the caller's MDC. All branches
 * share one deadline. A branch that misses it is marked {@link BranchState#TIMED_OUT} and
 * interrupted; its siblings keep running until they settle or reach the same deadline. The join
 * never stops at the first error: every branch is settled before anything is reported.
 */
public class AsyncCoordinator {

    private static final Logger log = LoggerFactory.getLogger(AsyncCoordinator.class);

    private static final ExecutorService BRANCHES = WorkerThreads.newCachedPool("firmo-branch");

    private final FirmoSettings settings;
    private final FirmoMetrics metrics;

    public AsyncCoordinator(FirmoSettings settings, FirmoMetrics metrics) {
        this.settings = settings;
        this.metrics = metrics;
    }

    public AsyncCoordinator(FirmoSettings settings) {
        this(settings, null);
    }

    /** Suspends the calling case for at least {@code durationMs}. */
    public void await(long durationMs) throws InterruptedException {
        if (durationMs < 0) {
            throw new IllegalArgumentException("duration must not be negative, got " + durationMs);
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(durationMs);
        long remaining;
        while ((remaining = deadline - System.nanoTime()) > 0) {
            TimeUnit.NANOSECONDS.sleep(remaining);
        }
    }

    public void waitUntil(BooleanSupplier condition) throws InterruptedException {
        waitUntil(condition, settings.defaultTimeoutMs(), settings.pollIntervalMs());
    }

    public void waitUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        waitUntil(condition, timeoutMs, settings.pollIntervalMs());
    }

    /**
     * Evaluates {@code condition} immediately and then every {@code pollIntervalMs} until it holds.
     *
     * @throws AsyncTimeoutException if it still does not hold after {@code timeoutMs}
     */
    public void waitUntil(BooleanSupplier condition, long timeoutMs, long pollIntervalMs) throws InterruptedException {
        if (condition == null) {
            throw new IllegalArgumentException("condition must not be null");
        }
        if (timeoutMs <= 0 || pollIntervalMs <= 0) {
            throw new IllegalArgumentException("timeout and poll interval must be positive, got "
                    + timeoutMs + "ms/" + pollIntervalMs + "ms");
        }
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        int checks = 0;
        while (true) {
            checks++;
            if (condition.getAsBoolean()) {
                log.debug("Condition met after {} check(s), {}ms", checks, elapsedMs(start));
                return;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(pollIntervalMs)));
        }
        throw new AsyncTimeoutException(
                String.format("Timeout of %dms exceeded while waiting for condition to be true", timeoutMs), timeoutMs);
    }

    @SafeVarargs
    public final <T> List<T> parallel(ThrowingSupplier<? extends T>... tasks) throws InterruptedException {
        return parallel(Arrays.asList(tasks), settings.defaultTimeoutMs());
    }

    public <T> List<T> parallel(List<? extends ThrowingSupplier<? extends T>> tasks) throws InterruptedException {
        return parallel(tasks, settings.defaultTimeoutMs());
    }

    /**
     * Runs every task concurrently and returns their results in input order.
     *
     * @throws AsyncTimeoutException     if every failing branch timed out
     * @throws AggregateBranchException  if at least one branch raised; lists every failing branch
     */
    public <T> List<T> parallel(List<? extends ThrowingSupplier<? extends T>> tasks, long timeoutMs)
            throws InterruptedException {
        List<PendingAsyncTask<T>> branches = parallelSettled(tasks, timeoutMs);

        var failed = branches.stream().filter(b -> b.state() != BranchState.RESOLVED).toList();
        if (failed.isEmpty()) {
            var results = new ArrayList<T>(branches.size());
            for (PendingAsyncTask<T> b : branches) results.add(b.result());
            return results;
        }
        if (failed.stream().allMatch(b -> b.state() == BranchState.TIMED_OUT)) {
            String indices = failed.stream().map(b -> String.valueOf(b.index())).collect(Collectors.joining(", "));
            throw new AsyncTimeoutException(String.format(
                    "Timeout of %dms exceeded. Operations %s did not complete in time.", timeoutMs, indices), timeoutMs);
        }
        var failures = failed.stream()
                .map(b -> new AggregateBranchException.BranchFailure(b.index(), b.state(), messageOf(b.error())))
                .toList();
        throw new AggregateBranchException(failures, branches);
    }

    public <T> List<PendingAsyncTask<T>> parallelSettled(List<? extends ThrowingSupplier<? extends T>> tasks)
            throws InterruptedException {
        return parallelSettled(tasks, settings.defaultTimeoutMs());
    }

    /**
     * Runs every task concurrently and returns each branch in its terminal state, never raising
     * for branch failures.
     */
    public <T> List<PendingAsyncTask<T>> parallelSettled(List<? extends ThrowingSupplier<? extends T>> tasks,
                                                         long timeoutMs) throws InterruptedException {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks must not be null");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeoutMs);
        }
        if (metrics != null) {
            metrics.recordParallelWidth(tasks.size());
        }
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Map<String, String> mdc = MdcContext.snapshot();

        var branches = new ArrayList<PendingAsyncTask<T>>(tasks.size());
        var futures = new ArrayList<Future<?>>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            ThrowingSupplier<? extends T> task = tasks.get(i);
            PendingAsyncTask<T> branch = new PendingAsyncTask<>(i);
            branches.add(branch);
            futures.add(BRANCHES.submit(() -> runBranch(task, branch, mdc)));
        }

        try {
            for (int i = 0; i < futures.size(); i++) {
                join(futures.get(i), branches.get(i), deadline, timeoutMs);
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }

        for (PendingAsyncTask<T> b : branches) {
            if (metrics != null) {
                metrics.recordBranch(b.state().name().toLowerCase());
            }
        }
        log.debug("Parallel group of {} settled in {}ms: {}", branches.size(), elapsedMs(start), branches);
        return branches;
    }

    private static <T> void runBranch(ThrowingSupplier<? extends T> task, PendingAsyncTask<T> branch,
                                      Map<String, String> mdc) {
        MdcContext.restore(mdc);
        try {
            branch.resolve(task.get());
        } catch (InterruptedException e) {
            branch.reject(e);
            Thread.currentThread().interrupt();
        } catch (Exception | AssertionError e) {
            branch.reject(e);
        } finally {
            MdcContext.clear();
        }
    }

    private static void join(Future<?> future, PendingAsyncTask<?> branch, long deadline, long timeoutMs)
            throws InterruptedException {
        long remaining = deadline - System.nanoTime();
        try {
            future.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (branch.timeOut(timeoutMs)) {
                future.cancel(true);
                log.debug("Branch #{} timed out after {}ms", branch.index(), timeoutMs);
            }
        } catch (ExecutionException e) {
            // runBranch catches Exception and AssertionError; anything else is an Error
            branch.reject(e.getCause());
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    static String messageOf(Throwable t) {
        if (t == null) return "unknown error";
        String message = t.getMessage();
        return message == null || message.isEmpty() ? t.getClass().getName() : message;
    }
}
