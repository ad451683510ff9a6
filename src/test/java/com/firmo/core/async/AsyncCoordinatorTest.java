package com.firmo.core.async;

import com.firmo.core.config.FirmoSettings;
import com.firmo.core.logging.MdcContext;
import com.firmo.core.matcher.ThrowingSupplier;
import com.firmo.core.metrics.FirmoMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncCoordinatorTest {

    private SimpleMeterRegistry registry;
    private AsyncCoordinator async;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        async = new AsyncCoordinator(FirmoSettings.defaults(), new FirmoMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    private static ThrowingSupplier<Integer> after(long ms, int value) {
        return () -> {
            Thread.sleep(ms);
            return value;
        };
    }

    @Nested
    @DisplayName("await")
    class AwaitTests {

        @Test
        @DisplayName("suspends for at least the given duration")
        void waits() throws Exception {
            long start = System.nanoTime();
            async.await(40);
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 40);
        }

        @Test
        @DisplayName("zero returns immediately and negative is rejected")
        void bounds() {
            assertDoesNotThrow(() -> async.await(0));
            assertThrows(IllegalArgumentException.class, () -> async.await(-1));
        }
    }

    @Nested
    @DisplayName("waitUntil")
    class WaitUntilTests {

        @Test
        @DisplayName("returns once the condition holds")
        void conditionMet() throws Exception {
            var calls = new AtomicInteger();
            async.waitUntil(() -> calls.incrementAndGet() >= 3, 1_000, 5);
            assertEquals(3, calls.get());
        }

        @Test
        @DisplayName("checks immediately before sleeping")
        void immediate() throws Exception {
            long start = System.nanoTime();
            async.waitUntil(() -> true, 1_000, 500);
            assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) < 400);
        }

        @Test
        @DisplayName("times out with the bound in the message")
        void timesOut() {
            AsyncTimeoutException e = assertThrows(AsyncTimeoutException.class,
                    () -> async.waitUntil(() -> false, 50, 10));
            assertEquals("Timeout of 50ms exceeded while waiting for condition to be true", e.getMessage());
            assertEquals(50, e.getTimeoutMs());
        }

        @Test
        @DisplayName("rejects invalid arguments")
        void invalid() {
            assertThrows(IllegalArgumentException.class, () -> async.waitUntil(null));
            assertThrows(IllegalArgumentException.class, () -> async.waitUntil(() -> true, 0));
            assertThrows(IllegalArgumentException.class, () -> async.waitUntil(() -> true, 100, 0));
        }
    }

    @Nested
    @DisplayName("parallel")
    class ParallelTests {

        @Test
        @DisplayName("branches run concurrently and results keep input order")
        void concurrent() throws Exception {
            List<ThrowingSupplier<Integer>> tasks = List.of(after(50, 1), after(120, 2), after(70, 3));

            long start = System.nanoTime();
            List<Integer> results = async.parallel(tasks);
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(List.of(1, 2, 3), results);
            assertTrue(elapsed < 200, "took " + elapsed + "ms");
        }

        @Test
        @DisplayName("an empty group returns an empty list")
        void empty() throws Exception {
            List<ThrowingSupplier<Integer>> tasks = List.of();
            assertEquals(List.of(), async.parallel(tasks));
        }

        @Test
        @DisplayName("a failing branch is reported after every sibling settles")
        void failingBranch() {
            var slowFinished = new AtomicBoolean();
            List<ThrowingSupplier<Integer>> tasks = List.of(
                    after(10, 1),
                    () -> {
                        throw new IllegalStateException("boom");
                    },
                    () -> {
                        Thread.sleep(80);
                        slowFinished.set(true);
                        return 3;
                    });

            AggregateBranchException e = assertThrows(AggregateBranchException.class, () -> async.parallel(tasks));

            assertTrue(slowFinished.get());
            assertEquals(1, e.getFailures().size());
            assertEquals(1, e.getFailures().get(0).index());
            assertEquals(BranchState.REJECTED, e.getFailures().get(0).state());
            assertTrue(e.getMessage().contains("Branch #1 failed: boom"), e.getMessage());
            assertEquals(BranchState.RESOLVED, e.getBranches().get(2).state());
        }

        @Test
        @DisplayName("every failing branch is listed")
        void severalFailures() {
            List<ThrowingSupplier<Integer>> tasks = List.of(
                    () -> {
                        throw new IllegalStateException("first");
                    },
                    () -> {
                        throw new IllegalArgumentException("second");
                    });

            AggregateBranchException e = assertThrows(AggregateBranchException.class, () -> async.parallel(tasks));

            assertEquals(List.of(0, 1), e.getFailures().stream().map(AggregateBranchException.BranchFailure::index).toList());
            assertEquals(2, e.getSuppressed().length);
        }

        @Test
        @DisplayName("a group where only timeouts failed raises a timeout naming them")
        void allTimedOut() {
            List<ThrowingSupplier<Integer>> tasks = List.of(after(2_000, 1), after(2_000, 2), after(5, 3));

            AsyncTimeoutException e = assertThrows(AsyncTimeoutException.class, () -> async.parallel(tasks, 100));

            assertEquals("Timeout of 100ms exceeded. Operations 0, 1 did not complete in time.", e.getMessage());
        }

        @Test
        @DisplayName("a timeout mixed with an error is reported as an aggregate")
        void timeoutAndError() {
            List<ThrowingSupplier<Integer>> tasks = List.of(
                    after(2_000, 1),
                    () -> {
                        throw new IllegalStateException("broken");
                    });

            AggregateBranchException e = assertThrows(AggregateBranchException.class, () -> async.parallel(tasks, 100));

            assertEquals(BranchState.TIMED_OUT, e.getFailures().get(0).state());
            assertTrue(e.getMessage().contains("Branch #0 timed out"), e.getMessage());
        }

        @Test
        @DisplayName("parallelSettled reports each branch without raising")
        void settled() throws Exception {
            List<ThrowingSupplier<Integer>> tasks = List.of(
                    after(5, 1),
                    () -> {
                        throw new IllegalStateException("nope");
                    },
                    after(2_000, 3));

            List<PendingAsyncTask<Integer>> branches = async.parallelSettled(tasks, 100);

            assertEquals(BranchState.RESOLVED, branches.get(0).state());
            assertEquals(1, branches.get(0).result());
            assertEquals(BranchState.REJECTED, branches.get(1).state());
            assertEquals("nope", branches.get(1).error().getMessage());
            assertEquals(BranchState.TIMED_OUT, branches.get(2).state());
            assertInstanceOf(AsyncTimeoutException.class, branches.get(2).error());
            assertTrue(branches.stream().allMatch(b -> b.state().isTerminal()));
        }

        @Test
        @DisplayName("branches inherit the caller's MDC")
        void mdc() throws Exception {
            MDC.put(MdcContext.CASE_NAME, "parallel case");
            List<ThrowingSupplier<String>> tasks = List.of(() -> MDC.get(MdcContext.CASE_NAME));

            assertEquals(List.of("parallel case"), async.parallel(tasks));
        }

        @Test
        @DisplayName("rejects invalid arguments")
        void invalid() {
            List<ThrowingSupplier<Integer>> tasks = List.of(after(1, 1));
            assertThrows(IllegalArgumentException.class, () -> async.parallelSettled(null, 100));
            assertThrows(IllegalArgumentException.class, () -> async.parallel(tasks, 0));
        }

        @Test
        @DisplayName("records branch states and group width")
        void metrics() throws Exception {
            List<ThrowingSupplier<Integer>> tasks = List.of(
                    after(1, 1),
                    () -> {
                        throw new IllegalStateException("x");
                    });

            async.parallelSettled(tasks, 500);

            assertEquals(1.0, registry.find("firmo.parallel.branches").tag("state", "resolved").counter().count());
            assertEquals(1.0, registry.find("firmo.parallel.branches").tag("state", "rejected").counter().count());
            assertEquals(2.0, registry.find("firmo.parallel.width").summary().totalAmount());
        }
    }
}
