package com.firmo.core.engine;

import com.firmo.core.async.AsyncCoordinator;
import com.firmo.core.config.FirmoSettings;
import com.firmo.core.expect.Expect;
import com.firmo.core.expect.Expectation;
import com.firmo.core.expect.ExpectationUsageException;
import com.firmo.core.matcher.ThrowingRunnable;
import com.firmo.core.matcher.ThrowingSupplier;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Handle passed to every case body: assertions, error capture, pending/skip and async wait points.
 * <p>
 * One instance per executed case; never shared between cases.
 */
public final class CaseContext {

    private final String caseName;
    private final List<String> suitePath;
    private final boolean expectError;
    private final FirmoSettings settings;
    private final AsyncCoordinator async;
    private final AtomicBoolean capturedError = new AtomicBoolean();

    CaseContext(String caseName, List<String> suitePath, boolean expectError,
                FirmoSettings settings, AsyncCoordinator async) {
        this.caseName = caseName;
        this.suitePath = List.copyOf(suitePath);
        this.expectError = expectError;
        this.settings = settings;
        this.async = async;
    }

    public String caseName() {
        return caseName;
    }

    public List<String> suitePath() {
        return suitePath;
    }

    public FirmoSettings settings() {
        return settings;
    }

    /** Whether the case was declared with {@code expectError}. */
    public boolean expectsError() {
        return expectError;
    }

    public <T> Expectation<T> expect(T subject) {
        return Expect.expect(subject, settings);
    }

    public Expectation<ThrowingRunnable> expectCall(ThrowingRunnable block) {
        return Expect.expectCall(block, settings);
    }

    /**
     * Runs code under test and returns what it produced or raised instead of letting the error
     * end the case. Usage errors, pending/skip signals and JVM errors pass through.
     */
    public <T> CaptureResult<T> capture(ThrowingSupplier<T> block) {
        try {
            return CaptureResult.ok(block.get());
        } catch (ExpectationUsageException | PendingSignal e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return captured(e);
        } catch (Exception | AssertionError e) {
            return captured(e);
        }
    }

    public CaptureResult<Void> capture(ThrowingRunnable block) {
        return capture(() -> {
            block.run();
            return null;
        });
    }

    /** Stops the case here and records it as pending. */
    public void pending(String reason) {
        throw new PendingSignal(OutcomeStatus.PENDING, reason);
    }

    /** Stops the case here and records it as skipped. */
    public void skip(String reason) {
        throw new PendingSignal(OutcomeStatus.SKIPPED, reason);
    }

    public AsyncCoordinator async() {
        return async;
    }

    public void await(long durationMs) throws InterruptedException {
        async.await(durationMs);
    }

    public void waitUntil(BooleanSupplier condition) throws InterruptedException {
        async.waitUntil(condition);
    }

    boolean hasCapturedError() {
        return capturedError.get();
    }

    private <T> CaptureResult<T> captured(Throwable e) {
        capturedError.set(true);
        return CaptureResult.failed(e);
    }
}
