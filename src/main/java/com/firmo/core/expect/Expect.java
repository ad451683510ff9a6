package com.firmo.core.expect;

import com.firmo.core.config.FirmoSettings;
import com.firmo.core.matcher.ThrowingRunnable;

/**
 * Entry points for building expectations.
 * <p>
 * The static methods use {@link FirmoSettings#defaults()}; inside a running case prefer
 * {@code CaseContext.expect(...)}, which applies the configured tolerance.
 */
public final class Expect {

    private Expect() {}

    public static <T> Expectation<T> expect(T subject) {
        return new Expectation<>(subject, FirmoSettings.defaults());
    }

    /** Expectation over a block, for {@code toFail}, {@code toFailWith} and {@code toThrow}. */
    public static Expectation<ThrowingRunnable> expectCall(ThrowingRunnable block) {
        return new Expectation<>(block, FirmoSettings.defaults());
    }

    public static <T> Expectation<T> expect(T subject, FirmoSettings settings) {
        return new Expectation<>(subject, settings);
    }

    public static Expectation<ThrowingRunnable> expectCall(ThrowingRunnable block, FirmoSettings settings) {
        return new Expectation<>(block, settings);
    }
}
