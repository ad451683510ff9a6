package com.firmo.core.tree;

/**
 * A unit of test declarations, the Java counterpart of a test file.
 * <p>
 * Implementations are loaded by class name or through {@link java.util.ServiceLoader}.
 */
public interface TestSpec {

    void define(TestDsl dsl);

    /** Label used for logging; defaults to the simple class name. */
    default String name() {
        return getClass().getSimpleName();
    }
}
