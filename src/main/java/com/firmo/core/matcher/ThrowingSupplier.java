package com.firmo.core.matcher;

/**
 * A value-producing block of code under test that may throw anything.
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
    T get() throws Exception;
}
