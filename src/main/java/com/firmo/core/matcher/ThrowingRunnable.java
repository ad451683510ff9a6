package com.firmo.core.matcher;

/**
 * A block of code under test that may throw anything.
 */
@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Exception;
}
