package com.firmo.core.async;

/**
 * Thrown when {@code waitUntil}, {@code parallel} or a per-case time bound is exceeded.
 * Distinct from assertion failures and from errors raised by the code under test.
 */
public class AsyncTimeoutException extends RuntimeException {

    private final long timeoutMs;

    public AsyncTimeoutException(String message, long timeoutMs) {
        super(message);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
