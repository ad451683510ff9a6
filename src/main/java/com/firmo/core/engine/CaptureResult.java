package com.firmo.core.engine;

/**
 * Explicit result of running code under test through {@link CaseContext#capture}: either the
 * value it produced or the error it raised.
 *
 * @param value the produced value, null on error or for void blocks
 * @param error the raised error, null on success
 * @param <T>   value type
 */
public record CaptureResult<T>(T value, Throwable error) {

    public static <T> CaptureResult<T> ok(T value) {
        return new CaptureResult<>(value, null);
    }

    public static <T> CaptureResult<T> failed(Throwable error) {
        return new CaptureResult<>(null, error);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isError() {
        return error != null;
    }

    /** Message of the captured error, falling back to its class name; null on success. */
    public String errorMessage() {
        if (error == null) return null;
        String m = error.getMessage();
        return m == null || m.isEmpty() ? error.getClass().getName() : m;
    }
}
