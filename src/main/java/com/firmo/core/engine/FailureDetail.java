package com.firmo.core.engine;

import com.firmo.core.expect.AssertionFailure;

/**
 * Structured description of why a case failed or errored, enough for a reporter to render a
 * diff without re-deriving it.
 *
 * @param message   human-readable explanation
 * @param expected  rendered expected value, null if not an assertion failure
 * @param actual    rendered actual value, null if not an assertion failure
 * @param diff      structural difference, may be null
 * @param errorType fully qualified class name of the raised throwable
 * @param location  first stack frame outside the framework, may be null
 * @param chain     qualifier chain of the failed assertion, may be null
 */
public record FailureDetail(
    String message,
    String expected,
    String actual,
    String diff,
    String errorType,
    String location,
    String chain
) {

    private static final String FRAMEWORK_PACKAGE = "com.firmo.core.";

    public static FailureDetail of(String message) {
        return new FailureDetail(message, null, null, null, null, null, null);
    }

    public static FailureDetail from(Throwable t) {
        return from(null, t);
    }

    /**
     * @param prefix prepended to the message, e.g. "before hook failed: "; may be null
     */
    public static FailureDetail from(String prefix, Throwable t) {
        String p = prefix == null ? "" : prefix;
        if (t instanceof AssertionFailure af) {
            return new FailureDetail(p + af.getMessage(), af.getExpected(), af.getActual(), af.getDiff(),
                    af.getClass().getName(), locate(af), af.getChain());
        }
        String message = t.getMessage() == null || t.getMessage().isEmpty() ? t.getClass().getName() : t.getMessage();
        return new FailureDetail(p + message, null, null, null, t.getClass().getName(), locate(t), null);
    }

    private static String locate(Throwable t) {
        for (StackTraceElement frame : t.getStackTrace()) {
            if (!frame.getClassName().startsWith(FRAMEWORK_PACKAGE)
                    && !frame.getClassName().startsWith("java.")
                    && !frame.getClassName().startsWith("jdk.")) {
                return frame.getFileName() + ":" + frame.getLineNumber();
            }
        }
        return null;
    }
}
