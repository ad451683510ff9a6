package com.firmo.core.matcher;

import com.firmo.core.engine.PendingSignal;
import com.firmo.core.expect.ExpectationUsageException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Predicates over a block of code: whether it raises, what it raises and with which message.
 * <p>
 * The block is invoked exactly once. JVM-fatal errors, malformed assertions and pending/skip
 * signals are never treated as an expected failure.
 */
public final class FailureMatchers {

    private FailureMatchers() {}

    public static MatchResult fails(ThrowingRunnable block) {
        Throwable raised = invoke(block);
        return MatchResult.of(raised != null,
                "expected function to fail",
                "expected function to not fail, but it raised " + describe(raised));
    }

    /**
     * The block raises and its message (or, when it has none, its class name) contains a match
     * for {@code regex}.
     */
    public static MatchResult failsWith(ThrowingRunnable block, String regex) {
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            return MatchResult.uninterpretable("invalid pattern \"" + regex + "\": " + e.getDescription());
        }
        Throwable raised = invoke(block);
        if (raised == null) {
            return MatchResult.of(false,
                    "expected function to fail with message matching \"" + regex + "\", but it did not fail",
                    "expected function to not fail with message matching \"" + regex + "\"");
        }
        String text = messageOf(raised);
        return MatchResult.of(pattern.matcher(text).find(),
                        "expected error message \"" + text + "\" to match \"" + regex + "\"",
                        "expected error message \"" + text + "\" to not match \"" + regex + "\"")
                .withValues(regex, text);
    }

    public static MatchResult throwsType(ThrowingRunnable block, Class<? extends Throwable> type) {
        Throwable raised = invoke(block);
        String name = type.getSimpleName();
        if (raised == null) {
            return MatchResult.of(false,
                    "expected function to throw " + name + ", but it did not throw",
                    "expected function to not throw " + name);
        }
        return MatchResult.of(type.isInstance(raised),
                        "expected function to throw " + name + ", but it threw " + describe(raised),
                        "expected function to not throw " + name + ", but it threw " + describe(raised))
                .withValues(name, raised.getClass().getSimpleName());
    }

    /**
     * @return the throwable raised by the block, or null if it completed normally
     */
    static Throwable invoke(ThrowingRunnable block) {
        try {
            block.run();
            return null;
        } catch (ExpectationUsageException | PendingSignal | VirtualMachineError e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return e;
        } catch (Throwable t) {
            return t;
        }
    }

    static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isEmpty() ? t.getClass().getName() : message;
    }

    private static String describe(Throwable t) {
        return t == null ? "nothing" : t.getClass().getSimpleName() + ": " + messageOf(t);
    }
}
