package com.firmo.core.matcher;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.Method;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.BaseStream;

/**
 * Type classification and truthiness predicates.
 * <p>
 * Capabilities are decided by interface checks: callable means the value implements a
 * {@link FunctionalInterface} (or is a reflective method handle), comparable means
 * {@link Comparable}, iterable means it can produce a sequence of elements.
 */
public final class TypeMatchers {

    private TypeMatchers() {}

    public static MatchResult callable(Object value) {
        return capability(value, isCallable(value), "callable");
    }

    public static MatchResult comparable(Object value) {
        return capability(value, value instanceof Comparable<?>, "comparable");
    }

    public static MatchResult iterable(Object value) {
        boolean iterable = value instanceof Iterable<?>
                || value instanceof Map<?, ?>
                || value instanceof Iterator<?>
                || value instanceof BaseStream<?, ?>
                || (value != null && value.getClass().isArray());
        return capability(value, iterable, "iterable");
    }

    public static MatchResult instanceOf(Object value, Class<?> type) {
        String v = ValueFormatter.format(value);
        return MatchResult.of(type.isInstance(value),
                        "expected " + v + " to be a " + type.getSimpleName() + ", got " + ValueFormatter.typeName(value),
                        "expected " + v + " to not be a " + type.getSimpleName())
                .withValues(type.getSimpleName(), ValueFormatter.typeName(value));
    }

    public static MatchResult isNull(Object value) {
        return MatchResult.of(value == null,
                "expected " + ValueFormatter.format(value) + " to be null",
                "expected value to not be null");
    }

    public static MatchResult exists(Object value) {
        return MatchResult.of(value != null,
                "expected value to exist",
                "expected " + ValueFormatter.format(value) + " to not exist");
    }

    /** Everything except {@code null} and {@code false} is truthy. */
    public static MatchResult truthy(Object value) {
        return MatchResult.of(isTruthy(value),
                "expected " + ValueFormatter.format(value) + " to be truthy",
                "expected " + ValueFormatter.format(value) + " to not be truthy");
    }

    public static MatchResult falsy(Object value) {
        return MatchResult.of(!isTruthy(value),
                "expected " + ValueFormatter.format(value) + " to be falsy",
                "expected " + ValueFormatter.format(value) + " to not be falsy");
    }

    /**
     * Applies a caller predicate. A predicate that throws is a non-match carrying the error.
     */
    public static <T> MatchResult satisfies(T value, Predicate<? super T> predicate) {
        String v = ValueFormatter.format(value);
        try {
            return MatchResult.of(predicate.test(value),
                    "expected " + v + " to satisfy the predicate",
                    "expected " + v + " to not satisfy the predicate");
        } catch (RuntimeException e) {
            return MatchResult.uninterpretable("predicate raised " + e.getClass().getSimpleName()
                    + " for " + v + ": " + e.getMessage());
        }
    }

    static boolean isTruthy(Object value) {
        return value != null && !Boolean.FALSE.equals(value);
    }

    static boolean isCallable(Object value) {
        if (value == null) return false;
        if (value instanceof Method || value instanceof MethodHandle) return true;
        Deque<Class<?>> pending = new ArrayDeque<>();
        for (Class<?> c = value.getClass(); c != null; c = c.getSuperclass()) {
            for (Class<?> i : c.getInterfaces()) pending.push(i);
        }
        while (!pending.isEmpty()) {
            Class<?> i = pending.pop();
            if (i.isAnnotationPresent(FunctionalInterface.class)) return true;
            for (Class<?> parent : i.getInterfaces()) pending.push(parent);
        }
        return false;
    }

    private static MatchResult capability(Object value, boolean has, String word) {
        String v = ValueFormatter.format(value);
        return MatchResult.of(has,
                "expected " + v + " to be " + word + ", got " + ValueFormatter.typeName(value),
                "expected " + v + " to not be " + word);
    }
}
