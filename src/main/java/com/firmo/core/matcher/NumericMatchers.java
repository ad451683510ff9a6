package com.firmo.core.matcher;

import java.math.BigDecimal;

/**
 * Numeric proximity, range and ordering predicates.
 */
public final class NumericMatchers {

    private NumericMatchers() {}

    /**
     * {@code |actual - expected| <= tolerance}, inclusive and symmetric in its two operands.
     */
    public static MatchResult near(Object actual, Object expected, double tolerance) {
        if (!(actual instanceof Number a)) {
            return MatchResult.uninterpretable("expected a number to compare, got " + ValueFormatter.typeName(actual));
        }
        if (!(expected instanceof Number e)) {
            return MatchResult.uninterpretable("expected target value to be a number, got " + ValueFormatter.typeName(expected));
        }
        boolean near = withinTolerance(a, e, tolerance);
        return MatchResult.of(near,
                        "expected " + a + " to be near " + e + " (within " + tolerance + ")",
                        "expected " + a + " to not be near " + e + " (within " + tolerance + ")")
                .withValues(expected, actual)
                .withDiff(near ? null : "difference " + absoluteDifference(a, e));
    }

    /** Inclusive on both bounds. Numbers compare by value, other values by {@link Comparable}. */
    public static MatchResult between(Object actual, Object min, Object max) {
        Integer low = compare(actual, min);
        Integer high = compare(actual, max);
        if (low == null || high == null) {
            return MatchResult.uninterpretable("expected comparable values for range check, got "
                    + ValueFormatter.typeName(actual) + " between " + ValueFormatter.typeName(min)
                    + " and " + ValueFormatter.typeName(max));
        }
        String range = ValueFormatter.format(min) + " and " + ValueFormatter.format(max);
        return MatchResult.of(low >= 0 && high <= 0,
                "expected " + ValueFormatter.format(actual) + " to be between " + range,
                "expected " + ValueFormatter.format(actual) + " to not be between " + range);
    }

    public static MatchResult greaterThan(Object actual, Object bound) {
        return ordering(actual, bound, "greater than", c -> c > 0);
    }

    public static MatchResult lessThan(Object actual, Object bound) {
        return ordering(actual, bound, "less than", c -> c < 0);
    }

    public static MatchResult atLeast(Object actual, Object bound) {
        return ordering(actual, bound, "at least", c -> c >= 0);
    }

    public static MatchResult atMost(Object actual, Object bound) {
        return ordering(actual, bound, "at most", c -> c <= 0);
    }

    public static MatchResult integer(Object actual) {
        boolean integral = actual instanceof Number n
                && (DeepEquality.isIntegral(n) || isWholeDecimal(n));
        return MatchResult.of(integral,
                "expected " + ValueFormatter.format(actual) + " to be an integer",
                "expected " + ValueFormatter.format(actual) + " to not be an integer");
    }

    public static MatchResult positive(Object actual) {
        return sign(actual, "positive", c -> c > 0);
    }

    public static MatchResult negative(Object actual) {
        return sign(actual, "negative", c -> c < 0);
    }

    static boolean withinTolerance(Number a, Number b, double tolerance) {
        if (a instanceof BigDecimal || b instanceof BigDecimal) {
            return toBigDecimal(a).subtract(toBigDecimal(b)).abs()
                    .compareTo(BigDecimal.valueOf(tolerance)) <= 0;
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        if (x == y) return true;
        return Math.abs(x - y) <= tolerance;
    }

    private static Object absoluteDifference(Number a, Number b) {
        if (a instanceof BigDecimal || b instanceof BigDecimal) {
            return toBigDecimal(a).subtract(toBigDecimal(b)).abs();
        }
        return Math.abs(a.doubleValue() - b.doubleValue());
    }

    private static MatchResult ordering(Object actual, Object bound, String relation,
                                        java.util.function.IntPredicate test) {
        Integer c = compare(actual, bound);
        if (c == null) {
            return MatchResult.uninterpretable("expected comparable values, got "
                    + ValueFormatter.typeName(actual) + " and " + ValueFormatter.typeName(bound));
        }
        return MatchResult.of(test.test(c),
                        "expected " + ValueFormatter.format(actual) + " to be " + relation + " " + ValueFormatter.format(bound),
                        "expected " + ValueFormatter.format(actual) + " to not be " + relation + " " + ValueFormatter.format(bound))
                .withValues(bound, actual);
    }

    private static MatchResult sign(Object actual, String word, java.util.function.IntPredicate test) {
        if (!(actual instanceof Number n)) {
            return MatchResult.uninterpretable("expected a number, got " + ValueFormatter.typeName(actual));
        }
        if (n instanceof Double d && d.isNaN() || n instanceof Float f && f.isNaN()) {
            return MatchResult.uninterpretable("expected a number, got NaN");
        }
        int signum = n instanceof BigDecimal || DeepEquality.isIntegral(n)
                ? toBigDecimal(n).signum()
                : (int) Math.signum(n.doubleValue());
        return MatchResult.of(test.test(signum),
                "expected " + n + " to be " + word,
                "expected " + n + " to not be " + word);
    }

    /**
     * Three-way comparison of two numbers (by value) or two mutually comparable objects.
     *
     * @return null if the values cannot be ordered against each other
     */
    static Integer compare(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            if (isNaN(na) || isNaN(nb)) return null;
            return toBigDecimal(na).compareTo(toBigDecimal(nb));
        }
        if (a instanceof Comparable<?> && b != null && a.getClass().isInstance(b)) {
            @SuppressWarnings("unchecked")
            Comparable<Object> ca = (Comparable<Object>) a;
            try {
                return Integer.signum(ca.compareTo(b));
            } catch (ClassCastException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean isNaN(Number n) {
        return (n instanceof Double d && (d.isNaN() || d.isInfinite()))
                || (n instanceof Float f && (f.isNaN() || f.isInfinite()));
    }

    private static boolean isWholeDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd.stripTrailingZeros().scale() <= 0;
        }
        double d = n.doubleValue();
        return !Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d);
    }

    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        if (DeepEquality.isIntegral(n)) return new BigDecimal(DeepEquality.toBigInteger(n));
        return BigDecimal.valueOf(n.doubleValue());
    }
}
