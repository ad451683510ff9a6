package com.firmo.core.matcher;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural equality over scalars, maps, sets and sequences.
 * <p>
 * Maps compare keys by value and ignore entry order; sets ignore order; lists and arrays are
 * compared element by element. Numbers compare by numeric value across boxed types.
 * A pair of containers already under comparison higher up the stack is assumed equal, so
 * self-referencing structures terminate.
 */
public final class DeepEquality {

    private DeepEquality() {}

    public static boolean deepEquals(Object a, Object b) {
        return difference(a, b, 0.0) == null;
    }

    /**
     * @return {@code null} when equal, otherwise a description of the first difference found
     */
    public static String difference(Object actual, Object expected, double epsilon) {
        return new Walk(epsilon).diff(actual, expected, "$");
    }

    public static MatchResult equal(Object actual, Object expected) {
        return equal(actual, expected, 0.0);
    }

    public static MatchResult equal(Object actual, Object expected, double epsilon) {
        String diff = difference(actual, expected, epsilon);
        String a = ValueFormatter.format(actual);
        String e = ValueFormatter.format(expected);
        return MatchResult.of(diff == null,
                        "expected " + a + " to equal " + e,
                        "expected " + a + " to not equal " + e)
                .withValues(expected, actual)
                .withDiff(diff);
    }

    private static final class Walk {

        private final double epsilon;
        private final Map<Object, Set<Object>> inProgress = new IdentityHashMap<>();

        Walk(double epsilon) {
            this.epsilon = epsilon;
        }

        String diff(Object a, Object b, String path) {
            if (a == b) return null;
            if (a == null || b == null) {
                return mismatch(path, b, a);
            }
            if (a instanceof Number na && b instanceof Number nb) {
                return numbersEqual(na, nb) ? null : mismatch(path, b, a);
            }
            boolean aContainer = Containers.isContainer(a);
            boolean bContainer = Containers.isContainer(b);
            if (!aContainer || !bContainer) {
                return Objects.equals(a, b) ? null : mismatch(path, b, a);
            }
            if (!enter(a, b)) {
                return null;
            }
            try {
                if (Containers.isMap(a) && Containers.isMap(b)) {
                    return mapDiff((Map<?, ?>) a, (Map<?, ?>) b, path);
                }
                if (Containers.isSet(a) && Containers.isSet(b)) {
                    return setDiff((Set<?>) a, (Set<?>) b, path);
                }
                if (Containers.isSequence(a) && Containers.isSequence(b)) {
                    return sequenceDiff(Containers.elements(a), Containers.elements(b), path);
                }
                return "at " + path + ": expected a " + ValueFormatter.typeName(b)
                        + " but was a " + ValueFormatter.typeName(a);
            } finally {
                exit(a, b);
            }
        }

        private String mapDiff(Map<?, ?> a, Map<?, ?> b, String path) {
            for (Map.Entry<?, ?> e : b.entrySet()) {
                if (!Containers.containsKey(a, e.getKey())) {
                    return "at " + path + ": missing key " + ValueFormatter.format(e.getKey());
                }
            }
            for (Map.Entry<?, ?> e : a.entrySet()) {
                if (!Containers.containsKey(b, e.getKey())) {
                    return "at " + path + ": unexpected key " + ValueFormatter.format(e.getKey());
                }
                String d = diff(e.getValue(), b.get(e.getKey()), path + "." + e.getKey());
                if (d != null) return d;
            }
            return null;
        }

        private String setDiff(Set<?> a, Set<?> b, String path) {
            if (a.size() != b.size()) {
                return "at " + path + ": expected " + b.size() + " elements but was " + a.size();
            }
            outer:
            for (Object expected : b) {
                for (Object candidate : a) {
                    if (diff(candidate, expected, path) == null) continue outer;
                }
                return "at " + path + ": missing element " + ValueFormatter.format(expected);
            }
            return null;
        }

        private String sequenceDiff(List<Object> a, List<Object> b, String path) {
            if (a.size() != b.size()) {
                return "at " + path + ": expected length " + b.size() + " but was " + a.size();
            }
            for (int i = 0; i < a.size(); i++) {
                String d = diff(a.get(i), b.get(i), path + "[" + i + "]");
                if (d != null) return d;
            }
            return null;
        }

        private boolean numbersEqual(Number a, Number b) {
            if (isIntegral(a) && isIntegral(b)) {
                return toBigInteger(a).equals(toBigInteger(b));
            }
            if (a instanceof BigDecimal da && b instanceof BigDecimal db) {
                return da.compareTo(db) == 0;
            }
            double x = a.doubleValue();
            double y = b.doubleValue();
            if (Double.compare(x, y) == 0) return true;
            return Math.abs(x - y) <= epsilon;
        }

        private boolean enter(Object a, Object b) {
            Set<Object> partners = inProgress.computeIfAbsent(a,
                    k -> Collections.newSetFromMap(new IdentityHashMap<>()));
            return partners.add(b);
        }

        private void exit(Object a, Object b) {
            Set<Object> partners = inProgress.get(a);
            if (partners != null) {
                partners.remove(b);
                if (partners.isEmpty()) inProgress.remove(a);
            }
        }

        private static String mismatch(String path, Object expected, Object actual) {
            return "at " + path + ": expected " + ValueFormatter.format(expected)
                    + " but was " + ValueFormatter.format(actual);
        }
    }

    static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short
                || n instanceof Byte || n instanceof BigInteger;
    }

    static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger bi ? bi : BigInteger.valueOf(n.longValue());
    }
}
