package com.firmo.core.matcher;

import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Membership, key presence, subset and size predicates over maps, collections, arrays and strings.
 */
public final class ContainmentMatchers {

    private ContainmentMatchers() {}

    /**
     * Element membership by deep equality. Maps are searched by value, strings by substring.
     */
    public static MatchResult contains(Object container, Object element) {
        String c = ValueFormatter.format(container);
        String e = ValueFormatter.format(element);
        boolean found;
        if (container instanceof CharSequence s && element instanceof CharSequence sub) {
            found = s.toString().contains(sub);
        } else if (container instanceof Map<?, ?> map) {
            found = map.values().stream().anyMatch(v -> DeepEquality.deepEquals(v, element));
        } else if (Containers.isContainer(container)) {
            found = Containers.elements(container).stream().anyMatch(v -> DeepEquality.deepEquals(v, element));
        } else {
            return MatchResult.uninterpretable("expected a container to search, got " + ValueFormatter.typeName(container));
        }
        return MatchResult.of(found, "expected " + c + " to contain " + e, "expected " + c + " to not contain " + e);
    }

    /** A map key, or a valid index of a list or array. */
    public static MatchResult hasKey(Object container, Object key) {
        String c = ValueFormatter.format(container);
        String k = ValueFormatter.format(key);
        if (!Containers.isContainer(container)) {
            return MatchResult.uninterpretable("expected a container to look up key " + k + ", got "
                    + ValueFormatter.typeName(container));
        }
        return MatchResult.of(lookup(container, key) != Missing.INSTANCE,
                "expected " + c + " to contain key " + k,
                "expected " + c + " to not contain key " + k);
    }

    public static MatchResult hasKeys(Object container, Collection<?> keys) {
        if (!Containers.isContainer(container)) {
            return MatchResult.uninterpretable("expected a container to look up keys, got " + ValueFormatter.typeName(container));
        }
        var missing = new ArrayList<Object>();
        for (Object key : keys) {
            if (lookup(container, key) == Missing.INSTANCE) missing.add(key);
        }
        String c = ValueFormatter.format(container);
        String k = ValueFormatter.format(keys);
        return MatchResult.of(missing.isEmpty(),
                "expected " + c + " to contain keys " + k + " but missing " + ValueFormatter.format(missing),
                "expected " + c + " to not contain keys " + k);
    }

    /** Dotted path, e.g. {@code "nested.value"}. */
    public static MatchResult hasDeepKey(Object container, String dottedPath) {
        return hasDeepKey(container, Arrays.asList(dottedPath.split("\\.", -1)));
    }

    /**
     * Walks the path one segment at a time. An intermediate value that is not a container
     * ends the walk with a non-match rather than an error.
     */
    public static MatchResult hasDeepKey(Object container, List<?> segments) {
        String path = String.join(".", segments.stream().map(String::valueOf).toList());
        Object current = container;
        String failure = null;
        for (Object segment : segments) {
            if (!Containers.isContainer(current)) {
                failure = "intermediate value at \"" + segment + "\" is a " + ValueFormatter.typeName(current);
                break;
            }
            current = lookup(current, segment);
            if (current == Missing.INSTANCE) {
                failure = "missing segment \"" + segment + "\"";
                break;
            }
        }
        String c = ValueFormatter.format(container);
        return MatchResult.of(failure == null,
                        "expected " + c + " to contain deep key \"" + path + "\"",
                        "expected " + c + " to not contain deep key \"" + path + "\"")
                .withDiff(failure);
    }

    /** The key set equals {@code keys}, order irrelevant. */
    public static MatchResult hasExactKeys(Object container, Collection<?> keys) {
        if (!(container instanceof Map<?, ?> map)) {
            return MatchResult.uninterpretable("expected a map to compare keys, got " + ValueFormatter.typeName(container));
        }
        Set<Object> expected = new HashSet<>(keys);
        Set<Object> actual = new HashSet<>(map.keySet());
        var missing = new HashSet<>(expected);
        missing.removeAll(actual);
        var extra = new HashSet<>(actual);
        extra.removeAll(expected);
        String diff = missing.isEmpty() && extra.isEmpty() ? null
                : "missing " + ValueFormatter.format(sorted(missing)) + ", unexpected " + ValueFormatter.format(sorted(extra));
        return MatchResult.of(diff == null,
                        "expected keys " + ValueFormatter.format(sorted(actual)) + " to be exactly " + ValueFormatter.format(sorted(expected)),
                        "expected keys " + ValueFormatter.format(sorted(actual)) + " to not be exactly " + ValueFormatter.format(sorted(expected)))
                .withValues(sorted(expected), sorted(actual))
                .withDiff(diff);
    }

    /**
     * Every key/value pair of {@code subset} is present with a deep-equal value in {@code superset}.
     * For non-map collections every element of {@code subset} must be contained in {@code superset}.
     */
    public static MatchResult isSubsetOf(Object subset, Object superset) {
        String sub = ValueFormatter.format(subset);
        String sup = ValueFormatter.format(superset);
        String diff = null;
        if (subset instanceof Map<?, ?> left && superset instanceof Map<?, ?> right) {
            for (Map.Entry<?, ?> e : left.entrySet()) {
                if (!Containers.containsKey(right, e.getKey())) {
                    diff = "missing key " + ValueFormatter.format(e.getKey());
                    break;
                }
                String d = DeepEquality.difference(right.get(e.getKey()), e.getValue(), 0.0);
                if (d != null) {
                    diff = "key " + ValueFormatter.format(e.getKey()) + " differs " + d;
                    break;
                }
            }
        } else if (Containers.isContainer(subset) && !Containers.isMap(subset)
                && Containers.isContainer(superset) && !Containers.isMap(superset)) {
            List<Object> pool = Containers.elements(superset);
            for (Object element : Containers.elements(subset)) {
                if (pool.stream().noneMatch(v -> DeepEquality.deepEquals(v, element))) {
                    diff = "missing element " + ValueFormatter.format(element);
                    break;
                }
            }
        } else {
            return MatchResult.uninterpretable("expected two maps or two collections for subset check, got "
                    + ValueFormatter.typeName(subset) + " and " + ValueFormatter.typeName(superset));
        }
        return MatchResult.of(diff == null,
                        "expected " + sub + " to be a subset of " + sup,
                        "expected " + sub + " to not be a subset of " + sup)
                .withDiff(diff);
    }

    /** String length, collection/map size or array length. */
    public static MatchResult hasLength(Object value, int expected) {
        int actual;
        if (value instanceof CharSequence s) {
            actual = s.length();
        } else if (Containers.isContainer(value)) {
            actual = Containers.size(value);
        } else {
            return MatchResult.uninterpretable("expected a string or container to measure, got " + ValueFormatter.typeName(value));
        }
        return MatchResult.of(actual == expected,
                        "expected " + ValueFormatter.format(value) + " to have length " + expected + ", got " + actual,
                        "expected " + ValueFormatter.format(value) + " to not have length " + expected)
                .withValues(expected, actual);
    }

    /**
     * A map key or record component named {@code name}; when {@code checkValue} is set its value
     * must also deep-equal {@code expectedValue}.
     */
    public static MatchResult hasProperty(Object value, String name, boolean checkValue, Object expectedValue) {
        Object actualValue = property(value, name);
        String v = ValueFormatter.format(value);
        if (actualValue == Missing.INSTANCE) {
            return MatchResult.of(false,
                    "expected " + v + " to have property \"" + name + "\"",
                    "expected " + v + " to not have property \"" + name + "\"");
        }
        if (!checkValue) {
            return MatchResult.of(true,
                    "expected " + v + " to have property \"" + name + "\"",
                    "expected " + v + " to not have property \"" + name + "\"");
        }
        String e = ValueFormatter.format(expectedValue);
        return MatchResult.of(DeepEquality.deepEquals(actualValue, expectedValue),
                        "expected property \"" + name + "\" to equal " + e + ", got " + ValueFormatter.format(actualValue),
                        "expected property \"" + name + "\" to not equal " + e)
                .withValues(expectedValue, actualValue);
    }

    private static Object property(Object value, String name) {
        if (value instanceof Map<?, ?> map) {
            return Containers.containsKey(map, name) ? map.get(name) : Missing.INSTANCE;
        }
        if (value != null && value.getClass().isRecord()) {
            for (RecordComponent rc : value.getClass().getRecordComponents()) {
                if (rc.getName().equals(name)) {
                    try {
                        return rc.getAccessor().invoke(value);
                    } catch (ReflectiveOperationException | RuntimeException e) {
                        return Missing.INSTANCE;
                    }
                }
            }
        }
        return Missing.INSTANCE;
    }

    /** Child of a container by key (maps) or by index (sequences; numeric strings allowed). */
    private static Object lookup(Object container, Object key) {
        if (container instanceof Map<?, ?> map) {
            if (Containers.containsKey(map, key)) return map.get(key);
            return Missing.INSTANCE;
        }
        if (Containers.isSequence(container)) {
            Integer index = asIndex(key);
            List<Object> elements = Containers.elements(container);
            if (index != null && index >= 0 && index < elements.size()) {
                return elements.get(index);
            }
        }
        return Missing.INSTANCE;
    }

    private static Integer asIndex(Object key) {
        if (key instanceof Integer i) return i;
        if (key instanceof CharSequence s) {
            try {
                return Integer.parseInt(s.toString());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static List<Object> sorted(Set<Object> values) {
        var strings = new TreeSet<String>();
        var out = new ArrayList<Object>();
        for (Object o : values) strings.add(String.valueOf(o));
        out.addAll(strings);
        return out;
    }

    private enum Missing { INSTANCE }
}
