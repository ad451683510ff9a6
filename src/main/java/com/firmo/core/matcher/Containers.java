package com.firmo.core.matcher;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shape classification shared by the equality and containment matchers.
 * Maps are keyed containers, sets are unordered, lists/arrays/other collections are sequences.
 */
final class Containers {

    private Containers() {}

    static boolean isMap(Object value) {
        return value instanceof Map<?, ?>;
    }

    static boolean isSet(Object value) {
        return value instanceof Set<?>;
    }

    static boolean isSequence(Object value) {
        return value != null && !isSet(value)
                && (value instanceof Collection<?> || value.getClass().isArray());
    }

    static boolean isContainer(Object value) {
        return isMap(value) || value instanceof Collection<?> || (value != null && value.getClass().isArray());
    }

    /**
     * Key membership that tolerates maps rejecting the key, such as immutable maps with a null key
     * or sorted maps with a key of a foreign type. A map that cannot hold the key does not contain it.
     */
    static boolean containsKey(Map<?, ?> map, Object key) {
        try {
            return map.containsKey(key);
        } catch (NullPointerException | ClassCastException e) {
            return false;
        }
    }

    /** Elements of a collection or (primitive or reference) array, in iteration order. */
    static List<Object> elements(Object value) {
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        int length = Array.getLength(value);
        var list = new ArrayList<Object>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(value, i));
        }
        return list;
    }

    static int size(Object value) {
        if (value instanceof Map<?, ?> m) return m.size();
        if (value instanceof Collection<?> c) return c.size();
        return Array.getLength(value);
    }
}
