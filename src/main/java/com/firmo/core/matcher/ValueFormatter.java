package com.firmo.core.matcher;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

/**
 * Renders arbitrary values for failure messages. Strings are quoted, containers are
 * expanded up to a fixed depth and self-references print as {@code <cycle>}.
 */
public final class ValueFormatter {

    private static final int MAX_DEPTH = 4;
    private static final int MAX_ELEMENTS = 20;

    private ValueFormatter() {}

    public static String format(Object value) {
        var sb = new StringBuilder();
        append(sb, value, 0, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    /** Short type label used in "got X" explanations. */
    public static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static void append(StringBuilder sb, Object value, int depth, Set<Object> seen) {
        if (value == null) {
            sb.append("null");
            return;
        }
        if (value instanceof CharSequence cs) {
            sb.append('"').append(cs).append('"');
            return;
        }
        if (value instanceof Character c) {
            sb.append('\'').append(c).append('\'');
            return;
        }
        boolean container = value instanceof Map<?, ?> || value instanceof Collection<?> || value.getClass().isArray();
        if (!container) {
            sb.append(value);
            return;
        }
        if (!seen.add(value)) {
            sb.append("<cycle>");
            return;
        }
        try {
            if (depth >= MAX_DEPTH) {
                sb.append(value instanceof Map<?, ?> ? "{...}" : "[...]");
                return;
            }
            if (value instanceof Map<?, ?> map) {
                sb.append('{');
                int n = 0;
                for (Map.Entry<?, ?> e : map.entrySet()) {
                    if (n > 0) sb.append(", ");
                    if (n++ == MAX_ELEMENTS) {
                        sb.append("...");
                        break;
                    }
                    append(sb, e.getKey(), depth + 1, seen);
                    sb.append('=');
                    append(sb, e.getValue(), depth + 1, seen);
                }
                sb.append('}');
            } else {
                sb.append('[');
                Iterator<?> it = elements(value);
                int n = 0;
                while (it.hasNext()) {
                    if (n > 0) sb.append(", ");
                    if (n++ == MAX_ELEMENTS) {
                        sb.append("...");
                        break;
                    }
                    append(sb, it.next(), depth + 1, seen);
                }
                sb.append(']');
            }
        } finally {
            seen.remove(value);
        }
    }

    private static Iterator<?> elements(Object value) {
        if (value instanceof Collection<?> c) {
            return c.iterator();
        }
        int length = Array.getLength(value);
        return new Iterator<>() {
            private int i = 0;

            @Override
            public boolean hasNext() {
                return i < length;
            }

            @Override
            public Object next() {
                return Array.get(value, i++);
            }
        };
    }
}
