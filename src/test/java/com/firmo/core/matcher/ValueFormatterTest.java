package com.firmo.core.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueFormatterTest {

    @Test
    @DisplayName("quotes strings and characters")
    void scalars() {
        assertEquals("\"x\"", ValueFormatter.format("x"));
        assertEquals("'c'", ValueFormatter.format('c'));
        assertEquals("null", ValueFormatter.format(null));
        assertEquals("42", ValueFormatter.format(42));
    }

    @Test
    @DisplayName("expands lists, arrays and maps")
    void containers() {
        assertEquals("[1, \"a\"]", ValueFormatter.format(List.of(1, "a")));
        assertEquals("[1, 2]", ValueFormatter.format(new int[]{1, 2}));
        assertEquals("{\"k\"=[true]}", ValueFormatter.format(Map.of("k", List.of(true))));
    }

    @Test
    @DisplayName("prints self-references as <cycle>")
    void cycle() {
        List<Object> list = new ArrayList<>();
        list.add(1);
        list.add(list);
        assertEquals("[1, <cycle>]", ValueFormatter.format(list));
    }

    @Test
    @DisplayName("truncates deep nesting")
    void depth() {
        Object nested = List.of(List.of(List.of(List.of(List.of(1)))));
        assertEquals("[[[[[...]]]]]", ValueFormatter.format(nested));
    }

    @Test
    @DisplayName("typeName uses the simple class name")
    void typeName() {
        assertEquals("String", ValueFormatter.typeName("s"));
        assertEquals("null", ValueFormatter.typeName(null));
    }
}
