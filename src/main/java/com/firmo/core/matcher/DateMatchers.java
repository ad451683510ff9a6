package com.firmo.core.matcher;

import com.firmo.core.matcher.DateParser.ParsedDate;

import java.util.Optional;

/**
 * Chronological predicates. Either side may be a {@code java.time} value, a {@link java.util.Date}
 * or a string in a layout {@link DateParser} understands; anything else is a non-match.
 */
public final class DateMatchers {

    private DateMatchers() {}

    public static MatchResult isDate(Object value) {
        String v = ValueFormatter.format(value);
        return MatchResult.of(DateParser.parse(value).isPresent(),
                "expected " + v + " to be a valid date",
                "expected " + v + " to not be a valid date");
    }

    public static MatchResult isIsoDate(Object value) {
        String v = ValueFormatter.format(value);
        return MatchResult.of(DateParser.parseIso(value).isPresent(),
                "expected " + v + " to be an ISO-8601 date",
                "expected " + v + " to not be an ISO-8601 date");
    }

    public static MatchResult before(Object actual, Object other) {
        return ordered(actual, other, "before", c -> c < 0);
    }

    public static MatchResult after(Object actual, Object other) {
        return ordered(actual, other, "after", c -> c > 0);
    }

    /** Calendar date as written, time-of-day ignored. */
    public static MatchResult sameDay(Object actual, Object other) {
        Optional<ParsedDate> a = DateParser.parse(actual);
        Optional<ParsedDate> b = DateParser.parse(other);
        if (a.isEmpty() || b.isEmpty()) {
            return unparseable(a.isEmpty() ? actual : other);
        }
        String x = ValueFormatter.format(actual);
        String y = ValueFormatter.format(other);
        return MatchResult.of(a.get().localDate().equals(b.get().localDate()),
                        "expected " + x + " to be the same day as " + y,
                        "expected " + x + " to not be the same day as " + y)
                .withValues(b.get().localDate(), a.get().localDate());
    }

    /** Inclusive on both bounds. */
    public static MatchResult betweenDates(Object actual, Object start, Object end) {
        return betweenDates(actual, start, end, true);
    }

    public static MatchResult betweenDates(Object actual, Object start, Object end, boolean inclusive) {
        Optional<ParsedDate> a = DateParser.parse(actual);
        Optional<ParsedDate> s = DateParser.parse(start);
        Optional<ParsedDate> e = DateParser.parse(end);
        if (a.isEmpty()) return unparseable(actual);
        if (s.isEmpty()) return unparseable(start);
        if (e.isEmpty()) return unparseable(end);
        int low = a.get().instant().compareTo(s.get().instant());
        int high = a.get().instant().compareTo(e.get().instant());
        boolean within = inclusive ? low >= 0 && high <= 0 : low > 0 && high < 0;
        String range = ValueFormatter.format(start) + " and " + ValueFormatter.format(end);
        String x = ValueFormatter.format(actual);
        return MatchResult.of(within,
                "expected " + x + " to be between " + range,
                "expected " + x + " to not be between " + range);
    }

    private static MatchResult ordered(Object actual, Object other, String relation,
                                       java.util.function.IntPredicate test) {
        Optional<ParsedDate> a = DateParser.parse(actual);
        Optional<ParsedDate> b = DateParser.parse(other);
        if (a.isEmpty() || b.isEmpty()) {
            return unparseable(a.isEmpty() ? actual : other);
        }
        String x = ValueFormatter.format(actual);
        String y = ValueFormatter.format(other);
        return MatchResult.of(test.test(a.get().instant().compareTo(b.get().instant())),
                        "expected " + x + " to be " + relation + " " + y,
                        "expected " + x + " to not be " + relation + " " + y)
                .withValues(b.get().instant(), a.get().instant());
    }

    private static MatchResult unparseable(Object value) {
        return MatchResult.uninterpretable("cannot interpret " + ValueFormatter.format(value) + " as a date");
    }
}
