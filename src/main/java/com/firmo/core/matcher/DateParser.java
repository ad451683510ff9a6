package com.firmo.core.matcher;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns date values and common textual date representations into a comparable instant.
 * <p>
 * Values without an offset are read as UTC. The calendar date as written is kept separately
 * so that same-day checks are not shifted by the offset.
 */
public final class DateParser {

    /**
     * @param instant   point in time used for ordering
     * @param localDate calendar date as written in the input
     * @param iso       whether the input was in one of the ISO-8601 layouts
     */
    public record ParsedDate(Instant instant, LocalDate localDate, boolean iso) {

        ParsedDate withLocalDate(LocalDate date) {
            return new ParsedDate(instant, date, iso);
        }
    }

    private static final DateTimeFormatter SHORT_OFFSET =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm[:ss][.SSS]X").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter SPACED =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm[:ss]").withResolverStyle(ResolverStyle.STRICT);
    private static final List<DateTimeFormatter> US_FORMATS = List.of(
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("MM/dd/uuuu HH:mm[:ss]").withResolverStyle(ResolverStyle.STRICT));

    private DateParser() {}

    public static Optional<ParsedDate> parse(Object value) {
        if (value instanceof Instant i) {
            return Optional.of(new ParsedDate(i, i.atOffset(ZoneOffset.UTC).toLocalDate(), true));
        }
        if (value instanceof OffsetDateTime o) {
            return Optional.of(new ParsedDate(o.toInstant(), o.toLocalDate(), true));
        }
        if (value instanceof ZonedDateTime z) {
            return Optional.of(new ParsedDate(z.toInstant(), z.toLocalDate(), true));
        }
        if (value instanceof LocalDateTime l) {
            return Optional.of(new ParsedDate(l.toInstant(ZoneOffset.UTC), l.toLocalDate(), true));
        }
        if (value instanceof LocalDate d) {
            return Optional.of(new ParsedDate(d.atStartOfDay(ZoneOffset.UTC).toInstant(), d, true));
        }
        if (value instanceof Date d) {
            Instant i = d.toInstant();
            return Optional.of(new ParsedDate(i, i.atOffset(ZoneOffset.UTC).toLocalDate(), false));
        }
        if (value instanceof CharSequence s) {
            return parseText(s.toString().trim());
        }
        return Optional.empty();
    }

    public static Optional<ParsedDate> parseIso(Object value) {
        if (!(value instanceof CharSequence)) return Optional.empty();
        return parse(value).filter(ParsedDate::iso);
    }

    private static final List<Function<String, ParsedDate>> LAYOUTS = List.of(
            text -> offset(OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME)),
            text -> offset(OffsetDateTime.parse(text, SHORT_OFFSET)),
            text -> utc(LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME), true),
            text -> {
                LocalDate d = LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
                return new ParsedDate(d.atStartOfDay(ZoneOffset.UTC).toInstant(), d, true);
            },
            text -> utc(LocalDateTime.parse(text, SPACED), false),
            text -> usDate(text, US_FORMATS.get(0)),
            text -> usDate(text, US_FORMATS.get(1)));

    private static Optional<ParsedDate> parseText(String text) {
        if (text.isEmpty()) return Optional.empty();
        for (Function<String, ParsedDate> layout : LAYOUTS) {
            try {
                return Optional.of(layout.apply(text));
            } catch (DateTimeException e) {
                continue;
            }
        }
        return Optional.empty();
    }

    private static ParsedDate offset(OffsetDateTime o) {
        return new ParsedDate(o.toInstant(), o.toLocalDate(), true);
    }

    private static ParsedDate utc(LocalDateTime l, boolean iso) {
        return new ParsedDate(l.toInstant(ZoneOffset.UTC), l.toLocalDate(), iso);
    }

    private static ParsedDate usDate(String text, DateTimeFormatter format) {
        TemporalAccessor parsed = format.parse(text);
        LocalDate d = LocalDate.from(parsed);
        LocalDateTime l = parsed.isSupported(ChronoField.HOUR_OF_DAY) ? LocalDateTime.from(parsed) : d.atStartOfDay();
        return utc(l, false).withLocalDate(d);
    }
}
