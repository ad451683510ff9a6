package com.firmo.core.matcher;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class DateMatchersTest {

    @Nested
    @DisplayName("parsing")
    class ParsingTests {

        @Test
        @DisplayName("accepts ISO, spaced and US layouts")
        void layouts() {
            assertTrue(DateMatchers.isDate("2024-03-15").matched());
            assertTrue(DateMatchers.isDate("2024-03-15T10:30:00Z").matched());
            assertTrue(DateMatchers.isDate("2024-03-15T10:30:00+02").matched());
            assertTrue(DateMatchers.isDate("2024-03-15T10:30:00.250").matched());
            assertTrue(DateMatchers.isDate("2024-03-15 10:30").matched());
            assertTrue(DateMatchers.isDate("03/15/2024").matched());
            assertTrue(DateMatchers.isDate("03/15/2024 10:30:15").matched());
        }

        @Test
        @DisplayName("rejects impossible calendar dates and free text")
        void invalid() {
            assertFalse(DateMatchers.isDate("2024-02-30").matched());
            assertFalse(DateMatchers.isDate("13/01/2024").matched());
            assertFalse(DateMatchers.isDate("not a date").matched());
            assertFalse(DateMatchers.isDate("").matched());
            assertFalse(DateMatchers.isDate(42).matched());
        }

        @Test
        @DisplayName("accepts java.time values and java.util.Date")
        void temporalValues() {
            assertTrue(DateMatchers.isDate(LocalDate.of(2024, 1, 1)).matched());
            assertTrue(DateMatchers.isDate(Instant.EPOCH).matched());
            assertTrue(DateMatchers.isDate(new Date(0)).matched());
        }

        @Test
        @DisplayName("only ISO-8601 text counts as an ISO date")
        void isoOnly() {
            assertTrue(DateMatchers.isIsoDate("2024-03-15").matched());
            assertTrue(DateMatchers.isIsoDate("2024-03-15T10:30:00Z").matched());
            assertFalse(DateMatchers.isIsoDate("2024-03-15 10:30").matched());
            assertFalse(DateMatchers.isIsoDate("03/15/2024").matched());
            assertFalse(DateMatchers.isIsoDate(LocalDate.of(2024, 3, 15)).matched());
        }
    }

    @Nested
    @DisplayName("comparison")
    class ComparisonTests {

        @Test
        @DisplayName("before and after")
        void ordering() {
            assertTrue(DateMatchers.before("2024-01-01", "2024-06-01").matched());
            assertFalse(DateMatchers.after("2024-01-01", "2024-06-01").matched());
            assertTrue(DateMatchers.after("2024-06-01", "2024-01-01").matched());
            assertFalse(DateMatchers.before("2024-01-01", "2024-01-01").matched());
        }

        @Test
        @DisplayName("mixes text and temporal values")
        void mixed() {
            assertTrue(DateMatchers.before(Instant.parse("2024-01-01T00:00:00Z"), "2024-01-02").matched());
            assertTrue(DateMatchers.after(ZonedDateTime.of(2024, 5, 1, 0, 0, 0, 0, ZoneOffset.UTC),
                    LocalDate.of(2024, 4, 30)).matched());
        }

        @Test
        @DisplayName("offsets are applied when ordering")
        void offsets() {
            assertTrue(DateMatchers.before("2024-01-01T10:00:00+02:00", "2024-01-01T09:00:00Z").matched());
        }

        @Test
        @DisplayName("same day ignores time of day and keeps the date as written")
        void sameDay() {
            assertTrue(DateMatchers.sameDay("2024-03-15T01:00:00", "2024-03-15T23:59:00").matched());
            assertTrue(DateMatchers.sameDay("2024-03-15T23:30:00-05:00", "2024-03-15").matched());
            assertFalse(DateMatchers.sameDay("2024-03-15", "2024-03-16").matched());
        }

        @Test
        @DisplayName("betweenDates is inclusive by default")
        void between() {
            assertTrue(DateMatchers.betweenDates("2024-03-15", "2024-03-01", "2024-03-31").matched());
            assertTrue(DateMatchers.betweenDates("2024-03-01", "2024-03-01", "2024-03-31").matched());
            assertFalse(DateMatchers.betweenDates("2024-03-01", "2024-03-01", "2024-03-31", false).matched());
            assertFalse(DateMatchers.betweenDates("2024-04-01", "2024-03-01", "2024-03-31").matched());
        }

        @Test
        @DisplayName("unparseable input is a non-match naming the value")
        void unparseable() {
            MatchResult r = DateMatchers.before("garbage", "2024-01-01");
            assertFalse(r.matched());
            assertEquals("cannot interpret \"garbage\" as a date", r.message());

            MatchResult end = DateMatchers.betweenDates("2024-01-05", "2024-01-01", "soon");
            assertEquals("cannot interpret \"soon\" as a date", end.message());
        }
    }
}
