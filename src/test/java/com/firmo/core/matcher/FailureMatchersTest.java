package com.firmo.core.matcher;

import com.firmo.core.expect.ExpectationUsageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class FailureMatchersTest {

    @Nested
    @DisplayName("fails")
    class FailsTests {

        @Test
        @DisplayName("detects checked and unchecked errors")
        void detects() {
            assertTrue(FailureMatchers.fails(() -> { throw new IOException("x"); }).matched());
            assertTrue(FailureMatchers.fails(() -> { throw new IllegalStateException(); }).matched());
            assertFalse(FailureMatchers.fails(() -> { }).matched());
        }

        @Test
        @DisplayName("negated message names what was raised")
        void negatedMessage() {
            MatchResult r = FailureMatchers.fails(() -> { throw new IOException("disk"); });
            assertEquals("expected function to not fail, but it raised IOException: disk", r.negatedMessage());
        }

        @Test
        @DisplayName("runs the block exactly once")
        void runsOnce() {
            var calls = new AtomicInteger();
            FailureMatchers.fails(calls::incrementAndGet);
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("JVM errors are never treated as expected failures")
        void virtualMachineError() {
            assertThrows(OutOfMemoryError.class,
                    () -> FailureMatchers.fails(() -> { throw new OutOfMemoryError("simulated"); }));
        }

        @Test
        @DisplayName("a malformed assertion in the block propagates")
        void usageError() {
            assertThrows(ExpectationUsageException.class,
                    () -> FailureMatchers.fails(() -> { throw new ExpectationUsageException("tolerance must not be negative"); }));
        }

        @Test
        @DisplayName("an interrupt raised by the block restores the interrupt flag")
        void interrupt() {
            assertTrue(FailureMatchers.fails(() -> { throw new InterruptedException(); }).matched());
            assertTrue(Thread.interrupted());
        }
    }

    @Nested
    @DisplayName("failsWith")
    class FailsWithTests {

        @Test
        @DisplayName("matches the message against a regex")
        void message() {
            assertTrue(FailureMatchers.failsWith(
                    () -> { throw new IllegalArgumentException("bad input 42"); }, "input \\d+").matched());
            assertFalse(FailureMatchers.failsWith(
                    () -> { throw new IllegalArgumentException("bad input"); }, "^input").matched());
        }

        @Test
        @DisplayName("falls back to the class name when there is no message")
        void classNameFallback() {
            assertTrue(FailureMatchers.failsWith(
                    () -> { throw new IllegalStateException(); }, "IllegalState").matched());
        }

        @Test
        @DisplayName("a block that does not fail is a non-match")
        void noFailure() {
            MatchResult r = FailureMatchers.failsWith(() -> { }, "boom");
            assertFalse(r.matched());
            assertTrue(r.message().endsWith("but it did not fail"));
        }

        @Test
        @DisplayName("an invalid regex does not run the block")
        void invalidRegex() {
            var calls = new AtomicInteger();
            MatchResult r = FailureMatchers.failsWith(calls::incrementAndGet, "[");
            assertFalse(r.matched());
            assertEquals(0, calls.get());
        }
    }

    @Nested
    @DisplayName("throwsType")
    class ThrowsTypeTests {

        @Test
        @DisplayName("accepts subclasses of the expected type")
        void subclass() {
            assertTrue(FailureMatchers.throwsType(
                    () -> { throw new IllegalArgumentException(); }, RuntimeException.class).matched());
        }

        @Test
        @DisplayName("names the type actually thrown")
        void wrongType() {
            MatchResult r = FailureMatchers.throwsType(
                    () -> { throw new IllegalStateException("state"); }, IOException.class);
            assertFalse(r.matched());
            assertEquals("expected function to throw IOException, but it threw IllegalStateException: state",
                    r.message());
        }

        @Test
        @DisplayName("a block that does not throw is a non-match")
        void noThrow() {
            assertFalse(FailureMatchers.throwsType(() -> { }, RuntimeException.class).matched());
        }
    }
}
