package com.firmo.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FirmoSettingsTest {

    @Test
    @DisplayName("defaults match the documented fallbacks")
    void defaults() {
        FirmoSettings settings = FirmoSettings.defaults();
        assertEquals(1000, settings.defaultTimeoutMs());
        assertEquals(10, settings.pollIntervalMs());
        assertEquals(1e-9, settings.tolerance());
        assertEquals(0, settings.caseTimeoutMs());
    }

    @Test
    @DisplayName("withers replace one value")
    void withers() {
        FirmoSettings settings = FirmoSettings.defaults().withDefaultTimeoutMs(250).withPollIntervalMs(5)
                .withTolerance(0.01).withCaseTimeoutMs(2000);
        assertEquals(new FirmoSettings(250, 5, 0.01, 2000), settings);
    }

    @Test
    @DisplayName("rejects out-of-range values")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new FirmoSettings(0, 10, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new FirmoSettings(1000, -1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new FirmoSettings(1000, 10, -0.1, 0));
        assertThrows(IllegalArgumentException.class, () -> new FirmoSettings(1000, 10, Double.NaN, 0));
        assertThrows(IllegalArgumentException.class, () -> new FirmoSettings(1000, 10, 0, -5));
    }
}
