package com.firmo.core.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FirmoPropertiesTest {

    @Test
    void defaultValues() {
        var props = new FirmoProperties();
        assertEquals(1000, props.getDefaultTimeoutMs());
        assertEquals(10, props.getPollIntervalMs());
        assertEquals(1e-9, props.getTolerance());
        assertEquals(0, props.getCaseTimeoutMs());
        assertEquals(FirmoSettings.defaults(), props.toSettings());
    }

    @Test
    void nestedSettersFlowIntoSettings() {
        var props = new FirmoProperties();
        props.getAsync().setDefaultTimeoutMs(300);
        props.getAsync().setPollIntervalMs(20);
        props.getMatchers().setTolerance(0.5);
        props.getRun().setCaseTimeoutMs(5000);

        assertEquals(new FirmoSettings(300, 20, 0.5, 5000), props.toSettings());
    }

    @Test
    void bindsKebabCaseKeys() {
        var source = new MapConfigurationPropertySource(Map.of(
                "firmo.async.default-timeout-ms", "750",
                "firmo.matchers.tolerance", "0.001",
                "firmo.run.case-timeout-ms", "100"));

        FirmoProperties props = new Binder(source).bind("firmo", FirmoProperties.class).get();

        assertEquals(750, props.getDefaultTimeoutMs());
        assertEquals(0.001, props.getTolerance());
        assertEquals(100, props.getCaseTimeoutMs());
        assertEquals(10, props.getPollIntervalMs());
    }

    @Test
    void invalidValuesFailWhenResolved() {
        var props = new FirmoProperties();
        props.getAsync().setPollIntervalMs(0);

        assertThrows(IllegalArgumentException.class, props::toSettings);
    }
}
