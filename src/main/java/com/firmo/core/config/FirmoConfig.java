package com.firmo.core.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the resolved settings and a fallback meter registry into the context.
 */
@Configuration
public class FirmoConfig {

    @Bean
    public FirmoSettings firmoSettings(FirmoProperties properties) {
        return properties.toSettings();
    }

    /** Used when no metrics backend (actuator, registry starter) contributes one. */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
