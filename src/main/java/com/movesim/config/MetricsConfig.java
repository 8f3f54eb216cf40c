package com.movesim.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application name. Applied through a customizer so the tag is in
 * place before {@link com.movesim.observability.SimulationMetrics} registers its meters.
 */
@Configuration
public class MetricsConfig {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> applicationTagCustomizer(
            @Value("${spring.application.name:movesim}") String applicationName) {
        return registry -> registry.config().commonTags("application", applicationName);
    }
}
