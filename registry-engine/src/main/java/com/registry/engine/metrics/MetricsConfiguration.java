package com.registry.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the entity registry.
 *
 * Configures:
 * - Common tags for all metrics
 * - The registry metrics binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "entity-registry");
    }

    @Bean
    public RegistryMetrics registryMetrics() {
        return new RegistryMetrics();
    }
}
