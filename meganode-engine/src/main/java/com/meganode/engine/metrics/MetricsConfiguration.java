package com.meganode.engine.metrics;

import com.meganode.scheduler.RunnerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration for the meganode.
 *
 * {@link RunnerMetrics} is a {@code MeterBinder}, so Spring Boot binds it to the
 * application's registry on startup.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "meganode");
    }

    @Bean
    public RunnerMetrics runnerMetrics() {
        return new RunnerMetrics();
    }
}
