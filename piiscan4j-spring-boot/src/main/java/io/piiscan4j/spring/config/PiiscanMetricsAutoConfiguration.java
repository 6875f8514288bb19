/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.spring.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.piiscan4j.spring.MicrometerReporter;
import io.piiscan4j.spring.PiiscanProperties;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/** Micrometer-backed {@link MicrometerReporter} when a {@link MeterRegistry} is available. */
@AutoConfiguration(
        before = PiiscanAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(PiiscanProperties.class)
@ConditionalOnProperty(prefix = "piiscan4j", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnClass(MeterRegistry.class)
public class PiiscanMetricsAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean
    public MicrometerReporter piiscanMicrometerReporter(MeterRegistry registry, PiiscanProperties props) {
        return new MicrometerReporter(registry, props.getMetrics().getRecentCapacity());
    }
}
