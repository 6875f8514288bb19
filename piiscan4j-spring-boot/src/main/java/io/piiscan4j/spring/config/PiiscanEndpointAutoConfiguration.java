/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.spring.config;

import io.piiscan4j.core.preset.ScanConfig;
import io.piiscan4j.spring.MicrometerReporter;
import io.piiscan4j.spring.PiiscanEndpoint;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = {PiiscanMetricsAutoConfiguration.class, PiiscanAutoConfiguration.class})
@ConditionalOnProperty(prefix = "piiscan4j", name = "enabled", havingValue = "true", matchIfMissing = true)
@ConditionalOnClass(
        name = "org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint")
public class PiiscanEndpointAutoConfiguration {

    @Bean
    @ConditionalOnBean({MicrometerReporter.class, ScanConfig.class})
    @ConditionalOnAvailableEndpoint(endpoint = PiiscanEndpoint.class)
    @ConditionalOnMissingBean
    public PiiscanEndpoint piiscanEndpoint(MicrometerReporter reporter, ScanConfig config) {
        return new PiiscanEndpoint(reporter, config);
    }
}
