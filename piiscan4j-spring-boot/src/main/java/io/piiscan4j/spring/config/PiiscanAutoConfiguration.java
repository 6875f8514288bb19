/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.spring.config;

import io.piiscan4j.core.api.PiiScanner;
import io.piiscan4j.core.batch.BatchProcessor;
import io.piiscan4j.core.ner.EntityRecognizer;
import io.piiscan4j.core.phone.LibPhoneNumberValidator;
import io.piiscan4j.core.phone.PhoneValidator;
import io.piiscan4j.core.preset.ScanConfig;
import io.piiscan4j.core.report.NoopReporter;
import io.piiscan4j.core.report.Reporter;
import io.piiscan4j.core.risk.RiskClassifier;
import io.piiscan4j.spring.PiiscanProperties;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Builds the scanning engine from {@code piiscan4j.*} properties. Recognizer and phone validator
 * can be replaced by declaring beans of those types; without a recognizer only pattern types are
 * detected. The reporter is the Micrometer one when a meter registry exists, otherwise a no-op.
 */
@AutoConfiguration
@EnableConfigurationProperties(PiiscanProperties.class)
@ConditionalOnProperty(prefix = "piiscan4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PiiscanAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ScanConfig piiscanConfig(PiiscanProperties props) {
        return props.toScanConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public PhoneValidator phoneValidator() {
        return new LibPhoneNumberValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityRecognizer entityRecognizer() {
        return EntityRecognizer.none();
    }

    @Bean
    @ConditionalOnMissingBean
    public RiskClassifier riskClassifier(ScanConfig cfg) {
        return new RiskClassifier(cfg.highVolumeThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    public PiiScanner piiScanner(ScanConfig cfg, EntityRecognizer recognizer, PhoneValidator phoneValidator) {
        return PiiScanner.create(cfg, recognizer, phoneValidator);
    }

    /** Only reached when no metrics reporter was registered before this configuration. */
    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter reporter() {
        return new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchProcessor batchProcessor(
            PiiScanner scanner, RiskClassifier classifier, Reporter reporter, ScanConfig cfg) {
        return new BatchProcessor(scanner, classifier, reporter, cfg);
    }
}
