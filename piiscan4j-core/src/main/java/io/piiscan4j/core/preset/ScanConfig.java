/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.preset;

import io.piiscan4j.core.api.model.PiiType;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Engine configuration.
 *
 * @param enabledTypes         PII types to detect; model types are honoured by the entity adapter
 * @param phoneRegion          ISO 3166 region hint passed to the phone validator
 * @param highVolumeThreshold  e-mail/phone count above which a scope is at least ALTO
 * @param maskChar             replacement for alphanumerics inside a span
 * @param entityLabels         recognizer label (upper-case) to PII type
 * @param minPersonNameTokens  person spans with fewer whitespace-separated tokens are dropped
 * @param recordTimeout        per-record deadline in batch mode; null means none
 * @param workerThreads        batch worker pool size
 */
public record ScanConfig(
        Set<PiiType> enabledTypes,
        String phoneRegion,
        int highVolumeThreshold,
        char maskChar,
        Map<String, PiiType> entityLabels,
        int minPersonNameTokens,
        Duration recordTimeout,
        int workerThreads) {

    public static final String DEFAULT_PHONE_REGION = "BR";
    public static final int DEFAULT_HIGH_VOLUME_THRESHOLD = 10;
    public static final char DEFAULT_MASK_CHAR = 'x';

    public ScanConfig {
        enabledTypes = (enabledTypes == null || enabledTypes.isEmpty())
                ? Set.copyOf(EnumSet.allOf(PiiType.class))
                : Set.copyOf(enabledTypes);
        phoneRegion = (phoneRegion == null || phoneRegion.isBlank())
                ? DEFAULT_PHONE_REGION
                : phoneRegion.trim().toUpperCase(Locale.ROOT);
        if (highVolumeThreshold < 0) {
            throw new IllegalArgumentException("highVolumeThreshold must be >= 0: " + highVolumeThreshold);
        }
        if (Character.isDigit(maskChar) || Character.isWhitespace(maskChar)) {
            throw new IllegalArgumentException("maskChar must not be a digit or whitespace: " + maskChar);
        }
        entityLabels = normalizeLabels(entityLabels == null || entityLabels.isEmpty() ? defaultLabels() : entityLabels);
        minPersonNameTokens = Math.max(1, minPersonNameTokens);
        if (recordTimeout != null && (recordTimeout.isNegative() || recordTimeout.isZero())) recordTimeout = null;
        workerThreads = Math.max(1, workerThreads);
    }

    public static ScanConfig defaults() {
        return new ScanConfig(
                EnumSet.allOf(PiiType.class),
                DEFAULT_PHONE_REGION,
                DEFAULT_HIGH_VOLUME_THRESHOLD,
                DEFAULT_MASK_CHAR,
                defaultLabels(),
                1,
                null,
                Runtime.getRuntime().availableProcessors());
    }

    /** Labels emitted by common recognizers (spaCy pt, CoNLL, OntoNotes). */
    public static Map<String, PiiType> defaultLabels() {
        return Map.of(
                "PER", PiiType.PERSON_NAME,
                "PERSON", PiiType.PERSON_NAME,
                "PERSON_NAME", PiiType.PERSON_NAME,
                "LOC", PiiType.LOCATION,
                "LOCATION", PiiType.LOCATION,
                "GPE", PiiType.LOCATION);
    }

    public boolean isEnabled(PiiType type) {
        return enabledTypes.contains(type);
    }

    public ScanConfig withEnabledTypes(Set<PiiType> types) {
        return new ScanConfig(types, phoneRegion, highVolumeThreshold, maskChar, entityLabels, minPersonNameTokens, recordTimeout, workerThreads);
    }

    public ScanConfig withPhoneRegion(String region) {
        return new ScanConfig(enabledTypes, region, highVolumeThreshold, maskChar, entityLabels, minPersonNameTokens, recordTimeout, workerThreads);
    }

    public ScanConfig withHighVolumeThreshold(int threshold) {
        return new ScanConfig(enabledTypes, phoneRegion, threshold, maskChar, entityLabels, minPersonNameTokens, recordTimeout, workerThreads);
    }

    public ScanConfig withMaskChar(char c) {
        return new ScanConfig(enabledTypes, phoneRegion, highVolumeThreshold, c, entityLabels, minPersonNameTokens, recordTimeout, workerThreads);
    }

    public ScanConfig withEntityLabels(Map<String, PiiType> labels) {
        return new ScanConfig(enabledTypes, phoneRegion, highVolumeThreshold, maskChar, labels, minPersonNameTokens, recordTimeout, workerThreads);
    }

    public ScanConfig withMinPersonNameTokens(int tokens) {
        return new ScanConfig(enabledTypes, phoneRegion, highVolumeThreshold, maskChar, entityLabels, tokens, recordTimeout, workerThreads);
    }

    public ScanConfig withRecordTimeout(Duration timeout) {
        return new ScanConfig(enabledTypes, phoneRegion, highVolumeThreshold, maskChar, entityLabels, minPersonNameTokens, timeout, workerThreads);
    }

    public ScanConfig withWorkerThreads(int threads) {
        return new ScanConfig(enabledTypes, phoneRegion, highVolumeThreshold, maskChar, entityLabels, minPersonNameTokens, recordTimeout, threads);
    }

    /** Upper-cases and trims label keys so lookups are case-insensitive. */
    public static String normalizeLabel(String label) {
        return label == null ? "" : label.trim().toUpperCase(Locale.ROOT);
    }

    private static Map<String, PiiType> normalizeLabels(Map<String, PiiType> in) {
        Map<String, PiiType> out = new HashMap<>();
        in.forEach((k, v) -> {
            if (k != null && v != null) out.put(normalizeLabel(k), Objects.requireNonNull(v));
        });
        return Map.copyOf(out);
    }
}
