/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api;

import io.piiscan4j.core.anonymize.Anonymizer;
import io.piiscan4j.core.api.model.DetectorKind;
import io.piiscan4j.core.api.model.RecordInput;
import io.piiscan4j.core.api.model.RecordResult;
import io.piiscan4j.core.api.model.RecordStatus;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.detect.PatternScan;
import io.piiscan4j.core.detect.PatternScanner;
import io.piiscan4j.core.ner.EntityRecognizer;
import io.piiscan4j.core.ner.EntityRecognizerAdapter;
import io.piiscan4j.core.phone.LibPhoneNumberValidator;
import io.piiscan4j.core.phone.PhoneValidator;
import io.piiscan4j.core.preset.DetectorRegistry;
import io.piiscan4j.core.preset.ScanConfig;
import io.piiscan4j.core.resolve.SpanResolver;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-record pipeline: pattern detection, entity detection, span resolution, masking.
 *
 * <p>{@link #scan} depends only on the record text and immutable collaborators, so one instance can
 * serve any number of threads. Collaborator failures degrade the record to
 * {@link RecordStatus#PARTIAL} instead of failing it.
 */
@Slf4j
public final class PiiScanner {
    private final PatternScanner patterns;
    private final EntityRecognizerAdapter entities;
    private final SpanResolver resolver;
    private final Anonymizer anonymizer;

    public PiiScanner(
            PatternScanner patterns, EntityRecognizerAdapter entities, SpanResolver resolver, Anonymizer anonymizer) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
        this.entities = Objects.requireNonNull(entities, "entities");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.anonymizer = Objects.requireNonNull(anonymizer, "anonymizer");
    }

    /** Wires the default components from {@code cfg}. */
    public static PiiScanner create(ScanConfig cfg, EntityRecognizer recognizer, PhoneValidator phoneValidator) {
        var registry = new DetectorRegistry(phoneValidator);
        return new PiiScanner(
                registry.scanner(cfg),
                new EntityRecognizerAdapter(recognizer, cfg),
                new SpanResolver(),
                new Anonymizer(cfg.maskChar()));
    }

    /** Defaults with libphonenumber and the given recognizer. */
    public static PiiScanner create(ScanConfig cfg, EntityRecognizer recognizer) {
        return create(cfg, recognizer, new LibPhoneNumberValidator());
    }

    public RecordResult scan(RecordInput input) {
        return scan(input.recordId(), input.text());
    }

    public RecordResult scan(String recordId, String text) {
        Objects.requireNonNull(recordId, "recordId");
        if (text == null || text.isEmpty()) {
            return new RecordResult(
                    recordId, 0, text == null ? "" : text, null, false, null, null, RecordStatus.COMPLETE);
        }

        PatternScan patternScan = patterns.detectPatterns(text);
        Set<DetectorKind> unavailable = EnumSet.noneOf(DetectorKind.class);
        unavailable.addAll(patternScan.unavailable());

        List<Span> modelSpans;
        try {
            modelSpans = entities.detectEntities(text);
        } catch (DetectorUnavailableException e) {
            log.warn("Record {}: {} unavailable, continuing with pattern findings only", recordId, e.kind(), e);
            unavailable.add(e.kind());
            modelSpans = List.of();
        }

        List<Span> resolved = resolver.resolve(patternScan.spans(), modelSpans);
        Anonymizer.Anonymized masked = anonymizer.anonymize(text, resolved);

        RecordStatus status = unavailable.isEmpty() ? RecordStatus.COMPLETE : RecordStatus.PARTIAL;
        RecordResult result = new RecordResult(
                recordId,
                text.length(),
                masked.text(),
                masked.counts(),
                masked.hasPii(),
                patternScan.rejected(),
                unavailable,
                status);
        if (log.isDebugEnabled()) {
            log.debug("Record {}: status={} counts={} rejected={}", recordId, status, result.piiCounts(), result.rejectedCandidates());
        }
        return result;
    }
}
