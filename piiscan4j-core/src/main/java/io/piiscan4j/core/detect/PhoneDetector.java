/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.Detector;
import io.piiscan4j.core.api.DetectorUnavailableException;
import io.piiscan4j.core.api.model.DetectionResult;
import io.piiscan4j.core.api.model.DetectorKind;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.api.model.SpanSource;
import io.piiscan4j.core.phone.PhoneValidator;
import io.piiscan4j.core.phone.PhoneValidation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds phone-shaped candidates (optional +55, optional area code, 8 or 9 digit subscriber number)
 * and keeps only those the {@link PhoneValidator} accepts for the configured region.
 *
 * <p>A validator failure aborts this detector for the record with {@link DetectorUnavailableException}.
 */
public final class PhoneDetector implements Detector {
    private static final Pattern CANDIDATE = Pattern.compile(
            "(?<![\\d+])(?:\\+?55[\\s-]?)?(?:\\(?\\d{2}\\)?[\\s-]?)?(?:9\\s?\\d{4}|\\d{4})[-.\\s]?\\d{4}(?!\\d)");

    private final PhoneValidator validator;
    private final String region;

    public PhoneDetector(PhoneValidator validator, String region) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.region = Objects.requireNonNull(region, "region");
    }

    @Override
    public PiiType type() {
        return PiiType.PHONE;
    }

    @Override
    public DetectionResult detect(String text) {
        if (text == null || text.isEmpty()) return DetectionResult.empty();
        Matcher m = CANDIDATE.matcher(text);
        List<Span> spans = new ArrayList<>();
        List<Span> rejected = new ArrayList<>();
        while (m.find()) {
            Span span = Span.of(text, m.start(), m.end(), PiiType.PHONE, SpanSource.PATTERN);
            if (validate(m.group()).valid()) {
                spans.add(span);
            } else {
                rejected.add(span);
            }
        }
        return DetectionResult.of(spans, rejected);
    }

    private PhoneValidation validate(String candidate) {
        try {
            PhoneValidation v = validator.validate(candidate, region);
            return v == null ? PhoneValidation.invalid() : v;
        } catch (RuntimeException e) {
            throw new DetectorUnavailableException(DetectorKind.PHONE_VALIDATOR, "Phone validator failed", e);
        }
    }
}
