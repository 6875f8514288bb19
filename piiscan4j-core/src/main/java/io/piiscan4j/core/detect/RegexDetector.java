/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.Detector;
import io.piiscan4j.core.api.model.DetectionResult;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.api.model.SpanSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural detector: every match of the pattern that passes the optional validator becomes a span.
 * Matches that fail the validator are returned as rejected candidates.
 */
public class RegexDetector implements Detector {
    private final PiiType type;
    private final Pattern pattern;
    private final Predicate<String> validator;

    public RegexDetector(PiiType type, String regex) {
        this(type, Pattern.compile(regex), s -> true);
    }

    public RegexDetector(PiiType type, Pattern pattern, Predicate<String> validator) {
        this.type = Objects.requireNonNull(type, "type");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    @Override
    public PiiType type() {
        return type;
    }

    @Override
    public DetectionResult detect(String text) {
        if (text == null || text.isEmpty()) return DetectionResult.empty();
        Matcher m = pattern.matcher(text);
        List<Span> spans = new ArrayList<>();
        List<Span> rejected = new ArrayList<>();
        while (m.find()) {
            if (m.end() == m.start()) continue;
            Span span = Span.of(text, m.start(), m.end(), type, SpanSource.PATTERN);
            if (validator.test(m.group())) {
                spans.add(span);
            } else {
                rejected.add(span);
            }
        }
        return DetectionResult.of(spans, rejected);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + type + "]";
    }
}
