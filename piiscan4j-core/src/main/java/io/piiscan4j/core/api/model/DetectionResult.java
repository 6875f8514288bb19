/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

import java.util.List;

/**
 * Output of a single pattern detector.
 *
 * @param rejectedCandidates shape matches that failed validation (check digits, Luhn, phone grammar)
 */
public record DetectionResult(boolean found, List<Span> spans, List<Span> rejectedCandidates) {

    public DetectionResult {
        spans = List.copyOf(spans);
        rejectedCandidates = List.copyOf(rejectedCandidates);
    }

    public static DetectionResult empty() {
        return new DetectionResult(false, List.of(), List.of());
    }

    public static DetectionResult of(List<Span> spans, List<Span> rejectedCandidates) {
        return new DetectionResult(!spans.isEmpty(), spans, rejectedCandidates);
    }

    public int rejected() {
        return rejectedCandidates.size();
    }
}
