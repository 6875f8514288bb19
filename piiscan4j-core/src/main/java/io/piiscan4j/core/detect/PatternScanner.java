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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs every registered pattern detector over a record and settles collisions that start at the
 * same offset: the longest candidate wins, equal lengths go to the higher-priority type.
 * Candidates with different starts are left to the span resolver.
 */
@Slf4j
public final class PatternScanner {
    private static final Comparator<Span> BEST_AT_OFFSET = Comparator.comparingInt(Span::length)
            .reversed()
            .thenComparing(Span::type, PiiType.PRIORITY);

    private final List<Detector> detectors;

    public PatternScanner(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public List<Detector> detectors() {
        return detectors;
    }

    public PatternScan detectPatterns(String text) {
        if (text == null || text.isEmpty()) return PatternScan.empty();

        List<Span> all = new ArrayList<>();
        List<Span> failedValidation = new ArrayList<>();
        Set<DetectorKind> unavailable = EnumSet.noneOf(DetectorKind.class);
        for (Detector d : detectors) {
            DetectionResult r;
            try {
                r = d.detect(text);
            } catch (DetectorUnavailableException e) {
                log.warn("{} detector unavailable ({}): {}", d.type(), e.kind(), e.getMessage());
                unavailable.add(e.kind());
                continue;
            }
            if (r.found()) all.addAll(r.spans());
            failedValidation.addAll(r.rejectedCandidates());
        }
        return new PatternScan(bestPerStart(all), countRejected(failedValidation, all), unavailable);
    }

    /** A rejected candidate inside an accepted match of a higher-priority type is not counted. */
    private static Map<PiiType, Integer> countRejected(List<Span> failedValidation, List<Span> accepted) {
        Map<PiiType, Integer> rejected = new EnumMap<>(PiiType.class);
        for (Span r : failedValidation) {
            boolean shadowed = accepted.stream().anyMatch(a -> a.overlaps(r) && a.type().rank() < r.type().rank());
            if (!shadowed) rejected.merge(r.type(), 1, Integer::sum);
        }
        return rejected;
    }

    private static List<Span> bestPerStart(List<Span> spans) {
        if (spans.size() <= 1) return spans;
        Map<Integer, Span> best = new LinkedHashMap<>();
        for (Span s : spans) {
            best.merge(s.start(), s, (a, b) -> BEST_AT_OFFSET.compare(a, b) <= 0 ? a : b);
        }
        List<Span> out = new ArrayList<>(best.values());
        out.sort(Comparator.comparingInt(Span::start));
        return out;
    }
}
