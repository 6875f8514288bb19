/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-record outcome. Immutable; the engine never touches it after returning it.
 *
 * @param piiCounts            accepted spans per type, zero entries omitted
 * @param rejectedCandidates   shape matches per type that failed validation
 * @param unavailableDetectors collaborators that failed while scanning this record
 */
public record RecordResult(
        String recordId,
        int originalLength,
        String anonymizedText,
        Map<PiiType, Integer> piiCounts,
        boolean hasPii,
        Map<PiiType, Integer> rejectedCandidates,
        Set<DetectorKind> unavailableDetectors,
        RecordStatus status) {

    public RecordResult {
        Objects.requireNonNull(recordId, "recordId");
        Objects.requireNonNull(status, "status");
        piiCounts = copyCounts(piiCounts);
        rejectedCandidates = copyCounts(rejectedCandidates);
        unavailableDetectors = unavailableDetectors == null || unavailableDetectors.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(DetectorKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(unavailableDetectors));
    }

    /** Result for a record that could not be processed at all. */
    public static RecordResult failed(String recordId, int originalLength) {
        return new RecordResult(recordId, originalLength, "", Map.of(), false, Map.of(), Set.of(), RecordStatus.FAILED);
    }

    public int count(PiiType type) {
        return piiCounts.getOrDefault(type, 0);
    }

    public int totalPii() {
        int total = 0;
        for (int c : piiCounts.values()) total += c;
        return total;
    }

    /** True when the absence of findings cannot be trusted as "no PII". */
    public boolean isDegraded() {
        return status != RecordStatus.COMPLETE;
    }

    static Map<PiiType, Integer> copyCounts(Map<PiiType, Integer> in) {
        EnumMap<PiiType, Integer> out = new EnumMap<>(PiiType.class);
        if (in != null) {
            in.forEach((type, count) -> {
                if (type != null && count != null && count > 0) out.put(type, count);
            });
        }
        return Collections.unmodifiableMap(out);
    }
}
