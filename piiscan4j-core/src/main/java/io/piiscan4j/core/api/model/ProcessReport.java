/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finalized, immutable report of one processing run.
 *
 * @param complete         false when the caller finalized a deliberately truncated subset
 * @param processingTime   elapsed time supplied by the caller
 * @param recordsPerSecond derived from {@code processingTime}; 0 when it is zero
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "collections are copied into unmodifiable views")
public record ProcessReport(
        String processId,
        long totalRecords,
        long recordsWithPii,
        long recordsWithoutPii,
        long totalPiiDetected,
        List<PiiBreakdownEntry> piiBreakdown,
        RiskLevel riskLevel,
        String riskDescription,
        List<String> recommendations,
        Map<PiiType, Long> rejectedCandidates,
        long partialRecords,
        long failedRecords,
        boolean complete,
        Duration processingTime,
        double recordsPerSecond,
        double piiRatePercentage) {

    public ProcessReport {
        Objects.requireNonNull(processId, "processId");
        Objects.requireNonNull(riskLevel, "riskLevel");
        Objects.requireNonNull(processingTime, "processingTime");
        piiBreakdown = List.copyOf(piiBreakdown);
        recommendations = List.copyOf(recommendations);
        rejectedCandidates = Map.copyOf(rejectedCandidates);
    }

    /** Count for one type taken from the breakdown; 0 if absent. */
    public long count(PiiType type) {
        for (PiiBreakdownEntry e : piiBreakdown) {
            if (e.type() == type) return e.count();
        }
        return 0;
    }
}
