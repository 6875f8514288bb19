/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.report;

import io.piiscan4j.core.api.model.PiiBreakdownEntry;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.ProcessReport;
import io.piiscan4j.core.api.model.RecordResult;
import io.piiscan4j.core.api.model.RecordStatus;
import io.piiscan4j.core.api.model.RiskLevel;
import io.piiscan4j.core.risk.RiskClassifier;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Folds {@link RecordResult}s into one {@link ProcessReport}.
 *
 * <p>All updates are additive, so the final report does not depend on the order in which records
 * arrive, and partial aggregators built by independent workers can be {@link #merge merged}.
 * Thread-safe. Finalization happens exactly once; afterwards the aggregator rejects further input.
 */
public final class ReportAggregator {
    private static final Comparator<PiiBreakdownEntry> BREAKDOWN_ORDER = Comparator.comparingLong(
                    PiiBreakdownEntry::count)
            .reversed()
            .thenComparing(PiiBreakdownEntry::type, PiiType.PRIORITY);

    private final String processId;
    private final RiskClassifier classifier;

    private long totalRecords;
    private long recordsWithPii;
    private long partialRecords;
    private long failedRecords;
    private final EnumMap<PiiType, Long> counts = new EnumMap<>(PiiType.class);
    private final EnumMap<PiiType, Long> rejected = new EnumMap<>(PiiType.class);
    private boolean finalized;

    public ReportAggregator(String processId, RiskClassifier classifier) {
        this.processId = Objects.requireNonNull(processId, "processId");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
    }

    public String processId() {
        return processId;
    }

    public synchronized void add(RecordResult r) {
        Objects.requireNonNull(r, "record");
        ensureOpen();
        totalRecords++;
        if (r.hasPii()) recordsWithPii++;
        if (r.status() == RecordStatus.PARTIAL) partialRecords++;
        if (r.status() == RecordStatus.FAILED) failedRecords++;
        r.piiCounts().forEach((t, c) -> counts.merge(t, (long) c, Long::sum));
        r.rejectedCandidates().forEach((t, c) -> rejected.merge(t, (long) c, Long::sum));
    }

    /** Adds another aggregator's running totals to this one. The other one is left untouched. */
    public void merge(ReportAggregator other) {
        Objects.requireNonNull(other, "other");
        if (other == this) throw new IllegalArgumentException("Cannot merge an aggregator into itself");
        Snapshot s = other.snapshot();
        synchronized (this) {
            ensureOpen();
            totalRecords += s.totalRecords;
            recordsWithPii += s.recordsWithPii;
            partialRecords += s.partialRecords;
            failedRecords += s.failedRecords;
            s.counts.forEach((t, c) -> counts.merge(t, c, Long::sum));
            s.rejected.forEach((t, c) -> rejected.merge(t, c, Long::sum));
        }
    }

    public synchronized long totalRecords() {
        return totalRecords;
    }

    public synchronized boolean isFinalized() {
        return finalized;
    }

    /** Finalizes after all records were folded. */
    public ProcessReport finish(Duration processingTime) {
        return build(processingTime, true);
    }

    /** Finalizes a deliberately truncated run; the report is marked incomplete. */
    public ProcessReport finishIncomplete(Duration processingTime) {
        return build(processingTime, false);
    }

    private synchronized ProcessReport build(Duration processingTime, boolean complete) {
        Objects.requireNonNull(processingTime, "processingTime");
        ensureOpen();
        finalized = true;

        long totalPii = 0;
        for (long c : counts.values()) totalPii += c;

        List<PiiBreakdownEntry> breakdown = new ArrayList<>(counts.size());
        for (Map.Entry<PiiType, Long> e : counts.entrySet()) {
            if (e.getValue() <= 0) continue;
            breakdown.add(new PiiBreakdownEntry(
                    e.getKey(), e.getKey().description(), e.getValue(), percent(e.getValue(), totalPii)));
        }
        breakdown.sort(BREAKDOWN_ORDER);

        RiskLevel level = classifier.classify(counts);
        double seconds = processingTime.toNanos() / 1_000_000_000d;
        double rps = seconds > 0 ? round2(totalRecords / seconds) : 0d;

        return new ProcessReport(
                processId,
                totalRecords,
                recordsWithPii,
                totalRecords - recordsWithPii,
                totalPii,
                breakdown,
                level,
                level.description(),
                classifier.recommendations(level, counts),
                rejected,
                partialRecords,
                failedRecords,
                complete,
                processingTime,
                rps,
                percent(recordsWithPii, totalRecords));
    }

    private synchronized Snapshot snapshot() {
        return new Snapshot(
                totalRecords, recordsWithPii, partialRecords, failedRecords, new EnumMap<>(counts), new EnumMap<>(rejected));
    }

    private void ensureOpen() {
        if (finalized) throw new IllegalStateException("Report " + processId + " is already finalized");
    }

    static double percent(long part, long whole) {
        return whole > 0 ? round2(part * 100d / whole) : 0d;
    }

    private static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private record Snapshot(
            long totalRecords,
            long recordsWithPii,
            long partialRecords,
            long failedRecords,
            Map<PiiType, Long> counts,
            Map<PiiType, Long> rejected) {}
}
