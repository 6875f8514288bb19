/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.RecordResult;
import io.piiscan4j.core.api.model.RecordStatus;
import io.piiscan4j.core.report.Reporter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Counts records and detections in Micrometer and keeps a small ring of recent record summaries. */
public final class MicrometerReporter implements Reporter {
    private final MeterRegistry registry;
    private final Deque<RecentRecord> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(RecordResult result) {
        if (result == null) return;
        registry.counter("piiscan4j_records_total", "status", result.status().name()).increment();
        result.piiCounts().forEach((type, count) -> registry.counter("piiscan4j_pii_detected_total", "type", type.name())
                .increment(count));
        if (ring.size() >= capacity) ring.removeFirst();
        ring.addLast(new RecentRecord(result.recordId(), result.status(), result.piiCounts()));
    }

    /** Returns an unmodifiable snapshot of the recent records ring buffer. */
    public synchronized List<RecentRecord> recentRecords() {
        return List.copyOf(ring);
    }

    /** What the ring keeps: never the text, only ids and counts. */
    public record RecentRecord(String recordId, RecordStatus status, Map<PiiType, Integer> counts) {}
}
