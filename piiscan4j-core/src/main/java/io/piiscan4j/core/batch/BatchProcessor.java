/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.batch;

import io.piiscan4j.core.api.PiiScanner;
import io.piiscan4j.core.api.model.ProcessReport;
import io.piiscan4j.core.api.model.RecordInput;
import io.piiscan4j.core.api.model.RecordResult;
import io.piiscan4j.core.preset.ScanConfig;
import io.piiscan4j.core.report.ReportAggregator;
import io.piiscan4j.core.report.Reporter;
import io.piiscan4j.core.risk.RiskClassifier;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs {@link PiiScanner#scan} for a stream of records on a worker pool and folds the results into
 * a {@link ReportAggregator} on the calling thread (single writer).
 *
 * <p>At most {@code workerThreads * 4} records are in flight; results are emitted in input order.
 * A record that throws or misses the per-record deadline becomes a FAILED result and still counts
 * in the totals. If the calling thread is interrupted the run stops and the report is finalized as
 * incomplete.
 */
@Slf4j
public final class BatchProcessor implements AutoCloseable {
    private final PiiScanner scanner;
    private final RiskClassifier classifier;
    private final Reporter reporter;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final Duration recordTimeout;
    private final int window;

    public BatchProcessor(PiiScanner scanner, RiskClassifier classifier, Reporter reporter, ScanConfig cfg) {
        this(scanner, classifier, reporter, cfg, Executors.newFixedThreadPool(cfg.workerThreads(), workerThreads()), true);
    }

    /** Uses a caller-managed executor; {@link #close()} will not shut it down. */
    public BatchProcessor(
            PiiScanner scanner, RiskClassifier classifier, Reporter reporter, ScanConfig cfg, ExecutorService executor) {
        this(scanner, classifier, reporter, cfg, executor, false);
    }

    private BatchProcessor(
            PiiScanner scanner,
            RiskClassifier classifier,
            Reporter reporter,
            ScanConfig cfg,
            ExecutorService executor,
            boolean ownsExecutor) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.recordTimeout = cfg.recordTimeout();
        this.window = cfg.workerThreads() * 4;
    }

    /** Processes all records, keeping every result in memory. */
    public BatchResult process(String processId, Iterable<RecordInput> records) {
        List<RecordResult> out = new ArrayList<>();
        ProcessReport report = process(processId, records, out::add);
        return new BatchResult(out, report);
    }

    /** Streams each result to {@code sink} (in input order) and returns the finalized report. */
    public ProcessReport process(String processId, Iterable<RecordInput> records, Consumer<RecordResult> sink) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(sink, "sink");
        ReportAggregator aggregator = new ReportAggregator(processId, classifier);
        log.info("Process {}: started", processId);
        long t0 = System.nanoTime();

        Deque<Pending> inFlight = new ArrayDeque<>();
        Iterator<RecordInput> it = records.iterator();
        boolean interrupted = false;
        while (!interrupted && (it.hasNext() || !inFlight.isEmpty())) {
            while (it.hasNext() && inFlight.size() < window) {
                RecordInput in = it.next();
                inFlight.addLast(new Pending(in, executor.submit(() -> scanner.scan(in))));
            }
            Pending next = inFlight.removeFirst();
            RecordResult result;
            try {
                result = await(next);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                next.future().cancel(true);
                continue;
            }
            aggregator.add(result);
            reporter.report(result);
            sink.accept(result);
        }
        inFlight.forEach(p -> p.future().cancel(true));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - t0);
        ProcessReport report = interrupted ? aggregator.finishIncomplete(elapsed) : aggregator.finish(elapsed);
        log.info(
                "Process {}: {} records, {} with PII, risk={}, complete={} in {} ms",
                processId, report.totalRecords(), report.recordsWithPii(), report.riskLevel(), report.complete(),
                elapsed.toMillis());
        return report;
    }

    private RecordResult await(Pending p) throws InterruptedException {
        String id = p.input().recordId();
        int length = p.input().text() == null ? 0 : p.input().text().length();
        try {
            return recordTimeout == null
                    ? p.future().get()
                    : p.future().get(recordTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            p.future().cancel(true);
            log.warn("Record {} exceeded the {} ms deadline; reported as failed", id, recordTimeout.toMillis());
            return RecordResult.failed(id, length);
        } catch (ExecutionException e) {
            log.warn("Record {} failed; reported as failed", id, e.getCause());
            return RecordResult.failed(id, length);
        }
    }

    @Override
    public void close() {
        if (ownsExecutor) executor.shutdownNow();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "piiscan-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Pending(RecordInput input, Future<RecordResult> future) {}
}
