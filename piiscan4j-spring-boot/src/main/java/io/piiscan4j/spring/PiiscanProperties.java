/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.spring;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.preset.ScanConfig;
import java.time.Duration;
import java.util.*;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@ConfigurationProperties(prefix = "piiscan4j")
public class PiiscanProperties {

    @Setter
    private boolean enabled = true;

    private List<PiiType> detectors = new ArrayList<>();

    @Setter
    private String phoneRegion = ScanConfig.DEFAULT_PHONE_REGION;

    @Setter
    private char maskChar = ScanConfig.DEFAULT_MASK_CHAR;

    private Risk risk = new Risk();
    private Entities entities = new Entities();
    private Batch batch = new Batch();
    private Metrics metrics = new Metrics();

    public List<PiiType> getDetectors() {
        return Collections.unmodifiableList(detectors);
    }

    public void setDetectors(List<PiiType> detectors) {
        this.detectors = new ArrayList<>(Objects.requireNonNullElse(detectors, List.of()));
    }

    public void setRisk(Risk risk) {
        this.risk = (risk == null) ? new Risk() : risk;
    }

    public void setEntities(Entities entities) {
        this.entities = (entities == null) ? new Entities() : entities;
    }

    public void setBatch(Batch batch) {
        this.batch = (batch == null) ? new Batch() : batch;
    }

    public void setMetrics(Metrics metrics) {
        this.metrics = (metrics == null) ? new Metrics() : metrics;
    }

    /** Engine configuration derived from these properties. */
    public ScanConfig toScanConfig() {
        return new ScanConfig(
                detectors.isEmpty() ? EnumSet.allOf(PiiType.class) : EnumSet.copyOf(detectors),
                phoneRegion,
                risk.getHighVolumeThreshold(),
                maskChar,
                entities.getLabels().isEmpty() ? ScanConfig.defaultLabels() : entities.getLabels(),
                entities.getMinPersonNameTokens(),
                batch.getRecordTimeout(),
                batch.getWorkerThreads());
    }

    // ---- nested: risk ----
    @Getter
    @Setter
    public static final class Risk {
        private int highVolumeThreshold = ScanConfig.DEFAULT_HIGH_VOLUME_THRESHOLD;
    }

    // ---- nested: entities ----
    public static final class Entities {
        private Map<String, PiiType> labels = new LinkedHashMap<>();

        @Setter
        @Getter
        private int minPersonNameTokens = 1;

        public Map<String, PiiType> getLabels() {
            return Collections.unmodifiableMap(labels);
        }

        public void setLabels(Map<String, PiiType> labels) {
            this.labels = new LinkedHashMap<>(Objects.requireNonNullElse(labels, Map.of()));
        }
    }

    // ---- nested: batch ----
    @Getter
    @Setter
    public static final class Batch {
        private int workerThreads = Runtime.getRuntime().availableProcessors();

        private Duration recordTimeout; // null = no deadline
    }

    // ---- nested: metrics ----
    @Getter
    @Setter
    public static final class Metrics {
        private int recentCapacity = 200;
    }
}
