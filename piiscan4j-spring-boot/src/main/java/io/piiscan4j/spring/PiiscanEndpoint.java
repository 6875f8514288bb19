/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.spring;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.preset.ScanConfig;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "piiscan")
public class PiiscanEndpoint {

    private final MicrometerReporter reporter;
    private final ScanConfig config;

    public PiiscanEndpoint(MicrometerReporter reporter, ScanConfig config) {
        this.reporter = reporter;
        this.config = config;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new HashMap<>();
        m.put("status", "OK");
        m.put("enabledTypes", severities());
        m.put("highVolumeThreshold", config.highVolumeThreshold());
        m.put("recentRecords", reporter.recentRecords());
        return m;
    }

    /** Enabled types in priority order with their severity weight. */
    private Map<PiiType, Integer> severities() {
        Map<PiiType, Integer> out = new EnumMap<>(PiiType.class);
        for (PiiType t : config.enabledTypes()) out.put(t, t.severity());
        return out;
    }
}
