/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.ner;

import io.piiscan4j.core.api.DetectorUnavailableException;
import io.piiscan4j.core.api.model.DetectorKind;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.api.model.SpanSource;
import io.piiscan4j.core.preset.ScanConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns recognizer output into MODEL spans. Only maps labels and checks offsets; no linguistic
 * analysis happens here.
 */
@Slf4j
public final class EntityRecognizerAdapter {
    private final EntityRecognizer recognizer;
    private final ScanConfig cfg;

    public EntityRecognizerAdapter(EntityRecognizer recognizer, ScanConfig cfg) {
        this.recognizer = Objects.requireNonNull(recognizer, "recognizer");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /**
     * @throws DetectorUnavailableException if the recognizer itself fails
     */
    public List<Span> detectEntities(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<RecognizedEntity> raw;
        try {
            raw = recognizer.recognize(text);
        } catch (RuntimeException e) {
            throw new DetectorUnavailableException(DetectorKind.ENTITY_RECOGNIZER, "Entity recognizer failed", e);
        }
        if (raw == null || raw.isEmpty()) return List.of();

        List<Span> spans = new ArrayList<>(raw.size());
        for (RecognizedEntity e : raw) {
            if (e == null) continue;
            PiiType type = cfg.entityLabels().get(ScanConfig.normalizeLabel(e.label()));
            if (type == null || !cfg.isEnabled(type)) continue;
            if (e.start() < 0 || e.end() > text.length() || e.start() >= e.end()) {
                log.warn(
                        "Detector contract violation: entity [{},{}) label={} outside text of length {}",
                        e.start(), e.end(), e.label(), text.length());
                continue;
            }
            Span span = Span.of(text, e.start(), e.end(), type, SpanSource.MODEL);
            if (type == PiiType.PERSON_NAME && tokens(span.text()) < cfg.minPersonNameTokens()) continue;
            spans.add(span);
        }
        return spans;
    }

    private static int tokens(String s) {
        String t = s.strip();
        return t.isEmpty() ? 0 : t.split("\\s+").length;
    }
}
