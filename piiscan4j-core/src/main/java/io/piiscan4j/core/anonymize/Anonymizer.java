/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.anonymize;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.preset.ScanConfig;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structure-preserving masking: letters and digits inside a resolved span become the mask
 * character; separators ({@code . - / ( ) @}, spaces) and any other symbol stay, so a masked CPF
 * still reads {@code xxx.xxx.xxx-xx}.
 */
public final class Anonymizer {
    private final char maskChar;

    public Anonymizer() {
        this(ScanConfig.DEFAULT_MASK_CHAR);
    }

    public Anonymizer(char maskChar) {
        this.maskChar = maskChar;
    }

    /**
     * @param resolved non-overlapping spans sorted by start, as produced by the resolver
     */
    public Anonymized anonymize(String text, List<Span> resolved) {
        if (text == null || text.isEmpty()) return new Anonymized(text == null ? "" : text, Map.of());
        if (resolved.isEmpty()) return new Anonymized(text, Map.of());

        StringBuilder out = new StringBuilder(text.length());
        Map<PiiType, Integer> counts = new EnumMap<>(PiiType.class);
        int pos = 0;
        for (Span s : resolved) {
            if (s.start() < pos || s.end() > text.length()) {
                throw new IllegalArgumentException("Spans must be sorted, non-overlapping and inside the text: " + s);
            }
            out.append(text, pos, s.start());
            for (int i = s.start(); i < s.end(); ) {
                int cp = text.codePointAt(i);
                if (Character.isLetterOrDigit(cp)) {
                    out.append(maskChar);
                } else {
                    out.appendCodePoint(cp);
                }
                i += Character.charCount(cp);
            }
            counts.merge(s.type(), 1, Integer::sum);
            pos = s.end();
        }
        out.append(text, pos, text.length());
        return new Anonymized(out.toString(), Collections.unmodifiableMap(counts));
    }

    /** Masked text plus accepted spans per type. */
    public record Anonymized(String text, Map<PiiType, Integer> counts) {
        public boolean hasPii() {
            return !counts.isEmpty();
        }
    }
}
