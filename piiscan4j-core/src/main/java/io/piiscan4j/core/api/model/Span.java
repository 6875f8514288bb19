/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

import java.util.Objects;

/**
 * A contiguous range [start, end) of a record identified as one PII type.
 *
 * @param text the covered substring, kept so consumers never re-slice the record
 */
public record Span(int start, int end, PiiType type, SpanSource source, String text) {

    public Span {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(text, "text");
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Invalid span bounds [" + start + "," + end + ")");
        }
        if (text.length() != end - start) {
            throw new IllegalArgumentException("Span text length does not match bounds [" + start + "," + end + ")");
        }
    }

    /** Slices {@code record} and builds the span; rejects ranges outside the record. */
    public static Span of(String record, int start, int end, PiiType type, SpanSource source) {
        Objects.requireNonNull(record, "record");
        if (end > record.length()) {
            throw new IllegalArgumentException(
                    "Span end " + end + " exceeds record length " + record.length());
        }
        if (start < 0 || start >= end) {
            throw new IllegalArgumentException("Invalid span bounds [" + start + "," + end + ")");
        }
        return new Span(start, end, type, source, record.substring(start, end));
    }

    public int length() {
        return end - start;
    }

    /** Half-open overlap: spans that merely touch do not overlap. */
    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }
}
