/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.model.DetectorKind;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Pattern spans of one record plus what was rejected and which collaborators failed. */
public record PatternScan(List<Span> spans, Map<PiiType, Integer> rejected, Set<DetectorKind> unavailable) {
    public PatternScan {
        spans = List.copyOf(spans);
        rejected = Map.copyOf(rejected);
        unavailable = Set.copyOf(unavailable);
    }

    public static PatternScan empty() {
        return new PatternScan(List.of(), Map.of(), Set.of());
    }
}
