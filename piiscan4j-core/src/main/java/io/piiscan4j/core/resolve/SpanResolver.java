/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.resolve;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.api.model.SpanSource;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Merges pattern and model candidates into one ordered, non-overlapping list.
 *
 * <p>PATTERN candidates are settled first: ordered by start, then longest first, then type priority,
 * a left-to-right sweep keeps a candidate only if it starts at or after the end of the last kept
 * span. MODEL candidates, in the same order, are then kept only where they overlap nothing already
 * kept, so a validated match is never displaced by a recognizer guess. Losers are dropped whole,
 * never trimmed.
 */
public final class SpanResolver {

    static final Comparator<Span> ORDER = Comparator.comparingInt(Span::start)
            .thenComparing(Comparator.comparingInt(Span::length).reversed())
            .thenComparing(Span::source, Comparator.comparingInt(SpanSource::ordinal))
            .thenComparing(Span::type, PiiType.PRIORITY);

    public List<Span> resolve(Collection<Span> candidates) {
        if (candidates == null || candidates.isEmpty()) return List.of();

        List<Span> patterns = new ArrayList<>();
        List<Span> models = new ArrayList<>();
        for (Span s : candidates) {
            (s.source() == SpanSource.PATTERN ? patterns : models).add(s);
        }
        patterns.sort(ORDER);
        models.sort(ORDER);

        List<Span> accepted = new ArrayList<>();
        int frontier = 0; // end of the last accepted pattern span
        for (Span s : patterns) {
            if (s.start() >= frontier) {
                accepted.add(s);
                frontier = s.end();
            }
        }
        for (Span s : models) {
            if (accepted.stream().noneMatch(s::overlaps)) accepted.add(s);
        }
        accepted.sort(ORDER);
        return List.copyOf(accepted);
    }

    /** Convenience for callers holding the two candidate sources separately. */
    public List<Span> resolve(Collection<Span> patternSpans, Collection<Span> modelSpans) {
        List<Span> all = new ArrayList<>(patternSpans.size() + modelSpans.size());
        all.addAll(patternSpans);
        all.addAll(modelSpans);
        return resolve(all);
    }
}
