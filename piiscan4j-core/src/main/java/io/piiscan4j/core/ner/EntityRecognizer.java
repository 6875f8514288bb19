/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.ner;

import java.util.List;

/**
 * Named-entity recognition capability (spaCy, OpenNLP, a remote model...). Must be deterministic for
 * identical input so reports are reproducible. May throw; the caller treats that as "unavailable".
 */
@FunctionalInterface
public interface EntityRecognizer {
    List<RecognizedEntity> recognize(String text);

    /** Null object: never recognizes anything. */
    static EntityRecognizer none() {
        return text -> List.of();
    }
}
