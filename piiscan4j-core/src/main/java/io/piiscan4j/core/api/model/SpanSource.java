/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

/** Where a span came from. Declaration order is trust order: PATTERN wins over MODEL. */
public enum SpanSource {
    PATTERN, // regex + validator
    MODEL // external entity recognizer
}
