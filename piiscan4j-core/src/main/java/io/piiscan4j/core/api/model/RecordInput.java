/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

import java.util.Objects;

/** A record supplied by the caller; the id is passed through untouched. */
public record RecordInput(String recordId, String text) {
    public RecordInput {
        Objects.requireNonNull(recordId, "recordId");
    }
}
