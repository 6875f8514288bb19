/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

/** External collaborators whose failure degrades a record to {@link RecordStatus#PARTIAL}. */
public enum DetectorKind {
    ENTITY_RECOGNIZER,
    PHONE_VALIDATOR
}
