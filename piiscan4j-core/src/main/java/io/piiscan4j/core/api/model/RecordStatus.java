/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

public enum RecordStatus {
    COMPLETE, // every detector ran
    PARTIAL, // a collaborator failed; pattern findings still applied
    FAILED // not processed (deadline exceeded or unexpected error)
}
