/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api;

import io.piiscan4j.core.api.model.DetectorKind;

/** An external collaborator (recognizer, phone validator) failed for the current record. */
public class DetectorUnavailableException extends RuntimeException {
    private final DetectorKind kind;

    public DetectorUnavailableException(DetectorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public DetectorKind kind() {
        return kind;
    }
}
