/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api;

import io.piiscan4j.core.api.model.DetectionResult;
import io.piiscan4j.core.api.model.PiiType;

/** Stateless pattern detector that returns validated spans (source=PATTERN) for one PII type. */
public interface Detector {
    PiiType type();

    DetectionResult detect(String text);
}
