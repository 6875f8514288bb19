/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.report;

import io.piiscan4j.core.api.model.RecordResult;

/** Receives every finished record, e.g. for metrics. Must be thread-safe and must not block. */
public interface Reporter {
    void report(RecordResult result);
}
