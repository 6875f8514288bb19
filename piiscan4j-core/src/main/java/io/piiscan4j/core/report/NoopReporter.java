/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.report;

import io.piiscan4j.core.api.model.RecordResult;

public final class NoopReporter implements Reporter {
    @Override
    public void report(RecordResult result) {
        /* no-op */
    }
}
