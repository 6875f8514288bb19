/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.batch;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.piiscan4j.core.api.model.ProcessReport;
import io.piiscan4j.core.api.model.RecordResult;
import java.util.List;

/** Records in input order plus the finalized report. */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "records list is an immutable copy")
public record BatchResult(List<RecordResult> records, ProcessReport report) {
    public BatchResult {
        records = List.copyOf(records);
    }
}
