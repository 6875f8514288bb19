/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

/** One line of a report breakdown; {@code percentage} is of all detections, two decimals. */
public record PiiBreakdownEntry(PiiType type, String description, long count, double percentage) {}
