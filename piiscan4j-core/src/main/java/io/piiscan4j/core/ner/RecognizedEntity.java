/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.ner;

/** Raw recognizer output: zero-based, exclusive-end offsets into the exact input string. */
public record RecognizedEntity(int start, int end, String label) {}
