/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.model.PiiType;
import java.util.regex.Pattern;

/** CPF with or without punctuation (000.000.000-00), accepted only when both check digits match. */
public final class CpfDetector extends RegexDetector {
    private static final Pattern CPF = Pattern.compile("(?<!\\d)\\d{3}\\.?\\d{3}\\.?\\d{3}-?\\d{2}(?!\\d)");

    public CpfDetector() {
        super(PiiType.CPF, CPF, s -> CheckDigits.isValidCpf(CheckDigits.digitsOf(s)));
    }
}
