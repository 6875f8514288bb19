/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.model.PiiType;
import java.util.regex.Pattern;

/** CNPJ (00.000.000/0000-00, separators optional), accepted only when both check digits match. */
public final class CnpjDetector extends RegexDetector {
    private static final Pattern CNPJ =
            Pattern.compile("(?<!\\d)\\d{2}\\.?\\d{3}\\.?\\d{3}/?\\d{4}-?\\d{2}(?!\\d)");

    public CnpjDetector() {
        super(PiiType.CNPJ, CNPJ, s -> CheckDigits.isValidCnpj(CheckDigits.digitsOf(s)));
    }
}
