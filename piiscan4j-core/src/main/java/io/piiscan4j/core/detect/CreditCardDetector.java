/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.model.PiiType;
import java.util.regex.Pattern;

/** Card numbers: four groups of four (space or dash separated) or 13-19 bare digits, validated via Luhn. */
public final class CreditCardDetector extends RegexDetector {
    private static final Pattern CARD =
            Pattern.compile("(?<!\\d)(?:\\d{4}(?:[ -]\\d{4}){3}|\\d{13,19})(?!\\d)");

    public CreditCardDetector() {
        super(PiiType.CREDIT_CARD, CARD, s -> CheckDigits.luhn(CheckDigits.digitsOf(s)));
    }
}
