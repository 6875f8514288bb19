/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.phone;

/** Verdict of a {@link PhoneValidator}; {@code canonical} is E.164 when valid, null otherwise. */
public record PhoneValidation(boolean valid, String canonical) {
    private static final PhoneValidation INVALID = new PhoneValidation(false, null);

    public static PhoneValidation invalid() {
        return INVALID;
    }

    public static PhoneValidation valid(String canonical) {
        return new PhoneValidation(true, canonical);
    }
}
