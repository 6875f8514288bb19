/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.phone;

/**
 * Country-aware phone grammar check. Implementations may be remote or slow; they are called once
 * per candidate, never under a lock. Any exception is treated as the validator being unavailable.
 */
@FunctionalInterface
public interface PhoneValidator {
    PhoneValidation validate(String candidate, String region);
}
