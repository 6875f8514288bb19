/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import io.piiscan4j.core.api.model.PiiType;
import java.util.regex.Pattern;

/** E-mail addresses; local part and domain may contain accented letters (joão@empresa.com.br). */
public final class EmailDetector extends RegexDetector {
    private static final Pattern P = Pattern.compile(
            "(?<![\\p{L}\\p{N}._%+-])[\\p{L}\\p{N}._%+-]+@[\\p{L}\\p{N}.-]+\\.\\p{L}{2,}(?![\\p{L}\\p{N}])");

    public EmailDetector() {
        super(PiiType.EMAIL, P, s -> true);
    }
}
