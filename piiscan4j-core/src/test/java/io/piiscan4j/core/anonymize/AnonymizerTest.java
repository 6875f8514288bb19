/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.anonymize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.api.model.SpanSource;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class AnonymizerTest {

    private final Anonymizer anonymizer = new Anonymizer();

    private static Span span(String text, String covered, PiiType type) {
        int start = text.indexOf(covered);
        return Span.of(text, start, start + covered.length(), type, SpanSource.PATTERN);
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "123.456.789-09      | xxx.xxx.xxx-xx",
                "12345678909         | xxxxxxxxxxx",
                "(11) 98765-4321     | (xx) xxxxx-xxxx",
                "joao.silva@email.com| xxxx.xxxxx@xxxxx.xxx",
                "11.222.333/0001-81  | xx.xxx.xxx/xxxx-xx",
                "Avenida São João    | xxxxxxx xxx xxxx"
            })
    void masksAlphanumericsAndKeepsSeparators(String value, String expected) {
        String text = "valor: " + value + " fim";
        Anonymizer.Anonymized out = anonymizer.anonymize(text, List.of(span(text, value, PiiType.CPF)));

        assertThat(out.text()).isEqualTo("valor: " + expected + " fim");
        assertThat(out.text()).hasSameSizeAs(text);
    }

    @Test
    void textOutsideSpansIsUntouched() {
        String text = "Cliente Maria, e-mail maria@ex.com, CEP 01310-100.";
        Anonymizer.Anonymized out = anonymizer.anonymize(
                text, List.of(span(text, "maria@ex.com", PiiType.EMAIL), span(text, "01310-100", PiiType.CEP)));

        assertThat(out.text()).isEqualTo("Cliente Maria, e-mail xxxxx@xx.xxx, CEP xxxxx-xxx.");
        assertThat(out.counts()).containsOnly(entry(PiiType.EMAIL, 1), entry(PiiType.CEP, 1));
        assertThat(out.hasPii()).isTrue();
    }

    @Test
    void punctuationIsPreservedAndNoAlphanumericSurvivesInsideSpans() {
        String text = "a 1a.2b-3c/4d (5e) @6f g";
        Span s = span(text, "1a.2b-3c/4d (5e) @6f", PiiType.SEI_PROCESS);
        String masked = anonymizer.anonymize(text, List.of(s)).text();

        String inside = masked.substring(s.start(), s.end());
        assertThat(inside.chars().filter(c -> c != 'x').noneMatch(Character::isLetterOrDigit)).isTrue();
        assertThat(inside.replace("x", "")).isEqualTo(s.text().replaceAll("[\\p{L}\\p{N}]", ""));
    }

    @Test
    void customMaskCharIsUsed() {
        String text = "CPF 123.456.789-09";
        String masked = new Anonymizer('*').anonymize(text, List.of(span(text, "123.456.789-09", PiiType.CPF))).text();

        assertThat(masked).isEqualTo("CPF ***.***.***-**");
    }

    @Test
    void noSpansLeavesTextAsIs() {
        Anonymizer.Anonymized out = anonymizer.anonymize("nada aqui", List.of());

        assertThat(out.text()).isEqualTo("nada aqui");
        assertThat(out.counts()).isEmpty();
        assertThat(out.hasPii()).isFalse();
    }

    @Test
    void overlappingOrUnsortedSpansAreRejected() {
        String text = "0123456789";
        Span a = Span.of(text, 0, 5, PiiType.CPF, SpanSource.PATTERN);
        Span b = Span.of(text, 3, 8, PiiType.CEP, SpanSource.PATTERN);
        Span c = Span.of(text, 6, 9, PiiType.CEP, SpanSource.PATTERN);

        assertThatThrownBy(() -> anonymizer.anonymize(text, List.of(a, b))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> anonymizer.anonymize(text, List.of(c, a))).isInstanceOf(IllegalArgumentException.class);
    }
}
