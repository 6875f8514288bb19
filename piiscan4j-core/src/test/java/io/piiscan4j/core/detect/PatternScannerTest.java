/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.piiscan4j.core.api.Detector;
import io.piiscan4j.core.api.model.DetectorKind;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.Span;
import io.piiscan4j.core.api.model.SpanSource;
import io.piiscan4j.core.phone.PhoneValidation;
import io.piiscan4j.core.phone.PhoneValidator;
import io.piiscan4j.core.preset.DetectorRegistry;
import io.piiscan4j.core.preset.ScanConfig;
import java.util.EnumSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PatternScannerTest {

    /** Accepts anything with an area code (10+ digits), like a national-format check would. */
    static final PhoneValidator TEN_DIGITS = (candidate, region) -> CheckDigits.digitsOf(candidate).length() >= 10
            ? PhoneValidation.valid("+55" + CheckDigits.digitsOf(candidate))
            : PhoneValidation.invalid();

    private PatternScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new DetectorRegistry(TEN_DIGITS).scanner(ScanConfig.defaults());
    }

    @Nested
    @DisplayName("per-type detection")
    class PerType {
        @Test
        void formattedCpf() {
            PatternScan r = scanner.detectPatterns("João Silva, CPF 123.456.789-09");
            assertThat(r.spans())
                    .extracting(Span::type, Span::start, Span::end, Span::source)
                    .containsExactly(tuple(PiiType.CPF, 16, 30, SpanSource.PATTERN));
        }

        @Test
        void invalidCpfIsCountedAsRejectedNotDetected() {
            PatternScan r = scanner.detectPatterns("CPF inválido 123.456.789-00 e 111.111.111-11");
            assertThat(r.spans()).isEmpty();
            assertThat(r.rejected()).containsEntry(PiiType.CPF, 2);
        }

        @Test
        void rgAndBirthDate() {
            PatternScan r = scanner.detectPatterns("RG 12.345.678-9 nascido em 15/03/1985");
            assertThat(r.spans())
                    .extracting(Span::type, Span::text)
                    .containsExactly(tuple(PiiType.RG, "12.345.678-9"), tuple(PiiType.DATE_BIRTH, "15/03/1985"));
        }

        @Test
        void cepAndEmail() {
            PatternScan r = scanner.detectPatterns("CEP 01310-100, email maria.souza@gov.br");
            assertThat(r.spans())
                    .extracting(Span::type, Span::text)
                    .containsExactly(tuple(PiiType.CEP, "01310-100"), tuple(PiiType.EMAIL, "maria.souza@gov.br"));
        }

        @Test
        void emailWithAccentedLocalPart() {
            PatternScan r = scanner.detectPatterns("escreva para joão@empresa.com.br hoje");
            assertThat(r.spans())
                    .extracting(Span::type, Span::text)
                    .containsExactly(tuple(PiiType.EMAIL, "joão@empresa.com.br"));
        }

        @Test
        void phoneIsDelegatedToTheValidator() {
            PatternScan r = scanner.detectPatterns("Ligue (11) 98765-4321 ou 1234-5678");
            assertThat(r.spans())
                    .extracting(Span::type, Span::text)
                    .containsExactly(tuple(PiiType.PHONE, "(11) 98765-4321"));
            assertThat(r.rejected()).containsEntry(PiiType.PHONE, 1);
        }

        @Test
        void textWithoutPiiYieldsNothing() {
            PatternScan r = scanner.detectPatterns("Sem dados pessoais aqui.");
            assertThat(r.spans()).isEmpty();
            assertThat(r.rejected()).isEmpty();
            assertThat(r.unavailable()).isEmpty();
        }

        @Test
        void nullAndEmptyNeverThrow() {
            assertThat(scanner.detectPatterns(null).spans()).isEmpty();
            assertThat(scanner.detectPatterns("").spans()).isEmpty();
        }
    }

    @Nested
    @DisplayName("collisions at the same offset")
    class SameOffset {
        @Test
        void longestMatchWinsSoSeiProcessSwallowsTheCepPrefix() {
            PatternScan r = scanner.detectPatterns("Processo 12345-123456/2023-12");
            assertThat(r.spans())
                    .extracting(Span::type, Span::text)
                    .containsExactly(tuple(PiiType.SEI_PROCESS, "12345-123456/2023-12"));
        }

        @Test
        void equalLengthGoesToTheHigherPriorityType() {
            // 11 bare digits: a valid CPF that the fake validator would also accept as a phone
            PatternScan r = scanner.detectPatterns("id 52998224725");
            assertThat(r.spans()).extracting(Span::type).containsExactly(PiiType.CPF);
        }

        @Test
        void cardBeatsThePhoneCandidateStartingAtTheSameDigit() {
            PatternScan r = scanner.detectPatterns("cartão 4111 1111 1111 1111");
            assertThat(r.spans()).extracting(Span::type).containsExactly(PiiType.CREDIT_CARD);
            assertThat(r.rejected()).doesNotContainKey(PiiType.PHONE);
        }
    }

    @Nested
    @DisplayName("rejected candidate counts")
    class RejectedCandidates {
        @Test
        void phoneShapedPiecesOfAnAcceptedCardAreNotCounted() {
            PatternScan r = scanner.detectPatterns("4111-1111-1111-1111");
            assertThat(r.spans()).extracting(Span::type).containsExactly(PiiType.CREDIT_CARD);
            assertThat(r.rejected()).isEmpty();
        }

        @Test
        void piecesOfARejectedCardAreStillCounted() {
            PatternScan r = scanner.detectPatterns("cartão 4111 1111 1111 1112 e 1234-5678");
            assertThat(r.spans()).isEmpty();
            assertThat(r.rejected()).containsEntry(PiiType.CREDIT_CARD, 1).containsEntry(PiiType.PHONE, 3);
        }
    }

    @Nested
    @DisplayName("phone validator failure")
    class ValidatorFailure {
        @Test
        void failingValidatorMarksPhoneUnavailableButOtherTypesStillWork() {
            PhoneValidator broken = (c, r) -> {
                throw new IllegalStateException("metadata service down");
            };
            PatternScanner s = new DetectorRegistry(broken).scanner(ScanConfig.defaults());

            PatternScan r = s.detectPatterns("CPF 123.456.789-09 tel (11) 98765-4321");

            assertThat(r.unavailable()).containsExactly(DetectorKind.PHONE_VALIDATOR);
            assertThat(r.spans()).extracting(Span::type).containsExactly(PiiType.CPF);
        }
    }

    @Test
    void disabledTypesAreNotDetected() {
        PatternScanner onlyEmail = new DetectorRegistry(TEN_DIGITS)
                .scanner(ScanConfig.defaults().withEnabledTypes(EnumSet.of(PiiType.EMAIL)));
        PatternScan r = onlyEmail.detectPatterns("CPF 123.456.789-09, a@b.com");
        assertThat(r.spans()).extracting(Span::type).containsExactly(PiiType.EMAIL);
    }

    @Test
    void registryBuildsDetectorsInPriorityOrder() {
        assertThat(scanner.detectors())
                .extracting(Detector::type)
                .containsExactly(
                        PiiType.CPF,
                        PiiType.CNPJ,
                        PiiType.CREDIT_CARD,
                        PiiType.SEI_PROCESS,
                        PiiType.RG,
                        PiiType.CEP,
                        PiiType.PHONE,
                        PiiType.EMAIL,
                        PiiType.DATE_BIRTH);
    }
}
