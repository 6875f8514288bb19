/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.RiskLevel;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier();

    @Nested
    class Rules {

        @Test
        void nothingDetectedIsMinimo() {
            assertThat(classifier.classify(Map.of())).isEqualTo(RiskLevel.MINIMO);
            assertThat(classifier.classify(null)).isEqualTo(RiskLevel.MINIMO);
            assertThat(classifier.classify(Map.of(PiiType.CPF, 0))).isEqualTo(RiskLevel.MINIMO);
        }

        @ParameterizedTest
        @EnumSource(value = PiiType.class, names = {"CPF", "RG", "CREDIT_CARD"})
        void anySingleCriticalDocumentIsCritico(PiiType type) {
            assertThat(classifier.classify(Map.of(type, 1))).isEqualTo(RiskLevel.CRITICO);
        }

        @Test
        @DisplayName("contact data becomes ALTO only above the threshold")
        void contactThresholdBoundary() {
            assertThat(classifier.classify(Map.of(PiiType.EMAIL, 10))).isEqualTo(RiskLevel.BAIXO);
            assertThat(classifier.classify(Map.of(PiiType.EMAIL, 11))).isEqualTo(RiskLevel.ALTO);
            assertThat(classifier.classify(Map.of(PiiType.PHONE, 11))).isEqualTo(RiskLevel.ALTO);
            // thresholds apply per type, not to the sum
            assertThat(classifier.classify(Map.of(PiiType.EMAIL, 6, PiiType.PHONE, 6))).isEqualTo(RiskLevel.BAIXO);
        }

        @Test
        void identityDataIsMedio() {
            assertThat(classifier.classify(Map.of(PiiType.PERSON_NAME, 1))).isEqualTo(RiskLevel.MEDIO);
            assertThat(classifier.classify(Map.of(PiiType.LOCATION, 3, PiiType.EMAIL, 2))).isEqualTo(RiskLevel.MEDIO);
        }

        @Test
        void otherTypesAreBaixo() {
            assertThat(classifier.classify(Map.of(PiiType.CEP, 1))).isEqualTo(RiskLevel.BAIXO);
            assertThat(classifier.classify(Map.of(PiiType.CNPJ, 50))).isEqualTo(RiskLevel.BAIXO);
            assertThat(classifier.classify(Map.of(PiiType.SEI_PROCESS, 1, PiiType.DATE_BIRTH, 1)))
                    .isEqualTo(RiskLevel.BAIXO);
        }

        @Test
        void higherRuleWins() {
            assertThat(classifier.classify(Map.of(PiiType.CPF, 1, PiiType.EMAIL, 50))).isEqualTo(RiskLevel.CRITICO);
            assertThat(classifier.classify(Map.of(PiiType.PHONE, 20, PiiType.PERSON_NAME, 1)))
                    .isEqualTo(RiskLevel.ALTO);
        }

        @Test
        void thresholdIsConfigurable() {
            RiskClassifier strict = new RiskClassifier(2);
            assertThat(strict.classify(Map.of(PiiType.EMAIL, 3))).isEqualTo(RiskLevel.ALTO);
            assertThatThrownBy(() -> new RiskClassifier(-1)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("adding detections never lowers the level")
    void monotonic() {
        Random rnd = new Random(11);
        PiiType[] types = PiiType.values();
        for (int round = 0; round < 300; round++) {
            Map<PiiType, Long> counts = new EnumMap<>(PiiType.class);
            int n = rnd.nextInt(6);
            for (int i = 0; i < n; i++) {
                counts.merge(types[rnd.nextInt(types.length)], (long) (1 + rnd.nextInt(8)), Long::sum);
            }
            RiskLevel before = classifier.classify(counts);
            counts.merge(types[rnd.nextInt(types.length)], (long) (1 + rnd.nextInt(8)), Long::sum);

            assertThat(classifier.classify(counts).isAtLeast(before)).isTrue();
        }
    }

    @Nested
    class Recommendations {

        @Test
        void criticalDocumentsGetProtectionAndPseudonymization() {
            Map<PiiType, Integer> counts = Map.of(PiiType.CPF, 2);
            assertThat(classifier.recommendations(classifier.classify(counts), counts))
                    .contains(
                            "Implementar criptografia adicional para armazenamento",
                            "Documentos de identificação detectados - considerar pseudonimização")
                    .doesNotContain("Manter boas práticas de segurança da informação");
        }

        @Test
        void cardsAreFlaggedAsUrgent() {
            Map<PiiType, Integer> counts = Map.of(PiiType.CREDIT_CARD, 1);
            assertThat(classifier.recommendations(RiskLevel.CRITICO, counts))
                    .contains("URGENTE: Dados financeiros detectados - validar compliance PCI-DSS");
        }

        @Test
        void contactDataAsksForConsent() {
            Map<PiiType, Integer> counts = Map.of(PiiType.EMAIL, 1);
            assertThat(classifier.recommendations(RiskLevel.BAIXO, counts))
                    .containsExactly("Dados de contato detectados - obter consentimento explícito para uso");
        }

        @Test
        void cleanScopeGetsGeneralAdvice() {
            assertThat(classifier.recommendations(RiskLevel.MINIMO, Map.of()))
                    .containsExactly("Manter boas práticas de segurança da informação");
        }
    }
}
