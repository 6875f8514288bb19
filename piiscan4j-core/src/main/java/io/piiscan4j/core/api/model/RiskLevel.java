/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

/** Ordinal LGPD risk classification. Declaration order is severity order. */
public enum RiskLevel {
    MINIMO("Nenhum dado sensível significativo detectado."),
    BAIXO("Poucos dados sensíveis detectados. Risco controlável."),
    MEDIO("Dados pessoais identificáveis detectados. Proteção adequada recomendada."),
    ALTO("Dados sensíveis detectados. Atenção especial necessária."),
    CRITICO("Dados altamente sensíveis detectados (CPF, RG, Cartão). Requer máxima proteção.");

    private final String description;

    RiskLevel(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }
}
