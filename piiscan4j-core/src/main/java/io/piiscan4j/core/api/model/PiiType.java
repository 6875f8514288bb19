/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.api.model;

import java.util.Comparator;

/**
 * Closed set of PII types the engine reports.
 *
 * <p>The declaration order is the fixed priority order used for every tie-break (registry overlap,
 * resolver conflicts, report breakdown). Types produced only by the entity recognizer rank last.
 */
public enum PiiType {
    CPF("Cadastro de Pessoa Física", 10),
    CNPJ("Cadastro Nacional de Pessoa Jurídica", 8),
    CREDIT_CARD("Número de Cartão de Crédito", 10),
    SEI_PROCESS("Número de Processo SEI", 4),
    RG("Registro Geral", 9),
    CEP("Código de Endereçamento Postal", 3),
    PHONE("Número de Telefone", 6),
    EMAIL("Endereço de E-mail", 6),
    DATE_BIRTH("Data de Nascimento", 5),
    PERSON_NAME("Nome de Pessoa", 5),
    LOCATION("Endereço/Localização", 4);

    /** Orders types by rank: higher priority first. */
    public static final Comparator<PiiType> PRIORITY = Comparator.comparingInt(PiiType::rank);

    private final String description;
    private final int severity;

    PiiType(String description, int severity) {
        this.description = description;
        this.severity = severity;
    }

    public String description() {
        return description;
    }

    /** Relative sensitivity weight, 1..10. */
    public int severity() {
        return severity;
    }

    /** 0 is the highest priority. */
    public int rank() {
        return ordinal();
    }

    /** True for types that only the entity recognizer produces. */
    public boolean isModelType() {
        return this == PERSON_NAME || this == LOCATION;
    }
}
