/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.preset;

import io.piiscan4j.core.api.Detector;
import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.detect.CnpjDetector;
import io.piiscan4j.core.detect.CpfDetector;
import io.piiscan4j.core.detect.CreditCardDetector;
import io.piiscan4j.core.detect.EmailDetector;
import io.piiscan4j.core.detect.PatternScanner;
import io.piiscan4j.core.detect.PhoneDetector;
import io.piiscan4j.core.detect.RegexDetector;
import io.piiscan4j.core.phone.PhoneValidator;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Builds the pattern {@link Detector}s for the enabled {@link PiiType}s.
 *
 * <p>Detectors are returned in the fixed type priority order
 * (CPF, CNPJ, CREDIT_CARD, SEI_PROCESS, RG, CEP, PHONE, EMAIL, DATE_BIRTH) so that iteration order
 * never decides a tie. PERSON_NAME and LOCATION have no pattern detector; they come from the
 * entity recognizer.
 */
public final class DetectorRegistry {

    static final String RG = "(?<!\\d)\\d{1,2}\\.?\\d{3}\\.?\\d{3}-?[0-9xX](?!\\d)";
    static final String CEP = "(?<!\\d)\\d{5}-?\\d{3}(?!\\d)";
    static final String SEI_PROCESS = "(?<!\\d)\\d{5}[-.\\s]?\\d{6,}/?\\d{4}[-.\\s]?\\d{2}(?!\\d)";
    static final String DATE_BIRTH =
            "(?<!\\d)(?:0?[1-9]|[12][0-9]|3[01])[/-](?:0?[1-9]|1[0-2])[/-](?:19|20)\\d{2}(?!\\d)";

    private final PhoneValidator phoneValidator;

    public DetectorRegistry(PhoneValidator phoneValidator) {
        this.phoneValidator = Objects.requireNonNull(phoneValidator, "phoneValidator");
    }

    /** Every type with a pattern detector. */
    public static EnumSet<PiiType> patternTypes() {
        EnumSet<PiiType> all = EnumSet.allOf(PiiType.class);
        all.removeIf(PiiType::isModelType);
        return all;
    }

    /**
     * Build detectors in priority order.
     *
     * @param types enabled types (null/empty means all); model types are ignored here
     * @param cfg   engine configuration (phone region)
     * @return immutable list of active detectors
     */
    public List<Detector> build(Collection<PiiType> types, ScanConfig cfg) {
        Objects.requireNonNull(cfg, "ScanConfig cannot be null");
        EnumSet<PiiType> enabled =
                (types == null || types.isEmpty()) ? patternTypes() : EnumSet.copyOf(types);

        List<Detector> out = new ArrayList<>();
        for (PiiType type : enabled) { // EnumSet iterates in declaration (= priority) order
            Detector d = create(type, cfg);
            if (d != null) out.add(d);
        }
        return List.copyOf(out);
    }

    /** Convenience: a scanner over the detectors enabled in {@code cfg}. */
    public PatternScanner scanner(ScanConfig cfg) {
        return new PatternScanner(build(cfg.enabledTypes(), cfg));
    }

    private Detector create(PiiType type, ScanConfig cfg) {
        return switch (type) {
            case CPF -> new CpfDetector();
            case CNPJ -> new CnpjDetector();
            case CREDIT_CARD -> new CreditCardDetector();
            case SEI_PROCESS -> new RegexDetector(PiiType.SEI_PROCESS, SEI_PROCESS);
            case RG -> new RegexDetector(PiiType.RG, RG);
            case CEP -> new RegexDetector(PiiType.CEP, CEP);
            case PHONE -> new PhoneDetector(phoneValidator, cfg.phoneRegion());
            case EMAIL -> new EmailDetector();
            case DATE_BIRTH -> new RegexDetector(PiiType.DATE_BIRTH, DATE_BIRTH);
            case PERSON_NAME, LOCATION -> null;
        };
    }
}
