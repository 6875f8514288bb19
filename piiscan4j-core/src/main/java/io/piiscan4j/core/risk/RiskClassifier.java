/*
 * Copyright (c) 2025 Piiscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.piiscan4j.core.risk;

import io.piiscan4j.core.api.model.PiiType;
import io.piiscan4j.core.api.model.RiskLevel;
import io.piiscan4j.core.preset.ScanConfig;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rule-priority classifier over PII counts (one record or a whole process). The first matching rule,
 * evaluated from CRITICO down, decides the level:
 * <ol>
 *   <li>CRITICO: any CPF, RG or CREDIT_CARD</li>
 *   <li>ALTO: EMAIL or PHONE above the high-volume threshold</li>
 *   <li>MEDIO: any PERSON_NAME or LOCATION</li>
 *   <li>BAIXO: anything else detected</li>
 *   <li>MINIMO: nothing detected</li>
 * </ol>
 */
public final class RiskClassifier {
    private static final Set<PiiType> CRITICAL = EnumSet.of(PiiType.CPF, PiiType.RG, PiiType.CREDIT_CARD);
    private static final Set<PiiType> CONTACT = EnumSet.of(PiiType.EMAIL, PiiType.PHONE);
    private static final Set<PiiType> IDENTITY = EnumSet.of(PiiType.PERSON_NAME, PiiType.LOCATION);

    private final long highVolumeThreshold;

    public RiskClassifier() {
        this(ScanConfig.DEFAULT_HIGH_VOLUME_THRESHOLD);
    }

    public RiskClassifier(long highVolumeThreshold) {
        if (highVolumeThreshold < 0) {
            throw new IllegalArgumentException("highVolumeThreshold must be >= 0: " + highVolumeThreshold);
        }
        this.highVolumeThreshold = highVolumeThreshold;
    }

    public long highVolumeThreshold() {
        return highVolumeThreshold;
    }

    public RiskLevel classify(Map<PiiType, ? extends Number> counts) {
        if (counts == null || counts.isEmpty()) return RiskLevel.MINIMO;
        if (anyAbove(counts, CRITICAL, 0)) return RiskLevel.CRITICO;
        if (anyAbove(counts, CONTACT, highVolumeThreshold)) return RiskLevel.ALTO;
        if (anyAbove(counts, IDENTITY, 0)) return RiskLevel.MEDIO;
        if (anyAbove(counts, EnumSet.allOf(PiiType.class), 0)) return RiskLevel.BAIXO;
        return RiskLevel.MINIMO;
    }

    /** LGPD handling recommendations for a classified scope. */
    public List<String> recommendations(RiskLevel level, Map<PiiType, ? extends Number> counts) {
        List<String> out = new ArrayList<>();
        if (level.isAtLeast(RiskLevel.ALTO)) {
            out.add("Implementar criptografia adicional para armazenamento");
            out.add("Restringir acesso aos dados apenas a usuários autorizados");
            out.add("Implementar log de auditoria para todos os acessos");
        }
        if (count(counts, PiiType.CPF) > 0 || count(counts, PiiType.RG) > 0) {
            out.add("Documentos de identificação detectados - considerar pseudonimização");
        }
        if (count(counts, PiiType.EMAIL) > 0 || count(counts, PiiType.PHONE) > 0) {
            out.add("Dados de contato detectados - obter consentimento explícito para uso");
        }
        if (count(counts, PiiType.CREDIT_CARD) > 0) {
            out.add("URGENTE: Dados financeiros detectados - validar compliance PCI-DSS");
        }
        if (out.isEmpty()) out.add("Manter boas práticas de segurança da informação");
        return List.copyOf(out);
    }

    private static boolean anyAbove(Map<PiiType, ? extends Number> counts, Set<PiiType> types, long threshold) {
        for (PiiType t : types) {
            if (count(counts, t) > threshold) return true;
        }
        return false;
    }

    private static long count(Map<PiiType, ? extends Number> counts, PiiType type) {
        if (counts == null) return 0;
        Number n = counts.get(type);
        return n == null ? 0 : n.longValue();
    }
}
