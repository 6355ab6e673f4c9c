package com.vtb.rca.core;

/**
 * Типы входных артефактов. Порядок объявления задает порядок сборки набора данных.
 */
public enum ArtifactType {
    COMPLIANCE_BENCHMARK(true),
    VULNERABILITY_SCAN(true),
    SBOM(true),
    NETWORK_POLICY(false),
    APPLICATION_LOG(false);
    
    private final boolean structured;
    
    ArtifactType(boolean structured) {
        this.structured = structured;
    }
    
    /**
     * true для JSON документов, false для текстовых (политики, логи)
     */
    public boolean isStructured() {
        return structured;
    }
}
