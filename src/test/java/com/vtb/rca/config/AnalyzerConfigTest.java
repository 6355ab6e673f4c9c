package com.vtb.rca.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerConfigTest {

    @Test
    void loadsClasspathConfig() {
        AnalyzerConfig config = AnalyzerConfig.loadResource(AnalyzerConfig.RESOURCE_NAME);

        assertEquals("payment-service", config.getDefaultTargetService());
        assertTrue(config.isParallelLoadingEnabled());
        assertEquals(30, config.getLoadTimeoutSeconds());
        assertEquals("security/trivy_vulnerability_report.json", config.getArtifacts().getVulnerabilityScan());
        assertEquals("*.log", config.getArtifacts().getLogsGlob());
    }

    @Test
    void partialConfigGetsDefaults() {
        AnalyzerConfig config = AnalyzerConfig.loadResource("analyzer-config-partial.yaml");

        assertEquals(5, config.getLoadTimeoutSeconds());
        assertEquals("inventory/sbom.json", config.getArtifacts().getSbom());
        assertEquals("security/cis_benchmark_report.json", config.getArtifacts().getComplianceBenchmark());
        assertEquals("policies", config.getArtifacts().getPoliciesDir());
        assertEquals("payment-service", config.getDefaultTargetService());
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class, () -> AnalyzerConfig.loadResource("no-such-config.yaml"));
    }

    @Test
    void invalidTimeoutIsReplaced() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.setLoadTimeoutSeconds(-3);
        config.ensureDefaults();

        assertEquals(30, config.getLoadTimeoutSeconds());
        assertNotNull(config.getArtifacts());
    }

    @Test
    void sequentialCopyLeavesOriginalUntouched() {
        AnalyzerConfig original = AnalyzerConfig.defaults();

        AnalyzerConfig sequential = original.withParallelLoading(false);

        assertFalse(sequential.isParallelLoadingEnabled());
        assertTrue(original.isParallelLoadingEnabled());
        assertEquals(original.getLoadTimeoutSeconds(), sequential.getLoadTimeoutSeconds());
        assertEquals(original.getArtifacts(), sequential.getArtifacts());
    }
}
