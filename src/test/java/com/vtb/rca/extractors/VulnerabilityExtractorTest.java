package com.vtb.rca.extractors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.rca.core.ArtifactType;
import com.vtb.rca.core.RawArtifact;
import com.vtb.rca.core.SourceDataset;
import com.vtb.rca.models.AnalysisWarning;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VulnerabilityExtractorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final VulnerabilityExtractor extractor = new VulnerabilityExtractor();

    @Test
    void keepsOnlyHighAndCritical() throws Exception {
        SourceDataset dataset = trivy("""
            {"report": {"findings": [
              {"vulnerability_id": "CVE-1", "package_name": "openssl", "severity": "CRITICAL", "cvss_score": 9.8, "description": "d1"},
              {"vulnerability_id": "CVE-2", "package_name": "curl", "severity": "high", "description": "d2"},
              {"vulnerability_id": "CVE-3", "package_name": "zlib", "severity": "MEDIUM", "description": "d3"}
            ]}}
            """);
        ExtractionContext context = new ExtractionContext("payment-service");

        List<Finding> findings = extractor.extract(dataset, context);

        assertEquals(2, findings.size());
        Finding first = findings.get(0);
        assertEquals(FindingCategory.VULNERABILITY, first.getCategory());
        assertEquals("CVE-1", first.getId());
        assertEquals(Severity.CRITICAL, first.getSeverity());
        assertEquals("openssl", first.getPackageName());
        assertEquals("9.8", first.getDetails().get("cvss_score"));
        assertEquals("trivy.json", first.getSourceArtifact());
        assertEquals(Severity.HIGH, findings.get(1).getSeverity());
        assertEquals("0", findings.get(1).getDetails().get("cvss_score"));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void sameCveInSeveralPackagesGivesOneFindingPerPackage() throws Exception {
        SourceDataset dataset = trivy("""
            {"report": {"findings": [
              {"vulnerability_id": "CVE-2023-0286", "package_name": "libssl3", "severity": "CRITICAL"},
              {"vulnerability_id": "CVE-2023-0286", "package_name": "libcrypto3", "severity": "CRITICAL"},
              {"vulnerability_id": "CVE-2023-44487", "package_name": "golang.org/x/net", "severity": "HIGH"}
            ]}}
            """);

        List<Finding> findings = extractor.extract(dataset, new ExtractionContext("svc"));

        assertEquals(3, findings.size());
        assertEquals("CVE-2023-0286@libssl3", findings.get(0).getId());
        assertEquals("CVE-2023-0286@libcrypto3", findings.get(1).getId());
        assertEquals("CVE-2023-44487", findings.get(2).getId(), "CVE без повторов сохраняет голый id");
        assertEquals("CVE-2023-0286",
            findings.get(1).getDetails().get(VulnerabilityExtractor.DETAIL_VULNERABILITY_ID));
        assertTrue(findings.get(0).getTitle().startsWith("CVE-2023-0286 "));
    }

    @Test
    void lowAndMediumOnlyGivesNothing() throws Exception {
        SourceDataset dataset = trivy("""
            {"report": {"findings": [
              {"vulnerability_id": "CVE-3", "package_name": "zlib", "severity": "MEDIUM"},
              {"vulnerability_id": "CVE-4", "package_name": "zlib", "severity": "low"}
            ]}}
            """);

        assertTrue(extractor.extract(dataset, new ExtractionContext("svc")).isEmpty());
    }

    @Test
    void unrecognizedSeverityBecomesLowWithWarning() throws Exception {
        SourceDataset dataset = trivy("""
            {"report": {"findings": [
              {"vulnerability_id": "CVE-9", "package_name": "zlib", "severity": "SEVERE"},
              {"vulnerability_id": "CVE-10", "package_name": "zlib"}
            ]}}
            """);
        ExtractionContext context = new ExtractionContext("svc");

        List<Finding> findings = extractor.extract(dataset, context);

        assertTrue(findings.isEmpty(), "LOW не проходит фильтр high/critical");
        assertEquals(2, context.getWarnings().size());
        assertEquals(AnalysisWarning.Type.UNRECOGNIZED_SEVERITY, context.getWarnings().get(0).getType());
        assertTrue(context.getWarnings().get(0).getMessage().contains("CVE-9"));
    }

    @Test
    void incompleteRecordUsesUnknownDefaults() throws Exception {
        SourceDataset dataset = trivy("{\"findings\": [{\"severity\": \"HIGH\"}, \"garbage\"]}");

        List<Finding> findings = extractor.extract(dataset, new ExtractionContext("svc"));

        assertEquals(1, findings.size());
        assertEquals("unknown", findings.get(0).getId());
        assertEquals("unknown", findings.get(0).getPackageName());
        assertEquals("unknown", findings.get(0).getDescription());
    }

    private static SourceDataset trivy(String json) throws Exception {
        return SourceDataset.builder()
            .add(RawArtifact.structured(ArtifactType.VULNERABILITY_SCAN, "trivy.json", MAPPER.readTree(json)))
            .build();
    }
}
