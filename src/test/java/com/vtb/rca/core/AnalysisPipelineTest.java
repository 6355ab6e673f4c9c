package com.vtb.rca.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.rca.config.AnalyzerConfig;
import com.vtb.rca.models.AnalysisResult;
import com.vtb.rca.models.AnalysisWarning;
import com.vtb.rca.models.Correlation;
import com.vtb.rca.models.CorrelationKind;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.RemediationAction;
import com.vtb.rca.models.RiskLevel;
import com.vtb.rca.reports.JsonReportGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Сквозные тесты конвейера на фикстурах из src/test/resources/fixtures/specs
 */
class AnalysisPipelineTest {

    private static final String TARGET = "payment-service";
    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-14T12:00:00Z"), ZoneOffset.UTC);

    private AnalysisPipeline pipeline;
    private Path specs;

    @BeforeEach
    void setUp() throws Exception {
        pipeline = new AnalysisPipeline(AnalyzerConfig.defaults(), FIXED);
        specs = Paths.get(getClass().getResource("/fixtures/specs").toURI());
    }

    @Test
    void fullRunOnFixtures() {
        AnalysisResult result = pipeline.run(specs, TARGET);

        assertEquals(TARGET, result.getTargetService());
        assertEquals(2, result.getFindings(FindingCategory.VULNERABILITY).size());
        assertEquals(2, result.getFindings(FindingCategory.COMPLIANCE).size());
        assertEquals(2, result.getFindings(FindingCategory.MISCONFIGURATION).size());
        assertEquals(2, result.getFindings(FindingCategory.DEPENDENCY).size());
        assertEquals(2, result.getFindings(FindingCategory.APPLICATION_ERROR).size());
        assertEquals(10, result.getTotalFindings());

        assertEquals(List.of("KSV012", "network-policy:payment-service-netpol.yaml"),
            ids(result.getFindings(FindingCategory.MISCONFIGURATION)));
        assertEquals(List.of("CVE-2023-0286:openssl", "CVE-2022-37434:zlib"),
            ids(result.getFindings(FindingCategory.DEPENDENCY)));

        assertEquals(39, result.getRiskAssessment().getScore());
        assertEquals(RiskLevel.CRITICAL, result.getRiskAssessment().getLevel());
        assertEquals(List.of(
            "Critical vulnerability: CVE-2023-0286",
            "High vulnerability: CVE-2023-44487",
            "Critical compliance failure: 5.1.1",
            "High compliance failure: 5.2.2",
            "High misconfiguration: Runs as root user",
            "High misconfiguration: Overly permissive network policy"), result.getRiskAssessment().getFactors());

        List<Correlation> correlations = result.getCorrelations();
        assertEquals(List.of(CorrelationKind.VULNERABILITY_DEPENDENCY_LINK, CorrelationKind.COMPLIANCE_CONFIG_LINK,
            CorrelationKind.NETWORK_ERROR_LINK),
            correlations.stream().map(Correlation::getKind).collect(Collectors.toList()));
        assertEquals(List.of("CVE-2023-0286", "CVE-2023-0286:openssl"), correlations.get(0).getRelatedFindingIds());

        assertEquals(4, result.getRemediationPlan().getImmediate().size());
        assertEquals(2, result.getRemediationPlan().getShortTerm().size());
        assertEquals(3, result.getRemediationPlan().getLongTerm().size());
        assertEquals(5, result.getRemediationPlan().getMonitoring().size());
        assertEquals("Remove cluster-admin bindings from payment-service service accounts",
            result.getRemediationPlan().getImmediate().get(2).getDescription());

        assertFalse(result.hasWarnings());
        assertEquals(10, result.getStatistics().getTotalFindings());
        assertEquals(3, result.getStatistics().getTotalCorrelations());
        assertEquals(2, result.getStatistics().getArtifactsLoaded().get(ArtifactType.APPLICATION_LOG.name()));
    }

    @Test
    void everyCorrelationReferencesExistingFindings() {
        AnalysisResult result = pipeline.run(specs, TARGET);

        Set<String> ids = new HashSet<>();
        result.getFindings().values().forEach(list -> list.forEach(f -> ids.add(f.getId())));
        for (Correlation correlation : result.getCorrelations()) {
            assertFalse(correlation.getRelatedFindingIds().isEmpty());
            assertTrue(ids.containsAll(correlation.getRelatedFindingIds()));
        }
        for (RemediationAction action : result.getRemediationPlan().getImmediate()) {
            assertTrue(ids.contains(action.getOriginFindingId()));
        }
    }

    @Test
    void findingKeysAreUnique() {
        AnalysisResult result = pipeline.run(specs, TARGET);

        List<String> keys = result.getFindings().values().stream()
            .flatMap(List::stream)
            .map(Finding::key)
            .collect(Collectors.toList());
        assertEquals(keys.size(), new HashSet<>(keys).size());
    }

    @Test
    void otherTargetSkipsPaymentPolicy() {
        AnalysisResult result = pipeline.run(specs, "frontend");

        List<Finding> misconfigurations = result.getFindings(FindingCategory.MISCONFIGURATION);
        assertEquals(List.of("KSV012", "network-policy:frontend-netpol.yaml"), ids(misconfigurations));
        assertEquals("frontend", result.getRiskAssessment().getAffectedComponents().iterator().next());
    }

    @Test
    void emptyDirectoryGivesLowRiskAndTemplatesOnly(@TempDir Path empty) {
        AnalysisResult result = pipeline.run(empty, TARGET);

        assertEquals(0, result.getTotalFindings());
        assertEquals(0, result.getRiskAssessment().getScore());
        assertEquals(RiskLevel.LOW, result.getRiskAssessment().getLevel());
        assertTrue(result.getCorrelations().isEmpty());
        assertTrue(result.getRemediationPlan().getImmediate().isEmpty());
        assertEquals(3, result.getRemediationPlan().getLongTerm().size());
        assertEquals(5, result.getRemediationPlan().getMonitoring().size());
        assertFalse(result.hasWarnings());
    }

    @Test
    void repeatedRunsRenderIdentically() throws Exception {
        JsonReportGenerator generator = new JsonReportGenerator();

        String first = generator.render(pipeline.run(specs, TARGET));
        String second = generator.render(new AnalysisPipeline(AnalyzerConfig.defaults(), FIXED).run(specs, TARGET));

        assertEquals(first, second);
    }

    @Test
    void duplicateFindingsAreDroppedWithWarning() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        String trivy = "{\"report\": {\"findings\": [{\"vulnerability_id\": \"CVE-1\", \"package_name\": \"openssl\","
            + " \"severity\": \"CRITICAL\"}]}}";
        SourceDataset dataset = SourceDataset.builder()
            .add(RawArtifact.structured(ArtifactType.VULNERABILITY_SCAN, "first.json", mapper.readTree(trivy)))
            .add(RawArtifact.structured(ArtifactType.VULNERABILITY_SCAN, "second.json", mapper.readTree(trivy)))
            .build();

        AnalysisResult result = pipeline.run(dataset, TARGET);

        List<Finding> vulnerabilities = result.getFindings(FindingCategory.VULNERABILITY);
        assertEquals(1, vulnerabilities.size());
        assertEquals("first.json", vulnerabilities.get(0).getSourceArtifact());
        assertEquals(10, result.getRiskAssessment().getScore());
        assertEquals(1, result.getWarnings().size());
        AnalysisWarning warning = result.getWarnings().get(0);
        assertEquals(AnalysisWarning.Type.DUPLICATE_FINDING, warning.getType());
        assertEquals("second.json", warning.getSource());
    }

    @Test
    void sameCveInTwoPackagesIsScoredTwice() throws Exception {
        String trivy = """
            {"report": {"findings": [
              {"vulnerability_id": "CVE-2023-0286", "package_name": "libssl3", "severity": "CRITICAL"},
              {"vulnerability_id": "CVE-2023-0286", "package_name": "libcrypto3", "severity": "CRITICAL"}
            ]}}
            """;
        SourceDataset dataset = SourceDataset.builder()
            .add(RawArtifact.structured(ArtifactType.VULNERABILITY_SCAN, "trivy.json", new ObjectMapper().readTree(trivy)))
            .build();

        AnalysisResult result = pipeline.run(dataset, TARGET);

        assertEquals(2, result.getFindings(FindingCategory.VULNERABILITY).size());
        assertEquals(20, result.getRiskAssessment().getScore());
        assertEquals(RiskLevel.CRITICAL, result.getRiskAssessment().getLevel());
        assertEquals(List.of("Critical vulnerability: CVE-2023-0286", "Critical vulnerability: CVE-2023-0286"),
            result.getRiskAssessment().getFactors());
        List<String> immediate = result.getRemediationPlan().getImmediate().stream()
            .map(RemediationAction::getDescription)
            .collect(Collectors.toList());
        assertEquals(List.of("Update libssl3 to fix CVE-2023-0286", "Update libcrypto3 to fix CVE-2023-0286"),
            immediate);
        assertFalse(result.hasWarnings());
    }

    @Test
    void resultCannotBeModifiedThroughNestedCollections() {
        AnalysisResult result = pipeline.run(specs, TARGET);
        Finding vulnerability = result.getFindings(FindingCategory.VULNERABILITY).get(0);

        assertThrows(UnsupportedOperationException.class, () -> vulnerability.getDetails().put("cvss_score", "0.0"));
        assertThrows(UnsupportedOperationException.class,
            () -> result.getStatistics().getArtifactsLoaded().put(ArtifactType.SBOM.name(), 99));
        assertThrows(UnsupportedOperationException.class,
            () -> result.getRiskAssessment().getFactors().clear());
        assertThrows(UnsupportedOperationException.class,
            () -> result.getCorrelations().get(0).getRelatedFindingIds().clear());
        assertThrows(UnsupportedOperationException.class,
            () -> result.getRemediationPlan().getImmediate().clear());
    }

    @Test
    void blankTargetIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> pipeline.run(SourceDataset.empty(), " "));
    }

    private static List<String> ids(List<Finding> findings) {
        return findings.stream().map(Finding::getId).collect(Collectors.toList());
    }
}
