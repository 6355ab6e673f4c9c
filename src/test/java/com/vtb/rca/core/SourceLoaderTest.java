package com.vtb.rca.core;

import com.vtb.rca.config.AnalyzerConfig;
import com.vtb.rca.models.AnalysisWarning;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для SourceLoader
 */
class SourceLoaderTest {

    @TempDir
    Path root;

    private SourceLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SourceLoader(AnalyzerConfig.defaults());
    }

    @Test
    void missingArtifactsGiveEmptyDatasetWithoutWarnings() {
        SourceDataset dataset = loader.load(root, "payment-service");

        assertTrue(dataset.isEmpty());
        assertTrue(dataset.getWarnings().isEmpty(), "Отсутствие артефакта - не ошибка");
        for (ArtifactType type : ArtifactType.values()) {
            assertNotNull(dataset.get(type));
            assertEquals(0, dataset.skippedCount(type));
        }
    }

    @Test
    void malformedArtifactIsSkippedAndOthersLoad() throws IOException {
        write("security/trivy_vulnerability_report.json", "{ \"report\": { \"findings\": [ ");
        write("security/cis_benchmark_report.json", "{\"report\": {\"failed_checks_details\": []}}");
        write("logs/app.log", "all good");

        SourceDataset dataset = loader.load(root, "payment-service");

        assertTrue(dataset.get(ArtifactType.VULNERABILITY_SCAN).isEmpty());
        assertEquals(1, dataset.skippedCount(ArtifactType.VULNERABILITY_SCAN));
        assertEquals(1, dataset.loadedCount(ArtifactType.COMPLIANCE_BENCHMARK));
        assertEquals(1, dataset.loadedCount(ArtifactType.APPLICATION_LOG));

        assertEquals(1, dataset.getWarnings().size());
        AnalysisWarning warning = dataset.getWarnings().get(0);
        assertEquals(AnalysisWarning.Type.MALFORMED_ARTIFACT, warning.getType());
        assertEquals("trivy_vulnerability_report.json", warning.getSource());
    }

    @Test
    void nonObjectRootIsMalformed() throws IOException {
        write("security/sbom_report.json", "[1, 2, 3]");

        SourceDataset dataset = loader.load(root, "payment-service");

        assertTrue(dataset.get(ArtifactType.SBOM).isEmpty());
        assertEquals(AnalysisWarning.Type.MALFORMED_ARTIFACT, dataset.getWarnings().get(0).getType());
    }

    @Test
    void documentsAreSortedByFilenameAndFilteredByGlob() throws IOException {
        write("policies/zeta.yaml", "kind: NetworkPolicy");
        write("policies/alpha.yaml", "kind: NetworkPolicy");
        write("policies/readme.txt", "not a policy");

        SourceDataset dataset = loader.load(root, "payment-service");

        List<String> names = dataset.get(ArtifactType.NETWORK_POLICY).stream()
            .map(RawArtifact::getName)
            .collect(Collectors.toList());
        assertEquals(List.of("alpha.yaml", "zeta.yaml"), names);
        assertEquals("kind: NetworkPolicy", dataset.first(ArtifactType.NETWORK_POLICY).getText());
    }

    @Test
    void sequentialAndParallelLoadingProduceSameDataset() throws IOException {
        write("security/cis_benchmark_report.json", "{\"report\": {\"failed_checks_details\": []}}");
        write("security/sbom_report.json", "{\"packages\": []}");
        write("logs/b.log", "b");
        write("logs/a.log", "a");

        AnalyzerConfig sequentialConfig = AnalyzerConfig.defaults();
        sequentialConfig.setParallelLoading(Boolean.FALSE);

        SourceDataset parallel = loader.load(root, "payment-service");
        SourceDataset sequential = new SourceLoader(sequentialConfig).load(root, "payment-service");

        for (ArtifactType type : ArtifactType.values()) {
            assertEquals(parallel.get(type), sequential.get(type), "Тип " + type);
        }
    }

    @Test
    void parallelLoadSharesOneTimeoutWindow() {
        AnalyzerConfig config = AnalyzerConfig.defaults();
        config.setLoadTimeoutSeconds(1);
        SourceLoader slowLoader = new SourceLoader(config);

        Map<ArtifactType, Callable<SourceLoader.LoadOutcome>> tasks = new EnumMap<>(ArtifactType.class);
        for (ArtifactType type : ArtifactType.values()) {
            tasks.put(type, () -> {
                Thread.sleep(10_000);
                return SourceLoader.LoadOutcome.empty();
            });
        }

        long started = System.nanoTime();
        Map<ArtifactType, SourceLoader.LoadOutcome> outcomes = slowLoader.loadParallel(tasks);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(elapsedMs < 3_000, "Общее ожидание ограничено одним окном, было " + elapsedMs + " мс");
        for (ArtifactType type : ArtifactType.values()) {
            List<AnalysisWarning> warnings = outcomes.get(type).warnings;
            assertEquals(1, warnings.size());
            assertEquals(AnalysisWarning.Type.LOAD_TIMEOUT, warnings.get(0).getType());
        }
    }

    @Test
    void datasetIsImmutable() {
        SourceDataset dataset = loader.load(root, "payment-service");

        assertThrows(UnsupportedOperationException.class,
            () -> dataset.get(ArtifactType.SBOM).add(RawArtifact.document(ArtifactType.SBOM, "x", "y")));
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
