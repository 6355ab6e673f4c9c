package com.vtb.rca.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.rca.config.AnalyzerConfig;
import com.vtb.rca.models.AnalysisWarning;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Загрузчик артефактов безопасности и соответствия
 *
 * Каждый тип артефакта опционален: отсутствующий файл дает пустой список,
 * битый файл пропускается с предупреждением и не прерывает запуск.
 * Типы грузятся независимо (параллельно, если включено), но набор данных
 * всегда собирается в порядке ArtifactType, а не в порядке завершения.
 */
@Slf4j
public class SourceLoader {
    
    private static final int MAX_THREADS = 4;
    
    private final AnalyzerConfig config;
    private final ObjectMapper objectMapper;
    
    public SourceLoader(AnalyzerConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper();
    }
    
    /**
     * Загрузить все артефакты из каталога спецификаций
     *
     * @param specsRoot корень каталога (security/, policies/, logs/)
     * @param targetService имя целевого сервиса
     */
    public SourceDataset load(Path specsRoot, String targetService) {
        if (specsRoot == null) {
            throw new IllegalArgumentException("Каталог артефактов не указан");
        }
        log.info("Загрузка артефактов для {} из {}", targetService, specsRoot.toAbsolutePath());
        
        Map<ArtifactType, Callable<LoadOutcome>> tasks = createTasks(specsRoot);
        Map<ArtifactType, LoadOutcome> outcomes = config.isParallelLoadingEnabled()
            ? loadParallel(tasks)
            : loadSequential(tasks);
        
        SourceDataset.Builder builder = SourceDataset.builder();
        for (ArtifactType type : ArtifactType.values()) {
            LoadOutcome outcome = outcomes.get(type);
            builder.addAll(type, outcome.artifacts);
            outcome.warnings.forEach(w -> builder.skipped(type, w));
        }
        SourceDataset dataset = builder.build();
        
        for (ArtifactType type : ArtifactType.values()) {
            log.debug("{}: загружено {}, пропущено {}", type, dataset.loadedCount(type), dataset.skippedCount(type));
        }
        return dataset;
    }
    
    private Map<ArtifactType, Callable<LoadOutcome>> createTasks(Path root) {
        AnalyzerConfig.Artifacts paths = config.getArtifacts();
        Map<ArtifactType, Callable<LoadOutcome>> tasks = new EnumMap<>(ArtifactType.class);
        tasks.put(ArtifactType.COMPLIANCE_BENCHMARK,
            () -> loadJson(ArtifactType.COMPLIANCE_BENCHMARK, root.resolve(paths.getComplianceBenchmark())));
        tasks.put(ArtifactType.VULNERABILITY_SCAN,
            () -> loadJson(ArtifactType.VULNERABILITY_SCAN, root.resolve(paths.getVulnerabilityScan())));
        tasks.put(ArtifactType.SBOM,
            () -> loadJson(ArtifactType.SBOM, root.resolve(paths.getSbom())));
        tasks.put(ArtifactType.NETWORK_POLICY,
            () -> loadDocuments(ArtifactType.NETWORK_POLICY, root.resolve(paths.getPoliciesDir()), paths.getPoliciesGlob()));
        tasks.put(ArtifactType.APPLICATION_LOG,
            () -> loadDocuments(ArtifactType.APPLICATION_LOG, root.resolve(paths.getLogsDir()), paths.getLogsGlob()));
        return tasks;
    }
    
    private Map<ArtifactType, LoadOutcome> loadSequential(Map<ArtifactType, Callable<LoadOutcome>> tasks) {
        Map<ArtifactType, LoadOutcome> outcomes = new EnumMap<>(ArtifactType.class);
        tasks.forEach((type, task) -> {
            try {
                outcomes.put(type, task.call());
            } catch (Exception e) {
                log.error("Ошибка загрузки {}: {}", type, e.getMessage(), e);
                outcomes.put(type, LoadOutcome.failed(AnalysisWarning.Type.MALFORMED_ARTIFACT, type.name(), e.getMessage()));
            }
        });
        return outcomes;
    }
    
    /**
     * Параллельная загрузка. Все типы укладываются в одно общее окно loadTimeoutSeconds,
     * отсчитываемое от запуска задач.
     */
    Map<ArtifactType, LoadOutcome> loadParallel(Map<ArtifactType, Callable<LoadOutcome>> tasks) {
        int timeoutSec = config.getLoadTimeoutSeconds();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(MAX_THREADS, tasks.size())));
        Map<ArtifactType, LoadOutcome> outcomes = new EnumMap<>(ArtifactType.class);
        try {
            Map<ArtifactType, Future<LoadOutcome>> futures = new EnumMap<>(ArtifactType.class);
            tasks.forEach((type, task) -> futures.put(type, executor.submit(task)));
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSec);
            
            for (Map.Entry<ArtifactType, Future<LoadOutcome>> entry : futures.entrySet()) {
                ArtifactType type = entry.getKey();
                Future<LoadOutcome> future = entry.getValue();
                try {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    outcomes.put(type, future.get(remaining, TimeUnit.NANOSECONDS));
                } catch (TimeoutException e) {
                    future.cancel(true);
                    log.warn("TIMEOUT: загрузка {} не завершилась за {} секунд, артефакт пропущен", type, timeoutSec);
                    outcomes.put(type, LoadOutcome.failed(AnalysisWarning.Type.LOAD_TIMEOUT, type.name(),
                        "Загрузка не завершилась за " + timeoutSec + " с"));
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Ошибка загрузки {}: {}", type, cause.getMessage(), cause);
                    outcomes.put(type, LoadOutcome.failed(AnalysisWarning.Type.MALFORMED_ARTIFACT, type.name(),
                        String.valueOf(cause.getMessage())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    log.warn("Загрузка {} прервана", type);
                    outcomes.put(type, LoadOutcome.failed(AnalysisWarning.Type.LOAD_TIMEOUT, type.name(),
                        "Загрузка прервана"));
                }
            }
        } finally {
            executor.shutdownNow();
        }
        return outcomes;
    }
    
    LoadOutcome loadJson(ArtifactType type, Path file) {
        String name = file.getFileName().toString();
        if (!Files.exists(file)) {
            log.info("Артефакт {} не найден ({}), пропускаем", type, file);
            return LoadOutcome.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || !root.isObject()) {
                log.warn("Артефакт {} пропущен: корень документа не является объектом", name);
                return LoadOutcome.failed(AnalysisWarning.Type.MALFORMED_ARTIFACT, name,
                    "Корень документа не является JSON объектом");
            }
            log.info("Загружен {}: {}", type, name);
            return LoadOutcome.of(RawArtifact.structured(type, name, root));
        } catch (IOException e) {
            log.warn("Артефакт {} пропущен: {}", name, e.getMessage());
            return LoadOutcome.failed(AnalysisWarning.Type.MALFORMED_ARTIFACT, name,
                "Не удалось разобрать JSON: " + e.getMessage());
        }
    }
    
    LoadOutcome loadDocuments(ArtifactType type, Path dir, String glob) {
        if (!Files.isDirectory(dir)) {
            log.info("Каталог {} для {} не найден, пропускаем", dir, type);
            return LoadOutcome.empty();
        }
        
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, glob)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.warn("Не удалось прочитать каталог {}: {}", dir, e.getMessage());
            return LoadOutcome.failed(AnalysisWarning.Type.MALFORMED_ARTIFACT, dir.getFileName().toString(),
                "Не удалось прочитать каталог: " + e.getMessage());
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        
        LoadOutcome outcome = new LoadOutcome();
        for (Path file : files) {
            String name = file.getFileName().toString();
            try {
                outcome.artifacts.add(RawArtifact.document(type, name, Files.readString(file, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Документ {} пропущен: {}", name, e.getMessage());
                outcome.warnings.add(AnalysisWarning.of(AnalysisWarning.Type.MALFORMED_ARTIFACT, name,
                    "Не удалось прочитать документ: " + e.getMessage()));
            }
        }
        log.info("Загружено {} документов {} из {}", outcome.artifacts.size(), type, dir.getFileName());
        return outcome;
    }
    
    /**
     * Результат загрузки одного типа артефактов; у каждого пути загрузки свой экземпляр
     */
    static final class LoadOutcome {
        final List<RawArtifact> artifacts = new ArrayList<>();
        final List<AnalysisWarning> warnings = new ArrayList<>();
        
        static LoadOutcome empty() {
            return new LoadOutcome();
        }
        
        static LoadOutcome of(RawArtifact artifact) {
            LoadOutcome outcome = new LoadOutcome();
            outcome.artifacts.add(artifact);
            return outcome;
        }
        
        static LoadOutcome failed(AnalysisWarning.Type type, String source, String message) {
            LoadOutcome outcome = new LoadOutcome();
            outcome.warnings.add(AnalysisWarning.of(type, source, message));
            return outcome;
        }
    }
}
