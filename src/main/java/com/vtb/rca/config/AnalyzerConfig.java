package com.vtb.rca.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Конфигурация анализатора из YAML файла
 * Пути к артефактам и параметры загрузки вынесены из кода
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {
    
    static final String RESOURCE_NAME = "analyzer-config.yaml";
    
    private static final String DEFAULT_TARGET_SERVICE = "payment-service";
    private static final int DEFAULT_LOAD_TIMEOUT_SEC = 30;
    
    private String defaultTargetService;
    private Boolean parallelLoading;
    private Integer loadTimeoutSeconds;
    private Artifacts artifacts;
    
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Artifacts {
        private String complianceBenchmark;
        private String vulnerabilityScan;
        private String sbom;
        private String policiesDir;
        private String policiesGlob;
        private String logsDir;
        private String logsGlob;
        
        void ensureDefaults() {
            if (isBlank(complianceBenchmark)) {
                complianceBenchmark = "security/cis_benchmark_report.json";
            }
            if (isBlank(vulnerabilityScan)) {
                vulnerabilityScan = "security/trivy_vulnerability_report.json";
            }
            if (isBlank(sbom)) {
                sbom = "security/sbom_report.json";
            }
            if (isBlank(policiesDir)) {
                policiesDir = "policies";
            }
            if (isBlank(policiesGlob)) {
                policiesGlob = "*.yaml";
            }
            if (isBlank(logsDir)) {
                logsDir = "logs";
            }
            if (isBlank(logsGlob)) {
                logsGlob = "*.log";
            }
        }
    }
    
    private static AnalyzerConfig instance;
    
    /**
     * Загрузить конфигурацию из classpath
     */
    public static synchronized AnalyzerConfig load() {
        if (instance == null) {
            instance = loadResource(RESOURCE_NAME);
        }
        return instance;
    }
    
    static AnalyzerConfig loadResource(String resourceName) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = AnalyzerConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                throw new IllegalStateException(resourceName + " не найден в classpath");
            }
            AnalyzerConfig config = mapper.readValue(is, AnalyzerConfig.class);
            if (config == null) {
                config = new AnalyzerConfig();
            }
            config.ensureDefaults();
            log.debug("Конфигурация загружена из {}", resourceName);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }
    
    /**
     * Конфигурация по умолчанию без чтения classpath (для тестов и встраивания)
     */
    public static AnalyzerConfig defaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.ensureDefaults();
        return config;
    }
    
    public void ensureDefaults() {
        if (isBlank(defaultTargetService)) {
            defaultTargetService = DEFAULT_TARGET_SERVICE;
        }
        if (parallelLoading == null) {
            parallelLoading = Boolean.TRUE;
        }
        if (loadTimeoutSeconds == null || loadTimeoutSeconds <= 0) {
            loadTimeoutSeconds = DEFAULT_LOAD_TIMEOUT_SEC;
        }
        if (artifacts == null) {
            artifacts = new Artifacts();
        }
        artifacts.ensureDefaults();
    }
    
    /**
     * Копия с другим режимом загрузки; общий экземпляр из load() не меняется
     */
    public AnalyzerConfig withParallelLoading(boolean parallel) {
        AnalyzerConfig copy = new AnalyzerConfig();
        copy.setDefaultTargetService(defaultTargetService);
        copy.setParallelLoading(parallel);
        copy.setLoadTimeoutSeconds(loadTimeoutSeconds);
        copy.setArtifacts(artifacts);
        copy.ensureDefaults();
        return copy;
    }
    
    public boolean isParallelLoadingEnabled() {
        return parallelLoading == null || parallelLoading;
    }
    
    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
