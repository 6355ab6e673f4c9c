package com.vtb.rca.core;

import com.vtb.rca.analysis.Correlator;
import com.vtb.rca.analysis.RemediationPlanner;
import com.vtb.rca.analysis.ResultAggregator;
import com.vtb.rca.analysis.RiskScorer;
import com.vtb.rca.config.AnalyzerConfig;
import com.vtb.rca.extractors.ApplicationErrorExtractor;
import com.vtb.rca.extractors.ComplianceExtractor;
import com.vtb.rca.extractors.DependencyExtractor;
import com.vtb.rca.extractors.ExtractionContext;
import com.vtb.rca.extractors.FindingExtractor;
import com.vtb.rca.extractors.MisconfigurationExtractor;
import com.vtb.rca.extractors.VulnerabilityExtractor;
import com.vtb.rca.models.AnalysisResult;
import com.vtb.rca.models.AnalysisStatistics;
import com.vtb.rca.models.AnalysisWarning;
import com.vtb.rca.models.Correlation;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.RemediationPlan;
import com.vtb.rca.models.RiskAssessment;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Главный конвейер RCA анализа
 * Координирует загрузку, извлечение, корреляцию, оценку риска и план исправлений
 *
 * Стадии выполняются строго последовательно, каждая получает полный результат предыдущей.
 */
@Slf4j
public class AnalysisPipeline {
    
    private final SourceLoader loader;
    private final List<FindingExtractor> extractors = new ArrayList<>();
    private final Correlator correlator = new Correlator();
    private final RiskScorer riskScorer = new RiskScorer();
    private final RemediationPlanner planner = new RemediationPlanner();
    private final ResultAggregator aggregator;
    
    public AnalysisPipeline(AnalyzerConfig config) {
        this(config, Clock.systemDefaultZone());
    }
    
    public AnalysisPipeline(AnalyzerConfig config, Clock clock) {
        this.loader = new SourceLoader(config);
        this.aggregator = new ResultAggregator(clock);
        initializeExtractors();
    }
    
    /**
     * Инициализация экстракторов. Порядок = порядок категорий в отчете.
     */
    private void initializeExtractors() {
        extractors.add(new VulnerabilityExtractor());
        extractors.add(new ComplianceExtractor());
        extractors.add(new MisconfigurationExtractor());
        extractors.add(new DependencyExtractor());
        extractors.add(new ApplicationErrorExtractor());
        log.debug("Загружено {} экстракторов", extractors.size());
    }
    
    /**
     * Запустить полный анализ по каталогу артефактов
     */
    public AnalysisResult run(Path specsRoot, String targetService) {
        return run(loader.load(specsRoot, targetService), targetService);
    }
    
    /**
     * Запустить анализ по уже загруженному набору данных
     */
    public AnalysisResult run(SourceDataset dataset, String targetService) {
        if (targetService == null || targetService.isBlank()) {
            throw new IllegalArgumentException("Целевой сервис не указан");
        }
        log.info("=== Начало RCA анализа: {} ===", targetService);
        long startTime = System.currentTimeMillis();
        
        ExtractionContext context = new ExtractionContext(targetService);
        List<AnalysisWarning> duplicates = new ArrayList<>();
        Map<FindingCategory, List<Finding>> findings = extractAll(dataset, context, duplicates);
        
        List<Finding> allFindings = new ArrayList<>();
        findings.values().forEach(allFindings::addAll);
        
        List<Correlation> correlations = correlator.correlate(findings);
        RiskAssessment assessment = riskScorer.score(allFindings, targetService);
        RemediationPlan plan = planner.plan(findings, correlations);
        
        List<AnalysisWarning> warnings = new ArrayList<>(dataset.getWarnings());
        warnings.addAll(context.getWarnings());
        warnings.addAll(duplicates);
        if (!warnings.isEmpty()) {
            log.warn("Предупреждений анализа: {}", warnings.size());
        }
        
        AnalysisResult result = aggregator.aggregate(targetService, findings, correlations, assessment, plan,
            warnings, buildStatistics(dataset, findings, correlations));
        
        log.info("=== Анализ завершен за {} мс: {} находок, риск {} ({}) ===",
            System.currentTimeMillis() - startTime, allFindings.size(),
            assessment.getLevel(), assessment.getScore());
        return result;
    }
    
    /**
     * Извлечь находки всеми экстракторами.
     * Повтор пары (категория, id) отбрасывается с предупреждением, первая находка остается.
     */
    private Map<FindingCategory, List<Finding>> extractAll(SourceDataset dataset, ExtractionContext context,
                                                           List<AnalysisWarning> duplicates) {
        Map<FindingCategory, List<Finding>> findings = new EnumMap<>(FindingCategory.class);
        for (FindingCategory category : FindingCategory.values()) {
            findings.put(category, new ArrayList<>());
        }
        
        Set<String> seen = new HashSet<>();
        for (FindingExtractor extractor : extractors) {
            log.debug("Запуск экстрактора: {}", extractor.getClass().getSimpleName());
            for (Finding finding : extractor.extract(dataset, context)) {
                if (!seen.add(finding.key())) {
                    log.warn("Дубликат находки {} из {} пропущен", finding.key(), finding.getSourceArtifact());
                    duplicates.add(AnalysisWarning.of(AnalysisWarning.Type.DUPLICATE_FINDING,
                        finding.getSourceArtifact(), "Повторная находка " + finding.getId() + " пропущена"));
                    continue;
                }
                findings.get(finding.getCategory()).add(finding);
            }
        }
        return findings;
    }
    
    private AnalysisStatistics buildStatistics(SourceDataset dataset,
                                               Map<FindingCategory, List<Finding>> findings,
                                               List<Correlation> correlations) {
        Map<String, Integer> loaded = new LinkedHashMap<>();
        Map<String, Integer> skipped = new LinkedHashMap<>();
        for (ArtifactType type : ArtifactType.values()) {
            loaded.put(type.name(), dataset.loadedCount(type));
            skipped.put(type.name(), dataset.skippedCount(type));
        }
        
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<FindingCategory, List<Finding>> entry : findings.entrySet()) {
            byCategory.put(entry.getKey().name(), entry.getValue().size());
            total += entry.getValue().size();
        }
        
        return AnalysisStatistics.builder()
            .artifactsLoaded(loaded)
            .artifactsSkipped(skipped)
            .findingsByCategory(byCategory)
            .totalFindings(total)
            .totalCorrelations(correlations.size())
            .build();
    }
}
