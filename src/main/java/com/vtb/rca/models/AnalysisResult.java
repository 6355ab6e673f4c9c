package com.vtb.rca.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Итог одного запуска анализа. Единственная точка передачи внешним
 * генераторам отчетов и CI/CD интеграции. Собирается только в ResultAggregator.
 */
@Value
@Builder
public class AnalysisResult {
    String targetService;
    LocalDateTime generatedAt;
    Map<FindingCategory, List<Finding>> findings;
    List<Correlation> correlations;
    RiskAssessment riskAssessment;
    RemediationPlan remediationPlan;
    List<AnalysisWarning> warnings;
    AnalysisStatistics statistics;
    
    public List<Finding> getFindings(FindingCategory category) {
        return findings.getOrDefault(category, List.of());
    }
    
    @JsonIgnore
    public int getTotalFindings() {
        return findings.values().stream().mapToInt(List::size).sum();
    }
    
    public int countBySeverity(Severity severity) {
        return (int) findings.values().stream()
            .flatMap(List::stream)
            .filter(f -> f.getSeverity() == severity)
            .count();
    }
    
    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
