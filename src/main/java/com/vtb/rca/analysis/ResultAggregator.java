package com.vtb.rca.analysis;

import com.vtb.rca.core.InvariantViolationException;
import com.vtb.rca.models.AnalysisResult;
import com.vtb.rca.models.AnalysisStatistics;
import com.vtb.rca.models.AnalysisWarning;
import com.vtb.rca.models.Correlation;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.RemediationAction;
import com.vtb.rca.models.RemediationPlan;
import com.vtb.rca.models.RiskAssessment;
import com.vtb.rca.models.RiskLevel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Сборка итогового AnalysisResult
 *
 * Перед сборкой проверяет внутренние инварианты. Нарушение означает ошибку в логике
 * анализатора, поэтому бросается InvariantViolationException, а не предупреждение.
 */
@Slf4j
public class ResultAggregator {
    
    private final Clock clock;
    
    public ResultAggregator() {
        this(Clock.systemDefaultZone());
    }
    
    public ResultAggregator(Clock clock) {
        this.clock = clock;
    }
    
    public AnalysisResult aggregate(String targetService,
                                    Map<FindingCategory, List<Finding>> findings,
                                    List<Correlation> correlations,
                                    RiskAssessment assessment,
                                    RemediationPlan plan,
                                    List<AnalysisWarning> warnings,
                                    AnalysisStatistics statistics) {
        verifyFindings(findings);
        verifyCorrelations(findings, correlations);
        verifyAssessment(assessment);
        verifyPlan(plan);
        
        Map<FindingCategory, List<Finding>> frozen = new EnumMap<>(FindingCategory.class);
        for (FindingCategory category : FindingCategory.values()) {
            List<Finding> list = findings.get(category);
            frozen.put(category, list != null ? List.copyOf(list) : List.of());
        }
        
        AnalysisResult result = AnalysisResult.builder()
            .targetService(targetService)
            .generatedAt(LocalDateTime.now(clock))
            .findings(Collections.unmodifiableMap(frozen))
            .correlations(List.copyOf(correlations))
            .riskAssessment(assessment)
            .remediationPlan(plan)
            .warnings(warnings != null ? List.copyOf(warnings) : List.of())
            .statistics(statistics != null ? statistics : AnalysisStatistics.builder().build())
            .build();
        
        log.debug("Результат анализа собран: {} находок, {} корреляций", result.getTotalFindings(),
            result.getCorrelations().size());
        return result;
    }
    
    private void verifyFindings(Map<FindingCategory, List<Finding>> findings) {
        Set<String> keys = new HashSet<>();
        findings.forEach((category, list) -> {
            for (Finding finding : list) {
                if (finding.getCategory() != category) {
                    throw new InvariantViolationException(
                        "Находка " + finding.getId() + " категории " + finding.getCategory() + " лежит в группе " + category);
                }
                if (!keys.add(finding.key())) {
                    throw new InvariantViolationException("Дубликат находки " + finding.key());
                }
            }
        });
    }
    
    private void verifyCorrelations(Map<FindingCategory, List<Finding>> findings, List<Correlation> correlations) {
        Set<String> ids = new HashSet<>();
        findings.values().forEach(list -> list.forEach(f -> ids.add(f.getId())));
        
        for (Correlation correlation : correlations) {
            if (correlation.getRelatedFindingIds().isEmpty()) {
                throw new InvariantViolationException("Корреляция " + correlation.getKind().getCode() + " без находок");
            }
            for (String id : correlation.getRelatedFindingIds()) {
                if (!ids.contains(id)) {
                    throw new InvariantViolationException(
                        "Корреляция " + correlation.getKind().getCode() + " ссылается на несуществующую находку " + id);
                }
            }
        }
    }
    
    private void verifyAssessment(RiskAssessment assessment) {
        if (assessment.getScore() < 0) {
            throw new InvariantViolationException("Отрицательный балл риска: " + assessment.getScore());
        }
        RiskLevel expected = RiskLevel.fromScore(assessment.getScore());
        if (assessment.getLevel() != expected) {
            throw new InvariantViolationException(String.format(
                "Уровень риска %s не соответствует баллу %d (ожидался %s)",
                assessment.getLevel(), assessment.getScore(), expected));
        }
    }
    
    private void verifyPlan(RemediationPlan plan) {
        for (RemediationAction action : plan.getImmediate()) {
            boolean validCategory = action.getOriginCategory() == FindingCategory.VULNERABILITY
                || action.getOriginCategory() == FindingCategory.COMPLIANCE;
            boolean validSeverity = action.getOriginSeverity() != null && action.getOriginSeverity().isHighOrCritical();
            if (!action.isFindingDerived() || !validCategory || !validSeverity) {
                throw new InvariantViolationException("Срочное действие без подходящей исходной находки: "
                    + action.getDescription());
            }
        }
    }
}
