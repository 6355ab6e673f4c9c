package com.vtb.rca.analysis;

import com.vtb.rca.extractors.VulnerabilityExtractor;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.RiskAssessment;
import com.vtb.rca.models.RiskLevel;
import com.vtb.rca.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Аддитивная модель риска с фиксированной таблицей весов
 *
 * | категория        | critical | high |
 * |------------------|----------|------|
 * | vulnerability    | 10       | 5    |
 * | compliance       | 8        | 4    |
 * | misconfiguration | -        | 6    |
 *
 * Остальные комбинации дают 0 и не попадают в факторы.
 * Веса воспроизводятся как контракт, а не как откалиброванная модель риска.
 */
@Slf4j
public class RiskScorer {
    
    /**
     * Допущение модели о радиусе поражения, не обнаруженный факт
     */
    public static final List<String> ASSUMED_INFRASTRUCTURE = List.of(
        "kubernetes-cluster",
        "network-infrastructure",
        "container-runtime"
    );
    
    private static final List<FindingCategory> SCORED_CATEGORIES = List.of(
        FindingCategory.VULNERABILITY,
        FindingCategory.COMPLIANCE,
        FindingCategory.MISCONFIGURATION
    );
    
    private static final Map<FindingCategory, Map<Severity, Integer>> WEIGHTS = new EnumMap<>(FindingCategory.class);
    private static final Map<FindingCategory, String> FACTOR_LABELS = new EnumMap<>(FindingCategory.class);
    
    static {
        Map<Severity, Integer> vulnerability = new EnumMap<>(Severity.class);
        vulnerability.put(Severity.CRITICAL, 10);
        vulnerability.put(Severity.HIGH, 5);
        WEIGHTS.put(FindingCategory.VULNERABILITY, vulnerability);
        
        Map<Severity, Integer> compliance = new EnumMap<>(Severity.class);
        compliance.put(Severity.CRITICAL, 8);
        compliance.put(Severity.HIGH, 4);
        WEIGHTS.put(FindingCategory.COMPLIANCE, compliance);
        
        Map<Severity, Integer> misconfiguration = new EnumMap<>(Severity.class);
        misconfiguration.put(Severity.HIGH, 6);
        WEIGHTS.put(FindingCategory.MISCONFIGURATION, misconfiguration);
        
        FACTOR_LABELS.put(FindingCategory.VULNERABILITY, "vulnerability");
        FACTOR_LABELS.put(FindingCategory.COMPLIANCE, "compliance failure");
        FACTOR_LABELS.put(FindingCategory.MISCONFIGURATION, "misconfiguration");
    }
    
    /**
     * Посчитать риск
     *
     * Сумма не зависит от порядка находок. Факторы идут по категориям
     * (уязвимости, CIS, конфигурация), внутри категории от critical к high,
     * при равенстве в порядке обнаружения.
     */
    public RiskAssessment score(Collection<Finding> findings, String targetService) {
        int score = 0;
        List<String> factors = new ArrayList<>();
        
        for (FindingCategory category : SCORED_CATEGORIES) {
            List<Finding> ordered = findings.stream()
                .filter(f -> f.getCategory() == category)
                .sorted(Comparator.comparingInt((Finding f) -> f.getSeverity().getPriority()).reversed())
                .collect(Collectors.toList());
            
            for (Finding finding : ordered) {
                int points = weight(category, finding.getSeverity());
                if (points == 0) {
                    continue;
                }
                score += points;
                factors.add(factor(finding));
            }
        }
        
        RiskLevel level = RiskLevel.fromScore(score);
        
        Set<String> affected = new LinkedHashSet<>();
        if (targetService != null) {
            affected.add(targetService);
        }
        affected.addAll(ASSUMED_INFRASTRUCTURE);
        
        log.info("Риск: {} (балл {}, факторов {})", level, score, factors.size());
        return RiskAssessment.builder()
            .score(score)
            .level(level)
            .factors(List.copyOf(factors))
            .affectedComponents(Collections.unmodifiableSet(affected))
            .assumedComponents(Collections.unmodifiableSet(new LinkedHashSet<>(ASSUMED_INFRASTRUCTURE)))
            .build();
    }
    
    public static int weight(FindingCategory category, Severity severity) {
        Map<Severity, Integer> table = WEIGHTS.get(category);
        if (table == null) {
            return 0;
        }
        return table.getOrDefault(severity, 0);
    }
    
    private static String factor(Finding finding) {
        String severity = finding.getSeverity() == Severity.CRITICAL ? "Critical" : "High";
        String subject;
        if (finding.getCategory() == FindingCategory.MISCONFIGURATION && finding.getTitle() != null) {
            subject = finding.getTitle();
        } else if (finding.getCategory() == FindingCategory.VULNERABILITY) {
            subject = finding.detailOrDefault(VulnerabilityExtractor.DETAIL_VULNERABILITY_ID, finding.getId());
        } else {
            subject = finding.getId();
        }
        return severity + " " + FACTOR_LABELS.get(finding.getCategory()) + ": " + subject;
    }
}
