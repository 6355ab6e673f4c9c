package com.vtb.rca.analysis;

import com.vtb.rca.extractors.MisconfigurationExtractor;
import com.vtb.rca.models.Correlation;
import com.vtb.rca.models.CorrelationKind;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Корреляция находок между категориями
 *
 * Точность намеренно разная:
 * 1. Уязвимость ↔ зависимость: точное совпадение имени пакета
 * 2. CIS ↔ конфигурация: только совместное присутствие категорий
 * 3. Ошибки приложения ↔ сетевые политики: совместное присутствие
 * Это сигнал для триажа, а не доказательство причинности.
 */
@Slf4j
public class Correlator {
    
    static final String UNKNOWN_PACKAGE = "unknown";
    
    /**
     * Найти связи. Порядок результата фиксирован и совпадает с порядком правил.
     */
    public List<Correlation> correlate(Map<FindingCategory, List<Finding>> findings) {
        List<Correlation> correlations = new ArrayList<>();
        
        linkVulnerabilitiesToDependencies(findings, correlations);
        linkComplianceToConfiguration(findings, correlations);
        linkErrorsToNetworkPolicies(findings, correlations);
        
        log.info("Найдено корреляций: {}", correlations.size());
        return correlations;
    }
    
    private void linkVulnerabilitiesToDependencies(Map<FindingCategory, List<Finding>> findings,
                                                   List<Correlation> correlations) {
        List<Finding> vulnerabilities = of(findings, FindingCategory.VULNERABILITY);
        List<Finding> dependencies = of(findings, FindingCategory.DEPENDENCY);
        
        Set<String> shared = new TreeSet<>(packages(vulnerabilities));
        shared.retainAll(packages(dependencies));
        if (shared.isEmpty()) {
            return;
        }
        
        Set<String> related = new LinkedHashSet<>();
        vulnerabilities.stream().filter(f -> shared.contains(f.getPackageName())).forEach(f -> related.add(f.getId()));
        dependencies.stream().filter(f -> shared.contains(f.getPackageName())).forEach(f -> related.add(f.getId()));
        
        log.debug("Уязвимые пакеты присутствуют в SBOM: {}", shared);
        correlations.add(Correlation.builder()
            .kind(CorrelationKind.VULNERABILITY_DEPENDENCY_LINK)
            .description("Vulnerable packages found in SBOM: " + shared)
            .impactNote("Direct security vulnerability in application dependencies")
            .relatedFindingIds(List.copyOf(related))
            .build());
    }
    
    private void linkComplianceToConfiguration(Map<FindingCategory, List<Finding>> findings,
                                               List<Correlation> correlations) {
        List<Finding> compliance = of(findings, FindingCategory.COMPLIANCE);
        List<Finding> misconfigurations = of(findings, FindingCategory.MISCONFIGURATION);
        if (compliance.isEmpty() || misconfigurations.isEmpty()) {
            return;
        }
        
        correlations.add(Correlation.builder()
            .kind(CorrelationKind.COMPLIANCE_CONFIG_LINK)
            .description("CIS compliance failures related to container and network misconfigurations")
            .impactNote("Infrastructure security posture compromised")
            .relatedFindingIds(ids(compliance, misconfigurations))
            .build());
    }
    
    private void linkErrorsToNetworkPolicies(Map<FindingCategory, List<Finding>> findings,
                                             List<Correlation> correlations) {
        List<Finding> errors = of(findings, FindingCategory.APPLICATION_ERROR);
        List<Finding> networkPolicies = of(findings, FindingCategory.MISCONFIGURATION).stream()
            .filter(f -> f.hasKind(MisconfigurationExtractor.KIND_NETWORK_POLICY))
            .collect(Collectors.toList());
        if (errors.isEmpty() || networkPolicies.isEmpty()) {
            return;
        }
        
        correlations.add(Correlation.builder()
            .kind(CorrelationKind.NETWORK_ERROR_LINK)
            .description("Application errors potentially caused by restrictive network policies")
            .impactNote("Service availability affected by security controls")
            .relatedFindingIds(ids(errors, networkPolicies))
            .build());
    }
    
    /**
     * Имена пакетов; "unknown" не считается общим идентификатором
     */
    private static Set<String> packages(List<Finding> findings) {
        return findings.stream()
            .map(Finding::getPackageName)
            .filter(name -> name != null && !UNKNOWN_PACKAGE.equals(name))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }
    
    private static List<String> ids(List<Finding> first, List<Finding> second) {
        Set<String> ids = new LinkedHashSet<>();
        first.forEach(f -> ids.add(f.getId()));
        second.forEach(f -> ids.add(f.getId()));
        return List.copyOf(ids);
    }
    
    private static List<Finding> of(Map<FindingCategory, List<Finding>> findings, FindingCategory category) {
        List<Finding> list = findings.get(category);
        return list != null ? list : List.of();
    }
}
