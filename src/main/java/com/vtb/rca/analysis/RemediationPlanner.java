package com.vtb.rca.analysis;

import com.vtb.rca.extractors.VulnerabilityExtractor;
import com.vtb.rca.models.ActionOrigin;
import com.vtb.rca.models.Correlation;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.RemediationAction;
import com.vtb.rca.models.RemediationBucket;
import com.vtb.rca.models.RemediationPlan;
import com.vtb.rca.models.RemediationPriority;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Построение плана исправлений
 *
 * IMMEDIATE и SHORT_TERM строятся из находок (origin = FINDING),
 * LONG_TERM и MONITORING - стандартные практики из шаблона (origin = TEMPLATE)
 * и от находок не зависят.
 */
@Slf4j
public class RemediationPlanner {
    
    private static final List<RemediationAction> LONG_TERM_TEMPLATE = List.of(
        template("Implement automated vulnerability scanning in CI/CD pipeline",
            RemediationPriority.MEDIUM, "1-2 weeks", "DevSecOps Team", RemediationBucket.LONG_TERM),
        template("Establish CIS benchmark compliance monitoring",
            RemediationPriority.MEDIUM, "1 week", "Platform Team", RemediationBucket.LONG_TERM),
        template("Implement SBOM generation and analysis in build process",
            RemediationPriority.LOW, "2-3 weeks", "Development Team", RemediationBucket.LONG_TERM)
    );
    
    private static final List<RemediationAction> MONITORING_TEMPLATE = List.of(
        monitoring("Implement continuous vulnerability scanning"),
        monitoring("Set up CIS compliance monitoring alerts"),
        monitoring("Monitor network policy violations"),
        monitoring("Track application error rates and patterns"),
        monitoring("Regular SBOM analysis and dependency updates")
    );
    
    /**
     * Построить план
     *
     * @param findings находки по категориям
     * @param correlations связи между находками; отдельных действий сейчас не порождают,
     *                     но учитываются в логе плана
     */
    public RemediationPlan plan(Map<FindingCategory, List<Finding>> findings, List<Correlation> correlations) {
        List<RemediationAction> immediate = new ArrayList<>();
        List<RemediationAction> shortTerm = new ArrayList<>();
        
        for (Finding vuln : of(findings, FindingCategory.VULNERABILITY)) {
            if (!vuln.getSeverity().isHighOrCritical()) {
                continue;
            }
            immediate.add(fromFinding(vuln,
                "Update " + vuln.getPackageName() + " to fix "
                    + vuln.detailOrDefault(VulnerabilityExtractor.DETAIL_VULNERABILITY_ID, vuln.getId()),
                RemediationPriority.CRITICAL, "2-4 hours", "DevSecOps Team", RemediationBucket.IMMEDIATE));
        }
        
        for (Finding check : of(findings, FindingCategory.COMPLIANCE)) {
            if (!check.getSeverity().isHighOrCritical()) {
                continue;
            }
            String action = check.getRemediationHint() != null
                ? check.getRemediationHint()
                : "Resolve compliance check " + check.getId();
            immediate.add(fromFinding(check, action,
                RemediationPriority.HIGH, "1-2 hours", "Platform Team", RemediationBucket.IMMEDIATE));
        }
        
        for (Finding misconfig : of(findings, FindingCategory.MISCONFIGURATION)) {
            String action = misconfig.getRemediationHint() != null
                ? misconfig.getRemediationHint()
                : "Review configuration: " + (misconfig.getTitle() != null ? misconfig.getTitle() : misconfig.getId());
            shortTerm.add(fromFinding(misconfig, action,
                RemediationPriority.MEDIUM, "4-8 hours", "Development Team", RemediationBucket.SHORT_TERM));
        }
        
        log.info("План исправлений: {} срочных, {} краткосрочных (корреляций учтено: {})",
            immediate.size(), shortTerm.size(), correlations != null ? correlations.size() : 0);
        
        return RemediationPlan.builder()
            .immediate(List.copyOf(immediate))
            .shortTerm(List.copyOf(shortTerm))
            .longTerm(LONG_TERM_TEMPLATE)
            .monitoring(MONITORING_TEMPLATE)
            .build();
    }
    
    private static RemediationAction fromFinding(Finding finding, String description, RemediationPriority priority,
                                                 String effort, String owner, RemediationBucket bucket) {
        return RemediationAction.builder()
            .description(description)
            .priority(priority)
            .estimatedEffort(effort)
            .ownerRole(owner)
            .bucket(bucket)
            .origin(ActionOrigin.FINDING)
            .originFindingId(finding.getId())
            .originCategory(finding.getCategory())
            .originSeverity(finding.getSeverity())
            .build();
    }
    
    private static RemediationAction template(String description, RemediationPriority priority,
                                              String effort, String owner, RemediationBucket bucket) {
        return RemediationAction.builder()
            .description(description)
            .priority(priority)
            .estimatedEffort(effort)
            .ownerRole(owner)
            .bucket(bucket)
            .origin(ActionOrigin.TEMPLATE)
            .build();
    }
    
    private static RemediationAction monitoring(String description) {
        return template(description, RemediationPriority.LOW, "ongoing", "Operations Team", RemediationBucket.MONITORING);
    }
    
    private static List<Finding> of(Map<FindingCategory, List<Finding>> findings, FindingCategory category) {
        List<Finding> list = findings.get(category);
        return list != null ? list : List.of();
    }
}
