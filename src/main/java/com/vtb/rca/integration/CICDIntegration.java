package com.vtb.rca.integration;

import com.vtb.rca.models.AnalysisResult;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.RiskLevel;
import com.vtb.rca.models.Severity;
import lombok.extern.slf4j.Slf4j;

/**
 * Интеграция с CI/CD системами
 * GitHub Actions, GitLab CI и т.д.
 */
@Slf4j
public class CICDIntegration {
    
    private CICDIntegration() {
    }
    
    /**
     * Определить exit code на основе уровня риска
     * 
     * @param result результат анализа
     * @param failOnHigh прерывать ли сборку при уровне риска HIGH
     * @return exit code (0 = успех, 1 = провал)
     */
    public static int getExitCode(AnalysisResult result, boolean failOnHigh) {
        if (result == null || result.getRiskAssessment() == null) {
            log.warn("Результат анализа null, возвращаем код успеха");
            return 0;
        }
        
        RiskLevel level = result.getRiskAssessment().getLevel();
        if (level == RiskLevel.CRITICAL) {
            log.error("Уровень риска CRITICAL. Сборка провалена.");
            return 1;
        }
        
        if (failOnHigh && level == RiskLevel.HIGH) {
            log.error("Уровень риска HIGH. Сборка провалена (--fail-on-high).");
            return 1;
        }
        
        log.info("Критичного уровня риска не обнаружено");
        return 0;
    }
    
    /**
     * Вывести краткую сводку для CI/CD
     */
    public static void printCISummary(AnalysisResult result) {
        if (result == null) {
            log.warn("Результат анализа null, пропускаем вывод");
            return;
        }
        
        System.out.println("\n=== RCA Summary ===");
        System.out.println("Service: " + result.getTargetService());
        System.out.println("Generated: " + result.getGeneratedAt());
        System.out.println("Risk: " + result.getRiskAssessment().getLevel()
            + " (score " + result.getRiskAssessment().getScore() + ")");
        System.out.println("\nFindings:");
        for (FindingCategory category : FindingCategory.values()) {
            System.out.printf("  %-18s %d%n", category.getCode() + ":", result.getFindings(category).size());
        }
        System.out.println("\n  CRITICAL: " + result.countBySeverity(Severity.CRITICAL));
        System.out.println("  HIGH:     " + result.countBySeverity(Severity.HIGH));
        System.out.println("  MEDIUM:   " + result.countBySeverity(Severity.MEDIUM));
        System.out.println("  LOW:      " + result.countBySeverity(Severity.LOW));
        System.out.println("\nCorrelations: " + result.getCorrelations().size());
        System.out.println("Immediate actions: " + result.getRemediationPlan().getImmediate().size());
        System.out.println("Warnings: " + result.getWarnings().size());
        System.out.println("===================\n");
    }
    
    /**
     * Создать аннотации для GitHub Actions
     */
    public static void printGitHubAnnotations(AnalysisResult result) {
        if (result == null) {
            return;
        }
        
        result.getFindings().values().forEach(list -> list.forEach(finding -> {
            String level = switch (finding.getSeverity()) {
                case CRITICAL, HIGH -> "error";
                case MEDIUM -> "warning";
                default -> "notice";
            };
            System.out.printf("::%s file=%s,title=%s::%s - %s%n",
                level,
                finding.getSourceArtifact() != null ? finding.getSourceArtifact() : "N/A",
                finding.getCategory().getCode(),
                finding.getId(),
                finding.getDescription() != null ? finding.getDescription() : "");
        }));
        result.getWarnings().forEach(w ->
            System.out.printf("::warning file=%s,title=%s::%s%n", w.getSource(), w.getType(), w.getMessage()));
    }
}
