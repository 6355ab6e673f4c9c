package com.vtb.rca.cli;

import com.vtb.rca.config.AnalyzerConfig;
import com.vtb.rca.core.AnalysisPipeline;
import com.vtb.rca.integration.CICDIntegration;
import com.vtb.rca.models.AnalysisResult;
import com.vtb.rca.models.AnalysisWarning;
import com.vtb.rca.models.Correlation;
import com.vtb.rca.models.RemediationAction;
import com.vtb.rca.models.RemediationBucket;
import com.vtb.rca.models.Severity;
import com.vtb.rca.reports.JsonReportGenerator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда RCA анализатора
 */
@Slf4j
@Command(
    name = "rca-analyzer",
    mixinStandardHelpOptions = true,
    version = "VTB Infrastructure RCA Analyzer 1.0.0",
    description = """
        
        VTB Infrastructure RCA Analyzer
        
        Анализ первопричин по артефактам безопасности и соответствия
        
        Возможности:
          • Извлечение находок из Trivy, CIS Benchmark, SBOM, сетевых политик и логов
          • Корреляция находок между категориями
          • Оценка риска по фиксированной модели весов
          • План исправлений по срокам
          • Интеграция с CI/CD
        
        """
)
public class MainCommand implements Callable<Integer> {
    
    static final int EXIT_TOOL_ERROR = 2;
    
    @Parameters(
        index = "0",
        description = "Каталог с артефактами (security/, policies/, logs/)"
    )
    private Path specsDir;
    
    @Option(
        names = {"-t", "--target"},
        description = "Целевой сервис (по умолчанию из analyzer-config.yaml)"
    )
    private String targetService;
    
    @Option(
        names = {"-o", "--output"},
        description = "Директория для сохранения отчета (по умолчанию: ./reports)"
    )
    private String outputDir = "./reports";
    
    @Option(
        names = {"--fail-on-high"},
        description = "Прервать с ошибкой при уровне риска HIGH (для CI/CD)"
    )
    private boolean failOnHigh = false;
    
    @Option(
        names = {"--ci"},
        description = "Режим CI/CD (краткий вывод + exit codes)"
    )
    private boolean ciMode = false;
    
    @Option(
        names = {"--github-annotations"},
        description = "Вывести находки как аннотации GitHub Actions"
    )
    private boolean githubAnnotations = false;
    
    @Option(
        names = {"--no-parallel"},
        description = "Загружать артефакты последовательно"
    )
    private boolean noParallel = false;
    
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }
    
    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(specsDir)) {
                log.error("Каталог артефактов не найден: {}", specsDir);
                return EXIT_TOOL_ERROR;
            }
            
            AnalyzerConfig config = noParallel
                ? AnalyzerConfig.load().withParallelLoading(false)
                : AnalyzerConfig.load();
            String target = targetService != null && !targetService.isBlank()
                ? targetService
                : config.getDefaultTargetService();
            
            AnalysisPipeline pipeline = new AnalysisPipeline(config);
            AnalysisResult result = pipeline.run(specsDir, target);
            
            Path outputPath = Paths.get(outputDir);
            JsonReportGenerator jsonGen = new JsonReportGenerator();
            jsonGen.generate(result, outputPath.resolve(reportFileName(target, jsonGen.getFileExtension())));
            
            if (githubAnnotations) {
                CICDIntegration.printGitHubAnnotations(result);
            }
            
            if (ciMode) {
                CICDIntegration.printCISummary(result);
            } else {
                printDetailedResults(result);
            }
            return CICDIntegration.getExitCode(result, failOnHigh);
            
        } catch (Exception e) {
            log.error("Ошибка анализа: {}", e.getMessage(), e);
            return EXIT_TOOL_ERROR;
        }
    }
    
    /**
     * Имя файла отчета. Разделители пути в имени сервиса заменяются, файл всегда лежит в --output.
     */
    static String reportFileName(String target, String extension) {
        String safeTarget = target.replaceAll("[/\\\\:]", "_").replace("..", "_");
        return "rca-report-" + safeTarget + "." + extension;
    }
    
    /**
     * Вывести детальные результаты
     */
    private void printDetailedResults(AnalysisResult result) {
        var risk = result.getRiskAssessment();
        
        System.out.println("\n" + "=".repeat(80));
        System.out.println("ROOT CAUSE ANALYSIS - " + result.getTargetService());
        System.out.println("=".repeat(80));
        System.out.println();
        System.out.println("Дата: " + result.getGeneratedAt());
        System.out.println("Итоговый риск: " + risk.getLevel() + " (" + risk.getScore() + ")");
        System.out.println("Затронутые компоненты: " + String.join(", ", risk.getAffectedComponents()));
        System.out.println("  (из них допущение модели: " + String.join(", ", risk.getAssumedComponents()) + ")");
        System.out.println();
        
        System.out.println("НАХОДКИ: " + result.getTotalFindings());
        System.out.println("CRITICAL: " + result.countBySeverity(Severity.CRITICAL));
        System.out.println("HIGH:     " + result.countBySeverity(Severity.HIGH));
        System.out.println("MEDIUM:   " + result.countBySeverity(Severity.MEDIUM));
        System.out.println("LOW:      " + result.countBySeverity(Severity.LOW));
        System.out.println();
        
        if (!risk.getFactors().isEmpty()) {
            System.out.println("ФАКТОРЫ РИСКА:");
            risk.getFactors().forEach(f -> System.out.println("   - " + f));
            System.out.println();
        }
        
        if (!result.getCorrelations().isEmpty()) {
            System.out.println("КОРРЕЛЯЦИИ:");
            for (Correlation correlation : result.getCorrelations()) {
                System.out.printf("   [%s] %s%n", correlation.getKind().getCode(), correlation.getDescription());
            }
            System.out.println();
        }
        
        for (RemediationBucket bucket : RemediationBucket.values()) {
            var actions = result.getRemediationPlan().getActions(bucket);
            if (actions.isEmpty()) {
                continue;
            }
            System.out.println(bucket + " (" + bucket.getHorizon() + "):");
            for (RemediationAction action : actions) {
                System.out.printf("   [%s] %s → %s, %s%n",
                    action.getPriority(), action.getDescription(), action.getOwnerRole(), action.getEstimatedEffort());
            }
            System.out.println();
        }
        
        if (result.hasWarnings()) {
            System.out.println("ПРЕДУПРЕЖДЕНИЯ:");
            for (AnalysisWarning warning : result.getWarnings()) {
                System.out.printf("   [%s] %s: %s%n", warning.getType(), warning.getSource(), warning.getMessage());
            }
            System.out.println();
        }
        
        System.out.println("Отчет сохранен в: " + outputDir);
        System.out.println("=".repeat(80));
        System.out.println();
    }
}
