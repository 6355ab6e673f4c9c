package com.vtb.rca.extractors;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.rca.core.ArtifactType;
import com.vtb.rca.core.RawArtifact;
import com.vtb.rca.core.SourceDataset;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ошибки конфигурации
 *
 * Два источника:
 * 1. report.misconfigurations из Trivy, только HIGH
 * 2. Эвристика по сетевым политикам целевого сервиса: "allow" + "any" в тексте
 *
 * Эвристика смотрит только документы, в имени файла которых есть имя целевого сервиса
 * (без учета регистра). Политики других сервисов из того же каталога не проверяются
 * и находок не дают, даже если содержат "allow" и "any".
 */
@Slf4j
public class MisconfigurationExtractor implements FindingExtractor {
    
    public static final String KIND_CONTAINER = "container_misconfiguration";
    public static final String KIND_NETWORK_POLICY = "network_policy";
    
    static final String PERMISSIVE_POLICY_TITLE = "Overly permissive network policy";
    static final String PERMISSIVE_POLICY_MESSAGE = "Network policy allows traffic from any source";
    static final String PERMISSIVE_POLICY_RESOLUTION = "Restrict network policies to specific namespaces/services";
    
    @Override
    public FindingCategory getCategory() {
        return FindingCategory.MISCONFIGURATION;
    }
    
    @Override
    public List<Finding> extract(SourceDataset dataset, ExtractionContext context) {
        List<Finding> findings = new ArrayList<>();
        extractContainerMisconfigurations(dataset, context, findings);
        extractPermissivePolicies(dataset, context, findings);
        log.info("Ошибок конфигурации: {}", findings.size());
        return findings;
    }
    
    private void extractContainerMisconfigurations(SourceDataset dataset, ExtractionContext context,
                                                   List<Finding> findings) {
        for (RawArtifact artifact : dataset.get(ArtifactType.VULNERABILITY_SCAN)) {
            JsonNode report = JsonFields.reportBody(artifact.getJson());
            
            for (JsonNode entry : JsonFields.objects(report, "misconfigurations")) {
                String title = JsonFields.text(entry, "title");
                String explicitId = JsonFields.optionalText(entry, "id");
                String id = explicitId != null ? explicitId : title;
                
                Severity severity = context.normalizeSeverity(
                    JsonFields.optionalText(entry, "severity"), artifact.getName(), id);
                if (severity != Severity.HIGH) {
                    continue;
                }
                
                findings.add(Finding.builder()
                    .category(FindingCategory.MISCONFIGURATION)
                    .id(id)
                    .severity(severity)
                    .kind(KIND_CONTAINER)
                    .title(title)
                    .description(JsonFields.text(entry, "message"))
                    .remediationHint(JsonFields.optionalText(entry, "resolution"))
                    .impactNote("Container configuration weakness")
                    .sourceArtifact(artifact.getName())
                    .build());
            }
        }
    }
    
    /**
     * Грубая текстовая эвристика: политика целевого сервиса с "allow" и "any" считается слишком открытой.
     * Это сигнал для триажа, а не разбор YAML.
     */
    private void extractPermissivePolicies(SourceDataset dataset, ExtractionContext context,
                                           List<Finding> findings) {
        String target = context.getTargetService() != null
            ? context.getTargetService().toLowerCase(Locale.ROOT)
            : "";
        
        for (RawArtifact policy : dataset.get(ArtifactType.NETWORK_POLICY)) {
            String fileName = policy.getName() != null ? policy.getName() : "";
            if (!fileName.toLowerCase(Locale.ROOT).contains(target)) {
                continue;
            }
            if (!isPermissive(policy.getText())) {
                continue;
            }
            
            log.debug("Слишком открытая сетевая политика: {}", fileName);
            findings.add(Finding.builder()
                .category(FindingCategory.MISCONFIGURATION)
                .id("network-policy:" + fileName)
                .severity(Severity.HIGH)
                .kind(KIND_NETWORK_POLICY)
                .title(PERMISSIVE_POLICY_TITLE)
                .description(PERMISSIVE_POLICY_MESSAGE)
                .remediationHint(PERMISSIVE_POLICY_RESOLUTION)
                .impactNote("Lateral movement path into " + context.getTargetService())
                .sourceArtifact(fileName)
                .build());
        }
    }
    
    static boolean isPermissive(String content) {
        if (content == null) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return lower.contains("allow") && lower.contains("any");
    }
}
