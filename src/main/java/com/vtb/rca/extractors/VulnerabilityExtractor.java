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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Уязвимости контейнера из отчета Trivy (report.findings)
 * Берутся только HIGH и CRITICAL.
 *
 * Trivy часто сообщает одну CVE для нескольких пакетов (libssl3 и libcrypto3).
 * Такие записи остаются отдельными находками с id "CVE@пакет"; CVE без повторов
 * сохраняет голый id. Исходный идентификатор всегда лежит в details[vulnerability_id].
 */
@Slf4j
public class VulnerabilityExtractor implements FindingExtractor {
    
    public static final String DETAIL_VULNERABILITY_ID = "vulnerability_id";
    
    static final String IMPACT = "Container security vulnerability";
    static final String PACKAGE_SEPARATOR = "@";
    
    @Override
    public FindingCategory getCategory() {
        return FindingCategory.VULNERABILITY;
    }
    
    @Override
    public List<Finding> extract(SourceDataset dataset, ExtractionContext context) {
        List<Finding> findings = new ArrayList<>();
        
        for (RawArtifact artifact : dataset.get(ArtifactType.VULNERABILITY_SCAN)) {
            JsonNode report = JsonFields.reportBody(artifact.getJson());
            List<JsonNode> entries = JsonFields.objects(report, "findings");
            Map<String, Set<String>> packagesByCve = packagesByCve(entries);
            
            for (JsonNode entry : entries) {
                String cve = JsonFields.text(entry, "vulnerability_id");
                String packageName = JsonFields.text(entry, "package_name");
                String id = packagesByCve.get(cve).size() > 1
                    ? cve + PACKAGE_SEPARATOR + packageName
                    : cve;
                
                Severity severity = context.normalizeSeverity(
                    JsonFields.optionalText(entry, "severity"), artifact.getName(), id);
                if (!severity.isHighOrCritical()) {
                    continue;
                }
                
                Map<String, String> details = new LinkedHashMap<>();
                details.put(DETAIL_VULNERABILITY_ID, cve);
                String cvss = JsonFields.optionalText(entry, "cvss_score");
                details.put("cvss_score", cvss != null ? cvss : "0");
                
                findings.add(Finding.builder()
                    .category(FindingCategory.VULNERABILITY)
                    .id(id)
                    .severity(severity)
                    .title(cve + " - " + packageName)
                    .description(JsonFields.text(entry, "description"))
                    .impactNote(IMPACT)
                    .sourceArtifact(artifact.getName())
                    .packageName(packageName)
                    .details(details)
                    .build());
            }
        }
        
        log.info("Уязвимостей HIGH/CRITICAL: {}", findings.size());
        return findings;
    }
    
    /**
     * Различные пакеты каждой CVE в пределах одного отчета
     */
    private static Map<String, Set<String>> packagesByCve(List<JsonNode> entries) {
        Map<String, Set<String>> result = new HashMap<>();
        for (JsonNode entry : entries) {
            result.computeIfAbsent(JsonFields.text(entry, "vulnerability_id"), k -> new HashSet<>())
                .add(JsonFields.text(entry, "package_name"));
        }
        return result;
    }
}
