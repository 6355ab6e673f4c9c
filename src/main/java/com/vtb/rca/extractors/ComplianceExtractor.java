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

/**
 * Проваленные проверки CIS Benchmark (report.failed_checks_details)
 * Берутся только high и critical.
 */
@Slf4j
public class ComplianceExtractor implements FindingExtractor {
    
    static final String IMPACT = "Kubernetes security compliance violation";
    
    @Override
    public FindingCategory getCategory() {
        return FindingCategory.COMPLIANCE;
    }
    
    @Override
    public List<Finding> extract(SourceDataset dataset, ExtractionContext context) {
        List<Finding> findings = new ArrayList<>();
        
        for (RawArtifact artifact : dataset.get(ArtifactType.COMPLIANCE_BENCHMARK)) {
            JsonNode report = JsonFields.reportBody(artifact.getJson());
            
            for (JsonNode check : JsonFields.objects(report, "failed_checks_details")) {
                String id = JsonFields.text(check, "id");
                Severity severity = context.normalizeSeverity(
                    JsonFields.optionalText(check, "severity"), artifact.getName(), id);
                if (!severity.isHighOrCritical()) {
                    continue;
                }
                
                findings.add(Finding.builder()
                    .category(FindingCategory.COMPLIANCE)
                    .id(id)
                    .severity(severity)
                    .title(id)
                    .description(JsonFields.text(check, "description"))
                    .remediationHint(JsonFields.optionalText(check, "remediation"))
                    .impactNote(IMPACT)
                    .sourceArtifact(artifact.getName())
                    .build());
            }
        }
        
        log.info("Нарушений CIS high/critical: {}", findings.size());
        return findings;
    }
}
