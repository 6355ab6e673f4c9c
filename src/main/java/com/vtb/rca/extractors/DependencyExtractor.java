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
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Уязвимые зависимости из SBOM
 *
 * Пакет считается уязвимым, если его SPDXID есть в affectedPackages уязвимости.
 * Одна находка на каждую пару (пакет, уязвимость), без фильтра по severity.
 */
@Slf4j
public class DependencyExtractor implements FindingExtractor {
    
    @Override
    public FindingCategory getCategory() {
        return FindingCategory.DEPENDENCY;
    }
    
    @Override
    public List<Finding> extract(SourceDataset dataset, ExtractionContext context) {
        List<Finding> findings = new ArrayList<>();
        
        for (RawArtifact artifact : dataset.get(ArtifactType.SBOM)) {
            JsonNode sbom = JsonFields.reportBody(artifact.getJson());
            List<JsonNode> vulnerabilities = JsonFields.objects(sbom, "vulnerabilities");
            // одна нормализация severity на запись уязвимости
            Map<JsonNode, Severity> severities = new IdentityHashMap<>();
            
            for (JsonNode pkg : JsonFields.objects(sbom, "packages")) {
                String spdxId = JsonFields.optionalText(pkg, "SPDXID");
                if (spdxId == null) {
                    continue;
                }
                
                for (JsonNode vuln : vulnerabilities) {
                    if (!JsonFields.strings(vuln, "affectedPackages").contains(spdxId)) {
                        continue;
                    }
                    Severity severity = severities.computeIfAbsent(vuln, v -> context.normalizeSeverity(
                        JsonFields.optionalText(v, "severity"), artifact.getName(), JsonFields.text(v, "name")));
                    findings.add(toFinding(artifact, pkg, vuln, severity));
                }
            }
        }
        
        log.info("Уязвимых зависимостей в SBOM: {}", findings.size());
        return findings;
    }
    
    private Finding toFinding(RawArtifact artifact, JsonNode pkg, JsonNode vuln, Severity severity) {
        String packageName = JsonFields.text(pkg, "name");
        String version = JsonFields.text(pkg, "versionInfo");
        String license = JsonFields.text(pkg, "licenseConcluded");
        String vulnerability = JsonFields.text(vuln, "name");
        String id = vulnerability + ":" + packageName;
        
        Map<String, String> details = new LinkedHashMap<>();
        details.put("version", version);
        details.put("vulnerability", vulnerability);
        details.put("license", license);
        
        return Finding.builder()
            .category(FindingCategory.DEPENDENCY)
            .id(id)
            .severity(severity)
            .title(packageName + " " + version)
            .description(String.format("%s %s is affected by %s (license: %s)",
                packageName, version, vulnerability, license))
            .impactNote("Vulnerable third-party dependency")
            .sourceArtifact(artifact.getName())
            .packageName(packageName)
            .details(details)
            .build();
    }
}
