package com.vtb.rca.extractors;

import com.vtb.rca.core.ArtifactType;
import com.vtb.rca.core.RawArtifact;
import com.vtb.rca.core.SourceDataset;
import com.vtb.rca.models.Finding;
import com.vtb.rca.models.FindingCategory;
import com.vtb.rca.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ошибки приложения в логах
 *
 * Ищутся два фиксированных маркера, не более одной находки на маркер в документе:
 * - HTTP 405 Method Not Allowed
 * - CrashLoopBackOff
 */
@Slf4j
public class ApplicationErrorExtractor implements FindingExtractor {
    
    public static final String KIND_HTTP_ERROR = "http_error";
    public static final String KIND_POD_FAILURE = "pod_failure";
    
    @Override
    public FindingCategory getCategory() {
        return FindingCategory.APPLICATION_ERROR;
    }
    
    @Override
    public List<Finding> extract(SourceDataset dataset, ExtractionContext context) {
        List<Finding> findings = new ArrayList<>();
        
        for (RawArtifact logDocument : dataset.get(ArtifactType.APPLICATION_LOG)) {
            String content = logDocument.getText() != null ? logDocument.getText() : "";
            String lower = content.toLowerCase(Locale.ROOT);
            String source = logDocument.getName();
            
            if (content.contains("405") && lower.contains("method not allowed")) {
                Map<String, String> details = new LinkedHashMap<>();
                details.put("code", "405");
                findings.add(Finding.builder()
                    .category(FindingCategory.APPLICATION_ERROR)
                    .id("http-405:" + source)
                    .severity(Severity.MEDIUM)
                    .kind(KIND_HTTP_ERROR)
                    .title("Method Not Allowed")
                    .description("Method Not Allowed error detected")
                    .impactNote("API authentication/authorization issue")
                    .sourceArtifact(source)
                    .details(details)
                    .build());
            }
            
            if (lower.contains("crashloopbackoff")) {
                Map<String, String> details = new LinkedHashMap<>();
                details.put("status", "CrashLoopBackOff");
                findings.add(Finding.builder()
                    .category(FindingCategory.APPLICATION_ERROR)
                    .id("crashloop:" + source)
                    .severity(Severity.HIGH)
                    .kind(KIND_POD_FAILURE)
                    .title("CrashLoopBackOff")
                    .description("Pod repeatedly crashing")
                    .impactNote("Application stability issue")
                    .sourceArtifact(source)
                    .details(details)
                    .build());
            }
        }
        
        log.info("Ошибок приложения в логах: {}", findings.size());
        return findings;
    }
}
