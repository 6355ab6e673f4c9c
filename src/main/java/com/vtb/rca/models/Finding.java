package com.vtb.rca.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Нормализованная находка безопасности или соответствия.
 * Создается экстрактором из одного артефакта и больше не меняется.
 */
@Value
public class Finding {
    FindingCategory category;
    String id;
    Severity severity;
    String title;
    String description;
    String remediationHint;
    String impactNote;
    String sourceArtifact;
    
    // container_misconfiguration, network_policy, http_error, pod_failure
    String kind;
    String packageName;
    
    Map<String, String> details;
    
    @Builder
    private Finding(@NonNull FindingCategory category, @NonNull String id, @NonNull Severity severity,
                    String title, String description, String remediationHint, String impactNote,
                    String sourceArtifact, String kind, String packageName, Map<String, String> details) {
        this.category = category;
        this.id = id;
        this.severity = severity;
        this.title = title;
        this.description = description;
        this.remediationHint = remediationHint;
        this.impactNote = impactNote;
        this.sourceArtifact = sourceArtifact;
        this.kind = kind;
        this.packageName = packageName;
        this.details = details != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
            : Collections.emptyMap();
    }
    
    public boolean hasKind(String expected) {
        return kind != null && kind.equals(expected);
    }
    
    public String detailOrDefault(String key, String fallback) {
        return details.getOrDefault(key, fallback);
    }
    
    /**
     * Ключ уникальности в пределах одного запуска
     */
    public String key() {
        return category.name() + "|" + id;
    }
}
