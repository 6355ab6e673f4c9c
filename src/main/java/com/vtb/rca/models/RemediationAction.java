package com.vtb.rca.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Одно действие плана исправлений.
 * Для origin = FINDING заполнены поля originFinding*, для TEMPLATE они пустые.
 */
@Value
@Builder
public class RemediationAction {
    @NonNull String description;
    @NonNull RemediationPriority priority;
    String estimatedEffort;
    String ownerRole;
    @NonNull RemediationBucket bucket;
    @NonNull ActionOrigin origin;
    
    String originFindingId;
    FindingCategory originCategory;
    Severity originSeverity;
    
    public boolean isFindingDerived() {
        return origin == ActionOrigin.FINDING;
    }
}
