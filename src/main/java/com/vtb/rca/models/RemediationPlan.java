package com.vtb.rca.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * План исправлений, разбитый на четыре фиксированные группы
 */
@Value
public class RemediationPlan {
    List<RemediationAction> immediate;
    List<RemediationAction> shortTerm;
    List<RemediationAction> longTerm;
    List<RemediationAction> monitoring;
    
    @Builder
    private RemediationPlan(List<RemediationAction> immediate, List<RemediationAction> shortTerm,
                            List<RemediationAction> longTerm, List<RemediationAction> monitoring) {
        this.immediate = copy(immediate);
        this.shortTerm = copy(shortTerm);
        this.longTerm = copy(longTerm);
        this.monitoring = copy(monitoring);
    }
    
    private static List<RemediationAction> copy(List<RemediationAction> actions) {
        return actions != null ? List.copyOf(actions) : List.of();
    }
    
    public List<RemediationAction> getActions(RemediationBucket bucket) {
        return switch (bucket) {
            case IMMEDIATE -> immediate;
            case SHORT_TERM -> shortTerm;
            case LONG_TERM -> longTerm;
            case MONITORING -> monitoring;
        };
    }
    
    @JsonIgnore
    public List<RemediationAction> getAllActions() {
        return Stream.of(immediate, shortTerm, longTerm, monitoring)
            .flatMap(List::stream)
            .collect(Collectors.toList());
    }
    
    public List<RemediationAction> findingDerived() {
        return getAllActions().stream()
            .filter(RemediationAction::isFindingDerived)
            .collect(Collectors.toList());
    }
    
    public List<RemediationAction> templateDerived() {
        return getAllActions().stream()
            .filter(action -> action.getOrigin() == ActionOrigin.TEMPLATE)
            .collect(Collectors.toList());
    }
}
