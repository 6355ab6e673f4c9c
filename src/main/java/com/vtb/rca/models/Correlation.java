package com.vtb.rca.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;

/**
 * Выявленная связь между находками. Строится только коррелятором.
 */
@Value
public class Correlation {
    CorrelationKind kind;
    String description;
    String impactNote;
    List<String> relatedFindingIds;
    
    @Builder
    private Correlation(@NonNull CorrelationKind kind, String description, String impactNote,
                        @NonNull List<String> relatedFindingIds) {
        this.kind = kind;
        this.description = description;
        this.impactNote = impactNote;
        this.relatedFindingIds = List.copyOf(relatedFindingIds);
    }
}
