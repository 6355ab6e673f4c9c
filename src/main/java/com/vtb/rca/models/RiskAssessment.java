package com.vtb.rca.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Агрегированная оценка риска за запуск
 *
 * В affectedComponents кроме целевого сервиса всегда есть слои инфраструктуры
 * из assumedComponents: это допущение модели о радиусе поражения, а не обнаруженный факт.
 */
@Value
public class RiskAssessment {
    int score;
    RiskLevel level;
    List<String> factors;
    Set<String> affectedComponents;
    Set<String> assumedComponents;
    
    @Builder
    private RiskAssessment(int score, @NonNull RiskLevel level, List<String> factors,
                           Set<String> affectedComponents, Set<String> assumedComponents) {
        this.score = score;
        this.level = level;
        this.factors = factors != null ? List.copyOf(factors) : List.of();
        this.affectedComponents = freeze(affectedComponents);
        this.assumedComponents = freeze(assumedComponents);
    }
    
    private static Set<String> freeze(Set<String> source) {
        return source != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(source))
            : Collections.emptySet();
    }
}
