package com.vtb.rca.models;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Статистика запуска анализа.
 * Без времени выполнения: повторный запуск на тех же артефактах должен давать тот же результат.
 */
@Value
public class AnalysisStatistics {
    Map<String, Integer> artifactsLoaded;
    Map<String, Integer> artifactsSkipped;
    Map<String, Integer> findingsByCategory;
    int totalFindings;
    int totalCorrelations;
    
    @Builder
    private AnalysisStatistics(Map<String, Integer> artifactsLoaded, Map<String, Integer> artifactsSkipped,
                               Map<String, Integer> findingsByCategory, int totalFindings, int totalCorrelations) {
        this.artifactsLoaded = freeze(artifactsLoaded);
        this.artifactsSkipped = freeze(artifactsSkipped);
        this.findingsByCategory = freeze(findingsByCategory);
        this.totalFindings = totalFindings;
        this.totalCorrelations = totalCorrelations;
    }
    
    private static Map<String, Integer> freeze(Map<String, Integer> source) {
        return source != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(source))
            : Collections.emptyMap();
    }
}
