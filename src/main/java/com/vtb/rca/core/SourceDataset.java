package com.vtb.rca.core;

import com.vtb.rca.models.AnalysisWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Набор сырых артефактов одного запуска, сгруппированный по типу.
 * Неизменяем после сборки; каждый тип присутствует, отсутствующие артефакты дают пустой список.
 */
public final class SourceDataset {
    
    private final Map<ArtifactType, List<RawArtifact>> artifacts;
    private final Map<ArtifactType, Integer> skipped;
    private final List<AnalysisWarning> warnings;
    
    private SourceDataset(Map<ArtifactType, List<RawArtifact>> artifacts,
                          Map<ArtifactType, Integer> skipped,
                          List<AnalysisWarning> warnings) {
        this.artifacts = artifacts;
        this.skipped = skipped;
        this.warnings = warnings;
    }
    
    public static SourceDataset empty() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public List<RawArtifact> get(ArtifactType type) {
        return artifacts.get(type);
    }
    
    /**
     * Первый артефакт типа или null. Для типов, представленных одним файлом.
     */
    public RawArtifact first(ArtifactType type) {
        List<RawArtifact> list = artifacts.get(type);
        return list.isEmpty() ? null : list.get(0);
    }
    
    public int loadedCount(ArtifactType type) {
        return artifacts.get(type).size();
    }
    
    public int skippedCount(ArtifactType type) {
        return skipped.get(type);
    }
    
    public List<AnalysisWarning> getWarnings() {
        return warnings;
    }
    
    public boolean isEmpty() {
        return artifacts.values().stream().allMatch(List::isEmpty);
    }
    
    public static final class Builder {
        private final Map<ArtifactType, List<RawArtifact>> artifacts = new EnumMap<>(ArtifactType.class);
        private final Map<ArtifactType, Integer> skipped = new EnumMap<>(ArtifactType.class);
        private final List<AnalysisWarning> warnings = new ArrayList<>();
        
        private Builder() {
            for (ArtifactType type : ArtifactType.values()) {
                artifacts.put(type, new ArrayList<>());
                skipped.put(type, 0);
            }
        }
        
        public Builder add(RawArtifact artifact) {
            artifacts.get(artifact.getType()).add(artifact);
            return this;
        }
        
        public Builder addAll(ArtifactType type, List<RawArtifact> loaded) {
            artifacts.get(type).addAll(loaded);
            return this;
        }
        
        public Builder skipped(ArtifactType type, AnalysisWarning warning) {
            skipped.merge(type, 1, Integer::sum);
            warnings.add(warning);
            return this;
        }
        
        public SourceDataset build() {
            Map<ArtifactType, List<RawArtifact>> frozen = new EnumMap<>(ArtifactType.class);
            artifacts.forEach((type, list) -> frozen.put(type, List.copyOf(list)));
            return new SourceDataset(
                Collections.unmodifiableMap(frozen),
                Collections.unmodifiableMap(new EnumMap<>(skipped)),
                List.copyOf(warnings));
        }
    }
}
