package com.vtb.rca.models;

import lombok.Builder;
import lombok.Value;

/**
 * Предупреждение, попадающее в итоговый результат: что пропущено или подставлено по умолчанию
 */
@Value
@Builder
public class AnalysisWarning {
    
    public enum Type {
        MALFORMED_ARTIFACT,
        LOAD_TIMEOUT,
        UNRECOGNIZED_SEVERITY,
        DUPLICATE_FINDING
    }
    
    Type type;
    String source;
    String message;
    
    public static AnalysisWarning of(Type type, String source, String message) {
        return AnalysisWarning.builder()
            .type(type)
            .source(source)
            .message(message)
            .build();
    }
}
