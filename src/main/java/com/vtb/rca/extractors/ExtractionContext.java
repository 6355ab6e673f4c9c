package com.vtb.rca.extractors;

import com.vtb.rca.models.AnalysisWarning;
import com.vtb.rca.models.Severity;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Контекст извлечения находок для одного запуска
 */
@Slf4j
public class ExtractionContext {
    
    @Getter
    private final String targetService;
    private final List<AnalysisWarning> warnings = new ArrayList<>();
    
    public ExtractionContext(String targetService) {
        this.targetService = targetService;
    }
    
    /**
     * Привести значение severity из артефакта к перечислению.
     * Нераспознанное или отсутствующее значение становится LOW с предупреждением.
     */
    public Severity normalizeSeverity(String raw, String source, String recordId) {
        Severity severity = Severity.parse(raw);
        if (severity != null) {
            return severity;
        }
        String message = String.format("Нераспознанный severity '%s' у записи %s, принят LOW", raw, recordId);
        log.warn("{}: {}", source, message);
        warnings.add(AnalysisWarning.of(AnalysisWarning.Type.UNRECOGNIZED_SEVERITY, source, message));
        return Severity.LOW;
    }
    
    public List<AnalysisWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
