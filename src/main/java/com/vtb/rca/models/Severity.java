package com.vtb.rca.models;

import java.util.Locale;

/**
 * Уровни критичности находок
 *
 * Во входных артефактах регистр не согласован (Trivy пишет CRITICAL, CIS пишет critical),
 * поэтому разбор всегда регистронезависимый.
 */
public enum Severity {
    CRITICAL("Критический", 4),
    HIGH("Высокий", 3),
    MEDIUM("Средний", 2),
    LOW("Низкий", 1);
    
    private final String russianName;
    private final int priority;
    
    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }
    
    public String getRussianName() {
        return russianName;
    }
    
    public int getPriority() {
        return priority;
    }
    
    public boolean isHighOrCritical() {
        return this == CRITICAL || this == HIGH;
    }
    
    /**
     * Разобрать значение из артефакта
     *
     * @return уровень или null, если значение отсутствует или не распознано
     */
    public static Severity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
