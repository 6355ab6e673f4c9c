package com.vtb.rca.models;

/**
 * Итоговый уровень риска. Чистая функция от балла.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;
    
    public static final int CRITICAL_THRESHOLD = 20;
    public static final int HIGH_THRESHOLD = 10;
    public static final int MEDIUM_THRESHOLD = 5;
    
    public static RiskLevel fromScore(int score) {
        if (score >= CRITICAL_THRESHOLD) {
            return CRITICAL;
        }
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
