package com.vtb.rca.models;

/**
 * Группы плана исправлений по срочности
 */
public enum RemediationBucket {
    IMMEDIATE("В течение 24 часов"),
    SHORT_TERM("В течение недели"),
    LONG_TERM("В течение месяца"),
    MONITORING("Постоянно");
    
    private final String horizon;
    
    RemediationBucket(String horizon) {
        this.horizon = horizon;
    }
    
    public String getHorizon() {
        return horizon;
    }
}
