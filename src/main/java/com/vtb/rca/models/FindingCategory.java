package com.vtb.rca.models;

/**
 * Категории находок. Порядок объявления = порядок в отчете.
 */
public enum FindingCategory {
    VULNERABILITY("vulnerability"),
    COMPLIANCE("compliance"),
    MISCONFIGURATION("misconfiguration"),
    DEPENDENCY("dependency"),
    APPLICATION_ERROR("application-error");
    
    private final String code;
    
    FindingCategory(String code) {
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
}
