package com.vtb.rca.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Типы связей между находками разных категорий
 */
public enum CorrelationKind {
    VULNERABILITY_DEPENDENCY_LINK("vulnerability_dependency_link"),
    COMPLIANCE_CONFIG_LINK("compliance_config_link"),
    NETWORK_ERROR_LINK("network_error_link");
    
    private final String code;
    
    CorrelationKind(String code) {
        this.code = code;
    }
    
    @JsonValue
    public String getCode() {
        return code;
    }
}
