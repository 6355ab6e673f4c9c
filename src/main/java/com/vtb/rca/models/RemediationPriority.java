package com.vtb.rca.models;

public enum RemediationPriority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW
}
