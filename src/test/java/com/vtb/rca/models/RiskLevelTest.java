package com.vtb.rca.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Границы уровней риска
 */
class RiskLevelTest {

    @Test
    void boundariesAreExact() {
        assertEquals(RiskLevel.LOW, RiskLevel.fromScore(0));
        assertEquals(RiskLevel.LOW, RiskLevel.fromScore(4));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(5));
        assertEquals(RiskLevel.MEDIUM, RiskLevel.fromScore(9));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(10));
        assertEquals(RiskLevel.HIGH, RiskLevel.fromScore(19));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(20));
        assertEquals(RiskLevel.CRITICAL, RiskLevel.fromScore(500));
    }
}
