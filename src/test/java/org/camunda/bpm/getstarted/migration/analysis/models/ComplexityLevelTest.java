package org.camunda.bpm.getstarted.migration.analysis.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComplexityLevelTest {

    @Test
    void shouldAssessByCriticalAndWarningCounts() {
        assertEquals(ComplexityLevel.LOW, ComplexityLevel.assess(0, 0));
        assertEquals(ComplexityLevel.MEDIUM, ComplexityLevel.assess(5, 10));
        assertEquals(ComplexityLevel.MEDIUM, ComplexityLevel.assess(0, 1));
        assertEquals(ComplexityLevel.HIGH, ComplexityLevel.assess(6, 0));
        assertEquals(ComplexityLevel.HIGH, ComplexityLevel.assess(0, 11));
    }
}
