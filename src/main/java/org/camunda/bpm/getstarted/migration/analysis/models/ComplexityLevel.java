package org.camunda.bpm.getstarted.migration.analysis.models;

/**
 * Overall effort estimate shown at the end of a report.
 */
public enum ComplexityLevel {
    LOW("Process appears largely compatible with minimal changes needed."),
    MEDIUM("Moderate migration effort required. Focus on critical issues first."),
    HIGH("Significant migration effort required. Consider phased approach.");

    private static final int MEDIUM_MAX_CRITICAL = 5;
    private static final int MEDIUM_MAX_WARNING = 10;

    private final String assessment;

    ComplexityLevel(String assessment) {
        this.assessment = assessment;
    }

    public String assessment() {
        return assessment;
    }

    public static ComplexityLevel assess(int criticalCount, int warningCount) {
        if (criticalCount == 0 && warningCount == 0) {
            return LOW;
        }
        if (criticalCount <= MEDIUM_MAX_CRITICAL && warningCount <= MEDIUM_MAX_WARNING) {
            return MEDIUM;
        }
        return HIGH;
    }
}
