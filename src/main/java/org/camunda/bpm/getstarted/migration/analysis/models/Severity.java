package org.camunda.bpm.getstarted.migration.analysis.models;

import java.util.Comparator;

/**
 * Issue severity. The order below is for grouping and sorting only, not a numeric scale.
 */
public enum Severity {
    CRITICAL,
    WARNING,
    INFO;

    /**
     * CRITICAL first, then WARNING, then INFO.
     */
    public static final Comparator<Severity> MOST_SEVERE_FIRST = Comparator.comparingInt(Enum::ordinal);
}
