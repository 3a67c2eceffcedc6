package org.camunda.bpm.getstarted.migration.report;

import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.camunda.bpm.getstarted.migration.analysis.models.ComplexityLevel;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.camunda.bpm.getstarted.migration.analysis.models.Statistics;

import java.io.PrintStream;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Human-readable summary of a report, as printed by the command line tool.
 */
public class ConsoleReportPrinter {
    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String DOUBLE_RULE = "=".repeat(80);
    private static final String RULE = "-".repeat(80);

    private final PrintStream out;

    public ConsoleReportPrinter(PrintStream out) {
        this.out = out;
    }

    public void print(AnalysisReport report) {
        Statistics stats = report.statistics();

        out.println();
        out.println(DOUBLE_RULE);
        out.println("BPMN MIGRATION ANALYSIS FOR CAMUNDA 8");
        out.println(DOUBLE_RULE);
        out.println();
        out.println("File: " + report.file());
        out.println("Analysis Date: " + DATE_FORMAT.format(report.timestamp()));

        section("STATISTICS");
        out.println("Total BPMN Elements: " + stats.totalElements());
        out.println("Total Issues Found: " + stats.totalIssues());
        out.println("  - Critical: " + stats.issueCount(Severity.CRITICAL));
        out.println("  - Warning:  " + stats.issueCount(Severity.WARNING));
        out.println("  - Info:     " + stats.issueCount(Severity.INFO));
        out.println("Total Process Variables: " + stats.totalVariablesDetected());

        out.println();
        out.println("Element Breakdown:");
        for (Map.Entry<String, Integer> entry : new TreeMap<>(stats.elementCounts()).entrySet()) {
            if (entry.getValue() > 0) {
                out.println("  - " + entry.getKey() + ": " + entry.getValue());
            }
        }

        out.println();
        out.println("Issues by Category:");
        stats.issueCountsByCategory().forEach((category, count) -> out.println("  - " + category + ": " + count));

        section("DETAILED ISSUES");
        for (Severity severity : Severity.values()) {
            List<MigrationIssue> issues = report.issuesWithSeverity(severity);
            if (issues.isEmpty()) {
                continue;
            }
            out.println();
            out.println(severity + " (" + issues.size() + "):");
            out.println("-".repeat(40));
            for (MigrationIssue issue : issues) {
                out.println();
                out.println("[" + issue.category() + "] " + issue.message());
                out.println("  Element: " + issue.elementName() + " (ID: " + issue.elementId() + ")");
                if (!issue.details().isEmpty()) {
                    out.println("  Details: " + issue.details());
                }
            }
        }

        if (!report.processVariables().isEmpty()) {
            section("PROCESS VARIABLES DETECTED");
            report.processVariables().forEach(variable -> out.println("  - " + variable));
        }

        section("MIGRATION COMPLEXITY ASSESSMENT");
        ComplexityLevel complexity = stats.complexity();
        out.println("Complexity Level: " + complexity);
        out.println("Assessment: " + complexity.assessment());

        out.println();
        out.println(DOUBLE_RULE);
        out.flush();
    }

    private void section(String title) {
        out.println();
        out.println(RULE);
        out.println(title);
        out.println(RULE);
    }
}
