package org.camunda.bpm.getstarted.migration.report;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Severity;
import org.camunda.bpm.getstarted.migration.analysis.models.Statistics;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders the report as a standalone HTML page from {@code templates/report.ftlh}.
 * The template has HTML auto-escaping on, so element names and expressions from the
 * document are safe to print.
 */
@Slf4j
public class HtmlReportExporter {
    static final String TEMPLATE = "report.ftlh";

    private static final Configuration FREEMARKER_CONFIG;

    static {
        FREEMARKER_CONFIG = new Configuration(Configuration.VERSION_2_3_32);
        FREEMARKER_CONFIG.setDefaultEncoding(StandardCharsets.UTF_8.name());
        FREEMARKER_CONFIG.setClassLoaderForTemplateLoading(HtmlReportExporter.class.getClassLoader(), "templates");

        // fail fast on missing variables
        FREEMARKER_CONFIG.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        FREEMARKER_CONFIG.setLogTemplateExceptions(false);
        FREEMARKER_CONFIG.setFallbackOnNullLoopVariable(false);
    }

    public void export(AnalysisReport report, Path outputFile) {
        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            render(report, writer);
            log.info("HTML report written to {}", outputFile);
        } catch (IOException e) {
            throw new ReportExportException("Failed to write HTML report: " + outputFile, e);
        }
    }

    public String render(AnalysisReport report) {
        StringWriter writer = new StringWriter();
        render(report, writer);
        return writer.toString();
    }

    private void render(AnalysisReport report, Writer writer) {
        try {
            Template template = FREEMARKER_CONFIG.getTemplate(TEMPLATE);
            template.process(toModel(report), writer);
        } catch (IOException e) {
            throw new ReportExportException("Failed to load template: " + TEMPLATE, e);
        } catch (TemplateException e) {
            throw new ReportExportException("Error rendering template: " + TEMPLATE, e);
        }
    }

    // the template only sees maps, lists, strings and numbers
    static Map<String, Object> toModel(AnalysisReport report) {
        Statistics stats = report.statistics();

        Map<String, Object> statistics = new HashMap<>();
        statistics.put("totalElements", stats.totalElements());
        statistics.put("totalIssues", stats.totalIssues());
        statistics.put("critical", stats.issueCount(Severity.CRITICAL));
        statistics.put("warning", stats.issueCount(Severity.WARNING));
        statistics.put("info", stats.issueCount(Severity.INFO));
        statistics.put("totalVariables", stats.totalVariablesDetected());

        Map<String, Integer> elementCounts = new TreeMap<>();
        stats.elementCounts().forEach((type, count) -> {
            if (count > 0) {
                elementCounts.put(type, count);
            }
        });

        List<Map<String, Object>> severityGroups = new ArrayList<>();
        for (Severity severity : Severity.values()) {
            List<MigrationIssue> issues = report.issuesWithSeverity(severity);
            if (issues.isEmpty()) {
                continue;
            }
            Map<String, Object> group = new HashMap<>();
            group.put("name", severity.name());
            group.put("cssClass", severity.name().toLowerCase(Locale.ROOT));
            group.put("issues", issues.stream().map(HtmlReportExporter::issueModel).toList());
            severityGroups.add(group);
        }

        Map<String, Object> model = new HashMap<>();
        model.put("file", report.file());
        model.put("analysisDate", ConsoleReportPrinter.DATE_FORMAT.format(report.timestamp()));
        model.put("statistics", statistics);
        model.put("elementCounts", elementCounts);
        model.put("categoryCounts", new LinkedHashMap<>(stats.issueCountsByCategory()));
        model.put("severityGroups", severityGroups);
        model.put("variables", report.processVariables());
        model.put("complexity", stats.complexity().name());
        model.put("assessment", stats.complexity().assessment());
        return model;
    }

    private static Map<String, String> issueModel(MigrationIssue issue) {
        Map<String, String> model = new HashMap<>();
        model.put("category", issue.category());
        model.put("message", issue.message());
        model.put("elementId", issue.elementId());
        model.put("elementName", issue.elementName());
        model.put("details", issue.details());
        return model;
    }
}
