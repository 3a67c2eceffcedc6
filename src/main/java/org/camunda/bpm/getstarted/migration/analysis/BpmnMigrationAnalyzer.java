package org.camunda.bpm.getstarted.migration.analysis;

import lombok.extern.slf4j.Slf4j;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.BpmnDocumentParser;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ProcessDocument;
import org.camunda.bpm.getstarted.migration.analysis.models.AnalysisReport;
import org.camunda.bpm.getstarted.migration.analysis.models.MigrationIssue;
import org.camunda.bpm.getstarted.migration.analysis.models.Statistics;
import org.camunda.bpm.getstarted.migration.analysis.rules.MigrationRule;
import org.camunda.bpm.getstarted.migration.analysis.rules.MigrationRules;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every migration rule over a BPMN document and assembles the report.
 * <p>
 * Instances hold no per-run state and may be shared; each call to {@code analyze} gets its own
 * {@link AnalysisContext}.
 */
@Slf4j
public class BpmnMigrationAnalyzer {

    private final List<MigrationRule> rules;

    public BpmnMigrationAnalyzer() {
        this(MigrationRules.defaultRules());
    }

    public BpmnMigrationAnalyzer(List<MigrationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Analyzes a BPMN file.
     *
     * @param bpmnFile the file to analyze
     * @return the finished report
     * @throws org.camunda.bpm.getstarted.migration.analysis.bpmn.BpmnParseException if the file
     *         cannot be read or is not well-formed XML; no rule runs in that case
     */
    public AnalysisReport analyze(Path bpmnFile) {
        return analyze(BpmnDocumentParser.parse(bpmnFile));
    }

    /**
     * Analyzes BPMN content from a stream, e.g. an upload. The stream is not closed.
     */
    public AnalysisReport analyze(InputStream in, String source) {
        return analyze(BpmnDocumentParser.parse(in, source));
    }

    public AnalysisReport analyze(ProcessDocument document) {
        log.info("Analyzing {}", document.source());

        ElementModel model = new ElementModel(document);
        AnalysisContext context = new AnalysisContext();
        for (MigrationRule rule : rules) {
            int before = context.issues().size();
            rule.apply(model, context);
            log.debug("Rule '{}' reported {} issue(s)", rule.name(), context.issues().size() - before);
        }

        List<MigrationIssue> issues = new ArrayList<>(context.issues());
        issues.sort(MigrationIssue.REPORT_ORDER);  // List.sort is stable
        List<String> variables = new ArrayList<>(context.variables());

        Statistics statistics = StatisticsAggregator.aggregate(model, issues, variables.size());
        log.info("Finished {}: {} issue(s), {} variable(s)", document.source(), issues.size(), variables.size());

        return new AnalysisReport(document.source(), LocalDateTime.now(), statistics, issues, variables);
    }
}
