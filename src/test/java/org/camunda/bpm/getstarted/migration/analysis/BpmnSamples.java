package org.camunda.bpm.getstarted.migration.analysis;

import org.camunda.bpm.getstarted.migration.analysis.bpmn.BpmnDocumentParser;
import org.camunda.bpm.getstarted.migration.analysis.bpmn.ElementModel;
import org.camunda.bpm.getstarted.migration.analysis.rules.MigrationRule;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

/**
 * Inline BPMN documents for tests.
 */
public final class BpmnSamples {
    public static final String VALID_BPMN = "src/test/resources/bpmn/valid-process.bpmn";
    public static final String LEGACY_BPMN = "src/test/resources/bpmn/legacy-process.bpmn";
    public static final String MALFORMED_BPMN = "src/test/resources/bpmn/malformed.bpmn";
    public static final String NOT_SCHEMA_VALID_BPMN = "src/test/resources/bpmn/not-schema-valid.bpmn";

    private static final String HEADER = """
            <?xml version="1.0" encoding="UTF-8"?>
            <bpmn:definitions xmlns:bpmn="http://www.omg.org/spec/BPMN/20100524/MODEL"
                              xmlns:camunda="http://camunda.org/schema/1.0/bpmn"
                              xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance"
                              xsi:schemaLocation="http://www.omg.org/spec/BPMN/20100524/MODEL BPMN20.xsd"
                              id="Definitions_1" targetNamespace="http://bpmn.io/schema/bpmn">
            """;

    private BpmnSamples() {
    }

    /**
     * Wraps elements in a process inside a definitions root with a BPMN 2.0 schema location.
     */
    public static String process(String processBody) {
        return definitions("<bpmn:process id=\"Process_1\" isExecutable=\"true\">\n"
                + processBody + "\n</bpmn:process>");
    }

    /**
     * Wraps root-level elements (processes, messages, errors) in a definitions root.
     */
    public static String definitions(String rootChildren) {
        return HEADER + rootChildren + "\n</bpmn:definitions>";
    }

    public static ElementModel model(String xml) {
        return new ElementModel(BpmnDocumentParser.parse(
                new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline.bpmn"));
    }

    /**
     * Runs a single rule over a process body.
     */
    public static AnalysisContext apply(MigrationRule rule, String processBody) {
        return applyToDocument(rule, process(processBody));
    }

    public static AnalysisContext applyToDocument(MigrationRule rule, String xml) {
        AnalysisContext context = new AnalysisContext();
        rule.apply(model(xml), context);
        return context;
    }
}
