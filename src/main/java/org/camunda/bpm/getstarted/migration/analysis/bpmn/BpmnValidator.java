package org.camunda.bpm.getstarted.migration.analysis.bpmn;

import org.camunda.bpm.model.bpmn.Bpmn;
import org.camunda.bpm.model.bpmn.BpmnModelInstance;
import org.camunda.bpm.model.xml.ModelException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Schema validation through the Camunda BPMN model API. Only used in strict mode; the
 * analyzer itself needs nothing beyond well-formed XML.
 */
public class BpmnValidator {

    /**
     * Validates a BPMN file from disk against the BPMN 2.0 schema.
     *
     * @param bpmnFile the file to validate
     * @throws BpmnParseException if the file cannot be read or violates the schema
     */
    public static void validate(Path bpmnFile) {
        try (InputStream in = Files.newInputStream(bpmnFile)) {
            validate(in, bpmnFile.toString());
        } catch (IOException e) {
            throw new BpmnParseException(bpmnFile.toString(), e);
        }
    }

    /**
     * Validates BPMN content from a stream against the BPMN 2.0 schema.
     *
     * @param in     the BPMN XML
     * @param source name used in error messages
     * @throws BpmnParseException if the content violates the schema
     */
    public static void validate(InputStream in, String source) {
        try {
            BpmnModelInstance model = Bpmn.readModelFromStream(in);
            Bpmn.validateModel(model);
        } catch (ModelException e) {
            throw new BpmnParseException(source, e);
        }
    }
}
