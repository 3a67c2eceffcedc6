package org.camunda.bpm.getstarted.migration.analysis.bpmn;

/**
 * Thrown when a process document cannot be read as XML. No rule runs after this.
 */
public class BpmnParseException extends RuntimeException {

    private final String source;

    public BpmnParseException(String source, Throwable cause) {
        super("Failed to parse BPMN file: " + source + " (" + cause.getMessage() + ")", cause);
        this.source = source;
    }

    public BpmnParseException(String source, String message) {
        super("Failed to parse BPMN file: " + source + " (" + message + ")");
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
