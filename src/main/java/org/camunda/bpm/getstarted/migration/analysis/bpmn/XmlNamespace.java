package org.camunda.bpm.getstarted.migration.analysis.bpmn;

/**
 * XML namespaces the analyzer reads attributes and elements from.
 */
public enum XmlNamespace {
    BPMN("http://www.omg.org/spec/BPMN/20100524/MODEL"),
    CAMUNDA("http://camunda.org/schema/1.0/bpmn"),
    XSI("http://www.w3.org/2001/XMLSchema-instance");

    private final String uri;

    XmlNamespace(String uri) {
        this.uri = uri;
    }

    public String uri() {
        return uri;
    }
}
