package org.camunda.bpm.getstarted.migration.web;

/**
 * The request carried no usable BPMN upload.
 */
public class InvalidUploadException extends RuntimeException {

    public InvalidUploadException(String message) {
        super(message);
    }
}
