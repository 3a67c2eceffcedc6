package org.camunda.bpm.getstarted.migration.report;

/**
 * A report could not be written: an I/O failure or a template error.
 */
public class ReportExportException extends RuntimeException {

    public ReportExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
