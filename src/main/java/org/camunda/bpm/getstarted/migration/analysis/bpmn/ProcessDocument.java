package org.camunda.bpm.getstarted.migration.analysis.bpmn;

import org.w3c.dom.Document;

/**
 * A parsed process definition. Owned by a single analysis run and never modified after parsing.
 *
 * @param source   file name or upload name the document was read from
 * @param document the namespace-aware DOM tree
 */
public record ProcessDocument(
        String source,
        Document document
) {
}
