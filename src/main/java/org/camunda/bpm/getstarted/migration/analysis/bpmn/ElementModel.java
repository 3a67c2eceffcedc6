package org.camunda.bpm.getstarted.migration.analysis.bpmn;

import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queryable, read-only view over a {@link ProcessDocument}.
 */
public class ElementModel {

    private final ProcessDocument document;
    private final ElementRef root;

    public ElementModel(ProcessDocument document) {
        this.document = document;
        this.root = new ElementRef(document.document().getDocumentElement());
    }

    public ProcessDocument document() {
        return document;
    }

    /**
     * The document root, normally {@code bpmn:definitions}.
     */
    public ElementRef root() {
        return root;
    }

    /**
     * Finds all BPMN elements of a type anywhere below the root, in document order.
     *
     * @param type local element name, e.g. "serviceTask"
     * @return matching elements; empty list if there are none
     */
    public List<ElementRef> findAll(String type) {
        return wrap(root.element().getElementsByTagNameNS(XmlNamespace.BPMN.uri(), type));
    }

    /**
     * Every element below the root, in any namespace, in document order.
     */
    public List<ElementRef> allElements() {
        return wrap(root.element().getElementsByTagNameNS("*", "*"));
    }

    /**
     * Finds the element carrying the given {@code id} attribute.
     *
     * @param id the identifier to look for
     * @return the first element with that id, or empty
     */
    public Optional<ElementRef> findById(String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return allElements().stream()
                .filter(element -> element.attribute("id").map(id::equals).orElse(false))
                .findFirst();
    }

    /**
     * Finds a BPMN element of a given type by identifier, e.g. the {@code sequenceFlow} an
     * {@code outgoing} reference points at.
     *
     * @param type local element name
     * @param id   the identifier
     * @return the element, or empty when the reference does not resolve
     */
    public Optional<ElementRef> findById(String type, String id) {
        if (id == null || id.isEmpty()) {
            return Optional.empty();
        }
        return findAll(type).stream()
                .filter(element -> element.attribute("id").map(id::equals).orElse(false))
                .findFirst();
    }

    /**
     * Nearest enclosing element. Uses the parent link the DOM keeps for every node,
     * so no tree scan is needed.
     *
     * @param element a handle from this model
     * @return the parent, or empty for the root
     */
    public Optional<ElementRef> parentOf(ElementRef element) {
        if (element.equals(root)) {
            return Optional.empty();
        }
        return element.parent();
    }

    /**
     * Number of BPMN elements of the given type in the document.
     */
    public int count(String type) {
        return root.element().getElementsByTagNameNS(XmlNamespace.BPMN.uri(), type).getLength();
    }

    private static List<ElementRef> wrap(NodeList nodes) {
        List<ElementRef> elements = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            elements.add(new ElementRef((Element) nodes.item(i)));
        }
        return elements;
    }
}
