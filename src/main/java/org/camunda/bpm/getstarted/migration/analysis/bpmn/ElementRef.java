package org.camunda.bpm.getstarted.migration.analysis.bpmn;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only handle to one element of a {@link ProcessDocument}.
 * <p>
 * Attribute lookups never throw: a missing attribute and an empty one are both reported as absent.
 * Handles are only valid while the owning document is.
 */
public final class ElementRef {
    public static final String UNKNOWN_ID = "unknown";
    public static final String UNNAMED = "Unnamed";

    private static final String EXTENSION_ELEMENTS = "extensionElements";

    private final Element element;

    ElementRef(Element element) {
        this.element = Objects.requireNonNull(element);
    }

    /**
     * Local element name, e.g. "serviceTask".
     */
    public String type() {
        String localName = element.getLocalName();
        return localName != null ? localName : element.getTagName();
    }

    public String id() {
        return attribute("id").orElse(UNKNOWN_ID);
    }

    public String name() {
        return attribute("name").orElse(UNNAMED);
    }

    public boolean isA(XmlNamespace namespace, String localName) {
        return namespace.uri().equals(element.getNamespaceURI()) && localName.equals(type());
    }

    /**
     * Reads an unqualified attribute.
     *
     * @param localName the attribute name
     * @return the value, or empty when the attribute is missing or empty
     */
    public Optional<String> attribute(String localName) {
        Attr attr = element.getAttributeNodeNS(null, localName);
        return valueOf(attr);
    }

    /**
     * Reads a namespace-qualified attribute, e.g. {@code camunda:delegateExpression}.
     *
     * @param namespace the attribute namespace
     * @param localName the attribute name without prefix
     * @return the value, or empty when the attribute is missing or empty
     */
    public Optional<String> attribute(XmlNamespace namespace, String localName) {
        Attr attr = element.getAttributeNodeNS(namespace.uri(), localName);
        return valueOf(attr);
    }

    /**
     * Shorthand for {@code attribute(XmlNamespace.CAMUNDA, localName)}.
     */
    public Optional<String> camundaAttribute(String localName) {
        return attribute(XmlNamespace.CAMUNDA, localName);
    }

    public boolean isTrue(XmlNamespace namespace, String localName) {
        return attribute(namespace, localName).map("true"::equals).orElse(false);
    }

    public boolean isTrue(String localName) {
        return attribute(localName).map("true"::equals).orElse(false);
    }

    /**
     * Literal text directly inside this element (child elements excluded), trimmed.
     *
     * @return the text, or empty when there is none
     */
    public Optional<String> text() {
        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        String trimmed = text.toString().trim();
        return trimmed.isEmpty() ? Optional.empty() : Optional.of(trimmed);
    }

    /**
     * First direct BPMN child with the given local name.
     */
    public Optional<ElementRef> child(String type) {
        return children(XmlNamespace.BPMN, type).stream().findFirst();
    }

    /**
     * All direct BPMN children with the given local name, in document order.
     */
    public List<ElementRef> children(String type) {
        return children(XmlNamespace.BPMN, type);
    }

    public List<ElementRef> children(XmlNamespace namespace, String localName) {
        List<ElementRef> result = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i) instanceof Element childEl) {
                ElementRef child = new ElementRef(childEl);
                if (child.isA(namespace, localName)) {
                    result.add(child);
                }
            }
        }
        return result;
    }

    /**
     * The {@code bpmn:extensionElements} block of this element, if it has one.
     */
    public Optional<ElementRef> extensionElements() {
        return child(EXTENSION_ELEMENTS);
    }

    /**
     * Camunda elements with the given local name inside the extension block,
     * e.g. "taskListener", "inputOutput", "formData".
     *
     * @return matching elements, empty when there is no extension block
     */
    public List<ElementRef> extensionChildren(String localName) {
        return extensionElements()
                .map(ext -> ext.children(XmlNamespace.CAMUNDA, localName))
                .orElse(List.of());
    }

    public Optional<ElementRef> extensionChild(String localName) {
        return extensionChildren(localName).stream().findFirst();
    }

    Element element() {
        return element;
    }

    Optional<ElementRef> parent() {
        Node parent = element.getParentNode();
        return parent instanceof Element parentEl ? Optional.of(new ElementRef(parentEl)) : Optional.empty();
    }

    private static Optional<String> valueOf(Attr attr) {
        if (attr == null || attr.getValue() == null || attr.getValue().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(attr.getValue());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ElementRef other && element == other.element;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(element);
    }

    @Override
    public String toString() {
        return type() + "[" + id() + "]";
    }
}
