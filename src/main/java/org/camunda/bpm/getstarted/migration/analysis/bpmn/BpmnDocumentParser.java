package org.camunda.bpm.getstarted.migration.analysis.bpmn;

import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads BPMN XML into a {@link ProcessDocument}. Only well-formedness is checked here.
 */
@Slf4j
public class BpmnDocumentParser {

    /**
     * Parses a BPMN file from disk.
     *
     * @param bpmnFile the path to the BPMN file
     * @return the parsed document
     * @throws BpmnParseException if the file cannot be read or is not well-formed XML
     */
    public static ProcessDocument parse(Path bpmnFile) {
        String source = bpmnFile.toString();
        try (InputStream in = Files.newInputStream(bpmnFile)) {
            return parse(in, source);
        } catch (IOException e) {
            throw new BpmnParseException(source, e);
        }
    }

    /**
     * Parses BPMN XML from a stream. The stream is not closed.
     *
     * @param in     the XML content
     * @param source a name for the content, used in the report and in error messages
     * @return the parsed document
     * @throws BpmnParseException if the content is not well-formed XML
     */
    public static ProcessDocument parse(InputStream in, String source) {
        try {
            DocumentBuilder builder = newDocumentBuilder();
            Document doc = builder.parse(in);
            if (doc.getDocumentElement() == null) {
                throw new BpmnParseException(source, "document has no root element");
            }
            log.debug("Parsed {} with root element '{}'", source, doc.getDocumentElement().getLocalName());
            return new ProcessDocument(source, doc);
        } catch (SAXException | IOException e) {
            throw new BpmnParseException(source, e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    // keeps the JDK parser from printing "[Fatal Error]" lines to stderr
    private static final class RethrowingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
