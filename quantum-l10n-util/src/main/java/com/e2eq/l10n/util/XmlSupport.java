package com.e2eq.l10n.util;

import org.w3c.dom.Document;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * DOM helpers for resource files. Comments are kept, doctype declarations are refused and no
 * external entity is ever resolved.
 */
public final class XmlSupport {

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>";

    private XmlSupport() {
    }

    /**
     * Creates a new builder. Builders are not thread safe, so each worker asks for its own.
     */
    public static DocumentBuilder newDocumentBuilder() {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setIgnoringComments(false);
        factory.setCoalescing(false);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            // fatal errors are rethrown rather than printed to stderr
            builder.setErrorHandler(new DefaultHandler());
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support the required features", e);
        }
    }

    /**
     * Parses a file into a DOM document.
     *
     * @throws IOException when the file cannot be read or is not well-formed XML
     */
    public static Document parse(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file);
        }
    }

    /**
     * Parses content already read from {@code origin}.
     *
     * @throws IOException when the content is not well-formed XML
     */
    public static Document parse(byte[] content, Path origin) throws IOException {
        return parse(new ByteArrayInputStream(content), origin);
    }

    private static Document parse(InputStream in, Path origin) throws IOException {
        try {
            return newDocumentBuilder().parse(in, origin.toUri().toString());
        } catch (SAXException e) {
            throw new IOException("Malformed XML in " + origin + ": " + e.getMessage(), e);
        }
    }

    public static Document newDocument(String rootElement) {
        Document document = newDocumentBuilder().newDocument();
        document.appendChild(document.createElement(rootElement));
        return document;
    }

    /**
     * Escapes character data the way {@link #toXml(Document)} writes it.
     */
    public static String escapeText(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '\r' -> out.append("&#13;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Serializes a document exactly as it is laid out in the DOM (no re-indentation), preceded by
     * a UTF-8 declaration and followed by a trailing newline.
     */
    public static String toXml(Document document) {
        try {
            TransformerFactory factory = TransformerFactory.newInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            String body = writer.toString();
            return XML_DECLARATION + "\n" + body + (body.endsWith("\n") ? "" : "\n");
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize XML document", e);
        }
    }
}
