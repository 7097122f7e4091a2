package com.e2eq.l10n.resource;

import com.e2eq.l10n.model.MergeAction;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.util.XmlSupport;
import org.jboss.logging.Logger;
import org.w3c.dom.Comment;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.Text;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * In-place editor for one resource file. Nodes that no entry asks to change are left exactly as
 * parsed, and {@link #isModified()} only turns true when a node actually changed.
 * <p>
 * A loaded file is written back by copying the original text of every child of the root that was
 * not edited. When the file cannot be cut that way (not UTF-8, self-closing root) the whole
 * document is serialized instead.
 */
public final class ResourceDocument {

    private static final Logger LOG = Logger.getLogger(ResourceDocument.class);

    static final String DEFAULT_INDENT = "  ";

    private final Document document;
    private final Element root;
    private final String indent;
    private final Map<String, Element> elements = new LinkedHashMap<>();
    private final SourceSegments source;
    private final Map<Node, SourceSegments.Segment> original;
    private final Set<Node> edited = Collections.newSetFromMap(new IdentityHashMap<>());
    private boolean modified;

    private ResourceDocument(Document document, boolean created, SourceSegments source) {
        this.document = document;
        this.root = document.getDocumentElement();
        this.indent = detectIndent(root);
        this.modified = created;
        Map<Node, SourceSegments.Segment> bound = source == null ? null : source.bind(root);
        this.source = bound == null ? null : source;
        this.original = bound == null ? Map.of() : bound;
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Element element) {
                elements.putIfAbsent(element.getTagName(), element);
            }
        }
    }

    /**
     * @throws IOException when the file cannot be read or is not well-formed
     */
    public static ResourceDocument load(Path file) throws IOException {
        byte[] content = Files.readAllBytes(file);
        Document document = XmlSupport.parse(content, file);
        SourceSegments source = null;
        String encoding = document.getXmlEncoding();
        if (encoding == null || encoding.equalsIgnoreCase("UTF-8") || encoding.equalsIgnoreCase("UTF8")) {
            try {
                source = SourceSegments.scan(StandardCharsets.UTF_8.newDecoder()
                        .decode(ByteBuffer.wrap(content)).toString());
            } catch (CharacterCodingException e) {
                LOG.debugf("%s is not valid UTF-8, it will be serialized in full when changed", file);
            }
        }
        ResourceDocument loaded = new ResourceDocument(document, false, source);
        if (loaded.source == null) {
            LOG.debugf("Layout of %s not recognised, it will be serialized in full when changed", file);
        }
        return loaded;
    }

    public static ResourceDocument create(String rootElement) {
        return new ResourceDocument(XmlSupport.newDocument(rootElement), true, null);
    }

    public boolean contains(String key) {
        return elements.containsKey(key);
    }

    public boolean isModified() {
        return modified;
    }

    String indent() {
        return indent;
    }

    /**
     * Applies one merged entry. Unchanged entries are ignored; updated entries are edited where they
     * stand; added entries are appended unless the key is already present.
     */
    public void apply(MergedEntry entry) {
        if (entry.action() == MergeAction.UNCHANGED) {
            return;
        }
        Element element = elements.get(entry.key());
        if (element == null) {
            append(entry);
            return;
        }
        if (ResourceFileReader.hasChildElements(element)) {
            LOG.warnf("Not updating <%s>: list values are not reconciled", entry.key());
            return;
        }
        Annotated annotated = annotationsOf(element);
        Comment snapshot = annotated.snapshot();
        String snapshotData = Annotations.render(Annotations.Kind.SNAPSHOT, entry.sourceSnapshot());
        if (snapshot == null) {
            snapshot = document.createComment(snapshotData);
            insertBefore(snapshot, element);
            modified = true;
        } else if (!snapshot.getData().equals(snapshotData)) {
            snapshot.setData(snapshotData);
            edited.add(snapshot);
            modified = true;
        }

        if (entry.historyNote() != null) {
            String historyData = Annotations.render(Annotations.Kind.HISTORY, entry.historyNote());
            Comment history = annotated.history();
            if (history == null) {
                insertBefore(document.createComment(historyData), snapshot);
                modified = true;
            } else {
                if (!history.getData().equals(historyData)) {
                    history.setData(historyData);
                    edited.add(history);
                    modified = true;
                }
                if (follows(history, snapshot)) {
                    detach(history);
                    insertBefore(history, snapshot);
                    modified = true;
                }
            }
        }
        setElementText(element, entry.translatedText());
    }

    /**
     * Replaces the text of an existing element, leaving its annotations alone.
     *
     * @return false when the key is not in this document
     */
    public boolean setText(String key, String text) {
        Element element = elements.get(key);
        if (element == null) {
            return false;
        }
        if (ResourceFileReader.hasChildElements(element)) {
            LOG.warnf("Not importing into <%s>: list values are not reconciled", key);
            return false;
        }
        setElementText(element, text);
        return true;
    }

    public String toXml() {
        if (source == null) {
            return XmlSupport.toXml(document);
        }
        StringBuilder out = new StringBuilder(source.prefix());
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            SourceSegments.Segment segment = original.get(node);
            if (segment != null && !edited.contains(node)) {
                out.append(segment.text());
            } else {
                out.append(render(node, segment));
            }
        }
        return out.append(source.suffix()).toString();
    }

    private void setElementText(Element element, String text) {
        String value = text == null ? "" : text;
        if (!value.equals(element.getTextContent())) {
            element.setTextContent(value);
            edited.add(element);
            modified = true;
        }
    }

    /**
     * Writes a child of the root that was added or edited. An edited element keeps its original
     * start tag.
     */
    private static String render(Node node, SourceSegments.Segment segment) {
        switch (node.getNodeType()) {
            case Node.COMMENT_NODE:
                return "<!--" + ((Comment) node).getData() + "-->";
            case Node.TEXT_NODE:
                return XmlSupport.escapeText(((Text) node).getData());
            case Node.CDATA_SECTION_NODE:
                return "<![CDATA[" + ((Text) node).getData() + "]]>";
            case Node.ELEMENT_NODE:
                Element element = (Element) node;
                String text = element.getTextContent();
                if (segment == null && text.isEmpty()) {
                    return "<" + element.getTagName() + "/>";
                }
                String startTag = segment == null || segment.selfClosing()
                        ? "<" + element.getTagName() + ">"
                        : segment.startTag();
                return startTag + XmlSupport.escapeText(text) + "</" + element.getTagName() + ">";
            default:
                throw new IllegalStateException("Unexpected node under the root: " + node.getNodeName());
        }
    }

    private void append(MergedEntry entry) {
        Node last = root.getLastChild();
        Node anchor = isWhitespace(last) ? last : null;
        if (entry.historyNote() != null) {
            root.insertBefore(document.createTextNode("\n" + indent), anchor);
            root.insertBefore(document.createComment(Annotations.render(Annotations.Kind.HISTORY, entry.historyNote())), anchor);
        }
        root.insertBefore(document.createTextNode("\n" + indent), anchor);
        root.insertBefore(document.createComment(Annotations.render(Annotations.Kind.SNAPSHOT, entry.sourceSnapshot())), anchor);
        root.insertBefore(document.createTextNode("\n" + indent), anchor);
        Element element = document.createElement(entry.key());
        element.setTextContent(entry.translatedText());
        root.insertBefore(element, anchor);
        if (anchor == null) {
            root.appendChild(document.createTextNode("\n"));
        }
        elements.put(entry.key(), element);
        modified = true;
    }

    /**
     * Collects the annotation comments between the element and the previous element. The closest
     * comment of each kind wins, as it does when parsing.
     */
    private static Annotated annotationsOf(Element element) {
        Comment history = null;
        Comment snapshot = null;
        for (Node node = element.getPreviousSibling(); node != null; node = node.getPreviousSibling()) {
            if (node instanceof Element) {
                break;
            }
            if (node instanceof Comment comment) {
                Annotations.Kind kind = Annotations.classify(comment.getData());
                if (kind == Annotations.Kind.HISTORY && history == null) {
                    history = comment;
                } else if (kind == Annotations.Kind.SNAPSHOT && snapshot == null) {
                    snapshot = comment;
                }
            }
        }
        return new Annotated(history, snapshot);
    }

    private void insertBefore(Node node, Node reference) {
        Node parent = reference.getParentNode();
        parent.insertBefore(node, reference);
        parent.insertBefore(document.createTextNode("\n" + indent), reference);
    }

    /**
     * Removes a node together with the whitespace that follows it.
     */
    private static void detach(Node node) {
        Node parent = node.getParentNode();
        Node next = node.getNextSibling();
        if (isWhitespace(next)) {
            parent.removeChild(next);
        }
        parent.removeChild(node);
    }

    private static boolean follows(Node node, Node other) {
        return (other.compareDocumentPosition(node) & Node.DOCUMENT_POSITION_FOLLOWING) != 0;
    }

    private static boolean isWhitespace(Node node) {
        return node != null && node.getNodeType() == Node.TEXT_NODE && ((Text) node).getData().isBlank();
    }

    static String detectIndent(Element root) {
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (isWhitespace(node) && node.getNextSibling() != null
                    && node.getNextSibling().getNodeType() != Node.TEXT_NODE) {
                String data = ((Text) node).getData();
                int newline = data.lastIndexOf('\n');
                String candidate = newline < 0 ? "" : data.substring(newline + 1);
                if (!candidate.isEmpty()) {
                    return candidate;
                }
            }
        }
        return DEFAULT_INDENT;
    }

    private record Annotated(Comment history, Comment snapshot) {
    }
}
