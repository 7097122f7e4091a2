package com.e2eq.l10n.resource;

import org.w3c.dom.Comment;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The original text of a resource file, cut at the children of the root element. A rewrite copies
 * the text of every child it did not edit, so untouched entries keep their exact bytes.
 */
final class SourceSegments {

    enum Kind {
        TEXT, COMMENT, CDATA, INSTRUCTION, ELEMENT
    }

    record Segment(Kind kind, String text, String startTag) {

        boolean selfClosing() {
            return startTag != null && startTag.endsWith("/>");
        }

        boolean matches(Node node) {
            return switch (kind) {
                case TEXT -> node.getNodeType() == Node.TEXT_NODE;
                case CDATA -> node.getNodeType() == Node.CDATA_SECTION_NODE;
                case INSTRUCTION -> node.getNodeType() == Node.PROCESSING_INSTRUCTION_NODE;
                case COMMENT -> node instanceof Comment comment
                        && normalizeLineEnds(text).equals("<!--" + comment.getData() + "-->");
                case ELEMENT -> node instanceof Element element
                        && nameOf(startTag).equals(element.getTagName());
            };
        }
    }

    private final String prefix;
    private final List<Segment> children;
    private final String suffix;

    private SourceSegments(String prefix, List<Segment> children, String suffix) {
        this.prefix = prefix;
        this.children = children;
        this.suffix = suffix;
    }

    /**
     * Everything up to and including the root start tag.
     */
    String prefix() {
        return prefix;
    }

    /**
     * The root end tag and everything after it.
     */
    String suffix() {
        return suffix;
    }

    /**
     * Cuts well-formed resource text at the root's children.
     *
     * @return the segments, or {@code null} when the text is not laid out as expected (for
     * instance a self-closing root element)
     */
    static SourceSegments scan(String source) {
        int rootStart = skipProlog(source);
        if (rootStart < 0) {
            return null;
        }
        int rootEnd = endOfTag(source, rootStart);
        if (rootEnd < 0 || source.charAt(rootEnd - 2) == '/') {
            return null;
        }
        List<Segment> children = new ArrayList<>();
        int i = rootEnd;
        while (i < source.length()) {
            if (source.startsWith("</", i)) {
                return new SourceSegments(source.substring(0, rootEnd), children, source.substring(i));
            }
            Kind kind;
            int end;
            String startTag = null;
            if (source.startsWith("<!--", i)) {
                kind = Kind.COMMENT;
                end = after(source, "-->", i + 4);
            } else if (source.startsWith("<![CDATA[", i)) {
                kind = Kind.CDATA;
                end = after(source, "]]>", i + 9);
            } else if (source.startsWith("<?", i)) {
                kind = Kind.INSTRUCTION;
                end = after(source, "?>", i + 2);
            } else if (source.charAt(i) == '<') {
                kind = Kind.ELEMENT;
                int tagEnd = endOfTag(source, i);
                if (tagEnd < 0) {
                    return null;
                }
                startTag = source.substring(i, tagEnd);
                end = startTag.endsWith("/>") ? tagEnd : endOfContent(source, tagEnd);
            } else {
                kind = Kind.TEXT;
                end = source.indexOf('<', i);
            }
            if (end < 0) {
                return null;
            }
            children.add(new Segment(kind, source.substring(i, end), startTag));
            i = end;
        }
        return null;
    }

    /**
     * Pairs the root's DOM children with the segments, in order.
     *
     * @return segment per child node, or {@code null} when the two do not line up
     */
    Map<Node, Segment> bind(Element root) {
        Map<Node, Segment> bound = new IdentityHashMap<>();
        Iterator<Segment> segments = children.iterator();
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (!segments.hasNext()) {
                return null;
            }
            Segment segment = segments.next();
            if (!segment.matches(node)) {
                return null;
            }
            bound.put(node, segment);
        }
        return segments.hasNext() ? null : bound;
    }

    private static int skipProlog(String source) {
        int i = 0;
        while (i >= 0 && i < source.length()) {
            char c = source.charAt(i);
            if (c == '\uFEFF' || Character.isWhitespace(c)) {
                i++;
            } else if (source.startsWith("<?", i)) {
                i = after(source, "?>", i + 2);
            } else if (source.startsWith("<!--", i)) {
                i = after(source, "-->", i + 4);
            } else if (c == '<') {
                return i;
            } else {
                return -1;
            }
        }
        return -1;
    }

    /**
     * @return index just past the {@code >} closing the tag that starts at {@code from}
     */
    private static int endOfTag(String source, int from) {
        char quote = 0;
        for (int i = from + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i + 1;
            }
        }
        return -1;
    }

    /**
     * @return index just past the end tag matching an element whose content starts at {@code from}
     */
    private static int endOfContent(String source, int from) {
        int depth = 1;
        int i = from;
        while (i >= 0) {
            i = source.indexOf('<', i);
            if (i < 0) {
                return -1;
            }
            if (source.startsWith("<!--", i)) {
                i = after(source, "-->", i + 4);
            } else if (source.startsWith("<![CDATA[", i)) {
                i = after(source, "]]>", i + 9);
            } else if (source.startsWith("<?", i)) {
                i = after(source, "?>", i + 2);
            } else {
                boolean closing = source.startsWith("</", i);
                int tagEnd = endOfTag(source, i);
                if (tagEnd < 0) {
                    return -1;
                }
                if (closing) {
                    depth--;
                } else if (source.charAt(tagEnd - 2) != '/') {
                    depth++;
                }
                if (depth == 0) {
                    return tagEnd;
                }
                i = tagEnd;
            }
        }
        return -1;
    }

    private static int after(String source, String token, int from) {
        int index = source.indexOf(token, from);
        return index < 0 ? -1 : index + token.length();
    }

    private static String nameOf(String startTag) {
        int end = 1;
        while (end < startTag.length()) {
            char c = startTag.charAt(end);
            if (Character.isWhitespace(c) || c == '>' || c == '/') {
                break;
            }
            end++;
        }
        return startTag.substring(1, end);
    }

    private static String normalizeLineEnds(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
