package com.e2eq.l10n.resource;

import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.util.XmlSupport;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;
import org.w3c.dom.Comment;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the entries of one resource file together with the annotations that precede them.
 */
final class ResourceFileReader {

    private static final Logger LOG = Logger.getLogger(ResourceFileReader.class);

    private ResourceFileReader() {
    }

    /**
     * @param file         file to read
     * @param relativePath path recorded as the entries' origin file
     * @throws IOException when the file cannot be read or is not well-formed
     */
    static List<TargetEntry> read(Path file, String relativePath) throws IOException {
        Document document = XmlSupport.parse(file);
        Element root = document.getDocumentElement();
        List<TargetEntry> entries = new ArrayList<>();
        String pendingHistory = null;
        String pendingSnapshot = null;
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if (node instanceof Comment comment) {
                String data = comment.getData();
                switch (Annotations.classify(data)) {
                    case HISTORY -> pendingHistory = Annotations.textOf(data);
                    case SNAPSHOT -> pendingSnapshot = Annotations.textOf(data);
                    default -> {
                        // unrelated comment
                    }
                }
            } else if (node instanceof Element element) {
                if (hasChildElements(element)) {
                    LOG.warnf("Skipping <%s> in %s: list values are not reconciled", element.getTagName(), relativePath);
                } else {
                    String key = element.getTagName();
                    entries.add(new TargetEntry(key, element.getTextContent(), tagOf(key), relativePath,
                            pendingSnapshot, pendingHistory));
                }
                pendingHistory = null;
                pendingSnapshot = null;
            }
        }
        LOG.debugf("Read %d entries from %s", entries.size(), relativePath);
        return entries;
    }

    static boolean hasChildElements(Element element) {
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    static String tagOf(String key) {
        String last = StringUtils.substringAfterLast(key, ".");
        return last.isEmpty() ? key : last;
    }
}
