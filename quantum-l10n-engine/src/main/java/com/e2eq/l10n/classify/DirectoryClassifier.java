package com.e2eq.l10n.classify;

import com.e2eq.l10n.model.TreePresence;
import com.e2eq.l10n.resource.ResourceLayout;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Tells whether a directory holds any structured-data file anywhere in its subtree.
 */
public class DirectoryClassifier {

    private static final Logger LOG = Logger.getLogger(DirectoryClassifier.class);

    private final ResourceLayout layout;

    public DirectoryClassifier(ResourceLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
    }

    /**
     * @throws UncheckedIOException when an existing directory cannot be scanned
     */
    public TreePresence classify(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return TreePresence.ABSENT;
        }
        try (Stream<Path> stream = Files.walk(directory)) {
            TreePresence presence = stream.anyMatch(layout::isResourceFile) ? TreePresence.PRESENT : TreePresence.ABSENT;
            LOG.debugf("%s is %s", directory, presence);
            return presence;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + directory, e);
        }
    }
}
