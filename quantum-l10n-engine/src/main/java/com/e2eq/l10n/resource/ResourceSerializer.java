package com.e2eq.l10n.resource;

import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.util.AtomicFiles;
import com.e2eq.l10n.util.ExceptionLoggingUtils;
import com.e2eq.l10n.util.WorkerPool;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Persists placed entries into the files of a namespace tree, one worker task per file.
 * <p>
 * Existing files are edited in place and rewritten only when something changed. A file that is
 * not well-formed is never overwritten. Every write goes through a temporary sibling file.
 */
public class ResourceSerializer {

    private static final Logger LOG = Logger.getLogger(ResourceSerializer.class);

    private final ResourceLayout layout;
    private final int parallelism;

    public ResourceSerializer(ResourceLayout layout, int parallelism) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.parallelism = parallelism;
    }

    /**
     * @param namespaceRoot root the relative paths are resolved against
     * @param placed        entries grouped by relative file path
     * @param fresh         whether every file is written from scratch, ignoring what is on disk
     */
    public WriteResult write(Path namespaceRoot, Map<String, List<MergedEntry>> placed, boolean fresh) {
        List<Map.Entry<String, List<MergedEntry>>> groups = new ArrayList<>(new TreeMap<>(placed).entrySet());
        List<FileOutcome> outcomes = WorkerPool.map(groups, parallelism, "l10n-write",
                group -> writeFile(namespaceRoot, group.getKey(), group.getValue(), fresh));

        int written = 0;
        int untouched = 0;
        List<ResourceError> errors = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                errors.add(outcome.error());
            } else if (outcome.written()) {
                written++;
            } else {
                untouched++;
            }
        }
        LOG.infof("Wrote %d files under %s, %d untouched, %d failed", written, namespaceRoot, untouched, errors.size());
        return new WriteResult(written, untouched, errors);
    }

    /**
     * Deletes every structured-data file below the root. Other files are kept.
     *
     * @return number of files deleted
     */
    public int clear(Path namespaceRoot) throws IOException {
        if (!Files.isDirectory(namespaceRoot)) {
            return 0;
        }
        List<Path> files;
        try (Stream<Path> stream = Files.walk(namespaceRoot)) {
            files = stream.filter(layout::isResourceFile).sorted(Comparator.reverseOrder()).toList();
        }
        for (Path file : files) {
            Files.delete(file);
        }
        LOG.infof("Removed %d existing files under %s", files.size(), namespaceRoot);
        return files.size();
    }

    /**
     * Resolves a relative path under the root.
     *
     * @return the resolved file, or {@code null} when the path is absolute or leaves the root
     */
    static Path resolveInside(Path namespaceRoot, String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            return null;
        }
        try {
            Path relative = Path.of(relativePath);
            if (relative.isAbsolute()) {
                return null;
            }
            Path base = namespaceRoot.toAbsolutePath().normalize();
            Path file = base.resolve(relative).normalize();
            return file.startsWith(base) && !file.equals(base) ? file : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private FileOutcome writeFile(Path namespaceRoot, String relativePath, List<MergedEntry> entries, boolean fresh) {
        Path file = resolveInside(namespaceRoot, relativePath);
        if (file == null) {
            LOG.warnf("Refusing to write %s: path is outside %s", relativePath, namespaceRoot);
            return FileOutcome.failed(ResourceError.serialization(relativePath, "path escapes the namespace root"));
        }
        ResourceDocument document;
        if (fresh || !Files.exists(file)) {
            document = ResourceDocument.create(layout.rootElement());
            entries.stream()
                    .sorted(Comparator.comparing(MergedEntry::key))
                    .forEach(document::apply);
        } else {
            try {
                document = ResourceDocument.load(file);
            } catch (IOException e) {
                LOG.warnf("Leaving %s untouched: %s", relativePath, e.getMessage());
                return FileOutcome.failed(ResourceError.serialization(relativePath,
                        "existing file could not be read and was not overwritten: " + e.getMessage()));
            }
            entries.forEach(document::apply);
        }
        if (!document.isModified()) {
            LOG.debugf("No changes for %s", relativePath);
            return FileOutcome.UNTOUCHED;
        }
        try {
            AtomicFiles.writeString(file, document.toXml());
            LOG.debugf("Wrote %s (%d entries)", relativePath, entries.size());
            return FileOutcome.WRITTEN;
        } catch (IOException e) {
            ExceptionLoggingUtils.logWarn(LOG, e, "Failed to write %s", relativePath);
            return FileOutcome.failed(ResourceError.serialization(relativePath, e.getMessage()));
        }
    }

    private record FileOutcome(boolean written, ResourceError error) {
        static final FileOutcome WRITTEN = new FileOutcome(true, null);
        static final FileOutcome UNTOUCHED = new FileOutcome(false, null);

        static FileOutcome failed(ResourceError error) {
            return new FileOutcome(false, error);
        }
    }
}
