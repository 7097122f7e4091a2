package com.e2eq.l10n.resource;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.util.WorkerPool;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads every resource file below a namespace root. Files are parsed concurrently; results are
 * combined in sorted path order.
 */
public class ResourceParser {

    private static final Logger LOG = Logger.getLogger(ResourceParser.class);

    private final ResourceLayout layout;
    private final int parallelism;

    public ResourceParser(ResourceLayout layout, int parallelism) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.parallelism = parallelism;
    }

    /**
     * @param namespaceRoot directory to scan; a missing directory yields an empty result
     * @throws IOException                 when the directory cannot be scanned
     * @throws MergeConfigurationException when a key is defined in more than one place
     */
    public LoadResult load(Path namespaceRoot) throws IOException {
        if (!Files.isDirectory(namespaceRoot)) {
            LOG.debugf("Nothing to load, %s does not exist", namespaceRoot);
            return LoadResult.empty();
        }
        List<Path> files = listFiles(namespaceRoot);
        List<FileResult> results = WorkerPool.map(files, parallelism, "l10n-parse",
                file -> readFile(namespaceRoot, file));

        List<TargetEntry> entries = new ArrayList<>();
        List<ResourceError> errors = new ArrayList<>();
        Map<String, String> firstSeen = new HashMap<>();
        for (FileResult result : results) {
            if (result.error() != null) {
                errors.add(result.error());
                continue;
            }
            for (TargetEntry entry : result.entries()) {
                String previous = firstSeen.putIfAbsent(entry.key(), entry.originFile());
                if (previous != null) {
                    throw new MergeConfigurationException(String.format(
                            "Duplicate key '%s' in %s (first seen in %s)", entry.key(), entry.originFile(), previous));
                }
                entries.add(entry);
            }
        }
        LOG.infof("Loaded %d entries from %d files under %s (%d unreadable)",
                entries.size(), files.size() - errors.size(), namespaceRoot, errors.size());
        return new LoadResult(entries, errors);
    }

    List<Path> listFiles(Path namespaceRoot) throws IOException {
        try (Stream<Path> stream = Files.walk(namespaceRoot)) {
            return stream.filter(layout::isResourceFile)
                    .sorted(Comparator.comparing(p -> relativize(namespaceRoot, p)))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IOException("Failed to scan resource files under " + namespaceRoot, e);
        }
    }

    static String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static FileResult readFile(Path root, Path file) {
        String relative = relativize(root, file);
        try {
            return new FileResult(ResourceFileReader.read(file, relative), null);
        } catch (IOException e) {
            LOG.warnf("Skipping %s: %s", relative, e.getMessage());
            return new FileResult(List.of(), ResourceError.parse(relative, e.getMessage()));
        }
    }

    private record FileResult(List<TargetEntry> entries, ResourceError error) {
    }
}
