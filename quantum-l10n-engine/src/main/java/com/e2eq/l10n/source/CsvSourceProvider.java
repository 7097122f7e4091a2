package com.e2eq.l10n.source;

import com.e2eq.l10n.csv.CsvExchange;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.TreePresence;
import org.jboss.logging.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reads source text from one extraction CSV per namespace ({@code key,text,tag,file}).
 */
public class CsvSourceProvider implements SourceSnapshotProvider {

    private static final Logger LOG = Logger.getLogger(CsvSourceProvider.class);

    private final Map<Namespace, Path> files;

    public CsvSourceProvider(Map<Namespace, Path> files) {
        this.files = new EnumMap<>(Namespace.class);
        this.files.putAll(files);
    }

    @Override
    public String getId() {
        return "csv";
    }

    /**
     * A namespace is present when its file exists and has at least one row below the header.
     */
    @Override
    public TreePresence presence(Namespace namespace) {
        Path file = files.get(namespace);
        if (file == null || !Files.isRegularFile(file)) {
            return TreePresence.ABSENT;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.lines().skip(1).anyMatch(line -> !line.isBlank()) ? TreePresence.PRESENT : TreePresence.ABSENT;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    @Override
    public SourceSnapshot load(Namespace namespace) throws IOException {
        Path file = files.get(namespace);
        if (file == null) {
            return SourceSnapshot.of(List.of());
        }
        CsvExchange.Rows<SourceEntry> rows = CsvExchange.readSource(file);
        LOG.infof("Read %d %s source rows from %s (%d rejected)", rows.rows().size(), namespace, file, rows.rejected().size());
        return new SourceSnapshot(rows.rows(), List.of(), rows.rejected());
    }
}
