package com.e2eq.l10n.csv;

import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.TargetEntry;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;
import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListReader;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * CSV import and export of entries for external translation workflows. All files are UTF-8 with a
 * header row; a leading byte order mark is ignored on input.
 */
public final class CsvExchange {

    private static final Logger LOG = Logger.getLogger(CsvExchange.class);

    public static final String[] SOURCE_HEADER = {"key", "text", "tag", "file"};
    public static final String[] MERGED_HEADER = {"key", "translatedText", "tag", "originFile", "sourceSnapshot", "historyNote"};

    private static final char BOM = '\uFEFF';

    private CsvExchange() {
    }

    /**
     * Rows read from a CSV file, and the rows that were rejected.
     */
    public record Rows<T>(List<T> rows, List<KeyDiagnostic> rejected) {
        public Rows {
            rows = List.copyOf(rows);
            rejected = List.copyOf(rejected);
        }
    }

    public static void writeSource(Path path, Collection<SourceEntry> entries) throws IOException {
        try (ICsvListWriter writer = newWriter(path)) {
            writer.writeHeader(SOURCE_HEADER);
            for (SourceEntry e : entries) {
                writer.write(e.key(), e.text(), e.tag(), e.originFile());
            }
        }
        LOG.debugf("Wrote %d source rows to %s", entries.size(), path);
    }

    public static void writeMerged(Path path, Collection<MergedEntry> entries) throws IOException {
        try (ICsvListWriter writer = newWriter(path)) {
            writer.writeHeader(MERGED_HEADER);
            for (MergedEntry e : entries) {
                writer.write(e.key(), e.translatedText(), e.tag(), e.originFile(), e.sourceSnapshot(),
                        StringUtils.defaultString(e.historyNote()));
            }
        }
        LOG.infof("Exported %d merged entries to %s", entries.size(), path);
    }

    /**
     * Reads a four-column source extraction.
     */
    public static Rows<SourceEntry> readSource(Path path) throws IOException {
        List<SourceEntry> rows = new ArrayList<>();
        List<KeyDiagnostic> rejected = new ArrayList<>();
        read(path, SOURCE_HEADER.length, columns -> rows.add(
                new SourceEntry(columns.get(0), columns.get(1), columns.get(2), columns.get(3))), rejected);
        return new Rows<>(rows, rejected);
    }

    /**
     * Reads translation rows of five or six columns; the history note is optional.
     */
    public static Rows<TargetEntry> readTranslations(Path path) throws IOException {
        List<TargetEntry> rows = new ArrayList<>();
        List<KeyDiagnostic> rejected = new ArrayList<>();
        read(path, MERGED_HEADER.length - 1, columns -> rows.add(new TargetEntry(columns.get(0), columns.get(1),
                columns.get(2), columns.get(3), columns.get(4),
                columns.size() > 5 ? StringUtils.trimToNull(columns.get(5)) : null)), rejected);
        return new Rows<>(rows, rejected);
    }

    private static void read(Path path, int minColumns, Consumer<List<String>> handler, List<KeyDiagnostic> rejected) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             ICsvListReader reader = new CsvListReader(skipBom(in), CsvPreference.STANDARD_PREFERENCE)) {
            reader.getHeader(true);
            List<String> row;
            while ((row = reader.read()) != null) {
                List<String> columns = new ArrayList<>(row.size());
                for (String value : row) {
                    columns.add(value == null ? "" : value);
                }
                if (columns.size() < minColumns) {
                    String key = columns.isEmpty() ? "" : columns.get(0);
                    String reason = String.format("line %d has %d columns, expected at least %d",
                            reader.getLineNumber(), columns.size(), minColumns);
                    LOG.warnf("Rejected row in %s: %s", path, reason);
                    rejected.add(new KeyDiagnostic(key, path.getFileName().toString(), reason));
                    continue;
                }
                handler.accept(columns);
            }
        } catch (SuperCsvException e) {
            throw new IOException("Malformed CSV in " + path + ": " + e.getMessage(), e);
        }
    }

    private static ICsvListWriter newWriter(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        return new CsvListWriter(out, CsvPreference.STANDARD_PREFERENCE);
    }

    private static BufferedReader skipBom(BufferedReader in) throws IOException {
        in.mark(1);
        if (in.read() != BOM) {
            in.reset();
        }
        return in;
    }
}
