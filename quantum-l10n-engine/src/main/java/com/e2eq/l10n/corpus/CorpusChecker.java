package com.e2eq.l10n.corpus;

import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.ICsvListReader;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a TSV corpus before it is handed to a training or review tool: every line holds exactly
 * two non-blank cells, and no cell contains an ideographic or zero-width space.
 */
public final class CorpusChecker {

    private static final CsvPreference TSV_KEEPING_EMPTY_LINES =
            new CsvPreference.Builder(CorpusFormat.TSV.preference()).ignoreEmptyLines(false).build();

    private static final char IDEOGRAPHIC_SPACE = '\u3000';
    private static final char ZERO_WIDTH_SPACE = '\u200B';

    private CorpusChecker() {
    }

    /**
     * @return one message per problem, empty when the file is well-formed
     * @throws IOException when the file cannot be read or its quoting is broken
     */
    public static List<String> checkTsv(Path file) throws IOException {
        List<String> problems = new ArrayList<>();
        try (ICsvListReader reader = new CsvListReader(Files.newBufferedReader(file, StandardCharsets.UTF_8),
                TSV_KEEPING_EMPTY_LINES)) {
            List<String> row;
            while ((row = reader.read()) != null) {
                int line = reader.getLineNumber();
                if (row.size() == 1 && row.get(0) == null) {
                    problems.add(String.format("line %d is empty", line));
                    continue;
                }
                if (row.size() != 2) {
                    problems.add(String.format("line %d has %d columns, expected 2", line, row.size()));
                }
                if (row.stream().anyMatch(cell -> cell == null || cell.isBlank())) {
                    problems.add(String.format("line %d has an empty cell", line));
                }
                if (row.stream().anyMatch(cell -> cell != null
                        && (cell.indexOf(IDEOGRAPHIC_SPACE) >= 0 || cell.indexOf(ZERO_WIDTH_SPACE) >= 0))) {
                    problems.add(String.format("line %d contains an ideographic or zero-width space", line));
                }
            }
        } catch (SuperCsvException e) {
            throw new IOException("Malformed TSV in " + file + ": " + e.getMessage(), e);
        }
        return problems;
    }
}
