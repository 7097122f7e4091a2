package com.e2eq.l10n.corpus;

import org.supercsv.prefs.CsvPreference;

/**
 * Output formats of the parallel corpus. Neither carries a header row.
 */
public enum CorpusFormat {
    TSV("tsv", new CsvPreference.Builder('"', '\t', "\n").build()),
    CSV("csv", CsvPreference.STANDARD_PREFERENCE);

    public static final String BASE_NAME = "parallel-corpus";

    private final String extension;
    private final CsvPreference preference;

    CorpusFormat(String extension, CsvPreference preference) {
        this.extension = extension;
        this.preference = preference;
    }

    public String fileName() {
        return BASE_NAME + "." + extension;
    }

    public CsvPreference preference() {
        return preference;
    }
}
