package com.e2eq.l10n.plan;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Formats the single-line change record kept above each reconciled entry. Each new note replaces
 * the previous one.
 */
public final class HistoryNotes {

    private final String date;

    public HistoryNotes(LocalDate date) {
        this.date = DateTimeFormatter.ISO_LOCAL_DATE.format(Objects.requireNonNull(date, "date"));
    }

    public String updated(String previousTranslation, String previousSnapshot, String newSource) {
        return String.format("previous translation '%s', previous source '%s' -> new source '%s', updated on %s",
                previousTranslation, previousSnapshot, newSource, date);
    }

    public String added(String sourceText) {
        return String.format("added '%s' on %s", sourceText, date);
    }
}
