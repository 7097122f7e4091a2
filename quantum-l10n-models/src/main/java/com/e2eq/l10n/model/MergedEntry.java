package com.e2eq.l10n.model;

import java.util.Objects;

/**
 * Output of a reconciliation pass for a single key.
 */
public record MergedEntry(String key,
                          String translatedText,
                          String tag,
                          String originFile,
                          String sourceSnapshot,
                          String historyNote,
                          MergeAction action) {

    public MergedEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(action, "action");
        translatedText = translatedText == null ? "" : translatedText;
        tag = tag == null ? "" : tag;
        originFile = originFile == null ? "" : originFile;
        sourceSnapshot = sourceSnapshot == null ? "" : sourceSnapshot;
    }

    /**
     * Pass-through of an existing entry.
     */
    public static MergedEntry unchanged(TargetEntry target) {
        return new MergedEntry(target.key(), target.translatedText(), target.tag(), target.originFile(),
                target.sourceSnapshot(), target.historyNote(), MergeAction.UNCHANGED);
    }

    public MergedEntry withOriginFile(String newOriginFile) {
        return new MergedEntry(key, translatedText, tag, newOriginFile, sourceSnapshot, historyNote, action);
    }
}
