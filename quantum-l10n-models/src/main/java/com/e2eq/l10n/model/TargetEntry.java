package com.e2eq.l10n.model;

import java.util.Objects;

/**
 * One entry of the existing target-language tree.
 *
 * @param key            identifier of the field within its namespace
 * @param translatedText human-authored target-language text
 * @param tag            informational classifier
 * @param originFile     file the entry currently lives in, relative to the namespace root
 * @param sourceSnapshot source text the translation was last validated against; empty when never reconciled
 * @param historyNote    most recent change record, or {@code null}
 */
public record TargetEntry(String key,
                          String translatedText,
                          String tag,
                          String originFile,
                          String sourceSnapshot,
                          String historyNote) {

    public TargetEntry {
        Objects.requireNonNull(key, "key");
        translatedText = translatedText == null ? "" : translatedText;
        tag = tag == null ? "" : tag;
        originFile = originFile == null ? "" : originFile;
        sourceSnapshot = sourceSnapshot == null ? "" : sourceSnapshot;
    }

    public TargetEntry withKey(String newKey) {
        return new TargetEntry(newKey, translatedText, tag, originFile, sourceSnapshot, historyNote);
    }
}
