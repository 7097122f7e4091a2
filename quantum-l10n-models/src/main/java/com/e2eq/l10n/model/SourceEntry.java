package com.e2eq.l10n.model;

import java.util.Objects;

/**
 * One source-language entry as currently extracted.
 *
 * @param key        identifier of the field within its namespace; may still carry a {@code DefType/} prefix
 * @param text       source-language text
 * @param tag        field classifier of the form {@code Discriminant[.field]}; routing metadata only
 * @param originFile provenance path in the source tree, relative and {@code /} separated
 */
public record SourceEntry(String key, String text, String tag, String originFile) {

    public SourceEntry {
        Objects.requireNonNull(key, "key");
        text = text == null ? "" : text;
        tag = tag == null ? "" : tag;
        originFile = originFile == null ? "" : originFile;
    }

    public SourceEntry withKey(String newKey) {
        return new SourceEntry(newKey, text, tag, originFile);
    }
}
