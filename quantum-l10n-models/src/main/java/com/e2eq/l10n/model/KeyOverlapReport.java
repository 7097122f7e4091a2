package com.e2eq.l10n.model;

/**
 * Data quality summary of one reconciliation pass.
 *
 * @param sharedKeys         keys present in both the source snapshot and the target tree
 * @param sourceOnlyKeys     keys present only in the source snapshot
 * @param targetOnlyKeys     keys present only in the target tree (stale until a rebuild)
 * @param emptyTranslations  target entries whose translated text is blank
 */
public record KeyOverlapReport(int sharedKeys, int sourceOnlyKeys, int targetOnlyKeys, int emptyTranslations) {

    public static KeyOverlapReport empty() {
        return new KeyOverlapReport(0, 0, 0, 0);
    }
}
