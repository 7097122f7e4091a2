package com.e2eq.l10n.model;

/**
 * Classification of a merged entry produced by a reconciliation pass.
 */
public enum MergeAction {
    /** Source text matches the recorded snapshot, or the key exists only in the target tree. */
    UNCHANGED,

    /** Source text differs from the recorded snapshot; the translation needs review. */
    UPDATED,

    /** Key exists only in the source snapshot; the translation is a placeholder. */
    ADDED
}
