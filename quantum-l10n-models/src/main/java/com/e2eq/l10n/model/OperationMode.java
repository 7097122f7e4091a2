package com.e2eq.l10n.model;

/**
 * Concrete operation derived from tree presence and the requested {@link ConflictPolicy}.
 */
public enum OperationMode {
    /** Nothing was extracted for the namespace. */
    SKIP,

    /** No target tree yet; every source entry is written as new. */
    FIRST_BUILD,

    /** Full reconciliation pass. */
    RECONCILE,

    /** Reconciliation restricted to added entries. */
    ADDITIVE,

    /** Existing target files are discarded and rebuilt from the source snapshot. */
    REBUILD;

    /**
     * @return true when the mode writes every entry into freshly created files
     */
    public boolean isFresh() {
        return this == FIRST_BUILD || this == REBUILD;
    }
}
