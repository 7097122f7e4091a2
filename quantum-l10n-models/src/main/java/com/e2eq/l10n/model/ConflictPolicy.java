package com.e2eq.l10n.model;

/**
 * Policy chosen by the caller for what to do when a target tree already exists.
 */
public enum ConflictPolicy {
    /** Build a fresh tree; refused when the target is already present. */
    NEW,

    /** Reconcile the existing tree: flag changed entries and add new ones. */
    MERGE,

    /** Only add entries that are new; leave changed entries alone. */
    INCREMENTAL,

    /** Discard the existing tree and write every source entry as new. */
    REBUILD
}
