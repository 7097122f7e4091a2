package com.e2eq.l10n.model;

/**
 * The two independent key-spaces reconciled by the engine.
 */
public enum Namespace {
    /** Structured definitions, keyed by {@code defName.field}. */
    TYPED("DefInjected"),

    /** Flat string tables, keyed by a plain identifier. */
    FLAT("Keyed");

    private final String defaultDirectory;

    Namespace(String defaultDirectory) {
        this.defaultDirectory = defaultDirectory;
    }

    public String defaultDirectory() {
        return defaultDirectory;
    }
}
