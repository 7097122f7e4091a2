package com.e2eq.l10n.model;

/**
 * An input entry that was rejected because its key is malformed, or that could not be applied.
 */
public record KeyDiagnostic(String key, String originFile, String reason) {
}
