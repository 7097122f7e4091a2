package com.e2eq.l10n.source;

import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.model.SourceEntry;

import java.util.List;

/**
 * Source-language entries of one namespace, with whatever could not be read.
 */
public record SourceSnapshot(List<SourceEntry> entries, List<ResourceError> errors, List<KeyDiagnostic> rejected) {

    public SourceSnapshot {
        entries = List.copyOf(entries);
        errors = List.copyOf(errors);
        rejected = List.copyOf(rejected);
    }

    public static SourceSnapshot of(List<SourceEntry> entries) {
        return new SourceSnapshot(entries, List.of(), List.of());
    }
}
