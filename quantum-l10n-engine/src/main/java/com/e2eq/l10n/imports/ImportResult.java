package com.e2eq.l10n.imports;

import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.resource.WriteResult;

import java.util.List;

/**
 * Outcome of importing translated rows into a namespace tree.
 *
 * @param applied  rows whose key was found in the tree
 * @param rejected rows that were not applied, with the reason
 * @param writes   files written and left untouched
 * @param errors   files that could not be read or written
 */
public record ImportResult(int applied, List<KeyDiagnostic> rejected, WriteResult writes, List<ResourceError> errors) {

    public ImportResult {
        rejected = List.copyOf(rejected);
        errors = List.copyOf(errors);
    }
}
