package com.e2eq.l10n.imports;

import com.e2eq.l10n.model.ResourceError;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an import run. Rejected rows are reported per namespace and do not fail the run.
 */
@Data
@NoArgsConstructor
public class ImportReport {
    private List<NamespaceImport> outcomes = new ArrayList<>();
    private List<ResourceError> errors = new ArrayList<>();

    public int getFailureCount() {
        return errors.size();
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }
}
