package com.e2eq.l10n.service;

import com.e2eq.l10n.model.ResourceError;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a run: one entry per selected namespace and every recorded error.
 */
@Data
@NoArgsConstructor
public class ReconciliationReport {
    private String historyDate;
    private List<NamespaceOutcome> outcomes = new ArrayList<>();
    private List<ResourceError> errors = new ArrayList<>();

    public int getFailureCount() {
        return errors.size();
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }
}
