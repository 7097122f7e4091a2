package com.e2eq.l10n.service;

import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.KeyOverlapReport;
import com.e2eq.l10n.model.MergeStatistics;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.OperationMode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * What a run did for one namespace.
 */
@Data
@Builder
public class NamespaceOutcome {
    private Namespace namespace;
    private OperationMode mode;
    private MergeStatistics statistics;
    private KeyOverlapReport overlap;
    @Builder.Default
    private List<KeyDiagnostic> diagnostics = List.of();
    private int filesWritten;
    private int filesUntouched;
    private int routerFallbacks;
    private String csvExport;
}
