package com.e2eq.l10n.service;

import com.e2eq.l10n.model.ConflictPolicy;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.StructuralStrategy;
import com.e2eq.l10n.resource.ResourceLayout;
import com.e2eq.l10n.source.SourceSnapshotProvider;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * Parameters of one reconciliation run.
 */
@Data
@Builder
public class ReconciliationRequest {

    /**
     * Where the current source-language entries come from.
     */
    private SourceSnapshotProvider sourceProvider;

    /**
     * Target language root, e.g. {@code Languages/French}.
     */
    private Path targetRoot;

    @Builder.Default
    private ResourceLayout layout = ResourceLayout.defaults();

    @Builder.Default
    private List<Namespace> namespaces = List.of(Namespace.TYPED, Namespace.FLAT);

    @Builder.Default
    private ConflictPolicy conflictPolicy = ConflictPolicy.MERGE;

    @Builder.Default
    private StructuralStrategy structuralStrategy = StructuralStrategy.MIRROR_SOURCE;

    /**
     * Source-language tree whose file layout new entries follow; required by {@link StructuralStrategy#MIRROR_REFERENCE}.
     */
    private Path referenceRoot;

    /**
     * Whether unchanged entries are part of the plan and the CSV export.
     */
    private boolean includeUnchanged;

    @Builder.Default
    private LocalDate historyDate = LocalDate.now();

    @Builder.Default
    private int parallelism = 4;

    /**
     * Directory receiving {@code <namespace>-merged.csv}; no export when null.
     */
    private Path csvExportDir;
}
