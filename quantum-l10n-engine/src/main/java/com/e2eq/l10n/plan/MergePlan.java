package com.e2eq.l10n.plan;

import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.KeyOverlapReport;
import com.e2eq.l10n.model.MergeAction;
import com.e2eq.l10n.model.MergeStatistics;
import com.e2eq.l10n.model.MergedEntry;

import java.util.List;

/**
 * Result of one reconciliation pass over a namespace.
 *
 * @param entries     merged entries to hand to serialization, sorted by key
 * @param statistics  counters for every key seen, including suppressed unchanged ones
 * @param diagnostics rejected input entries
 * @param overlap     key overlap between the source snapshot and the target tree
 */
public record MergePlan(List<MergedEntry> entries,
                        MergeStatistics statistics,
                        List<KeyDiagnostic> diagnostics,
                        KeyOverlapReport overlap) {

    public MergePlan {
        entries = List.copyOf(entries);
        diagnostics = List.copyOf(diagnostics);
    }

    public static MergePlan empty() {
        return new MergePlan(List.of(), new MergeStatistics(), List.of(), KeyOverlapReport.empty());
    }

    public List<MergedEntry> entriesWith(MergeAction action) {
        return entries.stream().filter(e -> e.action() == action).toList();
    }

    /**
     * Keeps only added entries, as an incremental pass does. Statistics still describe the full pass.
     */
    public MergePlan onlyAdded() {
        List<MergedEntry> added = entriesWith(MergeAction.ADDED);
        MergeStatistics stats = new MergeStatistics();
        stats.setSourceCount(statistics.getSourceCount());
        stats.setTargetCount(statistics.getTargetCount());
        stats.setUnchangedCount(statistics.getUnchangedCount());
        stats.setUpdatedCount(statistics.getUpdatedCount());
        stats.setAddedCount(statistics.getAddedCount());
        stats.setRejectedCount(statistics.getRejectedCount());
        stats.setEmittedCount(added.size());
        return new MergePlan(added, stats, diagnostics, overlap);
    }
}
