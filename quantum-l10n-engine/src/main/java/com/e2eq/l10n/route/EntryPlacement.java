package com.e2eq.l10n.route;

import com.e2eq.l10n.model.MergeAction;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.OperationMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups merged entries by the file they belong to. Existing entries stay where they are; the
 * router decides for new ones, and for everything when the tree is built from scratch.
 */
public final class EntryPlacement {

    private EntryPlacement() {
    }

    public static Map<String, List<MergedEntry>> place(List<MergedEntry> entries, StructuralRouter router, OperationMode mode) {
        Map<String, List<MergedEntry>> byFile = new TreeMap<>();
        for (MergedEntry entry : entries) {
            MergedEntry placed = entry;
            if (mode.isFresh() || entry.action() == MergeAction.ADDED) {
                placed = entry.withOriginFile(router.route(entry));
            }
            byFile.computeIfAbsent(placed.originFile(), k -> new ArrayList<>()).add(placed);
        }
        return byFile;
    }
}
