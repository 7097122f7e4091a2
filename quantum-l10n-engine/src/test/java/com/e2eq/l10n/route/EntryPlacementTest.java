package com.e2eq.l10n.route;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.model.MergeAction;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.OperationMode;
import com.e2eq.l10n.model.StructuralStrategy;
import com.e2eq.l10n.resource.ResourceLayout;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class EntryPlacementTest {

    private final StructuralRouter byType = StructuralRouter.create(StructuralStrategy.GROUP_BY_TYPE, null, ResourceLayout.defaults());

    @Test
    void onlyAddedEntriesAreRoutedWhenReconciling() {
        MergedEntry updated = new MergedEntry("u", "t", "ThingDef.label", "Existing/File.xml", "s", "h", MergeAction.UPDATED);
        MergedEntry added = new MergedEntry("a", "t", "ThingDef.label", "Src/File.xml", "s", "h", MergeAction.ADDED);

        Map<String, List<MergedEntry>> placed = EntryPlacement.place(List.of(updated, added), byType, OperationMode.RECONCILE);

        assertEquals(List.of(updated), placed.get("Existing/File.xml"));
        assertEquals("ThingDef/ThingDef.xml", placed.get("ThingDef/ThingDef.xml").get(0).originFile());
    }

    @Test
    void freshModesRouteEverything() {
        MergedEntry a = new MergedEntry("a", "t", "Keyed", "Src/One.xml", "s", "h", MergeAction.ADDED);
        MergedEntry b = new MergedEntry("b", "t", "Keyed", "Src/Two.xml", "s", "h", MergeAction.ADDED);

        Map<String, List<MergedEntry>> placed = EntryPlacement.place(List.of(a, b), byType, OperationMode.REBUILD);

        assertEquals(1, placed.size());
        assertEquals(2, placed.get("Keyed/Keyed.xml").size());
    }
}
