package com.e2eq.l10n.plan;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.MergeAction;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.TargetEntry;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class MergePlannerTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 1);

    private final MergePlanner planner = new MergePlanner(DATE);

    private static SourceEntry source(String key, String text) {
        return new SourceEntry(key, text, "ThingDef.label", "ThingDef/Nymphs.xml");
    }

    private static TargetEntry target(String key, String translation, String snapshot) {
        return new TargetEntry(key, translation, "label", "ThingDef/Nymphs.xml", snapshot, null);
    }

    /**
     * The entry as the next pass reads it back from disk.
     */
    private static TargetEntry persisted(MergedEntry entry) {
        return new TargetEntry(entry.key(), entry.translatedText(), entry.tag(), entry.originFile(),
                entry.sourceSnapshot(), entry.historyNote());
    }

    private static Map<String, MergedEntry> byKey(MergePlan plan) {
        return plan.entries().stream().collect(Collectors.toMap(MergedEntry::key, Function.identity()));
    }

    @Test
    void unchangedWhenSourceMatchesSnapshot() {
        TargetEntry existing = target("Nymph.label", "Nymphe bavarde", "Chatty Nymph");

        MergePlan plan = planner.plan(List.of(source("ThingDef/Nymph.label", "Chatty Nymph")), List.of(existing), true);

        MergedEntry entry = plan.entries().get(0);
        assertEquals(MergeAction.UNCHANGED, entry.action());
        assertEquals(existing, persisted(entry));
        assertEquals(1, plan.overlap().sharedKeys());
    }

    @Test
    void updatedKeepsTranslationAndRefreshesSnapshot() {
        TargetEntry existing = new TargetEntry("Nymph.label", "Nymphe bavarde", "label", "Custom/Place.xml",
                "Chatty Nymph", "added 'Chatty Nymph' on 2023-01-01");

        MergePlan plan = planner.plan(List.of(source("Nymph.label", "Talkative Nymph")), List.of(existing), false);

        MergedEntry entry = plan.entries().get(0);
        assertEquals(MergeAction.UPDATED, entry.action());
        assertEquals("Nymphe bavarde", entry.translatedText());
        assertEquals("Talkative Nymph", entry.sourceSnapshot());
        assertEquals("Custom/Place.xml", entry.originFile(), "placement stays where the target keeps it");
        assertEquals("label", entry.tag());
        assertEquals("previous translation 'Nymphe bavarde', previous source 'Chatty Nymph' -> new source 'Talkative Nymph', updated on 2024-05-01",
                entry.historyNote());
    }

    @Test
    void addedUsesSourceTextAsPlaceholder() {
        MergePlan plan = planner.plan(List.of(source("b.title", "Explosive")), List.of(), false);

        MergedEntry entry = plan.entries().get(0);
        assertEquals(MergeAction.ADDED, entry.action());
        assertEquals("Explosive", entry.translatedText());
        assertEquals("Explosive", entry.sourceSnapshot());
        assertEquals("ThingDef.label", entry.tag());
        assertEquals("ThingDef/Nymphs.xml", entry.originFile());
        assertEquals("added 'Explosive' on 2024-05-01", entry.historyNote());
    }

    @Test
    void targetOnlyKeysPassThroughAndAreNeverDropped() {
        TargetEntry stale = target("Gone.label", "Parti", "Gone");

        MergePlan included = planner.plan(List.of(), List.of(stale), true);
        MergePlan excluded = planner.plan(List.of(), List.of(stale), false);

        assertEquals(List.of(MergedEntry.unchanged(stale)), included.entries());
        assertTrue(excluded.entries().isEmpty());
        assertEquals(1, excluded.statistics().getUnchangedCount());
        assertEquals(1, excluded.overlap().targetOnlyKeys());
    }

    @Test
    void missingSnapshotCountsAsUpdate() {
        MergePlan plan = planner.plan(List.of(source("a.label", "Text")),
                List.of(target("a.label", "Texte", "")), false);

        assertEquals(MergeAction.UPDATED, plan.entries().get(0).action());
        assertEquals("Text", plan.entries().get(0).sourceSnapshot());
    }

    @Test
    void unchangedEntriesAreOmittedUnlessRequested() {
        List<SourceEntry> sources = List.of(source("a", "A"), source("b", "B2"), source("c", "C"));
        List<TargetEntry> targets = List.of(target("a", "a-fr", "A"), target("b", "b-fr", "B"));

        MergePlan plan = planner.plan(sources, targets, false);

        assertEquals(List.of("b", "c"), plan.entries().stream().map(MergedEntry::key).toList());
        assertEquals(1, plan.statistics().getUnchangedCount());
        assertEquals(1, plan.statistics().getUpdatedCount());
        assertEquals(1, plan.statistics().getAddedCount());
        assertEquals(2, plan.statistics().getEmittedCount());
        assertEquals(3, planner.plan(sources, targets, true).entries().size());
    }

    @Test
    void secondPassOverOwnOutputIsSteady() {
        List<SourceEntry> sources = List.of(source("a", "A2"), source("b", "B"), source("c", "C"));
        List<TargetEntry> targets = List.of(target("a", "a-fr", "A"), target("b", "b-fr", "B"), target("z", "z-fr", "Z"));

        MergePlan first = planner.plan(sources, targets, true);
        List<TargetEntry> written = first.entries().stream().map(MergePlannerTest::persisted).toList();
        MergePlan second = planner.plan(sources, written, true);

        assertEquals(0, second.statistics().getUpdatedCount());
        assertEquals(0, second.statistics().getAddedCount());
        assertTrue(second.statistics().isSteadyState());
        assertEquals(4, second.statistics().getUnchangedCount());
    }

    @Test
    void onePerKeyAcrossBothInputs() {
        List<SourceEntry> sources = List.of(source("a", "A"), source("b", "B"));
        List<TargetEntry> targets = List.of(target("b", "b-fr", "B"), target("c", "c-fr", "C"));

        Map<String, MergedEntry> merged = byKey(planner.plan(sources, targets, true));

        assertEquals(3, merged.size());
        assertEquals(MergeAction.ADDED, merged.get("a").action());
        assertEquals(MergeAction.UNCHANGED, merged.get("b").action());
        assertEquals(MergeAction.UNCHANGED, merged.get("c").action());
    }

    @Test
    void malformedKeysAreRejectedWithDiagnostic() {
        MergePlan plan = planner.plan(List.of(source("", "x"), source("a b", "y"), source("ok", "z")), List.of(), false);

        assertEquals(1, plan.entries().size());
        assertEquals(2, plan.diagnostics().size());
        assertEquals(2, plan.statistics().getRejectedCount());
        assertEquals("a b", plan.diagnostics().get(1).key());
    }

    @Test
    void duplicateKeyAfterNormalizationIsFatal() {
        List<SourceEntry> sources = List.of(source("ThingDef/a.label", "x"), source("a.label", "y"));

        MergeConfigurationException e = assertThrows(MergeConfigurationException.class,
                () -> planner.plan(sources, List.of(), false));
        assertTrue(e.getMessage().contains("a.label"), e.getMessage());
    }

    @Test
    void duplicateTargetKeyIsFatal() {
        assertThrows(MergeConfigurationException.class,
                () -> planner.plan(List.of(), List.of(target("a", "1", ""), target("a", "2", "")), true));
    }

    @Test
    void freshBuildAddsEverySourceEntry() {
        MergePlan plan = planner.freshBuild(List.of(source("b", "B"), source("ThingDef/a", "A"), source("", "bad")));

        assertEquals(List.of("a", "b"), plan.entries().stream().map(MergedEntry::key).toList());
        assertTrue(plan.entries().stream().allMatch(e -> e.action() == MergeAction.ADDED));
        assertEquals(1, plan.statistics().getRejectedCount());
    }

    @Test
    void onlyAddedKeepsFullStatistics() {
        List<SourceEntry> sources = List.of(source("a", "A2"), source("n", "N"));
        List<TargetEntry> targets = List.of(target("a", "a-fr", "A"));

        MergePlan additive = planner.plan(sources, targets, false).onlyAdded();

        assertEquals(List.of("n"), additive.entries().stream().map(MergedEntry::key).toList());
        assertEquals(1, additive.statistics().getUpdatedCount());
        assertEquals(1, additive.statistics().getEmittedCount());
    }

    @Test
    void countsEmptyTranslations() {
        MergePlan plan = planner.plan(List.of(), List.of(target("a", "", "A"), target("b", " ", "B"), target("c", "c", "C")), false);
        assertEquals(2, plan.overlap().emptyTranslations());
    }
}
