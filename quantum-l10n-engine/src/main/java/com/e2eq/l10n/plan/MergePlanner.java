package com.e2eq.l10n.plan;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.KeyOverlapReport;
import com.e2eq.l10n.model.MergeAction;
import com.e2eq.l10n.model.MergeStatistics;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.TargetEntry;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Decides, for every key of a namespace, whether the existing translation is still current, needs
 * review because its source text changed, or is missing altogether.
 * <p>
 * Change detection compares the new source text with the snapshot recorded next to the
 * translation, never with the translation itself. Translations are never replaced or removed
 * here: an updated entry keeps its human translation, gets its snapshot refreshed and a history
 * note describing the change. Both namespaces go through the same planner.
 */
public final class MergePlanner {

    private static final Logger LOG = Logger.getLogger(MergePlanner.class);

    private final HistoryNotes historyNotes;

    /**
     * @param historyDate date stamped into the history notes written by this planner
     */
    public MergePlanner(LocalDate historyDate) {
        this.historyNotes = new HistoryNotes(historyDate);
    }

    /**
     * Reconciles a source snapshot against the existing target entries.
     *
     * @param sources          current source-language entries
     * @param targets          entries loaded from the target tree
     * @param includeUnchanged whether unchanged entries are part of the returned list
     * @throws MergeConfigurationException when a key occurs twice within the sources or within the targets
     */
    public MergePlan plan(Collection<SourceEntry> sources, Collection<TargetEntry> targets, boolean includeUnchanged) {
        Objects.requireNonNull(sources, "sources");
        Objects.requireNonNull(targets, "targets");

        MergeStatistics stats = new MergeStatistics();
        List<KeyDiagnostic> diagnostics = new ArrayList<>();
        Map<String, SourceEntry> sourceMap = index(sources, "source", SourceEntry::key, SourceEntry::originFile,
                SourceEntry::withKey, diagnostics, stats);
        Map<String, TargetEntry> targetMap = index(targets, "target", TargetEntry::key, TargetEntry::originFile,
                TargetEntry::withKey, diagnostics, stats);
        stats.setSourceCount(sourceMap.size());
        stats.setTargetCount(targetMap.size());

        Set<String> keys = new TreeSet<>(sourceMap.keySet());
        keys.addAll(targetMap.keySet());

        List<MergedEntry> merged = new ArrayList<>();
        int shared = 0;
        int sourceOnly = 0;
        int targetOnly = 0;
        for (String key : keys) {
            SourceEntry source = sourceMap.get(key);
            TargetEntry target = targetMap.get(key);
            MergedEntry entry;
            if (source != null && target != null) {
                shared++;
                entry = reconcile(source, target);
            } else if (source != null) {
                sourceOnly++;
                entry = add(source);
            } else {
                targetOnly++;
                entry = MergedEntry.unchanged(target);
            }
            stats.count(entry.action());
            LOG.debugf("%s -> %s", key, entry.action());
            if (entry.action() == MergeAction.UNCHANGED && !includeUnchanged) {
                continue;
            }
            merged.add(entry);
            stats.emit();
        }

        int emptyTranslations = (int) targetMap.values().stream()
                .filter(t -> StringUtils.isBlank(t.translatedText()))
                .count();
        KeyOverlapReport overlap = new KeyOverlapReport(shared, sourceOnly, targetOnly, emptyTranslations);
        LOG.infof("Merge plan: %d source, %d target -> %d unchanged, %d updated, %d added, %d rejected (%d emitted, includeUnchanged=%s)",
                stats.getSourceCount(), stats.getTargetCount(), stats.getUnchangedCount(), stats.getUpdatedCount(),
                stats.getAddedCount(), stats.getRejectedCount(), stats.getEmittedCount(), includeUnchanged);
        if (targetOnly > 0) {
            LOG.infof("%d target key(s) no longer present in the source snapshot are kept until a rebuild", targetOnly);
        }
        return new MergePlan(merged, stats, diagnostics, overlap);
    }

    /**
     * Turns every source entry into an added entry without consulting any target. Used when there is
     * no target tree yet, or when it is being rebuilt.
     */
    public MergePlan freshBuild(Collection<SourceEntry> sources) {
        Objects.requireNonNull(sources, "sources");
        MergeStatistics stats = new MergeStatistics();
        List<KeyDiagnostic> diagnostics = new ArrayList<>();
        Map<String, SourceEntry> sourceMap = index(sources, "source", SourceEntry::key, SourceEntry::originFile,
                SourceEntry::withKey, diagnostics, stats);
        stats.setSourceCount(sourceMap.size());

        List<MergedEntry> merged = new ArrayList<>(sourceMap.size());
        for (String key : new TreeSet<>(sourceMap.keySet())) {
            MergedEntry entry = add(sourceMap.get(key));
            stats.count(entry.action());
            merged.add(entry);
            stats.emit();
        }
        LOG.infof("Fresh build plan: %d entries, %d rejected", stats.getAddedCount(), stats.getRejectedCount());
        return new MergePlan(merged, stats, diagnostics,
                new KeyOverlapReport(0, sourceMap.size(), 0, 0));
    }

    private MergedEntry reconcile(SourceEntry source, TargetEntry target) {
        if (Objects.equals(source.text(), target.sourceSnapshot())) {
            return MergedEntry.unchanged(target);
        }
        String note = historyNotes.updated(target.translatedText(), target.sourceSnapshot(), source.text());
        return new MergedEntry(target.key(), target.translatedText(), target.tag(), target.originFile(),
                source.text(), note, MergeAction.UPDATED);
    }

    private MergedEntry add(SourceEntry source) {
        return new MergedEntry(source.key(), source.text(), source.tag(), source.originFile(),
                source.text(), historyNotes.added(source.text()), MergeAction.ADDED);
    }

    /**
     * Normalizes keys, drops malformed entries with a diagnostic and fails on duplicates.
     */
    private static <T> Map<String, T> index(Collection<T> items,
                                            String inputName,
                                            Function<T, String> keyOf,
                                            Function<T, String> fileOf,
                                            KeyRewriter<T> rewriter,
                                            List<KeyDiagnostic> diagnostics,
                                            MergeStatistics stats) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T item : items) {
            String rawKey = keyOf.apply(item);
            KeyValidator.KeyCheck check = KeyValidator.check(rawKey);
            if (!check.isValid()) {
                LOG.warnf("Rejected %s entry '%s' from %s: %s", inputName, rawKey, fileOf.apply(item), check.problem());
                diagnostics.add(new KeyDiagnostic(rawKey, fileOf.apply(item), check.problem()));
                stats.reject();
                continue;
            }
            T normalized = check.key().equals(rawKey) ? item : rewriter.withKey(item, check.key());
            T first = map.putIfAbsent(check.key(), normalized);
            if (first != null) {
                throw new MergeConfigurationException(String.format(
                        "Duplicate key '%s' in %s input (first seen in '%s', again in '%s')",
                        check.key(), inputName, fileOf.apply(first), fileOf.apply(item)));
            }
        }
        return map;
    }

    @FunctionalInterface
    private interface KeyRewriter<T> {
        T withKey(T item, String key);
    }
}
