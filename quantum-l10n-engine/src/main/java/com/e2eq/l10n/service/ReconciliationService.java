package com.e2eq.l10n.service;

import com.e2eq.l10n.classify.DirectoryClassifier;
import com.e2eq.l10n.classify.OperationModeResolver;
import com.e2eq.l10n.csv.CsvExchange;
import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.MergedEntry;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.OperationMode;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.StructuralStrategy;
import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.model.TreePresence;
import com.e2eq.l10n.plan.MergePlan;
import com.e2eq.l10n.plan.MergePlanner;
import com.e2eq.l10n.plan.NamespaceGuard;
import com.e2eq.l10n.resource.LoadResult;
import com.e2eq.l10n.resource.ResourceLayout;
import com.e2eq.l10n.resource.ResourceParser;
import com.e2eq.l10n.resource.ResourceSerializer;
import com.e2eq.l10n.resource.WriteResult;
import com.e2eq.l10n.route.EntryPlacement;
import com.e2eq.l10n.route.MirrorReferenceRouter;
import com.e2eq.l10n.route.StructuralRouter;
import com.e2eq.l10n.source.SourceSnapshot;
import com.e2eq.l10n.source.SourceSnapshotProvider;
import com.e2eq.l10n.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs a reconciliation: every namespace is planned before the first file is written, so a
 * configuration problem found in any namespace leaves the whole target tree untouched.
 */
public class ReconciliationService {

    private static final Logger LOG = Logger.getLogger(ReconciliationService.class);

    /**
     * @throws MergeConfigurationException when the request or the inputs are inconsistent; nothing has been written
     * @throws IOException                 when a source or target tree cannot be scanned
     */
    public ReconciliationReport run(ReconciliationRequest request) throws IOException {
        validate(request);
        ResourceLayout layout = request.getLayout();
        Set<Namespace> namespaces = new LinkedHashSet<>(request.getNamespaces());
        SourceSnapshotProvider provider = request.getSourceProvider();
        LOG.infof("Reconciling %s into %s (policy %s, strategy %s, namespaces %s)", provider.getId(),
                request.getTargetRoot(), request.getConflictPolicy(), request.getStructuralStrategy(), namespaces);

        ReconciliationReport report = new ReconciliationReport();
        report.setHistoryDate(request.getHistoryDate().toString());

        // plan phase, no writes
        Map<Namespace, SourceSnapshot> snapshots = new EnumMap<>(Namespace.class);
        Map<Namespace, TreePresence> sourcePresence = new EnumMap<>(Namespace.class);
        for (Namespace namespace : namespaces) {
            TreePresence presence = provider.presence(namespace);
            sourcePresence.put(namespace, presence);
            SourceSnapshot snapshot = presence == TreePresence.PRESENT
                    ? provider.load(namespace)
                    : SourceSnapshot.of(List.of());
            snapshots.put(namespace, snapshot);
            report.getErrors().addAll(snapshot.errors());
        }
        if (namespaces.contains(Namespace.TYPED) && namespaces.contains(Namespace.FLAT)) {
            NamespaceGuard.checkDisjoint(snapshots.get(Namespace.TYPED).entries(), snapshots.get(Namespace.FLAT).entries());
        }

        DirectoryClassifier classifier = new DirectoryClassifier(layout);
        ResourceParser parser = new ResourceParser(layout, request.getParallelism());
        MergePlanner planner = new MergePlanner(request.getHistoryDate());
        List<PlannedNamespace> planned = new ArrayList<>();
        for (Namespace namespace : namespaces) {
            Path namespaceRoot = layout.resolve(request.getTargetRoot(), namespace);
            OperationMode mode = OperationModeResolver.resolve(sourcePresence.get(namespace),
                    classifier.classify(namespaceRoot), request.getConflictPolicy());
            StructuralRouter router = StructuralRouter.create(request.getStructuralStrategy(),
                    referenceIndex(request, parser, namespace), layout);
            List<SourceEntry> sources = snapshots.get(namespace).entries();
            MergePlan plan = switch (mode) {
                case SKIP -> {
                    LOG.warnf("No %s source entries were extracted, skipping %s", namespace, namespaceRoot);
                    yield MergePlan.empty();
                }
                case FIRST_BUILD, REBUILD -> planner.freshBuild(sources);
                case RECONCILE -> planner.plan(sources, loadTargets(parser, namespaceRoot, report), request.isIncludeUnchanged());
                case ADDITIVE -> planner.plan(sources, loadTargets(parser, namespaceRoot, report), false).onlyAdded();
            };
            LOG.infof("%s: %s", namespace, mode);
            planned.add(new PlannedNamespace(namespace, namespaceRoot, mode, router, plan,
                    snapshots.get(namespace).rejected()));
        }

        // write phase
        ResourceSerializer serializer = new ResourceSerializer(layout, request.getParallelism());
        for (PlannedNamespace p : planned) {
            report.getOutcomes().add(write(request, serializer, p, report.getErrors()));
        }

        if (report.isSuccessful()) {
            LOG.infof("Reconciliation finished for %d namespace(s)", planned.size());
        } else {
            for (ResourceError error : report.getErrors()) {
                LOG.warnf("%s error in %s: %s", error.kind(), error.path(), error.reason());
            }
            LOG.warnf("Reconciliation finished with %d error(s)", report.getFailureCount());
        }
        return report;
    }

    private NamespaceOutcome write(ReconciliationRequest request, ResourceSerializer serializer, PlannedNamespace p,
                                   List<ResourceError> errors) {
        NamespaceOutcome.NamespaceOutcomeBuilder outcome = NamespaceOutcome.builder()
                .namespace(p.namespace())
                .mode(p.mode())
                .statistics(p.plan().statistics())
                .overlap(p.plan().overlap());
        List<KeyDiagnostic> diagnostics = new ArrayList<>(p.sourceRejected());
        diagnostics.addAll(p.plan().diagnostics());
        outcome.diagnostics(diagnostics);
        if (p.mode() == OperationMode.SKIP) {
            return outcome.build();
        }

        if (p.mode() == OperationMode.REBUILD) {
            try {
                serializer.clear(p.root());
            } catch (IOException e) {
                ExceptionLoggingUtils.logError(LOG, e, "Failed to clear %s before rebuilding", p.root());
                errors.add(ResourceError.serialization(p.root().toString(), "could not clear before rebuild: " + e.getMessage()));
                return outcome.build();
            }
        }

        Map<String, List<MergedEntry>> placed = EntryPlacement.place(p.plan().entries(), p.router(), p.mode());
        WriteResult result = serializer.write(p.root(), placed, p.mode().isFresh());
        errors.addAll(result.errors());
        outcome.filesWritten(result.filesWritten()).filesUntouched(result.filesUntouched());
        if (p.router() instanceof MirrorReferenceRouter reference) {
            outcome.routerFallbacks(reference.getMissCount());
        }

        if (request.getCsvExportDir() != null) {
            Path csv = request.getCsvExportDir().resolve(p.namespace().name().toLowerCase(Locale.ROOT) + "-merged.csv");
            try {
                CsvExchange.writeMerged(csv, placed.values().stream().flatMap(List::stream)
                        .sorted(Comparator.comparing(MergedEntry::key)).toList());
                outcome.csvExport(csv.toString());
            } catch (IOException e) {
                ExceptionLoggingUtils.logError(LOG, e, "Failed to export %s", csv);
                errors.add(ResourceError.serialization(csv.toString(), e.getMessage()));
            }
        }
        return outcome.build();
    }

    private static List<TargetEntry> loadTargets(ResourceParser parser, Path namespaceRoot,
                                                                    ReconciliationReport report) throws IOException {
        LoadResult targets = parser.load(namespaceRoot);
        report.getErrors().addAll(targets.errors());
        return targets.entries();
    }

    private static Map<String, String> referenceIndex(ReconciliationRequest request, ResourceParser parser,
                                                      Namespace namespace) throws IOException {
        if (request.getStructuralStrategy() != StructuralStrategy.MIRROR_REFERENCE || request.getReferenceRoot() == null) {
            return null;
        }
        LoadResult reference = parser.load(request.getLayout().resolve(request.getReferenceRoot(), namespace));
        for (ResourceError error : reference.errors()) {
            LOG.warnf("Reference file %s could not be read: %s", error.path(), error.reason());
        }
        return reference.keyIndex();
    }

    static void validate(ReconciliationRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.getSourceProvider() == null) {
            throw new MergeConfigurationException("No source provider configured");
        }
        if (request.getTargetRoot() == null) {
            throw new MergeConfigurationException("No target root configured");
        }
        if (request.getNamespaces() == null || request.getNamespaces().isEmpty()) {
            throw new MergeConfigurationException("At least one namespace must be selected");
        }
        if (request.getParallelism() < 1) {
            throw new MergeConfigurationException("Parallelism must be at least 1, got " + request.getParallelism());
        }
        if (request.getLayout() == null || request.getConflictPolicy() == null
                || request.getStructuralStrategy() == null || request.getHistoryDate() == null) {
            throw new MergeConfigurationException("Layout, conflict policy, structural strategy and history date must be set");
        }
    }

    private record PlannedNamespace(Namespace namespace,
                                    Path root,
                                    OperationMode mode,
                                    StructuralRouter router,
                                    MergePlan plan,
                                    List<KeyDiagnostic> sourceRejected) {
    }
}
