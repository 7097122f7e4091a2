package com.e2eq.l10n.imports;

import com.e2eq.l10n.csv.CsvExchange;
import com.e2eq.l10n.model.KeyDiagnostic;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.plan.KeyValidator;
import com.e2eq.l10n.resource.LoadResult;
import com.e2eq.l10n.resource.ResourceDocument;
import com.e2eq.l10n.resource.ResourceLayout;
import com.e2eq.l10n.resource.ResourceParser;
import com.e2eq.l10n.resource.WriteResult;
import com.e2eq.l10n.util.AtomicFiles;
import com.e2eq.l10n.util.WorkerPool;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Writes translated text from an external workflow back into an existing tree. Only element text
 * changes; annotations stay as they are and keys missing from the tree are never created.
 */
public class TranslationImporter {

    private static final Logger LOG = Logger.getLogger(TranslationImporter.class);

    private final ResourceLayout layout;
    private final ResourceParser parser;
    private final int parallelism;

    public TranslationImporter(ResourceLayout layout, int parallelism) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.parser = new ResourceParser(layout, parallelism);
        this.parallelism = parallelism;
    }

    /**
     * Reads each namespace's translated CSV and applies it to that namespace's tree.
     *
     * @throws IOException when a CSV file cannot be read
     */
    public ImportReport importAll(Path targetRoot, Map<Namespace, Path> csvFiles) throws IOException {
        ImportReport report = new ImportReport();
        for (Map.Entry<Namespace, Path> entry : new TreeMap<>(csvFiles).entrySet()) {
            Path csv = entry.getValue();
            CsvExchange.Rows<TargetEntry> rows = CsvExchange.readTranslations(csv);
            ImportResult result = apply(layout.resolve(targetRoot, entry.getKey()), rows.rows());

            List<KeyDiagnostic> rejected = new ArrayList<>(rows.rejected());
            rejected.addAll(result.rejected());
            report.getOutcomes().add(NamespaceImport.builder()
                    .namespace(entry.getKey())
                    .csvFile(csv.toString())
                    .applied(result.applied())
                    .rejected(rejected)
                    .filesWritten(result.writes().filesWritten())
                    .filesUntouched(result.writes().filesUntouched())
                    .build());
            report.getErrors().addAll(result.errors());
        }
        return report;
    }

    public ImportResult apply(Path namespaceRoot, Collection<TargetEntry> translations) throws IOException {
        LoadResult tree = parser.load(namespaceRoot);
        Map<String, String> keyIndex = tree.keyIndex();

        List<KeyDiagnostic> rejected = new ArrayList<>();
        Map<String, Map<String, String>> byFile = new TreeMap<>();
        int applied = 0;
        for (TargetEntry row : translations) {
            KeyValidator.KeyCheck check = KeyValidator.check(row.key());
            if (!check.isValid()) {
                rejected.add(new KeyDiagnostic(row.key(), row.originFile(), check.problem()));
                continue;
            }
            String file = keyIndex.get(check.key());
            if (file == null) {
                LOG.warnf("Not importing '%s': key is not in %s", check.key(), namespaceRoot);
                rejected.add(new KeyDiagnostic(check.key(), row.originFile(), "key not found in target tree"));
                continue;
            }
            if (!row.originFile().isEmpty() && !row.originFile().equals(file)) {
                LOG.debugf("'%s' lives in %s, not %s as the row says", check.key(), file, row.originFile());
            }
            byFile.computeIfAbsent(file, f -> new TreeMap<>()).put(check.key(), row.translatedText());
            applied++;
        }

        List<Map.Entry<String, Map<String, String>>> groups = new ArrayList<>(byFile.entrySet());
        List<FileOutcome> outcomes = WorkerPool.map(groups, parallelism, "l10n-import",
                group -> importFile(namespaceRoot, group.getKey(), group.getValue()));

        int written = 0;
        int untouched = 0;
        List<ResourceError> writeErrors = new ArrayList<>();
        for (FileOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                writeErrors.add(outcome.error());
            } else if (outcome.written()) {
                written++;
            } else {
                untouched++;
            }
        }
        List<ResourceError> errors = new ArrayList<>(tree.errors());
        errors.addAll(writeErrors);
        LOG.infof("Imported %d translations into %s: %d files written, %d unchanged, %d rows rejected",
                applied, namespaceRoot, written, untouched, rejected.size());
        return new ImportResult(applied, rejected, new WriteResult(written, untouched, writeErrors), errors);
    }

    private static FileOutcome importFile(Path namespaceRoot, String relativePath, Map<String, String> texts) {
        Path file = namespaceRoot.resolve(relativePath);
        try {
            ResourceDocument document = ResourceDocument.load(file);
            texts.forEach(document::setText);
            if (!document.isModified()) {
                return new FileOutcome(false, null);
            }
            AtomicFiles.writeString(file, document.toXml());
            return new FileOutcome(true, null);
        } catch (IOException e) {
            LOG.warnf("Failed to import into %s: %s", relativePath, e.getMessage());
            return new FileOutcome(false, ResourceError.serialization(relativePath, e.getMessage()));
        }
    }

    private record FileOutcome(boolean written, ResourceError error) {
    }
}
