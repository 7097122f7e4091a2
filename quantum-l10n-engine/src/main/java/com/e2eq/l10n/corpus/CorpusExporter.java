package com.e2eq.l10n.corpus;

import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.resource.LoadResult;
import com.e2eq.l10n.resource.ResourceLayout;
import com.e2eq.l10n.resource.ResourceParser;
import org.apache.commons.lang3.StringUtils;
import org.jboss.logging.Logger;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a parallel corpus from a reconciled tree: every entry whose recorded source snapshot and
 * translation are both present becomes one (source, translation) pair.
 * <p>
 * Texts are stripped. Pairs where the translation equals the source are left out, and each
 * distinct pair is written once, in tree order.
 */
public class CorpusExporter {

    private static final Logger LOG = Logger.getLogger(CorpusExporter.class);

    private final ResourceParser parser;
    private final ResourceLayout layout;

    public CorpusExporter(ResourceLayout layout, int parallelism) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.parser = new ResourceParser(layout, parallelism);
    }

    public CorpusReport export(CorpusRequest request) throws IOException {
        CorpusReport report = new CorpusReport();
        List<TargetEntry> entries = new ArrayList<>();
        for (Namespace namespace : request.namespaces()) {
            LoadResult tree = parser.load(layout.resolve(request.targetRoot(), namespace));
            entries.addAll(tree.entries());
            report.getErrors().addAll(tree.errors());
        }
        List<CorpusPair> pairs = pairsOf(entries, report);
        report.setPairs(pairs.size());

        for (CorpusFormat format : request.formats()) {
            Path file = request.outputDir().resolve(format.fileName());
            write(file, format, pairs);
            report.getFiles().add(file.toString());
            if (format == CorpusFormat.TSV) {
                report.getProblems().addAll(CorpusChecker.checkTsv(file));
            }
        }
        LOG.infof("Exported %d corpus pairs from %s (%d incomplete, %d identical, %d duplicates skipped)",
                pairs.size(), request.targetRoot(), report.getSkippedIncomplete(), report.getSkippedIdentical(),
                report.getDuplicates());
        for (String problem : report.getProblems()) {
            LOG.warnf("Corpus format problem: %s", problem);
        }
        return report;
    }

    /**
     * Turns entries into distinct pairs, counting what was skipped into the report.
     */
    static List<CorpusPair> pairsOf(Collection<TargetEntry> entries, CorpusReport report) {
        Set<CorpusPair> pairs = new LinkedHashSet<>();
        for (TargetEntry entry : entries) {
            String source = StringUtils.strip(entry.sourceSnapshot());
            String translation = StringUtils.strip(entry.translatedText());
            if (source.isEmpty() || translation.isEmpty()) {
                report.setSkippedIncomplete(report.getSkippedIncomplete() + 1);
            } else if (source.equals(translation)) {
                report.setSkippedIdentical(report.getSkippedIdentical() + 1);
            } else if (!pairs.add(new CorpusPair(source, translation))) {
                report.setDuplicates(report.getDuplicates() + 1);
            }
        }
        return new ArrayList<>(pairs);
    }

    static void write(Path file, CorpusFormat format, Collection<CorpusPair> pairs) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (ICsvListWriter writer = new CsvListWriter(Files.newBufferedWriter(file, StandardCharsets.UTF_8),
                format.preference())) {
            for (CorpusPair pair : pairs) {
                writer.write(pair.source(), pair.translation());
            }
        }
        LOG.debugf("Wrote %d pairs to %s", pairs.size(), file);
    }
}
