package com.e2eq.l10n.app;

import com.e2eq.l10n.config.L10nConfig;
import com.e2eq.l10n.corpus.CorpusExporter;
import com.e2eq.l10n.corpus.CorpusReport;
import com.e2eq.l10n.corpus.CorpusRequest;
import com.e2eq.l10n.config.L10nConfigLoader;
import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.imports.ImportReport;
import com.e2eq.l10n.imports.ImportRequest;
import com.e2eq.l10n.imports.NamespaceImport;
import com.e2eq.l10n.imports.TranslationImporter;
import com.e2eq.l10n.service.NamespaceOutcome;
import com.e2eq.l10n.service.ReconciliationReport;
import com.e2eq.l10n.service.ReconciliationService;
import com.e2eq.l10n.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Command line entry point. The only optional argument is a properties file with
 * {@code quantum.l10n.*} settings; {@code quantum.l10n.mode} selects a merge, an import of
 * translated CSV files or a parallel corpus export.
 * <p>
 * Exit status: 0 on success, 1 when any file could not be read or written, 2 on a configuration error.
 */
public final class L10nMergeApplication {

    private static final Logger LOG = Logger.getLogger(L10nMergeApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_CONFIGURATION = 2;

    private L10nMergeApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        if (args.length > 1) {
            LOG.error("Usage: L10nMergeApplication [config.properties]");
            return EXIT_CONFIGURATION;
        }
        try {
            L10nConfig config = L10nConfigLoader.load(args.length == 1 ? Path.of(args[0]) : null);
            return switch (config.mode()) {
                case MERGE -> merge(config);
                case IMPORT -> importTranslations(config);
                case CORPUS -> exportCorpus(config);
            };
        } catch (MergeConfigurationException e) {
            LOG.errorf("Configuration error: %s", e.getMessage());
            return EXIT_CONFIGURATION;
        } catch (IOException | UncheckedIOException e) {
            ExceptionLoggingUtils.logError(LOG, e, "Run failed");
            return EXIT_ERRORS;
        }
    }

    private static int merge(L10nConfig config) throws IOException {
        ReconciliationReport report = new ReconciliationService().run(L10nConfigLoader.toRequest(config));
        logSummary(report);
        writeReport(config, report);
        return report.isSuccessful() ? EXIT_OK : EXIT_ERRORS;
    }

    private static int importTranslations(L10nConfig config) throws IOException {
        ImportRequest request = L10nConfigLoader.toImportRequest(config);
        ImportReport report = new TranslationImporter(request.layout(), request.parallelism())
                .importAll(request.targetRoot(), request.csvFiles());
        for (NamespaceImport outcome : report.getOutcomes()) {
            LOG.infof("%-5s applied=%d rejected=%d written=%d untouched=%d", outcome.getNamespace(),
                    outcome.getApplied(), outcome.getRejected().size(), outcome.getFilesWritten(), outcome.getFilesUntouched());
        }
        LOG.infof("%d error(s)", report.getFailureCount());
        writeReport(config, report);
        return report.isSuccessful() ? EXIT_OK : EXIT_ERRORS;
    }

    private static int exportCorpus(L10nConfig config) throws IOException {
        CorpusRequest request = L10nConfigLoader.toCorpusRequest(config);
        CorpusReport report = new CorpusExporter(request.layout(), request.parallelism()).export(request);
        LOG.infof("%d pairs, %d format problem(s), %d error(s)", report.getPairs(), report.getProblems().size(),
                report.getFailureCount());
        writeReport(config, report);
        return report.isSuccessful() ? EXIT_OK : EXIT_ERRORS;
    }

    private static void writeReport(L10nConfig config, Object report) throws IOException {
        if (config.reportFile().isPresent()) {
            Path reportFile = Path.of(config.reportFile().get());
            ReportWriter.write(report, reportFile);
            LOG.infof("Report written to %s", reportFile);
        }
    }

    private static void logSummary(ReconciliationReport report) {
        for (NamespaceOutcome outcome : report.getOutcomes()) {
            if (outcome.getStatistics() == null) {
                continue;
            }
            LOG.infof("%-5s %-11s unchanged=%d updated=%d added=%d rejected=%d written=%d untouched=%d",
                    outcome.getNamespace(), outcome.getMode(),
                    outcome.getStatistics().getUnchangedCount(), outcome.getStatistics().getUpdatedCount(),
                    outcome.getStatistics().getAddedCount(), outcome.getStatistics().getRejectedCount(),
                    outcome.getFilesWritten(), outcome.getFilesUntouched());
        }
        LOG.infof("%d error(s)", report.getFailureCount());
    }
}
