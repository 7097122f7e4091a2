package com.e2eq.l10n.config;

import com.e2eq.l10n.corpus.CorpusFormat;
import com.e2eq.l10n.model.ConflictPolicy;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.StructuralStrategy;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Optional;

/**
 * Maps {@code quantum.l10n.*} properties to the options of a reconciliation run.
 */
@ConfigMapping(prefix = "quantum.l10n")
public interface L10nConfig {

    /**
     * What a run does: reconcile the tree, import translated CSV files, or export a parallel corpus.
     * @return the run mode
     */
    @WithDefault("MERGE")
    RunMode mode();

    /**
     * Target language root, e.g. {@code Languages/French}.
     * @return the target root
     */
    Optional<String> targetRoot();

    /**
     * Source-language tree used by the mirror-reference strategy.
     * @return the reference root
     */
    Optional<String> referenceRoot();

    @WithDefault("TYPED,FLAT")
    List<Namespace> namespaces();

    @WithDefault("MERGE")
    ConflictPolicy conflictPolicy();

    @WithDefault("MIRROR_SOURCE")
    StructuralStrategy structuralStrategy();

    @WithDefault("false")
    boolean includeUnchanged();

    /**
     * Date written into history notes, {@code yyyy-MM-dd}; today when not set.
     * @return the history date
     */
    Optional<String> historyDate();

    @WithDefault("4")
    int parallelism();

    Optional<String> csvExportDir();

    /**
     * File receiving the JSON run report.
     * @return the report file
     */
    Optional<String> reportFile();

    Source source();

    Layout layout();

    @WithName("import")
    Import importing();

    Corpus corpus();

    enum RunMode {
        MERGE,
        IMPORT,
        CORPUS
    }

    enum SourceKind {
        TREE,
        CSV
    }

    interface Source {
        @WithDefault("TREE")
        SourceKind kind();

        /**
         * Source-language root read when the kind is {@code TREE}.
         * @return the source root
         */
        Optional<String> root();

        Optional<String> typedCsv();

        Optional<String> flatCsv();
    }

    interface Import {
        Optional<String> typedCsv();

        Optional<String> flatCsv();
    }

    interface Corpus {
        /**
         * Directory receiving one {@code parallel-corpus.*} file per format.
         * @return the output directory
         */
        Optional<String> dir();

        @WithDefault("TSV,CSV")
        List<CorpusFormat> formats();
    }

    interface Layout {
        @WithDefault("DefInjected")
        String typedDir();

        @WithDefault("Keyed")
        String flatDir();

        @WithDefault("xml")
        String fileExtension();

        @WithDefault("LanguageData")
        String rootElement();
    }
}
