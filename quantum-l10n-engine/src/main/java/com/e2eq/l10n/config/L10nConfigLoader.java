package com.e2eq.l10n.config;

import com.e2eq.l10n.corpus.CorpusRequest;
import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.imports.ImportRequest;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.resource.ResourceLayout;
import com.e2eq.l10n.service.ReconciliationRequest;
import com.e2eq.l10n.source.CsvSourceProvider;
import com.e2eq.l10n.source.LanguageTreeSourceProvider;
import com.e2eq.l10n.source.SourceSnapshotProvider;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads {@link L10nConfig} outside of any container: system properties, environment variables,
 * {@code META-INF/microprofile-config.properties} and an optional properties file.
 */
public final class L10nConfigLoader {

    private static final Logger LOG = Logger.getLogger(L10nConfigLoader.class);

    static final int FILE_ORDINAL = 250;
    static final int OVERRIDE_ORDINAL = 500;

    private L10nConfigLoader() {
    }

    /**
     * @param propertiesFile optional file whose values override the packaged defaults
     */
    public static L10nConfig load(Path propertiesFile) {
        SmallRyeConfigBuilder builder = newBuilder();
        if (propertiesFile != null) {
            if (!Files.isRegularFile(propertiesFile)) {
                throw new MergeConfigurationException("Configuration file " + propertiesFile + " does not exist");
            }
            try {
                builder.withSources(new PropertiesConfigSource(propertiesFile.toUri().toURL(), FILE_ORDINAL));
            } catch (IOException e) {
                throw new MergeConfigurationException("Failed to read configuration file " + propertiesFile, e);
            }
            LOG.debugf("Using configuration file %s", propertiesFile);
        }
        return build(builder);
    }

    /**
     * Loads the configuration with explicit values taking precedence over every other source.
     */
    public static L10nConfig load(Map<String, String> overrides) {
        return build(newBuilder().withSources(new PropertiesConfigSource(overrides, "quantum-l10n-overrides", OVERRIDE_ORDINAL)));
    }

    /**
     * Turns a configuration into a request, resolving paths and the history date.
     *
     * @throws MergeConfigurationException when a required value is missing or malformed
     */
    public static ReconciliationRequest toRequest(L10nConfig config) {
        checkCommon(config);
        ResourceLayout layout = layoutOf(config);
        Path targetRoot = targetRootOf(config);

        return ReconciliationRequest.builder()
                .sourceProvider(sourceProvider(config, layout))
                .targetRoot(targetRoot)
                .layout(layout)
                .namespaces(config.namespaces())
                .conflictPolicy(config.conflictPolicy())
                .structuralStrategy(config.structuralStrategy())
                .referenceRoot(config.referenceRoot().map(Path::of).orElse(null))
                .includeUnchanged(config.includeUnchanged())
                .historyDate(historyDate(config))
                .parallelism(config.parallelism())
                .csvExportDir(config.csvExportDir().map(Path::of).orElse(null))
                .build();
    }

    /**
     * Collects the translated CSV files of an import run.
     *
     * @throws MergeConfigurationException when no file is configured or a configured file is missing
     */
    public static ImportRequest toImportRequest(L10nConfig config) {
        checkCommon(config);
        Map<Namespace, Path> files = new EnumMap<>(Namespace.class);
        config.importing().typedCsv().map(Path::of).ifPresent(p -> files.put(Namespace.TYPED, p));
        config.importing().flatCsv().map(Path::of).ifPresent(p -> files.put(Namespace.FLAT, p));
        if (files.isEmpty()) {
            throw new MergeConfigurationException(
                    "Mode IMPORT needs quantum.l10n.import.typed-csv and/or quantum.l10n.import.flat-csv");
        }
        for (Path file : files.values()) {
            if (!Files.isRegularFile(file)) {
                throw new MergeConfigurationException("Translation file " + file + " does not exist");
            }
        }
        return new ImportRequest(targetRootOf(config), layoutOf(config), files, config.parallelism());
    }

    /**
     * @throws MergeConfigurationException when the output directory or the formats are missing
     */
    public static CorpusRequest toCorpusRequest(L10nConfig config) {
        checkCommon(config);
        Path outputDir = config.corpus().dir().map(Path::of)
                .orElseThrow(() -> new MergeConfigurationException("Mode CORPUS needs quantum.l10n.corpus.dir"));
        if (config.corpus().formats().isEmpty()) {
            throw new MergeConfigurationException("quantum.l10n.corpus.formats must name at least one format");
        }
        return new CorpusRequest(targetRootOf(config), layoutOf(config), config.namespaces(), outputDir,
                config.corpus().formats(), config.parallelism());
    }

    private static void checkCommon(L10nConfig config) {
        if (config.parallelism() < 1) {
            throw new MergeConfigurationException("quantum.l10n.parallelism must be at least 1, got " + config.parallelism());
        }
        if (config.namespaces().isEmpty()) {
            throw new MergeConfigurationException("quantum.l10n.namespaces must name at least one namespace");
        }
    }

    private static ResourceLayout layoutOf(L10nConfig config) {
        try {
            return new ResourceLayout(config.layout().typedDir(), config.layout().flatDir(),
                    config.layout().fileExtension(), config.layout().rootElement());
        } catch (IllegalArgumentException e) {
            throw new MergeConfigurationException("Invalid quantum.l10n.layout: " + e.getMessage(), e);
        }
    }

    private static Path targetRootOf(L10nConfig config) {
        return config.targetRoot().map(Path::of)
                .orElseThrow(() -> new MergeConfigurationException("quantum.l10n.target-root is required"));
    }

    private static SourceSnapshotProvider sourceProvider(L10nConfig config, ResourceLayout layout) {
        L10nConfig.Source source = config.source();
        return switch (source.kind()) {
            case TREE -> new LanguageTreeSourceProvider(source.root().map(Path::of).orElseThrow(
                    () -> new MergeConfigurationException("quantum.l10n.source.root is required for source kind TREE")),
                    layout, config.parallelism());
            case CSV -> {
                Map<Namespace, Path> files = new EnumMap<>(Namespace.class);
                source.typedCsv().map(Path::of).ifPresent(p -> files.put(Namespace.TYPED, p));
                source.flatCsv().map(Path::of).ifPresent(p -> files.put(Namespace.FLAT, p));
                if (files.isEmpty()) {
                    throw new MergeConfigurationException(
                            "Source kind CSV needs quantum.l10n.source.typed-csv and/or quantum.l10n.source.flat-csv");
                }
                yield new CsvSourceProvider(files);
            }
        };
    }

    private static LocalDate historyDate(L10nConfig config) {
        try {
            return config.historyDate().map(LocalDate::parse).orElseGet(LocalDate::now);
        } catch (DateTimeParseException e) {
            throw new MergeConfigurationException("quantum.l10n.history-date must be yyyy-MM-dd, got '"
                    + config.historyDate().orElse("") + "'", e);
        }
    }

    private static SmallRyeConfigBuilder newBuilder() {
        return new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDefaultInterceptors()
                .withMapping(L10nConfig.class);
    }

    private static L10nConfig build(SmallRyeConfigBuilder builder) {
        try {
            SmallRyeConfig config = builder.build();
            return config.getConfigMapping(L10nConfig.class);
        } catch (RuntimeException e) {
            throw new MergeConfigurationException("Invalid quantum.l10n configuration: " + e.getMessage(), e);
        }
    }
}
