package com.e2eq.l10n.config;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.corpus.CorpusFormat;
import com.e2eq.l10n.corpus.CorpusRequest;
import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.imports.ImportRequest;
import com.e2eq.l10n.model.ConflictPolicy;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.StructuralStrategy;
import com.e2eq.l10n.service.ReconciliationRequest;
import com.e2eq.l10n.source.CsvSourceProvider;
import com.e2eq.l10n.source.LanguageTreeSourceProvider;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class L10nConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void appliesDefaults() {
        L10nConfig config = L10nConfigLoader.load(Map.of());

        assertEquals(List.of(Namespace.TYPED, Namespace.FLAT), config.namespaces());
        assertEquals(ConflictPolicy.MERGE, config.conflictPolicy());
        assertEquals(StructuralStrategy.MIRROR_SOURCE, config.structuralStrategy());
        assertEquals(4, config.parallelism());
        assertFalse(config.includeUnchanged());
        assertEquals(L10nConfig.SourceKind.TREE, config.source().kind());
        assertEquals("DefInjected", config.layout().typedDir());
        assertEquals("LanguageData", config.layout().rootElement());
        assertTrue(config.targetRoot().isEmpty());
        assertEquals(L10nConfig.RunMode.MERGE, config.mode());
        assertEquals(List.of(CorpusFormat.TSV, CorpusFormat.CSV), config.corpus().formats());
    }

    @Test
    void buildsRequestFromProperties() {
        L10nConfig config = L10nConfigLoader.load(Map.of(
                "quantum.l10n.target-root", dir.resolve("French").toString(),
                "quantum.l10n.source.root", dir.resolve("English").toString(),
                "quantum.l10n.namespaces", "FLAT",
                "quantum.l10n.conflict-policy", "REBUILD",
                "quantum.l10n.structural-strategy", "GROUP_BY_TYPE",
                "quantum.l10n.history-date", "2024-05-01",
                "quantum.l10n.parallelism", "2"));

        ReconciliationRequest request = L10nConfigLoader.toRequest(config);

        assertEquals(dir.resolve("French"), request.getTargetRoot());
        assertInstanceOf(LanguageTreeSourceProvider.class, request.getSourceProvider());
        assertEquals(List.of(Namespace.FLAT), request.getNamespaces());
        assertEquals(ConflictPolicy.REBUILD, request.getConflictPolicy());
        assertEquals(StructuralStrategy.GROUP_BY_TYPE, request.getStructuralStrategy());
        assertEquals(LocalDate.of(2024, 5, 1), request.getHistoryDate());
        assertEquals(2, request.getParallelism());
        assertNull(request.getReferenceRoot());
    }

    @Test
    void readsPropertiesFile() throws IOException {
        Path file = dir.resolve("l10n.properties");
        Files.writeString(file, "quantum.l10n.target-root=out\nquantum.l10n.source.kind=CSV\nquantum.l10n.source.typed-csv=typed.csv\n");

        ReconciliationRequest request = L10nConfigLoader.toRequest(L10nConfigLoader.load(file));

        assertInstanceOf(CsvSourceProvider.class, request.getSourceProvider());
        assertEquals(Path.of("out"), request.getTargetRoot());
    }

    @Test
    void missingOrInvalidValuesAreConfigurationErrors() {
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.toRequest(L10nConfigLoader.load(Map.of())));
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.load(Map.of("quantum.l10n.conflict-policy", "SOMETIMES")));
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.toRequest(L10nConfigLoader.load(Map.of(
                "quantum.l10n.target-root", "out",
                "quantum.l10n.source.root", "in",
                "quantum.l10n.history-date", "yesterday"))));
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.toRequest(L10nConfigLoader.load(Map.of(
                "quantum.l10n.target-root", "out",
                "quantum.l10n.source.kind", "CSV"))));
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.load(dir.resolve("missing.properties")));
    }

    @Test
    void buildsImportRequest() throws IOException {
        Path flat = Files.writeString(dir.resolve("flat.csv"), "key,translatedText,tag,originFile,sourceSnapshot\n");
        L10nConfig config = L10nConfigLoader.load(Map.of(
                "quantum.l10n.mode", "IMPORT",
                "quantum.l10n.target-root", "French",
                "quantum.l10n.import.flat-csv", flat.toString()));

        ImportRequest request = L10nConfigLoader.toImportRequest(config);

        assertEquals(L10nConfig.RunMode.IMPORT, config.mode());
        assertEquals(Path.of("French"), request.targetRoot());
        assertEquals(Map.of(Namespace.FLAT, flat), request.csvFiles());
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.toImportRequest(L10nConfigLoader.load(Map.of(
                "quantum.l10n.target-root", "French",
                "quantum.l10n.import.typed-csv", dir.resolve("missing.csv").toString()))));
    }

    @Test
    void buildsCorpusRequest() {
        CorpusRequest request = L10nConfigLoader.toCorpusRequest(L10nConfigLoader.load(Map.of(
                "quantum.l10n.target-root", "French",
                "quantum.l10n.namespaces", "TYPED",
                "quantum.l10n.corpus.dir", "corpus",
                "quantum.l10n.corpus.formats", "TSV")));

        assertEquals(Path.of("corpus"), request.outputDir());
        assertEquals(List.of(CorpusFormat.TSV), request.formats());
        assertEquals(List.of(Namespace.TYPED), request.namespaces());
        assertThrows(MergeConfigurationException.class, () -> L10nConfigLoader.toCorpusRequest(L10nConfigLoader.load(Map.of(
                "quantum.l10n.target-root", "French"))));
    }
}
