package com.e2eq.l10n.corpus;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.TargetEntry;
import com.e2eq.l10n.resource.ResourceLayout;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusExporterTest {

    private static final String DECLARATION = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n";

    @TempDir
    Path dir;

    private void write(String relative, String body) throws IOException {
        Path file = dir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, DECLARATION + body);
    }

    private static TargetEntry entry(String text, String snapshot) {
        return new TargetEntry("k", text, "", "a.xml", snapshot, null);
    }

    @Test
    void pairsAreStrippedAndDistinct() {
        CorpusReport report = new CorpusReport();

        List<CorpusPair> pairs = CorpusExporter.pairsOf(List.of(
                entry(" Bonjour ", "Hello"),
                entry("Bonjour", " Hello\n"),
                entry("", "Hello"),
                entry("Rien", ""),
                entry("OK", "OK"),
                entry("Au revoir", "Goodbye")), report);

        assertEquals(List.of(new CorpusPair("Hello", "Bonjour"), new CorpusPair("Goodbye", "Au revoir")), pairs);
        assertEquals(2, report.getSkippedIncomplete());
        assertEquals(1, report.getSkippedIdentical());
        assertEquals(1, report.getDuplicates());
    }

    @Test
    void writesOneFilePerFormat() throws IOException {
        write("French/Keyed/A.xml", "<LanguageData>\n"
                + "  <!-- EN: Hello -->\n  <Hello>Bonjour</Hello>\n"
                + "  <NoSnapshot>Rien</NoSnapshot>\n"
                + "  <!-- EN: OK -->\n  <Same>OK</Same>\n"
                + "  <!-- EN: Fire, then run -->\n  <Fire>Feu, puis courir</Fire>\n"
                + "</LanguageData>\n");
        write("French/Keyed/B.xml", "<LanguageData>\n  <!-- EN: Hello -->\n  <Greeting>Bonjour</Greeting>\n</LanguageData>\n");
        Path out = dir.resolve("out");

        CorpusReport report = new CorpusExporter(ResourceLayout.defaults(), 2).export(new CorpusRequest(
                dir.resolve("French"), ResourceLayout.defaults(), List.of(Namespace.FLAT), out,
                List.of(CorpusFormat.TSV, CorpusFormat.CSV), 2));

        assertTrue(report.isSuccessful());
        assertEquals(2, report.getPairs());
        assertEquals(1, report.getSkippedIncomplete());
        assertEquals(1, report.getSkippedIdentical());
        assertEquals(1, report.getDuplicates());
        assertTrue(report.getProblems().isEmpty(), report.getProblems().toString());
        assertEquals(2, report.getFiles().size());
        assertEquals("Hello\tBonjour\nFire, then run\tFeu, puis courir\n",
                Files.readString(out.resolve("parallel-corpus.tsv")));
        assertEquals("Hello,Bonjour\r\n\"Fire, then run\",\"Feu, puis courir\"\r\n",
                Files.readString(out.resolve("parallel-corpus.csv")));
    }
}
