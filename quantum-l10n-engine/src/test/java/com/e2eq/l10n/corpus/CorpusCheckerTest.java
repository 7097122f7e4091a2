package com.e2eq.l10n.corpus;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CorpusCheckerTest {

    @TempDir
    Path dir;

    @Test
    void wellFormedFileHasNoProblems() throws IOException {
        Path file = Files.writeString(dir.resolve("ok.tsv"), "Hello\tBonjour\n\"Tab\there\"\tTabulation\n", StandardCharsets.UTF_8);

        assertTrue(CorpusChecker.checkTsv(file).isEmpty());
    }

    @Test
    void reportsEachBadLine() throws IOException {
        Path file = Files.writeString(dir.resolve("bad.tsv"),
                "a\tb\n\nc\n d\t \ne\u3000\tf\n", StandardCharsets.UTF_8);

        assertEquals(List.of(
                "line 2 is empty",
                "line 3 has 1 columns, expected 2",
                "line 4 has an empty cell",
                "line 5 contains an ideographic or zero-width space"), CorpusChecker.checkTsv(file));
    }

    @Test
    void brokenQuotingIsAnError() throws IOException {
        Path file = Files.writeString(dir.resolve("quote.tsv"), "\"never closed\tx\n", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> CorpusChecker.checkTsv(file));
    }
}
