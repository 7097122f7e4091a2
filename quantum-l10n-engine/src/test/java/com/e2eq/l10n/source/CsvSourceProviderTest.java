package com.e2eq.l10n.source;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.SourceEntry;
import com.e2eq.l10n.model.TreePresence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvSourceProviderTest {

    @TempDir
    Path dir;

    @Test
    void readsExtractionRows() throws IOException {
        Path typed = dir.resolve("typed.csv");
        Files.writeString(typed, "key,text,tag,file\nThingDef/Nymph.label,Chatty Nymph,ThingDef.label,ThingDef/Nymphs.xml\nbroken,row\n");
        CsvSourceProvider provider = new CsvSourceProvider(Map.of(Namespace.TYPED, typed));

        SourceSnapshot snapshot = provider.load(Namespace.TYPED);

        assertEquals(TreePresence.PRESENT, provider.presence(Namespace.TYPED));
        assertEquals(new SourceEntry("ThingDef/Nymph.label", "Chatty Nymph", "ThingDef.label", "ThingDef/Nymphs.xml"),
                snapshot.entries().get(0));
        assertEquals(1, snapshot.rejected().size());
    }

    @Test
    void headerOnlyOrMissingFileIsAbsent() throws IOException {
        Path flat = dir.resolve("flat.csv");
        Files.writeString(flat, "key,text,tag,file\n");
        CsvSourceProvider provider = new CsvSourceProvider(Map.of(Namespace.FLAT, flat));

        assertEquals(TreePresence.ABSENT, provider.presence(Namespace.FLAT));
        assertEquals(TreePresence.ABSENT, provider.presence(Namespace.TYPED));
        assertTrue(provider.load(Namespace.TYPED).entries().isEmpty());
    }
}
