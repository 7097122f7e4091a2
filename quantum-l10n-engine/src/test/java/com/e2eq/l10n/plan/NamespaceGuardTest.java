package com.e2eq.l10n.plan;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.exceptions.MergeConfigurationException;
import com.e2eq.l10n.model.SourceEntry;

import java.util.List;

import org.junit.jupiter.api.Test;

class NamespaceGuardTest {

    @Test
    void sameKeyWithSameTextIsAllowed() {
        assertDoesNotThrow(() -> NamespaceGuard.checkDisjoint(
                List.of(new SourceEntry("ThingDef/Shared", "Text", "ThingDef.Shared", "a.xml")),
                List.of(new SourceEntry("Shared", "Text", "Keyed", "b.xml"))));
    }

    @Test
    void sameKeyWithDifferentTextIsFatal() {
        MergeConfigurationException e = assertThrows(MergeConfigurationException.class, () -> NamespaceGuard.checkDisjoint(
                List.of(new SourceEntry("Shared", "One", "ThingDef.Shared", "a.xml")),
                List.of(new SourceEntry("Shared", "Two", "Keyed", "b.xml"))));
        assertTrue(e.getMessage().contains("Shared"));
        assertTrue(e.getMessage().contains("One") && e.getMessage().contains("Two"));
    }

    @Test
    void malformedKeysAreLeftToThePlanner() {
        assertDoesNotThrow(() -> NamespaceGuard.checkDisjoint(
                List.of(new SourceEntry("a b", "One", "", "")),
                List.of(new SourceEntry("a b", "Two", "", ""))));
    }
}
