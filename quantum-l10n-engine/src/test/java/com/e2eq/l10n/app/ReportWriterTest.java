package com.e2eq.l10n.app;

import static org.junit.jupiter.api.Assertions.*;

import com.e2eq.l10n.model.MergeStatistics;
import com.e2eq.l10n.model.Namespace;
import com.e2eq.l10n.model.OperationMode;
import com.e2eq.l10n.model.ResourceError;
import com.e2eq.l10n.service.NamespaceOutcome;
import com.e2eq.l10n.service.ReconciliationReport;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

import org.junit.jupiter.api.Test;

class ReportWriterTest {

    @Test
    void serializesOutcomesAndErrors() throws IOException {
        ReconciliationReport report = new ReconciliationReport();
        MergeStatistics stats = new MergeStatistics();
        stats.setAddedCount(3);
        report.getOutcomes().add(NamespaceOutcome.builder()
                .namespace(Namespace.TYPED)
                .mode(OperationMode.FIRST_BUILD)
                .statistics(stats)
                .filesWritten(1)
                .build());
        report.getErrors().add(ResourceError.parse("A/a.xml", "Malformed XML"));

        JsonNode json = new ObjectMapper().readTree(ReportWriter.toJson(report));

        assertEquals(1, json.get("failureCount").asInt());
        assertFalse(json.get("successful").asBoolean());
        assertEquals("TYPED", json.get("outcomes").get(0).get("namespace").asText());
        assertEquals(3, json.get("outcomes").get(0).get("statistics").get("addedCount").asInt());
        assertEquals("PARSE", json.get("errors").get(0).get("kind").asText());
    }
}
