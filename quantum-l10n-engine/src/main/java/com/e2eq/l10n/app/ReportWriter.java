package com.e2eq.l10n.app;

import com.e2eq.l10n.util.AtomicFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes a run report (merge, import or corpus) as pretty printed JSON.
 */
public final class ReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ReportWriter() {
    }

    public static String toJson(Object report) throws IOException {
        return MAPPER.writeValueAsString(report);
    }

    public static void write(Object report, Path file) throws IOException {
        AtomicFiles.writeString(file, toJson(report) + System.lineSeparator());
    }
}
