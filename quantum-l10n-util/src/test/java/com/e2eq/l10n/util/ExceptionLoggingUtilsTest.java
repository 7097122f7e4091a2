package com.e2eq.l10n.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;

import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;

class ExceptionLoggingUtilsTest {

    @Test
    void describeFallsBackToClassName() {
        assertEquals("disk full", ExceptionLoggingUtils.describe(new IOException("disk full")));
        assertEquals("java.lang.IllegalStateException", ExceptionLoggingUtils.describe(new IllegalStateException()));
        assertEquals("", ExceptionLoggingUtils.describe(null));
    }

    @Test
    void stackTraceNamesTheException() {
        String trace = ExceptionLoggingUtils.getStackTrace(new IOException("disk full"));
        assertTrue(trace.startsWith("java.io.IOException: disk full"), trace);
        assertTrue(trace.contains("stackTraceNamesTheException"));
    }

    @Test
    void loggingWithoutExceptionDoesNotFail() {
        Logger log = Logger.getLogger(ExceptionLoggingUtilsTest.class);
        assertDoesNotThrow(() -> ExceptionLoggingUtils.logWarn(log, null, "plain %s", "message"));
        assertDoesNotThrow(() -> ExceptionLoggingUtils.logError(log, new IOException("x"), "with exception"));
    }
}
