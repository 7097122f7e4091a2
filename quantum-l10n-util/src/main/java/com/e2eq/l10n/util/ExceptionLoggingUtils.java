package com.e2eq.l10n.util;

import org.jboss.logging.Logger;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Consistent exception logging for the engine. Messages use {@link String#format} placeholders.
 */
public final class ExceptionLoggingUtils {

    private ExceptionLoggingUtils() {
    }

    /**
     * Log an exception with its stack trace at ERROR level.
     *
     * @param log       the caller's logger
     * @param exception the exception to log, may be null
     * @param message   the message format string
     * @param args      optional arguments for message formatting
     */
    public static void logError(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.ERROR, exception, message, args);
    }

    /**
     * Log an exception with its stack trace at WARN level.
     */
    public static void logWarn(Logger log, Throwable exception, String message, Object... args) {
        log(log, Logger.Level.WARN, exception, message, args);
    }

    private static void log(Logger log, Logger.Level level, Throwable exception, String message, Object... args) {
        String formatted = args.length > 0 ? String.format(message, args) : message;
        if (exception == null) {
            log.log(level, formatted);
            return;
        }
        log.logf(level, "%s: %s%n%s", formatted, describe(exception), getStackTrace(exception));
    }

    /**
     * @return the exception message, or its class name when it carries none
     */
    public static String describe(Throwable exception) {
        if (exception == null) {
            return "";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    /**
     * Get stack trace as string
     *
     * @param exception the exception
     * @return stack trace as string
     */
    public static String getStackTrace(Throwable exception) {
        if (exception == null) {
            return "";
        }
        StringWriter sw = new StringWriter();
        PrintWriter pw = new PrintWriter(sw);
        exception.printStackTrace(pw);
        return sw.toString();
    }
}
