package com.nana.ingest.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * AppLogger - Import Event and MDC Utilities
 *
 * <p>Every class logs through its own SLF4J logger:
 * <pre>
 *     private static final Logger log = LoggerFactory.getLogger(MyClass.class);
 * </pre>
 * {@code AppLogger} adds two things on top of that:
 * <ul>
 *   <li>MDC (Mapped Diagnostic Context) management. Wrapping an import in
 *       {@link #setOperationContext(String)} makes every log line produced
 *       on that thread carry {@code operation=CSV_IMPORT} (see the
 *       {@code %X{operation}} token in {@code logback.xml}), and
 *       {@link #setSourceContext(String)} tags lines with the file being
 *       imported.</li>
 *   <li>Structured event logging. Import milestones (parse rejected,
 *       import complete) are logged through one dedicated logger in a
 *       fixed {@code [EVENT] name | details} format.</li>
 * </ul>
 */
public final class AppLogger {

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /** Logger for structured import events. */
    private static final Logger EVENT_LOG =
            LoggerFactory.getLogger("com.nana.ingest.EVENTS");

    /** MDC key for the current operation name. */
    public static final String MDC_OPERATION = "operation";

    /** MDC key for the name of the file being imported. */
    public static final String MDC_SOURCE = "source";

    private AppLogger() {
        throw new UnsupportedOperationException(
                "AppLogger is a static utility class.");
    }

    // -----------------------------------------------------------------------
    // STRUCTURED EVENT LOGGING
    // -----------------------------------------------------------------------

    /**
     * Logs an import milestone.
     *
     * <p>Format: {@code [EVENT] <eventName> | <details>}
     *
     * @param eventName a short event label (e.g., "CSV_IMPORT_COMPLETE")
     * @param details   additional context (e.g., "total=50, failed=3")
     */
    public static void logEvent(String eventName, String details) {
        EVENT_LOG.info("[EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs an event that is not an error but warrants attention, such as a
     * file rejected for missing headers or an import with failed rows.
     *
     * @param eventName a short event label
     * @param details   additional context
     */
    public static void logWarningEvent(String eventName, String details) {
        EVENT_LOG.warn("[WARN_EVENT] {} | {}", eventName, details);
    }

    /**
     * Logs a failed operation together with its cause.
     *
     * @param eventName a short event label
     * @param details   what was attempted
     * @param throwable the cause
     */
    public static void logErrorEvent(String eventName,
                                     String details,
                                     Throwable throwable) {
        EVENT_LOG.error("[ERROR_EVENT] {} | {}", eventName, details, throwable);
    }

    // -----------------------------------------------------------------------
    // MDC CONTEXT MANAGEMENT
    // -----------------------------------------------------------------------

    /**
     * Sets the current operation name in the MDC.
     *
     * <pre>
     *     AppLogger.setOperationContext("CSV_IMPORT");
     *     try {
     *         // ... import ...
     *     } finally {
     *         AppLogger.clearOperationContext();
     *     }
     * </pre>
     *
     * @param operationName the operation label (e.g., "CSV_IMPORT")
     */
    public static void setOperationContext(String operationName) {
        MDC.put(MDC_OPERATION, operationName);
    }

    /**
     * Sets the source file name in the MDC.
     *
     * @param sourceName the file name, or a label such as "inline"
     */
    public static void setSourceContext(String sourceName) {
        MDC.put(MDC_SOURCE, sourceName);
    }

    /**
     * Removes the operation and source entries from the MDC. Must be
     * called from a {@code finally} block so the values do not leak onto
     * unrelated work on a pooled thread.
     */
    public static void clearOperationContext() {
        MDC.remove(MDC_OPERATION);
        MDC.remove(MDC_SOURCE);
    }
}
