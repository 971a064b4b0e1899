// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opt-in tracing of signing activity through the {@code sh.tessera.debug} logger.
 *
 * <p>Messages use {@link String#format} placeholders and are passed through
 * {@link LogSanitizer} before they reach SLF4J.
 */
public final class DebugLogger {

    static final String LOGGER_NAME = "sh.tessera.debug";

    private static final Logger LOG = LoggerFactory.getLogger(LOGGER_NAME);

    private DebugLogger() {
    }

    /**
     * Logs when transaction signing tracing is on.
     */
    public static void logSign(final String message, final Object... args) {
        if (!TesseraDebug.isSignLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Logs when authorization signing tracing is on.
     */
    public static void logAuth(final String message, final Object... args) {
        if (!TesseraDebug.isAuthLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void log(final String message, final Object... args) {
        if (!TesseraDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
