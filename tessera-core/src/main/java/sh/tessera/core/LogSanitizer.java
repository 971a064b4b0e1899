// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import java.util.regex.Pattern;

/**
 * Scrubs secrets from log text and caps its length.
 *
 * <p>JSON-style {@code "privateKey"}, {@code "mnemonic"} and {@code "raw"} string values are
 * replaced; anything over 2000 characters is truncated.
 */
public final class LogSanitizer {

    private static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    private static final Pattern PRIVATE_KEY_PATTERN =
            Pattern.compile("\"privateKey\"\\s*:\\s*\"0x[^\"]+\"");

    private static final String PRIVATE_KEY_REPLACEMENT = "\"privateKey\":\"0x***[REDACTED]***\"";

    private static final Pattern MNEMONIC_PATTERN =
            Pattern.compile("\"mnemonic\"\\s*:\\s*\"[^\"]+\"");

    private static final String MNEMONIC_REPLACEMENT = "\"mnemonic\":\"***[REDACTED]***\"";

    private static final Pattern RAW_PATTERN =
            Pattern.compile("\"raw\"\\s*:\\s*\"0x[^\"]+\"");

    private static final String RAW_REPLACEMENT = "\"raw\":\"0x***[REDACTED]***\"";

    private LogSanitizer() {
    }

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String sanitized = input;

        if (sanitized.contains("\"privateKey\"")) {
            sanitized = PRIVATE_KEY_PATTERN.matcher(sanitized).replaceAll(PRIVATE_KEY_REPLACEMENT);
        }

        if (sanitized.contains("\"mnemonic\"")) {
            sanitized = MNEMONIC_PATTERN.matcher(sanitized).replaceAll(MNEMONIC_REPLACEMENT);
        }

        if (sanitized.contains("\"raw\"")) {
            sanitized = RAW_PATTERN.matcher(sanitized).replaceAll(RAW_REPLACEMENT);
        }

        if (sanitized.length() > MAX_LOG_LENGTH) {
            final int truncateAt = Math.max(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length());
            sanitized = sanitized.substring(0, truncateAt) + TRUNCATION_SUFFIX;
        }

        return sanitized;
    }
}
