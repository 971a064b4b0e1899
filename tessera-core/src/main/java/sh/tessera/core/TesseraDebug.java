// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import java.util.Locale;

/**
 * Global switches for {@link DebugLogger} tracing.
 *
 * <p>Both switches start from the {@code tessera.debug} system property, falling back to the
 * {@code TESSERA_DEBUG} environment variable; {@code "true"} or {@code "1"} turns tracing on.
 * They can be flipped at runtime.
 */
public final class TesseraDebug {

    static final String PROPERTY = "tessera.debug";
    static final String ENV = "TESSERA_DEBUG";

    private static volatile boolean signLogging = initialValue();
    private static volatile boolean authLogging = signLogging;

    private TesseraDebug() {
    }

    public static boolean isEnabled() {
        return signLogging || authLogging;
    }

    public static void setEnabled(final boolean enabled) {
        signLogging = enabled;
        authLogging = enabled;
    }

    public static void setSignLogging(final boolean enabled) {
        signLogging = enabled;
    }

    public static boolean isSignLoggingEnabled() {
        return signLogging;
    }

    public static void setAuthLogging(final boolean enabled) {
        authLogging = enabled;
    }

    public static boolean isAuthLoggingEnabled() {
        return authLogging;
    }

    static boolean parse(final String value) {
        if (value == null) {
            return false;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return "true".equals(normalized) || "1".equals(normalized);
    }

    private static boolean initialValue() {
        final String property = System.getProperty(PROPERTY);
        return parse(property != null ? property : System.getenv(ENV));
    }
}
