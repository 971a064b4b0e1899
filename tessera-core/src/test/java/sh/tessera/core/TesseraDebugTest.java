// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TesseraDebugTest {

    @AfterEach
    void reset() {
        TesseraDebug.setEnabled(false);
    }

    @Test
    void parsesFlagValues() {
        assertTrue(TesseraDebug.parse("true"));
        assertTrue(TesseraDebug.parse(" TRUE "));
        assertTrue(TesseraDebug.parse("1"));
        assertFalse(TesseraDebug.parse("yes"));
        assertFalse(TesseraDebug.parse(""));
        assertFalse(TesseraDebug.parse(null));
    }

    @Test
    void enabledWhenEitherSwitchIsOn() {
        TesseraDebug.setEnabled(false);
        assertFalse(TesseraDebug.isEnabled());

        TesseraDebug.setAuthLogging(true);
        assertTrue(TesseraDebug.isEnabled());
        assertFalse(TesseraDebug.isSignLoggingEnabled());

        TesseraDebug.setEnabled(true);
        assertTrue(TesseraDebug.isSignLoggingEnabled());
        assertTrue(TesseraDebug.isAuthLoggingEnabled());
    }
}
