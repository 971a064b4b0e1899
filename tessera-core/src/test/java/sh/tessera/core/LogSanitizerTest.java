// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogSanitizerTest {

    @Test
    void sanitizesPrivateKey() {
        final String input = "{\"privateKey\": \"0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318\"}";
        final String out = LogSanitizer.sanitize(input);
        assertEquals("{\"privateKey\":\"0x***[REDACTED]***\"}", out);
    }

    @Test
    void sanitizesMnemonic() {
        final String out = LogSanitizer.sanitize("{\"mnemonic\":\"test test test junk\"}");
        assertFalse(out.contains("junk"));
        assertTrue(out.contains("***[REDACTED]***"));
    }

    @Test
    void sanitizesRawTransaction() {
        final String out = LogSanitizer.sanitize("{\"raw\":\"0x02f86c0180\",\"hash\":\"0xabc\"}");
        assertEquals("{\"raw\":\"0x***[REDACTED]***\",\"hash\":\"0xabc\"}", out);
    }

    @Test
    void truncatesLongData() {
        final String out = LogSanitizer.sanitize("a".repeat(5000));
        assertEquals(2000, out.length());
        assertTrue(out.endsWith("...(truncated)"));
    }

    @Test
    void handlesNull() {
        assertEquals("null", LogSanitizer.sanitize(null));
    }

    @Test
    void leavesSafeDataUntouched() {
        final String input = "[SIGN] type=EIP1559 hash=0x1234 size=110";
        assertEquals(input, LogSanitizer.sanitize(input));
    }
}
