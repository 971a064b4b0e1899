// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class HexTest {

    @Test
    void decodesWithAndWithoutPrefix() {
        assertArrayEquals(new byte[] {0x12, (byte) 0xab}, Hex.decode("0x12ab"));
        assertArrayEquals(new byte[] {0x12, (byte) 0xab}, Hex.decode("12AB"));
        assertArrayEquals(new byte[0], Hex.decode("0x"));
        assertArrayEquals(new byte[0], Hex.decode(""));
    }

    @Test
    void encodesLowercase() {
        assertEquals("0xdeadbeef", Hex.encode(new byte[] {(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef}));
        assertEquals("00ff", Hex.encodeNoPrefix(new byte[] {0, (byte) 0xff}));
        assertEquals("0xadbe", Hex.encode(new byte[] {(byte) 0xde, (byte) 0xad, (byte) 0xbe, (byte) 0xef}, 1, 2));
        assertEquals("0x0f", Hex.encodeByte(15));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0x1", "abc", "0xzz", "0x12g4"})
    void rejectsMalformedInput(final String input) {
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(input));
        assertFalse(Hex.isValid(input));
    }

    @Test
    void prefixHelpers() {
        assertTrue(Hex.hasPrefix("0Xab"));
        assertFalse(Hex.hasPrefix("ab"));
        assertEquals("ab", Hex.cleanPrefix("0xab"));
        assertEquals("ab", Hex.cleanPrefix("ab"));
        assertThrows(IllegalArgumentException.class, () -> Hex.decode(null));
        assertThrows(IllegalArgumentException.class, () -> Hex.encodeByte(256));
    }
}
