// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import sh.tessera.primitives.Hex;

class Keccak256Test {

    @Test
    void hashesEmptyInput() {
        assertEquals(
                "0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470",
                Hex.encode(Keccak256.hash(new byte[0])));
    }

    @Test
    void hashesAscii() {
        assertEquals(
                "0x1c8aff950685c2ed4bc3174f3472287b56d9517b9c948127319a09a7a36deac8",
                Hex.encode(Keccak256.hash("hello".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void multiPartHashEqualsHashOfConcatenation() {
        final byte[] whole = Keccak256.hash("hello world".getBytes(StandardCharsets.UTF_8));
        final byte[] parts = Keccak256.hash(
                "hello".getBytes(StandardCharsets.UTF_8), " ".getBytes(StandardCharsets.UTF_8),
                "world".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(whole, parts);
    }

    @Test
    void reusableAfterCleanup() {
        final byte[] before = Keccak256.hash(new byte[] {1});
        Keccak256.cleanup();
        assertArrayEquals(before, Keccak256.hash(new byte[] {1}));
        assertArrayEquals(before, HashFunction.keccak256().hash(new byte[] {1}));
    }
}
