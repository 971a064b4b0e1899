// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SignatureTest {

    @ParameterizedTest
    @CsvSource({"0,0", "1,1", "27,0", "28,1", "37,0", "38,1", "2709,0", "2710,1"})
    void derivesRecoveryId(final int v, final int expected) {
        assertEquals(expected, Signature.of(BigInteger.ONE, BigInteger.TWO, v).recoveryId());
    }

    @Test
    void rejectsUnrecognisedV() {
        final Signature signature = Signature.of(BigInteger.ONE, BigInteger.TWO, 2);
        assertThrows(IllegalArgumentException.class, signature::recoveryId);
    }

    @Test
    void validatesComponentLengths() {
        assertThrows(IllegalArgumentException.class, () -> new Signature(new byte[31], new byte[32], 0));
        assertThrows(IllegalArgumentException.class, () -> new Signature(new byte[32], new byte[33], 0));
        assertThrows(IllegalArgumentException.class, () -> new Signature(new byte[32], new byte[32], -1));
        assertThrows(IllegalArgumentException.class, () -> Signature.of(BigInteger.TWO.pow(256), BigInteger.ONE, 0));
    }

    @Test
    void componentsAreDefensivelyCopied() {
        final byte[] r = new byte[32];
        r[31] = 5;
        final Signature signature = new Signature(r, new byte[32], 0);
        r[31] = 6;
        signature.r()[31] = 7;

        assertEquals(BigInteger.valueOf(5), signature.rAsBigInteger());
    }

    @Test
    void equalityIsByValue() {
        final Signature a = Signature.of(BigInteger.TEN, BigInteger.ONE, 1);
        assertEquals(a, Signature.of(BigInteger.TEN, BigInteger.ONE, 1));
        assertEquals(a.hashCode(), Signature.of(BigInteger.TEN, BigInteger.ONE, 1).hashCode());
        assertNotEquals(a, a.withV(28));
        assertEquals(28, a.withV(28).v());
    }
}
