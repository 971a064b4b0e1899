// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class TypesTest {

    @Test
    void addressIsNormalisedToLowerCase() {
        final Address address = new Address("0x2C7536E3605D9C16a7a3D7b1898e529396a65c23");
        assertEquals("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23", address.value());
        assertEquals(address, Address.fromBytes(address.toBytes()));
        assertTrue(Address.ZERO.isZero());
        assertFalse(address.isZero());
    }

    @Test
    void addressRejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("2c7536e3605d9c16a7a3d7b1898e529396a65c23"));
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void hashRequires32Bytes() {
        final Hash hash = Hash.fromBytes(new byte[32]);
        assertEquals("0x" + "00".repeat(32), hash.value());
        assertThrows(IllegalArgumentException.class, () -> Hash.of("0x" + "00".repeat(31)));
        assertThrows(IllegalArgumentException.class, () -> Hash.fromBytes(new byte[33]));
    }

    @Test
    void hexDataCopiesAndCompares() {
        final byte[] raw = {1, 2, 3};
        final HexData data = HexData.fromBytes(raw);
        raw[0] = 9;

        assertEquals("0x010203", data.value());
        assertEquals(HexData.of("0x010203"), data);
        assertEquals(3, data.byteLength());
        assertTrue(HexData.EMPTY.isEmpty());
        assertEquals("0x", HexData.EMPTY.value());
        assertThrows(IllegalArgumentException.class, () -> HexData.of("0x123"));
    }

    @Test
    void weiConversions() {
        assertEquals(BigInteger.valueOf(20_000_000_000L), Wei.gwei(20).value());
        assertEquals(BigInteger.TEN.pow(18), Wei.fromEther(BigDecimal.ONE).value());
        assertEquals(new BigDecimal("1.500000000000000000"), Wei.fromEther(new BigDecimal("1.5")).toEther());
        assertEquals("0x4a817c800", Wei.gwei(20).toHexString());
        assertThrows(IllegalArgumentException.class, () -> Wei.of(-1));
        assertThrows(ArithmeticException.class, () -> Wei.fromEther(new BigDecimal("0.0000000000000000001")));
    }
}
