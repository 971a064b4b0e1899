// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import sh.tessera.primitives.Hex;

class RlpTest {

    private static RlpString ascii(final String s) {
        return RlpString.of(s.getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    @DisplayName("String vectors from the Ethereum RLP documentation")
    void stringVectors() {
        assertEquals("80", Hex.encodeNoPrefix(RlpString.of(new byte[0]).encode()));
        assertEquals("83646f67", Hex.encodeNoPrefix(ascii("dog").encode()));
        assertEquals("00", Hex.encodeNoPrefix(RlpString.of(new byte[] {0x00}).encode()));
        assertEquals("0f", Hex.encodeNoPrefix(RlpString.of(new byte[] {0x0f}).encode()));
        assertEquals("8180", Hex.encodeNoPrefix(RlpString.of(new byte[] {(byte) 0x80}).encode()));
    }

    @Test
    @DisplayName("Integers use the minimal big-endian form")
    void minimalIntegers() {
        assertArrayEquals(new byte[] {(byte) 0x80}, RlpString.of(0L).encode());
        assertArrayEquals(new byte[] {(byte) 0x80}, RlpNumeric.encodeBigIntegerUnsigned(BigInteger.ZERO));
        assertArrayEquals(new byte[] {(byte) 0x82, 0x04, 0x00}, RlpString.of(1024L).encode());
        assertArrayEquals(new byte[] {(byte) 0x82, 0x04, 0x00}, RlpNumeric.encodeLongUnsigned(1024L));
        assertEquals("7f", Hex.encodeNoPrefix(RlpString.of(127L).encode()));
        assertEquals("8180", Hex.encodeNoPrefix(RlpString.of(BigInteger.valueOf(128)).encode()));
        assertEquals(
                "a0ffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffffff",
                Hex.encodeNoPrefix(RlpString.of(BigInteger.TWO.pow(256).subtract(BigInteger.ONE)).encode()));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(-1L));
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(BigInteger.valueOf(-1)));
    }

    @Test
    @DisplayName("List vectors from the Ethereum RLP documentation")
    void listVectors() {
        assertEquals("c0", Hex.encodeNoPrefix(RlpList.of().encode()));
        assertEquals("c88363617483646f67", Hex.encodeNoPrefix(RlpList.of(ascii("cat"), ascii("dog")).encode()));
        // set-theoretic representation of three
        final RlpList three = RlpList.of(
                RlpList.of(),
                RlpList.of(RlpList.of()),
                RlpList.of(RlpList.of(), RlpList.of(RlpList.of())));
        assertEquals("c7c0c1c0c3c0c1c0", Hex.encodeNoPrefix(three.encode()));
    }

    @Test
    void longStringAndListPrefixes() {
        final byte[] longString = new byte[60];
        Arrays.fill(longString, (byte) 0x01);
        final byte[] encoded = RlpString.of(longString).encode();
        assertEquals((byte) 0xB8, encoded[0]);
        assertEquals((byte) 0x3C, encoded[1]);
        assertEquals(62, encoded.length);

        final List<RlpItem> items = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            items.add(RlpString.of((long) i));
        }
        final byte[] encodedList = RlpList.of(items).encode();
        assertEquals((byte) 0xF8, encodedList[0]);
        assertEquals((byte) 0x3C, encodedList[1]);
        assertEquals(items, Rlp.decodeList(encodedList));

        final byte[] big = new byte[1024];
        final byte[] bigEncoded = RlpString.of(big).encode();
        assertEquals("b90400", Hex.encodeNoPrefix(Arrays.copyOf(bigEncoded, 3)));
    }

    @Test
    void roundTripsNestedStructures() {
        final List<RlpItem> samples = List.of(
                RlpString.of(new byte[0]),
                RlpString.of(15L),
                RlpList.of(ascii("hello"), RlpList.of(RlpString.of(1024L))),
                RlpList.of(RlpString.of(new byte[60]), RlpList.of(ascii("tessera"))));
        for (final RlpItem item : samples) {
            assertEquals(item, Rlp.decode(Rlp.encode(item)));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",          // empty input
        "83646f",    // truncated string
        "c883636174",// truncated list
        "8105",      // single byte below 0x80 wrapped in a prefix
        "b80100",    // long form used for a short string
        "b9000100",  // length with leading zero
        "8000",      // trailing byte
        "c3830102"   // list payload shorter than its child
    })
    void rejectsNonCanonicalOrTruncatedInput(final String hex) {
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(Hex.decode(hex)));
    }

    @Test
    void scalarAccessorsRejectLeadingZeros() {
        assertEquals(BigInteger.valueOf(1024), RlpString.of("0x0400").asBigInteger());
        assertEquals(0L, RlpString.of(new byte[0]).asLong());
        assertThrows(IllegalArgumentException.class, () -> RlpString.of("0x0004").asBigInteger());
        assertThrows(IllegalArgumentException.class, () -> RlpString.of(new byte[9]).asLong());
        assertThrows(IllegalArgumentException.class, () -> Rlp.decodeList(Hex.decode("83646f67")));
    }

    @Test
    void stringBytesAreCopied() {
        final byte[] raw = {1, 2, 3};
        final RlpString str = RlpString.of(raw);
        raw[0] = 9;
        assertEquals(1, str.bytes()[0]);
        str.bytes()[1] = 9;
        assertEquals(2, str.bytes()[1]);
    }
}
