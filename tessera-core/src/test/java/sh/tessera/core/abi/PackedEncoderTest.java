// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.primitives.Hex;

class PackedEncoderTest {

    @Test
    void packsElementaryValuesAtNaturalWidth() {
        final byte[] packed = PackedEncoder.encodePacked(
                List.of(AbiType.signedInt(16), AbiType.bytes(1), AbiType.uint(16), AbiType.string()),
                List.of(AbiValue.number(-1),
                        AbiValue.bytes(new byte[] {0x42}),
                        AbiValue.number(3),
                        AbiValue.string("Hello, world!")));

        assertEquals("ffff42000348656c6c6f2c20776f726c6421", Hex.encodeNoPrefix(packed));
    }

    @Test
    void addressAndBoolAreUnpadded() {
        final byte[] packed = PackedEncoder.encodePacked(
                List.of(AbiType.address(), AbiType.bool(), AbiType.bytes()),
                List.of(AbiValue.address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23"),
                        AbiValue.bool(true),
                        AbiValue.bytes(new byte[] {1, 2, 3})));

        assertEquals("2c7536e3605d9c16a7a3d7b1898e529396a65c2301010203", Hex.encodeNoPrefix(packed));
    }

    @Test
    void arrayElementsArePaddedToWords() {
        final byte[] packed = PackedEncoder.encodePacked(
                List.of(AbiType.array(AbiType.uint(8))),
                List.of(AbiValue.list(AbiValue.number(1), AbiValue.number(2))));

        assertEquals(AbiTestSupport.left("1") + AbiTestSupport.left("2"), Hex.encodeNoPrefix(packed));
    }

    @Test
    void rejectsUnpackableTypes() {
        assertThrows(AbiEncodingException.class, () -> PackedEncoder.encodePacked(
                List.of(AbiType.tuple(AbiType.uint(8))),
                List.of(AbiValue.list(AbiValue.number(1)))));
        assertThrows(AbiEncodingException.class, () -> PackedEncoder.encodePacked(
                List.of(AbiType.array(AbiType.string())),
                List.of(AbiValue.list(AbiValue.string("x")))));
        assertThrows(AbiEncodingException.class, () -> PackedEncoder.encodePacked(
                List.of(AbiType.uint(8)),
                List.of(AbiValue.number(256))));
    }
}
