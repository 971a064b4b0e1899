// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AbiTypeTest {

    @Test
    void nestedStaticTupleOccupiesThreeWords() {
        final AbiType type = AbiType.tuple(AbiType.tuple(AbiType.uint(256), AbiType.uint(256)), AbiType.uint(256));

        assertFalse(type.isDynamic());
        assertEquals(96, type.staticSize());
    }

    @Test
    void dynamicTypesTakeOneHeadSlot() {
        assertTrue(AbiType.string().isDynamic());
        assertTrue(AbiType.bytes().isDynamic());
        assertTrue(AbiType.array(AbiType.uint(8)).isDynamic());
        assertTrue(AbiType.array(AbiType.string(), 2).isDynamic());
        assertTrue(AbiType.tuple(AbiType.uint(256), AbiType.string()).isDynamic());

        assertEquals(32, AbiType.string().staticSize());
        assertEquals(32, AbiType.array(AbiType.string(), 2).staticSize());
        assertEquals(32, AbiType.tuple(AbiType.uint(256), AbiType.bytes()).staticSize());
    }

    @Test
    void fixedArraysOfStaticElementsAreInlined() {
        final AbiType type = AbiType.array(AbiType.tuple(AbiType.address(), AbiType.bool()), 3);

        assertFalse(type.isDynamic());
        assertEquals(192, type.staticSize());
    }

    @Test
    void rejectsInvalidWidths() {
        assertThrows(IllegalArgumentException.class, () -> AbiType.uint(0));
        assertThrows(IllegalArgumentException.class, () -> AbiType.uint(12));
        assertThrows(IllegalArgumentException.class, () -> AbiType.signedInt(264));
        assertThrows(IllegalArgumentException.class, () -> AbiType.bytes(0));
        assertThrows(IllegalArgumentException.class, () -> AbiType.bytes(33));
        assertThrows(IllegalArgumentException.class, () -> AbiType.array(AbiType.bool(), 0));
    }

    @Test
    void equalityFollowsStructure() {
        assertEquals(AbiType.parse("(uint256,address[])"),
                AbiType.tuple(AbiType.uint(256), AbiType.array(AbiType.address())));
        assertNotEquals(AbiType.parse("uint256[2]"), AbiType.parse("uint256[3]"));
    }
}
