// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import sh.tessera.core.error.AbiTypeParseException;

class TypeParserTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "uint256|uint256",
        "uint|uint256",
        "int|int256",
        "int8|int8",
        "address|address",
        "bool|bool",
        "bytes|bytes",
        "bytes1|bytes1",
        "bytes32|bytes32",
        "string|string",
        "address[]|address[]",
        "uint256[3]|uint256[3]",
        "uint256[2][3]|uint256[2][3]",
        "uint8[][4]|uint8[][4]",
        "(uint256,address)|(uint256,address)",
        "tuple(uint256,address)|(uint256,address)",
        "(uint256,address)[3]|(uint256,address)[3]",
        "(uint256,(bool,bytes)[])[2]|(uint256,(bool,bytes)[])[2]",
        "( uint256 , string )|(uint256,string)",
        "()|()"
    })
    void parsesToCanonicalForm(final String input, final String canonical) {
        assertEquals(canonical, TypeParser.parse(input).canonical());
    }

    @Test
    void arraysAreReadFromTheRight() {
        final AbiType type = TypeParser.parse("uint256[2][3]");

        final AbiType.ArrayType outer = assertInstanceOf(AbiType.ArrayType.class, type);
        assertEquals(3, outer.length());
        final AbiType.ArrayType inner = assertInstanceOf(AbiType.ArrayType.class, outer.element());
        assertEquals(2, inner.length());
        assertEquals(192, type.staticSize());
    }

    @Test
    void nestedTuplesAreNotSplitAtInnerCommas() {
        final AbiType.TupleType tuple = assertInstanceOf(
                AbiType.TupleType.class, TypeParser.parse("((uint256,uint256),uint256)"));

        assertEquals(2, tuple.components().size());
        assertEquals("(uint256,uint256)", tuple.components().get(0).canonical());
        assertEquals(96, tuple.staticSize());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "uint7", "uint264", "uint08", "int0", "bytes0", "bytes33", "foo", "uint256x",
        "(uint256", "uint256)", "uint256[", "uint256]", "uint256[0]", "uint256[-1]", "uint256[]x",
        "(uint256,,bool)", "[]", " ", "uint256[100000000]", "(uint256[50000000],uint256[50000000])"
    })
    void rejectsMalformedTypes(final String input) {
        assertThrows(AbiTypeParseException.class, () -> TypeParser.parse(input));
    }

    @Test
    void rejectsNull() {
        assertThrows(AbiTypeParseException.class, () -> TypeParser.parse(null));
    }

    @Test
    void parsesTypeLists() {
        final List<AbiType> types = TypeParser.parseList("uint256,(address,bytes)[],string");

        assertEquals(3, types.size());
        assertEquals("(address,bytes)[]", types.get(1).canonical());
        assertTrue(TypeParser.parseList("").isEmpty());
    }

    @Test
    void signatureDropsParameterNames() {
        final TypeParser.ParsedSignature parsed =
                TypeParser.parseSignature("transfer(address to, uint256 amount)");

        assertEquals("transfer", parsed.name());
        assertEquals("transfer(address,uint256)", parsed.canonical());
    }

    @Test
    void signatureWithTupleParameter() {
        final TypeParser.ParsedSignature parsed =
                TypeParser.parseSignature("submit((uint256,address) order, bytes sig)");

        assertEquals("submit((uint256,address),bytes)", parsed.canonical());
    }

    @Test
    void signatureWithoutParameters() {
        assertEquals("totalSupply()", TypeParser.parseSignature("totalSupply()").canonical());
    }

    @ParameterizedTest
    @ValueSource(strings = {"transfer", "(address)", "transfer(address", "1bad(uint256)", "f(uint7)"})
    void rejectsMalformedSignatures(final String signature) {
        assertThrows(AbiTypeParseException.class, () -> TypeParser.parseSignature(signature));
    }
}
