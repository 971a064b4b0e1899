// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.crypto.HashFunction;
import sh.tessera.core.error.AbiEncodingException;

/**
 * Solidity ABI head-tail encoder.
 *
 * <p>Each element of a tuple contributes its head: the value itself for static types (static
 * tuples and fixed arrays inline every word), or a 32-byte offset for dynamic types. Offsets are
 * measured from the start of the enclosing tuple's own encoding. Tails follow the heads in
 * declaration order and are encoded recursively.
 *
 * <p>Encoding runs in two passes: the first validates every value against its type and computes
 * the exact output length, the second writes into a single pre-sized buffer.
 *
 * <pre>{@code
 * byte[] data = AbiEncoder.encode(
 *         List.of(AbiType.uint(256), AbiType.string()),
 *         List.of(AbiValue.number(123), AbiValue.string("Hello World")));
 * }</pre>
 */
public final class AbiEncoder {

    private static final int WORD = 32;

    private AbiEncoder() {
    }

    /**
     * Encodes values as the tuple of the given types.
     *
     * @throws AbiEncodingException on any type/value mismatch or out-of-range integer
     */
    public static byte[] encode(final List<AbiType> types, final List<AbiValue> values) {
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(values, "values");
        final int size = tupleSize(types, values, "parameters");
        final ByteBuffer buffer = ByteBuffer.allocate(size);
        writeTuple(types, values, buffer);
        return buffer.array();
    }

    /**
     * Encodes a single value of {@code type} as if it were a one-element tuple.
     */
    public static byte[] encode(final AbiType type, final AbiValue value) {
        return encode(List.of(type), List.of(value));
    }

    /**
     * Encodes call data: {@code selector} followed by the encoded arguments.
     */
    public static byte[] encodeFunction(
            final byte[] selector, final List<AbiType> types, final List<AbiValue> values) {
        Objects.requireNonNull(selector, "selector");
        if (selector.length != 4) {
            throw new IllegalArgumentException("Selector must be 4 bytes, got " + selector.length);
        }
        final int size = tupleSize(types, values, "parameters");
        final ByteBuffer buffer = ByteBuffer.allocate(4 + size);
        buffer.put(selector);
        writeTuple(types, values, buffer);
        return buffer.array();
    }

    /**
     * Encodes call data for a human-readable signature such as {@code transfer(address,uint256)}.
     */
    public static byte[] encodeFunction(
            final String signature, final List<AbiValue> values, final HashFunction hash) {
        final TypeParser.ParsedSignature parsed = TypeParser.parseSignature(signature);
        final byte[] selector = new Selectors(hash).selector(parsed.canonical());
        return encodeFunction(selector, parsed.inputs(), values);
    }

    /**
     * {@link #encodeFunction(String, List, HashFunction)} with Keccak-256.
     */
    public static byte[] encodeFunction(final String signature, final List<AbiValue> values) {
        return encodeFunction(signature, values, HashFunction.keccak256());
    }

    // ---- size pass: validation happens here ----

    private static int tupleSize(final List<AbiType> types, final List<AbiValue> values, final String context) {
        if (types.size() != values.size()) {
            throw new AbiEncodingException(
                    "Expected " + types.size() + " values for " + context + ", got " + values.size());
        }
        int size = 0;
        for (int i = 0; i < types.size(); i++) {
            final AbiType type = Objects.requireNonNull(types.get(i), "type");
            final AbiValue value = values.get(i);
            if (value == null) {
                throw new AbiEncodingException("Null value for " + type.canonical() + " at index " + i);
            }
            final int content = contentSize(type, value);
            size = Math.addExact(size, type.isDynamic() ? WORD + content : content);
        }
        return size;
    }

    /**
     * Size of the value's own encoding: inline words for static types, tail bytes for dynamic ones.
     */
    private static int contentSize(final AbiType type, final AbiValue value) {
        if (type instanceof AbiType.UIntType t) {
            checkUnsigned(t, expect(value, AbiValue.NumberValue.class, type).value());
            return WORD;
        }
        if (type instanceof AbiType.IntType t) {
            checkSigned(t, expect(value, AbiValue.NumberValue.class, type).value());
            return WORD;
        }
        if (type instanceof AbiType.AddressType) {
            expect(value, AbiValue.AddressValue.class, type);
            return WORD;
        }
        if (type instanceof AbiType.BoolType) {
            expect(value, AbiValue.BoolValue.class, type);
            return WORD;
        }
        if (type instanceof AbiType.FixedBytesType t) {
            final int length = expect(value, AbiValue.BytesValue.class, type).length();
            if (length != t.size()) {
                throw new AbiEncodingException(
                        t.canonical() + " requires exactly " + t.size() + " bytes, got " + length);
            }
            return WORD;
        }
        if (type instanceof AbiType.BytesType) {
            return WORD + padded(expect(value, AbiValue.BytesValue.class, type).length());
        }
        if (type instanceof AbiType.StringType) {
            return WORD + padded(expect(value, AbiValue.StringValue.class, type).utf8().length);
        }
        if (type instanceof AbiType.ArrayType t) {
            final List<AbiValue> elements = expect(value, AbiValue.ListValue.class, type).values();
            if (t.isFixedLength() && elements.size() != t.length()) {
                throw new AbiEncodingException(
                        t.canonical() + " requires " + t.length() + " elements, got " + elements.size());
            }
            final int body = tupleSize(Collections.nCopies(elements.size(), t.element()), elements, t.canonical());
            return t.isFixedLength() ? body : WORD + body;
        }
        final AbiType.TupleType t = (AbiType.TupleType) type;
        final List<AbiValue> components = expect(value, AbiValue.ListValue.class, type).values();
        return tupleSize(t.components(), components, t.canonical());
    }

    // ---- write pass: values are known to be valid ----

    private static void writeTuple(final List<AbiType> types, final List<AbiValue> values, final ByteBuffer out) {
        int headSize = 0;
        for (final AbiType type : types) {
            headSize += type.staticSize();
        }
        int tailOffset = headSize;
        for (int i = 0; i < types.size(); i++) {
            final AbiType type = types.get(i);
            if (type.isDynamic()) {
                writeUnsigned(BigInteger.valueOf(tailOffset), out);
                tailOffset += contentSize(type, values.get(i));
            } else {
                writeContent(type, values.get(i), out);
            }
        }
        for (int i = 0; i < types.size(); i++) {
            if (types.get(i).isDynamic()) {
                writeContent(types.get(i), values.get(i), out);
            }
        }
    }

    private static void writeContent(final AbiType type, final AbiValue value, final ByteBuffer out) {
        if (type instanceof AbiType.UIntType) {
            writeUnsigned(((AbiValue.NumberValue) value).value(), out);
        } else if (type instanceof AbiType.IntType) {
            writeSigned(((AbiValue.NumberValue) value).value(), out);
        } else if (type instanceof AbiType.AddressType) {
            out.put(new byte[12]);
            out.put(((AbiValue.AddressValue) value).value().toBytes());
        } else if (type instanceof AbiType.BoolType) {
            out.put(new byte[WORD - 1]);
            out.put(((AbiValue.BoolValue) value).value() ? (byte) 1 : (byte) 0);
        } else if (type instanceof AbiType.FixedBytesType) {
            writePaddedRight(((AbiValue.BytesValue) value).unsafeBytes(), out);
        } else if (type instanceof AbiType.BytesType) {
            final byte[] content = ((AbiValue.BytesValue) value).unsafeBytes();
            writeUnsigned(BigInteger.valueOf(content.length), out);
            writePaddedRight(content, out);
        } else if (type instanceof AbiType.StringType) {
            final byte[] content = ((AbiValue.StringValue) value).utf8();
            writeUnsigned(BigInteger.valueOf(content.length), out);
            writePaddedRight(content, out);
        } else if (type instanceof AbiType.ArrayType t) {
            final List<AbiValue> elements = ((AbiValue.ListValue) value).values();
            if (!t.isFixedLength()) {
                writeUnsigned(BigInteger.valueOf(elements.size()), out);
            }
            writeTuple(Collections.nCopies(elements.size(), t.element()), elements, out);
        } else {
            writeTuple(((AbiType.TupleType) type).components(), ((AbiValue.ListValue) value).values(), out);
        }
    }

    private static void writeUnsigned(final BigInteger value, final ByteBuffer out) {
        final byte[] raw = value.toByteArray();
        final int start = raw.length > WORD ? raw.length - WORD : 0;
        final int length = raw.length - start;
        out.put(new byte[WORD - length]);
        out.put(raw, start, length);
    }

    private static void writeSigned(final BigInteger value, final ByteBuffer out) {
        final byte[] raw = value.toByteArray();
        final byte pad = value.signum() < 0 ? (byte) 0xFF : 0;
        for (int i = raw.length; i < WORD; i++) {
            out.put(pad);
        }
        out.put(raw);
    }

    private static void writePaddedRight(final byte[] content, final ByteBuffer out) {
        out.put(content);
        out.put(new byte[padded(content.length) - content.length]);
    }

    static int padded(final int length) {
        return (length + WORD - 1) / WORD * WORD;
    }

    static void checkUnsigned(final AbiType.UIntType type, final BigInteger value) {
        if (value.signum() < 0 || value.bitLength() > type.bits()) {
            throw new AbiEncodingException("Value " + value + " out of range for " + type.canonical());
        }
    }

    static void checkSigned(final AbiType.IntType type, final BigInteger value) {
        // two's complement range [-2^(bits-1), 2^(bits-1))
        if (value.bitLength() > type.bits() - 1) {
            throw new AbiEncodingException("Value " + value + " out of range for " + type.canonical());
        }
    }

    static <T extends AbiValue> T expect(final AbiValue value, final Class<T> kind, final AbiType type) {
        if (!kind.isInstance(value)) {
            throw new AbiEncodingException("Value " + value + " does not match type " + type.canonical());
        }
        return kind.cast(value);
    }
}
