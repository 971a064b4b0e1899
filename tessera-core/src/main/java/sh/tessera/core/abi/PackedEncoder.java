// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.primitives.Bytes;

/**
 * Non-standard packed mode ({@code abi.encodePacked}).
 *
 * <p>Values are concatenated with no offsets or length words: integers take {@code N/8} bytes,
 * addresses 20, bools 1, {@code bytesN} N, and {@code bytes}/{@code string} their raw content.
 * Array elements are padded to 32 bytes each. Tuples and arrays of dynamic or nested types cannot
 * be packed. The output is ambiguous and cannot be decoded.
 */
public final class PackedEncoder {

    private PackedEncoder() {
    }

    /**
     * Packs values of the given types.
     *
     * @throws AbiEncodingException on a type/value mismatch, an out-of-range integer or an unsupported type
     */
    public static byte[] encodePacked(final List<AbiType> types, final List<AbiValue> values) {
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(values, "values");
        if (types.size() != values.size()) {
            throw new AbiEncodingException(
                    "Expected " + types.size() + " values for packed encoding, got " + values.size());
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < types.size(); i++) {
            final AbiType type = types.get(i);
            final AbiValue value = values.get(i);
            if (type instanceof AbiType.ArrayType array) {
                if (array.element().isDynamic()
                        || array.element() instanceof AbiType.ArrayType
                        || array.element() instanceof AbiType.TupleType) {
                    throw new AbiEncodingException("Cannot pack " + array.canonical());
                }
                final List<AbiValue> elements = AbiEncoder.expect(value, AbiValue.ListValue.class, type).values();
                if (array.isFixedLength() && elements.size() != array.length()) {
                    throw new AbiEncodingException(
                            array.canonical() + " requires " + array.length() + " elements, got " + elements.size());
                }
                for (final AbiValue element : elements) {
                    out.writeBytes(AbiEncoder.encode(array.element(), element));
                }
            } else if (type instanceof AbiType.TupleType) {
                throw new AbiEncodingException("Cannot pack tuple " + type.canonical());
            } else {
                out.writeBytes(packElementary(type, value));
            }
        }
        return out.toByteArray();
    }

    private static byte[] packElementary(final AbiType type, final AbiValue value) {
        if (type instanceof AbiType.UIntType t) {
            final BigInteger n = AbiEncoder.expect(value, AbiValue.NumberValue.class, type).value();
            AbiEncoder.checkUnsigned(t, n);
            return Bytes.toUnsignedFixed(n, t.bits() / 8);
        }
        if (type instanceof AbiType.IntType t) {
            final BigInteger n = AbiEncoder.expect(value, AbiValue.NumberValue.class, type).value();
            AbiEncoder.checkSigned(t, n);
            final BigInteger twos = n.signum() < 0 ? BigInteger.ONE.shiftLeft(t.bits()).add(n) : n;
            return Bytes.toUnsignedFixed(twos, t.bits() / 8);
        }
        if (type instanceof AbiType.AddressType) {
            return AbiEncoder.expect(value, AbiValue.AddressValue.class, type).value().toBytes();
        }
        if (type instanceof AbiType.BoolType) {
            return new byte[] {AbiEncoder.expect(value, AbiValue.BoolValue.class, type).value() ? (byte) 1 : 0};
        }
        if (type instanceof AbiType.FixedBytesType t) {
            final byte[] raw = AbiEncoder.expect(value, AbiValue.BytesValue.class, type).value();
            if (raw.length != t.size()) {
                throw new AbiEncodingException(t.canonical() + " requires exactly " + t.size() + " bytes, got " + raw.length);
            }
            return raw;
        }
        if (type instanceof AbiType.BytesType) {
            return AbiEncoder.expect(value, AbiValue.BytesValue.class, type).value();
        }
        return AbiEncoder.expect(value, AbiValue.StringValue.class, type).utf8();
    }
}
