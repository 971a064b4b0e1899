// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.primitives.Hex;

/**
 * A value paired with an {@link AbiType} for encoding, or produced by decoding.
 *
 * <p>The shape mirrors {@code AbiType}: integers of any width are {@link NumberValue}, both
 * {@code bytesN} and {@code bytes} are {@link BytesValue}, and arrays and tuples are
 * {@link ListValue}. Whether a value actually fits its type (tuple arity, fixed array length,
 * integer range, {@code bytesN} length) is checked by the encoder.
 *
 * <pre>{@code
 * List<AbiValue> args = List.of(AbiValue.address(recipient), AbiValue.number(1_000L));
 * }</pre>
 */
public sealed interface AbiValue
        permits AbiValue.AddressValue,
        AbiValue.BoolValue,
        AbiValue.NumberValue,
        AbiValue.BytesValue,
        AbiValue.StringValue,
        AbiValue.ListValue {

    static AddressValue address(final Address address) {
        return new AddressValue(address);
    }

    static AddressValue address(final String address) {
        return new AddressValue(new Address(address));
    }

    static BoolValue bool(final boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static NumberValue number(final long value) {
        return new NumberValue(BigInteger.valueOf(value));
    }

    static NumberValue number(final BigInteger value) {
        return new NumberValue(value);
    }

    static BytesValue bytes(final byte[] value) {
        return new BytesValue(value);
    }

    static StringValue string(final String value) {
        return new StringValue(value);
    }

    static ListValue list(final AbiValue... values) {
        return new ListValue(List.of(values));
    }

    static ListValue list(final List<? extends AbiValue> values) {
        return new ListValue(List.copyOf(values));
    }

    default Address asAddress() {
        throw mismatch(this, "address");
    }

    default boolean asBool() {
        throw mismatch(this, "bool");
    }

    default BigInteger asBigInteger() {
        throw mismatch(this, "number");
    }

    default byte[] asBytes() {
        throw mismatch(this, "bytes");
    }

    default String asString() {
        throw mismatch(this, "string");
    }

    default List<AbiValue> asList() {
        throw mismatch(this, "list");
    }

    private static IllegalStateException mismatch(final AbiValue value, final String wanted) {
        return new IllegalStateException("Expected " + wanted + " value but was " + value);
    }

    /**
     * Coerces a plain Java object into the value shape {@code type} expects.
     *
     * <p>Accepted inputs:
     * <ul>
     *   <li>integers: {@link BigInteger}, {@link Long}, {@link Integer}, {@link Short}, {@link Byte},
     *       decimal strings and {@code 0x} hex strings;</li>
     *   <li>address: {@link Address} or a hex string;</li>
     *   <li>bool: {@link Boolean};</li>
     *   <li>bytes: {@code byte[]}, {@link HexData} or a hex string;</li>
     *   <li>string: {@link String};</li>
     *   <li>arrays and tuples: {@link List} or {@code Object[]} of coercible elements.</li>
     * </ul>
     * Existing {@code AbiValue} instances are returned unchanged.
     *
     * @throws AbiEncodingException if the object cannot represent a value of {@code type}
     */
    static AbiValue from(final AbiType type, final Object value) {
        Objects.requireNonNull(type, "type");
        if (value == null) {
            throw new AbiEncodingException("Null value for " + type.canonical());
        }
        if (value instanceof AbiValue abiValue) {
            return abiValue;
        }
        if (type instanceof AbiType.UIntType || type instanceof AbiType.IntType) {
            return new NumberValue(toBigInteger(type, value));
        }
        if (type instanceof AbiType.AddressType) {
            if (value instanceof Address address) {
                return new AddressValue(address);
            }
            if (value instanceof String s) {
                try {
                    return new AddressValue(new Address(s));
                } catch (IllegalArgumentException e) {
                    throw new AbiEncodingException("Invalid address for " + type.canonical() + ": " + s, e);
                }
            }
        } else if (type instanceof AbiType.BoolType) {
            if (value instanceof Boolean b) {
                return bool(b);
            }
        } else if (type instanceof AbiType.FixedBytesType || type instanceof AbiType.BytesType) {
            if (value instanceof byte[] raw) {
                return new BytesValue(raw);
            }
            if (value instanceof HexData data) {
                return new BytesValue(data.toBytes());
            }
            if (value instanceof String s) {
                try {
                    return new BytesValue(Hex.decode(s));
                } catch (IllegalArgumentException e) {
                    throw new AbiEncodingException("Invalid hex for " + type.canonical() + ": " + s, e);
                }
            }
        } else if (type instanceof AbiType.StringType) {
            if (value instanceof String s) {
                return new StringValue(s);
            }
        } else if (type instanceof AbiType.ArrayType array) {
            final List<?> elements = asJavaList(value);
            if (elements != null) {
                final List<AbiValue> converted = new ArrayList<>(elements.size());
                for (final Object element : elements) {
                    converted.add(from(array.element(), element));
                }
                return new ListValue(converted);
            }
        } else if (type instanceof AbiType.TupleType tuple) {
            final List<?> elements = asJavaList(value);
            if (elements != null) {
                if (elements.size() != tuple.components().size()) {
                    throw new AbiEncodingException("Tuple " + tuple.canonical() + " expects "
                            + tuple.components().size() + " components, got " + elements.size());
                }
                final List<AbiValue> converted = new ArrayList<>(elements.size());
                for (int i = 0; i < elements.size(); i++) {
                    converted.add(from(tuple.components().get(i), elements.get(i)));
                }
                return new ListValue(converted);
            }
        }
        throw new AbiEncodingException(
                "Cannot convert " + value.getClass().getSimpleName() + " to " + type.canonical());
    }

    private static List<?> asJavaList(final Object value) {
        if (value instanceof List<?> list) {
            return list;
        }
        if (value instanceof Object[] array) {
            return Arrays.asList(array);
        }
        return null;
    }

    private static BigInteger toBigInteger(final AbiType type, final Object value) {
        if (value instanceof BigInteger big) {
            return big;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof String s) {
            try {
                return Hex.hasPrefix(s) ? new BigInteger(Hex.cleanPrefix(s), 16) : new BigInteger(s);
            } catch (NumberFormatException e) {
                throw new AbiEncodingException("Invalid number for " + type.canonical() + ": " + s, e);
            }
        }
        throw new AbiEncodingException(
                "Cannot convert " + value.getClass().getSimpleName() + " to " + type.canonical());
    }

    record AddressValue(Address value) implements AbiValue {
        public AddressValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Address asAddress() {
            return value;
        }
    }

    record BoolValue(boolean value) implements AbiValue {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        @Override
        public boolean asBool() {
            return value;
        }
    }

    /**
     * Any {@code intN} or {@code uintN} value.
     */
    record NumberValue(BigInteger value) implements AbiValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public BigInteger asBigInteger() {
            return value;
        }
    }

    /**
     * Content of {@code bytesN} or {@code bytes}. The array is copied on the way in and out.
     */
    record BytesValue(byte[] value) implements AbiValue {
        public BytesValue {
            value = Objects.requireNonNull(value, "value").clone();
        }

        @Override
        public byte[] value() {
            return value.clone();
        }

        @Override
        public byte[] asBytes() {
            return value.clone();
        }

        int length() {
            return value.length;
        }

        byte[] unsafeBytes() {
            return value;
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof BytesValue other && Arrays.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return "BytesValue[" + Hex.encode(value) + "]";
        }
    }

    record StringValue(String value) implements AbiValue {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asString() {
            return value;
        }

        byte[] utf8() {
            return value.getBytes(StandardCharsets.UTF_8);
        }
    }

    /**
     * Elements of an array or components of a tuple.
     */
    record ListValue(List<AbiValue> values) implements AbiValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public List<AbiValue> asList() {
            return values;
        }
    }
}
