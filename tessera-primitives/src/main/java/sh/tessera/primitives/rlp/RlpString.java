// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import sh.tessera.primitives.Hex;

/**
 * RLP byte-string node.
 *
 * <p>The package-private constructor wraps the array without copying; it is used by the decoder
 * and the numeric helpers, which hand over ownership of freshly built arrays. Public factories copy.
 */
public final class RlpString implements RlpItem {

    private static final byte[] EMPTY = new byte[0];

    private final byte[] bytes;

    RlpString(final byte[] bytes) {
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
    }

    public static RlpString of(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new RlpString(Arrays.copyOf(bytes, bytes.length));
    }

    public static RlpString of(final String hex) {
        return new RlpString(Hex.decode(hex));
    }

    /**
     * Minimal big-endian encoding of a non-negative long; zero becomes the empty string.
     */
    public static RlpString of(final long value) {
        return (RlpString) RlpNumeric.encodeLongUnsignedItem(value);
    }

    /**
     * Minimal big-endian encoding of a non-negative integer; zero becomes the empty string.
     */
    public static RlpString of(final BigInteger value) {
        return (RlpString) RlpNumeric.encodeBigIntegerUnsignedItem(value);
    }

    static RlpString empty() {
        return new RlpString(EMPTY);
    }

    /**
     * Returns a copy of the raw content.
     */
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Interprets the content as an unsigned big-endian scalar.
     *
     * @throws IllegalArgumentException if the content has a leading zero byte
     */
    public BigInteger asBigInteger() {
        if (bytes.length == 0) {
            return BigInteger.ZERO;
        }
        if (bytes[0] == 0) {
            throw new IllegalArgumentException("RLP scalar has leading zero bytes: " + Hex.encode(bytes));
        }
        return new BigInteger(1, bytes);
    }

    /**
     * Interprets the content as an unsigned scalar that fits in a signed long.
     *
     * @throws IllegalArgumentException if the value is non-canonical or does not fit
     */
    public long asLong() {
        final BigInteger value = asBigInteger();
        if (value.bitLength() > 63) {
            throw new IllegalArgumentException("RLP scalar does not fit in a long: " + value);
        }
        return value.longValueExact();
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeString(bytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RlpString other)) {
            return false;
        }
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RlpString[" + Hex.encode(bytes) + "]";
    }
}
