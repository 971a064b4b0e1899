// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Scalar helpers for RLP: non-negative integers are written as minimal big-endian strings,
 * with zero as the empty string ({@code 0x80}).
 */
public final class RlpNumeric {

    private RlpNumeric() {
        // Utility class
    }

    /**
     * Encodes a non-negative long straight to RLP bytes.
     */
    public static byte[] encodeLongUnsigned(final long value) {
        return encodeLongUnsignedItem(value).encode();
    }

    public static RlpItem encodeLongUnsignedItem(final long value) {
        if (value < 0L) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative: " + value);
        }
        if (value == 0L) {
            return RlpString.empty();
        }
        final int size = (64 - Long.numberOfLeadingZeros(value) + 7) >>> 3;
        final byte[] raw = new byte[size];
        long tmp = value;
        for (int i = size - 1; i >= 0; i--) {
            raw[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return new RlpString(raw);
    }

    /**
     * Encodes a non-negative integer straight to RLP bytes.
     */
    public static byte[] encodeBigIntegerUnsigned(final BigInteger value) {
        return encodeBigIntegerUnsignedItem(value).encode();
    }

    public static RlpItem encodeBigIntegerUnsignedItem(final BigInteger value) {
        return new RlpString(toMinimalBytes(value));
    }

    /**
     * Minimal unsigned big-endian bytes of {@code value}; empty for zero.
     */
    public static byte[] toMinimalBytes(final BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("RLP numeric values must be non-negative: " + value);
        }
        if (value.signum() == 0) {
            return new byte[0];
        }
        final byte[] twos = value.toByteArray();
        if (twos[0] != 0) {
            return twos;
        }
        final byte[] raw = new byte[twos.length - 1];
        System.arraycopy(twos, 1, raw, 0, raw.length);
        return raw;
    }
}
