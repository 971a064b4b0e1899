// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-width byte helpers shared by the ABI and transaction codecs.
 *
 * @since 0.1.0
 */
public final class Bytes {

    private Bytes() {
        // Utility class
    }

    /**
     * Unsigned big-endian encoding of {@code value}, left-padded with zeros to {@code width} bytes.
     *
     * @throws IllegalArgumentException if the value is negative or needs more than {@code width} bytes
     */
    public static byte[] toUnsignedFixed(final BigInteger value, final int width) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("value must be non-negative: " + value);
        }
        if (value.bitLength() > width * 8) {
            throw new IllegalArgumentException("value does not fit in " + width + " bytes: " + value);
        }
        final byte[] raw = value.toByteArray();
        final byte[] out = new byte[width];
        final int copy = Math.min(raw.length, width);
        System.arraycopy(raw, raw.length - copy, out, width - copy, copy);
        return out;
    }

    /**
     * Unsigned 32-byte big-endian encoding of a non-negative long.
     */
    public static byte[] toUnsigned32(final long value) {
        return toUnsignedFixed(BigInteger.valueOf(value), 32);
    }

    /**
     * Concatenates the given arrays.
     */
    public static byte[] concat(final byte[]... parts) {
        int length = 0;
        for (final byte[] part : parts) {
            length = Math.addExact(length, Objects.requireNonNull(part, "part cannot be null").length);
        }
        final byte[] out = new byte[length];
        int offset = 0;
        for (final byte[] part : parts) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }
        return out;
    }

    /**
     * Returns {@code data} preceded by a single prefix byte.
     */
    public static byte[] prepend(final int prefix, final byte[] data) {
        final byte[] out = new byte[data.length + 1];
        out[0] = (byte) prefix;
        System.arraycopy(data, 0, out, 1, data.length);
        return out;
    }
}
