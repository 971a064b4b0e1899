// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import sh.tessera.primitives.Bytes;
import sh.tessera.primitives.Hex;

/**
 * An secp256k1 signature with 32-byte {@code r} and {@code s}.
 *
 * <p>{@code v} is whatever the producer supplied: a bare recovery id (0 or 1, as returned by
 * {@link Signer#signHash(byte[])} and used as {@code yParity} by typed transactions), a pre-EIP-155
 * value (27 or 28), or an EIP-155 value ({@code chainId * 2 + 35 + recoveryId}).
 *
 * @param r the r component
 * @param s the s component
 * @param v the recovery value
 */
public record Signature(byte[] r, byte[] s, int v) {

    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }
        if (v < 0) {
            throw new IllegalArgumentException("v must be non-negative, got " + v);
        }
        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Builds a signature from integer components.
     *
     * @throws IllegalArgumentException if r or s is negative or wider than 32 bytes
     */
    public static Signature of(final BigInteger r, final BigInteger s, final int v) {
        return new Signature(Bytes.toUnsignedFixed(r, 32), Bytes.toUnsignedFixed(s, 32), v);
    }

    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    public BigInteger rAsBigInteger() {
        return new BigInteger(1, r);
    }

    public BigInteger sAsBigInteger() {
        return new BigInteger(1, s);
    }

    /**
     * Derives the recovery id (0 or 1) from {@code v} in any of the three supported forms.
     */
    public int recoveryId() {
        if (v == 0 || v == 1) {
            return v;
        }
        if (v == 27 || v == 28) {
            return v - 27;
        }
        if (v >= 35) {
            return (v - 35) & 1;
        }
        throw new IllegalArgumentException("Cannot derive recovery id from v=" + v);
    }

    /**
     * Returns a copy of this signature with {@code v} replaced.
     */
    public Signature withV(final int newV) {
        return new Signature(r, s, newV);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Signature other)) {
            return false;
        }
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + abbreviate(r) + ", s=" + abbreviate(s) + ", v=" + v + "]";
    }

    private static String abbreviate(final byte[] bytes) {
        return Hex.encodeNoPrefix(Arrays.copyOf(bytes, MAX_BYTES_TO_DISPLAY)) + "...";
    }
}
