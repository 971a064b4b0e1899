// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import javax.security.auth.Destroyable;
import org.bouncycastle.math.ec.ECPoint;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Hex;

/**
 * An in-memory secp256k1 private key.
 *
 * <p>The input byte array is zeroed after parsing. {@link #destroy()} drops the scalar; any later
 * use fails with {@link IllegalStateException}.
 */
public final class PrivateKey implements Destroyable {

    private static final int KEY_SIZE = 32;

    private BigInteger scalar;
    private ECPoint publicKey;
    private volatile boolean destroyed;

    private PrivateKey(final byte[] keyBytes) {
        try {
            if (keyBytes.length != KEY_SIZE) {
                throw new IllegalArgumentException("Private key must be " + KEY_SIZE + " bytes, got " + keyBytes.length);
            }
            final BigInteger value = new BigInteger(1, keyBytes);
            if (value.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (value.compareTo(Secp256k1.CURVE_ORDER) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.scalar = value;
            this.publicKey = Secp256k1.publicPoint(value);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    public static PrivateKey fromHex(final String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hex));
    }

    /**
     * Parses a raw 32-byte key. The given array is zeroed.
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    public synchronized Address toAddress() {
        checkNotDestroyed();
        return Secp256k1.toAddress(publicKey);
    }

    /**
     * Signs a 32-byte digest deterministically.
     *
     * @return a signature whose {@code v} is the recovery id
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = scalar;
        }
        return Secp256k1.sign(messageHash, key);
    }

    @Override
    public synchronized void destroy() {
        destroyed = true;
        scalar = null;
        publicKey = null;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    @Override
    public String toString() {
        return destroyed ? "PrivateKey[destroyed]" : "PrivateKey[address=" + toAddress() + "]";
    }
}
