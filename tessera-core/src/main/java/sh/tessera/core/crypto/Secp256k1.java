// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Bytes;

/**
 * secp256k1 signing and public-key recovery on BouncyCastle's curve arithmetic.
 *
 * <p>Nonces are derived per RFC 6979 (HMAC-SHA256), so signing is deterministic. Signatures are
 * normalized to low-s (EIP-2) and the recovery id is flipped accordingly.
 */
public final class Secp256k1 {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(), CURVE_PARAMS.getG(), CURVE_PARAMS.getN(), CURVE_PARAMS.getH());

    /** Order of the base point. */
    public static final BigInteger CURVE_ORDER = CURVE.getN();
    public static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private Secp256k1() {
    }

    /**
     * Signs a 32-byte digest.
     *
     * @param messageHash the digest
     * @param privateKey  the scalar key, in {@code [1, n)}
     * @return a low-s signature whose {@code v} is the recovery id (0 or 1)
     */
    public static Signature sign(final byte[] messageHash, final BigInteger privateKey) {
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(CURVE_ORDER, privateKey, messageHash);
        final BigInteger z = new BigInteger(1, messageHash);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(CURVE_ORDER);
            if (r.signum() == 0) {
                continue;
            }
            BigInteger s = k.modInverse(CURVE_ORDER).multiply(z.add(r.multiply(privateKey))).mod(CURVE_ORDER);
            if (s.signum() == 0) {
                continue;
            }
            int recoveryId = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                // n - s corresponds to -R, whose y has the opposite parity
                s = CURVE_ORDER.subtract(s);
                recoveryId ^= 1;
            }
            return Signature.of(r, s, recoveryId);
        }
    }

    /**
     * Computes the public point for a private scalar.
     */
    static ECPoint publicPoint(final BigInteger privateKey) {
        return MULTIPLIER.multiply(CURVE.getG(), privateKey).normalize();
    }

    /**
     * Derives the address of a public point: the last 20 bytes of the Keccak-256 of its
     * uncompressed encoding without the {@code 0x04} tag.
     */
    static Address toAddress(final ECPoint publicKey) {
        final byte[] encoded = publicKey.getEncoded(false);
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    /**
     * Recovers the signer address of a 32-byte digest.
     *
     * @param messageHash the signed digest
     * @param signature   the signature; its recovery id is taken from {@link Signature#recoveryId()}
     * @return the signer's address
     * @throws IllegalArgumentException if the signature does not recover to a valid point
     */
    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final ECPoint q = recoverPublicKey(
                signature.rAsBigInteger(), signature.sAsBigInteger(), messageHash, signature.recoveryId());
        if (q == null) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return toAddress(q);
    }

    private static ECPoint recoverPublicKey(
            final BigInteger r, final BigInteger s, final byte[] messageHash, final int recoveryId) {
        if (r.signum() <= 0 || s.signum() <= 0 || r.compareTo(CURVE_ORDER) >= 0 || s.compareTo(CURVE_ORDER) >= 0) {
            return null;
        }
        final ECPoint rPoint = decompress(r, (recoveryId & 1) == 1);
        if (rPoint == null || !rPoint.multiply(CURVE_ORDER).isInfinity()) {
            return null;
        }
        // Q = r^-1 (sR - eG)
        final BigInteger e = new BigInteger(1, messageHash);
        final BigInteger rInv = r.modInverse(CURVE_ORDER);
        final BigInteger sr = rInv.multiply(s).mod(CURVE_ORDER);
        final BigInteger er = rInv.multiply(e).mod(CURVE_ORDER);
        final ECPoint q = rPoint.multiply(sr).subtract(CURVE.getG().multiply(er)).normalize();
        return q.isInfinity() ? null : q;
    }

    private static ECPoint decompress(final BigInteger x, final boolean odd) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (odd ? 0x03 : 0x02);
        final byte[] xBytes = Bytes.toUnsignedFixed(x, 32);
        System.arraycopy(xBytes, 0, encoded, 1, 32);
        try {
            final ECPoint point = CURVE.getCurve().decodePoint(encoded);
            return point.isValid() ? point : null;
        } catch (IllegalArgumentException e) {
            // x is not on the curve
            return null;
        }
    }
}
