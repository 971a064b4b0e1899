// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx.auth;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Bytes;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpList;
import sh.tessera.primitives.rlp.RlpString;

/**
 * An EIP-7702 authorization: the signing account delegates its code to {@code address}.
 *
 * <p>A chain id of zero makes the authorization valid on every chain. Delegating to the zero
 * address clears an existing delegation (see {@link #revocation(long, long)}).
 *
 * <p>Values are immutable. An unsigned authorization has no {@code yParity}, {@code r} or
 * {@code s}; {@link AuthorizationSigner} returns a new signed copy.
 *
 * @param chainId  chain the authorization is valid on, or 0 for any chain
 * @param address  delegate contract
 * @param nonce    the signing account's nonce at the time the authorization is processed
 * @param yParity  signature recovery id, {@code null} when unsigned
 * @param r        signature r, {@code null} when unsigned
 * @param s        signature s, {@code null} when unsigned
 * @see <a href="https://eips.ethereum.org/EIPS/eip-7702">EIP-7702</a>
 */
public record Authorization(
        long chainId, Address address, long nonce, Integer yParity, BigInteger r, BigInteger s) {

    /** Domain byte that prefixes the signing payload. */
    public static final int MAGIC = 0x05;

    public Authorization {
        if (chainId < 0) {
            throw new IllegalArgumentException("chainId cannot be negative");
        }
        Objects.requireNonNull(address, "address");
        if (nonce < 0) {
            throw new IllegalArgumentException("nonce cannot be negative");
        }
        final boolean anySet = yParity != null || r != null || s != null;
        final boolean allSet = yParity != null && r != null && s != null;
        if (anySet && !allSet) {
            throw new IllegalArgumentException("yParity, r and s must be given together");
        }
    }

    public static Authorization unsigned(final long chainId, final Address address, final long nonce) {
        return new Authorization(chainId, address, nonce, null, null, null);
    }

    /**
     * An unsigned authorization that delegates to the zero address, removing any delegation.
     */
    public static Authorization revocation(final long chainId, final long nonce) {
        return unsigned(chainId, Address.ZERO, nonce);
    }

    public boolean isSigned() {
        return yParity != null;
    }

    public boolean isRevocation() {
        return address.isZero();
    }

    /**
     * A copy carrying {@code signature}; its recovery id becomes {@code yParity}.
     */
    public Authorization withSignature(final Signature signature) {
        Objects.requireNonNull(signature, "signature");
        return new Authorization(
                chainId, address, nonce, signature.recoveryId(), signature.rAsBigInteger(), signature.sAsBigInteger());
    }

    /**
     * The signature as a {@link Signature} with {@code v = yParity}.
     *
     * @throws IllegalStateException if unsigned
     */
    public Signature signature() {
        requireSigned();
        return Signature.of(r, s, yParity);
    }

    /**
     * Bytes hashed for signing: {@code 0x05 || chainId (32 bytes) || address (20 bytes) || nonce (32 bytes)}.
     */
    public byte[] preimage() {
        return Bytes.prepend(MAGIC, Bytes.concat(
                Bytes.toUnsigned32(chainId), address.toBytes(), Bytes.toUnsigned32(nonce)));
    }

    /**
     * The {@code [chainId, address, nonce, yParity, r, s]} tuple embedded in an
     * {@code authorizationList}.
     *
     * @throws IllegalStateException if unsigned
     */
    public RlpList toRlp() {
        requireSigned();
        return RlpList.of(
                RlpString.of(chainId),
                RlpString.of(address.toBytes()),
                RlpString.of(nonce),
                RlpString.of(yParity.longValue()),
                RlpString.of(r),
                RlpString.of(s));
    }

    /**
     * Reads the tuple produced by {@link #toRlp()}.
     *
     * @throws IllegalArgumentException if the item is not a well-formed 6-tuple
     */
    public static Authorization fromRlp(final RlpItem item) {
        if (!(item instanceof RlpList list) || list.size() != 6) {
            throw new IllegalArgumentException("Authorization must be an RLP list of 6 items");
        }
        final List<RlpItem> fields = list.items();
        final long yParity = string(fields.get(3), "yParity").asLong();
        if (yParity > 1) {
            throw new IllegalArgumentException("Authorization yParity must be 0 or 1, got " + yParity);
        }
        return new Authorization(
                string(fields.get(0), "chainId").asLong(),
                Address.fromBytes(string(fields.get(1), "address").bytes()),
                string(fields.get(2), "nonce").asLong(),
                (int) yParity,
                string(fields.get(4), "r").asBigInteger(),
                string(fields.get(5), "s").asBigInteger());
    }

    private static RlpString string(final RlpItem item, final String field) {
        if (item instanceof RlpString str) {
            return str;
        }
        throw new IllegalArgumentException("Authorization field '" + field + "' must be an RLP string");
    }

    private void requireSigned() {
        if (!isSigned()) {
            throw new IllegalStateException("Authorization is not signed");
        }
    }
}
