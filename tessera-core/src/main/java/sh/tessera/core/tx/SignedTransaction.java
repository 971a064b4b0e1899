// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.util.Arrays;
import java.util.Objects;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.crypto.Secp256k1;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;

/**
 * A signed transaction envelope, as submitted with {@code eth_sendRawTransaction}.
 *
 * <p>{@link #signature()} carries the recovery id as {@code v}; for legacy transactions the
 * EIP-155 {@code v} in {@link #raw()} is derived from it.
 */
public final class SignedTransaction {

    private final UnsignedTransaction transaction;
    private final Signature signature;
    private final byte[] raw;
    private final Hash hash;

    SignedTransaction(
            final UnsignedTransaction transaction, final Signature signature, final byte[] raw, final Hash hash) {
        this.transaction = Objects.requireNonNull(transaction, "transaction");
        this.signature = Objects.requireNonNull(signature, "signature");
        this.raw = Objects.requireNonNull(raw, "raw");
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    public UnsignedTransaction transaction() {
        return transaction;
    }

    public Signature signature() {
        return signature;
    }

    public TransactionType type() {
        return transaction.type();
    }

    /**
     * The signed envelope bytes.
     */
    public byte[] raw() {
        return raw.clone();
    }

    /**
     * The transaction hash: the hash of {@link #raw()}.
     */
    public Hash hash() {
        return hash;
    }

    public String toHex() {
        return Hex.encode(raw);
    }

    /**
     * Recovers the sending address from the signature over the Keccak-256 signing hash.
     *
     * @throws IllegalArgumentException if the signature does not recover to a valid key
     */
    public Address recoverSender() {
        return Secp256k1.recoverAddress(Keccak256.hash(transaction.preimage()), signature);
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof SignedTransaction other && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "SignedTransaction{type=" + type() + ", hash=" + hash + ", size=" + raw.length + "}";
    }
}
