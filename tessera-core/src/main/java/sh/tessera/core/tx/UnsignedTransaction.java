// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import sh.tessera.core.crypto.Signature;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;

/**
 * A fully populated transaction, ready to be hashed and signed.
 *
 * <p>Instances are usually produced by
 * {@link sh.tessera.core.model.TransactionRequest#toUnsigned()} or read back by
 * {@link TransactionDecoder}. Each record knows its own RLP field order:
 * {@link #preimage(long)} gives the bytes whose Keccak-256 hash is signed, and
 * {@link #envelope(Signature)} the signed bytes broadcast with {@code eth_sendRawTransaction}.
 */
public sealed interface UnsignedTransaction
        permits LegacyTransaction, Eip2930Transaction, Eip1559Transaction, Eip4844Transaction, Eip7702Transaction {

    TransactionType type();

    long chainId();

    long nonce();

    long gasLimit();

    /**
     * Recipient, or {@code null} for contract creation.
     */
    Address to();

    Wei value();

    HexData data();

    /**
     * Signing payload for {@code chainId}.
     *
     * @throws IllegalArgumentException if {@code chainId} differs from {@link #chainId()}
     */
    byte[] preimage(long chainId);

    default byte[] preimage() {
        return preimage(chainId());
    }

    /**
     * Signed encoding. Only the recovery id of {@code signature} is used, so {@code v} may be
     * given as 0/1, 27/28 or in EIP-155 form.
     */
    byte[] envelope(Signature signature);
}
