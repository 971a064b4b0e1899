// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.rlp.Rlp;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpString;

/**
 * Legacy transaction with EIP-155 replay protection.
 *
 * <p>The signing payload is {@code rlp([nonce, gasPrice, gasLimit, to, value, data, chainId, 0, 0])}
 * and the envelope replaces the last three fields with {@code v = chainId * 2 + 35 + recoveryId},
 * {@code r} and {@code s}. A chain id of 0 denotes a pre-EIP-155 transaction: six fields are
 * signed and {@code v = 27 + recoveryId}.
 */
public record LegacyTransaction(
        long chainId,
        long nonce,
        Wei gasPrice,
        long gasLimit,
        Address to,
        Wei value,
        HexData data) implements UnsignedTransaction {

    public LegacyTransaction {
        if (chainId < 0) {
            throw new IllegalArgumentException("Chain ID cannot be negative");
        }
        TxRlp.requireCommon(nonce, gasLimit);
        Objects.requireNonNull(gasPrice, "gasPrice cannot be null");
        // to can be null for contract creation
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
    }

    @Override
    public TransactionType type() {
        return TransactionType.LEGACY;
    }

    @Override
    public byte[] preimage(final long chainId) {
        TxRlp.requireChainId(this.chainId, chainId);
        final List<RlpItem> items = baseFields();
        if (chainId > 0) {
            items.add(RlpString.of(chainId));
            items.add(RlpString.of(0L));
            items.add(RlpString.of(0L));
        }
        return Rlp.encodeList(items);
    }

    @Override
    public byte[] envelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        final List<RlpItem> items = baseFields();
        items.add(RlpString.of(v(signature.recoveryId())));
        items.add(RlpString.of(signature.rAsBigInteger()));
        items.add(RlpString.of(signature.sAsBigInteger()));
        return Rlp.encodeList(items);
    }

    /**
     * The envelope {@code v} for the given recovery id.
     */
    public long v(final int recoveryId) {
        if (chainId == 0) {
            return 27L + recoveryId;
        }
        return Math.addExact(Math.multiplyExact(chainId, 2L), 35L + recoveryId);
    }

    private List<RlpItem> baseFields() {
        final List<RlpItem> items = new ArrayList<>(9);
        items.add(RlpString.of(nonce));
        items.add(TxRlp.wei(gasPrice));
        items.add(RlpString.of(gasLimit));
        items.add(TxRlp.address(to));
        items.add(TxRlp.wei(value));
        items.add(TxRlp.data(data));
        return items;
    }
}
