// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.model.AccessListEntry;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpString;

/**
 * EIP-2930 access list transaction (type 0x01): legacy gas pricing plus an access list.
 *
 * <p>Encoded as {@code 0x01 || rlp([chainId, nonce, gasPrice, gasLimit, to, value, data,
 * accessList, yParity, r, s])}.
 */
public record Eip2930Transaction(
        long chainId,
        long nonce,
        Wei gasPrice,
        long gasLimit,
        Address to,
        Wei value,
        HexData data,
        List<AccessListEntry> accessList) implements UnsignedTransaction {

    public Eip2930Transaction {
        TxRlp.requireTypedCommon(chainId, nonce, gasLimit);
        Objects.requireNonNull(gasPrice, "gasPrice cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        accessList = accessList != null ? List.copyOf(accessList) : List.of();
    }

    @Override
    public TransactionType type() {
        return TransactionType.EIP2930;
    }

    @Override
    public byte[] preimage(final long chainId) {
        TxRlp.requireChainId(this.chainId, chainId);
        return TxRlp.typed(type(), fields());
    }

    @Override
    public byte[] envelope(final Signature signature) {
        Objects.requireNonNull(signature, "signature is required");
        final List<RlpItem> items = fields();
        TxRlp.appendSignature(items, signature);
        return TxRlp.typed(type(), items);
    }

    private List<RlpItem> fields() {
        final List<RlpItem> items = new ArrayList<>(11);
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(nonce));
        items.add(TxRlp.wei(gasPrice));
        items.add(RlpString.of(gasLimit));
        items.add(TxRlp.address(to));
        items.add(TxRlp.wei(value));
        items.add(TxRlp.data(data));
        items.add(TxRlp.accessList(accessList));
        return items;
    }
}
