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
 * EIP-1559 dynamic fee transaction (type 0x02).
 *
 * <p>Encoded as {@code 0x02 || rlp([chainId, nonce, maxPriorityFeePerGas, maxFeePerGas,
 * gasLimit, to, value, data, accessList, yParity, r, s])}.
 */
public record Eip1559Transaction(
        long chainId,
        long nonce,
        Wei maxPriorityFeePerGas,
        Wei maxFeePerGas,
        long gasLimit,
        Address to,
        Wei value,
        HexData data,
        List<AccessListEntry> accessList) implements UnsignedTransaction {

    public Eip1559Transaction {
        TxRlp.requireTypedCommon(chainId, nonce, gasLimit);
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas cannot be null");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas cannot be null");
        // to can be null for contract creation
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        accessList = accessList != null ? List.copyOf(accessList) : List.of();
    }

    @Override
    public TransactionType type() {
        return TransactionType.EIP1559;
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
        final List<RlpItem> items = new ArrayList<>(12);
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(nonce));
        items.add(TxRlp.wei(maxPriorityFeePerGas));
        items.add(TxRlp.wei(maxFeePerGas));
        items.add(RlpString.of(gasLimit));
        items.add(TxRlp.address(to));
        items.add(TxRlp.wei(value));
        items.add(TxRlp.data(data));
        items.add(TxRlp.accessList(accessList));
        return items;
    }
}
