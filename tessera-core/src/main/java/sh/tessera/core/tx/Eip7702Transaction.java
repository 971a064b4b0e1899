// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.model.AccessListEntry;
import sh.tessera.core.tx.auth.Authorization;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpString;

/**
 * EIP-7702 set-code transaction (type 0x04).
 *
 * <p>Encoded as {@code 0x04 || rlp([chainId, nonce, maxPriorityFeePerGas, maxFeePerGas, gasLimit,
 * to, value, data, accessList, authorizationList, yParity, r, s])}, where each authorization is
 * {@code [chainId, address, nonce, yParity, r, s]}.
 */
public record Eip7702Transaction(
        long chainId,
        long nonce,
        Wei maxPriorityFeePerGas,
        Wei maxFeePerGas,
        long gasLimit,
        Address to,
        Wei value,
        HexData data,
        List<AccessListEntry> accessList,
        List<Authorization> authorizationList) implements UnsignedTransaction {

    public Eip7702Transaction {
        TxRlp.requireTypedCommon(chainId, nonce, gasLimit);
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas cannot be null");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas cannot be null");
        Objects.requireNonNull(to, "to address is required for EIP-7702 transactions");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(authorizationList, "authorizationList cannot be null");
        if (authorizationList.isEmpty()) {
            throw new IllegalArgumentException("authorizationList must not be empty");
        }
        for (int i = 0; i < authorizationList.size(); i++) {
            final Authorization authorization = authorizationList.get(i);
            if (authorization == null || !authorization.isSigned()) {
                throw new IllegalArgumentException("authorizationList[" + i + "] must be signed");
            }
        }
        accessList = accessList != null ? List.copyOf(accessList) : List.of();
        authorizationList = List.copyOf(authorizationList);
    }

    @Override
    public TransactionType type() {
        return TransactionType.EIP7702;
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
        final List<RlpItem> items = new ArrayList<>(13);
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(nonce));
        items.add(TxRlp.wei(maxPriorityFeePerGas));
        items.add(TxRlp.wei(maxFeePerGas));
        items.add(RlpString.of(gasLimit));
        items.add(TxRlp.address(to));
        items.add(TxRlp.wei(value));
        items.add(TxRlp.data(data));
        items.add(TxRlp.accessList(accessList));
        items.add(TxRlp.authorizations(authorizationList));
        return items;
    }
}
