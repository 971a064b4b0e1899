// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.model.AccessListEntry;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpString;

/**
 * EIP-4844 blob transaction (type 0x03), without its network sidecar.
 *
 * <p>Encoded as {@code 0x03 || rlp([chainId, nonce, maxPriorityFeePerGas, maxFeePerGas, gasLimit,
 * to, value, data, accessList, maxFeePerBlobGas, blobVersionedHashes, yParity, r, s])}. Blob
 * transactions cannot create contracts, so {@code to} is required.
 */
public record Eip4844Transaction(
        long chainId,
        long nonce,
        Wei maxPriorityFeePerGas,
        Wei maxFeePerGas,
        long gasLimit,
        Address to,
        Wei value,
        HexData data,
        List<AccessListEntry> accessList,
        Wei maxFeePerBlobGas,
        List<Hash> blobVersionedHashes) implements UnsignedTransaction {

    /** KZG commitment version byte that every versioned hash starts with. */
    public static final int VERSIONED_HASH_VERSION_KZG = 0x01;

    private static final int MIN_BLOB_HASHES = 1;
    private static final int MAX_BLOB_HASHES = 6;

    public Eip4844Transaction {
        TxRlp.requireTypedCommon(chainId, nonce, gasLimit);
        Objects.requireNonNull(maxPriorityFeePerGas, "maxPriorityFeePerGas cannot be null");
        Objects.requireNonNull(maxFeePerGas, "maxFeePerGas cannot be null");
        Objects.requireNonNull(to, "to address is required for EIP-4844 transactions");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(maxFeePerBlobGas, "maxFeePerBlobGas cannot be null");
        Objects.requireNonNull(blobVersionedHashes, "blobVersionedHashes cannot be null");
        if (blobVersionedHashes.size() < MIN_BLOB_HASHES || blobVersionedHashes.size() > MAX_BLOB_HASHES) {
            throw new IllegalArgumentException(
                    "blobVersionedHashes must contain " + MIN_BLOB_HASHES + "-" + MAX_BLOB_HASHES
                            + " hashes, got " + blobVersionedHashes.size());
        }
        for (int i = 0; i < blobVersionedHashes.size(); i++) {
            final Hash hash = blobVersionedHashes.get(i);
            if (hash == null) {
                throw new IllegalArgumentException("blobVersionedHashes[" + i + "] cannot be null");
            }
            if (hash.toBytes()[0] != VERSIONED_HASH_VERSION_KZG) {
                throw new IllegalArgumentException(
                        "blobVersionedHashes[" + i + "] must start with version byte 0x01: " + hash);
            }
        }
        accessList = accessList != null ? List.copyOf(accessList) : List.of();
        blobVersionedHashes = List.copyOf(blobVersionedHashes);
    }

    @Override
    public TransactionType type() {
        return TransactionType.EIP4844;
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
        final List<RlpItem> items = new ArrayList<>(14);
        items.add(RlpString.of(chainId));
        items.add(RlpString.of(nonce));
        items.add(TxRlp.wei(maxPriorityFeePerGas));
        items.add(TxRlp.wei(maxFeePerGas));
        items.add(RlpString.of(gasLimit));
        items.add(TxRlp.address(to));
        items.add(TxRlp.wei(value));
        items.add(TxRlp.data(data));
        items.add(TxRlp.accessList(accessList));
        items.add(TxRlp.wei(maxFeePerBlobGas));
        items.add(TxRlp.hashes(blobVersionedHashes));
        return items;
    }
}
