// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.model;

import java.util.List;
import sh.tessera.core.error.InvalidTransactionException;
import sh.tessera.core.tx.Eip1559Transaction;
import sh.tessera.core.tx.Eip2930Transaction;
import sh.tessera.core.tx.Eip4844Transaction;
import sh.tessera.core.tx.Eip7702Transaction;
import sh.tessera.core.tx.LegacyTransaction;
import sh.tessera.core.tx.TransactionType;
import sh.tessera.core.tx.UnsignedTransaction;
import sh.tessera.core.tx.auth.Authorization;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;

/**
 * A transaction with optional fields covering all five envelope types.
 *
 * <p>Every field may be {@code null}. Build a request from {@link #empty()} with the
 * {@code with*} methods; each returns a new instance. {@link #toUnsigned()} picks the envelope
 * type and checks that the fields it needs are present:
 *
 * <ol>
 *   <li>an explicit {@link #type()} always wins, and fields of other types are ignored;</li>
 *   <li>otherwise blob fields select EIP-4844, an authorization list EIP-7702, 1559 fee fields
 *       EIP-1559, an access list EIP-2930, and anything else legacy.</li>
 * </ol>
 *
 * Blob fields together with an authorization list, or {@code gasPrice} together with a 1559
 * fee field, are contradictory and rejected.
 *
 * <pre>{@code
 * TransactionRequest request = TransactionRequest.empty()
 *         .withChainId(1L)
 *         .withNonce(0L)
 *         .withGasLimit(21_000L)
 *         .withMaxFeePerGas(Wei.gwei(30))
 *         .withMaxPriorityFeePerGas(Wei.gwei(2))
 *         .withTo(recipient)
 *         .withValue(Wei.fromEther(new BigDecimal("0.1")));
 * }</pre>
 */
public record TransactionRequest(
        TransactionType type,
        Long chainId,
        Long nonce,
        Long gasLimit,
        Address to,
        Wei value,
        HexData data,
        Wei gasPrice,
        Wei maxPriorityFeePerGas,
        Wei maxFeePerGas,
        List<AccessListEntry> accessList,
        Wei maxFeePerBlobGas,
        List<Hash> blobVersionedHashes,
        List<Authorization> authorizationList) {

    private static final TransactionRequest EMPTY = new TransactionRequest(
            null, null, null, null, null, null, null, null, null, null, null, null, null, null);

    public TransactionRequest {
        accessList = accessList == null ? null : List.copyOf(accessList);
        blobVersionedHashes = blobVersionedHashes == null ? null : List.copyOf(blobVersionedHashes);
        authorizationList = authorizationList == null ? null : List.copyOf(authorizationList);
    }

    public static TransactionRequest empty() {
        return EMPTY;
    }

    public TransactionRequest withType(final TransactionType type) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withChainId(final long chainId) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withNonce(final long nonce) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withGasLimit(final long gasLimit) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withTo(final Address to) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withValue(final Wei value) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withData(final HexData data) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withGasPrice(final Wei gasPrice) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withMaxPriorityFeePerGas(final Wei maxPriorityFeePerGas) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withMaxFeePerGas(final Wei maxFeePerGas) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withAccessList(final List<AccessListEntry> accessList) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withMaxFeePerBlobGas(final Wei maxFeePerBlobGas) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withBlobVersionedHashes(final List<Hash> blobVersionedHashes) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    public TransactionRequest withAuthorizationList(final List<Authorization> authorizationList) {
        return new TransactionRequest(type, chainId, nonce, gasLimit, to, value, data, gasPrice,
                maxPriorityFeePerGas, maxFeePerGas, accessList, maxFeePerBlobGas, blobVersionedHashes,
                authorizationList);
    }

    /**
     * The envelope type {@link #toUnsigned()} will produce.
     *
     * @throws InvalidTransactionException if no type is set and the fields point at more than one
     */
    public TransactionType resolveType() {
        if (type != null) {
            return type;
        }
        final boolean blob = maxFeePerBlobGas != null || blobVersionedHashes != null;
        final boolean auth = authorizationList != null;
        final boolean dynamicFee = maxFeePerGas != null || maxPriorityFeePerGas != null;
        if (blob && auth) {
            throw new InvalidTransactionException(
                    "Blob fields and authorizationList cannot be combined in one transaction");
        }
        if (gasPrice != null && dynamicFee) {
            throw new InvalidTransactionException(
                    "gasPrice cannot be combined with maxFeePerGas or maxPriorityFeePerGas");
        }
        if (blob) {
            return TransactionType.EIP4844;
        }
        if (auth) {
            return TransactionType.EIP7702;
        }
        if (dynamicFee) {
            return TransactionType.EIP1559;
        }
        if (accessList != null) {
            return TransactionType.EIP2930;
        }
        return TransactionType.LEGACY;
    }

    /**
     * Resolves the type and builds the matching unsigned transaction. A missing value is zero and
     * missing data is empty.
     *
     * @throws InvalidTransactionException if the fields conflict, a required field is missing, or
     *                                     a field value is invalid for the resolved type
     */
    public UnsignedTransaction toUnsigned() {
        final TransactionType resolved = resolveType();
        final long chain = require(chainId, "chainId", resolved);
        final long nonceValue = require(nonce, "nonce", resolved);
        final long gas = require(gasLimit, "gasLimit", resolved);
        final Wei valueOrZero = value != null ? value : Wei.ZERO;
        final HexData dataOrEmpty = data != null ? data : HexData.EMPTY;
        final List<AccessListEntry> accessListOrEmpty = accessList != null ? accessList : List.of();
        try {
            switch (resolved) {
                case LEGACY:
                    return new LegacyTransaction(chain, nonceValue, require(gasPrice, "gasPrice", resolved),
                            gas, to, valueOrZero, dataOrEmpty);
                case EIP2930:
                    return new Eip2930Transaction(chain, nonceValue, require(gasPrice, "gasPrice", resolved),
                            gas, to, valueOrZero, dataOrEmpty, accessListOrEmpty);
                case EIP1559:
                    return new Eip1559Transaction(chain, nonceValue,
                            require(maxPriorityFeePerGas, "maxPriorityFeePerGas", resolved),
                            require(maxFeePerGas, "maxFeePerGas", resolved),
                            gas, to, valueOrZero, dataOrEmpty, accessListOrEmpty);
                case EIP4844:
                    return new Eip4844Transaction(chain, nonceValue,
                            require(maxPriorityFeePerGas, "maxPriorityFeePerGas", resolved),
                            require(maxFeePerGas, "maxFeePerGas", resolved),
                            gas, require(to, "to", resolved), valueOrZero, dataOrEmpty, accessListOrEmpty,
                            require(maxFeePerBlobGas, "maxFeePerBlobGas", resolved),
                            require(blobVersionedHashes, "blobVersionedHashes", resolved));
                case EIP7702:
                    return new Eip7702Transaction(chain, nonceValue,
                            require(maxPriorityFeePerGas, "maxPriorityFeePerGas", resolved),
                            require(maxFeePerGas, "maxFeePerGas", resolved),
                            gas, require(to, "to", resolved), valueOrZero, dataOrEmpty, accessListOrEmpty,
                            require(authorizationList, "authorizationList", resolved));
                default:
                    throw new IllegalStateException("Unhandled transaction type " + resolved);
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new InvalidTransactionException(
                    "Invalid " + resolved + " transaction: " + e.getMessage(), e);
        }
    }

    private static <T> T require(final T field, final String name, final TransactionType type) {
        if (field == null) {
            throw new InvalidTransactionException(name + " is required for " + type + " transactions");
        }
        return field;
    }

    @Override
    public String toString() {
        return "TransactionRequest{type=" + type + ", chainId=" + chainId + ", nonce=" + nonce
                + ", to=" + to + ", value=" + value + ", gasLimit=" + gasLimit + "}";
    }
}
