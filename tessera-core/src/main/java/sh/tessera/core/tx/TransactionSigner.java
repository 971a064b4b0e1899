// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import sh.tessera.core.DebugLogger;
import sh.tessera.core.crypto.HashFunction;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.Signer;
import sh.tessera.core.crypto.Signers;
import sh.tessera.core.error.InvalidTransactionException;
import sh.tessera.core.error.SigningException;
import sh.tessera.core.model.TransactionRequest;
import sh.tessera.core.types.Hash;

/**
 * Signs transactions of all five types through a {@link Signer}.
 *
 * <p>The preimage of the unsigned transaction is hashed with the configured
 * {@link HashFunction}, the digest is handed to the signer, and the returned signature is
 * checked before the envelope is assembled. An envelope is never produced from a failed or
 * partial signature.
 *
 * <pre>{@code
 * TransactionSigner signer = new TransactionSigner(new PrivateKeySigner(key));
 * SignedTransaction signed = signer.sign(request);
 * String raw = signed.toHex();
 * }</pre>
 */
public final class TransactionSigner {

    private final Signer signer;
    private final HashFunction hash;

    public TransactionSigner(final Signer signer) {
        this(signer, HashFunction.keccak256());
    }

    public TransactionSigner(final Signer signer, final HashFunction hash) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    public Signer signer() {
        return signer;
    }

    /**
     * @throws InvalidTransactionException if the request's fields conflict or are incomplete
     * @throws SigningException            if the signer fails
     */
    public SignedTransaction sign(final TransactionRequest request) {
        return sign(Objects.requireNonNull(request, "request").toUnsigned());
    }

    /**
     * @throws SigningException if the signer fails or returns an incomplete signature
     */
    public SignedTransaction sign(final UnsignedTransaction transaction) {
        Objects.requireNonNull(transaction, "transaction");
        final Signature signature = Signers.sign(signer, signingHash(transaction));
        return assemble(transaction, signature);
    }

    /**
     * Signs through {@link Signer#signHashAsync(byte[])}. Request validation happens on the
     * calling thread; signer failures, timeouts and cancellation complete the future with a
     * {@link SigningException}.
     */
    public CompletableFuture<SignedTransaction> signAsync(final TransactionRequest request, final Duration timeout) {
        return signAsync(Objects.requireNonNull(request, "request").toUnsigned(), timeout);
    }

    public CompletableFuture<SignedTransaction> signAsync(
            final UnsignedTransaction transaction, final Duration timeout) {
        Objects.requireNonNull(transaction, "transaction");
        return Signers.signAsync(signer, signingHash(transaction), timeout)
                .thenApply(signature -> assemble(transaction, signature));
    }

    /**
     * The digest the signer is asked to sign.
     */
    public byte[] signingHash(final UnsignedTransaction transaction) {
        return hash.hash(transaction.preimage());
    }

    private SignedTransaction assemble(final UnsignedTransaction transaction, final Signature signature) {
        final byte[] raw = transaction.envelope(signature);
        final Hash txHash = Hash.fromBytes(hash.hash(raw));
        DebugLogger.logSign("[SIGN] type=%s hash=%s size=%d", transaction.type(), txHash, raw.length);
        return new SignedTransaction(transaction, signature, raw, txHash);
    }
}
