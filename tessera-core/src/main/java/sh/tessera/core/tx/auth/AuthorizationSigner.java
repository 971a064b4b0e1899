// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx.auth;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import sh.tessera.core.DebugLogger;
import sh.tessera.core.crypto.HashFunction;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.Signer;
import sh.tessera.core.crypto.Signers;
import sh.tessera.core.error.SigningException;
import sh.tessera.core.types.Address;

/**
 * Signs EIP-7702 authorizations.
 *
 * <p>The digest is the hash of {@link Authorization#preimage()}. Signing never modifies its
 * input: a new {@link Authorization} carrying {@code yParity}, {@code r} and {@code s} is
 * returned. Already-signed authorizations are re-signed by this signer.
 */
public final class AuthorizationSigner {

    private final Signer signer;
    private final HashFunction hash;

    public AuthorizationSigner(final Signer signer) {
        this(signer, HashFunction.keccak256());
    }

    public AuthorizationSigner(final Signer signer, final HashFunction hash) {
        this.signer = Objects.requireNonNull(signer, "signer");
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    /**
     * @throws SigningException if the signer fails or returns an incomplete signature
     */
    public Authorization sign(final Authorization authorization) {
        Objects.requireNonNull(authorization, "authorization");
        final Signature signature = Signers.sign(signer, signingHash(authorization));
        return attach(authorization, signature);
    }

    public Authorization sign(final long chainId, final Address delegate, final long nonce) {
        return sign(Authorization.unsigned(chainId, delegate, nonce));
    }

    /**
     * Signs each authorization in order. The first failure aborts the batch.
     */
    public List<Authorization> signAll(final List<Authorization> authorizations) {
        Objects.requireNonNull(authorizations, "authorizations");
        final List<Authorization> signed = new ArrayList<>(authorizations.size());
        for (final Authorization authorization : authorizations) {
            signed.add(sign(authorization));
        }
        return List.copyOf(signed);
    }

    /**
     * Asynchronous {@link #sign(Authorization)}; a timeout or cancellation completes the future
     * with a {@link SigningException}.
     */
    public CompletableFuture<Authorization> signAsync(final Authorization authorization, final Duration timeout) {
        Objects.requireNonNull(authorization, "authorization");
        return Signers.signAsync(signer, signingHash(authorization), timeout)
                .thenApply(signature -> attach(authorization, signature));
    }

    public byte[] signingHash(final Authorization authorization) {
        return hash.hash(authorization.preimage());
    }

    private static Authorization attach(final Authorization authorization, final Signature signature) {
        final Authorization signed = authorization.withSignature(signature);
        DebugLogger.logAuth("[AUTH] chainId=%d delegate=%s nonce=%d revocation=%s",
                signed.chainId(), signed.address(), signed.nonce(), signed.isRevocation());
        return signed;
    }
}
