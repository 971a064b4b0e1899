// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import sh.tessera.core.error.SigningException;

/**
 * Calls into a {@link Signer} and normalises what comes back.
 *
 * <p>Every failure at the signer boundary surfaces as a {@link SigningException}: a signer's own
 * {@code SigningException} is rethrown as-is, anything else is wrapped with the original as its
 * cause. A signature is only returned once it has non-zero {@code r} and {@code s} and a
 * recovery id of 0 or 1; its {@code v} is then the recovery id. Nothing is retried.
 */
public final class Signers {

    private Signers() {
    }

    /**
     * Signs {@code digest} on the calling thread.
     *
     * @throws SigningException if the signer fails or returns an incomplete signature
     */
    public static Signature sign(final Signer signer, final byte[] digest) {
        Objects.requireNonNull(signer, "signer");
        final Signature signature;
        try {
            signature = signer.signHash(digest);
        } catch (RuntimeException e) {
            throw toSigningException(e);
        }
        return requireComplete(signature);
    }

    /**
     * Signs {@code digest} through {@link Signer#signHashAsync(byte[])}, failing with a
     * {@link SigningException} if no signature arrives within {@code timeout}.
     */
    public static CompletableFuture<Signature> signAsync(
            final Signer signer, final byte[] digest, final Duration timeout) {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(timeout, "timeout");
        final CompletableFuture<Signature> pending;
        try {
            pending = Objects.requireNonNull(signer.signHashAsync(digest), "signHashAsync returned null");
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(toSigningException(e));
        }
        // copy() so the timeout does not complete the signer's own future
        return pending.copy()
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((signature, error) -> {
                    if (error != null) {
                        throw toSigningException(error, timeout);
                    }
                    return requireComplete(signature);
                });
    }

    /**
     * Checks that a signer's answer can go into an envelope.
     *
     * @return the signature with {@code v} set to its recovery id
     * @throws SigningException if the signature is missing or incomplete
     */
    public static Signature requireComplete(final Signature signature) {
        if (signature == null) {
            throw new SigningException("Signer returned no signature");
        }
        if (signature.rAsBigInteger().signum() == 0 || signature.sAsBigInteger().signum() == 0) {
            throw new SigningException("Signer returned an incomplete signature (zero r or s)");
        }
        final int recoveryId;
        try {
            recoveryId = signature.recoveryId();
        } catch (IllegalArgumentException e) {
            throw new SigningException("Signer returned an invalid recovery id: v=" + signature.v(), e);
        }
        return signature.v() == recoveryId ? signature : signature.withV(recoveryId);
    }

    /**
     * Whether {@code value} is a valid signature scalar, {@code 0 < value < n}.
     */
    public static boolean isValidScalar(final BigInteger value) {
        return value != null && value.signum() > 0 && value.compareTo(Secp256k1.CURVE_ORDER) < 0;
    }

    private static SigningException toSigningException(final Throwable error) {
        return toSigningException(error, null);
    }

    private static SigningException toSigningException(final Throwable error, final Duration timeout) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof SigningException signing) {
            return signing;
        }
        if (cause instanceof TimeoutException) {
            return new SigningException("Signer did not respond within " + timeout, cause);
        }
        if (cause instanceof CancellationException) {
            return new SigningException("Signing request was cancelled", cause);
        }
        return new SigningException("Signer failed: " + cause.getMessage(), cause);
    }
}
