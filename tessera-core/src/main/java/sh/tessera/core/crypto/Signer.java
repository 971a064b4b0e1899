// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Bytes;

/**
 * The signing capability the transaction and authorization signers delegate to.
 *
 * <p>Implementations may hold a key in memory, talk to a hardware device or call a remote
 * service. Only {@link #address()} and {@link #signHash(byte[])} are required; remote or slow
 * implementations should override {@link #signHashAsync(byte[])} so callers can apply timeouts
 * and cancellation.
 */
public interface Signer {

    /**
     * The address whose key produces this signer's signatures.
     */
    Address address();

    /**
     * Signs a 32-byte digest as-is, with no prefixing.
     *
     * @param hash the digest to sign
     * @return a signature whose {@code v} is the recovery id (0 or 1)
     */
    Signature signHash(byte[] hash);

    /**
     * Asynchronous form of {@link #signHash(byte[])}. The default runs synchronously on the
     * caller's thread and reports failures through the returned future.
     */
    default CompletableFuture<Signature> signHashAsync(final byte[] hash) {
        try {
            return CompletableFuture.completedFuture(signHash(hash));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Signs a message under EIP-191 ({@code "\x19Ethereum Signed Message:\n" + len + message}).
     *
     * @param message the raw message bytes
     * @return a signature with {@code v} of 27 or 28
     */
    default Signature signMessage(final byte[] message) {
        final byte[] prefix = ("\u0019Ethereum Signed Message:\n" + message.length).getBytes(StandardCharsets.UTF_8);
        final Signature sig = signHash(Keccak256.hash(Bytes.concat(prefix, message)));
        return sig.withV(sig.recoveryId() + 27);
    }
}
