// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import java.util.Objects;
import org.bouncycastle.jcajce.provider.digest.Keccak;

/**
 * Keccak-256 (the pre-standard SHA-3 variant Ethereum uses), backed by BouncyCastle.
 *
 * <p>Digests are cached per thread. Callers on pooled threads that are done hashing may call
 * {@link #cleanup()} to drop the cached instance.
 */
public final class Keccak256 {

    private static final ThreadLocal<Keccak.Digest256> DIGEST = ThreadLocal.withInitial(Keccak.Digest256::new);

    private Keccak256() {
        // Utility class
    }

    public static byte[] hash(final byte[] input) {
        Objects.requireNonNull(input, "input cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        return digest.digest(input);
    }

    /**
     * Hashes the concatenation of {@code inputs} without building the concatenated array.
     */
    public static byte[] hash(final byte[]... inputs) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        final Keccak.Digest256 digest = DIGEST.get();
        digest.reset();
        for (final byte[] input : inputs) {
            digest.update(Objects.requireNonNull(input, "input element cannot be null"));
        }
        return digest.digest();
    }

    public static void cleanup() {
        DIGEST.remove();
    }
}
