// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import sh.tessera.core.crypto.HashFunction;
import sh.tessera.core.types.Hash;

/**
 * Derives function selectors and event topics from signature strings.
 *
 * <p>The signature is hashed exactly as given, so it must already be canonical
 * ({@code transfer(address,uint256)}, no spaces or parameter names).
 * {@link TypeParser.ParsedSignature#canonical()} produces that form from looser input.
 */
public final class Selectors {

    private static final Selectors KECCAK = new Selectors(HashFunction.keccak256());

    private final HashFunction hash;

    public Selectors(final HashFunction hash) {
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    /**
     * Selectors backed by Keccak-256.
     */
    public static Selectors keccak() {
        return KECCAK;
    }

    /**
     * First four bytes of the signature hash.
     */
    public byte[] selector(final String signature) {
        return Arrays.copyOf(digest(signature), 4);
    }

    /**
     * Full 32-byte signature hash, as used for topic 0 of a non-anonymous event.
     */
    public Hash topic(final String signature) {
        return Hash.fromBytes(digest(signature));
    }

    private byte[] digest(final String signature) {
        Objects.requireNonNull(signature, "signature");
        final byte[] out = hash.hash(signature.getBytes(StandardCharsets.UTF_8));
        if (out == null || out.length != 32) {
            throw new IllegalStateException("Hash function must return 32 bytes");
        }
        return out;
    }
}
