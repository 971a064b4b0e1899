// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

/**
 * A 32-byte hash primitive injected into selector derivation and transaction signing.
 */
@FunctionalInterface
public interface HashFunction {

    /**
     * Hashes {@code input}.
     *
     * @param input the bytes to hash
     * @return a 32-byte digest
     */
    byte[] hash(byte[] input);

    /**
     * The Keccak-256 hash used throughout Ethereum.
     */
    static HashFunction keccak256() {
        return Keccak256::hash;
    }
}
