// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

/**
 * Builds 32-byte hex words for expected encodings.
 */
final class AbiTestSupport {

    private AbiTestSupport() {
    }

    static String left(final String hex) {
        return "0".repeat(64 - hex.length()) + hex;
    }

    static String right(final String hex) {
        return hex + "0".repeat(64 - hex.length());
    }
}
