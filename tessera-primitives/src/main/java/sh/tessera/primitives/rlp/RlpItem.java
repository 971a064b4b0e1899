// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

/**
 * A node of an RLP tree: either a byte string or a list of nodes.
 */
public sealed interface RlpItem permits RlpString, RlpList {

    /**
     * Encodes this item, including its length prefix.
     *
     * @return the RLP bytes
     */
    byte[] encode();
}
