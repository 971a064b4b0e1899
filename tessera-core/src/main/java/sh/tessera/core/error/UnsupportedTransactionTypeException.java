// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown for a transaction type tag outside the known set.
 */
public class UnsupportedTransactionTypeException extends TxnException {

    private final int typeTag;

    public UnsupportedTransactionTypeException(final int typeTag) {
        super("Unsupported transaction type: 0x" + Integer.toHexString(typeTag));
        this.typeTag = typeTag;
    }

    public int typeTag() {
        return typeTag;
    }
}
