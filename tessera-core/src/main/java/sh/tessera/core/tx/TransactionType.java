// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import sh.tessera.core.error.UnsupportedTransactionTypeException;

/**
 * The five transaction envelopes. Typed envelopes (EIP-2718) start with {@link #typeByte()};
 * legacy transactions are a bare RLP list.
 */
public enum TransactionType {
    LEGACY(0x00),
    EIP2930(0x01),
    EIP1559(0x02),
    EIP4844(0x03),
    EIP7702(0x04);

    private final int typeByte;

    TransactionType(final int typeByte) {
        this.typeByte = typeByte;
    }

    public int typeByte() {
        return typeByte;
    }

    /**
     * @throws UnsupportedTransactionTypeException for any tag outside 0x00..0x04
     */
    public static TransactionType fromByte(final int typeByte) {
        for (final TransactionType type : values()) {
            if (type.typeByte == typeByte) {
                return type;
            }
        }
        throw new UnsupportedTransactionTypeException(typeByte);
    }
}
