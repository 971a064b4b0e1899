// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import java.util.Objects;

/**
 * One member of an EIP-712 struct type, e.g. {@code Person from} or {@code uint256[] ids}.
 */
public record TypedDataField(String name, String type) {

    public TypedDataField {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
    }

    public static TypedDataField of(final String name, final String type) {
        return new TypedDataField(name, type);
    }
}
