// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Malformed EIP-712 typed data: unknown types, missing fields or values that do not fit
 * their declared type.
 */
public final class Eip712Exception extends TesseraException {

    public Eip712Exception(final String message) {
        super(message);
    }

    public Eip712Exception(final String message, final Throwable cause) {
        super(message, cause);
    }

    public static Eip712Exception unknownType(final String type) {
        return new Eip712Exception("Unknown EIP-712 type: " + type);
    }

    public static Eip712Exception missingField(final String typeName, final String fieldName) {
        return new Eip712Exception("Missing field '%s' in type '%s'".formatted(fieldName, typeName));
    }

    public static Eip712Exception invalidValue(final String type, final Object value, final Throwable cause) {
        return new Eip712Exception("Invalid value for type '%s': %s".formatted(type, value), cause);
    }

    public static Eip712Exception primaryTypeNotFound(final String primaryType) {
        return new Eip712Exception("Primary type not found: " + primaryType);
    }
}
