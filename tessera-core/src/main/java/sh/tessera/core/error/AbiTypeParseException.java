// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when a type string, signature or ABI JSON document cannot be parsed.
 *
 * @since 0.1.0
 */
public final class AbiTypeParseException extends TesseraException {

    public AbiTypeParseException(final String message) {
        super(message);
    }

    public AbiTypeParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
