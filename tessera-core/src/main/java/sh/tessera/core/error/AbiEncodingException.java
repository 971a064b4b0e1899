// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when a value does not match its ABI type: wrong shape, arity or length, or an integer out of range.
 *
 * @since 0.1.0
 */
public final class AbiEncodingException extends TesseraException {

    public AbiEncodingException(final String message) {
        super(message);
    }

    public AbiEncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
