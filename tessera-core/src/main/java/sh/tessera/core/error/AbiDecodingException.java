// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when ABI data is truncated, points outside the buffer or holds a value its type forbids.
 *
 * @since 0.1.0
 */
public final class AbiDecodingException extends TesseraException {

    public AbiDecodingException(final String message) {
        super(message);
    }

    public AbiDecodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
