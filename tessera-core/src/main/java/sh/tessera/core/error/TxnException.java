// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Base class for transaction failures: validation, envelope decoding and signing.
 */
public non-sealed class TxnException extends TesseraException {

    public TxnException(final String message) {
        super(message);
    }

    public TxnException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
