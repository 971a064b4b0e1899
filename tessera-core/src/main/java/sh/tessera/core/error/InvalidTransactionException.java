// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Thrown when a transaction request is missing a required field, carries conflicting field groups,
 * or when a serialized envelope cannot be parsed.
 */
public class InvalidTransactionException extends TxnException {

    public InvalidTransactionException(final String message) {
        super(message);
    }

    public InvalidTransactionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
