// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Raised at the signer boundary: the signer failed, rejected the request, timed out,
 * was cancelled, or returned an incomplete signature.
 *
 * <p>The signer's own exception, when there is one, is kept as the cause.
 */
public class SigningException extends TxnException {

    public SigningException(final String message) {
        super(message);
    }

    public SigningException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
