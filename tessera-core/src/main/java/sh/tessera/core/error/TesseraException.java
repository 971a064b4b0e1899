// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.error;

/**
 * Root of the library's exception hierarchy.
 *
 * <pre>
 * TesseraException
 * ├── {@link AbiTypeParseException} - malformed type strings, signatures or ABI JSON
 * ├── {@link AbiEncodingException} - values that do not fit their ABI type
 * ├── {@link AbiDecodingException} - truncated or malformed ABI data
 * ├── {@link RevertException} - decoded EVM revert data
 * ├── {@link Eip712Exception} - malformed EIP-712 typed data
 * └── {@link TxnException} - transaction failures
 *     ├── {@link InvalidTransactionException} - missing or conflicting fields, malformed envelopes
 *     ├── {@link UnsupportedTransactionTypeException} - unknown type tag
 *     └── {@link SigningException} - failures at the signer boundary
 * </pre>
 *
 * <p>Every kind is distinguishable with a dedicated catch clause:
 *
 * <pre>{@code
 * try {
 *     signer.sign(request);
 * } catch (SigningException e) {
 *     // signer rejected, timed out or was cancelled
 * } catch (TesseraException e) {
 *     // anything else raised by the library
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class TesseraException extends RuntimeException
        permits AbiTypeParseException,
        AbiEncodingException,
        AbiDecodingException,
        RevertException,
        Eip712Exception,
        TxnException {

    public TesseraException(final String message) {
        super(message);
    }

    public TesseraException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
