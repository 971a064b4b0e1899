// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.error.InvalidTransactionException;
import sh.tessera.core.error.UnsupportedTransactionTypeException;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;
import sh.tessera.primitives.rlp.Rlp;
import sh.tessera.primitives.rlp.RlpItem;

/**
 * Parses signed transaction envelopes back into their fields.
 *
 * <p>A first byte of {@code 0xc0} or above marks a legacy transaction; a byte in
 * {@code 0x00..0x7f} is an EIP-2718 type tag. Legacy {@code v} values of 27 and 28 decode with
 * chain id 0; EIP-155 values yield {@code chainId = (v - 35) / 2}, which must be at least 1. The returned signature always
 * carries the recovery id as {@code v}.
 */
public final class TransactionDecoder {

    private static final BigInteger V_27 = BigInteger.valueOf(27);
    private static final BigInteger V_28 = BigInteger.valueOf(28);
    private static final BigInteger V_35 = BigInteger.valueOf(35);
    private static final BigInteger V_37 = BigInteger.valueOf(37);

    private TransactionDecoder() {
    }

    public static SignedTransaction decode(final String rawHex) {
        final byte[] raw;
        try {
            raw = Hex.decode(rawHex);
        } catch (IllegalArgumentException e) {
            throw new InvalidTransactionException("Raw transaction is not valid hex", e);
        }
        return decode(raw);
    }

    /**
     * @throws UnsupportedTransactionTypeException if the type tag is not one of the five known types
     * @throws InvalidTransactionException         if the envelope is malformed
     */
    public static SignedTransaction decode(final byte[] raw) {
        if (raw == null || raw.length == 0) {
            throw new InvalidTransactionException("Raw transaction is empty");
        }
        final int first = raw[0] & 0xff;
        if (first > 0x7f && first < 0xc0) {
            throw new InvalidTransactionException(
                    "Raw transaction starts with neither a type byte nor an RLP list: 0x" + Integer.toHexString(first));
        }
        if (first == 0x00) {
            throw new UnsupportedTransactionTypeException(first);
        }
        final TransactionType type = first >= 0xc0 ? TransactionType.LEGACY : TransactionType.fromByte(first);
        try {
            final List<RlpItem> fields = type == TransactionType.LEGACY
                    ? Rlp.decodeList(raw)
                    : Rlp.decodeList(Arrays.copyOfRange(raw, 1, raw.length));
            final UnsignedTransaction transaction;
            final Signature signature;
            switch (type) {
                case LEGACY -> {
                    expectFields(type, fields, 9);
                    final BigInteger v = TxRlp.readBigInteger(fields.get(6), "v");
                    final long chainId;
                    final int recoveryId;
                    if (v.equals(V_27) || v.equals(V_28)) {
                        chainId = 0;
                        recoveryId = v.intValue() - 27;
                    } else if (v.compareTo(V_37) >= 0 && v.bitLength() < 64) {
                        chainId = v.subtract(V_35).shiftRight(1).longValueExact();
                        recoveryId = v.subtract(V_35).testBit(0) ? 1 : 0;
                    } else {
                        throw new InvalidTransactionException("Invalid legacy signature v: " + v);
                    }
                    transaction = new LegacyTransaction(
                            chainId,
                            TxRlp.readLong(fields.get(0), "nonce"),
                            TxRlp.readWei(fields.get(1), "gasPrice"),
                            TxRlp.readLong(fields.get(2), "gasLimit"),
                            TxRlp.readAddress(fields.get(3), "to"),
                            TxRlp.readWei(fields.get(4), "value"),
                            TxRlp.readData(fields.get(5), "data"));
                    signature = Signature.of(
                            TxRlp.readBigInteger(fields.get(7), "r"),
                            TxRlp.readBigInteger(fields.get(8), "s"),
                            recoveryId);
                }
                case EIP2930 -> {
                    expectFields(type, fields, 11);
                    transaction = new Eip2930Transaction(
                            TxRlp.readLong(fields.get(0), "chainId"),
                            TxRlp.readLong(fields.get(1), "nonce"),
                            TxRlp.readWei(fields.get(2), "gasPrice"),
                            TxRlp.readLong(fields.get(3), "gasLimit"),
                            TxRlp.readAddress(fields.get(4), "to"),
                            TxRlp.readWei(fields.get(5), "value"),
                            TxRlp.readData(fields.get(6), "data"),
                            TxRlp.readAccessList(fields.get(7)));
                    signature = TxRlp.readSignature(fields, 8);
                }
                case EIP1559 -> {
                    expectFields(type, fields, 12);
                    transaction = new Eip1559Transaction(
                            TxRlp.readLong(fields.get(0), "chainId"),
                            TxRlp.readLong(fields.get(1), "nonce"),
                            TxRlp.readWei(fields.get(2), "maxPriorityFeePerGas"),
                            TxRlp.readWei(fields.get(3), "maxFeePerGas"),
                            TxRlp.readLong(fields.get(4), "gasLimit"),
                            TxRlp.readAddress(fields.get(5), "to"),
                            TxRlp.readWei(fields.get(6), "value"),
                            TxRlp.readData(fields.get(7), "data"),
                            TxRlp.readAccessList(fields.get(8)));
                    signature = TxRlp.readSignature(fields, 9);
                }
                case EIP4844 -> {
                    expectFields(type, fields, 14);
                    transaction = new Eip4844Transaction(
                            TxRlp.readLong(fields.get(0), "chainId"),
                            TxRlp.readLong(fields.get(1), "nonce"),
                            TxRlp.readWei(fields.get(2), "maxPriorityFeePerGas"),
                            TxRlp.readWei(fields.get(3), "maxFeePerGas"),
                            TxRlp.readLong(fields.get(4), "gasLimit"),
                            TxRlp.readAddress(fields.get(5), "to"),
                            TxRlp.readWei(fields.get(6), "value"),
                            TxRlp.readData(fields.get(7), "data"),
                            TxRlp.readAccessList(fields.get(8)),
                            TxRlp.readWei(fields.get(9), "maxFeePerBlobGas"),
                            TxRlp.readHashes(fields.get(10), "blobVersionedHashes"));
                    signature = TxRlp.readSignature(fields, 11);
                }
                case EIP7702 -> {
                    expectFields(type, fields, 13);
                    transaction = new Eip7702Transaction(
                            TxRlp.readLong(fields.get(0), "chainId"),
                            TxRlp.readLong(fields.get(1), "nonce"),
                            TxRlp.readWei(fields.get(2), "maxPriorityFeePerGas"),
                            TxRlp.readWei(fields.get(3), "maxFeePerGas"),
                            TxRlp.readLong(fields.get(4), "gasLimit"),
                            TxRlp.readAddress(fields.get(5), "to"),
                            TxRlp.readWei(fields.get(6), "value"),
                            TxRlp.readData(fields.get(7), "data"),
                            TxRlp.readAccessList(fields.get(8)),
                            TxRlp.readAuthorizations(fields.get(9)));
                    signature = TxRlp.readSignature(fields, 10);
                }
                default -> throw new IllegalStateException("Unhandled transaction type " + type);
            }
            return new SignedTransaction(transaction, signature, raw.clone(), Hash.fromBytes(Keccak256.hash(raw)));
        } catch (IllegalArgumentException | NullPointerException | ArithmeticException e) {
            throw new InvalidTransactionException("Malformed " + type + " transaction: " + e.getMessage(), e);
        }
    }

    private static void expectFields(final TransactionType type, final List<RlpItem> fields, final int expected) {
        if (fields.size() != expected) {
            throw new InvalidTransactionException(
                    type + " transaction must have " + expected + " RLP fields, got " + fields.size());
        }
    }
}
