// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import sh.tessera.core.error.AbiDecodingException;
import sh.tessera.core.types.Address;

/**
 * Solidity ABI decoder, the inverse of {@link AbiEncoder}.
 *
 * <p>Static elements are read in place; a dynamic element's head word is an offset from the start
 * of the enclosing tuple, and the element is decoded there. Every read is bounds-checked and every
 * word is validated against its type (bool is 0 or 1, address and {@code uintN} have clean high
 * bits, {@code bytesN} has zero padding, strings are valid UTF-8). Any violation raises
 * {@link AbiDecodingException}; partial or zero-filled results are never returned.
 *
 * <p>The decoder does not skip a function selector. Callers decoding call data strip the first four
 * bytes themselves; return data carries no selector.
 */
public final class AbiDecoder {

    private static final int WORD = 32;
    private static final int ADDRESS_PADDING = 12;

    private AbiDecoder() {
    }

    /**
     * Decodes {@code data} as the tuple of {@code types}.
     *
     * @throws AbiDecodingException if the data is truncated, an offset or length is out of bounds,
     *                              or a word is not a valid value of its type
     */
    public static List<AbiValue> decode(final List<AbiType> types, final byte[] data) {
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(data, "data");
        return decodeTuple(types, data, 0);
    }

    /**
     * Decodes a single value encoded as a one-element tuple.
     */
    public static AbiValue decode(final AbiType type, final byte[] data) {
        return decode(List.of(type), data).get(0);
    }

    private static List<AbiValue> decodeTuple(final List<AbiType> types, final byte[] data, final int start) {
        final List<AbiValue> values = new ArrayList<>(types.size());
        int cursor = start;
        for (final AbiType type : types) {
            if (type.isDynamic()) {
                final int relative = readSize(data, cursor, type, "offset");
                final long target = (long) start + relative;
                if (target >= data.length) {
                    throw new AbiDecodingException("Offset " + relative + " for " + type.canonical()
                            + " at offset " + cursor + " points outside data of length " + data.length);
                }
                values.add(decodeContent(type, data, (int) target));
                cursor += WORD;
            } else {
                values.add(decodeContent(type, data, cursor));
                cursor += type.staticSize();
            }
        }
        return values;
    }

    private static AbiValue decodeContent(final AbiType type, final byte[] data, final int pos) {
        if (type instanceof AbiType.UIntType t) {
            final BigInteger value = new BigInteger(1, word(data, pos, type));
            if (value.bitLength() > t.bits()) {
                throw new AbiDecodingException("Value out of range for " + t.canonical() + " at offset " + pos);
            }
            return new AbiValue.NumberValue(value);
        }
        if (type instanceof AbiType.IntType t) {
            final BigInteger value = new BigInteger(word(data, pos, type));
            if (value.bitLength() > t.bits() - 1) {
                throw new AbiDecodingException("Value out of range for " + t.canonical() + " at offset " + pos);
            }
            return new AbiValue.NumberValue(value);
        }
        if (type instanceof AbiType.AddressType) {
            final byte[] word = word(data, pos, type);
            requireZero(word, 0, ADDRESS_PADDING, type, pos);
            return new AbiValue.AddressValue(Address.fromBytes(Arrays.copyOfRange(word, ADDRESS_PADDING, WORD)));
        }
        if (type instanceof AbiType.BoolType) {
            final byte[] word = word(data, pos, type);
            requireZero(word, 0, WORD - 1, type, pos);
            final int last = word[WORD - 1];
            if (last != 0 && last != 1) {
                throw new AbiDecodingException("Invalid bool value " + last + " at offset " + pos);
            }
            return AbiValue.bool(last == 1);
        }
        if (type instanceof AbiType.FixedBytesType t) {
            final byte[] word = word(data, pos, type);
            requireZero(word, t.size(), WORD, type, pos);
            return new AbiValue.BytesValue(Arrays.copyOf(word, t.size()));
        }
        if (type instanceof AbiType.BytesType) {
            return new AbiValue.BytesValue(lengthPrefixed(data, pos, type));
        }
        if (type instanceof AbiType.StringType) {
            return new AbiValue.StringValue(utf8(lengthPrefixed(data, pos, type), pos));
        }
        if (type instanceof AbiType.ArrayType t) {
            final int length;
            final int body;
            if (t.isFixedLength()) {
                length = t.length();
                body = pos;
            } else {
                length = readSize(data, pos, type, "length");
                body = pos + WORD;
                // each element needs at least one head word; reject lengths the buffer cannot hold
                final long minimum = (long) length * t.element().staticSize();
                if (body + minimum > data.length) {
                    throw new AbiDecodingException("insufficient data for " + t.canonical() + " of length "
                            + length + " at offset " + pos);
                }
            }
            return new AbiValue.ListValue(decodeTuple(Collections.nCopies(length, t.element()), data, body));
        }
        final AbiType.TupleType t = (AbiType.TupleType) type;
        return new AbiValue.ListValue(decodeTuple(t.components(), data, pos));
    }

    private static byte[] lengthPrefixed(final byte[] data, final int pos, final AbiType type) {
        final int length = readSize(data, pos, type, "length");
        final long end = (long) pos + WORD + length;
        if (end > data.length) {
            throw new AbiDecodingException(
                    "insufficient data for " + type.canonical() + " at offset " + pos
                            + ": length " + length + " exceeds available " + (data.length - pos - WORD) + " bytes");
        }
        return Arrays.copyOfRange(data, pos + WORD, (int) end);
    }

    private static String utf8(final byte[] bytes, final int pos) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new AbiDecodingException("Invalid UTF-8 in string at offset " + pos, e);
        }
    }

    private static byte[] word(final byte[] data, final int pos, final AbiType type) {
        if (pos < 0 || (long) pos + WORD > data.length) {
            throw new AbiDecodingException("insufficient data for " + type.canonical() + " at offset " + pos);
        }
        return Arrays.copyOfRange(data, pos, pos + WORD);
    }

    private static int readSize(final byte[] data, final int pos, final AbiType type, final String what) {
        final BigInteger value = new BigInteger(1, word(data, pos, type));
        if (value.bitLength() > 31) {
            throw new AbiDecodingException(
                    "Invalid " + what + " " + value + " for " + type.canonical() + " at offset " + pos);
        }
        return value.intValue();
    }

    private static void requireZero(
            final byte[] word, final int from, final int to, final AbiType type, final int pos) {
        for (int i = from; i < to; i++) {
            if (word[i] != 0) {
                throw new AbiDecodingException("Dirty padding for " + type.canonical() + " at offset " + pos);
            }
        }
    }
}
