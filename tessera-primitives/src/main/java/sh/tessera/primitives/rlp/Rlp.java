// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import sh.tessera.primitives.Hex;

/**
 * Recursive Length Prefix encoding and strict decoding.
 *
 * <p>Byte strings shorter than 56 bytes carry a one-byte prefix {@code 0x80 + len} (a single byte
 * below {@code 0x80} is its own encoding); longer strings carry {@code 0xB7 + lenOfLen} followed by
 * the big-endian length. Lists use the same two tiers based at {@code 0xC0} and {@code 0xF7}.
 *
 * <p>The decoder only accepts canonical input: minimal length prefixes, no leading zeros in
 * lengths, no prefixed single bytes below {@code 0x80}, no truncation and no trailing bytes.
 * Violations are reported as {@link IllegalArgumentException}.
 *
 * @see <a href="https://ethereum.org/en/developers/docs/data-structures-and-encoding/rlp/">RLP</a>
 */
public final class Rlp {

    private static final int SHORT_LIMIT = 55;

    private Rlp() {
        // Utility class
    }

    /**
     * Encodes the provided item.
     */
    public static byte[] encode(final RlpItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes a byte string.
     *
     * @param bytes the raw content
     * @return the prefixed encoding
     */
    public static byte[] encodeString(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        final int length = bytes.length;
        if (length == 1 && (bytes[0] & 0xFF) < 0x80) {
            return new byte[] {bytes[0]};
        }
        final byte[] header = header(0x80, 0xB7, length);
        final byte[] result = new byte[header.length + length];
        System.arraycopy(header, 0, result, 0, header.length);
        System.arraycopy(bytes, 0, result, header.length, length);
        return result;
    }

    /**
     * Encodes a list, computing the payload size once before allocating the result.
     *
     * @param items the list items
     * @return the prefixed encoding
     */
    public static byte[] encodeList(final List<? extends RlpItem> items) {
        Objects.requireNonNull(items, "items cannot be null");
        final byte[][] encoded = new byte[items.size()][];
        int payload = 0;
        for (int i = 0; i < encoded.length; i++) {
            final RlpItem item = Objects.requireNonNull(items.get(i), "items cannot contain null values");
            encoded[i] = item.encode();
            payload = Math.addExact(payload, encoded[i].length);
        }
        final byte[] header = header(0xC0, 0xF7, payload);
        final byte[] result = new byte[header.length + payload];
        System.arraycopy(header, 0, result, 0, header.length);
        int offset = header.length;
        for (final byte[] part : encoded) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }

    /**
     * Decodes exactly one item spanning the whole input.
     *
     * @param encoded the RLP bytes
     * @return the decoded item
     * @throws IllegalArgumentException if the input is malformed or has trailing bytes
     */
    public static RlpItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final DecodeResult result = decodeAt(encoded, 0, encoded.length);
        if (result.consumed() != encoded.length) {
            throw new IllegalArgumentException(
                    "RLP data has trailing bytes: consumed " + result.consumed() + " of " + encoded.length);
        }
        return result.item();
    }

    /**
     * Decodes an input whose root must be a list.
     *
     * @param encoded the RLP bytes
     * @return the list items
     * @throws IllegalArgumentException if the root is a string or the input is malformed
     */
    public static List<RlpItem> decodeList(final byte[] encoded) {
        final RlpItem item = decode(encoded);
        if (item instanceof RlpList list) {
            return list.items();
        }
        throw new IllegalArgumentException("RLP data is not a list");
    }

    private static DecodeResult decodeAt(final byte[] data, final int offset, final int limit) {
        if (offset >= limit) {
            throw new IllegalArgumentException("RLP data truncated at offset " + offset);
        }
        final int prefix = data[offset] & 0xFF;

        if (prefix < 0x80) {
            return new DecodeResult(new RlpString(new byte[] {(byte) prefix}), 1);
        }
        if (prefix <= 0xB7) {
            final int length = prefix - 0x80;
            final byte[] value = slice(data, offset + 1, length, limit, "string");
            if (length == 1 && (value[0] & 0xFF) < 0x80) {
                throw new IllegalArgumentException(
                        "Non-canonical single byte " + Hex.encodeByte(value[0] & 0xFF) + " at offset " + offset);
            }
            return new DecodeResult(new RlpString(value), 1 + length);
        }
        if (prefix <= 0xBF) {
            final int lengthOfLength = prefix - 0xB7;
            final int length = readLength(data, offset + 1, lengthOfLength, limit);
            final byte[] value = slice(data, offset + 1 + lengthOfLength, length, limit, "string");
            return new DecodeResult(new RlpString(value), 1 + lengthOfLength + length);
        }
        if (prefix <= 0xF7) {
            final int length = prefix - 0xC0;
            return decodeListPayload(data, offset + 1, length, limit, 1);
        }
        final int lengthOfLength = prefix - 0xF7;
        final int length = readLength(data, offset + 1, lengthOfLength, limit);
        return decodeListPayload(data, offset + 1 + lengthOfLength, length, limit, 1 + lengthOfLength);
    }

    private static DecodeResult decodeListPayload(
            final byte[] data, final int start, final int length, final int limit, final int headerSize) {
        final int end = start + length;
        if (length < 0 || end > limit || end < start) {
            throw new IllegalArgumentException("RLP list length " + length + " exceeds available data at offset " + start);
        }
        final List<RlpItem> items = new ArrayList<>();
        int cursor = start;
        while (cursor < end) {
            final DecodeResult child = decodeAt(data, cursor, end);
            items.add(child.item());
            cursor += child.consumed();
        }
        return new DecodeResult(new RlpList(items), headerSize + length);
    }

    private static byte[] slice(
            final byte[] data, final int start, final int length, final int limit, final String what) {
        final int end = start + length;
        if (length < 0 || end > limit || end < start) {
            throw new IllegalArgumentException(
                    "RLP " + what + " length " + length + " exceeds available data at offset " + start);
        }
        final byte[] out = new byte[length];
        System.arraycopy(data, start, out, 0, length);
        return out;
    }

    private static int readLength(final byte[] data, final int start, final int lengthOfLength, final int limit) {
        if (lengthOfLength > 4) {
            throw new IllegalArgumentException("RLP length-of-length too large: " + lengthOfLength);
        }
        if (start + lengthOfLength > limit) {
            throw new IllegalArgumentException("RLP length prefix truncated at offset " + start);
        }
        if (data[start] == 0) {
            throw new IllegalArgumentException("RLP length has leading zeros at offset " + start);
        }
        long length = 0;
        for (int i = 0; i < lengthOfLength; i++) {
            length = (length << 8) | (data[start + i] & 0xFF);
        }
        if (length <= SHORT_LIMIT) {
            throw new IllegalArgumentException("Non-minimal RLP length encoding: " + length);
        }
        if (length > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("RLP length too large: " + length);
        }
        return (int) length;
    }

    private static byte[] header(final int shortBase, final int longBase, final int length) {
        if (length <= SHORT_LIMIT) {
            return new byte[] {(byte) (shortBase + length)};
        }
        final int size = (32 - Integer.numberOfLeadingZeros(length) + 7) >>> 3;
        final byte[] header = new byte[1 + size];
        header[0] = (byte) (longBase + size);
        for (int i = 0; i < size; i++) {
            header[size - i] = (byte) (length >>> (8 * i));
        }
        return header;
    }

    private record DecodeResult(RlpItem item, int consumed) {
    }
}
