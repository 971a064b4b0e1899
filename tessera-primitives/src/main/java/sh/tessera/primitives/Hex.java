// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives;

import java.util.Arrays;
import java.util.Objects;

/**
 * Lowercase hex encoding and lenient decoding with an optional {@code 0x} prefix.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] DIGITS = "0123456789abcdef".toCharArray();
    private static final int[] NIBBLES = new int[128];

    static {
        Arrays.fill(NIBBLES, -1);
        for (int i = 0; i <= 9; i++) {
            NIBBLES['0' + i] = i;
        }
        for (int i = 0; i < 6; i++) {
            NIBBLES['a' + i] = 10 + i;
            NIBBLES['A' + i] = 10 + i;
        }
    }

    private Hex() {
        // Utility class
    }

    /**
     * Decodes a hex string, with or without {@code 0x} prefix.
     *
     * @param hex the string to decode
     * @return the decoded bytes, empty for {@code "0x"} or {@code ""}
     * @throws IllegalArgumentException if the input is null, has odd length or contains a non-hex character
     */
    public static byte[] decode(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        final int digits = hex.length() - start;
        if ((digits & 1) == 1) {
            throw new IllegalArgumentException("hex string must have even length: " + hex);
        }
        final byte[] out = new byte[digits / 2];
        for (int i = 0; i < out.length; i++) {
            final int hi = nibble(hex.charAt(start + 2 * i), hex);
            final int lo = nibble(hex.charAt(start + 2 * i + 1), hex);
            out[i] = (byte) ((hi << 4) | lo);
        }
        return out;
    }

    /**
     * Encodes bytes as lowercase hex with a {@code 0x} prefix.
     *
     * @param bytes the bytes to encode
     * @return the prefixed hex string
     */
    public static String encode(final byte[] bytes) {
        return "0x" + encodeNoPrefix(bytes);
    }

    /**
     * Encodes a sub-range of {@code bytes} as lowercase hex with a {@code 0x} prefix.
     */
    public static String encode(final byte[] bytes, final int offset, final int length) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return "0x" + new String(toChars(bytes, offset, length));
    }

    /**
     * Encodes bytes as lowercase hex without a prefix.
     *
     * @param bytes the bytes to encode
     * @return the bare hex string
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return new String(toChars(bytes, 0, bytes.length));
    }

    /**
     * Renders one unsigned byte value as {@code 0xNN}, for diagnostics.
     */
    public static String encodeByte(final int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("byte value must be in range 0-255: " + value);
        }
        return "0x" + DIGITS[value >>> 4] + DIGITS[value & 0x0F];
    }

    /**
     * Strips a leading {@code 0x} or {@code 0X} if present.
     */
    public static String cleanPrefix(final String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex string cannot be null");
        }
        return hasPrefix(hex) ? hex.substring(2) : hex;
    }

    /**
     * Returns {@code true} when {@code hex} starts with {@code 0x} (case-insensitive).
     */
    public static boolean hasPrefix(final String hex) {
        return hex != null
                && hex.length() >= 2
                && hex.charAt(0) == '0'
                && (hex.charAt(1) == 'x' || hex.charAt(1) == 'X');
    }

    /**
     * Returns {@code true} when {@code hex} is a well-formed, even-length hex string.
     */
    public static boolean isValid(final String hex) {
        if (hex == null) {
            return false;
        }
        final int start = hasPrefix(hex) ? 2 : 0;
        if (((hex.length() - start) & 1) == 1) {
            return false;
        }
        for (int i = start; i < hex.length(); i++) {
            final char c = hex.charAt(i);
            if (c >= NIBBLES.length || NIBBLES[c] == -1) {
                return false;
            }
        }
        return true;
    }

    private static char[] toChars(final byte[] bytes, final int offset, final int length) {
        final char[] chars = new char[length * 2];
        for (int i = 0; i < length; i++) {
            final int v = bytes[offset + i] & 0xFF;
            chars[2 * i] = DIGITS[v >>> 4];
            chars[2 * i + 1] = DIGITS[v & 0x0F];
        }
        return chars;
    }

    private static int nibble(final char c, final String input) {
        if (c >= NIBBLES.length || NIBBLES[c] == -1) {
            throw new IllegalArgumentException("invalid hex character in: " + input);
        }
        return NIBBLES[c];
    }
}
