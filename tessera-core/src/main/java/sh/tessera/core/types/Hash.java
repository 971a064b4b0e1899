// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import sh.tessera.primitives.Hex;

/**
 * A 32-byte hash or storage key in lowercase hex.
 *
 * @param value the hash in hex form
 */
public record Hash(@JsonValue String value) {
    public static final int BYTE_LENGTH = 32;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public Hash {
        Objects.requireNonNull(value, "hash");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hash: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Hash of(final String value) {
        return new Hash(value);
    }

    public static Hash fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Hash must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Hash(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
