// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Objects;
import sh.tessera.primitives.Hex;

/**
 * Arbitrary-length byte payload such as calldata. Immutable; byte accessors return copies.
 */
public final class HexData {
    public static final HexData EMPTY = new HexData(new byte[0]);

    private final byte[] raw;

    private HexData(final byte[] raw) {
        this.raw = raw;
    }

    /**
     * Parses {@code 0x}-prefixed, even-length hex.
     *
     * @throws IllegalArgumentException if the value is not valid hex data
     */
    public static HexData of(final String value) {
        Objects.requireNonNull(value, "hex");
        if (!HexValidator.ANY_LENGTH.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid hex data: " + value);
        }
        final byte[] bytes = Hex.decode(value);
        return bytes.length == 0 ? EMPTY : new HexData(bytes);
    }

    public static HexData fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return EMPTY;
        }
        return new HexData(bytes.clone());
    }

    public byte[] toBytes() {
        return raw.clone();
    }

    public int byteLength() {
        return raw.length;
    }

    public boolean isEmpty() {
        return raw.length == 0;
    }

    @JsonValue
    public String value() {
        return Hex.encode(raw);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof HexData other && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return "HexData[value=" + value() + ']';
    }
}
