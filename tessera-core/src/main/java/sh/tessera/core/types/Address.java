// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import sh.tessera.primitives.Hex;

/**
 * A 20-byte account address, stored as lowercase {@code 0x}-prefixed hex.
 *
 * <p>{@link #ZERO} doubles as the EIP-7702 revocation delegate.
 *
 * @param value the address in hex form
 */
public record Address(@JsonValue String value) {
    public static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    public static Address of(final String value) {
        return new Address(value);
    }

    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address(Hex.encode(bytes));
    }

    public byte[] toBytes() {
        return Hex.decode(value);
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
