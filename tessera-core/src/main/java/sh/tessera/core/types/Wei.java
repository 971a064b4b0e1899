// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import com.fasterxml.jackson.annotation.JsonValue;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A non-negative amount of wei, used for values and fee fields.
 *
 * @param value the amount in wei
 */
public record Wei(BigInteger value) {
    public static final Wei ZERO = new Wei(BigInteger.ZERO);

    private static final BigDecimal WEI_PER_ETHER = BigDecimal.TEN.pow(18);
    private static final BigInteger WEI_PER_GWEI = BigInteger.valueOf(1_000_000_000L);

    public Wei {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("Wei must be non-negative");
        }
    }

    public static Wei of(final long wei) {
        return new Wei(BigInteger.valueOf(wei));
    }

    public static Wei of(final BigInteger wei) {
        return new Wei(wei);
    }

    public static Wei gwei(final long gwei) {
        return new Wei(BigInteger.valueOf(gwei).multiply(WEI_PER_GWEI));
    }

    public static Wei fromEther(final BigDecimal ether) {
        Objects.requireNonNull(ether, "ether");
        return new Wei(ether.multiply(WEI_PER_ETHER).toBigIntegerExact());
    }

    public BigDecimal toEther() {
        return new BigDecimal(value).divide(WEI_PER_ETHER, 18, RoundingMode.DOWN);
    }

    @JsonValue
    public String toHexString() {
        return "0x" + value.toString(16);
    }
}
