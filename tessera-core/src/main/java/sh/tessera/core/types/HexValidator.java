// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.types;

import java.util.regex.Pattern;

/**
 * Regex factories for {@code 0x}-prefixed hex values.
 */
final class HexValidator {
    static final Pattern ANY_LENGTH = Pattern.compile("^0x([0-9a-fA-F]{2})*$");

    private HexValidator() {}

    static Pattern fixedLength(final int byteLength) {
        return Pattern.compile("^0x[0-9a-fA-F]{" + (byteLength * 2) + "}$");
    }
}
