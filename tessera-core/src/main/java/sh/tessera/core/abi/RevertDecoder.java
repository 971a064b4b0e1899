// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.tessera.core.error.AbiDecodingException;
import sh.tessera.core.error.RevertException;
import sh.tessera.primitives.Hex;

/**
 * Classifies the return data of a reverted call.
 *
 * <p>Solidity produces {@code Error(string)} for {@code require}/{@code revert("...")},
 * {@code Panic(uint256)} for compiler-inserted checks, and custom errors declared in the
 * contract. Custom errors are recognised only when their {@link AbiError} definitions are
 * supplied. Data that matches a known selector but fails to decode is reported as
 * {@link RevertKind#UNKNOWN}.
 */
public final class RevertDecoder {

    private static final Logger LOG = LoggerFactory.getLogger(RevertDecoder.class);

    private static final String ERROR_STRING_SELECTOR = "08c379a0";
    private static final String PANIC_SELECTOR = "4e487b71";

    public enum RevertKind {
        ERROR_STRING,
        PANIC,
        CUSTOM,
        UNKNOWN
    }

    /**
     * @param kind       classification
     * @param reason     human-readable reason, {@code null} for {@link RevertKind#UNKNOWN}
     * @param rawDataHex the revert data as {@code 0x}-prefixed hex
     */
    public record Decoded(RevertKind kind, String reason, String rawDataHex) {
    }

    private RevertDecoder() {
    }

    public static Decoded decode(final byte[] data) {
        return decode(data, List.of());
    }

    /**
     * Decodes with the custom errors of {@code abi}.
     */
    public static Decoded decode(final byte[] data, final Abi abi) {
        return decode(data, abi.errorsBySelector());
    }

    public static Decoded decode(final byte[] data, final List<AbiError> customErrors) {
        final Map<String, AbiError> bySelector = customErrors.stream()
                .collect(Collectors.toMap(
                        e -> Hex.encodeNoPrefix(e.selector()), e -> e, (a, b) -> a));
        return decode(data, bySelector);
    }

    /**
     * Throws a {@link RevertException} describing {@code data} unless it is empty.
     */
    public static void throwIfRevert(final byte[] data, final List<AbiError> customErrors) {
        if (data == null || data.length == 0) {
            return;
        }
        final Decoded decoded = decode(data, customErrors);
        throw new RevertException(decoded.kind(), decoded.reason(), decoded.rawDataHex());
    }

    private static Decoded decode(final byte[] data, final Map<String, AbiError> errors) {
        if (data == null) {
            return new Decoded(RevertKind.UNKNOWN, null, null);
        }
        final String rawDataHex = Hex.encode(data);
        if (data.length < 4) {
            return new Decoded(RevertKind.UNKNOWN, null, rawDataHex);
        }
        final String selector = Hex.encodeNoPrefix(Arrays.copyOf(data, 4)).toLowerCase(Locale.ROOT);
        final byte[] payload = Arrays.copyOfRange(data, 4, data.length);
        try {
            if (ERROR_STRING_SELECTOR.equals(selector)) {
                final String message = AbiDecoder.decode(AbiType.string(), payload).asString();
                return new Decoded(RevertKind.ERROR_STRING, message, rawDataHex);
            }
            if (PANIC_SELECTOR.equals(selector)) {
                final BigInteger code = AbiDecoder.decode(AbiType.uint(256), payload).asBigInteger();
                return new Decoded(RevertKind.PANIC, panicReason(code), rawDataHex);
            }
            final AbiError custom = errors.get(selector);
            if (custom != null) {
                final List<AbiValue> args = AbiDecoder.decode(custom.inputTypes(), payload);
                return new Decoded(RevertKind.CUSTOM, formatCustomReason(custom.name(), args), rawDataHex);
            }
        } catch (AbiDecodingException e) {
            LOG.debug("Revert data with selector 0x{} did not decode: {}", selector, e.getMessage());
        }
        return new Decoded(RevertKind.UNKNOWN, null, rawDataHex);
    }

    static String panicReason(final BigInteger code) {
        final String hexCode = code.toString(16);
        return switch (hexCode) {
            case "1" -> "assertion failed";
            case "11" -> "arithmetic overflow or underflow";
            case "12" -> "division or modulo by zero";
            case "21" -> "enum conversion out of range";
            case "22" -> "invalid storage byte array indexing";
            case "31" -> "pop on empty array";
            case "32" -> "array index out of bounds";
            case "41" -> "memory allocation overflow";
            case "51" -> "zero-initialized variable of internal function type";
            default -> "panic with code 0x" + hexCode;
        };
    }

    private static String formatCustomReason(final String name, final List<AbiValue> args) {
        return args.stream().map(RevertDecoder::format).collect(Collectors.joining(", ", name + "(", ")"));
    }

    private static String format(final AbiValue value) {
        if (value instanceof AbiValue.AddressValue address) {
            return address.asAddress().value();
        }
        if (value instanceof AbiValue.BytesValue bytes) {
            return Hex.encode(bytes.asBytes());
        }
        if (value instanceof AbiValue.ListValue list) {
            return list.asList().stream().map(RevertDecoder::format).collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof AbiValue.NumberValue number) {
            return number.asBigInteger().toString();
        }
        if (value instanceof AbiValue.StringValue string) {
            return string.asString();
        }
        return String.valueOf(value.asBool());
    }
}
