// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import sh.tessera.core.error.AbiTypeParseException;

/**
 * Parses ABI type strings and human-readable signatures.
 *
 * <p>Supported grammar:
 * <pre>
 * type     := base suffix*
 * base     := elementary | 'tuple'? '(' [type (',' type)*] ')'
 * suffix   := '[' digits? ']'
 * </pre>
 * Array suffixes are peeled from the end of the string, so {@code uint8[2][]} is a dynamic array
 * of {@code uint8[2]}. Tuple components are split on commas at nesting depth zero.
 */
public final class TypeParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private TypeParser() {
    }

    /**
     * A parsed {@code name(type,...)} signature.
     *
     * @param name   the function, event or error name
     * @param inputs the parameter types
     */
    public record ParsedSignature(String name, List<AbiType> inputs) {
        public ParsedSignature {
            Objects.requireNonNull(name, "name");
            inputs = List.copyOf(inputs);
        }

        /**
         * The canonical form, e.g. {@code transfer(address,uint256)}.
         */
        public String canonical() {
            return name + new AbiType.TupleType(inputs).canonical();
        }
    }

    /**
     * Parses a single type string.
     *
     * @param type e.g. {@code "uint256"}, {@code "address[]"}, {@code "(uint256,address)[3]"}
     * @return the type tree
     * @throws AbiTypeParseException if the string is not a valid ABI type
     */
    public static AbiType parse(final String type) {
        if (type == null) {
            throw new AbiTypeParseException("ABI type cannot be null");
        }
        final String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new AbiTypeParseException("ABI type cannot be empty");
        }
        return parseTrimmed(trimmed, type);
    }

    /**
     * Parses a list of types such as {@code "uint256,(address,bytes)[]"}; an empty string yields an
     * empty list.
     */
    public static List<AbiType> parseList(final String types) {
        Objects.requireNonNull(types, "types");
        final List<AbiType> result = new ArrayList<>();
        if (types.isBlank()) {
            return result;
        }
        for (final String component : splitTopLevel(types, types)) {
            result.add(parse(component));
        }
        return result;
    }

    /**
     * Parses a signature like {@code transfer(address,uint256)}. Parameter names and data-location
     * keywords after a type are tolerated and discarded, so {@code Error(address who)} works.
     *
     * @throws AbiTypeParseException on malformed input
     */
    public static ParsedSignature parseSignature(final String signature) {
        if (signature == null) {
            throw new AbiTypeParseException("Signature cannot be null");
        }
        final String trimmed = signature.trim();
        final int open = trimmed.indexOf('(');
        if (open <= 0 || !trimmed.endsWith(")")) {
            throw new AbiTypeParseException("Invalid signature: " + signature);
        }
        final String name = trimmed.substring(0, open).trim();
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new AbiTypeParseException("Invalid name in signature: " + signature);
        }
        final String params = trimmed.substring(open + 1, trimmed.length() - 1);
        final List<AbiType> inputs = new ArrayList<>();
        if (!params.isBlank()) {
            for (final String component : splitTopLevel(params, signature)) {
                inputs.add(parse(stripParameterName(component.trim(), signature)));
            }
        }
        return new ParsedSignature(name, inputs);
    }

    private static AbiType parseTrimmed(final String type, final String original) {
        if (type.endsWith("]")) {
            final int open = type.lastIndexOf('[');
            if (open <= 0) {
                throw new AbiTypeParseException("Unbalanced array brackets in type: " + original);
            }
            final String length = type.substring(open + 1, type.length() - 1);
            final AbiType element = parseTrimmed(type.substring(0, open).trim(), original);
            if (length.isEmpty()) {
                return new AbiType.ArrayType(element, AbiType.ArrayType.DYNAMIC);
            }
            if (!DIGITS.matcher(length).matches()) {
                throw new AbiTypeParseException("Invalid array length '" + length + "' in type: " + original);
            }
            final int size;
            try {
                size = Integer.parseInt(length);
            } catch (NumberFormatException e) {
                throw new AbiTypeParseException("Array length too large in type: " + original, e);
            }
            if (size == 0) {
                throw new AbiTypeParseException("Fixed array length must be positive in type: " + original);
            }
            try {
                return new AbiType.ArrayType(element, size);
            } catch (ArithmeticException e) {
                throw new AbiTypeParseException("Type too large: " + original, e);
            }
        }

        String body = type;
        if (body.startsWith("tuple(")) {
            body = body.substring("tuple".length());
        }
        if (body.startsWith("(")) {
            if (!body.endsWith(")")) {
                throw new AbiTypeParseException("Unbalanced parentheses in type: " + original);
            }
            final String inner = body.substring(1, body.length() - 1);
            final List<AbiType> components = new ArrayList<>();
            if (!inner.isBlank()) {
                for (final String component : splitTopLevel(inner, original)) {
                    final String c = component.trim();
                    if (c.isEmpty()) {
                        throw new AbiTypeParseException("Empty tuple component in type: " + original);
                    }
                    components.add(parseTrimmed(c, original));
                }
            }
            try {
                return new AbiType.TupleType(components);
            } catch (ArithmeticException e) {
                throw new AbiTypeParseException("Type too large: " + original, e);
            }
        }
        return parseElementary(type, original);
    }

    private static AbiType parseElementary(final String type, final String original) {
        switch (type) {
            case "address":
                return AbiType.address();
            case "bool":
                return AbiType.bool();
            case "string":
                return AbiType.string();
            case "bytes":
                return AbiType.bytes();
            case "uint":
                return AbiType.uint(256);
            case "int":
                return AbiType.signedInt(256);
            default:
                break;
        }
        try {
            if (type.startsWith("uint")) {
                return new AbiType.UIntType(width(type.substring(4), original));
            }
            if (type.startsWith("int")) {
                return new AbiType.IntType(width(type.substring(3), original));
            }
            if (type.startsWith("bytes")) {
                return new AbiType.FixedBytesType(width(type.substring(5), original));
            }
        } catch (IllegalArgumentException e) {
            throw new AbiTypeParseException("Invalid type '" + type + "': " + e.getMessage(), e);
        }
        throw new AbiTypeParseException("Unknown ABI type '" + type + "' in: " + original);
    }

    private static int width(final String digits, final String original) {
        if (!DIGITS.matcher(digits).matches() || digits.startsWith("0") || digits.length() > 3) {
            throw new AbiTypeParseException("Invalid type width '" + digits + "' in: " + original);
        }
        return Integer.parseInt(digits);
    }

    /**
     * Splits on commas that are not nested inside parentheses or brackets.
     */
    static List<String> splitTopLevel(final String input, final String original) {
        final List<String> parts = new ArrayList<>();
        int parenDepth = 0;
        int bracketDepth = 0;
        int start = 0;
        for (int i = 0; i < input.length(); i++) {
            final char c = input.charAt(i);
            switch (c) {
                case '(' -> parenDepth++;
                case ')' -> parenDepth--;
                case '[' -> bracketDepth++;
                case ']' -> bracketDepth--;
                case ',' -> {
                    if (parenDepth == 0 && bracketDepth == 0) {
                        parts.add(input.substring(start, i));
                        start = i + 1;
                    }
                }
                default -> {
                }
            }
            if (parenDepth < 0 || bracketDepth < 0) {
                throw new AbiTypeParseException("Unbalanced brackets in: " + original);
            }
        }
        if (parenDepth != 0 || bracketDepth != 0) {
            throw new AbiTypeParseException("Unbalanced brackets in: " + original);
        }
        parts.add(input.substring(start));
        return parts;
    }

    private static String stripParameterName(final String component, final String original) {
        if (component.isEmpty()) {
            throw new AbiTypeParseException("Empty parameter in signature: " + original);
        }
        int end;
        if (component.startsWith("(") || component.startsWith("tuple(")) {
            int depth = 0;
            end = component.indexOf('(');
            for (; end < component.length(); end++) {
                final char c = component.charAt(end);
                if (c == '(') {
                    depth++;
                } else if (c == ')' && --depth == 0) {
                    end++;
                    break;
                }
            }
            while (end < component.length() && component.charAt(end) == '[') {
                final int close = component.indexOf(']', end);
                if (close < 0) {
                    break;
                }
                end = close + 1;
            }
        } else {
            end = 0;
            while (end < component.length() && !Character.isWhitespace(component.charAt(end))) {
                end++;
            }
        }
        final String rest = component.substring(end).trim();
        for (final String token : rest.isEmpty() ? new String[0] : rest.split("\\s+")) {
            if (!IDENTIFIER.matcher(token).matches()) {
                throw new AbiTypeParseException("Unexpected token '" + token + "' in signature: " + original);
            }
        }
        return component.substring(0, end);
    }
}
