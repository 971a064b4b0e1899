// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One entry of an {@code inputs}, {@code outputs} or {@code components} array in ABI JSON.
 *
 * <p>{@code type} is kept exactly as written in the JSON, so a struct stays {@code "tuple"} or
 * {@code "tuple[]"} with its members in {@code components}. {@link #canonicalType()} expands that
 * into the form used for signatures and for {@link TypeParser}.
 *
 * @param name       parameter name, empty when unnamed
 * @param type       the JSON type string
 * @param indexed    whether an event parameter is stored in a topic
 * @param components tuple members, empty for non-tuple types
 */
public record AbiParameter(String name, String type, boolean indexed, List<AbiParameter> components) {

    public AbiParameter {
        name = name == null ? "" : name;
        Objects.requireNonNull(type, "type");
        components = components == null ? List.of() : List.copyOf(components);
        // fail at construction, not at first encode
        TypeParser.parse(canonicalType(type, components));
    }

    public static AbiParameter of(final String name, final String type) {
        return new AbiParameter(name, type, false, List.of());
    }

    public static AbiParameter indexed(final String name, final String type) {
        return new AbiParameter(name, type, true, List.of());
    }

    public String canonicalType() {
        return canonicalType(type, components);
    }

    public AbiType abiType() {
        return TypeParser.parse(canonicalType());
    }

    static List<AbiType> types(final List<AbiParameter> parameters) {
        return parameters.stream().map(AbiParameter::abiType).toList();
    }

    static String signature(final String name, final List<AbiParameter> parameters) {
        return parameters.stream()
                .map(AbiParameter::canonicalType)
                .collect(Collectors.joining(",", name + "(", ")"));
    }

    private static String canonicalType(final String type, final List<AbiParameter> components) {
        if (type.equals("tuple") || type.startsWith("tuple[")) {
            final String suffix = type.substring("tuple".length());
            return components.stream()
                    .map(AbiParameter::canonicalType)
                    .collect(Collectors.joining(",", "(", ")")) + suffix;
        }
        return type;
    }
}
