// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import sh.tessera.core.abi.AbiEncoder;
import sh.tessera.core.abi.AbiType;
import sh.tessera.core.abi.AbiValue;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.error.AbiTypeParseException;
import sh.tessera.core.error.Eip712Exception;
import sh.tessera.core.types.Hash;

/**
 * The EIP-712 encoding rules: {@code encodeType}, {@code typeHash}, {@code encodeData} and
 * {@code hashStruct}. Atomic members are encoded as single ABI words; {@code string},
 * {@code bytes}, arrays and nested structs contribute the hash of their encoding.
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
final class TypedDataEncoder {

    static final String DOMAIN_TYPE = "EIP712Domain";

    private TypedDataEncoder() {
    }

    /**
     * {@code Primary(...)Dep1(...)Dep2(...)} with dependencies sorted by name.
     */
    static String encodeType(final String typeName, final Map<String, List<TypedDataField>> types) {
        if (!types.containsKey(typeName)) {
            throw Eip712Exception.unknownType(typeName);
        }
        final Set<String> deps = new LinkedHashSet<>();
        collectDependencies(typeName, types, deps);
        deps.remove(typeName);

        final StringBuilder out = new StringBuilder();
        appendType(out, typeName, types.get(typeName));
        deps.stream().sorted().forEach(dep -> appendType(out, dep, types.get(dep)));
        return out.toString();
    }

    static byte[] typeHash(final String typeName, final Map<String, List<TypedDataField>> types) {
        return Keccak256.hash(encodeType(typeName, types).getBytes(StandardCharsets.UTF_8));
    }

    static byte[] encodeData(
            final String typeName, final Map<String, List<TypedDataField>> types, final Map<String, Object> data) {
        final List<TypedDataField> fields = types.get(typeName);
        if (fields == null) {
            throw Eip712Exception.unknownType(typeName);
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream(32 * fields.size());
        for (final TypedDataField field : fields) {
            final Object value = data.get(field.name());
            if (value == null) {
                throw Eip712Exception.missingField(typeName, field.name());
            }
            out.writeBytes(encodeField(field.type(), value, types));
        }
        return out.toByteArray();
    }

    /**
     * {@code keccak256(typeHash || encodeData)}.
     */
    static byte[] hashStruct(
            final String typeName, final Map<String, List<TypedDataField>> types, final Map<String, Object> data) {
        return Keccak256.hash(typeHash(typeName, types), encodeData(typeName, types, data));
    }

    static Hash hashDomain(final Eip712Domain domain) {
        final List<TypedDataField> fields = new ArrayList<>();
        final Map<String, Object> data = new LinkedHashMap<>();
        if (domain.name() != null) {
            fields.add(TypedDataField.of("name", "string"));
            data.put("name", domain.name());
        }
        if (domain.version() != null) {
            fields.add(TypedDataField.of("version", "string"));
            data.put("version", domain.version());
        }
        if (domain.chainId() != null) {
            fields.add(TypedDataField.of("chainId", "uint256"));
            data.put("chainId", domain.chainId());
        }
        if (domain.verifyingContract() != null) {
            fields.add(TypedDataField.of("verifyingContract", "address"));
            data.put("verifyingContract", domain.verifyingContract());
        }
        if (domain.salt() != null) {
            fields.add(TypedDataField.of("salt", "bytes32"));
            data.put("salt", domain.salt().toBytes());
        }
        return Hash.fromBytes(hashStruct(DOMAIN_TYPE, Map.of(DOMAIN_TYPE, fields), data));
    }

    static byte[] encodeField(final String type, final Object value, final Map<String, List<TypedDataField>> types) {
        if (type.endsWith("]")) {
            return encodeArray(type, value, types);
        }
        if (types.containsKey(type)) {
            return hashStruct(type, types, asStruct(type, value));
        }
        final AbiType abiType;
        try {
            abiType = AbiType.parse(type);
        } catch (AbiTypeParseException e) {
            throw new Eip712Exception("Unknown EIP-712 type: " + type, e);
        }
        if (abiType instanceof AbiType.TupleType) {
            throw Eip712Exception.unknownType(type);
        }
        try {
            final AbiValue abiValue = AbiValue.from(abiType, value);
            if (abiType instanceof AbiType.StringType) {
                return Keccak256.hash(abiValue.asString().getBytes(StandardCharsets.UTF_8));
            }
            if (abiType instanceof AbiType.BytesType) {
                return Keccak256.hash(abiValue.asBytes());
            }
            return AbiEncoder.encode(abiType, abiValue);
        } catch (AbiEncodingException e) {
            throw Eip712Exception.invalidValue(type, value, e);
        }
    }

    private static byte[] encodeArray(
            final String type, final Object value, final Map<String, List<TypedDataField>> types) {
        final int open = type.lastIndexOf('[');
        if (open <= 0) {
            throw Eip712Exception.unknownType(type);
        }
        final String elementType = type.substring(0, open);
        final String length = type.substring(open + 1, type.length() - 1);
        if (!(value instanceof List<?> elements)) {
            throw Eip712Exception.invalidValue(type, value, null);
        }
        if (!length.isEmpty()) {
            final int expected;
            try {
                expected = Integer.parseInt(length);
            } catch (NumberFormatException e) {
                throw new Eip712Exception("Unknown EIP-712 type: " + type, e);
            }
            if (expected != elements.size()) {
                throw new Eip712Exception(
                        "Array " + type + " expects " + expected + " elements, got " + elements.size());
            }
        }
        final ByteArrayOutputStream out = new ByteArrayOutputStream(32 * elements.size());
        for (final Object element : elements) {
            out.writeBytes(encodeField(elementType, element, types));
        }
        return Keccak256.hash(out.toByteArray());
    }

    private static void collectDependencies(
            final String typeName, final Map<String, List<TypedDataField>> types, final Set<String> found) {
        if (!found.add(typeName)) {
            return;
        }
        for (final TypedDataField field : types.get(typeName)) {
            final String base = baseType(field.type());
            if (types.containsKey(base)) {
                collectDependencies(base, types, found);
            }
        }
    }

    private static void appendType(final StringBuilder out, final String name, final List<TypedDataField> fields) {
        out.append(name).append('(');
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            out.append(fields.get(i).type()).append(' ').append(fields.get(i).name());
        }
        out.append(')');
    }

    private static String baseType(final String type) {
        final int bracket = type.indexOf('[');
        return bracket >= 0 ? type.substring(0, bracket) : type;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asStruct(final String type, final Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw Eip712Exception.invalidValue(type, value, null);
    }
}
