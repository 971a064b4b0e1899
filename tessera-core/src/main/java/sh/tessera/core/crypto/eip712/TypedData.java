// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sh.tessera.core.DebugLogger;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.crypto.Secp256k1;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.Signer;
import sh.tessera.core.crypto.Signers;
import sh.tessera.core.error.Eip712Exception;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.primitives.Hex;

/**
 * An EIP-712 typed-data message: domain, struct definitions, primary type and message values.
 *
 * <p>Message values are plain Java objects: nested structs are {@link Map}s, arrays are
 * {@link List}s, and atomic values take the same shapes ABI encoding accepts ({@link BigInteger},
 * {@code long}, {@link Address}, hex strings, {@code byte[]}, {@link Boolean}, {@link String}).
 *
 * <pre>{@code
 * TypedData mail = TypedData.create(domain, "Mail", types, message);
 * Hash digest = mail.hash();            // keccak256(0x1901 || domainSeparator || hashStruct(message))
 * Signature sig = mail.sign(signer);    // v is 27 or 28
 * }</pre>
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public final class TypedData {

    private static final byte[] PREFIX = {0x19, 0x01};
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, true);

    private final Eip712Domain domain;
    private final String primaryType;
    private final Map<String, List<TypedDataField>> types;
    private final Map<String, Object> message;

    private TypedData(
            final Eip712Domain domain,
            final String primaryType,
            final Map<String, List<TypedDataField>> types,
            final Map<String, Object> message) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.primaryType = Objects.requireNonNull(primaryType, "primaryType");
        this.message = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(message, "message")));
        Objects.requireNonNull(types, "types");
        final Map<String, List<TypedDataField>> copy = new LinkedHashMap<>();
        types.forEach((name, fields) -> {
            if (!TypedDataEncoder.DOMAIN_TYPE.equals(name)) {
                copy.put(name, List.copyOf(fields));
            }
        });
        if (!copy.containsKey(primaryType)) {
            throw Eip712Exception.primaryTypeNotFound(primaryType);
        }
        this.types = Map.copyOf(copy);
    }

    /**
     * @throws Eip712Exception if {@code primaryType} is not defined in {@code types}
     */
    public static TypedData create(
            final Eip712Domain domain,
            final String primaryType,
            final Map<String, List<TypedDataField>> types,
            final Map<String, Object> message) {
        return new TypedData(domain, primaryType, types, message);
    }

    /**
     * Parses the {@code eth_signTypedData_v4} JSON shape. An {@code EIP712Domain} entry in
     * {@code types} is ignored; the domain type is derived from the fields present in
     * {@code domain}.
     *
     * @throws Eip712Exception if the JSON is malformed or a required member is missing
     */
    public static TypedData fromJson(final String json) {
        if (json == null || json.isBlank()) {
            throw new Eip712Exception("Typed data json must not be null or empty");
        }
        final Map<String, Object> root;
        try {
            root = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() { });
        } catch (JsonProcessingException e) {
            throw new Eip712Exception("Invalid EIP-712 JSON: " + e.getOriginalMessage(), e);
        }
        final Object primaryType = root.get("primaryType");
        if (!(primaryType instanceof String primary)) {
            throw new Eip712Exception("Typed data json is missing 'primaryType'");
        }
        return create(
                parseDomain(member(root, "domain")),
                primary,
                parseTypes(member(root, "types")),
                member(root, "message"));
    }

    /**
     * The digest to sign: {@code keccak256(0x19 0x01 || domainSeparator || hashStruct(message))}.
     */
    public Hash hash() {
        final byte[] structHash = TypedDataEncoder.hashStruct(primaryType, types, message);
        return Hash.fromBytes(Keccak256.hash(PREFIX, domain.separator().toBytes(), structHash));
    }

    /**
     * {@code hashStruct} of the message under the primary type.
     */
    public Hash structHash() {
        return Hash.fromBytes(TypedDataEncoder.hashStruct(primaryType, types, message));
    }

    /**
     * The canonical type string of the primary type, dependencies included.
     */
    public String encodeType() {
        return TypedDataEncoder.encodeType(primaryType, types);
    }

    /**
     * Signs {@link #hash()} directly, without the EIP-191 personal-message prefix.
     *
     * @return the signature with {@code v} of 27 or 28
     * @throws sh.tessera.core.error.SigningException if the signer fails
     */
    public Signature sign(final Signer signer) {
        final Hash digest = hash();
        final Signature signature = Signers.sign(signer, digest.toBytes());
        DebugLogger.logSign("[SIGN] typedData primaryType=%s hash=%s", primaryType, digest);
        return signature.withV(27 + signature.recoveryId());
    }

    /**
     * Recovers the address that produced {@code signature} over {@link #hash()}.
     */
    public Address recoverSigner(final Signature signature) {
        return Secp256k1.recoverAddress(hash().toBytes(), signature);
    }

    public Eip712Domain domain() {
        return domain;
    }

    public String primaryType() {
        return primaryType;
    }

    public Map<String, List<TypedDataField>> types() {
        return types;
    }

    public Map<String, Object> message() {
        return message;
    }

    private static Eip712Domain parseDomain(final Map<String, Object> json) {
        final Eip712Domain.Builder builder = Eip712Domain.builder();
        if (json.get("name") != null) {
            builder.name(json.get("name").toString());
        }
        if (json.get("version") != null) {
            builder.version(json.get("version").toString());
        }
        final Object chainId = json.get("chainId");
        if (chainId != null) {
            builder.chainId(toLong(chainId));
        }
        try {
            if (json.get("verifyingContract") != null) {
                builder.verifyingContract(Address.of(json.get("verifyingContract").toString()));
            }
            if (json.get("salt") != null) {
                builder.salt(Hash.of(json.get("salt").toString()));
            }
        } catch (IllegalArgumentException e) {
            throw new Eip712Exception("Invalid EIP-712 domain: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static long toLong(final Object chainId) {
        try {
            if (chainId instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (chainId instanceof Number number) {
                return number.longValue();
            }
            final String text = chainId.toString();
            return Hex.hasPrefix(text) ? Long.parseLong(Hex.cleanPrefix(text), 16) : Long.parseLong(text);
        } catch (ArithmeticException | NumberFormatException e) {
            throw new Eip712Exception("Invalid EIP-712 domain chainId: " + chainId, e);
        }
    }

    private static Map<String, List<TypedDataField>> parseTypes(final Map<String, Object> json) {
        final Map<String, List<TypedDataField>> types = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : json.entrySet()) {
            if (!(entry.getValue() instanceof List<?> members)) {
                throw new Eip712Exception("Type '" + entry.getKey() + "' must be an array of fields");
            }
            final List<TypedDataField> fields = new ArrayList<>(members.size());
            for (final Object member : members) {
                if (!(member instanceof Map<?, ?> field)
                        || !(field.get("name") instanceof String name)
                        || !(field.get("type") instanceof String type)) {
                    throw new Eip712Exception("Malformed field in type '" + entry.getKey() + "'");
                }
                fields.add(TypedDataField.of(name, type));
            }
            types.put(entry.getKey(), fields);
        }
        return types;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> member(final Map<String, Object> root, final String name) {
        if (root.get(name) instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new Eip712Exception("Typed data json is missing object '" + name + "'");
    }
}
