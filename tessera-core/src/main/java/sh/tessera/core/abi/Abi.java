// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.tessera.core.error.AbiEncodingException;
import sh.tessera.core.error.AbiTypeParseException;
import sh.tessera.primitives.Hex;

/**
 * A contract ABI loaded from its standard JSON description.
 *
 * <p>Functions, events and errors are kept in declaration order. Overloads are allowed: lookups
 * take either a full signature such as {@code transfer(address,uint256)} or a bare name when only
 * one item carries it. {@code fallback} and {@code receive} entries carry no parameters and are
 * skipped.
 *
 * <pre>{@code
 * Abi abi = Abi.fromJson(json);
 * byte[] data = abi.encodeFunction("transfer", recipient, BigInteger.TEN);
 * }</pre>
 */
public final class Abi {

    private static final Logger LOG = LoggerFactory.getLogger(Abi.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<AbiFunction> functions;
    private final List<AbiEvent> events;
    private final List<AbiError> errors;
    private final AbiFunction constructor;

    public Abi(
            final List<AbiFunction> functions,
            final List<AbiEvent> events,
            final List<AbiError> errors,
            final AbiFunction constructor) {
        this.functions = List.copyOf(functions);
        this.events = List.copyOf(events);
        this.errors = List.copyOf(errors);
        this.constructor = constructor;
    }

    /**
     * Parses ABI JSON.
     *
     * @throws AbiTypeParseException if the JSON is malformed, a required field is missing or a
     *                               parameter type is invalid
     */
    public static Abi fromJson(final String json) {
        if (json == null || json.isBlank()) {
            throw new AbiTypeParseException("ABI json must not be null or empty");
        }
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AbiTypeParseException("Unable to parse ABI json", e);
        }
        if (!root.isArray()) {
            throw new AbiTypeParseException("ABI json must be an array");
        }

        final List<AbiFunction> functions = new ArrayList<>();
        final List<AbiEvent> events = new ArrayList<>();
        final List<AbiError> errors = new ArrayList<>();
        AbiFunction constructor = null;
        int index = 0;
        for (final JsonNode node : root) {
            final String context = "item " + index++;
            // a missing type means "function" in older compilers' output
            final String type = node.path("type").asText("function").toLowerCase(Locale.ROOT);
            switch (type) {
                case "function" -> functions.add(parseFunction(node, context));
                case "event" -> events.add(parseEvent(node, context));
                case "error" -> errors.add(parseError(node, context));
                case "constructor" -> {
                    if (constructor != null) {
                        throw new AbiTypeParseException("Multiple constructors found in ABI");
                    }
                    constructor = new AbiFunction(
                            "constructor",
                            parseParameters(node, "inputs", context),
                            List.of(),
                            parseStateMutability(node));
                }
                case "fallback", "receive" -> LOG.debug("Skipping {} entry at {}", type, context);
                default -> throw new AbiTypeParseException(
                        "Unknown ABI item type '" + type + "' at " + context);
            }
        }
        return new Abi(functions, events, errors, constructor);
    }

    /**
     * Writes this ABI back out as JSON. Output always uses {@code stateMutability}, never the
     * legacy {@code constant}/{@code payable} flags.
     */
    public String toJson() {
        final ArrayNode root = MAPPER.createArrayNode();
        if (constructor != null) {
            final ObjectNode node = root.addObject();
            node.put("type", "constructor");
            node.set("inputs", writeParameters(constructor.inputs(), false));
            node.put("stateMutability", constructor.stateMutability());
        }
        for (final AbiFunction fn : functions) {
            final ObjectNode node = root.addObject();
            node.put("type", "function");
            node.put("name", fn.name());
            node.set("inputs", writeParameters(fn.inputs(), false));
            node.set("outputs", writeParameters(fn.outputs(), false));
            node.put("stateMutability", fn.stateMutability());
        }
        for (final AbiEvent event : events) {
            final ObjectNode node = root.addObject();
            node.put("type", "event");
            node.put("name", event.name());
            node.set("inputs", writeParameters(event.inputs(), true));
            node.put("anonymous", event.anonymous());
        }
        for (final AbiError error : errors) {
            final ObjectNode node = root.addObject();
            node.put("type", "error");
            node.put("name", error.name());
            node.set("inputs", writeParameters(error.inputs(), false));
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to write ABI json", e);
        }
    }

    public List<AbiFunction> functions() {
        return functions;
    }

    public List<AbiEvent> events() {
        return events;
    }

    public List<AbiError> errors() {
        return errors;
    }

    public Optional<AbiFunction> constructor() {
        return Optional.ofNullable(constructor);
    }

    /**
     * Looks up a function by full signature, or by name when the name is not overloaded.
     *
     * @throws AbiEncodingException if a bare name matches more than one overload
     */
    public Optional<AbiFunction> getFunction(final String nameOrSignature) {
        return lookup(functions, nameOrSignature, AbiFunction::name, AbiFunction::signature, "function");
    }

    public Optional<AbiEvent> getEvent(final String nameOrSignature) {
        return lookup(events, nameOrSignature, AbiEvent::name, AbiEvent::signature, "event");
    }

    public Optional<AbiError> getError(final String nameOrSignature) {
        return lookup(errors, nameOrSignature, AbiError::name, AbiError::signature, "error");
    }

    /**
     * Call data for the named function; see {@link AbiFunction#encodeCall(Object...)}.
     *
     * @throws AbiEncodingException if no such function exists or the arguments do not fit
     */
    public byte[] encodeFunction(final String nameOrSignature, final Object... args) {
        return getFunction(nameOrSignature)
                .orElseThrow(() -> new AbiEncodingException("No function '" + nameOrSignature + "' in ABI"))
                .encodeCall(args);
    }

    /**
     * Encoded constructor arguments. An ABI without a constructor accepts no arguments.
     */
    public byte[] encodeConstructor(final Object... args) {
        if (constructor == null) {
            if (args != null && args.length > 0) {
                throw new AbiEncodingException("ABI has no constructor but " + args.length + " arguments were given");
            }
            return new byte[0];
        }
        return constructor.encodeArguments(args);
    }

    /**
     * Errors keyed by their 4-byte selector in hex, for {@link RevertDecoder}.
     */
    Map<String, AbiError> errorsBySelector() {
        final Map<String, AbiError> bySelector = new LinkedHashMap<>();
        for (final AbiError error : errors) {
            bySelector.putIfAbsent(Hex.encodeNoPrefix(error.selector()), error);
        }
        return Collections.unmodifiableMap(bySelector);
    }

    private static <T> Optional<T> lookup(
            final List<T> items,
            final String key,
            final Function<T, String> name,
            final Function<T, String> signature,
            final String kind) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        if (key.indexOf('(') >= 0) {
            final String canonical = TypeParser.parseSignature(key).canonical();
            return items.stream().filter(i -> signature.apply(i).equals(canonical)).findFirst();
        }
        final List<T> matches = items.stream().filter(i -> name.apply(i).equals(key)).toList();
        if (matches.size() > 1) {
            throw new AbiEncodingException(
                    "Overloaded " + kind + " '" + key + "'; look it up by full signature");
        }
        return matches.stream().findFirst();
    }

    private static AbiFunction parseFunction(final JsonNode node, final String context) {
        final String name = requireText(node, "name", "function " + context);
        return new AbiFunction(
                name,
                parseParameters(node, "inputs", "function " + name),
                parseParameters(node, "outputs", "function " + name),
                parseStateMutability(node));
    }

    private static AbiEvent parseEvent(final JsonNode node, final String context) {
        final String name = requireText(node, "name", "event " + context);
        return new AbiEvent(
                name, parseParameters(node, "inputs", "event " + name), node.path("anonymous").asBoolean(false));
    }

    private static AbiError parseError(final JsonNode node, final String context) {
        final String name = requireText(node, "name", "error " + context);
        return new AbiError(name, parseParameters(node, "inputs", "error " + name));
    }

    private static String parseStateMutability(final JsonNode node) {
        final String stateMutability = node.path("stateMutability").asText("");
        if (!stateMutability.isBlank()) {
            return stateMutability.toLowerCase(Locale.ROOT);
        }
        if (node.path("constant").asBoolean(false)) {
            return "view";
        }
        return node.path("payable").asBoolean(false) ? "payable" : "nonpayable";
    }

    private static List<AbiParameter> parseParameters(
            final JsonNode node, final String field, final String context) {
        final JsonNode array = node.path(field);
        if (array.isMissingNode() || array.isNull()) {
            return List.of();
        }
        if (!array.isArray()) {
            throw new AbiTypeParseException("Field '" + field + "' must be an array in " + context);
        }
        final List<AbiParameter> params = new ArrayList<>(array.size());
        for (final JsonNode param : array) {
            final String type = requireText(param, "type", "parameter of " + context);
            params.add(new AbiParameter(
                    param.path("name").asText(""),
                    type,
                    param.path("indexed").asBoolean(false),
                    parseParameters(param, "components", context)));
        }
        return params;
    }

    private static ArrayNode writeParameters(final List<AbiParameter> parameters, final boolean withIndexed) {
        final ArrayNode array = MAPPER.createArrayNode();
        for (final AbiParameter param : parameters) {
            final ObjectNode node = array.addObject();
            node.put("name", param.name());
            node.put("type", param.type());
            if (withIndexed) {
                node.put("indexed", param.indexed());
            }
            if (!param.components().isEmpty()) {
                node.set("components", writeParameters(param.components(), false));
            }
        }
        return array;
    }

    private static String requireText(final JsonNode node, final String field, final String context) {
        final JsonNode value = node.path(field);
        if (value.isMissingNode() || !value.isTextual()) {
            throw new AbiTypeParseException(
                    "Field '" + field + "' is required and must be a string in " + context);
        }
        return value.asText();
    }
}
