// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import sh.tessera.core.error.AbiDecodingException;
import sh.tessera.core.types.Hash;

/**
 * Decodes event logs against an {@link AbiEvent}.
 *
 * <p>Indexed value types (integers, address, bool, {@code bytesN}) are read back from their
 * topic. Indexed strings, bytes, arrays and tuples are stored by Solidity as the Keccak-256 hash
 * of their encoding, so the 32-byte topic itself is returned as a {@link AbiValue.BytesValue}.
 * Non-indexed parameters are decoded from the log data as one tuple.
 */
public final class EventDecoder {

    private EventDecoder() {
    }

    /**
     * @param event  the event definition
     * @param topics the log topics, including topic 0 for non-anonymous events
     * @param data   the log data
     * @return parameter name to value, in declaration order; unnamed parameters are keyed by
     *         their position
     * @throws AbiDecodingException if topic 0 does not match, the topic count is wrong, or the
     *                              data does not decode
     */
    public static Map<String, AbiValue> decode(
            final AbiEvent event, final List<Hash> topics, final byte[] data) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(topics, "topics");
        final List<AbiParameter> inputs = event.inputs();

        int topicIndex = 0;
        if (!event.anonymous()) {
            if (topics.isEmpty() || !topics.get(0).equals(event.topic())) {
                throw new AbiDecodingException("Log topic 0 does not match event " + event.signature());
            }
            topicIndex = 1;
        }
        final long indexedCount = inputs.stream().filter(AbiParameter::indexed).count();
        if (topics.size() - topicIndex != indexedCount) {
            throw new AbiDecodingException("Event " + event.signature() + " expects " + indexedCount
                    + " indexed topics, got " + (topics.size() - topicIndex));
        }

        final List<AbiType> dataTypes = new ArrayList<>();
        for (final AbiParameter input : inputs) {
            if (!input.indexed()) {
                dataTypes.add(input.abiType());
            }
        }
        final List<AbiValue> dataValues = dataTypes.isEmpty()
                ? List.of()
                : AbiDecoder.decode(dataTypes, data == null ? new byte[0] : data);

        final Map<String, AbiValue> result = new LinkedHashMap<>();
        int dataIndex = 0;
        for (int i = 0; i < inputs.size(); i++) {
            final AbiParameter input = inputs.get(i);
            final String key = input.name().isEmpty() ? Integer.toString(i) : input.name();
            final AbiValue value;
            if (input.indexed()) {
                value = decodeTopic(input.abiType(), topics.get(topicIndex++));
            } else {
                value = dataValues.get(dataIndex++);
            }
            result.put(key, value);
        }
        return Collections.unmodifiableMap(result);
    }

    private static AbiValue decodeTopic(final AbiType type, final Hash topic) {
        final byte[] word = topic.toBytes();
        if (type.isDynamic() || type instanceof AbiType.ArrayType || type instanceof AbiType.TupleType) {
            return AbiValue.bytes(word);
        }
        return AbiDecoder.decode(type, word);
    }
}
