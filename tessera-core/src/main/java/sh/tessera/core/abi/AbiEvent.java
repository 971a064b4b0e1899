// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.List;
import java.util.Objects;
import sh.tessera.core.types.Hash;

/**
 * An event from ABI JSON. Decoding is done by {@link EventDecoder}.
 */
public record AbiEvent(String name, List<AbiParameter> inputs, boolean anonymous) {

    public AbiEvent {
        Objects.requireNonNull(name, "name");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    public String signature() {
        return AbiParameter.signature(name, inputs);
    }

    /**
     * Topic 0 of a non-anonymous log of this event.
     */
    public Hash topic() {
        return Selectors.keccak().topic(signature());
    }
}
