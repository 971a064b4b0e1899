// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.List;
import java.util.Objects;

/**
 * A custom error from ABI JSON, matched against revert data by {@link RevertDecoder}.
 */
public record AbiError(String name, List<AbiParameter> inputs) {

    public AbiError {
        Objects.requireNonNull(name, "name");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
    }

    public String signature() {
        return AbiParameter.signature(name, inputs);
    }

    public byte[] selector() {
        return Selectors.keccak().selector(signature());
    }

    public List<AbiType> inputTypes() {
        return AbiParameter.types(inputs);
    }
}
