// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import sh.tessera.core.error.AbiEncodingException;

/**
 * A function (or the constructor) from ABI JSON.
 *
 * @param name            function name; {@code "constructor"} for the constructor
 * @param inputs          call parameters
 * @param outputs         return parameters, always empty for the constructor
 * @param stateMutability one of {@code pure}, {@code view}, {@code nonpayable}, {@code payable}
 */
public record AbiFunction(
        String name, List<AbiParameter> inputs, List<AbiParameter> outputs, String stateMutability) {

    public AbiFunction {
        Objects.requireNonNull(name, "name");
        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        stateMutability = stateMutability == null || stateMutability.isBlank()
                ? "nonpayable"
                : stateMutability.toLowerCase(Locale.ROOT);
    }

    /**
     * Canonical signature, e.g. {@code transfer(address,uint256)}.
     */
    public String signature() {
        return AbiParameter.signature(name, inputs);
    }

    public byte[] selector() {
        return Selectors.keccak().selector(signature());
    }

    public boolean isReadOnly() {
        return "view".equals(stateMutability) || "pure".equals(stateMutability);
    }

    public boolean isPayable() {
        return "payable".equals(stateMutability);
    }

    public List<AbiType> inputTypes() {
        return AbiParameter.types(inputs);
    }

    public List<AbiType> outputTypes() {
        return AbiParameter.types(outputs);
    }

    /**
     * Selector followed by the encoded arguments. Arguments are coerced with
     * {@link AbiValue#from(AbiType, Object)}.
     */
    public byte[] encodeCall(final Object... args) {
        final List<AbiType> types = inputTypes();
        return AbiEncoder.encodeFunction(selector(), types, coerce(name, types, args));
    }

    /**
     * Encoded arguments without a selector, as appended to constructor bytecode.
     */
    public byte[] encodeArguments(final Object... args) {
        final List<AbiType> types = inputTypes();
        return AbiEncoder.encode(types, coerce(name, types, args));
    }

    /**
     * Decodes return data (no selector) against {@link #outputs()}.
     */
    public List<AbiValue> decodeFunctionResult(final byte[] returnData) {
        return AbiDecoder.decode(outputTypes(), returnData);
    }

    static List<AbiValue> coerce(final String name, final List<AbiType> types, final Object[] args) {
        final Object[] actual = args == null ? new Object[0] : args;
        if (actual.length != types.size()) {
            throw new AbiEncodingException(
                    "Function '" + name + "' expects " + types.size() + " arguments, got " + actual.length);
        }
        final List<AbiValue> values = new ArrayList<>(actual.length);
        for (int i = 0; i < actual.length; i++) {
            values.add(AbiValue.from(types.get(i), actual[i]));
        }
        return values;
    }
}
