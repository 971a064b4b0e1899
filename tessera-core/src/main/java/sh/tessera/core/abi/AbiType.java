// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.abi;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Recursive description of a Solidity ABI type.
 *
 * <p>Whether a type is dynamic and how many head bytes it occupies are structural facts, fixed when
 * the node is built:
 * <ul>
 *   <li>{@code bytes}, {@code string} and {@code T[]} are dynamic;</li>
 *   <li>a tuple or {@code T[k]} is dynamic iff one of its components is;</li>
 *   <li>a dynamic type occupies one 32-byte head slot (its offset);</li>
 *   <li>a static tuple or fixed array occupies the sum of its components' static sizes, so
 *       {@code ((uint256,uint256),uint256)} occupies 96 bytes;</li>
 *   <li>every other static type occupies one slot.</li>
 * </ul>
 *
 * <p>Instances are immutable and safe to share between threads.
 *
 * @see TypeParser
 */
public sealed interface AbiType
        permits AbiType.UIntType,
        AbiType.IntType,
        AbiType.AddressType,
        AbiType.BoolType,
        AbiType.FixedBytesType,
        AbiType.BytesType,
        AbiType.StringType,
        AbiType.ArrayType,
        AbiType.TupleType {

    int SLOT_SIZE = 32;

    /**
     * Returns {@code true} if values of this type are stored in the tail and referenced by offset.
     */
    boolean isDynamic();

    /**
     * Number of bytes this type occupies in its enclosing head.
     */
    int staticSize();

    /**
     * Canonical type string as used in signatures, e.g. {@code (uint256,address)[3]}.
     */
    String canonical();

    static AbiType parse(final String type) {
        return TypeParser.parse(type);
    }

    static UIntType uint(final int bits) {
        return new UIntType(bits);
    }

    static IntType signedInt(final int bits) {
        return new IntType(bits);
    }

    static AddressType address() {
        return AddressType.INSTANCE;
    }

    static BoolType bool() {
        return BoolType.INSTANCE;
    }

    static FixedBytesType bytes(final int size) {
        return new FixedBytesType(size);
    }

    static BytesType bytes() {
        return BytesType.INSTANCE;
    }

    static StringType string() {
        return StringType.INSTANCE;
    }

    static ArrayType array(final AbiType element) {
        return new ArrayType(element, ArrayType.DYNAMIC);
    }

    static ArrayType array(final AbiType element, final int length) {
        return new ArrayType(element, length);
    }

    static TupleType tuple(final AbiType... components) {
        return new TupleType(List.of(components));
    }

    private static void checkBits(final int bits, final String kind) {
        if (bits < 8 || bits > 256 || bits % 8 != 0) {
            throw new IllegalArgumentException("Invalid " + kind + " width: " + bits);
        }
    }

    /**
     * {@code uintN}, holding values in {@code [0, 2^N)}.
     */
    record UIntType(int bits) implements AbiType {
        public UIntType {
            AbiType.checkBits(bits, "uint");
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "uint" + bits;
        }
    }

    /**
     * {@code intN}, holding values in {@code [-2^(N-1), 2^(N-1))}.
     */
    record IntType(int bits) implements AbiType {
        public IntType {
            AbiType.checkBits(bits, "int");
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "int" + bits;
        }
    }

    record AddressType() implements AbiType {
        static final AddressType INSTANCE = new AddressType();

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "address";
        }
    }

    record BoolType() implements AbiType {
        static final BoolType INSTANCE = new BoolType();

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "bool";
        }
    }

    /**
     * {@code bytesN} with {@code 1 <= N <= 32}; right-padded in its slot.
     */
    record FixedBytesType(int size) implements AbiType {
        public FixedBytesType {
            if (size < 1 || size > 32) {
                throw new IllegalArgumentException("Invalid bytesN size: " + size);
            }
        }

        @Override
        public boolean isDynamic() {
            return false;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "bytes" + size;
        }
    }

    record BytesType() implements AbiType {
        static final BytesType INSTANCE = new BytesType();

        @Override
        public boolean isDynamic() {
            return true;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "bytes";
        }
    }

    /**
     * {@code string}; encoded as its UTF-8 bytes.
     */
    record StringType() implements AbiType {
        static final StringType INSTANCE = new StringType();

        @Override
        public boolean isDynamic() {
            return true;
        }

        @Override
        public int staticSize() {
            return SLOT_SIZE;
        }

        @Override
        public String canonical() {
            return "string";
        }
    }

    /**
     * {@code T[]} when {@link #length()} is {@link #DYNAMIC}, otherwise {@code T[k]}.
     */
    final class ArrayType implements AbiType {
        public static final int DYNAMIC = -1;

        private final AbiType element;
        private final int length;
        private final boolean dynamic;
        private final int staticSize;

        public ArrayType(final AbiType element, final int length) {
            this.element = Objects.requireNonNull(element, "element");
            if (length != DYNAMIC && length < 1) {
                throw new IllegalArgumentException("Fixed array length must be positive: " + length);
            }
            this.length = length;
            this.dynamic = length == DYNAMIC || element.isDynamic();
            this.staticSize = dynamic ? SLOT_SIZE : Math.multiplyExact(length, element.staticSize());
        }

        public AbiType element() {
            return element;
        }

        public int length() {
            return length;
        }

        public boolean isFixedLength() {
            return length != DYNAMIC;
        }

        @Override
        public boolean isDynamic() {
            return dynamic;
        }

        @Override
        public int staticSize() {
            return staticSize;
        }

        @Override
        public String canonical() {
            return element.canonical() + (length == DYNAMIC ? "[]" : "[" + length + "]");
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof ArrayType other && length == other.length && element.equals(other.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(element, length);
        }

        @Override
        public String toString() {
            return canonical();
        }
    }

    /**
     * {@code (T1,...,Tn)}.
     */
    final class TupleType implements AbiType {
        private final List<AbiType> components;
        private final boolean dynamic;
        private final int staticSize;

        public TupleType(final List<AbiType> components) {
            this.components = List.copyOf(Objects.requireNonNull(components, "components"));
            boolean anyDynamic = false;
            int size = 0;
            for (final AbiType component : this.components) {
                anyDynamic |= component.isDynamic();
                size = Math.addExact(size, component.staticSize());
            }
            this.dynamic = anyDynamic;
            this.staticSize = anyDynamic ? SLOT_SIZE : size;
        }

        public List<AbiType> components() {
            return components;
        }

        /**
         * Sum of the components' head sizes, i.e. the head length of this tuple's own encoding.
         */
        public int headSize() {
            int size = 0;
            for (final AbiType component : components) {
                size += component.staticSize();
            }
            return size;
        }

        @Override
        public boolean isDynamic() {
            return dynamic;
        }

        @Override
        public int staticSize() {
            return staticSize;
        }

        @Override
        public String canonical() {
            return components.stream().map(AbiType::canonical).collect(Collectors.joining(",", "(", ")"));
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof TupleType other && components.equals(other.components);
        }

        @Override
        public int hashCode() {
            return components.hashCode();
        }

        @Override
        public String toString() {
            return canonical();
        }
    }
}
