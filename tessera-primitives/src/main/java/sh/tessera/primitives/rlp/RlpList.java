// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.primitives.rlp;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * RLP list node. The item list is copied and unmodifiable.
 */
public record RlpList(List<RlpItem> items) implements RlpItem {

    public RlpList {
        Objects.requireNonNull(items, "items cannot be null");
        for (final RlpItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null values");
            }
        }
        items = List.copyOf(items);
    }

    public static RlpList of(final RlpItem... items) {
        return new RlpList(Arrays.asList(items));
    }

    public static RlpList of(final List<? extends RlpItem> items) {
        return new RlpList(List.copyOf(items));
    }

    public int size() {
        return items.size();
    }

    public RlpItem get(final int index) {
        return items.get(index);
    }

    @Override
    public byte[] encode() {
        return Rlp.encodeList(items);
    }
}
