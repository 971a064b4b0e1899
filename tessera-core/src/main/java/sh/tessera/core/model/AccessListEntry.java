// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.model;

import java.util.List;
import java.util.Objects;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * Entry in a transaction's access list, as defined by EIP-2930.
 *
 * <p>Declares an account and the storage slots a transaction will touch so they are charged at
 * the warm rate. Encoded in RLP as {@code [address, [key, ...]]}.
 *
 * @param address     the account to pre-warm
 * @param storageKeys storage slots of that account
 * @see <a href="https://eips.ethereum.org/EIPS/eip-2930">EIP-2930</a>
 */
public record AccessListEntry(Address address, List<Hash> storageKeys) {

    public AccessListEntry {
        Objects.requireNonNull(address, "address");
        storageKeys = List.copyOf(Objects.requireNonNull(storageKeys, "storageKeys"));
    }

    public static AccessListEntry of(final Address address, final Hash... storageKeys) {
        return new AccessListEntry(address, List.of(storageKeys));
    }
}
