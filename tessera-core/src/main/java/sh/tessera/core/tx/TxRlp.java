// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.model.AccessListEntry;
import sh.tessera.core.tx.auth.Authorization;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.Bytes;
import sh.tessera.primitives.rlp.Rlp;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpList;
import sh.tessera.primitives.rlp.RlpString;

/**
 * RLP field helpers shared by the transaction records and {@link TransactionDecoder}.
 */
final class TxRlp {

    private TxRlp() {
    }

    static RlpString address(final Address address) {
        // contract creation: empty string
        return RlpString.of(address != null ? address.toBytes() : new byte[0]);
    }

    static RlpString wei(final Wei wei) {
        return RlpString.of(wei.value());
    }

    static RlpString data(final HexData data) {
        return RlpString.of(data.toBytes());
    }

    static RlpList accessList(final List<AccessListEntry> accessList) {
        final List<RlpItem> entries = new ArrayList<>(accessList.size());
        for (final AccessListEntry entry : accessList) {
            final List<RlpItem> keys = new ArrayList<>(entry.storageKeys().size());
            for (final Hash key : entry.storageKeys()) {
                keys.add(RlpString.of(key.toBytes()));
            }
            entries.add(RlpList.of(RlpString.of(entry.address().toBytes()), RlpList.of(keys)));
        }
        return RlpList.of(entries);
    }

    static RlpList hashes(final List<Hash> hashes) {
        final List<RlpItem> items = new ArrayList<>(hashes.size());
        for (final Hash hash : hashes) {
            items.add(RlpString.of(hash.toBytes()));
        }
        return RlpList.of(items);
    }

    static RlpList authorizations(final List<Authorization> authorizations) {
        final List<RlpItem> items = new ArrayList<>(authorizations.size());
        for (final Authorization authorization : authorizations) {
            items.add(authorization.toRlp());
        }
        return RlpList.of(items);
    }

    /**
     * Appends {@code yParity, r, s} for a typed envelope.
     */
    static void appendSignature(final List<RlpItem> fields, final Signature signature) {
        fields.add(RlpString.of(signature.recoveryId()));
        fields.add(RlpString.of(signature.rAsBigInteger()));
        fields.add(RlpString.of(signature.sAsBigInteger()));
    }

    /**
     * {@code typeByte || rlp(fields)}.
     */
    static byte[] typed(final TransactionType type, final List<RlpItem> fields) {
        return Bytes.prepend(type.typeByte(), Rlp.encodeList(fields));
    }

    static void requireChainId(final long expected, final long given) {
        if (expected != given) {
            throw new IllegalArgumentException(
                    "chainId parameter (" + given + ") must match transaction chainId (" + expected + ")");
        }
    }

    static void requireTypedCommon(final long chainId, final long nonce, final long gasLimit) {
        if (chainId <= 0) {
            throw new IllegalArgumentException("Chain ID must be positive");
        }
        requireCommon(nonce, gasLimit);
    }

    static void requireCommon(final long nonce, final long gasLimit) {
        if (nonce < 0) {
            throw new IllegalArgumentException("Nonce cannot be negative");
        }
        if (gasLimit <= 0) {
            throw new IllegalArgumentException("gasLimit must be positive");
        }
    }

    // ---- reading ----

    static RlpString string(final RlpItem item, final String field) {
        if (item instanceof RlpString str) {
            return str;
        }
        throw new IllegalArgumentException("Field '" + field + "' must be an RLP string");
    }

    static RlpList list(final RlpItem item, final String field) {
        if (item instanceof RlpList list) {
            return list;
        }
        throw new IllegalArgumentException("Field '" + field + "' must be an RLP list");
    }

    static long readLong(final RlpItem item, final String field) {
        return string(item, field).asLong();
    }

    static BigInteger readBigInteger(final RlpItem item, final String field) {
        return string(item, field).asBigInteger();
    }

    static Wei readWei(final RlpItem item, final String field) {
        return new Wei(readBigInteger(item, field));
    }

    static HexData readData(final RlpItem item, final String field) {
        return HexData.fromBytes(string(item, field).bytes());
    }

    static Address readAddress(final RlpItem item, final String field) {
        final byte[] bytes = string(item, field).bytes();
        if (bytes.length == 0) {
            return null;
        }
        return Address.fromBytes(bytes);
    }

    static List<AccessListEntry> readAccessList(final RlpItem item) {
        final List<AccessListEntry> entries = new ArrayList<>();
        for (final RlpItem entryItem : list(item, "accessList").items()) {
            final RlpList entry = list(entryItem, "accessList entry");
            if (entry.size() != 2) {
                throw new IllegalArgumentException("Access list entry must have 2 items, got " + entry.size());
            }
            final List<Hash> keys = new ArrayList<>();
            for (final RlpItem key : list(entry.get(1), "storageKeys").items()) {
                keys.add(Hash.fromBytes(string(key, "storageKey").bytes()));
            }
            entries.add(new AccessListEntry(Address.fromBytes(string(entry.get(0), "address").bytes()), keys));
        }
        return entries;
    }

    static List<Hash> readHashes(final RlpItem item, final String field) {
        final List<Hash> hashes = new ArrayList<>();
        for (final RlpItem hash : list(item, field).items()) {
            hashes.add(Hash.fromBytes(string(hash, field).bytes()));
        }
        return hashes;
    }

    static List<Authorization> readAuthorizations(final RlpItem item) {
        final List<Authorization> authorizations = new ArrayList<>();
        for (final RlpItem authorization : list(item, "authorizationList").items()) {
            authorizations.add(Authorization.fromRlp(authorization));
        }
        return authorizations;
    }

    /**
     * Reads {@code yParity, r, s} starting at {@code index}.
     */
    static Signature readSignature(final List<RlpItem> fields, final int index) {
        final long yParity = readLong(fields.get(index), "yParity");
        if (yParity > 1) {
            throw new IllegalArgumentException("yParity must be 0 or 1, got " + yParity);
        }
        return Signature.of(
                readBigInteger(fields.get(index + 1), "r"),
                readBigInteger(fields.get(index + 2), "s"),
                (int) yParity);
    }
}
