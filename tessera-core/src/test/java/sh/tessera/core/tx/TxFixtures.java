// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import sh.tessera.core.crypto.PrivateKeySigner;
import sh.tessera.core.model.AccessListEntry;
import sh.tessera.core.tx.auth.Authorization;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;
import sh.tessera.core.types.HexData;
import sh.tessera.core.types.Wei;

/**
 * Keys and transactions shared by the transaction tests.
 */
final class TxFixtures {

    /** Key from the EIP-155 example. */
    static final String EIP155_KEY = "0x" + "46".repeat(32);
    static final Address EIP155_SENDER = new Address("0x9d8a62f656a8d1615c1294fd71e9cfb3e4855a4f");
    static final Address RECIPIENT = new Address("0x3535353535353535353535353535353535353535");

    static final Address DELEGATE = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
    static final Hash STORAGE_KEY = Hash.of("0x" + "00".repeat(31) + "07");
    static final Hash BLOB_HASH = Hash.of("0x01" + "5a".repeat(31));

    private TxFixtures() {
    }

    static PrivateKeySigner signer() {
        return new PrivateKeySigner(EIP155_KEY);
    }

    static LegacyTransaction eip155Example() {
        return new LegacyTransaction(
                1, 9, Wei.gwei(20), 21_000, RECIPIENT, Wei.fromEther(BigDecimal.ONE), HexData.EMPTY);
    }

    static LegacyTransaction preEip155() {
        return new LegacyTransaction(0, 3, Wei.gwei(5), 21_000, RECIPIENT, Wei.of(1), HexData.EMPTY);
    }

    static Eip2930Transaction accessListTx() {
        return new Eip2930Transaction(
                5, 1, Wei.gwei(7), 60_000, RECIPIENT, Wei.ZERO, HexData.of("0xdeadbeef"),
                List.of(AccessListEntry.of(DELEGATE, STORAGE_KEY)));
    }

    static Eip1559Transaction dynamicFeeTx() {
        return new Eip1559Transaction(
                1, 0, Wei.gwei(2), Wei.gwei(30), 21_000, RECIPIENT, Wei.of(1_000), HexData.EMPTY, List.of());
    }

    static Eip1559Transaction contractCreation() {
        return new Eip1559Transaction(
                1, 4, Wei.gwei(1), Wei.gwei(10), 500_000, null, Wei.ZERO, HexData.of("0x6080604052"), List.of());
    }

    static Eip4844Transaction blobTx() {
        return new Eip4844Transaction(
                1, 2, Wei.gwei(1), Wei.gwei(40), 100_000, RECIPIENT, Wei.ZERO, HexData.EMPTY, List.of(),
                Wei.gwei(3), List.of(BLOB_HASH));
    }

    static Eip7702Transaction delegationTx() {
        final Authorization auth = new Authorization(
                1, DELEGATE, 10, 1, BigInteger.valueOf(0x1234), BigInteger.valueOf(0x5678));
        return new Eip7702Transaction(
                1, 9, Wei.gwei(1), Wei.gwei(20), 80_000, RECIPIENT, Wei.ZERO, HexData.EMPTY,
                List.of(AccessListEntry.of(RECIPIENT)), List.of(auth));
    }
}
