// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx.auth;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Hex;
import sh.tessera.primitives.rlp.Rlp;
import sh.tessera.primitives.rlp.RlpList;
import sh.tessera.primitives.rlp.RlpString;

class AuthorizationTest {

    private static final Address DELEGATE = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");

    @Test
    void preimageIsMagicChainAddressNonce() {
        final byte[] preimage = Authorization.unsigned(1, DELEGATE, 7).preimage();

        assertEquals(1 + 32 + 20 + 32, preimage.length);
        assertEquals(
                "0x05"
                        + "00".repeat(31) + "01"
                        + "2c7536e3605d9c16a7a3d7b1898e529396a65c23"
                        + "00".repeat(31) + "07",
                Hex.encode(preimage));
    }

    @Test
    void revocationDelegatesToZeroAddress() {
        final Authorization revocation = Authorization.revocation(1, 3);
        assertTrue(revocation.isRevocation());
        assertEquals(Address.ZERO, revocation.address());
        assertFalse(Authorization.unsigned(1, DELEGATE, 3).isRevocation());
    }

    @Test
    void signatureFieldsComeTogether() {
        assertThrows(IllegalArgumentException.class,
                () -> new Authorization(1, DELEGATE, 0, 1, BigInteger.ONE, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Authorization(-1, DELEGATE, 0, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new Authorization(1, DELEGATE, -1, null, null, null));
        assertThrows(NullPointerException.class,
                () -> new Authorization(1, null, 0, null, null, null));
    }

    @Test
    void withSignatureUsesRecoveryId() {
        final Authorization signed = Authorization.unsigned(1, DELEGATE, 0)
                .withSignature(Signature.of(BigInteger.TEN, BigInteger.TWO, 28));

        assertTrue(signed.isSigned());
        assertEquals(1, signed.yParity());
        assertEquals(BigInteger.TEN, signed.r());
        assertEquals(Signature.of(BigInteger.TEN, BigInteger.TWO, 1), signed.signature());
    }

    @Test
    void unsignedCannotBeSerialised() {
        final Authorization unsigned = Authorization.unsigned(1, DELEGATE, 0);
        assertThrows(IllegalStateException.class, unsigned::toRlp);
        assertThrows(IllegalStateException.class, unsigned::signature);
    }

    @Test
    void rlpTupleRoundTrips() {
        final Authorization signed = new Authorization(0, DELEGATE, 42, 0, BigInteger.valueOf(99), BigInteger.valueOf(100));

        final RlpList rlp = signed.toRlp();

        assertEquals(6, rlp.size());
        assertEquals(RlpString.of(0L), rlp.get(0));
        assertEquals(signed, Authorization.fromRlp(Rlp.decode(Rlp.encode(rlp))));
    }

    @Test
    void fromRlpRejectsMalformedTuples() {
        assertThrows(IllegalArgumentException.class, () -> Authorization.fromRlp(RlpString.of(1L)));
        assertThrows(IllegalArgumentException.class,
                () -> Authorization.fromRlp(RlpList.of(RlpString.of(1L), RlpString.of(2L))));
        assertThrows(IllegalArgumentException.class, () -> Authorization.fromRlp(RlpList.of(
                RlpString.of(1L), RlpString.of(DELEGATE.toBytes()), RlpString.of(0L),
                RlpString.of(2L), RlpString.of(1L), RlpString.of(1L))));
    }
}
