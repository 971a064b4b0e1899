// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx.auth;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.crypto.PrivateKeySigner;
import sh.tessera.core.crypto.Secp256k1;
import sh.tessera.core.types.Address;

class AuthorizationSignerTest {

    private static final String KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final Address SIGNER_ADDRESS = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
    private static final Address DELEGATE = new Address("0x3535353535353535353535353535353535353535");

    private final AuthorizationSigner signer = new AuthorizationSigner(new PrivateKeySigner(KEY));
    private final AuthorizationVerifier verifier = new AuthorizationVerifier();

    @Test
    void signsAndVerifies() {
        final Authorization signed = signer.sign(1, DELEGATE, 0);

        assertTrue(signed.isSigned());
        assertTrue(verifier.isWellFormed(signed));
        assertEquals(SIGNER_ADDRESS, verifier.recoverSigner(signed).orElseThrow());
        assertTrue(verifier.verify(signed, SIGNER_ADDRESS));
        assertFalse(verifier.verify(signed, DELEGATE));
    }

    @Test
    void signingHashIsKeccakOfPreimage() {
        final Authorization auth = Authorization.unsigned(5, DELEGATE, 2);
        assertArrayEquals(Keccak256.hash(auth.preimage()), signer.signingHash(auth));

        final Authorization signed = signer.sign(auth);
        assertEquals(SIGNER_ADDRESS, Secp256k1.recoverAddress(signer.signingHash(auth), signed.signature()));
    }

    @Test
    void chainIdZeroIsAllowed() {
        final Authorization anyChain = signer.sign(0, DELEGATE, 1);
        assertEquals(0, anyChain.chainId());
        assertTrue(verifier.verify(anyChain, SIGNER_ADDRESS));
    }

    @Test
    void revocationsAreSignable() {
        final Authorization revoked = signer.sign(Authorization.revocation(1, 4));
        assertTrue(revoked.isRevocation());
        assertTrue(verifier.verify(revoked, SIGNER_ADDRESS));
    }

    @Test
    void tamperedFieldsDoNotVerify() {
        final Authorization signed = signer.sign(1, DELEGATE, 0);
        final Authorization otherNonce = new Authorization(
                signed.chainId(), signed.address(), 1, signed.yParity(), signed.r(), signed.s());

        assertFalse(verifier.verify(otherNonce, SIGNER_ADDRESS));
    }

    @Test
    void unsignedOrMalformedDoesNotRecover() {
        assertTrue(verifier.recoverSigner(Authorization.unsigned(1, DELEGATE, 0)).isEmpty());

        final Authorization zeroR = new Authorization(1, DELEGATE, 0, 0, BigInteger.ZERO, BigInteger.ONE);
        assertFalse(verifier.isWellFormed(zeroR));
        assertTrue(verifier.recoverSigner(zeroR).isEmpty());

        final Authorization badParity = new Authorization(1, DELEGATE, 0, 3, BigInteger.ONE, BigInteger.ONE);
        assertFalse(verifier.isWellFormed(badParity));
    }

    @Test
    void signAllPreservesOrder() {
        final List<Authorization> signed = signer.signAll(List.of(
                Authorization.unsigned(1, DELEGATE, 0),
                Authorization.revocation(1, 1)));

        assertEquals(2, signed.size());
        assertEquals(0, signed.get(0).nonce());
        assertTrue(signed.get(1).isRevocation());
    }

    @Test
    void asyncMatchesSync() {
        final Authorization auth = Authorization.unsigned(1, DELEGATE, 9);
        assertEquals(signer.sign(auth), signer.signAsync(auth, Duration.ofSeconds(2)).join());
    }
}
