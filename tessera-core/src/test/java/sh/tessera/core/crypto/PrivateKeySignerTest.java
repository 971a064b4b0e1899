// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import sh.tessera.core.types.Address;
import sh.tessera.primitives.Bytes;
import sh.tessera.primitives.Hex;

class PrivateKeySignerTest {

    static final String TEST_PRIVATE_KEY = "0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    static final Address TEST_ADDRESS = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");

    @Test
    void derivesAddress() {
        assertEquals(TEST_ADDRESS, new PrivateKeySigner(TEST_PRIVATE_KEY).address());
    }

    @Test
    void signaturesRecoverToSigner() {
        final PrivateKeySigner signer = new PrivateKeySigner(TEST_PRIVATE_KEY);
        final byte[] digest = Keccak256.hash("payload".getBytes(StandardCharsets.UTF_8));

        final Signature signature = signer.signHash(digest);

        assertTrue(signature.v() == 0 || signature.v() == 1);
        assertTrue(signature.sAsBigInteger().compareTo(Secp256k1.HALF_CURVE_ORDER) <= 0);
        assertEquals(TEST_ADDRESS, Secp256k1.recoverAddress(digest, signature));
    }

    @Test
    void signingIsDeterministic() {
        final PrivateKeySigner signer = new PrivateKeySigner(TEST_PRIVATE_KEY);
        final byte[] digest = Keccak256.hash(new byte[] {42});
        assertEquals(signer.signHash(digest), signer.signHash(digest));
    }

    @Test
    void signMessageUsesPersonalPrefix() {
        final PrivateKeySigner signer = new PrivateKeySigner(TEST_PRIVATE_KEY);
        final byte[] message = "hello".getBytes(StandardCharsets.UTF_8);

        final Signature signature = signer.signMessage(message);

        assertTrue(signature.v() == 27 || signature.v() == 28);
        final byte[] prefixed = Bytes.concat(
                "\u0019Ethereum Signed Message:\n5".getBytes(StandardCharsets.UTF_8), message);
        assertEquals(TEST_ADDRESS, Secp256k1.recoverAddress(Keccak256.hash(prefixed), signature));
    }

    @Test
    void rejectsInvalidKeys() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x" + "00".repeat(32)));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x" + "ff".repeat(32)));
    }

    @Test
    void rejectsWrongDigestLength() {
        final PrivateKeySigner signer = new PrivateKeySigner(TEST_PRIVATE_KEY);
        assertThrows(IllegalArgumentException.class, () -> signer.signHash(new byte[31]));
    }

    @Test
    void destroyedKeyCannotSign() {
        final PrivateKey key = PrivateKey.fromHex(TEST_PRIVATE_KEY);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.sign(new byte[32]));
        assertEquals("PrivateKey[destroyed]", key.toString());
    }

    @Test
    void fromBytesZeroesInput() {
        final byte[] raw = Hex.decode(TEST_PRIVATE_KEY);
        PrivateKey.fromBytes(raw);
        assertArrayEquals(new byte[32], raw);
    }
}
