// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import sh.tessera.core.TesseraDebug;
import sh.tessera.core.crypto.Keccak256;
import sh.tessera.core.crypto.Signature;
import sh.tessera.core.crypto.Signer;
import sh.tessera.core.error.InvalidTransactionException;
import sh.tessera.core.error.SigningException;
import sh.tessera.core.model.TransactionRequest;
import sh.tessera.core.types.Address;
import sh.tessera.core.types.Wei;
import sh.tessera.primitives.Hex;
import sh.tessera.primitives.rlp.Rlp;
import sh.tessera.primitives.rlp.RlpItem;
import sh.tessera.primitives.rlp.RlpString;

class TransactionSignerTest {

    private static final String EIP155_PREIMAGE =
            "0xec098504a817c800825208943535353535353535353535353535353535353535880de0b6b3a764000080018080";
    private static final String EIP155_SIGNING_HASH =
            "0xdaf5a779ae972f972197303d7b574746c7ef83eadac0f2791ad23db92e4c8e53";
    private static final String EIP155_RAW =
            "0xf86c098504a817c800825208943535353535353535353535353535353535353535880de0b6b3a76400008025a0"
                    + "28ef61340bd939bc2195fe537567866003e1a15d3c71ff63e1590620aa636276a0"
                    + "67cbe9d8997f761aecb703304b3800ccf555c9f3dc64214b297fb1966a3b6d83";

    private final TransactionSigner signer = new TransactionSigner(TxFixtures.signer());

    @AfterEach
    void reset() {
        TesseraDebug.setEnabled(false);
        ((Logger) LoggerFactory.getLogger("sh.tessera.debug")).detachAndStopAllAppenders();
    }

    @Test
    void signsEip155Example() {
        final LegacyTransaction tx = TxFixtures.eip155Example();

        assertEquals(EIP155_PREIMAGE, Hex.encode(tx.preimage()));
        assertEquals(EIP155_SIGNING_HASH, Hex.encode(signer.signingHash(tx)));

        final SignedTransaction signed = signer.sign(tx);

        assertEquals(EIP155_RAW, signed.toHex());
        assertEquals(Hex.encode(Keccak256.hash(Hex.decode(EIP155_RAW))), signed.hash().value());
        assertEquals(0, signed.signature().v());
        assertEquals(TxFixtures.EIP155_SENDER, signed.recoverSender());
    }

    @Test
    void legacyVEncodesChainId() {
        final LegacyTransaction tx = TxFixtures.eip155Example();
        assertEquals(37, tx.v(0));
        assertEquals(38, tx.v(1));

        final LegacyTransaction sepolia = new LegacyTransaction(
                11_155_111, 0, Wei.gwei(1), 21_000, TxFixtures.RECIPIENT, Wei.ZERO, tx.data());
        assertEquals(22_310_257L, sepolia.v(0));
    }

    @Test
    void preEip155UsesSixFieldPreimageAnd27Or28() {
        final LegacyTransaction tx = TxFixtures.preEip155();

        assertEquals(6, Rlp.decodeList(tx.preimage()).size());

        final SignedTransaction signed = signer.sign(tx);
        final List<RlpItem> fields = Rlp.decodeList(signed.raw());
        final long v = ((RlpString) fields.get(6)).asLong();
        assertTrue(v == 27 || v == 28, "v=" + v);
        assertEquals(TxFixtures.EIP155_SENDER, signed.recoverSender());
    }

    @Test
    void typedEnvelopesStartWithTypeByte() {
        assertEquals(0x01, signer.sign(TxFixtures.accessListTx()).raw()[0]);
        assertEquals(0x02, signer.sign(TxFixtures.dynamicFeeTx()).raw()[0]);
        assertEquals(0x03, signer.sign(TxFixtures.blobTx()).raw()[0]);
        assertEquals(0x04, signer.sign(TxFixtures.delegationTx()).raw()[0]);

        assertEquals(0x02, TxFixtures.dynamicFeeTx().preimage()[0]);
    }

    @Test
    void everyTypeRecoversToSigner() {
        final List<UnsignedTransaction> all = List.of(
                TxFixtures.eip155Example(),
                TxFixtures.preEip155(),
                TxFixtures.accessListTx(),
                TxFixtures.dynamicFeeTx(),
                TxFixtures.contractCreation(),
                TxFixtures.blobTx(),
                TxFixtures.delegationTx());

        for (final UnsignedTransaction tx : all) {
            final SignedTransaction signed = signer.sign(tx);
            assertEquals(TxFixtures.EIP155_SENDER, signed.recoverSender(), tx.type().toString());
            assertEquals(tx.type(), signed.type());
        }
    }

    @Test
    void signingIsDeterministic() {
        assertEquals(signer.sign(TxFixtures.dynamicFeeTx()), signer.sign(TxFixtures.dynamicFeeTx()));
    }

    @Test
    void anyFieldChangeChangesTheSignedBytes() {
        final Eip1559Transaction base = TxFixtures.dynamicFeeTx();
        final Eip1559Transaction higherFee = new Eip1559Transaction(
                base.chainId(), base.nonce(), base.maxPriorityFeePerGas(), Wei.gwei(31), base.gasLimit(),
                base.to(), base.value(), base.data(), base.accessList());

        assertFalse(Hex.encode(signer.signingHash(base)).equals(Hex.encode(signer.signingHash(higherFee))));
        assertNotEquals(signer.sign(base).hash(), signer.sign(higherFee).hash());
    }

    @Test
    void signsRequests() {
        final TransactionRequest request = TransactionRequest.empty()
                .withChainId(1)
                .withNonce(9)
                .withGasLimit(21_000)
                .withGasPrice(Wei.gwei(20))
                .withTo(TxFixtures.RECIPIENT)
                .withValue(Wei.fromEther(BigDecimal.ONE));

        assertEquals(EIP155_RAW, signer.sign(request).toHex());
    }

    @Test
    void invalidRequestFailsBeforeSigning() {
        assertThrows(InvalidTransactionException.class, () -> signer.sign(TransactionRequest.empty()));
    }

    @Test
    void preimageRejectsOtherChain() {
        final Eip1559Transaction tx = TxFixtures.dynamicFeeTx();
        assertThrows(IllegalArgumentException.class, () -> tx.preimage(5));
    }

    @Test
    void injectedHashIsUsedForSigningHashAndTxHash() {
        final TransactionSigner zeroHash = new TransactionSigner(TxFixtures.signer(), input -> new byte[32]);

        final SignedTransaction signed = zeroHash.sign(TxFixtures.dynamicFeeTx());

        assertArrayEquals(new byte[32], zeroHash.signingHash(TxFixtures.dynamicFeeTx()));
        assertEquals("0x" + "00".repeat(32), signed.hash().value());
    }

    @Test
    void signerErrorsSurfaceAsSigningException() {
        final SigningException rejected = new SigningException("user rejected");
        final TransactionSigner failing = new TransactionSigner(new Signer() {
            @Override
            public Address address() {
                return TxFixtures.EIP155_SENDER;
            }

            @Override
            public Signature signHash(final byte[] hash) {
                throw rejected;
            }
        });

        assertSame(rejected, assertThrows(SigningException.class, () -> failing.sign(TxFixtures.dynamicFeeTx())));
    }

    @Test
    void asyncSigningMatchesSync() {
        final SignedTransaction async = signer.signAsync(TxFixtures.blobTx(), Duration.ofSeconds(2)).join();
        assertEquals(signer.sign(TxFixtures.blobTx()), async);
    }

    @Test
    void asyncSigningTimesOut() {
        final TransactionSigner slow = new TransactionSigner(new Signer() {
            @Override
            public Address address() {
                return TxFixtures.EIP155_SENDER;
            }

            @Override
            public Signature signHash(final byte[] hash) {
                throw new UnsupportedOperationException();
            }

            @Override
            public CompletableFuture<Signature> signHashAsync(final byte[] hash) {
                return new CompletableFuture<>();
            }
        });

        final CompletionException ex = assertThrows(CompletionException.class,
                () -> slow.signAsync(TxFixtures.dynamicFeeTx(), Duration.ofMillis(50)).join());
        assertInstanceOf(SigningException.class, ex.getCause());
    }

    @Test
    void tracesSigningWhenEnabled() {
        final Logger logger = (Logger) LoggerFactory.getLogger("sh.tessera.debug");
        final ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        TesseraDebug.setSignLogging(true);

        signer.sign(TxFixtures.dynamicFeeTx());

        assertEquals(1, appender.list.size());
        assertTrue(appender.list.get(0).getFormattedMessage().startsWith("[SIGN] type=EIP1559 hash=0x"));
    }
}
