// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.tx.auth;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.tessera.core.crypto.HashFunction;
import sh.tessera.core.crypto.Secp256k1;
import sh.tessera.core.crypto.Signers;
import sh.tessera.core.types.Address;

/**
 * Checks signed EIP-7702 authorizations and recovers their authority.
 *
 * <p>A well-formed signature has {@code yParity} of 0 or 1 and {@code 0 < r, s < n}, where
 * {@code n} is the secp256k1 group order.
 */
public final class AuthorizationVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(AuthorizationVerifier.class);

    private final HashFunction hash;

    public AuthorizationVerifier() {
        this(HashFunction.keccak256());
    }

    public AuthorizationVerifier(final HashFunction hash) {
        this.hash = Objects.requireNonNull(hash, "hash");
    }

    public boolean isWellFormed(final Authorization authorization) {
        Objects.requireNonNull(authorization, "authorization");
        if (!authorization.isSigned()) {
            return false;
        }
        final int yParity = authorization.yParity();
        return (yParity == 0 || yParity == 1)
                && Signers.isValidScalar(authorization.r())
                && Signers.isValidScalar(authorization.s());
    }

    /**
     * The account that signed {@code authorization}, or empty if it is unsigned, malformed or
     * does not recover to a public key.
     */
    public Optional<Address> recoverSigner(final Authorization authorization) {
        if (!isWellFormed(authorization)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Secp256k1.recoverAddress(
                    hash.hash(authorization.preimage()), authorization.signature()));
        } catch (IllegalArgumentException e) {
            LOG.debug("Authorization for delegate {} did not recover: {}", authorization.address(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Whether {@code authorization} was signed by {@code expected}.
     */
    public boolean verify(final Authorization authorization, final Address expected) {
        Objects.requireNonNull(expected, "expected");
        return recoverSigner(authorization).map(expected::equals).orElse(false);
    }
}
