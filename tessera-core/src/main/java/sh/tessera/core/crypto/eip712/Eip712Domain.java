// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.tessera.core.crypto.eip712;

import sh.tessera.core.types.Address;
import sh.tessera.core.types.Hash;

/**
 * EIP-712 domain separator fields.
 *
 * <p>Every field is optional; only the non-null ones take part in the {@code EIP712Domain}
 * type, in the order {@code name, version, chainId, verifyingContract, salt}.
 *
 * @param name              the protocol name, or null
 * @param version           the signing domain version, or null
 * @param chainId           the EIP-155 chain id, or null
 * @param verifyingContract the contract that verifies the signature, or null
 * @param salt              disambiguation salt, or null
 */
public record Eip712Domain(
        String name,
        String version,
        Long chainId,
        Address verifyingContract,
        Hash salt) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * {@code hashStruct(EIP712Domain)} over the fields that are set.
     */
    public Hash separator() {
        return TypedDataEncoder.hashDomain(this);
    }

    public static final class Builder {
        private String name;
        private String version;
        private Long chainId;
        private Address verifyingContract;
        private Hash salt;

        Builder() {
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder version(final String version) {
            this.version = version;
            return this;
        }

        public Builder chainId(final long chainId) {
            this.chainId = chainId;
            return this;
        }

        public Builder verifyingContract(final Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        public Builder salt(final Hash salt) {
            this.salt = salt;
            return this;
        }

        public Eip712Domain build() {
            return new Eip712Domain(name, version, chainId, verifyingContract, salt);
        }
    }
}
