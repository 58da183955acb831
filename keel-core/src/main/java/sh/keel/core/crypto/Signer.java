// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.crypto;

import sh.keel.core.types.PublicKey;

/**
 * Defines a signing identity capable of producing Ed25519 signatures.
 * <p>
 * This interface allows local keypairs, remote signers or hardware wallets to
 * be used interchangeably when assembling transactions. Key material is never
 * exposed through it.
 */
public interface Signer {

    /**
     * Returns the public key of this signer, which is also its account address.
     *
     * @return the public key
     */
    PublicKey publicKey();

    /**
     * Signs the given message bytes.
     * <p>
     * For transactions the message is the serialized transaction message; no
     * hashing or prefixing is applied.
     *
     * @param message the bytes to sign
     * @return the 64-byte Ed25519 signature
     */
    byte[] sign(byte[] message);
}
