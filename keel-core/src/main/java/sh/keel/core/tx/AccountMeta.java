// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.tx;

import java.util.Objects;

import sh.keel.core.types.PublicKey;

/**
 * An account referenced by an instruction together with its access flags.
 *
 * @param publicKey  the account address
 * @param isSigner   whether the account must sign the transaction
 * @param isWritable whether the instruction may modify the account
 */
public record AccountMeta(PublicKey publicKey, boolean isSigner, boolean isWritable) {

    public AccountMeta {
        Objects.requireNonNull(publicKey, "publicKey cannot be null");
    }

    public static AccountMeta writableSigner(final PublicKey publicKey) {
        return new AccountMeta(publicKey, true, true);
    }

    public static AccountMeta writable(final PublicKey publicKey) {
        return new AccountMeta(publicKey, false, true);
    }

    public static AccountMeta readonly(final PublicKey publicKey) {
        return new AccountMeta(publicKey, false, false);
    }
}
