// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.tx;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import sh.keel.core.types.PublicKey;

/**
 * A single program invocation: the program to call, the accounts it touches and
 * its opaque instruction data.
 *
 * @param programId the invoked program
 * @param accounts  the accounts, in the order the program expects them
 * @param data      the instruction data
 */
public record Instruction(PublicKey programId, List<AccountMeta> accounts, byte[] data) {

    public Instruction {
        Objects.requireNonNull(programId, "programId cannot be null");
        Objects.requireNonNull(accounts, "accounts cannot be null");
        Objects.requireNonNull(data, "data cannot be null");
        accounts = List.copyOf(accounts);
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Instruction other)) {
            return false;
        }
        return programId.equals(other.programId)
                && accounts.equals(other.accounts)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(programId, accounts, Arrays.hashCode(data));
    }

    @Override
    public String toString() {
        return "Instruction{programId=" + programId + ", accounts=" + accounts.size()
                + ", dataLength=" + data.length + "}";
    }
}
