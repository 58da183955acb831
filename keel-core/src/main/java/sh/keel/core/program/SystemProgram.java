// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.program;

import java.util.List;

import sh.keel.core.tx.AccountMeta;
import sh.keel.core.tx.Instruction;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.primitives.LittleEndian;

/**
 * Instruction factories for the system program.
 */
public final class SystemProgram {

    public static final PublicKey PROGRAM_ID = PublicKey.fromBytes(new byte[PublicKey.LENGTH]);

    private static final int TRANSFER = 2;

    private SystemProgram() {
    }

    /**
     * Moves lamports from a signing account to any account.
     */
    public static Instruction transfer(final PublicKey from, final PublicKey to, final Lamports amount) {
        final byte[] data = new byte[12];
        LittleEndian.putU32(data, 0, TRANSFER);
        LittleEndian.putU64(data, 4, amount.value());
        return new Instruction(
                PROGRAM_ID,
                List.of(AccountMeta.writableSigner(from), AccountMeta.writable(to)),
                data);
    }
}
