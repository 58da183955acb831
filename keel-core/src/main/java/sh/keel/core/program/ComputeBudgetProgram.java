// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.program;

import java.util.List;

import sh.keel.core.tx.Instruction;
import sh.keel.core.types.PublicKey;
import sh.keel.primitives.LittleEndian;

/**
 * Instruction factories for the compute budget program. None of these
 * instructions reference accounts.
 */
public final class ComputeBudgetProgram {

    public static final PublicKey PROGRAM_ID = new PublicKey("ComputeBudget111111111111111111111111111111");

    private static final byte SET_COMPUTE_UNIT_LIMIT = 2;
    private static final byte SET_COMPUTE_UNIT_PRICE = 3;
    private static final byte SET_LOADED_ACCOUNTS_DATA_SIZE_LIMIT = 4;

    private ComputeBudgetProgram() {
    }

    /**
     * Caps the compute units the transaction may consume.
     */
    public static Instruction setComputeUnitLimit(final int units) {
        requireNonNegative(units, "units");
        return u32Instruction(SET_COMPUTE_UNIT_LIMIT, units);
    }

    /**
     * Sets the priority fee in micro-lamports per compute unit.
     */
    public static Instruction setComputeUnitPrice(final long microLamports) {
        if (microLamports < 0) {
            throw new IllegalArgumentException("microLamports must be non-negative");
        }
        final byte[] data = new byte[9];
        data[0] = SET_COMPUTE_UNIT_PRICE;
        LittleEndian.putU64(data, 1, microLamports);
        return new Instruction(PROGRAM_ID, List.of(), data);
    }

    /**
     * Caps the total size of account data the transaction may load.
     */
    public static Instruction setLoadedAccountsDataSizeLimit(final int bytes) {
        requireNonNegative(bytes, "bytes");
        return u32Instruction(SET_LOADED_ACCOUNTS_DATA_SIZE_LIMIT, bytes);
    }

    private static Instruction u32Instruction(final byte discriminator, final int value) {
        final byte[] data = new byte[5];
        data[0] = discriminator;
        LittleEndian.putU32(data, 1, value);
        return new Instruction(PROGRAM_ID, List.of(), data);
    }

    private static void requireNonNegative(final int value, final String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
