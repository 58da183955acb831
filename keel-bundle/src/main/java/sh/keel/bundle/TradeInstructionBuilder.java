// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.util.List;

import sh.keel.core.tx.Instruction;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;

/**
 * Produces the program-specific instructions for a trade. Compute budget
 * instructions are added by the caller and must not be included.
 */
public interface TradeInstructionBuilder {

    /**
     * @throws sh.keel.core.error.TransactionBuildException if the trade cannot be priced or encoded
     */
    List<Instruction> buy(TradeTarget target, PublicKey owner, Lamports amount);

    /**
     * @param tokenAmount raw token units to sell
     * @throws sh.keel.core.error.TransactionBuildException if the trade cannot be priced or encoded
     */
    List<Instruction> sell(TradeTarget target, PublicKey owner, long tokenAmount);

    /**
     * Returns the token account holding {@code owner}'s balance of the target.
     */
    PublicKey tokenAccount(TradeTarget target, PublicKey owner);

    int buyComputeUnitLimit();

    int sellComputeUnitLimit();
}
