// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CommitmentTest {

    @Test
    void strongerStatusSatisfiesWeakerCommitment() {
        assertTrue(Commitment.CONFIRMED.isSatisfiedBy("finalized"));
        assertTrue(Commitment.CONFIRMED.isSatisfiedBy("confirmed"));
        assertFalse(Commitment.CONFIRMED.isSatisfiedBy("processed"));
        assertFalse(Commitment.PROCESSED.isSatisfiedBy(null));
        assertFalse(Commitment.PROCESSED.isSatisfiedBy("bogus"));
    }

    @Test
    void wireNamesAreLowercase() {
        assertEquals("finalized", Commitment.FINALIZED.value());
    }
}
