// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.program;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.tx.AccountMeta;
import sh.keel.core.tx.Instruction;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;

class SystemProgramTest {

    @Test
    void programIdIsAllOnes() {
        assertEquals("1".repeat(32), SystemProgram.PROGRAM_ID.value());
    }

    @Test
    void transferEncodesIndexAndAmount() {
        PublicKey from = Keypair.generate().publicKey();
        PublicKey to = Keypair.generate().publicKey();

        Instruction ix = SystemProgram.transfer(from, to, Lamports.fromSol("1"));

        assertArrayEquals(new byte[] {2, 0, 0, 0, 0, (byte) 0xCA, (byte) 0x9A, 0x3B, 0, 0, 0, 0}, ix.data());
        assertEquals(AccountMeta.writableSigner(from), ix.accounts().get(0));
        assertEquals(AccountMeta.writable(to), ix.accounts().get(1));
    }
}
