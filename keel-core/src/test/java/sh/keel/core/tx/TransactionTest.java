// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.tx;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Base64;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.program.SystemProgram;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.primitives.Base58;

class TransactionTest {

    private static final Blockhash BLOCKHASH = Blockhash.fromBytes(new byte[32]);

    private final Keypair payer = Keypair.generate();
    private final Keypair other = Keypair.generate();

    @Test
    void signsMessageAndPrefixesSignatures() {
        Message message = transfer();
        Transaction tx = Transaction.sign(message, List.of(payer));
        byte[] wire = tx.serialize();

        assertEquals(1 + 64 + message.serialize().length, wire.length);
        assertEquals(1, wire[0]);
        byte[] signature = Arrays.copyOfRange(wire, 1, 65);
        assertTrue(Keypair.verify(payer.publicKey(), message.serialize(), signature));
        assertEquals(Base58.encode(signature), tx.signature().value());
    }

    @Test
    void encodingsMatchWireBytes() {
        Transaction tx = Transaction.sign(transfer(), List.of(payer));
        assertArrayEquals(tx.serialize(), Base64.getDecoder().decode(tx.toBase64()));
        assertArrayEquals(tx.serialize(), Base58.decode(tx.toBase58()));
    }

    @Test
    void ignoresUnneededSigners() {
        Transaction tx = Transaction.sign(transfer(), List.of(other, payer));
        assertEquals(1, tx.signatures().size());
    }

    @Test
    void missingSignerFails() {
        TransactionBuildException ex = assertThrows(TransactionBuildException.class,
                () -> Transaction.sign(transfer(), List.of(other)));
        assertTrue(ex.getMessage().contains(payer.publicKey().toString()));
    }

    private Message transfer() {
        return Message.compile(payer.publicKey(),
                List.of(SystemProgram.transfer(payer.publicKey(), other.publicKey(), Lamports.of(1))), BLOCKHASH);
    }
}
