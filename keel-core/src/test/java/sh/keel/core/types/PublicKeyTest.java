// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PublicKeyTest {

    private static final String TOKEN_PROGRAM = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";

    @Test
    void acceptsValidAddress() {
        PublicKey key = new PublicKey(TOKEN_PROGRAM);
        assertEquals(TOKEN_PROGRAM, key.toString());
        assertEquals(32, key.toBytes().length);
        assertEquals(key, PublicKey.fromBytes(key.toBytes()));
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> new PublicKey("StV1DL6CwTryKyV"));
        assertThrows(IllegalArgumentException.class, () -> PublicKey.fromBytes(new byte[31]));
    }

    @Test
    void rejectsInvalidCharacters() {
        assertThrows(IllegalArgumentException.class, () -> new PublicKey("0OIl" + TOKEN_PROGRAM.substring(4)));
    }

    @Test
    void signatureRequires64Bytes() {
        byte[] raw = new byte[64];
        raw[0] = 9;
        TransactionSignature sig = TransactionSignature.fromBytes(raw);
        assertEquals(sig, new TransactionSignature(sig.value()));
        assertThrows(IllegalArgumentException.class, () -> TransactionSignature.fromBytes(new byte[32]));
    }

    @Test
    void blockhashRoundTripsBytes() {
        byte[] raw = new byte[32];
        raw[31] = 1;
        assertArrayEquals(raw, Blockhash.fromBytes(raw).toBytes());
    }
}
