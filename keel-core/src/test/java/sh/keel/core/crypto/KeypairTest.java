// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.crypto;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HexFormat;

import org.junit.jupiter.api.Test;

import sh.keel.primitives.Base58;

class KeypairTest {

    // RFC 8032 section 7.1, test 1
    private static final byte[] SEED =
            HexFormat.of().parseHex("9d61b19deffd5a60ba844af492ec2cc44449c5697b326919703bac031cae7f60");
    private static final byte[] PUBLIC =
            HexFormat.of().parseHex("d75a980182b10ab7d54bfed3c964073a0ee172f3daa62325af021a68f707511a");
    private static final byte[] EMPTY_SIGNATURE = HexFormat.of().parseHex(
            "e5564300c360ac729086e2cc806e828a84877f1eb8e5d974d873e06522490155"
                    + "5fb8821590a33bacc61e39701cf9b46bd25bf5f0595bbe24655141438e7a100b");

    @Test
    void derivesRfc8032PublicKey() {
        Keypair keypair = Keypair.fromSeed(SEED.clone());
        assertArrayEquals(PUBLIC, keypair.publicKey().toBytes());
    }

    @Test
    void signsRfc8032EmptyMessage() {
        Keypair keypair = Keypair.fromSeed(SEED.clone());
        assertArrayEquals(EMPTY_SIGNATURE, keypair.sign(new byte[0]));
        assertTrue(Keypair.verify(keypair.publicKey(), new byte[0], EMPTY_SIGNATURE));
    }

    @Test
    void secretKeyRoundTripsThroughBase58() {
        Keypair original = Keypair.generate();
        Keypair restored = Keypair.fromBase58SecretKey(original.toBase58SecretKey());
        assertEquals(original.publicKey(), restored.publicKey());

        byte[] message = "bundle".getBytes();
        assertTrue(Keypair.verify(original.publicKey(), message, restored.sign(message)));
    }

    @Test
    void secretKeyLayoutIsSeedThenPublicKey() {
        byte[] secret = Keypair.fromSeed(SEED.clone()).secretKey();
        assertEquals(64, secret.length);
        byte[] expected = new byte[64];
        System.arraycopy(SEED, 0, expected, 0, 32);
        System.arraycopy(PUBLIC, 0, expected, 32, 32);
        assertArrayEquals(expected, secret);
    }

    @Test
    void rejectsMismatchedPublicHalf() {
        byte[] secret = Keypair.fromSeed(SEED.clone()).secretKey();
        secret[40] ^= 0x01;
        assertThrows(IllegalArgumentException.class, () -> Keypair.fromSecretKey(secret));
    }

    @Test
    void rejectsWrongLength() {
        assertThrows(IllegalArgumentException.class, () -> Keypair.fromSecretKey(new byte[32]));
        assertThrows(IllegalArgumentException.class, () -> Keypair.fromSeed(new byte[31]));
        assertThrows(IllegalArgumentException.class,
                () -> Keypair.fromBase58SecretKey(Base58.encode(new byte[10])));
    }

    @Test
    void fromSecretKeyZeroesInput() {
        byte[] secret = Keypair.generate().secretKey();
        Keypair.fromSecretKey(secret);
        assertArrayEquals(new byte[64], secret);
    }

    @Test
    void destroyedKeypairCannotSign() {
        Keypair keypair = Keypair.generate();
        assertFalse(keypair.isDestroyed());
        keypair.destroy();
        assertTrue(keypair.isDestroyed());
        assertThrows(IllegalStateException.class, () -> keypair.sign(new byte[] {1}));
    }

    @Test
    void toStringDoesNotLeakSecret() {
        Keypair keypair = Keypair.generate();
        assertFalse(keypair.toString().contains(keypair.toBase58SecretKey()));
        assertTrue(keypair.toString().contains(keypair.publicKey().toString()));
    }
}
