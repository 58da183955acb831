// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import sh.keel.core.types.PublicKey;
import sh.keel.primitives.Base58;

/**
 * Ed25519 keypair backed by BouncyCastle.
 *
 * <p>
 * The exported secret key uses the conventional 64-byte layout: the 32-byte
 * seed followed by the 32-byte public key. Loading verifies that both halves
 * belong together.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Keypair keypair = Keypair.generate();
 * PublicKey address = keypair.publicKey();
 *
 * String stored = keypair.toBase58SecretKey();
 * Keypair restored = Keypair.fromBase58SecretKey(stored);
 * }</pre>
 *
 * <p>
 * Implements {@link Destroyable}: after {@link #destroy()} the key can no
 * longer sign.
 */
public final class Keypair implements Signer, Destroyable {

    private static final int SEED_SIZE = Ed25519PrivateKeyParameters.KEY_SIZE;
    private static final int SECRET_KEY_SIZE = SEED_SIZE + Ed25519PublicKeyParameters.KEY_SIZE;
    private static final SecureRandom RANDOM = new SecureRandom();

    private volatile Ed25519PrivateKeyParameters privateKey;
    private final PublicKey publicKey;
    private volatile boolean destroyed = false;

    private Keypair(final Ed25519PrivateKeyParameters privateKey) {
        this.privateKey = privateKey;
        this.publicKey = PublicKey.fromBytes(privateKey.generatePublicKey().getEncoded());
    }

    /**
     * Generates a new random keypair.
     */
    public static Keypair generate() {
        return new Keypair(new Ed25519PrivateKeyParameters(RANDOM));
    }

    /**
     * Creates a keypair from a 32-byte seed.
     *
     * @throws IllegalArgumentException if the seed is not 32 bytes
     */
    public static Keypair fromSeed(final byte[] seed) {
        Objects.requireNonNull(seed, "seed");
        if (seed.length != SEED_SIZE) {
            throw new IllegalArgumentException("Seed must be " + SEED_SIZE + " bytes, got " + seed.length);
        }
        return new Keypair(new Ed25519PrivateKeyParameters(seed, 0));
    }

    /**
     * Creates a keypair from a 64-byte secret key (seed followed by public key).
     *
     * <p>
     * The input array is zeroed after use.
     *
     * @throws IllegalArgumentException if the length is wrong or the public half does not match the seed
     */
    public static Keypair fromSecretKey(final byte[] secretKey) {
        Objects.requireNonNull(secretKey, "secretKey");
        try {
            if (secretKey.length != SECRET_KEY_SIZE) {
                throw new IllegalArgumentException(
                        "Secret key must be " + SECRET_KEY_SIZE + " bytes, got " + secretKey.length);
            }
            final Keypair keypair = new Keypair(new Ed25519PrivateKeyParameters(secretKey, 0));
            final byte[] expected = Arrays.copyOfRange(secretKey, SEED_SIZE, SECRET_KEY_SIZE);
            if (!Arrays.equals(expected, keypair.publicKey.toBytes())) {
                throw new IllegalArgumentException("Secret key public half does not match its seed");
            }
            return keypair;
        } finally {
            Arrays.fill(secretKey, (byte) 0);
        }
    }

    /**
     * Creates a keypair from a Base58-encoded 64-byte secret key.
     */
    public static Keypair fromBase58SecretKey(final String secretKey) {
        Objects.requireNonNull(secretKey, "secretKey");
        return fromSecretKey(Base58.decode(secretKey));
    }

    @Override
    public PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public byte[] sign(final byte[] message) {
        Objects.requireNonNull(message, "message");
        final Ed25519PrivateKeyParameters key = requireKey();
        final Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, key);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    /**
     * Verifies an Ed25519 signature against a public key.
     */
    public static boolean verify(final PublicKey publicKey, final byte[] message, final byte[] signature) {
        Objects.requireNonNull(publicKey, "publicKey");
        final Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new Ed25519PublicKeyParameters(publicKey.toBytes(), 0));
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    /**
     * Returns the 64-byte secret key. Callers own the returned array and should zero it after use.
     */
    public byte[] secretKey() {
        final byte[] secret = new byte[SECRET_KEY_SIZE];
        requireKey().encode(secret, 0);
        System.arraycopy(publicKey.toBytes(), 0, secret, SEED_SIZE, Ed25519PublicKeyParameters.KEY_SIZE);
        return secret;
    }

    public String toBase58SecretKey() {
        final byte[] secret = secretKey();
        try {
            return Base58.encode(secret);
        } finally {
            Arrays.fill(secret, (byte) 0);
        }
    }

    @Override
    public void destroy() {
        destroyed = true;
        privateKey = null;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "Keypair{publicKey=" + publicKey + "}";
    }

    private Ed25519PrivateKeyParameters requireKey() {
        final Ed25519PrivateKeyParameters key = privateKey;
        if (destroyed || key == null) {
            throw new IllegalStateException("Keypair has been destroyed");
        }
        return key;
    }
}
