// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.tx;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.keel.core.crypto.Signer;
import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.types.PublicKey;
import sh.keel.core.types.TransactionSignature;
import sh.keel.primitives.Base58;
import sh.keel.primitives.ShortVec;

/**
 * A signed legacy transaction: one 64-byte Ed25519 signature per required
 * signer followed by the serialized message.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Message message = Message.compile(payer.publicKey(), instructions, blockhash);
 * Transaction tx = Transaction.sign(message, List.of(payer));
 * String wire = tx.toBase64();
 * }</pre>
 */
public final class Transaction {

    public static final int SIGNATURE_LENGTH = 64;

    private final Message message;
    private final List<byte[]> signatures;

    private Transaction(final Message message, final List<byte[]> signatures) {
        this.message = message;
        this.signatures = signatures;
    }

    /**
     * Signs {@code message} with the given signers.
     *
     * <p>
     * Every required signer of the message must be present in {@code signers};
     * extra signers are ignored.
     *
     * @throws TransactionBuildException if a required signer is missing
     */
    public static Transaction sign(final Message message, final List<? extends Signer> signers) {
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(signers, "signers cannot be null");

        final Map<PublicKey, Signer> byKey = new HashMap<>();
        for (final Signer signer : signers) {
            byKey.putIfAbsent(signer.publicKey(), signer);
        }

        final byte[] payload = message.serialize();
        final List<byte[]> signatures = new ArrayList<>(message.numRequiredSignatures());
        for (final PublicKey required : message.signerKeys()) {
            final Signer signer = byKey.get(required);
            if (signer == null) {
                throw new TransactionBuildException("Missing signer for account " + required);
            }
            final byte[] signature = signer.sign(payload);
            if (signature.length != SIGNATURE_LENGTH) {
                throw new TransactionBuildException(
                        "Signer for " + required + " produced " + signature.length + "-byte signature");
            }
            signatures.add(signature);
        }
        return new Transaction(message, List.copyOf(signatures));
    }

    public Message message() {
        return message;
    }

    /**
     * Returns the fee payer's signature, which identifies the transaction on chain.
     */
    public TransactionSignature signature() {
        return TransactionSignature.fromBytes(signatures.get(0));
    }

    /**
     * Returns the signatures in signer order.
     */
    public List<TransactionSignature> signatures() {
        final List<TransactionSignature> out = new ArrayList<>(signatures.size());
        for (final byte[] sig : signatures) {
            out.add(TransactionSignature.fromBytes(sig));
        }
        return out;
    }

    public byte[] serialize() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream(512);
        out.writeBytes(ShortVec.encodeLength(signatures.size()));
        for (final byte[] sig : signatures) {
            out.writeBytes(sig);
        }
        out.writeBytes(message.serialize());
        return out.toByteArray();
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(serialize());
    }

    public String toBase58() {
        return Base58.encode(serialize());
    }

    @Override
    public String toString() {
        return "Transaction{signature=" + signature() + ", instructions=" + message.instructions().size() + "}";
    }
}
