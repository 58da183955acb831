// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.core.tx;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.PublicKey;
import sh.keel.primitives.ShortVec;

/**
 * Compiled legacy transaction message.
 *
 * <h2>Account Ordering</h2>
 * <p>
 * Accounts are de-duplicated, keeping the union of their flags, then ordered as:
 * fee payer, writable signers, readonly signers, writable non-signers, readonly
 * non-signers. Within each group the first-seen order is kept.
 *
 * <h2>Wire Format</h2>
 *
 * <pre>
 * [numRequiredSignatures u8][numReadonlySigned u8][numReadonlyUnsigned u8]
 * shortvec(accounts) accounts[32]...
 * recentBlockhash[32]
 * shortvec(instructions) { programIndex u8, shortvec(accountIdx) u8..., shortvec(data) data }...
 * </pre>
 *
 * @param numRequiredSignatures  count of signer accounts
 * @param numReadonlySigned      count of readonly signer accounts
 * @param numReadonlyUnsigned    count of readonly non-signer accounts
 * @param accountKeys            ordered account keys
 * @param recentBlockhash        the blockhash the message is valid for
 * @param instructions           the instructions in caller order
 */
public record Message(
        int numRequiredSignatures,
        int numReadonlySigned,
        int numReadonlyUnsigned,
        List<PublicKey> accountKeys,
        Blockhash recentBlockhash,
        List<Instruction> instructions) {

    private static final int MAX_ACCOUNTS = 256;

    public Message {
        Objects.requireNonNull(accountKeys, "accountKeys cannot be null");
        Objects.requireNonNull(recentBlockhash, "recentBlockhash cannot be null");
        Objects.requireNonNull(instructions, "instructions cannot be null");
        accountKeys = List.copyOf(accountKeys);
        instructions = List.copyOf(instructions);
    }

    /**
     * Compiles instructions into a message with {@code payer} as the fee payer.
     *
     * @throws TransactionBuildException if no instructions are given or too many accounts are referenced
     */
    public static Message compile(
            final PublicKey payer, final List<Instruction> instructions, final Blockhash recentBlockhash) {
        Objects.requireNonNull(payer, "payer cannot be null");
        Objects.requireNonNull(instructions, "instructions cannot be null");
        Objects.requireNonNull(recentBlockhash, "recentBlockhash cannot be null");
        if (instructions.isEmpty()) {
            throw new TransactionBuildException("Transaction must contain at least one instruction");
        }

        final Map<PublicKey, Flags> flags = new LinkedHashMap<>();
        flags.put(payer, new Flags(true, true));
        for (final Instruction ix : instructions) {
            for (final AccountMeta meta : ix.accounts()) {
                flags.computeIfAbsent(meta.publicKey(), k -> new Flags(false, false)).merge(meta);
            }
            flags.computeIfAbsent(ix.programId(), k -> new Flags(false, false));
        }
        if (flags.size() > MAX_ACCOUNTS) {
            throw new TransactionBuildException(
                    "Transaction references " + flags.size() + " accounts, maximum is " + MAX_ACCOUNTS);
        }

        final List<PublicKey> writableSigners = new ArrayList<>();
        final List<PublicKey> readonlySigners = new ArrayList<>();
        final List<PublicKey> writableUnsigned = new ArrayList<>();
        final List<PublicKey> readonlyUnsigned = new ArrayList<>();
        for (final Map.Entry<PublicKey, Flags> e : flags.entrySet()) {
            final Flags f = e.getValue();
            if (f.signer && f.writable) {
                writableSigners.add(e.getKey());
            } else if (f.signer) {
                readonlySigners.add(e.getKey());
            } else if (f.writable) {
                writableUnsigned.add(e.getKey());
            } else {
                readonlyUnsigned.add(e.getKey());
            }
        }

        // payer was inserted first, so it leads the writable signers
        final List<PublicKey> keys = new ArrayList<>(flags.size());
        keys.addAll(writableSigners);
        keys.addAll(readonlySigners);
        keys.addAll(writableUnsigned);
        keys.addAll(readonlyUnsigned);

        return new Message(
                writableSigners.size() + readonlySigners.size(),
                readonlySigners.size(),
                readonlyUnsigned.size(),
                keys,
                recentBlockhash,
                instructions);
    }

    /**
     * Returns the fee payer (always the first account key).
     */
    public PublicKey feePayer() {
        return accountKeys.get(0);
    }

    /**
     * Returns the public keys that must sign, in signature order.
     */
    public List<PublicKey> signerKeys() {
        return accountKeys.subList(0, numRequiredSignatures);
    }

    /**
     * Serializes the message; these are the bytes every signer signs.
     */
    public byte[] serialize() {
        final ByteArrayOutputStream out = new ByteArrayOutputStream(256);
        out.write(numRequiredSignatures);
        out.write(numReadonlySigned);
        out.write(numReadonlyUnsigned);

        out.writeBytes(ShortVec.encodeLength(accountKeys.size()));
        for (final PublicKey key : accountKeys) {
            out.writeBytes(key.toBytes());
        }
        out.writeBytes(recentBlockhash.toBytes());

        out.writeBytes(ShortVec.encodeLength(instructions.size()));
        for (final Instruction ix : instructions) {
            out.write(indexOf(ix.programId()));
            final List<AccountMeta> accounts = ix.accounts();
            out.writeBytes(ShortVec.encodeLength(accounts.size()));
            for (final AccountMeta meta : accounts) {
                out.write(indexOf(meta.publicKey()));
            }
            final byte[] data = ix.data();
            out.writeBytes(ShortVec.encodeLength(data.length));
            out.writeBytes(data);
        }
        return out.toByteArray();
    }

    private int indexOf(final PublicKey key) {
        final int index = accountKeys.indexOf(key);
        if (index < 0) {
            throw new TransactionBuildException("Account not present in message: " + key);
        }
        return index;
    }

    private static final class Flags {
        private boolean signer;
        private boolean writable;

        private Flags(final boolean signer, final boolean writable) {
            this.signer = signer;
            this.writable = writable;
        }

        private Flags merge(final AccountMeta meta) {
            signer |= meta.isSigner();
            writable |= meta.isWritable();
            return this;
        }
    }
}
