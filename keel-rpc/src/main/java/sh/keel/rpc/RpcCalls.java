// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

import sh.keel.core.DebugLogger;
import sh.keel.core.LogFormatter;
import sh.keel.core.error.RpcException;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.core.types.TransactionSignature;

/**
 * Solana JSON-RPC methods expressed against a single {@link KeelProvider}.
 * Routes decide which provider runs them.
 */
final class RpcCalls {

    private static final Map<String, Object> BASE64 = Map.of("encoding", "base64");

    private RpcCalls() {
    }

    static String getHealth(final KeelProvider provider) {
        return provider.send("getHealth", List.of()).resultAsString();
    }

    static Blockhash getLatestBlockhash(final KeelProvider provider) {
        final Map<String, Object> value = provider
                .send("getLatestBlockhash", List.of(commitment(Commitment.PROCESSED)))
                .valueAsMap();
        if (value == null || value.get("blockhash") == null) {
            throw new RpcException(RpcException.PARSE_ERROR, "getLatestBlockhash returned no blockhash", null,
                    (Throwable) null);
        }
        return new Blockhash(value.get("blockhash").toString());
    }

    static Lamports getBalance(final KeelProvider provider, final PublicKey account) {
        final Object value = provider
                .send("getBalance", List.of(account.value(), commitment(Commitment.CONFIRMED)))
                .value();
        return value instanceof Number n ? Lamports.of(n.longValue()) : Lamports.ZERO;
    }

    static @Nullable AccountInfo getAccountInfo(final KeelProvider provider, final PublicKey account) {
        final Map<String, Object> value = provider
                .send("getAccountInfo", List.of(account.value(), BASE64))
                .valueAsMap();
        return value == null ? null : AccountInfo.fromRpc(value);
    }

    /**
     * Returns one entry per requested account, {@code null} where it does not exist.
     */
    static List<@Nullable AccountInfo> getMultipleAccounts(final KeelProvider provider, final List<PublicKey> accounts) {
        final List<String> keys = new ArrayList<>(accounts.size());
        for (PublicKey key : accounts) {
            keys.add(key.value());
        }
        final List<Object> value = provider.send("getMultipleAccounts", List.of(keys, BASE64)).valueAsList();
        final List<@Nullable AccountInfo> out = new ArrayList<>(accounts.size());
        for (int i = 0; i < accounts.size(); i++) {
            final Object entry = value != null && i < value.size() ? value.get(i) : null;
            out.add(entry instanceof Map<?, ?> map ? AccountInfo.fromRpc(map) : null);
        }
        return out;
    }

    /**
     * Returns the raw token amount held by a token account, 0 if the account does not exist.
     */
    static long getTokenAccountBalance(final KeelProvider provider, final PublicKey tokenAccount) {
        final Map<String, Object> value;
        try {
            value = provider
                    .send("getTokenAccountBalance", List.of(tokenAccount.value(), commitment(Commitment.CONFIRMED)))
                    .valueAsMap();
        } catch (RpcException e) {
            if (e.isAccountNotFound()) {
                return 0L;
            }
            throw e;
        }
        if (value == null || value.get("amount") == null) {
            return 0L;
        }
        return Long.parseLong(value.get("amount").toString());
    }

    static TransactionSignature sendTransaction(
            final KeelProvider provider, final Transaction transaction, final boolean skipPreflight) {
        final Map<String, Object> options = new LinkedHashMap<>();
        options.put("encoding", "base64");
        options.put("skipPreflight", skipPreflight);
        options.put("preflightCommitment", Commitment.PROCESSED.value());

        final long start = System.nanoTime();
        final String result = provider.send("sendTransaction", List.of(transaction.toBase64(), options))
                .resultAsString();
        if (result == null) {
            throw new RpcException(RpcException.PARSE_ERROR, "sendTransaction returned no signature", null,
                    (Throwable) null);
        }
        final TransactionSignature signature = new TransactionSignature(result);
        DebugLogger.logTx(LogFormatter.formatTxSignature(signature.value(), (System.nanoTime() - start) / 1_000L));
        return signature;
    }

    static @Nullable SignatureStatus getSignatureStatus(
            final KeelProvider provider, final TransactionSignature signature) {
        final List<Object> value = provider
                .send("getSignatureStatuses", List.of(List.of(signature.value())))
                .valueAsList();
        if (value == null || value.isEmpty() || !(value.get(0) instanceof Map<?, ?> entry)) {
            return null;
        }
        return SignatureStatus.fromRpc(entry);
    }

    /**
     * Polls {@code getSignatureStatuses} until the signature reaches {@code commitment}.
     *
     * <p>
     * RPC failures propagate so the calling route can retry them.
     *
     * @param timeout {@code null} to poll until the status resolves
     * @return {@code true} once confirmed, {@code false} if the transaction failed on
     *         chain, the timeout passed or the thread was interrupted
     */
    static boolean awaitConfirmation(
            final KeelProvider provider,
            final TransactionSignature signature,
            final Commitment commitment,
            final Duration pollInterval,
            final @Nullable Duration timeout) {
        DebugLogger.logTx(LogFormatter.formatTxWait(signature.value(), commitment.value()));
        final long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
        while (true) {
            final SignatureStatus status = getSignatureStatus(provider, signature);
            if (status != null) {
                if (status.failed()) {
                    DebugLogger.logTx(LogFormatter.formatTxConfirm(signature.value(), false));
                    return false;
                }
                if (commitment.isSatisfiedBy(status.confirmationStatus())) {
                    DebugLogger.logTx(LogFormatter.formatTxConfirm(signature.value(), true));
                    return true;
                }
            }
            if (timeout != null && System.nanoTime() - deadline >= 0) {
                return false;
            }
            try {
                Thread.sleep(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private static Map<String, Object> commitment(final Commitment commitment) {
        return Map.of("commitment", commitment.value());
    }
}
