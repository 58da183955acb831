// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.DebugLogger;
import sh.keel.core.LogFormatter;
import sh.keel.core.crypto.Signer;
import sh.keel.core.error.KeelException;
import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.error.TransactionSubmitException;
import sh.keel.core.tx.ComputeBudget;
import sh.keel.core.tx.Instruction;
import sh.keel.core.tx.Message;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.core.types.TransactionSignature;

/**
 * Solana client that works the same over one endpoint or over a
 * {@link FailoverRouter}.
 *
 * <p>
 * The mode is the {@link RpcRoute} given at construction and never changes.
 * Sending adds its own retry loop on top of whatever retry the route applies:
 * after a failed send it waits {@code sendBackoffBase * 2^attempt} and tries
 * again, up to {@link ClientConfig#maxSendRetries()} times.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * HttpConnectionPool pool = new HttpConnectionPool(PoolConfig.defaults());
 * try (ResilientClient client = ResilientClient.failover(
 *         List.of(primaryUrl, backupUrl), pool, FailoverConfig.defaults(), ClientConfig.defaults())) {
 *     client.start();
 *     TransactionSignature sig = client.buildAndSendTransaction(
 *             instructions, payer, ComputeBudget.builder().priorityFee(5_000).build());
 *     boolean landed = client.confirmTransaction(sig, Commitment.CONFIRMED);
 * }
 * pool.close();
 * }</pre>
 */
public final class ResilientClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientClient.class);

    private final RpcRoute route;
    private final ClientConfig config;

    public ResilientClient(final RpcRoute route, final ClientConfig config) {
        this.route = Objects.requireNonNull(route, "route");
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Creates a client bound to one endpoint, sending through the shared pool.
     */
    public static ResilientClient singleEndpoint(
            final String url, final HttpConnectionPool pool, final ClientConfig config) {
        final KeelProvider provider = HttpKeelProvider.builder(url).pool(pool).build();
        return new ResilientClient(
                new SingleEndpointRoute(provider, config.blockhashRefreshInterval(), config.confirmPollInterval()),
                config);
    }

    /**
     * Creates a client routing over several endpoints with failover.
     *
     * @throws IllegalArgumentException if {@code urls} is empty
     */
    public static ResilientClient failover(
            final List<String> urls,
            final HttpConnectionPool pool,
            final FailoverConfig failoverConfig,
            final ClientConfig config) {
        return new ResilientClient(
                new FailoverRouter(urls, failoverConfig, ProviderFactory.http(pool)), config);
    }

    /**
     * Starts the route's background work. Idempotent.
     */
    public void start() {
        route.start();
    }

    @Override
    public void close() {
        route.close();
    }

    public RpcRoute route() {
        return route;
    }

    public ClientConfig config() {
        return config;
    }

    public Blockhash getCachedBlockhash() {
        return route.cachedBlockhash();
    }

    public Blockhash getLatestBlockhash() {
        return route.execute(RpcCalls::getLatestBlockhash);
    }

    /**
     * Returns the node's health string, or {@code null} if the node could not be reached.
     */
    public @Nullable String getHealth() {
        try {
            return route.execute(RpcCalls::getHealth);
        } catch (KeelException | AllProvidersExhaustedException e) {
            log.warn("Health request failed: {}", e.getMessage());
            return null;
        }
    }

    public Lamports getBalance(final PublicKey account) {
        Objects.requireNonNull(account, "account");
        return route.execute(p -> RpcCalls.getBalance(p, account));
    }

    /**
     * Returns the account, or {@code null} if it does not exist.
     */
    public @Nullable AccountInfo getAccountInfo(final PublicKey account) {
        Objects.requireNonNull(account, "account");
        return route.execute(p -> RpcCalls.getAccountInfo(p, account));
    }

    /**
     * Returns accounts aligned with {@code accounts}, {@code null} where absent.
     */
    public List<@Nullable AccountInfo> getMultipleAccounts(final List<PublicKey> accounts) {
        Objects.requireNonNull(accounts, "accounts");
        if (accounts.isEmpty()) {
            return List.of();
        }
        return route.execute(p -> RpcCalls.getMultipleAccounts(p, accounts));
    }

    /**
     * Returns the raw token amount of a token account, 0 if it does not exist.
     */
    public long getTokenAccountBalance(final PublicKey tokenAccount) {
        Objects.requireNonNull(tokenAccount, "tokenAccount");
        return route.execute(p -> RpcCalls.getTokenAccountBalance(p, tokenAccount));
    }

    /**
     * Builds and signs a transaction paid by {@code signer}.
     *
     * <p>
     * Compute budget instructions are prepended as described in {@link ComputeBudget};
     * the caller's instructions follow unchanged. The only network access is the
     * cached blockhash read.
     *
     * @throws TransactionBuildException if the transaction cannot be assembled
     */
    public Transaction buildTransaction(
            final List<Instruction> instructions, final Signer signer, final ComputeBudget budget) {
        Objects.requireNonNull(instructions, "instructions");
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(budget, "budget");
        final List<Instruction> all = budget.prependTo(instructions);
        final Blockhash blockhash = getCachedBlockhash();
        final Message message = Message.compile(signer.publicKey(), all, blockhash);
        return Transaction.sign(message, List.of(signer));
    }

    /**
     * Builds a transaction with the given optional budget settings; {@code null} leaves a setting out.
     */
    public Transaction buildTransaction(
            final List<Instruction> instructions,
            final Signer signer,
            final @Nullable Long priorityFee,
            final @Nullable Integer computeUnitLimit,
            final @Nullable Integer accountDataSizeLimit) {
        return buildTransaction(
                instructions, signer, new ComputeBudget(priorityFee, computeUnitLimit, accountDataSizeLimit));
    }

    public Transaction buildTransaction(final List<Instruction> instructions, final Signer signer) {
        return buildTransaction(instructions, signer, ComputeBudget.NONE);
    }

    /**
     * Sends a signed transaction once through the route.
     */
    public TransactionSignature sendTransaction(final Transaction transaction) {
        Objects.requireNonNull(transaction, "transaction");
        return route.execute(p -> RpcCalls.sendTransaction(p, transaction, config.skipPreflight()));
    }

    /**
     * Builds a transaction and sends it with send-level retry.
     *
     * @throws TransactionBuildException  if building fails; never retried
     * @throws TransactionSubmitException once every send attempt has failed
     */
    public TransactionSignature buildAndSendTransaction(
            final List<Instruction> instructions, final Signer signer, final ComputeBudget budget) {
        final Transaction transaction = buildTransaction(instructions, signer, budget);
        final int maxRetries = config.maxSendRetries();
        RuntimeException last = null;
        int attempts = 0;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            attempts++;
            DebugLogger.logTx(LogFormatter.formatTxSend(
                    signer.publicKey().value(), transaction.message().instructions().size(), attempt + 1));
            try {
                return sendTransaction(transaction);
            } catch (TransactionBuildException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxRetries - 1) {
                    log.error("Failed to send transaction after {} attempts", maxRetries, e);
                    break;
                }
                final Duration wait = config.sendBackoffFor(attempt);
                log.warn("Transaction attempt {} failed: {}, retrying in {}ms",
                        attempt + 1, e.getMessage(), wait.toMillis());
                try {
                    Thread.sleep(wait.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        throw new TransactionSubmitException(
                "Failed to send transaction after " + attempts + " attempts: "
                        + (last != null ? last.getMessage() : "interrupted"),
                attempts,
                last);
    }

    public TransactionSignature buildAndSendTransaction(final List<Instruction> instructions, final Signer signer) {
        return buildAndSendTransaction(instructions, signer, ComputeBudget.NONE);
    }

    /**
     * Polls until the signature reaches {@code commitment}. Never throws on
     * confirmation failure; logs and returns {@code false}.
     */
    public boolean confirmTransaction(final TransactionSignature signature, final Commitment commitment) {
        return route.confirmTransaction(signature, commitment, null);
    }

    /**
     * Like {@link #confirmTransaction(TransactionSignature, Commitment)} but gives up after {@code timeout}.
     */
    public boolean confirmTransaction(
            final TransactionSignature signature, final Commitment commitment, final Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        return route.confirmTransaction(signature, commitment, timeout);
    }

    /**
     * Posts a raw JSON-RPC body.
     *
     * @return the parsed response, or {@code null} if the request failed
     */
    public @Nullable Map<String, Object> postRpc(final Map<String, ?> body) {
        Objects.requireNonNull(body, "body");
        return route.postRpc(body);
    }
}
