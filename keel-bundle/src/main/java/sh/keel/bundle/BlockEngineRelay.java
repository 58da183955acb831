// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.keel.core.crypto.Signer;
import sh.keel.core.error.KeelException;
import sh.keel.core.program.SystemProgram;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.rpc.JsonRpcResponse;
import sh.keel.rpc.KeelProvider;
import sh.keel.rpc.ResilientClient;

/**
 * {@link BundleRelay} speaking the block-engine {@code sendBundle} JSON-RPC method.
 *
 * <p>
 * The tip is paid by a separate transfer from {@code tipPayer} to {@code tipAccount},
 * appended as the last transaction of the bundle so it only lands together with the
 * rest. Transactions are sent base58-encoded.
 *
 * <pre>{@code
 * KeelProvider engine = HttpKeelProvider.builder(BlockEngineRelay.DEFAULT_ENDPOINT).pool(pool).build();
 * BundleRelay relay = new BlockEngineRelay(engine, client, tipPayer, BlockEngineRelay.DEFAULT_TIP_ACCOUNT);
 * }</pre>
 */
public final class BlockEngineRelay implements BundleRelay, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BlockEngineRelay.class);

    public static final String DEFAULT_ENDPOINT = "https://mainnet.block-engine.jito.wtf/api/v1/bundles";
    public static final PublicKey DEFAULT_TIP_ACCOUNT =
            new PublicKey("96gYZGLnJYVFmbjzopPSU6QiEV5fGqZNyN9nmNhvrZU4");

    private final KeelProvider engine;
    private final ResilientClient client;
    private final Signer tipPayer;
    private final PublicKey tipAccount;

    public BlockEngineRelay(
            final KeelProvider engine, final ResilientClient client, final Signer tipPayer, final PublicKey tipAccount) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.client = Objects.requireNonNull(client, "client");
        this.tipPayer = Objects.requireNonNull(tipPayer, "tipPayer");
        this.tipAccount = Objects.requireNonNull(tipAccount, "tipAccount");
    }

    @Override
    public RelaySubmission submit(final List<Transaction> transactions, final Lamports tip) {
        if (transactions.isEmpty()) {
            return RelaySubmission.rejected("No transactions provided");
        }
        try {
            final List<String> encoded = new ArrayList<>(transactions.size() + 1);
            for (Transaction tx : transactions) {
                encoded.add(tx.toBase58());
            }
            encoded.add(tipTransaction(tip).toBase58());

            final JsonRpcResponse response = engine.send("sendBundle", List.of(encoded));
            final String bundleId = bundleId(response);
            if (bundleId == null) {
                final String error = "Bundle submitted but no bundle ID in response: " + response.result();
                log.warn(error);
                return RelaySubmission.rejected(error);
            }
            log.info("Bundle submitted: {} ({} transactions)", bundleId, encoded.size());
            return RelaySubmission.accepted(bundleId);
        } catch (KeelException e) {
            log.error("Bundle submission failed: {}", e.getMessage());
            return RelaySubmission.rejected(e.getMessage());
        }
    }

    @Override
    public void close() {
        engine.close();
    }

    private Transaction tipTransaction(final Lamports tip) {
        return client.buildTransaction(
                List.of(SystemProgram.transfer(tipPayer.publicKey(), tipAccount, tip)), tipPayer);
    }

    private static @Nullable String bundleId(final JsonRpcResponse response) {
        final Object result = response.result();
        if (result instanceof String id) {
            return id;
        }
        if (result instanceof Map<?, ?> map && map.get("bundleId") != null) {
            return map.get("bundleId").toString();
        }
        return null;
    }
}
