// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.crypto.Signer;
import sh.keel.core.error.RpcException;
import sh.keel.core.program.SystemProgram;
import sh.keel.core.tx.Instruction;
import sh.keel.core.tx.Message;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.rpc.JsonRpcResponse;
import sh.keel.rpc.KeelProvider;
import sh.keel.rpc.ResilientClient;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BlockEngineRelayTest {

    private static final Lamports TIP = Lamports.of(100_000_000L);

    @Mock
    private KeelProvider engine;

    @Mock
    private ResilientClient client;

    private final Keypair tipPayer = Keypair.generate();
    private BlockEngineRelay relay;

    @BeforeEach
    void setUp() {
        when(client.buildTransaction(anyList(), any(Signer.class))).thenAnswer(inv -> {
            List<Instruction> ixs = inv.getArgument(0);
            Signer signer = inv.getArgument(1);
            return signed(signer, ixs);
        });
        relay = new BlockEngineRelay(engine, client, tipPayer, BlockEngineRelay.DEFAULT_TIP_ACCOUNT);
    }

    @Test
    void sendsTransactionsFollowedByTipTransfer() {
        Transaction a = transfer(Keypair.generate());
        Transaction b = transfer(Keypair.generate());
        when(engine.send(eq("sendBundle"), anyList())).thenReturn(response("bundle-123"));

        RelaySubmission submission = relay.submit(List.of(a, b), TIP);

        assertTrue(submission.success());
        assertEquals("bundle-123", submission.bundleId());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<?>> params = ArgumentCaptor.forClass(List.class);
        verify(engine).send(eq("sendBundle"), params.capture());
        assertEquals(1, params.getValue().size());
        List<?> encoded = (List<?>) params.getValue().get(0);
        assertEquals(3, encoded.size());
        assertEquals(a.toBase58(), encoded.get(0));
        assertEquals(b.toBase58(), encoded.get(1));
        verify(client).buildTransaction(
                List.of(SystemProgram.transfer(tipPayer.publicKey(), BlockEngineRelay.DEFAULT_TIP_ACCOUNT, TIP)),
                tipPayer);
    }

    @Test
    void readsBundleIdFromResultObject() {
        when(engine.send(eq("sendBundle"), anyList())).thenReturn(response(Map.of("bundleId", "abc")));

        RelaySubmission submission = relay.submit(List.of(transfer(Keypair.generate())), TIP);

        assertTrue(submission.success());
        assertEquals("abc", submission.bundleId());
    }

    @Test
    void missingBundleIdIsRejected() {
        when(engine.send(eq("sendBundle"), anyList())).thenReturn(response(Map.of("status", "ok")));

        RelaySubmission submission = relay.submit(List.of(transfer(Keypair.generate())), TIP);

        assertFalse(submission.success());
        assertNull(submission.bundleId());
        assertTrue(submission.errorMessage().startsWith("Bundle submitted but no bundle ID in response"));
    }

    @Test
    void engineErrorIsRejected() {
        when(engine.send(eq("sendBundle"), anyList()))
                .thenThrow(new RpcException(-32097, "bundle rate limited", null, (Throwable) null));

        RelaySubmission submission = relay.submit(List.of(transfer(Keypair.generate())), TIP);

        assertFalse(submission.success());
        assertEquals("bundle rate limited", submission.errorMessage());
    }

    @Test
    void emptyBundleIsRejectedWithoutNetworkCall() {
        RelaySubmission submission = relay.submit(List.of(), TIP);

        assertFalse(submission.success());
        assertEquals("No transactions provided", submission.errorMessage());
        verifyNoInteractions(engine);
        verify(client, never()).buildTransaction(anyList(), any(Signer.class));
    }

    @Test
    void closeClosesEngine() {
        relay.close();

        verify(engine).close();
    }

    private static JsonRpcResponse response(final Object result) {
        return new JsonRpcResponse("2.0", result, null, "1");
    }

    private static Transaction transfer(final Keypair from) {
        return signed(from, List.of(SystemProgram.transfer(from.publicKey(), Keypair.generate().publicKey(),
                Lamports.of(1_000L))));
    }

    private static Transaction signed(final Signer signer, final List<Instruction> ixs) {
        return Transaction.sign(Message.compile(signer.publicKey(), ixs, Blockhash.fromBytes(new byte[32])),
                List.of(signer));
    }
}
