// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.error.RpcException;
import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.error.TransactionSubmitException;
import sh.keel.core.program.ComputeBudgetProgram;
import sh.keel.core.program.SystemProgram;
import sh.keel.core.tx.ComputeBudget;
import sh.keel.core.tx.Instruction;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.core.types.TransactionSignature;

@ExtendWith(MockitoExtension.class)
class ResilientClientTest {

    private static final Blockhash BLOCKHASH = Blockhash.fromBytes(new byte[32]);

    @Mock
    private KeelProvider provider;

    private final Keypair payer = Keypair.generate();
    private final PublicKey recipient = Keypair.generate().publicKey();
    private ResilientClient client;

    @BeforeEach
    void setUp() {
        ClientConfig config = ClientConfig.builder()
                .sendBackoffBase(Duration.ZERO)
                .confirmPollInterval(Duration.ZERO)
                .build();
        client = new ResilientClient(
                new SingleEndpointRoute(provider, config.blockhashRefreshInterval(), config.confirmPollInterval()),
                config);
    }

    @Test
    void buildPrependsComputeBudgetInstructions() {
        stubBlockhash();
        Instruction transfer = SystemProgram.transfer(payer.publicKey(), recipient, Lamports.of(1_000));

        Transaction tx = client.buildTransaction(List.of(transfer), payer, 5000L, 90_000, null);

        assertEquals(List.of(
                ComputeBudgetProgram.setComputeUnitLimit(90_000),
                ComputeBudgetProgram.setComputeUnitPrice(5000),
                transfer), tx.message().instructions());
        assertEquals(BLOCKHASH, tx.message().recentBlockhash());
        assertEquals(payer.publicKey(), tx.message().feePayer());
        assertTrue(Keypair.verify(payer.publicKey(), tx.message().serialize(), tx.signatures().get(0).toBytes()));
    }

    @Test
    void buildWithoutBudgetKeepsInstructionsUnchanged() {
        stubBlockhash();
        Instruction transfer = SystemProgram.transfer(payer.publicKey(), recipient, Lamports.of(1_000));

        Transaction tx = client.buildTransaction(List.of(transfer), payer);

        assertEquals(List.of(transfer), tx.message().instructions());
    }

    @Test
    void buildFailureIsNotRetried() {
        stubBlockhash();

        assertThrows(TransactionBuildException.class,
                () -> client.buildAndSendTransaction(List.of(), payer, ComputeBudget.NONE));
        verify(provider, never()).send(eq("sendTransaction"), anyList());
    }

    @Test
    void sendRetriesUntilNodeAccepts() {
        stubBlockhash();
        String signature = someSignature().value();
        when(provider.send(eq("sendTransaction"), anyList()))
                .thenThrow(networkError("connection reset"))
                .thenReturn(new JsonRpcResponse("2.0", signature, null, "1"));

        TransactionSignature result = client.buildAndSendTransaction(
                List.of(SystemProgram.transfer(payer.publicKey(), recipient, Lamports.of(1))), payer);

        assertEquals(new TransactionSignature(signature), result);
        verify(provider, times(2)).send(eq("sendTransaction"), anyList());
    }

    @Test
    void sendGivesUpAfterConfiguredAttempts() {
        stubBlockhash();
        RpcException last = networkError("node is behind");
        when(provider.send(eq("sendTransaction"), anyList()))
                .thenThrow(networkError("first"), networkError("second"), last);

        TransactionSubmitException ex = assertThrows(TransactionSubmitException.class,
                () -> client.buildAndSendTransaction(
                        List.of(SystemProgram.transfer(payer.publicKey(), recipient, Lamports.of(1))), payer));

        assertEquals(3, ex.attempts());
        assertSame(last, ex.getCause());
        assertTrue(ex.getMessage().contains("node is behind"));
    }

    @Test
    void confirmWaitsForRequestedCommitment() {
        when(provider.send(eq("getSignatureStatuses"), anyList()))
                .thenReturn(statusResponse(null))
                .thenReturn(statusResponse(Map.of("slot", 7, "confirmationStatus", "processed")))
                .thenReturn(statusResponse(Map.of("slot", 7, "confirmationStatus", "finalized")));

        assertTrue(client.confirmTransaction(someSignature(), Commitment.FINALIZED));
        verify(provider, times(3)).send(eq("getSignatureStatuses"), anyList());
    }

    @Test
    void confirmReturnsFalseWhenTransactionFailedOnChain() {
        Map<String, Object> status = new HashMap<>();
        status.put("slot", 7);
        status.put("confirmationStatus", "confirmed");
        status.put("err", Map.of("InstructionError", List.of(0, "Custom")));
        when(provider.send(eq("getSignatureStatuses"), anyList())).thenReturn(statusResponse(status));

        assertFalse(client.confirmTransaction(someSignature(), Commitment.CONFIRMED));
    }

    @Test
    void confirmReturnsFalseOnRpcError() {
        when(provider.send(eq("getSignatureStatuses"), anyList())).thenThrow(networkError("down"));

        assertFalse(client.confirmTransaction(someSignature(), Commitment.CONFIRMED));
    }

    @Test
    void confirmReturnsFalseOnMalformedStatusResponse() {
        when(provider.send(eq("getSignatureStatuses"), anyList())).thenReturn(new JsonRpcResponse("2.0",
                Map.of("context", Map.of("slot", 1), "value", "bogus"), null, "1"));

        assertFalse(client.confirmTransaction(someSignature(), Commitment.CONFIRMED));
    }

    @Test
    void confirmGivesUpAfterTimeout() {
        when(provider.send(eq("getSignatureStatuses"), anyList())).thenReturn(statusResponse(null));

        assertFalse(client.confirmTransaction(someSignature(), Commitment.CONFIRMED, Duration.ZERO));
    }

    @Test
    void missingTokenAccountHasZeroBalance() {
        when(provider.send(eq("getTokenAccountBalance"), anyList())).thenThrow(new RpcException(
                -32602, "Invalid param: could not find account", null, (Throwable) null));

        assertEquals(0L, client.getTokenAccountBalance(recipient));
    }

    @Test
    void tokenBalanceReadsRawAmount() {
        when(provider.send(eq("getTokenAccountBalance"), anyList())).thenReturn(new JsonRpcResponse("2.0",
                Map.of("context", Map.of("slot", 1),
                        "value", Map.of("amount", "123456789", "decimals", 6, "uiAmountString", "123.456789")),
                null, "1"));

        assertEquals(123_456_789L, client.getTokenAccountBalance(recipient));
    }

    @Test
    void missingAccountIsNull() {
        when(provider.send(eq("getAccountInfo"), anyList())).thenReturn(new JsonRpcResponse("2.0",
                contextWrapped(null), null, "1"));

        assertNull(client.getAccountInfo(recipient));
    }

    @Test
    void emptyMultipleAccountsSkipsTheNode() {
        assertTrue(client.getMultipleAccounts(List.of()).isEmpty());
        verify(provider, never()).send(eq("getMultipleAccounts"), anyList());
    }

    @Test
    void postRpcReturnsNullOnFailure() {
        when(provider.sendRaw(anyMap())).thenThrow(networkError("down"));

        assertNull(client.postRpc(Map.of("jsonrpc", "2.0", "id", 1, "method", "getSlot")));
    }

    @Test
    void postRpcReturnsNullWhenPoolIsClosed() {
        when(provider.sendRaw(anyMap())).thenThrow(new IllegalStateException("HTTP connection pool is closed"));

        assertNull(client.postRpc(Map.of("jsonrpc", "2.0", "id", 1, "method", "getSlot")));
    }

    @Test
    void healthIsNullWhenUnreachable() {
        when(provider.send(eq("getHealth"), anyList())).thenThrow(networkError("refused"));

        assertNull(client.getHealth());
    }

    private void stubBlockhash() {
        when(provider.send(eq("getLatestBlockhash"), anyList())).thenReturn(new JsonRpcResponse("2.0",
                contextWrapped(Map.of("blockhash", BLOCKHASH.value(), "lastValidBlockHeight", 150)), null, "1"));
    }

    private static JsonRpcResponse statusResponse(final Map<String, Object> status) {
        List<Object> value = new ArrayList<>();
        value.add(status);
        return new JsonRpcResponse("2.0", contextWrapped(value), null, "1");
    }

    private static Map<String, Object> contextWrapped(final Object value) {
        Map<String, Object> result = new HashMap<>();
        result.put("context", Map.of("slot", 1));
        result.put("value", value);
        return result;
    }

    private static RpcException networkError(final String message) {
        return new RpcException(RpcException.NETWORK_ERROR, message, null, (Throwable) null);
    }

    private static TransactionSignature someSignature() {
        byte[] bytes = new byte[64];
        Arrays.fill(bytes, (byte) 7);
        return TransactionSignature.fromBytes(bytes);
    }
}
