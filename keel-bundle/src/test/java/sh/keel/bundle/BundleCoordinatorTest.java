// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.keel.bundle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import sh.keel.core.crypto.Keypair;
import sh.keel.core.crypto.Signer;
import sh.keel.core.error.RpcException;
import sh.keel.core.error.TransactionBuildException;
import sh.keel.core.program.SystemProgram;
import sh.keel.core.tx.ComputeBudget;
import sh.keel.core.tx.Instruction;
import sh.keel.core.tx.Message;
import sh.keel.core.tx.Transaction;
import sh.keel.core.types.Blockhash;
import sh.keel.core.types.Lamports;
import sh.keel.core.types.PublicKey;
import sh.keel.rpc.ResilientClient;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BundleCoordinatorTest {

    private static final Blockhash BLOCKHASH = Blockhash.fromBytes(new byte[32]);
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private ResilientClient client;

    @Mock
    private TradeInstructionBuilder instructions;

    private final TradeTarget target = new TradeTarget(Keypair.generate().publicKey(), "KEEL");
    private final List<Lamports> offeredTips = Collections.synchronizedList(new ArrayList<>());
    private final List<List<Transaction>> submitted = Collections.synchronizedList(new ArrayList<>());
    private IdentityPool pool;
    private BundleCoordinator coordinator;

    @BeforeEach
    void setUp() {
        when(client.getBalance(any())).thenReturn(Lamports.of(2_000_000_000L));
        when(client.buildTransaction(anyList(), any(Signer.class), any(ComputeBudget.class)))
                .thenAnswer(inv -> sign(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));
        when(instructions.buy(any(), any(), any()))
                .thenAnswer(inv -> List.of(SystemProgram.transfer(inv.getArgument(1), target.mint(), inv.getArgument(2))));
        when(instructions.sell(any(), any(), anyLong()))
                .thenAnswer(inv -> List.of(SystemProgram.transfer(inv.getArgument(1), target.mint(),
                        Lamports.of((Long) inv.getArgument(2)))));
        when(instructions.tokenAccount(any(), any())).thenAnswer(inv -> inv.getArgument(1));
        when(instructions.buyComputeUnitLimit()).thenReturn(120_000);
        when(instructions.sellComputeUnitLimit()).thenReturn(100_000);

        pool = new IdentityPool(client, IdentityPoolConfig.builder().size(3).fundingDelay(Duration.ZERO).build());
        pool.initialize(Keypair.generate());
    }

    @AfterEach
    void tearDown() {
        if (coordinator != null) {
            coordinator.close();
        }
    }

    @Test
    void escalatesTipAfterEachRejectionAndReportsFailure() {
        coordinator = coordinator(rejectingRelay("bundle dropped"));

        BundleResult result = coordinator.submitWithRetry(List.of(someTransaction()), Lamports.of(100_000_000L), 3);

        assertEquals(List.of(Lamports.of(100_000_000L), Lamports.of(150_000_000L), Lamports.of(200_000_000L)),
                offeredTips);
        assertEquals(offeredTips, result.attemptedTips());
        assertFalse(result.success());
        assertEquals(3, result.attempts());
        assertEquals("bundle dropped", result.errorMessage());
        assertEquals(Lamports.ZERO, result.tipPaid());
        assertNull(result.bundleId());
    }

    @Test
    void escalatedTipNeverExceedsMaximum() {
        coordinator = coordinator(rejectingRelay("no"));

        BundleResult result = coordinator.submitWithRetry(List.of(someTransaction()), Lamports.of(900_000_000L), 4);

        assertEquals(List.of(Lamports.of(900_000_000L), Lamports.of(950_000_000L),
                Lamports.of(1_000_000_000L), Lamports.of(1_000_000_000L)), result.attemptedTips());
    }

    @Test
    void tipAboveMaximumIsNeverLowered() {
        coordinator = coordinator(rejectingRelay("no"));

        BundleResult result = coordinator.submitWithRetry(List.of(someTransaction()), Lamports.of(2_000_000_000L), 3);

        assertEquals(List.of(Lamports.of(2_000_000_000L), Lamports.of(2_000_000_000L),
                Lamports.of(2_000_000_000L)), result.attemptedTips());
    }

    @Test
    void landingTipIsReportedAsPaid() {
        coordinator = coordinator((txs, tip) -> {
            offeredTips.add(tip);
            return offeredTips.size() < 2 ? RelaySubmission.rejected("busy") : RelaySubmission.accepted("bundle-42");
        });

        BundleResult result = coordinator.submitWithRetry(List.of(someTransaction()), Lamports.of(100_000_000L));

        assertTrue(result.success());
        assertEquals("bundle-42", result.bundleId());
        assertEquals(Lamports.of(150_000_000L), result.tipPaid());
        assertEquals(2, result.attempts());
    }

    @Test
    void relayExceptionCountsAsRejection() {
        coordinator = coordinator((txs, tip) -> {
            offeredTips.add(tip);
            throw new IllegalStateException("relay unreachable");
        });

        BundleResult result = coordinator.submitWithRetry(List.of(someTransaction()), Lamports.of(100_000_000L));

        assertFalse(result.success());
        assertEquals(3, offeredTips.size());
        assertEquals("relay unreachable", result.errorMessage());
    }

    @Test
    void buySubmitsOneTransactionPerIdentityInPoolOrder() {
        coordinator = coordinator(acceptingRelay());

        BundleResult result = coordinator.executeBuy(target, Lamports.fromSol("0.05"));

        assertTrue(result.success());
        assertEquals(3, result.transactionsSubmitted());
        assertEquals(1, submitted.size());
        List<Transaction> bundle = submitted.get(0);
        for (int i = 0; i < 3; i++) {
            assertEquals(pool.identity(i).publicKey(), bundle.get(i).message().feePayer());
        }
        assertEquals(Lamports.of(100_000_000L), offeredTips.get(0));
    }

    @Test
    void buyTransactionsCarryPriorityFeeAndBuilderLimit() {
        coordinator = coordinator(acceptingRelay());

        coordinator.executeBuy(target, Lamports.fromSol("0.05"), List.of(0), null);

        verify(client).buildTransaction(anyList(), eq(pool.identity(0).keypair()),
                eq(ComputeBudget.builder().priorityFee(100_000L).computeUnitLimit(120_000).build()));
    }

    @Test
    void failedBuildsAreSkippedNotFatal() {
        PublicKey broken = pool.identity(1).publicKey();
        doThrow(new TransactionBuildException("no price data")).when(instructions).buy(any(), eq(broken), any());
        coordinator = coordinator(acceptingRelay());

        BundleResult result = coordinator.executeBuy(target, Lamports.fromSol("0.05"));

        assertTrue(result.success());
        assertEquals(2, result.transactionsSubmitted());
        assertEquals(pool.identity(0).publicKey(), submitted.get(0).get(0).message().feePayer());
        assertEquals(pool.identity(2).publicKey(), submitted.get(0).get(1).message().feePayer());
    }

    @Test
    void nothingBuiltMeansNothingSubmitted() {
        doThrow(new TransactionBuildException("no price data")).when(instructions).buy(any(), any(), any());
        coordinator = coordinator(acceptingRelay());

        BundleResult result = coordinator.executeBuy(target, Lamports.fromSol("0.05"));

        assertFalse(result.success());
        assertEquals("No transactions built", result.errorMessage());
        assertTrue(submitted.isEmpty());
        assertEquals(0, coordinator.stats().totalBundles());
    }

    @Test
    void fullSellUsesExactObservedBalance() {
        when(client.getTokenAccountBalance(any())).thenReturn(1_234_567_891L);
        coordinator = coordinator(acceptingRelay());

        BundleResult result = coordinator.executePercentageSell(target, 1.0, List.of(0), null);

        assertTrue(result.success());
        verify(instructions).sell(target, pool.identity(0).publicKey(), 1_234_567_891L);
        assertEquals(1_234_567_891L, pool.identity(0).tokenBalance());
    }

    @Test
    void partialSellRoundsDown() {
        when(client.getTokenAccountBalance(any())).thenReturn(999L);
        coordinator = coordinator(acceptingRelay());

        coordinator.executePercentageSell(target, 0.5, List.of(0), null);

        verify(instructions).sell(target, pool.identity(0).publicKey(), 499L);
    }

    @Test
    void identitiesWithNothingToSellAreLeftOut() {
        PublicKey empty = pool.identity(0).publicKey();
        when(client.getTokenAccountBalance(any())).thenReturn(10L);
        when(client.getTokenAccountBalance(empty)).thenReturn(1L);
        when(client.getTokenAccountBalance(pool.identity(2).publicKey()))
                .thenThrow(new RpcException(-32602, "could not find account", null, (Throwable) null));
        coordinator = coordinator(acceptingRelay());

        BundleResult result = coordinator.executePercentageSell(target, 0.5);

        assertTrue(result.success());
        assertEquals(1, result.transactionsSubmitted());
        verify(instructions, never()).sell(any(), eq(empty), anyLong());
    }

    @Test
    void sellWithNoBalanceAnywhereIsNotSubmitted() {
        when(client.getTokenAccountBalance(any())).thenReturn(0L);
        coordinator = coordinator(acceptingRelay());

        BundleResult result = coordinator.executePercentageSell(target, 0.25);

        assertFalse(result.success());
        assertEquals("No transactions built", result.errorMessage());
        assertTrue(submitted.isEmpty());
    }

    @Test
    void rejectsPercentageOutsideUnitInterval() {
        coordinator = coordinator(acceptingRelay());

        assertThrows(IllegalArgumentException.class, () -> coordinator.executePercentageSell(target, 0.0));
        assertThrows(IllegalArgumentException.class, () -> coordinator.executePercentageSell(target, 1.5));
    }

    @Test
    void rejectsUnknownIdentityIndex() {
        coordinator = coordinator(acceptingRelay());

        assertThrows(IndexOutOfBoundsException.class,
                () -> coordinator.executeBuy(target, Lamports.of(1), List.of(0, 7), null));
    }

    @Test
    void explicitTipOverridesInitialTip() {
        coordinator = coordinator(acceptingRelay());

        coordinator.executeBuy(target, Lamports.of(1_000), null, Lamports.of(250_000_000L));

        assertEquals(List.of(Lamports.of(250_000_000L)), offeredTips);
    }

    @Test
    void landedBundleMarksIdentitiesAndUpdatesStats() {
        coordinator = coordinator(acceptingRelay());

        coordinator.executeBuy(target, Lamports.of(1_000), List.of(0, 2), null);

        assertEquals(1, pool.identity(0).totalTrades());
        assertEquals(NOW, pool.identity(0).lastUsed());
        assertEquals(0, pool.identity(1).totalTrades());
        assertEquals(1, pool.identity(2).totalTrades());
        BundleStats stats = coordinator.stats();
        assertEquals(1, stats.totalBundles());
        assertEquals(1, stats.successfulBundles());
        assertEquals(1.0, stats.successRate());
        assertEquals(3, stats.identityCount());
    }

    private BundleCoordinator coordinator(final BundleRelay relay) {
        BundleConfig config = BundleConfig.builder().retryDelay(Duration.ZERO).build();
        return new BundleCoordinator(client, pool, relay, instructions, config, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private BundleRelay acceptingRelay() {
        return (txs, tip) -> {
            offeredTips.add(tip);
            submitted.add(txs);
            return RelaySubmission.accepted("bundle-" + submitted.size());
        };
    }

    private BundleRelay rejectingRelay(final String reason) {
        return (txs, tip) -> {
            offeredTips.add(tip);
            return RelaySubmission.rejected(reason);
        };
    }

    private static Transaction sign(final List<Instruction> ixs, final Signer signer, final ComputeBudget budget) {
        Message message = Message.compile(signer.publicKey(), budget.prependTo(ixs), BLOCKHASH);
        return Transaction.sign(message, List.of(signer));
    }

    private static Transaction someTransaction() {
        Keypair payer = Keypair.generate();
        return sign(List.of(SystemProgram.transfer(payer.publicKey(), Keypair.generate().publicKey(), Lamports.of(1))),
                payer, ComputeBudget.NONE);
    }
}
