package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.DepositStatus;
import com.piggyboss.vault.pojos.PayoutBreakdown;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.VaultRecords;
import com.piggyboss.vault.services.InterestCalculator.CompoundingMode;
import com.piggyboss.vault.services.VaultException.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link VaultStateMachine} instances sharing a {@link VaultStore}: the state a new
 * instance starts from, and what happens when commits collide or the store is down.
 *
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class VaultStatePersistenceTest {

    private static final BigInteger UNIT = BigInteger.TEN.pow(18);
    private static final long DAY = InterestCalculator.SECONDS_PER_DAY;
    private static final long START = 1_700_000_000L;
    private static final String ALICE = "alice";
    private static final String ADMIN = "admin";
    private static final int PLAN_30 = 30;

    private MockTokenLedger ledger;
    private MutableClock clock;
    private InMemoryVaultStore store;

    @BeforeEach
    public void setUp() {
        ledger = new MockTokenLedger();
        clock = new MutableClock(START);
        store = new InMemoryVaultStore();
    }

    private static BigInteger units(long n) {
        return BigInteger.valueOf(n).multiply(UNIT);
    }

    private static VaultConfig newConfig() {
        return new VaultConfig(CompoundingMode.BOUNDED_ITERATIVE, 500,
                VaultConfig.defaultPenaltyTiers(), Set.of(ADMIN), new MilestoneResolver(Map.of()));
    }

    private VaultStateMachine newInstance(VaultStore vaultStore) {
        return new VaultStateMachine(newConfig(), vaultStore, ledger, new RecordingRewardNotifier(), clock);
    }

    /** First instance on an empty store: seeds two plans and funds the pool. */
    private VaultStateMachine seededInstance() throws VaultException {
        VaultStateMachine machine = newInstance(store);
        machine.setPlan(ADMIN, PLAN_30, 30 * DAY, 1200, units(10), units(100_000), true);
        machine.setPlan(ADMIN, 90, 90 * DAY, 1800, units(10), units(100_000), true);
        machine.fundRewardPool(ADMIN, units(1_000));
        return machine;
    }

    @Test
    public void test_newInstance_startsFromStoredState() throws VaultException {
        VaultStateMachine first = seededInstance();
        first.setPlanMultiplier(ADMIN, 90, 15_000);
        Deposit deposit = first.createDeposit(ALICE, units(1_000), PLAN_30, START);

        VaultStateMachine second = newInstance(store);
        second.refresh();

        assertEquals(List.of(30, 90), second.listPlans().stream()
                .map(SavingsPlan::getPlanId)
                .collect(Collectors.toList()));
        assertEquals(first.effectiveApyOf(first.getPlan(90)), second.effectiveApyOf(second.getPlan(90)));
        assertEquals(units(1_000), second.getRewardPool().getTotalPool());
        assertEquals(DepositStatus.OPEN, second.getDeposit(deposit.getId()).getStatus());
        assertEquals(units(1_000), second.getUserAggregate(ALICE).getTotalDeposited());
        assertEquals(first.getEvents().size(), second.getEvents().size());

        PayoutBreakdown payout = second.withdraw(ALICE, deposit.getId(), START + 30 * DAY);
        assertEquals(payout.payout, ledger.totalOutTo(ALICE));
        assertEquals(2, second.createDeposit(ALICE, units(50), PLAN_30, START + 30 * DAY).getId());

        first.refresh();
        assertEquals(DepositStatus.WITHDRAWN, first.getDeposit(deposit.getId()).getStatus());
        assertEquals(payout.bonus, first.getRewardPool().getDistributed());
        assertEquals(second.getEvents().size(), first.getEvents().size());
        assertEquals(List.of(1L, 2L), first.listDepositIds(ALICE));
    }

    @Test
    public void test_mutationOnStaleInstance_reloadsBeforeApplying() throws VaultException {
        VaultStateMachine first = seededInstance();
        VaultStateMachine second = newInstance(store);
        second.refresh();

        first.createDeposit(ALICE, units(100), PLAN_30, START);
        Deposit next = second.createDeposit(ALICE, units(100), PLAN_30, START + 1);

        assertEquals(2, next.getId());
        assertEquals(units(200), second.getUserAggregate(ALICE).getTotalDeposited());
    }

    @Test
    public void test_concurrentCommit_rejectedWithStoreConflict() throws VaultException {
        VaultStateMachine first = seededInstance();
        InterleavingStore interleaving = new InterleavingStore(store);
        VaultStateMachine second = newInstance(interleaving);
        second.refresh();

        interleaving.beforeNextCommit(() -> first.setPaused(ADMIN, true));
        VaultException e = assertThrows(VaultException.class, () -> second.setGlobalMultiplier(ADMIN, 12_000));
        assertEquals(ErrorCode.STORE_CONFLICT, e.getErrorCode());
        assertInstanceOf(StoreException.class, e.getCause());

        second.refresh();
        assertTrue(second.getConfig().isPaused());
        assertEquals(InterestCalculator.BASIS_POINTS, second.getConfig().getGlobalMultiplierBps());

        second.setPaused(ADMIN, false);
        second.setGlobalMultiplier(ADMIN, 12_000);
        first.refresh();
        assertFalse(first.getConfig().isPaused());
        assertEquals(12_000, first.getConfig().getGlobalMultiplierBps());
    }

    @Test
    public void test_storeUnreachable_depositRejectedBeforeFundsMove() throws Exception {
        VaultStore down = mock(VaultStore.class);
        when(down.currentVersion()).thenThrow(new StoreException(StoreException.Reason.UNAVAILABLE, "down"));
        VaultStateMachine machine = newInstance(down);

        VaultException e = assertThrows(VaultException.class,
                () -> machine.createDeposit(ALICE, units(100), PLAN_30, START));

        assertEquals(ErrorCode.STORE_UNAVAILABLE, e.getErrorCode());
        assertTrue(ledger.getTransfersIn().isEmpty());
        verify(down, never()).commit(anyLong(), any(VaultRecords.class));
        assertThrows(VaultException.class, machine::refresh);
    }

    @Test
    public void test_failedPayout_rollbackIsStored() throws VaultException {
        VaultStateMachine first = seededInstance();
        Deposit deposit = first.createDeposit(ALICE, units(1_000), PLAN_30, START);
        ledger.failTransfersOut(TransferException.Reason.INSUFFICIENT_FUNDS);

        assertThrows(VaultException.class, () -> first.withdraw(ALICE, deposit.getId(), START + 30 * DAY));

        VaultStateMachine second = newInstance(store);
        second.refresh();
        assertEquals(DepositStatus.OPEN, second.getDeposit(deposit.getId()).getStatus());
        assertTrue(second.getPosition(deposit.getId()).isActive());
        assertEquals(BigInteger.ZERO, second.getRewardPool().getDistributed());
        assertEquals(BigInteger.ZERO, second.getUserAggregate(ALICE).getTotalWithdrawn());
    }

    @Test
    public void test_reads_doNotCommit() throws VaultException {
        VaultStateMachine first = seededInstance();
        long version = store.currentVersion();

        first.listPlans();
        first.getUserSummary(ALICE);
        first.refresh();

        assertEquals(version, store.currentVersion());
    }

    /** Delegating store that runs a hook right before the next commit reaches the delegate. */
    private static final class InterleavingStore implements VaultStore {

        @FunctionalInterface
        interface Hook {
            void run() throws Exception;
        }

        private final VaultStore delegate;
        private Hook beforeCommit;

        InterleavingStore(VaultStore delegate) {
            this.delegate = delegate;
        }

        void beforeNextCommit(Hook hook) {
            this.beforeCommit = hook;
        }

        @Override
        public long currentVersion() throws StoreException {
            return delegate.currentVersion();
        }

        @Override
        public VaultRecords load() throws StoreException {
            return delegate.load();
        }

        @Override
        public long commit(long expectedVersion, VaultRecords changes) throws StoreException {
            if (beforeCommit != null) {
                Hook hook = beforeCommit;
                beforeCommit = null;
                try {
                    hook.run();
                } catch (Exception e) {
                    throw new IllegalStateException("Interleaved commit failed", e);
                }
            }
            return delegate.commit(expectedVersion, changes);
        }
    }
}
