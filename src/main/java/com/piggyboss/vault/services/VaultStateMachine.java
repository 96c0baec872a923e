package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.DepositStatus;
import com.piggyboss.vault.pojos.PayoutBreakdown;
import com.piggyboss.vault.pojos.RewardPool;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.UserAggregate;
import com.piggyboss.vault.pojos.UserSummary;
import com.piggyboss.vault.pojos.VaultEvent;
import com.piggyboss.vault.pojos.VaultRecords;
import com.piggyboss.vault.pojos.YieldPosition;
import com.piggyboss.vault.services.VaultException.ErrorCode;
import com.piggyboss.vault.services.YieldPositionLedger.FinalizedPosition;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Drives the deposit lifecycle: OPEN, then WITHDRAWN or EMERGENCY_WITHDRAWN, both terminal.
 *
 * <h2>Execution model</h2>
 * Every mutating call runs to completion under one write lock, so lifecycle and admin
 * operations never interleave. Reads take the read lock.
 *
 * <h2>Ordering contract with the token ledger</h2>
 * <ul>
 *   <li>{@link #createDeposit}: funds are pulled before any state is touched.</li>
 *   <li>{@link #withdraw} / {@link #emergencyWithdraw}: the deposit is marked closed before the
 *       payout is issued. A re-entrant call from the ledger sees {@code ALREADY_WITHDRAWN}.
 *       If the payout fails, every change made by the call is rolled back.</li>
 * </ul>
 *
 * <h2>Persistence</h2>
 * The maps below are a cache of the {@link VaultStore}. The outermost mutating call syncs with
 * the store first and commits the records it touched before releasing the lock, against the
 * version it synced at. Calls nested through the token ledger join the outer commit.
 */
public class VaultStateMachine {

    private static final long UNSYNCED = -1;

    private final VaultConfig config;
    private final VaultStore store;
    private final YieldPositionLedger positions;
    private final TokenLedger tokenLedger;
    private final RewardNotifier rewardNotifier;
    private final Clock clock;
    private final VaultEventLog events = new VaultEventLog();

    private final Map<Long, Deposit> deposits = new LinkedHashMap<>();
    private final Map<String, UserAggregate> users = new HashMap<>();
    private long nextDepositId = 1;

    // Commit bookkeeping
    private long storedVersion = UNSYNCED;
    private long persistedEventSequence;
    private boolean plansDirty;
    private final Set<Long> dirtyDeposits = new LinkedHashSet<>();
    private final Set<String> dirtyUsers = new LinkedHashSet<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public VaultStateMachine(VaultConfig config, TokenLedger tokenLedger, RewardNotifier rewardNotifier, Clock clock) {
        this(config, new InMemoryVaultStore(), tokenLedger, rewardNotifier, clock);
    }

    public VaultStateMachine(VaultConfig config, VaultStore store, TokenLedger tokenLedger,
                             RewardNotifier rewardNotifier, Clock clock) {
        this.config = config;
        this.store = store;
        this.positions = new YieldPositionLedger(config.getCompoundingMode());
        this.tokenLedger = tokenLedger;
        this.rewardNotifier = rewardNotifier;
        this.clock = clock;
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    public Deposit createDeposit(String owner, BigInteger amount, int planId) throws VaultException {
        return createDeposit(owner, amount, planId, now());
    }

    /**
     * Lock {@code amount} into plan {@code planId} until {@code now + plan.duration}.
     *
     * @return a copy of the new deposit
     */
    public Deposit createDeposit(String owner, BigInteger amount, int planId, long now) throws VaultException {
        return mutate(() -> {
            if (config.isPaused()) {
                throw new VaultException(ErrorCode.VAULT_PAUSED);
            }
            if (owner == null || owner.isBlank()) {
                throw new VaultException(ErrorCode.NOT_OWNER, "Owner is required");
            }
            if (amount == null || amount.signum() <= 0) {
                throw new VaultException(ErrorCode.ZERO_PRINCIPAL);
            }
            SavingsPlan plan = config.getPlans().require(planId);
            if (!plan.isActive()) {
                throw new VaultException(ErrorCode.PLAN_INACTIVE, "Savings plan " + planId + " is not active");
            }
            if (!plan.acceptsAmount(amount)) {
                throw new VaultException(ErrorCode.AMOUNT_OUT_OF_RANGE,
                        "Amount must be between " + plan.getMinAmount() + " and " + plan.getMaxAmount());
            }
            int effectiveApy = config.effectiveApyFor(plan);

            try {
                tokenLedger.transferIn(owner, amount);
            } catch (TransferException e) {
                LoggingService.error("deposit_transfer_failed", e, LoggingService.data(
                        "owner", owner, "amount", amount, "planId", planId, "reason", e.getReason().name()));
                throw new VaultException(ErrorCode.TRANSFER_FAILED, "Transfer failed", e);
            }

            long positionId = positions.open(amount, plan.getDurationSeconds(), effectiveApy, now);

            Deposit deposit = new Deposit();
            deposit.setId(nextDepositId++);
            deposit.setOwner(owner);
            deposit.setAmount(amount);
            deposit.setPlanId(planId);
            deposit.setPlan(plan);
            deposit.setPositionId(positionId);
            deposit.setCreatedAt(now);
            deposit.setMaturityAt(now + plan.getDurationSeconds());
            deposits.put(deposit.getId(), deposit);
            dirtyDeposits.add(deposit.getId());
            dirtyUsers.add(owner);

            UserAggregate aggregate = users.computeIfAbsent(owner, UserAggregate::new);
            aggregate.recordDeposit(deposit.getId(), planId, amount, now);

            LoggingService.setDepositId(deposit.getId());
            events.append(VaultEvent.Type.DEPOSIT_CREATED, now, owner, deposit.getId(), amount,
                    "plan=" + planId + ", apyBps=" + effectiveApy + ", maturityAt=" + deposit.getMaturityAt());
            notifyMilestones(aggregate, deposit, now);

            return new Deposit(deposit);
        });
    }

    public PayoutBreakdown withdraw(String caller, long depositId) throws VaultException {
        return withdraw(caller, depositId, now());
    }

    /**
     * Close a matured deposit and pay {@code principal + interest + bonus}.
     * The bonus drops to zero when the reward pool cannot cover it.
     */
    public PayoutBreakdown withdraw(String caller, long depositId, long now) throws VaultException {
        return mutate(() -> {
            Deposit deposit = requireOpenDepositOf(caller, depositId);
            if (!deposit.isMatured(now)) {
                throw new VaultException(ErrorCode.NOT_MATURED,
                        "Deposit " + depositId + " matures at " + deposit.getMaturityAt());
            }
            Rollback rollback = new Rollback(deposit);

            FinalizedPosition finalized = positions.finalizePosition(deposit.getPositionId(), now);
            BigInteger bonus = InterestCalculator.maturityBonus(finalized.principal, finalized.totalInterest,
                    config.getMaturityBonusBps());
            boolean clamped = false;
            if (!config.tryDistribute(bonus)) {
                clamped = true;
                bonus = BigInteger.ZERO;
            }
            rollback.bonus = bonus;
            positions.applyBonus(deposit.getPositionId(), bonus);

            PayoutBreakdown breakdown = PayoutBreakdown.maturity(depositId, finalized.principal,
                    finalized.totalInterest, bonus, clamped);
            close(deposit, DepositStatus.WITHDRAWN, breakdown, now);
            recordWithdrawal(deposit, rollback, breakdown.payout, breakdown.interest.add(breakdown.bonus), now);

            payOut(deposit, breakdown, rollback);

            if (clamped) {
                events.append(VaultEvent.Type.BONUS_CLAMPED, now, deposit.getOwner(), depositId,
                        InterestCalculator.maturityBonus(finalized.principal, finalized.totalInterest,
                                config.getMaturityBonusBps()),
                        "reward pool available=" + config.getRewardPool().available());
            }
            events.append(VaultEvent.Type.DEPOSIT_WITHDRAWN, now, deposit.getOwner(), depositId, breakdown.payout,
                    "interest=" + breakdown.interest + ", bonus=" + breakdown.bonus);
            return breakdown;
        });
    }

    public PayoutBreakdown emergencyWithdraw(String caller, long depositId) throws VaultException {
        return emergencyWithdraw(caller, depositId, now());
    }

    /**
     * Close a deposit at any time, paying {@code principal - penalty}. Accrued interest is
     * frozen on the position for audit but not paid.
     */
    public PayoutBreakdown emergencyWithdraw(String caller, long depositId, long now) throws VaultException {
        return mutate(() -> {
            Deposit deposit = requireOpenDepositOf(caller, depositId);
            Rollback rollback = new Rollback(deposit);
            SavingsPlan plan = deposit.getPlan();

            FinalizedPosition finalized = positions.finalizePosition(deposit.getPositionId(), now);
            BigInteger penalty = InterestCalculator.earlyWithdrawalPenalty(
                    deposit.getAmount(),
                    config.penaltyRateFor(plan),
                    now - deposit.getCreatedAt(),
                    config.minimumHoldFor(plan));

            PayoutBreakdown breakdown = PayoutBreakdown.emergency(depositId, deposit.getAmount(),
                    finalized.totalInterest, penalty);
            close(deposit, DepositStatus.EMERGENCY_WITHDRAWN, breakdown, now);
            recordWithdrawal(deposit, rollback, breakdown.payout, BigInteger.ZERO, now);

            payOut(deposit, breakdown, rollback);

            events.append(VaultEvent.Type.EMERGENCY_WITHDRAWN, now, deposit.getOwner(), depositId, breakdown.payout,
                    "penalty=" + breakdown.penalty + ", forfeitedInterest=" + breakdown.interest);
            return breakdown;
        });
    }

    public BigInteger calculateCurrentInterest(long depositId) throws VaultException {
        return calculateCurrentInterest(depositId, now());
    }

    /**
     * Interest the deposit would show after an accrual at {@code now}. Read-only; closed
     * deposits report the value frozen at withdrawal.
     */
    public BigInteger calculateCurrentInterest(long depositId, long now) throws VaultException {
        lock.readLock().lock();
        try {
            Deposit deposit = requireDeposit(depositId);
            if (deposit.isWithdrawn()) {
                return deposit.getAccruedInterestAtWithdrawal();
            }
            return positions.projectInterest(deposit.getPositionId(), now);
        } finally {
            lock.readLock().unlock();
        }
    }

    // =========================================================================
    // Queries
    // =========================================================================

    public Deposit getDeposit(long depositId) throws VaultException {
        lock.readLock().lock();
        try {
            return new Deposit(requireDeposit(depositId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public YieldPosition getPosition(long depositId) throws VaultException {
        lock.readLock().lock();
        try {
            return positions.get(requireDeposit(depositId).getPositionId());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Long> listDepositIds(String owner) {
        lock.readLock().lock();
        try {
            UserAggregate aggregate = users.get(owner);
            return aggregate == null ? new ArrayList<>() : new ArrayList<>(aggregate.getDepositIds());
        } finally {
            lock.readLock().unlock();
        }
    }

    public UserSummary getUserSummary(String owner) {
        lock.readLock().lock();
        try {
            UserAggregate aggregate = users.get(owner);
            if (aggregate == null) {
                return new UserSummary(BigInteger.ZERO, 0, BigInteger.ZERO);
            }
            BigInteger totalSaved = BigInteger.ZERO;
            int activeCount = 0;
            for (Long id : aggregate.getDepositIds()) {
                Deposit deposit = deposits.get(id);
                if (!deposit.isWithdrawn()) {
                    totalSaved = totalSaved.add(deposit.getAmount());
                    activeCount++;
                }
            }
            return new UserSummary(totalSaved, activeCount, aggregate.getTotalEarned());
        } finally {
            lock.readLock().unlock();
        }
    }

    public UserAggregate getUserAggregate(String owner) {
        lock.readLock().lock();
        try {
            UserAggregate aggregate = users.get(owner);
            return aggregate == null ? new UserAggregate(owner) : new UserAggregate(aggregate);
        } finally {
            lock.readLock().unlock();
        }
    }

    public SavingsPlan getPlan(int planId) throws VaultException {
        return config.getPlans().require(planId);
    }

    public List<SavingsPlan> listPlans() {
        return config.getPlans().all();
    }

    public int effectiveApyOf(SavingsPlan plan) {
        return config.effectiveApyFor(plan);
    }

    public RewardPool getRewardPool() {
        return config.getRewardPool();
    }

    public List<VaultEvent> getEvents() {
        return events.all();
    }

    public List<VaultEvent> getEvents(long depositId) {
        return events.forDeposit(depositId);
    }

    public VaultConfig getConfig() {
        return config;
    }

    // =========================================================================
    // Administration
    // =========================================================================

    /**
     * Insert or replace a plan. Open deposits keep the terms they were created with.
     */
    public SavingsPlan setPlan(String caller, int planId, long durationSeconds, int baseApyBps,
                               BigInteger minAmount, BigInteger maxAmount, boolean active) throws VaultException {
        return mutate(() -> {
            config.requireAdmin(caller);
            SavingsPlan plan = config.getPlans().put(planId, durationSeconds, baseApyBps, minAmount, maxAmount, active);
            plansDirty = true;
            events.append(VaultEvent.Type.PLAN_UPDATED, now(), caller, null, null, plan.toString());
            return plan;
        });
    }

    public void setPlanMultiplier(String caller, int planId, int multiplierBps) throws VaultException {
        mutate(() -> {
            config.requireAdmin(caller);
            config.getPlans().setMultiplier(planId, multiplierBps);
            plansDirty = true;
            events.append(VaultEvent.Type.PLAN_MULTIPLIER_UPDATED, now(), caller, null, null,
                    "plan=" + planId + ", multiplierBps=" + multiplierBps);
            return null;
        });
    }

    public void setGlobalMultiplier(String caller, int multiplierBps) throws VaultException {
        mutate(() -> {
            config.requireAdmin(caller);
            config.setGlobalMultiplier(multiplierBps);
            events.append(VaultEvent.Type.GLOBAL_MULTIPLIER_UPDATED, now(), caller, null, null,
                    "multiplierBps=" + multiplierBps);
            return null;
        });
    }

    /**
     * Pull {@code amount} from the admin into the reward pool.
     */
    public RewardPool fundRewardPool(String caller, BigInteger amount) throws VaultException {
        return mutate(() -> {
            config.requireAdmin(caller);
            if (amount == null || amount.signum() <= 0) {
                throw new VaultException(ErrorCode.ZERO_PRINCIPAL, "Funding amount must be greater than zero");
            }
            try {
                tokenLedger.transferIn(caller, amount);
            } catch (TransferException e) {
                LoggingService.error("reward_pool_transfer_failed", e, LoggingService.data(
                        "caller", caller, "amount", amount, "reason", e.getReason().name()));
                throw new VaultException(ErrorCode.TRANSFER_FAILED, "Transfer failed", e);
            }
            config.fundRewardPool(amount);
            events.append(VaultEvent.Type.REWARD_POOL_FUNDED, now(), caller, null, amount, null);
            return config.getRewardPool();
        });
    }

    /**
     * Stop or resume new deposits. Withdrawals stay available while paused.
     */
    public void setPaused(String caller, boolean paused) throws VaultException {
        mutate(() -> {
            config.requireAdmin(caller);
            config.setPaused(paused);
            events.append(paused ? VaultEvent.Type.VAULT_PAUSED : VaultEvent.Type.VAULT_UNPAUSED,
                    now(), caller, null, null, null);
            return null;
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private long now() {
        return clock.instant().getEpochSecond();
    }

    // =========================================================================
    // Store sync
    // =========================================================================

    /**
     * Reload from the store if another instance committed since the last sync.
     * Costs one version read when nothing changed.
     */
    public void refresh() throws VaultException {
        lock.writeLock().lock();
        try {
            syncWithStore();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Run {@code mutation} under the write lock. The outermost call syncs first and commits after,
     * also when the mutation fails, so a rollback or a nested call's changes are stored too.
     */
    private <T> T mutate(Mutation<T> mutation) throws VaultException {
        lock.writeLock().lock();
        try {
            boolean outermost = lock.getWriteHoldCount() == 1;
            if (outermost) {
                syncWithStore();
            }
            T result;
            try {
                result = mutation.apply();
            } catch (VaultException | RuntimeException e) {
                if (outermost) {
                    commitAfterFailure();
                }
                throw e;
            }
            if (outermost) {
                commit();
            }
            return result;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void syncWithStore() throws VaultException {
        try {
            long current = store.currentVersion();
            if (current == storedVersion) {
                return;
            }
            if (current == 0) {
                // Empty store: the seeded plans go out with the first commit
                storedVersion = 0;
                plansDirty = true;
                return;
            }
            VaultRecords records = store.load();
            if (records == null) {
                throw new StoreException(StoreException.Reason.UNAVAILABLE,
                        "Store reported version " + current + " but returned no records");
            }
            hydrate(records);
        } catch (StoreException e) {
            LoggingService.error("vault_sync_failed", e, LoggingService.data("reason", e.getReason().name()));
            throw storeFailure(e);
        }
    }

    private void hydrate(VaultRecords records) throws VaultException {
        config.restoreFrom(records);
        deposits.clear();
        for (Deposit deposit : records.getDeposits()) {
            deposits.put(deposit.getId(), new Deposit(deposit));
        }
        positions.reset(records.getPositions());
        users.clear();
        for (UserAggregate aggregate : records.getUsers()) {
            users.put(aggregate.getUser(), new UserAggregate(aggregate));
        }
        events.reset(records.getEvents());
        nextDepositId = records.getNextDepositId();
        storedVersion = records.getVersion();
        persistedEventSequence = events.lastSequence();
        clearPending();
        LoggingService.info("vault_state_loaded", LoggingService.data(
                "version", storedVersion, "deposits", deposits.size(), "events", persistedEventSequence));
    }

    private boolean hasPendingChanges() {
        return plansDirty || !dirtyDeposits.isEmpty() || !dirtyUsers.isEmpty()
                || events.lastSequence() > persistedEventSequence;
    }

    private void commit() throws VaultException {
        if (!hasPendingChanges()) {
            return;
        }
        VaultRecords changes = new VaultRecords();
        changes.setNextDepositId(nextDepositId);
        config.exportTo(changes, plansDirty);
        for (Long id : dirtyDeposits) {
            Deposit deposit = deposits.get(id);
            changes.getDeposits().add(new Deposit(deposit));
            changes.getPositions().add(positions.get(deposit.getPositionId()));
        }
        for (String user : dirtyUsers) {
            changes.getUsers().add(new UserAggregate(users.get(user)));
        }
        changes.getEvents().addAll(events.after(persistedEventSequence));

        try {
            storedVersion = store.commit(storedVersion, changes);
            persistedEventSequence = events.lastSequence();
            clearPending();
        } catch (StoreException e) {
            // Drop the cache; the next call reloads whatever the store holds
            storedVersion = UNSYNCED;
            clearPending();
            LoggingService.error("vault_commit_failed", e, LoggingService.data(
                    "reason", e.getReason().name(),
                    "deposits", changes.getDeposits().toString(),
                    "events", changes.getEvents().toString()));
            throw storeFailure(e);
        }
    }

    private void commitAfterFailure() {
        try {
            commit();
        } catch (VaultException e) {
            LoggingService.warn("vault_commit_after_failure_failed", LoggingService.data(
                    "errorCode", e.getErrorCode().name()));
        }
    }

    private void clearPending() {
        plansDirty = false;
        dirtyDeposits.clear();
        dirtyUsers.clear();
    }

    private static VaultException storeFailure(StoreException e) {
        if (e.getReason() == StoreException.Reason.CONFLICT) {
            return new VaultException(ErrorCode.STORE_CONFLICT, e.getMessage(), e);
        }
        return new VaultException(ErrorCode.STORE_UNAVAILABLE, "Vault store unavailable", e);
    }

    private Deposit requireDeposit(long depositId) throws VaultException {
        Deposit deposit = deposits.get(depositId);
        if (deposit == null) {
            throw new VaultException(ErrorCode.DEPOSIT_NOT_FOUND, "Deposit " + depositId + " not found");
        }
        return deposit;
    }

    private Deposit requireOpenDepositOf(String caller, long depositId) throws VaultException {
        Deposit deposit = requireDeposit(depositId);
        if (caller == null || !caller.equals(deposit.getOwner())) {
            throw new VaultException(ErrorCode.NOT_OWNER);
        }
        if (deposit.isWithdrawn()) {
            throw new VaultException(ErrorCode.ALREADY_WITHDRAWN,
                    "Deposit " + depositId + " already " + deposit.getStatus());
        }
        LoggingService.setDepositId(depositId);
        return deposit;
    }

    private void close(Deposit deposit, DepositStatus status, PayoutBreakdown breakdown, long now) {
        deposit.setStatus(status);
        deposit.setAccruedInterestAtWithdrawal(breakdown.interest);
        deposit.setBonusAtWithdrawal(breakdown.bonus);
        deposit.setPenaltyAtWithdrawal(breakdown.penalty);
        deposit.setPayoutAmount(breakdown.payout);
        deposit.setClosedAt(now);
        dirtyDeposits.add(deposit.getId());
    }

    private void recordWithdrawal(Deposit deposit, Rollback rollback, BigInteger payout, BigInteger earned, long now) {
        users.get(deposit.getOwner()).recordWithdrawal(payout, earned, now);
        dirtyUsers.add(deposit.getOwner());
        rollback.payout = payout;
        rollback.earned = earned;
    }

    private void payOut(Deposit deposit, PayoutBreakdown breakdown, Rollback rollback) throws VaultException {
        if (breakdown.payout.signum() == 0) {
            return;
        }
        try {
            tokenLedger.transferOut(deposit.getOwner(), breakdown.payout);
        } catch (TransferException e) {
            rollback.apply();
            LoggingService.error("payout_transfer_failed", e, LoggingService.data(
                    "depositId", deposit.getId(),
                    "owner", deposit.getOwner(),
                    "kind", breakdown.kind.name(),
                    "payout", breakdown.payout,
                    "reason", e.getReason().name()));
            throw new VaultException(ErrorCode.TRANSFER_FAILED, "Transfer failed", e);
        } catch (RuntimeException e) {
            rollback.apply();
            LoggingService.error("payout_transfer_failed", e, LoggingService.data(
                    "depositId", deposit.getId(),
                    "owner", deposit.getOwner(),
                    "kind", breakdown.kind.name(),
                    "payout", breakdown.payout,
                    "reason", TransferException.Reason.LEDGER_UNAVAILABLE.name()));
            throw new VaultException(ErrorCode.TRANSFER_FAILED, "Transfer failed", e);
        }
    }

    private void notifyMilestones(UserAggregate aggregate, Deposit deposit, long now) {
        List<String> categories = config.getMilestones().resolve(
                deposit.getAmount(), deposit.getPlan().getDurationDays(),
                !aggregate.hasAwarded(MilestoneResolver.FIRST_DEPOSIT));
        for (String category : categories) {
            if (aggregate.hasAwarded(category)) {
                continue;
            }
            try {
                rewardNotifier.notify(deposit.getOwner(), category);
                aggregate.markAwarded(category);
                events.append(VaultEvent.Type.MILESTONE_REACHED, now, deposit.getOwner(), deposit.getId(), null, category);
            } catch (RuntimeException e) {
                // Left unawarded so a later deposit retries it
                LoggingService.warn("reward_notify_failed", e, LoggingService.data(
                        "user", deposit.getOwner(), "category", category, "depositId", deposit.getId()));
            }
        }
    }

    /**
     * Undo for one closing operation: the deposit and position as they were before it, plus the
     * amounts it added to the reward pool and the owner's aggregate. Changes made by calls nested
     * through the token ledger are left alone.
     */
    private final class Rollback {
        private final Deposit deposit;
        private final YieldPosition position;
        private BigInteger bonus = BigInteger.ZERO;
        private BigInteger payout;
        private BigInteger earned;

        Rollback(Deposit deposit) throws VaultException {
            this.deposit = new Deposit(deposit);
            this.position = positions.get(deposit.getPositionId());
        }

        void apply() {
            deposits.put(deposit.getId(), deposit);
            positions.restore(position);
            if (payout != null) {
                users.get(deposit.getOwner()).revertWithdrawal(payout, earned);
            }
            config.revertDistribution(bonus);
        }
    }

    @FunctionalInterface
    private interface Mutation<T> {
        T apply() throws VaultException;
    }
}
