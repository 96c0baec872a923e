package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.RewardPool;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.UserAggregate;
import com.piggyboss.vault.pojos.VaultEvent;
import com.piggyboss.vault.pojos.VaultRecords;
import com.piggyboss.vault.pojos.YieldPosition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Process-local {@link VaultStore}. State lives as long as the instance; use it for local runs
 * and tests, never for a deployed function.
 */
public class InMemoryVaultStore implements VaultStore {

    private long version;
    private long nextDepositId = 1;
    private int globalMultiplierBps = InterestCalculator.BASIS_POINTS;
    private boolean paused;
    private RewardPool rewardPool = new RewardPool();
    private final Map<Integer, SavingsPlan> plans = new TreeMap<>();
    private final Map<Integer, Integer> planMultipliers = new TreeMap<>();
    private final Map<Long, Deposit> deposits = new TreeMap<>();
    private final Map<Long, YieldPosition> positions = new TreeMap<>();
    private final Map<String, UserAggregate> users = new LinkedHashMap<>();
    private final Map<Long, VaultEvent> events = new TreeMap<>();

    @Override
    public synchronized long currentVersion() {
        return version;
    }

    @Override
    public synchronized VaultRecords load() {
        if (version == 0) {
            return null;
        }
        VaultRecords records = new VaultRecords();
        records.setVersion(version);
        records.setNextDepositId(nextDepositId);
        records.setGlobalMultiplierBps(globalMultiplierBps);
        records.setPaused(paused);
        records.setRewardPool(new RewardPool(rewardPool));
        records.getPlans().addAll(plans.values());
        records.getPlanMultipliers().putAll(planMultipliers);
        deposits.values().forEach(deposit -> records.getDeposits().add(new Deposit(deposit)));
        positions.values().forEach(position -> records.getPositions().add(new YieldPosition(position)));
        users.values().forEach(user -> records.getUsers().add(new UserAggregate(user)));
        records.getEvents().addAll(events.values());
        return records;
    }

    @Override
    public synchronized long commit(long expectedVersion, VaultRecords changes) throws StoreException {
        if (expectedVersion != version) {
            throw new StoreException(StoreException.Reason.CONFLICT,
                    "Expected version " + expectedVersion + " but store is at " + version);
        }
        nextDepositId = changes.getNextDepositId();
        globalMultiplierBps = changes.getGlobalMultiplierBps();
        paused = changes.isPaused();
        rewardPool = new RewardPool(changes.getRewardPool());
        changes.getPlans().forEach(plan -> plans.put(plan.getPlanId(), plan));
        planMultipliers.putAll(changes.getPlanMultipliers());
        changes.getDeposits().forEach(deposit -> deposits.put(deposit.getId(), new Deposit(deposit)));
        changes.getPositions().forEach(position -> positions.put(position.getId(), new YieldPosition(position)));
        changes.getUsers().forEach(user -> users.put(user.getUser(), new UserAggregate(user)));
        changes.getEvents().forEach(event -> events.put(event.getSequence(), event));
        return ++version;
    }
}
