package com.piggyboss.vault.pojos;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Records exchanged with a vault store: either everything stored, or the records one
 * operation touched. Controls (counters, multipliers, pause flag, reward pool) are always present.
 */
public class VaultRecords {
    private long version;
    private long nextDepositId = 1;
    private int globalMultiplierBps = 10_000;
    private boolean paused;
    private RewardPool rewardPool = new RewardPool();
    private final List<SavingsPlan> plans = new ArrayList<>();
    private final Map<Integer, Integer> planMultipliers = new TreeMap<>();
    private final List<Deposit> deposits = new ArrayList<>();
    private final List<YieldPosition> positions = new ArrayList<>();
    private final List<UserAggregate> users = new ArrayList<>();
    private final List<VaultEvent> events = new ArrayList<>();

    /** Store version the records were read at; unused on commit. */
    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }
    public long getNextDepositId() { return nextDepositId; }
    public void setNextDepositId(long nextDepositId) { this.nextDepositId = nextDepositId; }
    public int getGlobalMultiplierBps() { return globalMultiplierBps; }
    public void setGlobalMultiplierBps(int globalMultiplierBps) { this.globalMultiplierBps = globalMultiplierBps; }
    public boolean isPaused() { return paused; }
    public void setPaused(boolean paused) { this.paused = paused; }
    public RewardPool getRewardPool() { return rewardPool; }
    public void setRewardPool(RewardPool rewardPool) { this.rewardPool = rewardPool; }

    public List<SavingsPlan> getPlans() { return plans; }
    public Map<Integer, Integer> getPlanMultipliers() { return planMultipliers; }
    public List<Deposit> getDeposits() { return deposits; }
    public List<YieldPosition> getPositions() { return positions; }
    public List<UserAggregate> getUsers() { return users; }
    public List<VaultEvent> getEvents() { return events; }

    @Override
    public String toString() {
        return "VaultRecords{" +
                "version=" + version +
                ", nextDepositId=" + nextDepositId +
                ", plans=" + plans.size() +
                ", deposits=" + deposits.size() +
                ", positions=" + positions.size() +
                ", users=" + users.size() +
                ", events=" + events.size() +
                '}';
    }
}
