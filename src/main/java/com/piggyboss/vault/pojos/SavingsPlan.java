package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * Terms of a time-locked savings plan, identified by its duration in days.
 *
 * <p>Instances are immutable. An admin update replaces the catalog entry with a new
 * instance, so deposits keep the terms they were opened with.</p>
 */
public final class SavingsPlan {

    private final int planId;
    private final long durationSeconds;
    private final int baseApyBps;
    private final BigInteger minAmount;
    private final BigInteger maxAmount;
    private final boolean active;

    public SavingsPlan(int planId, long durationSeconds, int baseApyBps,
                       BigInteger minAmount, BigInteger maxAmount, boolean active) {
        this.planId = planId;
        this.durationSeconds = durationSeconds;
        this.baseApyBps = baseApyBps;
        this.minAmount = minAmount;
        this.maxAmount = maxAmount;
        this.active = active;
    }

    public int getPlanId() { return planId; }
    public long getDurationSeconds() { return durationSeconds; }
    public int getBaseApyBps() { return baseApyBps; }
    public BigInteger getMinAmount() { return minAmount; }
    public BigInteger getMaxAmount() { return maxAmount; }
    public boolean isActive() { return active; }

    /** Plan length in whole days (the plan id by convention). */
    public long getDurationDays() {
        return durationSeconds / 86_400L;
    }

    public boolean acceptsAmount(BigInteger amount) {
        return amount != null && amount.compareTo(minAmount) >= 0 && amount.compareTo(maxAmount) <= 0;
    }

    @Override
    public String toString() {
        return "SavingsPlan{" +
                "planId=" + planId +
                ", durationSeconds=" + durationSeconds +
                ", baseApyBps=" + baseApyBps +
                ", minAmount=" + minAmount +
                ", maxAmount=" + maxAmount +
                ", active=" + active +
                '}';
    }
}
