package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * Admin-funded balance bonuses are drawn from. {@code distributed <= totalPool} at all times.
 */
public class RewardPool {
    private BigInteger totalPool = BigInteger.ZERO;
    private BigInteger distributed = BigInteger.ZERO;

    public RewardPool() {}

    public RewardPool(BigInteger totalPool, BigInteger distributed) {
        if (totalPool.signum() < 0 || distributed.signum() < 0 || distributed.compareTo(totalPool) > 0) {
            throw new IllegalArgumentException("Reward pool must satisfy 0 <= distributed <= totalPool");
        }
        this.totalPool = totalPool;
        this.distributed = distributed;
    }

    public RewardPool(RewardPool other) {
        this.totalPool = other.totalPool;
        this.distributed = other.distributed;
    }

    public BigInteger getTotalPool() { return totalPool; }
    public BigInteger getDistributed() { return distributed; }

    public BigInteger available() {
        return totalPool.subtract(distributed);
    }

    public boolean canCover(BigInteger amount) {
        return amount.compareTo(available()) <= 0;
    }

    public void fund(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Funding amount must be positive");
        }
        totalPool = totalPool.add(amount);
    }

    /**
     * Record a bonus payout. Callers check {@link #canCover} first within the same operation.
     */
    public void distribute(BigInteger amount) {
        if (!canCover(amount)) {
            throw new IllegalStateException("Reward pool cannot cover " + amount + ", available " + available());
        }
        distributed = distributed.add(amount);
    }

    /**
     * Undo a {@link #distribute} whose payout did not go through.
     */
    public void refund(BigInteger amount) {
        if (amount.compareTo(distributed) > 0) {
            throw new IllegalStateException("Cannot refund " + amount + ", only " + distributed + " distributed");
        }
        distributed = distributed.subtract(amount);
    }

    @Override
    public String toString() {
        return "RewardPool{totalPool=" + totalPool + ", distributed=" + distributed + '}';
    }
}
