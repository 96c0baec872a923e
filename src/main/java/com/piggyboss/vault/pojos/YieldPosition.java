package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * Accrual bookkeeping paired 1:1 with a deposit.
 *
 * <p>{@code accruedInterest} only grows while the position is active and is frozen, not reset,
 * at finalization. {@code bonusAwarded} is kept apart from interest because it is drawn from the
 * reward pool rather than produced by accrual.</p>
 */
public class YieldPosition {
    private long id;
    private BigInteger principal;
    private BigInteger accruedInterest = BigInteger.ZERO;
    private BigInteger bonusAwarded = BigInteger.ZERO;
    private long startTime;
    private long endTime;
    private int effectiveApyBps;
    private long lastUpdateTime;
    private boolean active;

    public YieldPosition() {}

    public YieldPosition(YieldPosition other) {
        this.id = other.id;
        this.principal = other.principal;
        this.accruedInterest = other.accruedInterest;
        this.bonusAwarded = other.bonusAwarded;
        this.startTime = other.startTime;
        this.endTime = other.endTime;
        this.effectiveApyBps = other.effectiveApyBps;
        this.lastUpdateTime = other.lastUpdateTime;
        this.active = other.active;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public BigInteger getPrincipal() { return principal; }
    public void setPrincipal(BigInteger principal) { this.principal = principal; }
    public BigInteger getAccruedInterest() { return accruedInterest; }
    public void setAccruedInterest(BigInteger accruedInterest) { this.accruedInterest = accruedInterest; }
    public BigInteger getBonusAwarded() { return bonusAwarded; }
    public void setBonusAwarded(BigInteger bonusAwarded) { this.bonusAwarded = bonusAwarded; }
    public long getStartTime() { return startTime; }
    public void setStartTime(long startTime) { this.startTime = startTime; }
    public long getEndTime() { return endTime; }
    public void setEndTime(long endTime) { this.endTime = endTime; }
    public int getEffectiveApyBps() { return effectiveApyBps; }
    public void setEffectiveApyBps(int effectiveApyBps) { this.effectiveApyBps = effectiveApyBps; }
    public long getLastUpdateTime() { return lastUpdateTime; }
    public void setLastUpdateTime(long lastUpdateTime) { this.lastUpdateTime = lastUpdateTime; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public long getDurationSeconds() {
        return endTime - startTime;
    }

    @Override
    public String toString() {
        return "YieldPosition{" +
                "id=" + id +
                ", principal=" + principal +
                ", accruedInterest=" + accruedInterest +
                ", bonusAwarded=" + bonusAwarded +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                ", effectiveApyBps=" + effectiveApyBps +
                ", lastUpdateTime=" + lastUpdateTime +
                ", active=" + active +
                '}';
    }
}
