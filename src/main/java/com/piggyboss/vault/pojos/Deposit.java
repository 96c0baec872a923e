package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * A time-locked deposit. Append-only: deposits are never deleted, and the status
 * moves from {@link DepositStatus#OPEN} to a closed state exactly once.
 */
public class Deposit {
    private long id;
    private String owner;
    private BigInteger amount;
    private int planId;
    private SavingsPlan plan;
    private long positionId;
    private long createdAt;
    private long maturityAt;
    private DepositStatus status = DepositStatus.OPEN;

    // Closing values, frozen when the deposit leaves OPEN
    private BigInteger accruedInterestAtWithdrawal = BigInteger.ZERO;
    private BigInteger bonusAtWithdrawal = BigInteger.ZERO;
    private BigInteger penaltyAtWithdrawal = BigInteger.ZERO;
    private BigInteger payoutAmount = BigInteger.ZERO;
    private long closedAt;

    public Deposit() {}

    public Deposit(Deposit other) {
        this.id = other.id;
        this.owner = other.owner;
        this.amount = other.amount;
        this.planId = other.planId;
        this.plan = other.plan;
        this.positionId = other.positionId;
        this.createdAt = other.createdAt;
        this.maturityAt = other.maturityAt;
        this.status = other.status;
        this.accruedInterestAtWithdrawal = other.accruedInterestAtWithdrawal;
        this.bonusAtWithdrawal = other.bonusAtWithdrawal;
        this.penaltyAtWithdrawal = other.penaltyAtWithdrawal;
        this.payoutAmount = other.payoutAmount;
        this.closedAt = other.closedAt;
    }

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }
    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }
    public BigInteger getAmount() { return amount; }
    public void setAmount(BigInteger amount) { this.amount = amount; }
    public int getPlanId() { return planId; }
    public void setPlanId(int planId) { this.planId = planId; }
    public SavingsPlan getPlan() { return plan; }
    public void setPlan(SavingsPlan plan) { this.plan = plan; }
    public long getPositionId() { return positionId; }
    public void setPositionId(long positionId) { this.positionId = positionId; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public long getMaturityAt() { return maturityAt; }
    public void setMaturityAt(long maturityAt) { this.maturityAt = maturityAt; }
    public DepositStatus getStatus() { return status; }
    public void setStatus(DepositStatus status) { this.status = status; }
    public BigInteger getAccruedInterestAtWithdrawal() { return accruedInterestAtWithdrawal; }
    public void setAccruedInterestAtWithdrawal(BigInteger accruedInterestAtWithdrawal) { this.accruedInterestAtWithdrawal = accruedInterestAtWithdrawal; }
    public BigInteger getBonusAtWithdrawal() { return bonusAtWithdrawal; }
    public void setBonusAtWithdrawal(BigInteger bonusAtWithdrawal) { this.bonusAtWithdrawal = bonusAtWithdrawal; }
    public BigInteger getPenaltyAtWithdrawal() { return penaltyAtWithdrawal; }
    public void setPenaltyAtWithdrawal(BigInteger penaltyAtWithdrawal) { this.penaltyAtWithdrawal = penaltyAtWithdrawal; }
    public BigInteger getPayoutAmount() { return payoutAmount; }
    public void setPayoutAmount(BigInteger payoutAmount) { this.payoutAmount = payoutAmount; }
    public long getClosedAt() { return closedAt; }
    public void setClosedAt(long closedAt) { this.closedAt = closedAt; }

    public boolean isWithdrawn() {
        return status.isClosed();
    }

    public boolean isMatured(long now) {
        return now >= maturityAt;
    }

    @Override
    public String toString() {
        return "Deposit{" +
                "id=" + id +
                ", owner='" + owner + '\'' +
                ", amount=" + amount +
                ", planId=" + planId +
                ", positionId=" + positionId +
                ", createdAt=" + createdAt +
                ", maturityAt=" + maturityAt +
                ", status=" + status +
                ", accruedInterestAtWithdrawal=" + accruedInterestAtWithdrawal +
                ", bonusAtWithdrawal=" + bonusAtWithdrawal +
                ", penaltyAtWithdrawal=" + penaltyAtWithdrawal +
                ", payoutAmount=" + payoutAmount +
                '}';
    }
}
