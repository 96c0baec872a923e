package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * One entry of the vault's append-only audit trail.
 */
public final class VaultEvent {

    public enum Type {
        DEPOSIT_CREATED,
        DEPOSIT_WITHDRAWN,
        EMERGENCY_WITHDRAWN,
        BONUS_CLAMPED,
        MILESTONE_REACHED,
        PLAN_UPDATED,
        PLAN_MULTIPLIER_UPDATED,
        GLOBAL_MULTIPLIER_UPDATED,
        REWARD_POOL_FUNDED,
        VAULT_PAUSED,
        VAULT_UNPAUSED
    }

    private final long sequence;
    private final Type type;
    private final long timestamp;
    private final String user;
    private final Long depositId;
    private final BigInteger amount;
    private final String detail;

    public VaultEvent(long sequence, Type type, long timestamp, String user, Long depositId,
                      BigInteger amount, String detail) {
        this.sequence = sequence;
        this.type = type;
        this.timestamp = timestamp;
        this.user = user;
        this.depositId = depositId;
        this.amount = amount;
        this.detail = detail;
    }

    public long getSequence() { return sequence; }
    public Type getType() { return type; }
    public long getTimestamp() { return timestamp; }
    public String getUser() { return user; }
    public Long getDepositId() { return depositId; }
    public BigInteger getAmount() { return amount; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return "VaultEvent{" +
                "sequence=" + sequence +
                ", type=" + type +
                ", timestamp=" + timestamp +
                ", user='" + user + '\'' +
                ", depositId=" + depositId +
                ", amount=" + amount +
                ", detail='" + detail + '\'' +
                '}';
    }
}
