package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * JSON body shared by every vault function. Amounts are base units (18 decimals) and may be
 * sent as JSON strings to keep full precision.
 */
public class RequestBody {
    private String function;

    // Deposits
    private Integer planId;
    private BigInteger amount;
    private Long depositId;
    private String status; // list_deposits filter

    // Admin: plans
    private Long durationSeconds;
    private Integer baseApyBps;
    private BigInteger minAmount;
    private BigInteger maxAmount;
    private Boolean active;

    // Admin: multipliers, pause
    private Integer multiplierBps;
    private Boolean paused;

    public RequestBody() {
    }

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public Integer getPlanId() {
        return planId;
    }

    public void setPlanId(Integer planId) {
        this.planId = planId;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public void setAmount(BigInteger amount) {
        this.amount = amount;
    }

    public Long getDepositId() {
        return depositId;
    }

    public void setDepositId(Long depositId) {
        this.depositId = depositId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Long getDurationSeconds() {
        return durationSeconds;
    }

    public void setDurationSeconds(Long durationSeconds) {
        this.durationSeconds = durationSeconds;
    }

    public Integer getBaseApyBps() {
        return baseApyBps;
    }

    public void setBaseApyBps(Integer baseApyBps) {
        this.baseApyBps = baseApyBps;
    }

    public BigInteger getMinAmount() {
        return minAmount;
    }

    public void setMinAmount(BigInteger minAmount) {
        this.minAmount = minAmount;
    }

    public BigInteger getMaxAmount() {
        return maxAmount;
    }

    public void setMaxAmount(BigInteger maxAmount) {
        this.maxAmount = maxAmount;
    }

    public Boolean getActive() {
        return active;
    }

    public void setActive(Boolean active) {
        this.active = active;
    }

    public Integer getMultiplierBps() {
        return multiplierBps;
    }

    public void setMultiplierBps(Integer multiplierBps) {
        this.multiplierBps = multiplierBps;
    }

    public Boolean getPaused() {
        return paused;
    }

    public void setPaused(Boolean paused) {
        this.paused = paused;
    }
}
