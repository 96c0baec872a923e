package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.services.VaultException.ErrorCode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Savings plans keyed by duration in days, plus an optional APY multiplier per plan.
 * Plans are never removed, only deactivated.
 */
public class PlanCatalog {

    public static final int MAX_APY_BPS = InterestCalculator.BASIS_POINTS;

    private final Map<Integer, SavingsPlan> plans = new TreeMap<>();
    private final Map<Integer, Integer> multipliers = new TreeMap<>();

    /**
     * Insert or replace a plan after validating its terms.
     */
    public synchronized SavingsPlan put(int planId, long durationSeconds, int baseApyBps,
                                        BigInteger minAmount, BigInteger maxAmount, boolean active)
            throws VaultException {
        if (planId <= 0 || durationSeconds <= 0) {
            throw new VaultException(ErrorCode.INVALID_PLAN, "Plan id and duration must be positive");
        }
        if (baseApyBps < 0 || baseApyBps > MAX_APY_BPS) {
            throw new VaultException(ErrorCode.INVALID_PLAN, "APY must be between 0 and " + MAX_APY_BPS + " bps");
        }
        if (minAmount == null || maxAmount == null || minAmount.signum() <= 0 || minAmount.compareTo(maxAmount) > 0) {
            throw new VaultException(ErrorCode.INVALID_PLAN, "Plan limits must satisfy 0 < min <= max");
        }
        SavingsPlan plan = new SavingsPlan(planId, durationSeconds, baseApyBps, minAmount, maxAmount, active);
        plans.put(planId, plan);
        return plan;
    }

    public synchronized SavingsPlan get(int planId) {
        return plans.get(planId);
    }

    public synchronized SavingsPlan require(int planId) throws VaultException {
        SavingsPlan plan = plans.get(planId);
        if (plan == null) {
            throw new VaultException(ErrorCode.PLAN_NOT_FOUND, "Savings plan " + planId + " not found");
        }
        return plan;
    }

    /** All plans ordered by id. */
    public synchronized List<SavingsPlan> all() {
        return new ArrayList<>(plans.values());
    }

    public synchronized void setMultiplier(int planId, int multiplierBps) throws VaultException {
        require(planId);
        if (!InterestCalculator.isValidMultiplier(multiplierBps)) {
            throw new VaultException(ErrorCode.MULTIPLIER_OUT_OF_RANGE);
        }
        multipliers.put(planId, multiplierBps);
    }

    /** Multipliers that were set explicitly, keyed by plan id. */
    public synchronized Map<Integer, Integer> multipliers() {
        return new TreeMap<>(multipliers);
    }

    /** Plan multiplier in bps; 10000 (neutral) when none was set. */
    public synchronized int multiplierOf(int planId) {
        return multipliers.getOrDefault(planId, InterestCalculator.BASIS_POINTS);
    }
}
