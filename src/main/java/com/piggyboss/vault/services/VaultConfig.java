package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.RewardPool;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.VaultRecords;
import com.piggyboss.vault.services.InterestCalculator.CompoundingMode;
import com.piggyboss.vault.services.VaultException.ErrorCode;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runtime configuration handle shared by every vault operation: plan catalog, reward pool,
 * multipliers, penalty tiers and the admin set.
 *
 * <p>Mutators are package-private; administrative changes go through
 * {@link VaultStateMachine}, which validates the caller and holds the write lock.</p>
 */
public class VaultConfig {

    private final PlanCatalog plans = new PlanCatalog();
    private RewardPool rewardPool = new RewardPool();
    // max plan days -> penalty rate bps
    private final TreeMap<Integer, Integer> penaltyTiers = new TreeMap<>();
    private final Set<String> admins = new LinkedHashSet<>();
    private final MilestoneResolver milestones;
    private final CompoundingMode compoundingMode;
    private volatile int globalMultiplierBps = InterestCalculator.BASIS_POINTS;
    private final int maturityBonusBps;
    private volatile boolean paused;

    public VaultConfig(CompoundingMode compoundingMode, int maturityBonusBps,
                       Map<Integer, Integer> penaltyTiers, Set<String> admins, MilestoneResolver milestones) {
        this.compoundingMode = compoundingMode != null ? compoundingMode : CompoundingMode.BOUNDED_ITERATIVE;
        this.maturityBonusBps = Math.max(0, maturityBonusBps);
        this.penaltyTiers.putAll(penaltyTiers);
        this.admins.addAll(admins);
        this.milestones = milestones;
    }

    /**
     * Build the configuration described by {@code vault-settings.json}.
     */
    public static VaultConfig fromSettings(VaultSettings settings) throws VaultException {
        Map<Integer, Integer> tiers = new TreeMap<>();
        for (VaultSettings.PenaltyTier tier : settings.getPenaltyTiers()) {
            if (tier.getMaxDays() <= 0 || tier.getRateBps() < 0 || tier.getRateBps() > InterestCalculator.BASIS_POINTS) {
                throw new VaultException(ErrorCode.INVALID_PLAN, "Penalty tier " + tier.getMaxDays() + " days at "
                        + tier.getRateBps() + " bps: rate must be between 0 and " + InterestCalculator.BASIS_POINTS + " bps");
            }
            tiers.put(tier.getMaxDays(), tier.getRateBps());
        }
        if (tiers.isEmpty()) {
            tiers.putAll(defaultPenaltyTiers());
        }

        VaultConfig config = new VaultConfig(
                CompoundingMode.fromString(settings.getCompoundingMode()),
                settings.getMaturityBonusBps(),
                tiers,
                new LinkedHashSet<>(settings.getAdminIds()),
                MilestoneResolver.fromSettings(settings));

        for (VaultSettings.PlanSettings plan : settings.getPlans()) {
            config.plans.put(plan.getDays(),
                    plan.getDays() * InterestCalculator.SECONDS_PER_DAY,
                    plan.getApyBps(),
                    settings.toBaseUnits(plan.getMinAmount()),
                    settings.toBaseUnits(plan.getMaxAmount()),
                    plan.isActive());
        }
        config.setGlobalMultiplier(settings.getGlobalMultiplierBps());
        if (settings.getInitialRewardPool() > 0) {
            config.rewardPool.fund(settings.toBaseUnits(settings.getInitialRewardPool()));
        }
        return config;
    }

    /** 30 days 2%, 90 days 3%, 180 days 4%, anything longer 5%. */
    public static Map<Integer, Integer> defaultPenaltyTiers() {
        Map<Integer, Integer> tiers = new TreeMap<>();
        tiers.put(30, 200);
        tiers.put(90, 300);
        tiers.put(180, 400);
        tiers.put(365, 500);
        return tiers;
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    public PlanCatalog getPlans() {
        return plans;
    }

    public CompoundingMode getCompoundingMode() {
        return compoundingMode;
    }

    public int getGlobalMultiplierBps() {
        return globalMultiplierBps;
    }

    public int getMaturityBonusBps() {
        return maturityBonusBps;
    }

    public boolean isPaused() {
        return paused;
    }

    public MilestoneResolver getMilestones() {
        return milestones;
    }

    public Set<String> getAdmins() {
        return Collections.unmodifiableSet(admins);
    }

    public boolean isAdmin(String caller) {
        return caller != null && admins.contains(caller);
    }

    /** Copy of the reward pool. */
    public synchronized RewardPool getRewardPool() {
        return new RewardPool(rewardPool);
    }

    /** APY a new position on {@code plan} opens with. */
    public int effectiveApyFor(SavingsPlan plan) {
        return InterestCalculator.effectiveApy(plan.getBaseApyBps(), plans.multiplierOf(plan.getPlanId()),
                globalMultiplierBps);
    }

    /** Penalty rate of the shortest tier covering the plan; plans longer than every tier use the last one. */
    public int penaltyRateFor(SavingsPlan plan) {
        if (penaltyTiers.isEmpty()) {
            return 0;
        }
        long days = plan.getDurationDays();
        Map.Entry<Integer, Integer> tier = days > Integer.MAX_VALUE ? null : penaltyTiers.ceilingEntry((int) days);
        return tier != null ? tier.getValue() : penaltyTiers.lastEntry().getValue();
    }

    /** Hold period below which the full penalty applies: the whole lock period. */
    public long minimumHoldFor(SavingsPlan plan) {
        return plan.getDurationSeconds();
    }

    // -------------------------------------------------------------------------
    // Mutations (caller holds the vault write lock)
    // -------------------------------------------------------------------------

    void requireAdmin(String caller) throws VaultException {
        if (!isAdmin(caller)) {
            throw new VaultException(ErrorCode.NOT_ADMIN);
        }
    }

    void setGlobalMultiplier(int multiplierBps) throws VaultException {
        if (!InterestCalculator.isValidMultiplier(multiplierBps)) {
            throw new VaultException(ErrorCode.MULTIPLIER_OUT_OF_RANGE);
        }
        this.globalMultiplierBps = multiplierBps;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    synchronized void fundRewardPool(BigInteger amount) {
        rewardPool.fund(amount);
    }

    /**
     * Draw {@code bonus} from the pool if it can be covered in full.
     *
     * @return true if the bonus was recorded as distributed, false if the pool is short
     */
    synchronized boolean tryDistribute(BigInteger bonus) {
        if (bonus.signum() <= 0) {
            return true;
        }
        if (!rewardPool.canCover(bonus)) {
            return false;
        }
        rewardPool.distribute(bonus);
        return true;
    }

    /**
     * Copy controls and the reward pool into {@code records}, plus plans and multipliers when asked.
     */
    synchronized void exportTo(VaultRecords records, boolean includePlans) {
        if (includePlans) {
            records.getPlans().addAll(plans.all());
            records.getPlanMultipliers().putAll(plans.multipliers());
        }
        records.setGlobalMultiplierBps(globalMultiplierBps);
        records.setPaused(paused);
        records.setRewardPool(new RewardPool(rewardPool));
    }

    /**
     * Overwrite plans, multipliers, controls and the reward pool with stored values.
     */
    synchronized void restoreFrom(VaultRecords records) throws VaultException {
        for (SavingsPlan plan : records.getPlans()) {
            plans.put(plan.getPlanId(), plan.getDurationSeconds(), plan.getBaseApyBps(),
                    plan.getMinAmount(), plan.getMaxAmount(), plan.isActive());
        }
        for (Map.Entry<Integer, Integer> multiplier : records.getPlanMultipliers().entrySet()) {
            plans.setMultiplier(multiplier.getKey(), multiplier.getValue());
        }
        setGlobalMultiplier(records.getGlobalMultiplierBps());
        paused = records.isPaused();
        rewardPool = new RewardPool(records.getRewardPool());
    }

    /** Give back a bonus recorded by {@link #tryDistribute} whose payout was rolled back. */
    synchronized void revertDistribution(BigInteger bonus) {
        if (bonus.signum() > 0) {
            rewardPool.refund(bonus);
        }
    }
}
