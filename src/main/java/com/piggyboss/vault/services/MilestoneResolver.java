package com.piggyboss.vault.services;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps a deposit to the reward categories it reaches. Categories depend only on the
 * deposit amount, the plan length and whether the user's first-deposit reward is still owed.
 */
public class MilestoneResolver {

    public static final String FIRST_DEPOSIT = "first_deposit";
    public static final String STARTER = "starter";
    public static final String SAVER = "saver";
    public static final String INVESTOR = "investor";
    public static final String CHAMPION = "champion";

    // amount threshold (base units) -> category, ascending
    private final TreeMap<BigInteger, String> amountTiers = new TreeMap<>();

    public MilestoneResolver(Map<BigInteger, String> amountTiers) {
        this.amountTiers.putAll(amountTiers);
    }

    /**
     * Categories reached by one deposit, in notification order: first deposit (while it has not
     * been delivered), every amount tier at or below {@code amount}, then the plan-length tier.
     */
    public List<String> resolve(BigInteger amount, long planDays, boolean firstDepositOwed) {
        List<String> categories = new ArrayList<>();
        if (firstDepositOwed) {
            categories.add(FIRST_DEPOSIT);
        }
        amountTiers.headMap(amount, true).values().forEach(categories::add);
        categories.add(planTier(planDays));
        return categories;
    }

    public static String planTier(long planDays) {
        if (planDays <= 30) return STARTER;
        if (planDays <= 90) return SAVER;
        if (planDays <= 180) return INVESTOR;
        return CHAMPION;
    }

    static MilestoneResolver fromSettings(VaultSettings settings) {
        Map<BigInteger, String> tiers = new TreeMap<>();
        for (VaultSettings.MilestoneTier tier : settings.getMilestoneTiers()) {
            tiers.put(settings.toBaseUnits(tier.getMinAmount()), tier.getCategory());
        }
        return new MilestoneResolver(tiers);
    }
}
