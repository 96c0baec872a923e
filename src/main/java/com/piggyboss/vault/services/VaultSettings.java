package com.piggyboss.vault.services;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Deployment settings read from the classpath resource {@code vault-settings.json}.
 * The file is read once on first access (double-checked locking) and cached.
 *
 * <p>Amounts in the file are whole token units; {@link #toBaseUnits} scales them by
 * {@code assetDecimals}.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VaultSettings {

    public static final String RESOURCE = "/vault-settings.json";
    public static final String BACKEND_FIRESTORE = "firestore";
    public static final String BACKEND_MEMORY = "memory";

    private static volatile VaultSettings cached;

    private int assetDecimals = 18;
    private String compoundingMode = InterestCalculator.CompoundingMode.BOUNDED_ITERATIVE.name();
    private int maturityBonusBps = 500;
    private int globalMultiplierBps = InterestCalculator.BASIS_POINTS;
    private long initialRewardPool;
    private long vaultReserve;
    private String storage = BACKEND_FIRESTORE;
    private String ledger = BACKEND_FIRESTORE;
    private List<String> adminIds = new ArrayList<>();
    private List<PlanSettings> plans = new ArrayList<>();
    private List<PenaltyTier> penaltyTiers = new ArrayList<>();
    private List<MilestoneTier> milestoneTiers = new ArrayList<>();

    /**
     * Returns the cached settings, loading them on first use.
     */
    public static VaultSettings get() {
        if (cached == null) {
            synchronized (VaultSettings.class) {
                if (cached == null) {
                    cached = load(RESOURCE);
                }
            }
        }
        return cached;
    }

    /**
     * Read a fresh, uncached copy of {@code resource}.
     */
    public static VaultSettings load(String resource) {
        try (InputStream in = VaultSettings.class.getResourceAsStream(resource)) {
            if (in == null) {
                LoggingService.warn("vault_settings_missing", LoggingService.data("resource", resource));
                return new VaultSettings();
            }
            return new ObjectMapper().readValue(in, VaultSettings.class);
        } catch (Exception e) {
            LoggingService.error("vault_settings_load_failed", e);
            throw new IllegalStateException("Unable to read " + resource, e);
        }
    }

    public BigInteger toBaseUnits(long wholeUnits) {
        return BigInteger.valueOf(wholeUnits).multiply(BigInteger.TEN.pow(assetDecimals));
    }

    public int getAssetDecimals() { return assetDecimals; }
    public void setAssetDecimals(int assetDecimals) { this.assetDecimals = assetDecimals; }
    public String getCompoundingMode() { return compoundingMode; }
    public void setCompoundingMode(String compoundingMode) { this.compoundingMode = compoundingMode; }
    public int getMaturityBonusBps() { return maturityBonusBps; }
    public void setMaturityBonusBps(int maturityBonusBps) { this.maturityBonusBps = maturityBonusBps; }
    public int getGlobalMultiplierBps() { return globalMultiplierBps; }
    public void setGlobalMultiplierBps(int globalMultiplierBps) { this.globalMultiplierBps = globalMultiplierBps; }
    public long getInitialRewardPool() { return initialRewardPool; }
    public void setInitialRewardPool(long initialRewardPool) { this.initialRewardPool = initialRewardPool; }
    public long getVaultReserve() { return vaultReserve; }
    public void setVaultReserve(long vaultReserve) { this.vaultReserve = vaultReserve; }
    /** Where vault records live: {@code firestore}, or {@code memory} for local runs. */
    public String getStorage() { return storage; }
    public void setStorage(String storage) { this.storage = storage; }
    /** Which token ledger moves funds: {@code firestore} wallets, or {@code memory} for local runs. */
    public String getLedger() { return ledger; }
    public void setLedger(String ledger) { this.ledger = ledger; }
    public List<String> getAdminIds() { return adminIds; }
    public void setAdminIds(List<String> adminIds) { this.adminIds = adminIds; }
    public List<PlanSettings> getPlans() { return plans; }
    public void setPlans(List<PlanSettings> plans) { this.plans = plans; }
    public List<PenaltyTier> getPenaltyTiers() { return penaltyTiers; }
    public void setPenaltyTiers(List<PenaltyTier> penaltyTiers) { this.penaltyTiers = penaltyTiers; }
    public List<MilestoneTier> getMilestoneTiers() { return milestoneTiers; }
    public void setMilestoneTiers(List<MilestoneTier> milestoneTiers) { this.milestoneTiers = milestoneTiers; }

    /**
     * Seed plan; amounts in whole units.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlanSettings {
        private int days;
        private int apyBps;
        private long minAmount;
        private long maxAmount;
        private boolean active = true;

        public PlanSettings() {}

        public PlanSettings(int days, int apyBps, long minAmount, long maxAmount, boolean active) {
            this.days = days;
            this.apyBps = apyBps;
            this.minAmount = minAmount;
            this.maxAmount = maxAmount;
            this.active = active;
        }

        public int getDays() { return days; }
        public void setDays(int days) { this.days = days; }
        public int getApyBps() { return apyBps; }
        public void setApyBps(int apyBps) { this.apyBps = apyBps; }
        public long getMinAmount() { return minAmount; }
        public void setMinAmount(long minAmount) { this.minAmount = minAmount; }
        public long getMaxAmount() { return maxAmount; }
        public void setMaxAmount(long maxAmount) { this.maxAmount = maxAmount; }
        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
    }

    /**
     * Early-withdrawal penalty for plans lasting at most {@code maxDays}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PenaltyTier {
        private int maxDays;
        private int rateBps;

        public PenaltyTier() {}

        public PenaltyTier(int maxDays, int rateBps) {
            this.maxDays = maxDays;
            this.rateBps = rateBps;
        }

        public int getMaxDays() { return maxDays; }
        public void setMaxDays(int maxDays) { this.maxDays = maxDays; }
        public int getRateBps() { return rateBps; }
        public void setRateBps(int rateBps) { this.rateBps = rateBps; }
    }

    /**
     * Reward category reached by a single deposit of at least {@code minAmount} whole units.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MilestoneTier {
        private long minAmount;
        private String category;

        public MilestoneTier() {}

        public MilestoneTier(long minAmount, String category) {
            this.minAmount = minAmount;
            this.category = category;
        }

        public long getMinAmount() { return minAmount; }
        public void setMinAmount(long minAmount) { this.minAmount = minAmount; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
    }
}
