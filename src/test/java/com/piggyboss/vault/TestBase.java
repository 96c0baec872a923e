package com.piggyboss.vault;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.piggyboss.vault.services.InterestCalculator;
import com.piggyboss.vault.services.InterestCalculator.CompoundingMode;
import com.piggyboss.vault.services.MilestoneResolver;
import com.piggyboss.vault.services.MockTokenLedger;
import com.piggyboss.vault.services.MutableClock;
import com.piggyboss.vault.services.RecordingRewardNotifier;
import com.piggyboss.vault.services.VaultConfig;
import com.piggyboss.vault.services.VaultException;
import com.piggyboss.vault.services.VaultStateMachine;
import org.junit.jupiter.api.BeforeEach;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;

/**
 * Shared fixture for handler-level tests: an in-memory vault with one 30 day plan at 12%,
 * a funded reward pool, a mock token ledger and a clock that only moves when told to.
 */
public abstract class TestBase {

    protected static final BigInteger UNIT = BigInteger.TEN.pow(18);
    protected static final long DAY = InterestCalculator.SECONDS_PER_DAY;
    protected static final long START = 1_700_000_000L;
    protected static final String ADMIN = "vault-admin";
    protected static final String ALICE = "alice";
    protected static final String BOB = "bob";
    protected static final int PLAN_30 = 30;

    protected MockTokenLedger ledger;
    protected RecordingRewardNotifier notifier;
    protected MutableClock clock;
    protected VaultStateMachine vault;

    @BeforeEach
    public void setUpVault() throws VaultException {
        ledger = new MockTokenLedger();
        notifier = new RecordingRewardNotifier();
        clock = new MutableClock(START);
        VaultConfig config = new VaultConfig(CompoundingMode.BOUNDED_ITERATIVE, 500,
                VaultConfig.defaultPenaltyTiers(), Set.of(ADMIN),
                new MilestoneResolver(Map.of(units(100), "bronze_saver")));
        vault = new VaultStateMachine(config, ledger, notifier, clock);
        vault.setPlan(ADMIN, PLAN_30, 30 * DAY, 1200, units(10), units(100_000), true);
        vault.fundRewardPool(ADMIN, units(1_000));
    }

    protected static BigInteger units(long n) {
        return BigInteger.valueOf(n).multiply(UNIT);
    }

    protected static JsonObject json(String raw) {
        return JsonParser.parseString(raw).getAsJsonObject();
    }
}
