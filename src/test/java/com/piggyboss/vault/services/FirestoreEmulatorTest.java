package com.piggyboss.vault.services;

import com.google.cloud.NoCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.DepositStatus;
import com.piggyboss.vault.pojos.PayoutBreakdown;
import com.piggyboss.vault.services.InterestCalculator.CompoundingMode;
import com.piggyboss.vault.services.VaultException.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link FirestoreVaultStore} and {@link FirestoreTokenLedger} against the Firestore emulator.
 * Run with {@code FIRESTORE_EMULATOR_HOST=localhost:8080}; every test gets its own project id.
 */
@EnabledIfEnvironmentVariable(named = "FIRESTORE_EMULATOR_HOST", matches = ".+")
public class FirestoreEmulatorTest {

    private static final BigInteger UNIT = BigInteger.TEN.pow(18);
    private static final long DAY = InterestCalculator.SECONDS_PER_DAY;
    private static final long START = 1_700_000_000L;
    private static final String ADMIN = "admin";

    private Firestore db;

    @BeforeEach
    public void setUp() {
        db = FirestoreOptions.newBuilder()
                .setProjectId("piggy-vault-" + UUID.randomUUID().toString().substring(0, 8))
                .setEmulatorHost(System.getenv("FIRESTORE_EMULATOR_HOST"))
                .setCredentials(NoCredentials.getInstance())
                .build()
                .getService();
    }

    @AfterEach
    public void tearDown() throws Exception {
        db.close();
    }

    private static BigInteger units(long n) {
        return BigInteger.valueOf(n).multiply(UNIT);
    }

    private void fundWallet(String account, BigInteger balance) throws Exception {
        db.collection(FirestoreTokenLedger.WALLETS).document(account)
                .set(Map.of("balance", balance.toString())).get();
    }

    private VaultStateMachine newInstance(TokenLedger ledger) {
        VaultConfig config = new VaultConfig(CompoundingMode.BOUNDED_ITERATIVE, 500,
                VaultConfig.defaultPenaltyTiers(), Set.of(ADMIN), new MilestoneResolver(Map.of()));
        return new VaultStateMachine(config, new FirestoreVaultStore(db), ledger,
                new RecordingRewardNotifier(), new MutableClock(START));
    }

    @Test
    public void testLedger_movesBalancesAndRejectsOverdraft() throws Exception {
        FirestoreTokenLedger ledger = new FirestoreTokenLedger(db);
        fundWallet("alice", BigInteger.valueOf(100));

        ledger.transferIn("alice", BigInteger.valueOf(60));
        assertEquals(BigInteger.valueOf(40), ledger.balanceOf("alice"));
        assertEquals(BigInteger.valueOf(60), ledger.balanceOf(FirestoreTokenLedger.VAULT_ACCOUNT));

        TransferException e = assertThrows(TransferException.class,
                () -> ledger.transferIn("alice", BigInteger.valueOf(41)));
        assertEquals(TransferException.Reason.INSUFFICIENT_FUNDS, e.getReason());
        assertEquals(BigInteger.valueOf(40), ledger.balanceOf("alice"));
    }

    @Test
    public void testDepositWithoutFunds_rejectedAndNothingStored() throws Exception {
        VaultStateMachine vault = newInstance(new FirestoreTokenLedger(db));
        vault.setPlan(ADMIN, 30, 30 * DAY, 1200, units(10), units(100_000), true);
        long version = new FirestoreVaultStore(db).currentVersion();

        VaultException e = assertThrows(VaultException.class,
                () -> vault.createDeposit("bob", units(100), 30, START));

        assertEquals(ErrorCode.TRANSFER_FAILED, e.getErrorCode());
        assertEquals(version, new FirestoreVaultStore(db).currentVersion());
        assertTrue(vault.listDepositIds("bob").isEmpty());
    }

    @Test
    public void testStateSurvivesNewInstance() throws Exception {
        FirestoreTokenLedger ledger = new FirestoreTokenLedger(db);
        fundWallet("alice", units(1_000));
        fundWallet(ADMIN, units(50));

        VaultStateMachine first = newInstance(ledger);
        first.setPlan(ADMIN, 30, 30 * DAY, 1200, units(10), units(100_000), true);
        first.fundRewardPool(ADMIN, units(50));
        Deposit deposit = first.createDeposit("alice", units(1_000), 30, START);
        // Cover interest and bonus on top of the principal held
        fundWallet(FirestoreTokenLedger.VAULT_ACCOUNT, units(1_200));

        VaultStateMachine second = newInstance(ledger);
        second.refresh();
        assertEquals(DepositStatus.OPEN, second.getDeposit(deposit.getId()).getStatus());
        assertEquals(units(50), second.getRewardPool().getTotalPool());
        assertEquals(first.getEvents().size(), second.getEvents().size());

        PayoutBreakdown payout = second.withdraw("alice", deposit.getId(), START + 30 * DAY);
        assertEquals(payout.payout, ledger.balanceOf("alice"));

        first.refresh();
        assertEquals(DepositStatus.WITHDRAWN, first.getDeposit(deposit.getId()).getStatus());
        assertEquals(payout.bonus, first.getRewardPool().getDistributed());
    }
}
