package com.piggyboss.vault.services;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-local {@link TokenLedger} for the Lambda wiring. Savers settle outside the ledger, so
 * pulls always succeed; the vault account holds the reserve and cannot pay out more than it has.
 * Each external account tracks its net flow with the vault (negative after a deposit).
 */
public class InMemoryTokenLedger implements TokenLedger {

    public static final String VAULT_ACCOUNT = "vault";

    private final Map<String, BigInteger> balances = new HashMap<>();

    public InMemoryTokenLedger(BigInteger vaultReserve) {
        if (vaultReserve != null && vaultReserve.signum() > 0) {
            balances.put(VAULT_ACCOUNT, vaultReserve);
        }
    }

    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized void transferIn(String from, BigInteger amount) throws TransferException {
        requireValid(from, amount);
        balances.put(from, balanceOf(from).subtract(amount));
        balances.put(VAULT_ACCOUNT, balanceOf(VAULT_ACCOUNT).add(amount));
    }

    @Override
    public synchronized void transferOut(String to, BigInteger amount) throws TransferException {
        requireValid(to, amount);
        BigInteger available = balanceOf(VAULT_ACCOUNT);
        if (available.compareTo(amount) < 0) {
            throw new TransferException(TransferException.Reason.INSUFFICIENT_FUNDS,
                    "Vault reserve too low: has " + available + ", needs " + amount);
        }
        balances.put(VAULT_ACCOUNT, available.subtract(amount));
        balances.put(to, balanceOf(to).add(amount));
    }

    private static void requireValid(String account, BigInteger amount) throws TransferException {
        if (account == null || amount == null || amount.signum() <= 0) {
            throw new TransferException(TransferException.Reason.LEDGER_UNAVAILABLE, "Invalid transfer");
        }
    }
}
