package com.piggyboss.vault.services;

import java.math.BigInteger;

/**
 * Fungible balance ledger the vault moves funds through.
 * The vault never touches balances directly; every movement is a request to this ledger.
 *
 * <p>Both calls are all-or-nothing: on failure no funds have moved and the vault
 * rolls back its own state.</p>
 */
public interface TokenLedger {

    /**
     * Pull {@code amount} from {@code from} into the vault.
     *
     * @throws TransferException if the balance or allowance of {@code from} is insufficient
     */
    void transferIn(String from, BigInteger amount) throws TransferException;

    /**
     * Pay {@code amount} from the vault to {@code to}.
     *
     * @throws TransferException if the vault cannot cover the payout
     */
    void transferOut(String to, BigInteger amount) throws TransferException;
}
