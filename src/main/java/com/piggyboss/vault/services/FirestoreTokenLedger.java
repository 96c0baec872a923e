package com.piggyboss.vault.services;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * {@link TokenLedger} over wallet documents in Firestore. Every account, the vault's own reserve
 * included, keeps a base-unit balance in {@code vault_wallets/{account}}; wallets are topped up
 * outside the vault. Each transfer debits and credits in one transaction and fails when the
 * paying wallet is short.
 */
public class FirestoreTokenLedger implements TokenLedger {

    public static final String WALLETS = "vault_wallets";
    public static final String VAULT_ACCOUNT = "vault_reserve";

    private final Firestore db;

    public FirestoreTokenLedger(Firestore db) {
        this.db = db;
    }

    @Override
    public void transferIn(String from, BigInteger amount) throws TransferException {
        move(from, VAULT_ACCOUNT, amount);
    }

    @Override
    public void transferOut(String to, BigInteger amount) throws TransferException {
        move(VAULT_ACCOUNT, to, amount);
    }

    /**
     * Current balance of {@code account}; zero for an account that was never funded.
     */
    public BigInteger balanceOf(String account) throws TransferException {
        try {
            return balanceOf(wallet(account).get().get());
        } catch (ExecutionException e) {
            throw unavailable("read wallet " + account, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("read wallet " + account, e);
        }
    }

    private void move(String from, String to, BigInteger amount) throws TransferException {
        if (from == null || to == null || amount == null || amount.signum() <= 0) {
            throw new TransferException(TransferException.Reason.LEDGER_UNAVAILABLE, "Invalid transfer");
        }
        try {
            db.runTransaction(transaction -> {
                DocumentReference fromRef = wallet(from);
                DocumentReference toRef = wallet(to);
                BigInteger fromBalance = balanceOf(transaction.get(fromRef).get());
                BigInteger toBalance = balanceOf(transaction.get(toRef).get());
                if (fromBalance.compareTo(amount) < 0) {
                    throw new TransferException(TransferException.Reason.INSUFFICIENT_FUNDS,
                            "Wallet " + from + " has " + fromBalance + ", needs " + amount);
                }
                transaction.set(fromRef, balanceUpdate(fromBalance.subtract(amount)), SetOptions.merge());
                transaction.set(toRef, balanceUpdate(toBalance.add(amount)), SetOptions.merge());
                return null;
            }).get();
        } catch (ExecutionException e) {
            TransferException rejected = FirestoreVaultStore.findCause(e, TransferException.class);
            if (rejected != null) {
                throw rejected;
            }
            throw unavailable("move " + amount + " from " + from + " to " + to, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("move " + amount + " from " + from + " to " + to, e);
        }
    }

    private DocumentReference wallet(String account) {
        return db.collection(WALLETS).document(account);
    }

    private static BigInteger balanceOf(DocumentSnapshot wallet) {
        String balance = wallet.exists() ? wallet.getString("balance") : null;
        return balance != null ? new BigInteger(balance) : BigInteger.ZERO;
    }

    private static Map<String, Object> balanceUpdate(BigInteger balance) {
        Map<String, Object> data = new HashMap<>();
        data.put("balance", balance.toString());
        data.put("updated_at", Timestamp.now());
        return data;
    }

    private static TransferException unavailable(String action, Exception e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        LoggingService.error("firestore_ledger_failed", cause, LoggingService.data("action", action));
        return new TransferException(TransferException.Reason.LEDGER_UNAVAILABLE, "Failed to " + action, cause);
    }
}
