package com.piggyboss.vault.services;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Mock TokenLedger for testing. Records every completed transfer and can be switched to fail.
 *
 * Usage in tests:
 *   MockTokenLedger ledger = new MockTokenLedger();
 *   ledger.failTransfersOut(TransferException.Reason.LEDGER_UNAVAILABLE);
 *   ledger.onTransferOut(() -> vault.withdraw(...));   // re-entrant call from the ledger
 */
public class MockTokenLedger implements TokenLedger {

    @FunctionalInterface
    public interface TransferHook {
        void run() throws Exception;
    }

    public static final class Transfer {
        public final String account;
        public final BigInteger amount;

        Transfer(String account, BigInteger amount) {
            this.account = account;
            this.amount = amount;
        }
    }

    private final List<Transfer> transfersIn = new ArrayList<>();
    private final List<Transfer> transfersOut = new ArrayList<>();
    private TransferException.Reason failIn;
    private TransferException.Reason failOut;
    private TransferHook onTransferOut;

    public void failTransfersIn(TransferException.Reason reason) {
        this.failIn = reason;
    }

    public void failTransfersOut(TransferException.Reason reason) {
        this.failOut = reason;
    }

    public void succeed() {
        this.failIn = null;
        this.failOut = null;
    }

    /** Run {@code hook} inside the next transferOut, before it completes. */
    public void onTransferOut(TransferHook hook) {
        this.onTransferOut = hook;
    }

    @Override
    public void transferIn(String from, BigInteger amount) throws TransferException {
        if (failIn != null) {
            throw new TransferException(failIn, "Mock transferIn failure");
        }
        transfersIn.add(new Transfer(from, amount));
    }

    @Override
    public void transferOut(String to, BigInteger amount) throws TransferException {
        if (onTransferOut != null) {
            TransferHook hook = onTransferOut;
            onTransferOut = null;
            try {
                hook.run();
            } catch (Exception e) {
                throw new IllegalStateException("Transfer hook failed", e);
            }
        }
        if (failOut != null) {
            throw new TransferException(failOut, "Mock transferOut failure");
        }
        transfersOut.add(new Transfer(to, amount));
    }

    public List<Transfer> getTransfersIn() {
        return transfersIn;
    }

    public List<Transfer> getTransfersOut() {
        return transfersOut;
    }

    public BigInteger totalInFrom(String account) {
        return sum(transfersIn, account);
    }

    public BigInteger totalOutTo(String account) {
        return sum(transfersOut, account);
    }

    private static BigInteger sum(List<Transfer> transfers, String account) {
        BigInteger total = BigInteger.ZERO;
        for (Transfer transfer : transfers) {
            if (transfer.account.equals(account)) {
                total = total.add(transfer.amount);
            }
        }
        return total;
    }
}
