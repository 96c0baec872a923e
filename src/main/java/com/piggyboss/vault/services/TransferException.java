package com.piggyboss.vault.services;

/**
 * Raised by a {@link TokenLedger} when a transfer cannot be completed.
 */
public class TransferException extends Exception {

    public enum Reason {
        INSUFFICIENT_FUNDS,
        LEDGER_UNAVAILABLE
    }

    private final Reason reason;

    public TransferException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TransferException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
