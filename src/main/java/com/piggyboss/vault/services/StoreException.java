package com.piggyboss.vault.services;

/**
 * Raised by a {@link VaultStore} when records cannot be read or committed.
 */
public class StoreException extends Exception {

    public enum Reason {
        /** Another writer committed since the caller last synced. */
        CONFLICT,
        UNAVAILABLE
    }

    private final Reason reason;

    public StoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
