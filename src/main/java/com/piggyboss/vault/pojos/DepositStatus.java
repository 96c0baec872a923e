package com.piggyboss.vault.pojos;

/**
 * Lifecycle state of a deposit. Both closed states are terminal.
 */
public enum DepositStatus {
    OPEN,
    WITHDRAWN,
    EMERGENCY_WITHDRAWN;

    public boolean isClosed() {
        return this != OPEN;
    }

    public String toString() {
        return this.name();
    }

    /**
     * Returns null if the string doesn't match any value.
     */
    public static DepositStatus fromString(String value) {
        if (value == null) return null;
        try {
            return DepositStatus.valueOf(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
