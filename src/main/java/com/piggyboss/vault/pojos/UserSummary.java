package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * Dashboard figures for one user.
 */
public final class UserSummary {

    /** Principal currently locked in open deposits. */
    public final BigInteger totalSaved;

    /** Number of open deposits. */
    public final int activeCount;

    /** Interest and bonuses paid out so far. */
    public final BigInteger totalEarned;

    public UserSummary(BigInteger totalSaved, int activeCount, BigInteger totalEarned) {
        this.totalSaved = totalSaved;
        this.activeCount = activeCount;
        this.totalEarned = totalEarned;
    }

    @Override
    public String toString() {
        return "UserSummary{totalSaved=" + totalSaved + ", activeCount=" + activeCount + ", totalEarned=" + totalEarned + '}';
    }
}
