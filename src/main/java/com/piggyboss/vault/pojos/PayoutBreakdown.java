package com.piggyboss.vault.pojos;

import java.math.BigInteger;

/**
 * Immutable components of a closing payout.
 *
 * <p>Use {@link #maturity} or {@link #emergency} to construct; both keep
 * {@code payout} consistent with its components.</p>
 */
public final class PayoutBreakdown {

    public enum Kind {
        MATURITY,
        EMERGENCY
    }

    public final Kind kind;

    public final long depositId;

    /** Principal returned (before any penalty). */
    public final BigInteger principal;

    /**
     * Interest accrued by the position. Paid for {@link Kind#MATURITY}; forfeited
     * (reported, not paid) for {@link Kind#EMERGENCY}.
     */
    public final BigInteger interest;

    /** Maturity bonus drawn from the reward pool; 0 when clamped or for emergency exits. */
    public final BigInteger bonus;

    /** Early-withdrawal penalty; 0 for maturity withdrawals. */
    public final BigInteger penalty;

    /** Amount transferred to the owner. */
    public final BigInteger payout;

    /** True when a non-zero bonus was dropped because the reward pool could not cover it. */
    public final boolean bonusClamped;

    private PayoutBreakdown(Kind kind, long depositId, BigInteger principal, BigInteger interest,
                            BigInteger bonus, BigInteger penalty, BigInteger payout, boolean bonusClamped) {
        this.kind = kind;
        this.depositId = depositId;
        this.principal = principal;
        this.interest = interest;
        this.bonus = bonus;
        this.penalty = penalty;
        this.payout = payout;
        this.bonusClamped = bonusClamped;
    }

    /** {@code payout = principal + interest + bonus}. */
    public static PayoutBreakdown maturity(long depositId, BigInteger principal, BigInteger interest,
                                           BigInteger bonus, boolean bonusClamped) {
        return new PayoutBreakdown(Kind.MATURITY, depositId, principal, interest, bonus, BigInteger.ZERO,
                principal.add(interest).add(bonus), bonusClamped);
    }

    /** {@code payout = principal - penalty}, with the penalty capped at the principal; the interest is forfeited. */
    public static PayoutBreakdown emergency(long depositId, BigInteger principal, BigInteger forfeitedInterest,
                                            BigInteger penalty) {
        BigInteger charged = penalty.min(principal);
        return new PayoutBreakdown(Kind.EMERGENCY, depositId, principal, forfeitedInterest, BigInteger.ZERO,
                charged, principal.subtract(charged), false);
    }

    @Override
    public String toString() {
        return "PayoutBreakdown{" +
                "kind=" + kind +
                ", depositId=" + depositId +
                ", principal=" + principal +
                ", interest=" + interest +
                ", bonus=" + bonus +
                ", penalty=" + penalty +
                ", payout=" + payout +
                ", bonusClamped=" + bonusClamped +
                '}';
    }
}
