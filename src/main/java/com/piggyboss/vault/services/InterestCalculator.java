package com.piggyboss.vault.services;

import java.math.BigInteger;

/**
 * Stateless fixed-point math for savings positions.
 *
 * <h2>Conventions</h2>
 * <ul>
 *   <li>Amounts are unsigned integers in the asset's base units. Zero or negative inputs are treated as zero.</li>
 *   <li>Rates are basis points: {@code 10000 = 100%}.</li>
 *   <li>Every ratio multiplies before it divides. Compounding factors carry 18 decimals ({@link #WAD}).</li>
 * </ul>
 *
 * <h2>Core formulas</h2>
 * <pre>
 *   simple    = principal × apy × elapsed / (10000 × 365 days)
 *   dailyRate = apy / 365
 *   compound  = principal × (1 + dailyRate)^days − principal
 *   penalty   = principal × rate / 10000                    (elapsed &lt; minimumHold)
 *   bonus     = (principal + interest) × bonusRate / 10000
 * </pre>
 *
 * <p>All methods are static and total: no division by zero, no negative results.</p>
 */
public final class InterestCalculator {

    public static final int BASIS_POINTS = 10_000;
    public static final int MIN_MULTIPLIER_BPS = 5_000;
    public static final int MAX_MULTIPLIER_BPS = 20_000;
    public static final long SECONDS_PER_DAY = 86_400L;
    public static final long DAYS_PER_YEAR = 365L;
    public static final long SECONDS_PER_YEAR = SECONDS_PER_DAY * DAYS_PER_YEAR;

    /** Upper bound on daily compounding iterations in {@link CompoundingMode#BOUNDED_ITERATIVE}. */
    public static final int MAX_COMPOUNDING_DAYS = 365;

    public static final BigInteger WAD = BigInteger.TEN.pow(18);

    private static final BigInteger BPS = BigInteger.valueOf(BASIS_POINTS);
    private static final BigInteger YEAR = BigInteger.valueOf(SECONDS_PER_YEAR);

    /**
     * How whole days are compounded once a position has been open for at least a day.
     */
    public enum CompoundingMode {
        /** Multiply by {@code (1 + dailyRate)} once per day, at most {@value #MAX_COMPOUNDING_DAYS} times. */
        BOUNDED_ITERATIVE,
        /** Exact {@code (1 + dailyRate)^days} by exponentiation by squaring, no day bound. */
        CLOSED_FORM;

        public static CompoundingMode fromString(String value) {
            if (value == null) return BOUNDED_ITERATIVE;
            try {
                return CompoundingMode.valueOf(value.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return BOUNDED_ITERATIVE;
            }
        }
    }

    private InterestCalculator() {}

    // -------------------------------------------------------------------------
    // Interest
    // -------------------------------------------------------------------------

    /**
     * Compound interest with the default {@link CompoundingMode#BOUNDED_ITERATIVE} mode.
     */
    public static BigInteger compoundInterest(BigInteger principal, int apyBasisPoints,
                                              long elapsedSeconds, long totalDurationSeconds) {
        return compoundInterest(principal, apyBasisPoints, elapsedSeconds, totalDurationSeconds,
                CompoundingMode.BOUNDED_ITERATIVE);
    }

    /**
     * Interest earned by {@code principal} over {@code elapsedSeconds}.
     *
     * <p>Under one day the result is simple pro-rata interest. From one day on, whole days are
     * compounded at {@code apy / 365}; time the compounding does not cover (days past the
     * iteration bound, plus the sub-day remainder) earns simple interest on the compounded
     * balance.</p>
     *
     * @param principal            Amount the interest is computed on.
     * @param apyBasisPoints       Annual rate in basis points.
     * @param elapsedSeconds       Length of the accrual interval.
     * @param totalDurationSeconds Full lock period of the position. Must be positive.
     * @param mode                 Compounding behaviour for whole days.
     * @return interest, never negative; 0 if any input is zero.
     */
    public static BigInteger compoundInterest(BigInteger principal, int apyBasisPoints,
                                              long elapsedSeconds, long totalDurationSeconds,
                                              CompoundingMode mode) {
        if (isZero(principal) || apyBasisPoints <= 0 || elapsedSeconds <= 0 || totalDurationSeconds <= 0) {
            return BigInteger.ZERO;
        }
        if (elapsedSeconds < SECONDS_PER_DAY) {
            return simpleInterest(principal, apyBasisPoints, elapsedSeconds);
        }

        long days = elapsedSeconds / SECONDS_PER_DAY;
        long remainderSeconds = elapsedSeconds % SECONDS_PER_DAY;
        BigInteger dailyRate = dailyRateWad(apyBasisPoints);

        long compoundedDays;
        BigInteger factor;
        if (mode == CompoundingMode.CLOSED_FORM) {
            compoundedDays = days;
            factor = wadPow(WAD.add(dailyRate), days);
        } else {
            compoundedDays = Math.min(days, MAX_COMPOUNDING_DAYS);
            factor = WAD;
            BigInteger step = WAD.add(dailyRate);
            for (long i = 0; i < compoundedDays; i++) {
                factor = factor.multiply(step).divide(WAD);
            }
        }

        BigInteger balance = principal.multiply(factor).divide(WAD);
        long uncompoundedSeconds = (days - compoundedDays) * SECONDS_PER_DAY + remainderSeconds;
        balance = balance.add(simpleInterest(balance, apyBasisPoints, uncompoundedSeconds));
        return saturatingSub(balance, principal);
    }

    /**
     * Simple pro-rata interest: {@code principal × apy × elapsed / (10000 × 365 days)}.
     */
    public static BigInteger simpleInterest(BigInteger principal, int apyBasisPoints, long elapsedSeconds) {
        if (isZero(principal) || apyBasisPoints <= 0 || elapsedSeconds <= 0) {
            return BigInteger.ZERO;
        }
        return principal
                .multiply(BigInteger.valueOf(apyBasisPoints))
                .multiply(BigInteger.valueOf(elapsedSeconds))
                .divide(BPS.multiply(YEAR));
    }

    // -------------------------------------------------------------------------
    // Penalty, APY, bonus
    // -------------------------------------------------------------------------

    /**
     * Penalty for leaving a position early.
     *
     * <ul>
     *   <li>{@code elapsed < minimumHold}: the full rate applies.</li>
     *   <li>Otherwise the full penalty shrinks linearly over the window {@code 2 × minimumHold},
     *       reaching 0 at {@code elapsed ≥ 2 × minimumHold}.</li>
     * </ul>
     *
     * @return penalty in base units, never more than {@code principal × rate / 10000}.
     */
    public static BigInteger earlyWithdrawalPenalty(BigInteger principal, int penaltyRateBasisPoints,
                                                    long elapsedSeconds, long minimumHoldSeconds) {
        if (isZero(principal) || penaltyRateBasisPoints <= 0 || minimumHoldSeconds <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger fullPenalty = principal.multiply(BigInteger.valueOf(penaltyRateBasisPoints)).divide(BPS);
        long elapsed = Math.max(0L, elapsedSeconds);
        if (elapsed < minimumHoldSeconds) {
            return fullPenalty;
        }
        long window = minimumHoldSeconds * 2;
        if (elapsed >= window) {
            return BigInteger.ZERO;
        }
        return fullPenalty.multiply(BigInteger.valueOf(window - elapsed)).divide(BigInteger.valueOf(window));
    }

    /**
     * {@code baseApy × planMultiplier / 10000 × globalMultiplier / 10000}, computed as one
     * product over one divisor.
     */
    public static int effectiveApy(int baseApyBasisPoints, int planMultiplierBps, int globalMultiplierBps) {
        if (baseApyBasisPoints <= 0 || planMultiplierBps <= 0 || globalMultiplierBps <= 0) {
            return 0;
        }
        long scaled = (long) baseApyBasisPoints * planMultiplierBps * globalMultiplierBps;
        return (int) (scaled / ((long) BASIS_POINTS * BASIS_POINTS));
    }

    /**
     * Bonus paid at maturity: {@code (principal + interestEarned) × bonusRate / 10000}.
     */
    public static BigInteger maturityBonus(BigInteger principal, BigInteger interestEarned, int bonusRateBasisPoints) {
        if (bonusRateBasisPoints <= 0) {
            return BigInteger.ZERO;
        }
        BigInteger base = nonNegative(principal).add(nonNegative(interestEarned));
        return base.multiply(BigInteger.valueOf(bonusRateBasisPoints)).divide(BPS);
    }

    /** Multipliers are accepted in [5000, 20000]. */
    public static boolean isValidMultiplier(int multiplierBps) {
        return multiplierBps >= MIN_MULTIPLIER_BPS && multiplierBps <= MAX_MULTIPLIER_BPS;
    }

    // -------------------------------------------------------------------------
    // Utility
    // -------------------------------------------------------------------------

    /** {@code a > b ? a - b : 0}. */
    public static BigInteger saturatingSub(BigInteger a, BigInteger b) {
        return a.compareTo(b) > 0 ? a.subtract(b) : BigInteger.ZERO;
    }

    static BigInteger dailyRateWad(int apyBasisPoints) {
        return WAD.multiply(BigInteger.valueOf(apyBasisPoints)).divide(BPS.multiply(BigInteger.valueOf(DAYS_PER_YEAR)));
    }

    static BigInteger wadPow(BigInteger base, long exponent) {
        BigInteger result = WAD;
        BigInteger square = base;
        long remaining = exponent;
        while (remaining > 0) {
            if ((remaining & 1L) == 1L) {
                result = result.multiply(square).divide(WAD);
            }
            square = square.multiply(square).divide(WAD);
            remaining >>= 1;
        }
        return result;
    }

    private static boolean isZero(BigInteger amount) {
        return amount == null || amount.signum() <= 0;
    }

    private static BigInteger nonNegative(BigInteger amount) {
        return isZero(amount) ? BigInteger.ZERO : amount;
    }
}
