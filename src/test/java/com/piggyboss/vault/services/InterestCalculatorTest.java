package com.piggyboss.vault.services;

import com.piggyboss.vault.services.InterestCalculator.CompoundingMode;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InterestCalculator}. Pure math only.
 *
 * Naming convention: test_<scenario>_<expectedBehaviour>
 */
public class InterestCalculatorTest {

    private static final BigInteger UNIT = BigInteger.TEN.pow(18);
    private static final long DAY = InterestCalculator.SECONDS_PER_DAY;

    private static BigInteger units(long n) {
        return BigInteger.valueOf(n).multiply(UNIT);
    }

    /** n / 100 units. */
    private static BigInteger centiUnits(long n) {
        return BigInteger.valueOf(n).multiply(UNIT).divide(BigInteger.valueOf(100));
    }

    // =========================================================================
    // simpleInterest()
    // =========================================================================

    @Test
    public void test_simpleInterestFullRateOneDay_exactProRata() {
        // 365 units at 100% for one day = 1 unit
        assertEquals(units(1), InterestCalculator.simpleInterest(units(365), 10_000, DAY));
    }

    @Test
    public void test_simpleInterestZeroInputs_zero() {
        assertEquals(BigInteger.ZERO, InterestCalculator.simpleInterest(BigInteger.ZERO, 1200, DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.simpleInterest(units(1000), 0, DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.simpleInterest(units(1000), 1200, 0));
        assertEquals(BigInteger.ZERO, InterestCalculator.simpleInterest(null, 1200, DAY));
    }

    // =========================================================================
    // compoundInterest()
    // =========================================================================

    @Test
    public void test_compoundZeroInputs_zero() {
        assertEquals(BigInteger.ZERO, InterestCalculator.compoundInterest(BigInteger.ZERO, 1200, 30 * DAY, 30 * DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.compoundInterest(units(1000), 0, 30 * DAY, 30 * DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.compoundInterest(units(1000), 1200, 0, 30 * DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.compoundInterest(units(1000), 1200, -5, 30 * DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.compoundInterest(units(1000), 1200, 30 * DAY, 0));
    }

    @Test
    public void test_compoundUnderOneDay_equalsSimple() {
        long elapsed = DAY - 1;
        assertEquals(
                InterestCalculator.simpleInterest(units(1000), 1200, elapsed),
                InterestCalculator.compoundInterest(units(1000), 1200, elapsed, 30 * DAY));
    }

    @Test
    public void test_thirtyDaysAt12Percent_compoundSlightlyAboveSimple() {
        BigInteger compound = InterestCalculator.compoundInterest(units(1000), 1200, 30 * DAY, 30 * DAY);
        BigInteger simple = InterestCalculator.simpleInterest(units(1000), 1200, 30 * DAY);

        // simple = 1000 * 0.12 * 30 / 365 = 9.863
        assertTrue(simple.compareTo(centiUnits(986)) > 0 && simple.compareTo(centiUnits(987)) < 0);
        assertTrue(compound.compareTo(simple) > 0, "compound " + compound + " should exceed simple " + simple);
        // 1000 * ((1 + 0.12/365)^30 - 1) = 9.910
        assertTrue(compound.compareTo(centiUnits(990)) > 0 && compound.compareTo(centiUnits(992)) < 0,
                "unexpected compound interest " + compound);
    }

    @Test
    public void test_compoundIsMonotonicInElapsedTime() {
        BigInteger previous = BigInteger.ZERO;
        for (long seconds = 3600; seconds <= 400 * DAY; seconds += 7 * DAY + 3600) {
            BigInteger current = InterestCalculator.compoundInterest(units(1000), 1800, seconds, 400 * DAY);
            assertTrue(current.compareTo(previous) >= 0, "interest decreased at " + seconds);
            previous = current;
        }
    }

    @Test
    public void test_subDayRemainder_earnsSimpleInterestOnCompoundedBalance() {
        BigInteger wholeDays = InterestCalculator.compoundInterest(units(1000), 1200, 10 * DAY, 30 * DAY);
        BigInteger withRemainder = InterestCalculator.compoundInterest(units(1000), 1200, 10 * DAY + DAY / 2, 30 * DAY);
        BigInteger balance = units(1000).add(wholeDays);
        BigInteger expected = wholeDays.add(InterestCalculator.simpleInterest(balance, 1200, DAY / 2));
        assertEquals(expected, withRemainder);
    }

    @Test
    public void test_boundedAndClosedForm_agreeWithinOneYear() {
        BigInteger bounded = InterestCalculator.compoundInterest(units(1000), 1200, 90 * DAY, 90 * DAY,
                CompoundingMode.BOUNDED_ITERATIVE);
        BigInteger closed = InterestCalculator.compoundInterest(units(1000), 1200, 90 * DAY, 90 * DAY,
                CompoundingMode.CLOSED_FORM);
        assertTrue(bounded.subtract(closed).abs().compareTo(BigInteger.valueOf(1_000_000_000L)) < 0,
                "bounded " + bounded + " vs closed " + closed);
    }

    @Test
    public void test_beyondIterationBound_boundedFallsBackToSimpleTail() {
        BigInteger atBound = InterestCalculator.compoundInterest(units(1000), 1200, 365 * DAY, 400 * DAY);
        BigInteger bounded = InterestCalculator.compoundInterest(units(1000), 1200, 400 * DAY, 400 * DAY,
                CompoundingMode.BOUNDED_ITERATIVE);
        BigInteger closed = InterestCalculator.compoundInterest(units(1000), 1200, 400 * DAY, 400 * DAY,
                CompoundingMode.CLOSED_FORM);

        BigInteger expectedTail = InterestCalculator.simpleInterest(units(1000).add(atBound), 1200, 35 * DAY);
        assertEquals(atBound.add(expectedTail), bounded);
        assertTrue(closed.compareTo(bounded) > 0, "closed form keeps compounding past the bound");
    }

    @Test
    public void test_dailyRateWad_is_apyOver365() {
        // 1e18 * 1200 / (10000 * 365)
        assertEquals(new BigInteger("328767123287671"), InterestCalculator.dailyRateWad(1200));
    }

    @Test
    public void test_wadPow_exactForPowersOfTwo() {
        BigInteger two = InterestCalculator.WAD.multiply(BigInteger.TWO);
        assertEquals(InterestCalculator.WAD.multiply(BigInteger.valueOf(1024)), InterestCalculator.wadPow(two, 10));
        assertEquals(InterestCalculator.WAD, InterestCalculator.wadPow(two, 0));
    }

    // =========================================================================
    // earlyWithdrawalPenalty()
    // =========================================================================

    @Test
    public void test_penaltyBeforeMinimumHold_fullRate() {
        assertEquals(units(20), InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, 5 * DAY, 30 * DAY));
        assertEquals(units(20), InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, 0, 30 * DAY));
    }

    @Test
    public void test_penaltyInsideLinearWindow_decaysTowardsZero() {
        // window = 60 days; at day 45 a quarter of the window is left
        assertEquals(units(5), InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, 45 * DAY, 30 * DAY));
        assertEquals(units(10), InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, 30 * DAY, 30 * DAY));
    }

    @Test
    public void test_penaltyAfterDoubleHold_zero() {
        assertEquals(BigInteger.ZERO, InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, 60 * DAY, 30 * DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, 365 * DAY, 30 * DAY));
    }

    @Test
    public void test_penaltyNeverExceedsFullRate() {
        BigInteger full = units(1000).multiply(BigInteger.valueOf(500)).divide(BigInteger.valueOf(10_000));
        for (long elapsed = 0; elapsed <= 200 * DAY; elapsed += 5 * DAY) {
            BigInteger penalty = InterestCalculator.earlyWithdrawalPenalty(units(1000), 500, elapsed, 90 * DAY);
            assertTrue(penalty.compareTo(full) <= 0);
            assertTrue(penalty.signum() >= 0);
        }
    }

    @Test
    public void test_penaltyDegenerateInputs_zero() {
        assertEquals(BigInteger.ZERO, InterestCalculator.earlyWithdrawalPenalty(units(1000), 200, DAY, 0));
        assertEquals(BigInteger.ZERO, InterestCalculator.earlyWithdrawalPenalty(units(1000), 0, DAY, 30 * DAY));
        assertEquals(BigInteger.ZERO, InterestCalculator.earlyWithdrawalPenalty(BigInteger.ZERO, 200, DAY, 30 * DAY));
    }

    // =========================================================================
    // effectiveApy(), maturityBonus(), multipliers
    // =========================================================================

    @Test
    public void test_effectiveApy_neutralMultipliersKeepBase() {
        assertEquals(1200, InterestCalculator.effectiveApy(1200, 10_000, 10_000));
    }

    @Test
    public void test_effectiveApy_multipliersCompose() {
        assertEquals(1800, InterestCalculator.effectiveApy(1200, 15_000, 10_000));
        assertEquals(1440, InterestCalculator.effectiveApy(1000, 12_000, 12_000));
        assertEquals(600, InterestCalculator.effectiveApy(1200, 5_000, 10_000));
    }

    @Test
    public void test_effectiveApy_roundsDown() {
        // 3 * 0.5 * 0.5 = 0.75
        assertEquals(0, InterestCalculator.effectiveApy(3, 5_000, 5_000));
    }

    @Test
    public void test_maturityBonus_fivePercentOfPrincipalPlusInterest() {
        assertEquals(units(50), InterestCalculator.maturityBonus(units(1000), BigInteger.ZERO, 500));
        assertEquals(units(55), InterestCalculator.maturityBonus(units(1000), units(100), 500));
        assertEquals(BigInteger.ZERO, InterestCalculator.maturityBonus(units(1000), units(100), 0));
    }

    @Test
    public void test_multiplierBounds() {
        assertFalse(InterestCalculator.isValidMultiplier(4_999));
        assertTrue(InterestCalculator.isValidMultiplier(5_000));
        assertTrue(InterestCalculator.isValidMultiplier(20_000));
        assertFalse(InterestCalculator.isValidMultiplier(20_001));
    }

    @Test
    public void test_saturatingSub_neverNegative() {
        assertEquals(BigInteger.ZERO, InterestCalculator.saturatingSub(units(1), units(2)));
        assertEquals(units(1), InterestCalculator.saturatingSub(units(3), units(2)));
    }

    @Test
    public void test_compoundingModeFromString() {
        assertEquals(CompoundingMode.CLOSED_FORM, CompoundingMode.fromString("closed_form"));
        assertEquals(CompoundingMode.BOUNDED_ITERATIVE, CompoundingMode.fromString(null));
        assertEquals(CompoundingMode.BOUNDED_ITERATIVE, CompoundingMode.fromString("bogus"));
    }
}
