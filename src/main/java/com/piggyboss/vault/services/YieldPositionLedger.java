package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.YieldPosition;
import com.piggyboss.vault.services.InterestCalculator.CompoundingMode;
import com.piggyboss.vault.services.VaultException.ErrorCode;

import java.math.BigInteger;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Owns the accrual state of every yield position.
 *
 * <p>A position is Active from {@link #open} until {@link #finalizePosition}, then Finalized for good.
 * {@link #accrue} is idempotent for a fixed {@code now} and never decreases accrued interest.</p>
 */
public class YieldPositionLedger {

    /**
     * Values frozen when a position is finalized.
     */
    public static final class FinalizedPosition {
        public final long positionId;
        public final BigInteger principal;
        public final BigInteger totalInterest;

        FinalizedPosition(long positionId, BigInteger principal, BigInteger totalInterest) {
            this.positionId = positionId;
            this.principal = principal;
            this.totalInterest = totalInterest;
        }
    }

    private final Map<Long, YieldPosition> positions = new HashMap<>();
    private long nextPositionId = 1;
    private volatile CompoundingMode compoundingMode;

    public YieldPositionLedger(CompoundingMode compoundingMode) {
        this.compoundingMode = compoundingMode != null ? compoundingMode : CompoundingMode.BOUNDED_ITERATIVE;
    }

    public CompoundingMode getCompoundingMode() {
        return compoundingMode;
    }

    public void setCompoundingMode(CompoundingMode compoundingMode) {
        if (compoundingMode != null) {
            this.compoundingMode = compoundingMode;
        }
    }

    /**
     * Open an active position accruing from {@code now} until {@code now + durationSeconds}.
     *
     * @return the new position id
     */
    public synchronized long open(BigInteger principal, long durationSeconds, int effectiveApyBps, long now)
            throws VaultException {
        if (principal == null || principal.signum() <= 0) {
            throw new VaultException(ErrorCode.ZERO_PRINCIPAL);
        }
        if (durationSeconds <= 0) {
            throw new VaultException(ErrorCode.INVALID_PLAN, "Position duration must be positive");
        }
        YieldPosition position = new YieldPosition();
        position.setId(nextPositionId++);
        position.setPrincipal(principal);
        position.setStartTime(now);
        position.setEndTime(now + durationSeconds);
        position.setEffectiveApyBps(Math.max(0, effectiveApyBps));
        position.setLastUpdateTime(now);
        position.setActive(true);
        positions.put(position.getId(), position);
        return position.getId();
    }

    /**
     * Bring a position's interest up to {@code min(now, endTime)}.
     * No-op for finalized positions and for instants at or before the last update.
     *
     * @return the accrued interest after the call
     */
    public synchronized BigInteger accrue(long positionId, long now) throws VaultException {
        YieldPosition position = require(positionId);
        if (!position.isActive()) {
            return position.getAccruedInterest();
        }
        long cappedNow = Math.min(now, position.getEndTime());
        if (cappedNow <= position.getLastUpdateTime()) {
            return position.getAccruedInterest();
        }
        BigInteger earned = interestSinceLastUpdate(position, cappedNow);
        position.setAccruedInterest(position.getAccruedInterest().add(earned));
        position.setLastUpdateTime(cappedNow);
        return position.getAccruedInterest();
    }

    /**
     * The accrued interest {@link #accrue} would leave at {@code now}, without mutating anything.
     */
    public synchronized BigInteger projectInterest(long positionId, long now) throws VaultException {
        YieldPosition position = require(positionId);
        if (!position.isActive()) {
            return position.getAccruedInterest();
        }
        long cappedNow = Math.min(now, position.getEndTime());
        if (cappedNow <= position.getLastUpdateTime()) {
            return position.getAccruedInterest();
        }
        return position.getAccruedInterest().add(interestSinceLastUpdate(position, cappedNow));
    }

    /**
     * Accrue one last time and freeze the position.
     *
     * @throws VaultException {@code POSITION_ALREADY_FINALIZED} on a second call
     */
    public synchronized FinalizedPosition finalizePosition(long positionId, long now) throws VaultException {
        YieldPosition position = require(positionId);
        if (!position.isActive()) {
            throw new VaultException(ErrorCode.POSITION_ALREADY_FINALIZED,
                    "Yield position " + positionId + " already finalized");
        }
        accrue(positionId, now);
        position.setActive(false);
        return new FinalizedPosition(positionId, position.getPrincipal(), position.getAccruedInterest());
    }

    /**
     * Record a bonus against a position. Allowed after finalization; kept apart from accrued interest.
     */
    public synchronized void applyBonus(long positionId, BigInteger bonusAmount) throws VaultException {
        YieldPosition position = require(positionId);
        if (bonusAmount == null || bonusAmount.signum() <= 0) {
            return;
        }
        position.setBonusAwarded(position.getBonusAwarded().add(bonusAmount));
    }

    /**
     * Copy of the position, safe to hand out.
     */
    public synchronized YieldPosition get(long positionId) throws VaultException {
        return new YieldPosition(require(positionId));
    }

    /**
     * Put back a copy taken with {@link #get}. Only used to undo an operation that is being rolled back.
     */
    synchronized void restore(YieldPosition snapshot) {
        positions.put(snapshot.getId(), new YieldPosition(snapshot));
    }

    /**
     * Replace every position with stored copies. New ids continue after the highest stored id.
     */
    synchronized void reset(Collection<YieldPosition> stored) {
        positions.clear();
        long highest = 0;
        for (YieldPosition position : stored) {
            positions.put(position.getId(), new YieldPosition(position));
            highest = Math.max(highest, position.getId());
        }
        nextPositionId = highest + 1;
    }

    private BigInteger interestSinceLastUpdate(YieldPosition position, long cappedNow) {
        return InterestCalculator.compoundInterest(
                position.getPrincipal().add(position.getAccruedInterest()),
                position.getEffectiveApyBps(),
                cappedNow - position.getLastUpdateTime(),
                position.getDurationSeconds(),
                compoundingMode);
    }

    private YieldPosition require(long positionId) throws VaultException {
        YieldPosition position = positions.get(positionId);
        if (position == null) {
            throw new VaultException(ErrorCode.POSITION_NOT_FOUND, "Yield position " + positionId + " not found");
        }
        return position;
    }
}
