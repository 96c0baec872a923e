package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.DepositStatus;
import com.piggyboss.vault.pojos.RewardPool;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.UserAggregate;
import com.piggyboss.vault.pojos.VaultEvent;
import com.piggyboss.vault.pojos.VaultRecords;
import com.piggyboss.vault.pojos.YieldPosition;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Firestore document layouts for vault records. Amounts are stored as decimal strings of base
 * units because they overflow Firestore's 64-bit integers; timestamps are epoch seconds.
 */
final class VaultDocuments {

    private VaultDocuments() {}

    // -------------------------------------------------------------------------
    // Controls (the vault/state document)
    // -------------------------------------------------------------------------

    static Map<String, Object> controlsToMap(VaultRecords records, long version) {
        Map<String, Object> data = new HashMap<>();
        data.put("version", version);
        data.put("next_deposit_id", records.getNextDepositId());
        data.put("global_multiplier_bps", records.getGlobalMultiplierBps());
        data.put("paused", records.isPaused());
        data.put("reward_pool_total", amount(records.getRewardPool().getTotalPool()));
        data.put("reward_pool_distributed", amount(records.getRewardPool().getDistributed()));
        return data;
    }

    static void controlsInto(Map<String, Object> data, VaultRecords records) {
        records.setVersion(longOf(data, "version"));
        records.setNextDepositId(longOf(data, "next_deposit_id"));
        records.setGlobalMultiplierBps((int) longOf(data, "global_multiplier_bps"));
        records.setPaused(Boolean.TRUE.equals(data.get("paused")));
        records.setRewardPool(new RewardPool(amountOf(data, "reward_pool_total"),
                amountOf(data, "reward_pool_distributed")));
    }

    // -------------------------------------------------------------------------
    // Plans
    // -------------------------------------------------------------------------

    static Map<String, Object> planToMap(SavingsPlan plan, Integer multiplierBps) {
        Map<String, Object> data = new HashMap<>();
        data.put("plan_id", plan.getPlanId());
        data.put("duration_seconds", plan.getDurationSeconds());
        data.put("base_apy_bps", plan.getBaseApyBps());
        data.put("min_amount", amount(plan.getMinAmount()));
        data.put("max_amount", amount(plan.getMaxAmount()));
        data.put("active", plan.isActive());
        if (multiplierBps != null) {
            data.put("multiplier_bps", multiplierBps);
        }
        return data;
    }

    static SavingsPlan planFromMap(Map<String, Object> data) {
        return new SavingsPlan(
                (int) longOf(data, "plan_id"),
                longOf(data, "duration_seconds"),
                (int) longOf(data, "base_apy_bps"),
                amountOf(data, "min_amount"),
                amountOf(data, "max_amount"),
                Boolean.TRUE.equals(data.get("active")));
    }

    /** Explicit multiplier stored with a plan, or null for the neutral default. */
    static Integer multiplierFromMap(Map<String, Object> data) {
        Object value = data.get("multiplier_bps");
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    // -------------------------------------------------------------------------
    // Deposits and positions
    // -------------------------------------------------------------------------

    static Map<String, Object> depositToMap(Deposit deposit) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", deposit.getId());
        data.put("owner", deposit.getOwner());
        data.put("amount", amount(deposit.getAmount()));
        data.put("plan_id", deposit.getPlanId());
        // Terms the deposit was opened with
        data.put("plan", planToMap(deposit.getPlan(), null));
        data.put("position_id", deposit.getPositionId());
        data.put("created_at", deposit.getCreatedAt());
        data.put("maturity_at", deposit.getMaturityAt());
        data.put("status", deposit.getStatus().name());
        data.put("accrued_interest_at_withdrawal", amount(deposit.getAccruedInterestAtWithdrawal()));
        data.put("bonus_at_withdrawal", amount(deposit.getBonusAtWithdrawal()));
        data.put("penalty_at_withdrawal", amount(deposit.getPenaltyAtWithdrawal()));
        data.put("payout_amount", amount(deposit.getPayoutAmount()));
        data.put("closed_at", deposit.getClosedAt());
        return data;
    }

    @SuppressWarnings("unchecked")
    static Deposit depositFromMap(Map<String, Object> data) {
        Deposit deposit = new Deposit();
        deposit.setId(longOf(data, "id"));
        deposit.setOwner((String) data.get("owner"));
        deposit.setAmount(amountOf(data, "amount"));
        deposit.setPlanId((int) longOf(data, "plan_id"));
        deposit.setPlan(planFromMap((Map<String, Object>) data.get("plan")));
        deposit.setPositionId(longOf(data, "position_id"));
        deposit.setCreatedAt(longOf(data, "created_at"));
        deposit.setMaturityAt(longOf(data, "maturity_at"));
        deposit.setStatus(DepositStatus.valueOf((String) data.get("status")));
        deposit.setAccruedInterestAtWithdrawal(amountOf(data, "accrued_interest_at_withdrawal"));
        deposit.setBonusAtWithdrawal(amountOf(data, "bonus_at_withdrawal"));
        deposit.setPenaltyAtWithdrawal(amountOf(data, "penalty_at_withdrawal"));
        deposit.setPayoutAmount(amountOf(data, "payout_amount"));
        deposit.setClosedAt(longOf(data, "closed_at"));
        return deposit;
    }

    static Map<String, Object> positionToMap(YieldPosition position) {
        Map<String, Object> data = new HashMap<>();
        data.put("id", position.getId());
        data.put("principal", amount(position.getPrincipal()));
        data.put("accrued_interest", amount(position.getAccruedInterest()));
        data.put("bonus_awarded", amount(position.getBonusAwarded()));
        data.put("start_time", position.getStartTime());
        data.put("end_time", position.getEndTime());
        data.put("effective_apy_bps", position.getEffectiveApyBps());
        data.put("last_update_time", position.getLastUpdateTime());
        data.put("active", position.isActive());
        return data;
    }

    static YieldPosition positionFromMap(Map<String, Object> data) {
        YieldPosition position = new YieldPosition();
        position.setId(longOf(data, "id"));
        position.setPrincipal(amountOf(data, "principal"));
        position.setAccruedInterest(amountOf(data, "accrued_interest"));
        position.setBonusAwarded(amountOf(data, "bonus_awarded"));
        position.setStartTime(longOf(data, "start_time"));
        position.setEndTime(longOf(data, "end_time"));
        position.setEffectiveApyBps((int) longOf(data, "effective_apy_bps"));
        position.setLastUpdateTime(longOf(data, "last_update_time"));
        position.setActive(Boolean.TRUE.equals(data.get("active")));
        return position;
    }

    // -------------------------------------------------------------------------
    // Users and events
    // -------------------------------------------------------------------------

    static Map<String, Object> userToMap(UserAggregate aggregate) {
        Map<String, Object> planUsage = new HashMap<>();
        aggregate.getPlanUsage().forEach((planId, uses) -> planUsage.put(String.valueOf(planId), uses));

        Map<String, Object> data = new HashMap<>();
        data.put("user", aggregate.getUser());
        data.put("total_deposited", amount(aggregate.getTotalDeposited()));
        data.put("total_earned", amount(aggregate.getTotalEarned()));
        data.put("total_withdrawn", amount(aggregate.getTotalWithdrawn()));
        data.put("transaction_count", aggregate.getTransactionCount());
        data.put("last_activity", aggregate.getLastActivity());
        data.put("preferred_plan", aggregate.getPreferredPlan());
        data.put("plan_usage", planUsage);
        data.put("awarded_categories", new ArrayList<>(aggregate.getAwardedCategories()));
        data.put("deposit_ids", new ArrayList<>(aggregate.getDepositIds()));
        return data;
    }

    @SuppressWarnings("unchecked")
    static UserAggregate userFromMap(Map<String, Object> data) {
        Map<Integer, Integer> planUsage = new HashMap<>();
        Object storedUsage = data.get("plan_usage");
        if (storedUsage instanceof Map) {
            ((Map<String, Object>) storedUsage).forEach((planId, uses) ->
                    planUsage.put(Integer.parseInt(planId), ((Number) uses).intValue()));
        }
        List<Long> depositIds = new ArrayList<>();
        Object storedIds = data.get("deposit_ids");
        if (storedIds instanceof List) {
            for (Object id : (List<Object>) storedIds) {
                depositIds.add(((Number) id).longValue());
            }
        }
        List<String> awarded = new ArrayList<>();
        Object storedAwarded = data.get("awarded_categories");
        if (storedAwarded instanceof List) {
            for (Object category : (List<Object>) storedAwarded) {
                awarded.add((String) category);
            }
        }
        Object preferred = data.get("preferred_plan");
        return UserAggregate.restore(
                (String) data.get("user"),
                amountOf(data, "total_deposited"),
                amountOf(data, "total_earned"),
                amountOf(data, "total_withdrawn"),
                longOf(data, "transaction_count"),
                longOf(data, "last_activity"),
                preferred instanceof Number ? ((Number) preferred).intValue() : null,
                planUsage,
                awarded,
                depositIds);
    }

    static Map<String, Object> eventToMap(VaultEvent event) {
        Map<String, Object> data = new HashMap<>();
        data.put("sequence", event.getSequence());
        data.put("type", event.getType().name());
        data.put("timestamp", event.getTimestamp());
        data.put("user", event.getUser());
        data.put("deposit_id", event.getDepositId());
        data.put("amount", event.getAmount() != null ? amount(event.getAmount()) : null);
        data.put("detail", event.getDetail());
        return data;
    }

    static VaultEvent eventFromMap(Map<String, Object> data) {
        Object depositId = data.get("deposit_id");
        return new VaultEvent(
                longOf(data, "sequence"),
                VaultEvent.Type.valueOf((String) data.get("type")),
                longOf(data, "timestamp"),
                (String) data.get("user"),
                depositId instanceof Number ? ((Number) depositId).longValue() : null,
                data.get("amount") != null ? amountOf(data, "amount") : null,
                (String) data.get("detail"));
    }

    /** Document id that keeps events ordered by sequence. */
    static String eventId(long sequence) {
        return String.format("%012d", sequence);
    }

    // -------------------------------------------------------------------------
    // Field helpers
    // -------------------------------------------------------------------------

    static String amount(BigInteger value) {
        return value != null ? value.toString() : "0";
    }

    static BigInteger amountOf(Map<String, Object> data, String field) {
        Object value = data.get(field);
        if (value == null) {
            return BigInteger.ZERO;
        }
        return new BigInteger(value.toString());
    }

    static long longOf(Map<String, Object> data, String field) {
        Object value = data.get(field);
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
