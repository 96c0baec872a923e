package com.piggyboss.vault.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.DepositStatus;
import com.piggyboss.vault.pojos.PayoutBreakdown;
import com.piggyboss.vault.pojos.RequestBody;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.UserSummary;
import com.piggyboss.vault.services.LoggingService;
import com.piggyboss.vault.services.VaultException;
import com.piggyboss.vault.services.VaultStateMachine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for saver-facing operations: plans, deposits, withdrawals and the user summary.
 * Amounts are rendered as decimal strings of base units.
 */
public class VaultHandler {

    private final VaultStateMachine vault;
    private final Gson gson;

    public VaultHandler(VaultStateMachine vault) {
        this.vault = vault;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    /**
     * Route a function to its handler method.
     *
     * @return the JSON response, or null if the function is not handled here
     */
    public String handleRequest(String functionName, String userId, RequestBody requestBody) {
        try {
            switch (functionName) {
                case "list_plans":
                    return handleListPlans();
                case "get_plan":
                    return handleGetPlan(requestBody);
                case "create_deposit":
                    return handleCreateDeposit(userId, requestBody);
                case "list_deposits":
                    return handleListDeposits(userId, requestBody);
                case "get_deposit":
                    return handleGetDeposit(userId, requestBody);
                case "current_interest":
                    return handleCurrentInterest(userId, requestBody);
                case "withdraw":
                    return handleWithdraw(userId, requestBody);
                case "emergency_withdraw":
                    return handleEmergencyWithdraw(userId, requestBody);
                case "user_summary":
                    return handleUserSummary(userId);
                default:
                    return null;
            }
        } catch (VaultException e) {
            LoggingService.warn(functionName + "_failed", LoggingService.data(
                    "errorCode", e.getErrorCode().name(), "errorMessage", e.getMessage()));
            return errorJson(gson, e);
        } catch (Exception e) {
            LoggingService.error("vault_handler_exception", e);
            return gson.toJson(Map.of("success", false, "errorMessage",
                    e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }

    public static boolean handles(String functionName) {
        return functionName != null && (
            functionName.equals("list_plans") ||
            functionName.equals("get_plan") ||
            functionName.equals("create_deposit") ||
            functionName.equals("list_deposits") ||
            functionName.equals("get_deposit") ||
            functionName.equals("current_interest") ||
            functionName.equals("withdraw") ||
            functionName.equals("emergency_withdraw") ||
            functionName.equals("user_summary")
        );
    }

    // ============= Plans =============

    private String handleListPlans() {
        List<Map<String, Object>> plans = new ArrayList<>();
        for (SavingsPlan plan : vault.listPlans()) {
            plans.add(planToMap(plan, vault.effectiveApyOf(plan)));
        }
        return gson.toJson(Map.of("success", true, "plans", plans));
    }

    private String handleGetPlan(RequestBody requestBody) throws VaultException {
        if (requestBody.getPlanId() == null) {
            return missing("Plan ID is required");
        }
        SavingsPlan plan = vault.getPlan(requestBody.getPlanId());
        return gson.toJson(Map.of("success", true, "plan", planToMap(plan, vault.effectiveApyOf(plan))));
    }

    // ============= Deposits =============

    private String handleCreateDeposit(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getPlanId() == null) {
            return missing("Plan ID is required");
        }
        if (requestBody.getAmount() == null) {
            return missing("Amount is required");
        }
        Deposit deposit = vault.createDeposit(userId, requestBody.getAmount(), requestBody.getPlanId());
        LoggingService.info("deposit_created", LoggingService.data(
                "depositId", deposit.getId(), "planId", deposit.getPlanId(), "amount", deposit.getAmount()));
        return gson.toJson(Map.of("success", true, "deposit", depositToMap(deposit)));
    }

    private String handleListDeposits(String userId, RequestBody requestBody) throws VaultException {
        DepositStatus filter = null;
        if (requestBody.getStatus() != null && !requestBody.getStatus().isEmpty()) {
            filter = DepositStatus.fromString(requestBody.getStatus().toUpperCase());
            if (filter == null) {
                return missing("Unknown deposit status: " + requestBody.getStatus());
            }
        }
        List<Map<String, Object>> deposits = new ArrayList<>();
        for (Long id : vault.listDepositIds(userId)) {
            Deposit deposit = vault.getDeposit(id);
            if (filter == null || deposit.getStatus() == filter) {
                deposits.add(depositToMap(deposit));
            }
        }
        return gson.toJson(Map.of("success", true, "deposits", deposits));
    }

    private String handleGetDeposit(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getDepositId() == null) {
            return missing("Deposit ID is required");
        }
        Deposit deposit = ownedDeposit(userId, requestBody.getDepositId());
        return gson.toJson(Map.of("success", true, "deposit", depositToMap(deposit)));
    }

    private String handleCurrentInterest(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getDepositId() == null) {
            return missing("Deposit ID is required");
        }
        long depositId = requestBody.getDepositId();
        ownedDeposit(userId, depositId);
        BigInteger interest = vault.calculateCurrentInterest(depositId);
        return gson.toJson(Map.of(
                "success", true,
                "depositId", depositId,
                "interest", interest.toString()));
    }

    private String handleWithdraw(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getDepositId() == null) {
            return missing("Deposit ID is required");
        }
        PayoutBreakdown breakdown = vault.withdraw(userId, requestBody.getDepositId());
        return gson.toJson(Map.of("success", true, "payout", breakdownToMap(breakdown)));
    }

    private String handleEmergencyWithdraw(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getDepositId() == null) {
            return missing("Deposit ID is required");
        }
        PayoutBreakdown breakdown = vault.emergencyWithdraw(userId, requestBody.getDepositId());
        return gson.toJson(Map.of("success", true, "payout", breakdownToMap(breakdown)));
    }

    private String handleUserSummary(String userId) {
        UserSummary summary = vault.getUserSummary(userId);
        return gson.toJson(Map.of(
                "success", true,
                "totalSaved", summary.totalSaved.toString(),
                "activeCount", summary.activeCount,
                "totalEarned", summary.totalEarned.toString()));
    }

    // ============= Helpers =============

    private Deposit ownedDeposit(String userId, long depositId) throws VaultException {
        Deposit deposit = vault.getDeposit(depositId);
        if (userId == null || !userId.equals(deposit.getOwner())) {
            throw new VaultException(VaultException.ErrorCode.NOT_OWNER);
        }
        return deposit;
    }

    private String missing(String message) {
        return gson.toJson(Map.of("success", false, "errorCode", "INVALID_INPUT", "errorMessage", message));
    }

    static String errorJson(Gson gson, VaultException e) {
        return gson.toJson(Map.of(
                "success", false,
                "errorCode", e.getErrorCode().name(),
                "errorMessage", e.getMessage()));
    }

    static Map<String, Object> planToMap(SavingsPlan plan, int effectiveApyBps) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("planId", plan.getPlanId());
        map.put("durationSeconds", plan.getDurationSeconds());
        map.put("durationDays", plan.getDurationDays());
        map.put("baseApyBps", plan.getBaseApyBps());
        map.put("effectiveApyBps", effectiveApyBps);
        map.put("minAmount", plan.getMinAmount().toString());
        map.put("maxAmount", plan.getMaxAmount().toString());
        map.put("active", plan.isActive());
        return map;
    }

    static Map<String, Object> depositToMap(Deposit deposit) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("depositId", deposit.getId());
        map.put("owner", deposit.getOwner());
        map.put("amount", deposit.getAmount().toString());
        map.put("planId", deposit.getPlanId());
        map.put("createdAt", deposit.getCreatedAt());
        map.put("maturityAt", deposit.getMaturityAt());
        map.put("status", deposit.getStatus().name());
        if (deposit.isWithdrawn()) {
            map.put("closedAt", deposit.getClosedAt());
            map.put("interest", deposit.getAccruedInterestAtWithdrawal().toString());
            map.put("bonus", deposit.getBonusAtWithdrawal().toString());
            map.put("penalty", deposit.getPenaltyAtWithdrawal().toString());
            map.put("payout", deposit.getPayoutAmount().toString());
        }
        return map;
    }

    static Map<String, Object> breakdownToMap(PayoutBreakdown breakdown) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", breakdown.kind.name());
        map.put("depositId", breakdown.depositId);
        map.put("principal", breakdown.principal.toString());
        map.put("interest", breakdown.interest.toString());
        map.put("bonus", breakdown.bonus.toString());
        map.put("penalty", breakdown.penalty.toString());
        map.put("payout", breakdown.payout.toString());
        map.put("bonusClamped", breakdown.bonusClamped);
        return map;
    }
}
