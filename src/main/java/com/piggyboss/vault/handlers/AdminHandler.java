package com.piggyboss.vault.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.piggyboss.vault.pojos.RequestBody;
import com.piggyboss.vault.pojos.RewardPool;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.VaultEvent;
import com.piggyboss.vault.services.LoggingService;
import com.piggyboss.vault.services.VaultException;
import com.piggyboss.vault.services.VaultStateMachine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handler for vault administration. Every function requires the caller to be a configured admin;
 * the check itself lives in {@link VaultStateMachine}.
 */
public class AdminHandler {

    private final VaultStateMachine vault;
    private final Gson gson;

    public AdminHandler(VaultStateMachine vault) {
        this.vault = vault;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public String handleRequest(String functionName, String userId, RequestBody requestBody) {
        try {
            switch (functionName) {
                case "set_plan":
                    return handleSetPlan(userId, requestBody);
                case "set_plan_multiplier":
                    return handleSetPlanMultiplier(userId, requestBody);
                case "set_global_multiplier":
                    return handleSetGlobalMultiplier(userId, requestBody);
                case "fund_reward_pool":
                    return handleFundRewardPool(userId, requestBody);
                case "set_paused":
                    return handleSetPaused(userId, requestBody);
                case "reward_pool":
                    return handleRewardPool(userId);
                case "vault_events":
                    return handleVaultEvents(userId, requestBody);
                default:
                    return null;
            }
        } catch (VaultException e) {
            LoggingService.warn(functionName + "_failed", LoggingService.data(
                    "errorCode", e.getErrorCode().name(), "errorMessage", e.getMessage()));
            return VaultHandler.errorJson(gson, e);
        } catch (Exception e) {
            LoggingService.error("admin_handler_exception", e);
            return gson.toJson(Map.of("success", false, "errorMessage",
                    e.getMessage() != null ? e.getMessage() : "Internal server error"));
        }
    }

    public static boolean handles(String functionName) {
        return functionName != null && (
            functionName.equals("set_plan") ||
            functionName.equals("set_plan_multiplier") ||
            functionName.equals("set_global_multiplier") ||
            functionName.equals("fund_reward_pool") ||
            functionName.equals("set_paused") ||
            functionName.equals("reward_pool") ||
            functionName.equals("vault_events")
        );
    }

    private String handleSetPlan(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getPlanId() == null || requestBody.getDurationSeconds() == null
                || requestBody.getBaseApyBps() == null
                || requestBody.getMinAmount() == null || requestBody.getMaxAmount() == null) {
            return missing("planId, durationSeconds, baseApyBps, minAmount and maxAmount are required");
        }
        boolean active = requestBody.getActive() == null || requestBody.getActive();
        SavingsPlan plan = vault.setPlan(userId, requestBody.getPlanId(), requestBody.getDurationSeconds(),
                requestBody.getBaseApyBps(), requestBody.getMinAmount(), requestBody.getMaxAmount(), active);
        LoggingService.info("plan_updated", LoggingService.data("planId", plan.getPlanId(), "active", active));
        return gson.toJson(Map.of("success", true, "plan", VaultHandler.planToMap(plan, vault.effectiveApyOf(plan))));
    }

    private String handleSetPlanMultiplier(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getPlanId() == null || requestBody.getMultiplierBps() == null) {
            return missing("planId and multiplierBps are required");
        }
        vault.setPlanMultiplier(userId, requestBody.getPlanId(), requestBody.getMultiplierBps());
        return gson.toJson(Map.of(
                "success", true,
                "planId", requestBody.getPlanId(),
                "multiplierBps", requestBody.getMultiplierBps()));
    }

    private String handleSetGlobalMultiplier(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getMultiplierBps() == null) {
            return missing("multiplierBps is required");
        }
        vault.setGlobalMultiplier(userId, requestBody.getMultiplierBps());
        return gson.toJson(Map.of("success", true, "multiplierBps", requestBody.getMultiplierBps()));
    }

    private String handleFundRewardPool(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getAmount() == null) {
            return missing("Amount is required");
        }
        RewardPool pool = vault.fundRewardPool(userId, requestBody.getAmount());
        return gson.toJson(Map.of("success", true, "rewardPool", poolToMap(pool)));
    }

    private String handleSetPaused(String userId, RequestBody requestBody) throws VaultException {
        if (requestBody.getPaused() == null) {
            return missing("paused is required");
        }
        vault.setPaused(userId, requestBody.getPaused());
        return gson.toJson(Map.of("success", true, "paused", requestBody.getPaused()));
    }

    private String handleRewardPool(String userId) throws VaultException {
        requireAdmin(userId);
        return gson.toJson(Map.of("success", true, "rewardPool", poolToMap(vault.getRewardPool())));
    }

    private String handleVaultEvents(String userId, RequestBody requestBody) throws VaultException {
        requireAdmin(userId);
        List<VaultEvent> events = requestBody.getDepositId() != null
                ? vault.getEvents(requestBody.getDepositId())
                : vault.getEvents();
        List<Map<String, Object>> rendered = new ArrayList<>();
        for (VaultEvent event : events) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("sequence", event.getSequence());
            map.put("type", event.getType().name());
            map.put("timestamp", event.getTimestamp());
            map.put("user", event.getUser());
            map.put("depositId", event.getDepositId());
            map.put("amount", event.getAmount() != null ? event.getAmount().toString() : null);
            map.put("detail", event.getDetail());
            rendered.add(map);
        }
        return gson.toJson(Map.of("success", true, "events", rendered));
    }

    private void requireAdmin(String userId) throws VaultException {
        if (!vault.getConfig().isAdmin(userId)) {
            throw new VaultException(VaultException.ErrorCode.NOT_ADMIN);
        }
    }

    private String missing(String message) {
        return gson.toJson(Map.of("success", false, "errorCode", "INVALID_INPUT", "errorMessage", message));
    }

    private static Map<String, Object> poolToMap(RewardPool pool) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("totalPool", pool.getTotalPool().toString());
        map.put("distributed", pool.getDistributed().toString());
        map.put("available", pool.available().toString());
        return map;
    }
}
