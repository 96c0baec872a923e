package com.piggyboss.vault.rest;

import com.piggyboss.vault.handlers.AdminHandler;
import com.piggyboss.vault.handlers.VaultHandler;
import com.piggyboss.vault.pojos.RequestBody;
import com.piggyboss.vault.services.LoggingService;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps HTTP method + path to handler functions. Path and query parameters are copied onto the
 * request body before delegating.
 */
public class RestRouter {

    private final List<Route> routes = new ArrayList<>();

    private final VaultHandler vaultHandler;
    private final AdminHandler adminHandler;

    public RestRouter(VaultHandler vaultHandler, AdminHandler adminHandler) {
        this.vaultHandler = vaultHandler;
        this.adminHandler = adminHandler;

        registerRoutes();
    }

    /**
     * Attempt to route a request. Returns null if no route matches.
     */
    public ApiResponse route(String method, String path, String queryString, String userId, RequestBody body) {
        if (body == null) {
            body = new RequestBody();
        }
        Map<String, String> queryParams = parseQueryString(queryString);

        for (Route route : routes) {
            if (!route.method.equalsIgnoreCase(method)) continue;

            Matcher matcher = route.pattern.matcher(path);
            if (!matcher.matches()) continue;

            Map<String, String> pathParams = new HashMap<>();
            for (int i = 0; i < route.paramNames.size(); i++) {
                pathParams.put(route.paramNames.get(i), URLDecoder.decode(matcher.group(i + 1), StandardCharsets.UTF_8));
            }

            LoggingService.setFunction(route.functionName);

            try {
                ApiResponse response = route.handler.handle(userId, body, pathParams, queryParams);
                if (response == null) {
                    return ApiResponse.errorMessage("No response from handler");
                }
                return response;
            } catch (NumberFormatException e) {
                return ApiResponse.badRequestMessage("Malformed parameter: " + e.getMessage());
            } catch (Exception e) {
                LoggingService.error("rest_handler_exception", e);
                return ApiResponse.errorMessage(e.getMessage() != null ? e.getMessage() : "Internal server error");
            }
        }

        return null;
    }

    public static boolean isRestPath(String path) {
        return path != null && path.startsWith("/api/v1/");
    }

    // ============= Route Registration =============

    private void registerRoutes() {
        // --- Plans ---
        get("/api/v1/plans", "list_plans", (userId, body, pathParams, queryParams) -> {
            String result = vaultHandler.handleRequest("list_plans", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/plans/{planId}", "get_plan", (userId, body, pathParams, queryParams) -> {
            body.setPlanId(Integer.parseInt(pathParams.get("planId")));
            String result = vaultHandler.handleRequest("get_plan", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        // --- Deposits ---
        post("/api/v1/deposits", "create_deposit", (userId, body, pathParams, queryParams) -> {
            String result = vaultHandler.handleRequest("create_deposit", userId, body);
            return ResponseConverter.fromHandlerResponseCreated(result);
        });

        get("/api/v1/deposits", "list_deposits", (userId, body, pathParams, queryParams) -> {
            body.setStatus(queryParams.get("status"));
            String result = vaultHandler.handleRequest("list_deposits", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/deposits/{depositId}", "get_deposit", (userId, body, pathParams, queryParams) -> {
            body.setDepositId(Long.parseLong(pathParams.get("depositId")));
            String result = vaultHandler.handleRequest("get_deposit", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/deposits/{depositId}/interest", "current_interest", (userId, body, pathParams, queryParams) -> {
            body.setDepositId(Long.parseLong(pathParams.get("depositId")));
            String result = vaultHandler.handleRequest("current_interest", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post("/api/v1/deposits/{depositId}/withdraw", "withdraw", (userId, body, pathParams, queryParams) -> {
            body.setDepositId(Long.parseLong(pathParams.get("depositId")));
            String result = vaultHandler.handleRequest("withdraw", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post("/api/v1/deposits/{depositId}/emergency-withdraw", "emergency_withdraw", (userId, body, pathParams, queryParams) -> {
            body.setDepositId(Long.parseLong(pathParams.get("depositId")));
            String result = vaultHandler.handleRequest("emergency_withdraw", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        // --- Users ---
        get("/api/v1/users/me/summary", "user_summary", (userId, body, pathParams, queryParams) -> {
            String result = vaultHandler.handleRequest("user_summary", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        // --- Admin ---
        put("/api/v1/admin/plans/{planId}", "set_plan", (userId, body, pathParams, queryParams) -> {
            body.setPlanId(Integer.parseInt(pathParams.get("planId")));
            String result = adminHandler.handleRequest("set_plan", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        put("/api/v1/admin/plans/{planId}/multiplier", "set_plan_multiplier", (userId, body, pathParams, queryParams) -> {
            body.setPlanId(Integer.parseInt(pathParams.get("planId")));
            String result = adminHandler.handleRequest("set_plan_multiplier", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        put("/api/v1/admin/multiplier", "set_global_multiplier", (userId, body, pathParams, queryParams) -> {
            String result = adminHandler.handleRequest("set_global_multiplier", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post("/api/v1/admin/reward-pool", "fund_reward_pool", (userId, body, pathParams, queryParams) -> {
            String result = adminHandler.handleRequest("fund_reward_pool", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/admin/reward-pool", "reward_pool", (userId, body, pathParams, queryParams) -> {
            String result = adminHandler.handleRequest("reward_pool", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        put("/api/v1/admin/paused", "set_paused", (userId, body, pathParams, queryParams) -> {
            String result = adminHandler.handleRequest("set_paused", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/admin/events", "vault_events", (userId, body, pathParams, queryParams) -> {
            if (queryParams.get("depositId") != null) {
                body.setDepositId(Long.parseLong(queryParams.get("depositId")));
            }
            String result = adminHandler.handleRequest("vault_events", userId, body);
            return ResponseConverter.fromHandlerResponse(result);
        });
    }

    // ============= Route Helpers =============

    private void get(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("GET", pathPattern, functionName, handler));
    }

    private void post(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("POST", pathPattern, functionName, handler));
    }

    private void put(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("PUT", pathPattern, functionName, handler));
    }

    static Map<String, String> parseQueryString(String queryString) {
        Map<String, String> params = new HashMap<>();
        if (queryString == null || queryString.isEmpty()) return params;
        for (String pair : queryString.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2) {
                params.put(kv[0], URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
            } else if (kv.length == 1) {
                params.put(kv[0], "");
            }
        }
        return params;
    }

    // ============= Route Model =============

    @FunctionalInterface
    interface RouteHandler {
        ApiResponse handle(String userId, RequestBody body, Map<String, String> pathParams, Map<String, String> queryParams) throws Exception;
    }

    static class Route {
        final String method;
        final Pattern pattern;
        final List<String> paramNames;
        final String functionName;
        final RouteHandler handler;

        Route(String method, String pathTemplate, String functionName, RouteHandler handler) {
            this.method = method;
            this.functionName = functionName;
            this.handler = handler;
            this.paramNames = new ArrayList<>();

            // /api/v1/deposits/{depositId}/interest -> /api/v1/deposits/([^/]+)/interest
            Matcher m = Pattern.compile("\\{(\\w+)}").matcher(pathTemplate);
            while (m.find()) {
                paramNames.add(m.group(1));
            }
            String regex = pathTemplate.replaceAll("\\{\\w+}", "([^/]+)");
            this.pattern = Pattern.compile("^" + regex + "$");
        }
    }
}
