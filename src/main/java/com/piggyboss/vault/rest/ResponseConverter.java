package com.piggyboss.vault.rest;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import com.piggyboss.vault.services.VaultException;

/**
 * Turns handler JSON ({@code success:true/false} plus an optional {@code errorCode}) into an
 * {@link ApiResponse} with a matching HTTP status.
 */
public class ResponseConverter {

    public static ApiResponse fromHandlerResponse(String handlerResult) {
        return fromHandlerResponse(handlerResult, 200);
    }

    /**
     * Uses 201 Created for a successful result.
     */
    public static ApiResponse fromHandlerResponseCreated(String handlerResult) {
        return fromHandlerResponse(handlerResult, 201);
    }

    private static ApiResponse fromHandlerResponse(String handlerResult, int successStatus) {
        if (handlerResult == null) {
            return ApiResponse.errorMessage("No response from handler");
        }
        JsonObject json;
        try {
            json = JsonParser.parseString(handlerResult).getAsJsonObject();
        } catch (JsonSyntaxException | IllegalStateException e) {
            return ApiResponse.errorMessage("Malformed handler response");
        }
        if (!json.has("success") || json.get("success").getAsBoolean()) {
            return new ApiResponse(successStatus, handlerResult);
        }
        return determineErrorStatus(json, handlerResult);
    }

    private static ApiResponse determineErrorStatus(JsonObject json, String rawJson) {
        if (!json.has("errorCode")) {
            return ApiResponse.errorMessage(json.has("errorMessage")
                    ? json.get("errorMessage").getAsString()
                    : "Internal server error");
        }
        String errorCode = json.get("errorCode").getAsString();
        if ("INVALID_INPUT".equals(errorCode)) {
            return ApiResponse.badRequest(rawJson);
        }
        VaultException.ErrorCode code;
        try {
            code = VaultException.ErrorCode.valueOf(errorCode);
        } catch (IllegalArgumentException e) {
            return ApiResponse.badRequest(rawJson);
        }
        switch (code) {
            case PLAN_NOT_FOUND:
            case DEPOSIT_NOT_FOUND:
            case POSITION_NOT_FOUND:
                return ApiResponse.notFound(rawJson);
            case NOT_OWNER:
            case NOT_ADMIN:
                return ApiResponse.forbidden(rawJson);
            case TRANSFER_FAILED:
            case STORE_UNAVAILABLE:
                return ApiResponse.badGateway(rawJson);
            default:
                break;
        }
        switch (code.getCategory()) {
            case STATE_CONFLICT:
                return ApiResponse.conflict(rawJson);
            case VALIDATION_ERROR:
                return ApiResponse.unprocessable(rawJson);
            default:
                return ApiResponse.badRequest(rawJson);
        }
    }
}
