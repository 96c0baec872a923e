package com.piggyboss.vault.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for CloudWatch Logs Insights.
 *
 * Every line carries the request id, the vault function being executed and, when known,
 * the user and deposit it concerns. Extra fields go into the {@code data} key as JSON.
 *
 * <pre>
 * -- Full history of one deposit
 * fields @timestamp, message, depositId, userId, data
 * | filter depositId = "42"
 * | sort @timestamp asc
 *
 * -- Payout transfers that failed
 * fields @timestamp, message, data
 * | filter level = "ERROR" and message = "payout_transfer_failed"
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_CORRELATION_ID = "correlationId";
    public static final String KEY_USER_ID = "userId";
    public static final String KEY_DEPOSIT_ID = "depositId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_DATA = "data";

    /**
     * Initialize logging context with Lambda request information.
     * Call this at the start of every Lambda invocation.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null && context.getAwsRequestId() != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            ThreadContext.put(KEY_CORRELATION_ID, correlationId);
        }
    }

    /**
     * Set the current function being executed (e.g. "create_deposit").
     */
    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    public static void setUserId(String userId) {
        if (userId != null) {
            ThreadContext.put(KEY_USER_ID, userId);
        }
    }

    public static void setDepositId(long depositId) {
        ThreadContext.put(KEY_DEPOSIT_ID, String.valueOf(depositId));
    }

    /**
     * Clear all logging context. Call at the end of request processing.
     */
    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void warn(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message, t);
        clearDataContext();
    }

    public static void error(String message) {
        logger.error(message);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Create a mutable map with the given key-value pairs. Null values are kept,
     * unlike {@link Map#of}.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
