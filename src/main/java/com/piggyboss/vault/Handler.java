package com.piggyboss.vault;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.piggyboss.vault.handlers.AdminHandler;
import com.piggyboss.vault.handlers.VaultHandler;
import com.piggyboss.vault.pojos.RequestBody;
import com.piggyboss.vault.pojos.RequestEvent;
import com.piggyboss.vault.rest.ApiResponse;
import com.piggyboss.vault.rest.ResponseConverter;
import com.piggyboss.vault.rest.RestRouter;
import com.piggyboss.vault.services.FirestoreTokenLedger;
import com.piggyboss.vault.services.FirestoreVaultStore;
import com.piggyboss.vault.services.InMemoryTokenLedger;
import com.piggyboss.vault.services.InMemoryVaultStore;
import com.piggyboss.vault.services.LoggingRewardNotifier;
import com.piggyboss.vault.services.LoggingService;
import com.piggyboss.vault.services.TokenLedger;
import com.piggyboss.vault.services.VaultConfig;
import com.piggyboss.vault.services.VaultException;
import com.piggyboss.vault.services.VaultSettings;
import com.piggyboss.vault.services.VaultStateMachine;
import com.piggyboss.vault.services.VaultStore;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Map;

public class Handler implements RequestHandler<RequestEvent, Object> {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final VaultStateMachine vault;
    private final VaultHandler vaultHandler;
    private final AdminHandler adminHandler;
    private final RestRouter restRouter;

    public Handler() {
        this(createVault(VaultSettings.get()));
    }

    public Handler(VaultStateMachine vault) {
        this.vault = vault;
        this.vaultHandler = new VaultHandler(vault);
        this.adminHandler = new AdminHandler(vault);
        this.restRouter = new RestRouter(vaultHandler, adminHandler);
    }

    static VaultStateMachine createVault(VaultSettings settings) {
        try {
            VaultConfig config = VaultConfig.fromSettings(settings);
            boolean firestoreStorage = VaultSettings.BACKEND_FIRESTORE.equals(settings.getStorage());
            boolean firestoreLedger = VaultSettings.BACKEND_FIRESTORE.equals(settings.getLedger());
            Firestore db = firestoreStorage || firestoreLedger ? firestore() : null;

            VaultStore store = firestoreStorage ? new FirestoreVaultStore(db) : new InMemoryVaultStore();
            TokenLedger ledger = firestoreLedger
                    ? new FirestoreTokenLedger(db)
                    : new InMemoryTokenLedger(settings.toBaseUnits(settings.getVaultReserve()));
            if (!firestoreStorage || !firestoreLedger) {
                LoggingService.warn("vault_process_local_backend", LoggingService.data(
                        "storage", settings.getStorage(), "ledger", settings.getLedger()));
            }
            return new VaultStateMachine(config, store, ledger, new LoggingRewardNotifier(), Clock.systemUTC());
        } catch (VaultException e) {
            throw new IllegalStateException("Invalid vault settings: " + e.getMessage(), e);
        }
    }

    /**
     * Firestore of the default Firebase app, initialized on first use from the bundled
     * service account key or, without one, from application default credentials.
     */
    static Firestore firestore() {
        if (FirebaseApp.getApps().isEmpty()) {
            try (InputStream key = Handler.class.getResourceAsStream("/serviceAccountKey.json")) {
                GoogleCredentials credentials = key != null
                        ? GoogleCredentials.fromStream(key)
                        : GoogleCredentials.getApplicationDefault();
                FirebaseApp.initializeApp(FirebaseOptions.builder().setCredentials(credentials).build());
            } catch (IOException e) {
                LoggingService.error("firebase_init_failed", e);
                throw new IllegalStateException("Unable to initialize Firebase", e);
            }
        }
        return FirestoreClient.getFirestore();
    }

    public VaultStateMachine getVault() {
        return vault;
    }

    @Override
    public Object handleRequest(RequestEvent event, Context context) {
        LoggingService.initRequest(context);
        try {
            if ("aws.events".equals(event.getSource())) {
                LoggingService.info("warmed_up");
                return "Warmed up!";
            }

            if (event.getHeaders() != null) {
                LoggingService.setCorrelationId(event.getHeaders().get("x-correlation-id"));
            }
            String userId = extractUserId(event);
            LoggingService.setUserId(userId);
            String path = resolvePath(event);

            RequestBody requestBody;
            try {
                requestBody = parseBody(event.getBody());
            } catch (JsonParseException e) {
                LoggingService.warn("request_body_malformed", LoggingService.data("error", e.getMessage()));
                if (RestRouter.isRestPath(path)) {
                    return ApiResponse.badRequestMessage("Malformed JSON body").toLambdaResponse();
                }
                return gson.toJson(Map.of("success", false, "errorCode", "INVALID_INPUT",
                        "errorMessage", "Malformed JSON body"));
            }

            try {
                vault.refresh();
            } catch (VaultException e) {
                String error = gson.toJson(Map.of("success", false, "errorCode", e.getErrorCode().name(),
                        "errorMessage", e.getMessage()));
                return RestRouter.isRestPath(path) ? ResponseConverter.fromHandlerResponse(error).toLambdaResponse() : error;
            }

            if (RestRouter.isRestPath(path)) {
                return handleRest(event, path, userId, requestBody);
            }

            String function = requestBody.getFunction();
            if (function == null || function.isEmpty()) {
                return gson.toJson(Map.of("success", false, "errorCode", "INVALID_INPUT",
                        "errorMessage", "Function is required"));
            }
            LoggingService.setFunction(function);

            if (userId == null && requiresAuthentication(function)) {
                return gson.toJson(Map.of("success", false, "errorMessage", "Unauthorized: Authentication required"));
            }
            if (VaultHandler.handles(function)) {
                return vaultHandler.handleRequest(function, userId, requestBody);
            }
            if (AdminHandler.handles(function)) {
                return adminHandler.handleRequest(function, userId, requestBody);
            }
            return gson.toJson(Map.of("success", false, "errorMessage", "Unknown function: " + function));
        } catch (RuntimeException e) {
            LoggingService.error("handler_exception", e);
            return gson.toJson(Map.of("success", false, "errorMessage",
                    e.getMessage() != null ? e.getMessage() : "Internal server error"));
        } finally {
            LoggingService.clearContext();
        }
    }

    private Map<String, Object> handleRest(RequestEvent event, String path, String userId, RequestBody requestBody) {
        String method = event.getRequestContext() != null && event.getRequestContext().getHttp() != null
                ? event.getRequestContext().getHttp().getMethod()
                : null;
        if (userId == null && !path.startsWith("/api/v1/plans")) {
            return ApiResponse.unauthorizedMessage("Authentication required").toLambdaResponse();
        }
        ApiResponse response = method == null ? null : restRouter.route(method, path, event.getRawQueryString(), userId, requestBody);
        if (response == null) {
            response = ApiResponse.notFoundMessage("No route for " + method + " " + path);
        }
        return response.toLambdaResponse();
    }

    private RequestBody parseBody(String body) {
        if (body == null || body.isBlank()) {
            return new RequestBody();
        }
        RequestBody parsed = gson.fromJson(body, RequestBody.class);
        return parsed != null ? parsed : new RequestBody();
    }

    static String extractUserId(RequestEvent event) {
        if (event.getRequestContext() == null
                || event.getRequestContext().getAuthorizer() == null
                || event.getRequestContext().getAuthorizer().getJwt() == null
                || event.getRequestContext().getAuthorizer().getJwt().getClaims() == null) {
            return null;
        }
        String userId = event.getRequestContext().getAuthorizer().getJwt().getClaims().getUser_id();
        return userId == null || userId.isEmpty() ? null : userId;
    }

    static String resolvePath(RequestEvent event) {
        if (event.getRawPath() != null) {
            return event.getRawPath();
        }
        if (event.getRequestContext() != null && event.getRequestContext().getHttp() != null) {
            return event.getRequestContext().getHttp().getPath();
        }
        return null;
    }

    static boolean requiresAuthentication(String function) {
        return !"list_plans".equals(function) && !"get_plan".equals(function);
    }
}
