package com.piggyboss.vault.rest;

import com.google.gson.JsonObject;
import com.piggyboss.vault.TestBase;
import com.piggyboss.vault.handlers.AdminHandler;
import com.piggyboss.vault.handlers.VaultHandler;
import com.piggyboss.vault.pojos.RequestBody;
import com.piggyboss.vault.services.TransferException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Route matching and status codes for the REST surface, backed by a real in-memory vault.
 */
public class RestRouterTest extends TestBase {

    private RestRouter router;

    @BeforeEach
    public void setUp() {
        router = new RestRouter(new VaultHandler(vault), new AdminHandler(vault));
    }

    private ApiResponse createDeposit(String userId, long wholeUnits) {
        RequestBody body = new RequestBody();
        body.setPlanId(PLAN_30);
        body.setAmount(units(wholeUnits));
        return router.route("POST", "/api/v1/deposits", null, userId, body);
    }

    // ============= Matching =============

    @Test
    public void testUnknownRoute_returnsNull() {
        assertNull(router.route("GET", "/api/v1/unknown", null, ALICE, new RequestBody()));
        assertNull(router.route("DELETE", "/api/v1/deposits/1", null, ALICE, new RequestBody()));
    }

    @Test
    public void testMethodMatchIsCaseInsensitive() {
        assertEquals(200, router.route("get", "/api/v1/plans", null, null, null).getStatusCode());
    }

    @Test
    public void testGetPlan_pathParamAndNotFound() {
        ApiResponse found = router.route("GET", "/api/v1/plans/30", null, null, new RequestBody());
        assertEquals(200, found.getStatusCode());
        assertEquals(30, json(found.getBody()).getAsJsonObject("plan").get("planId").getAsInt());

        assertEquals(404, router.route("GET", "/api/v1/plans/7", null, null, new RequestBody()).getStatusCode());
    }

    @Test
    public void testMalformedPathParam_400() {
        ApiResponse response = router.route("GET", "/api/v1/deposits/abc", null, ALICE, new RequestBody());
        assertEquals(400, response.getStatusCode());
        assertTrue(response.getBody().contains("Malformed parameter"));
    }

    // ============= Deposit lifecycle =============

    @Test
    public void testCreateDeposit_201() {
        ApiResponse response = createDeposit(ALICE, 100);
        assertEquals(201, response.getStatusCode());
        assertEquals("OPEN", json(response.getBody()).getAsJsonObject("deposit").get("status").getAsString());
    }

    @Test
    public void testCreateDeposit_outOfRange422() {
        assertEquals(422, createDeposit(ALICE, 1).getStatusCode());
    }

    @Test
    public void testCreateDeposit_transferFailure502() {
        ledger.failTransfersIn(TransferException.Reason.LEDGER_UNAVAILABLE);
        assertEquals(502, createDeposit(ALICE, 100).getStatusCode());
    }

    @Test
    public void testWithdrawLifecycle_statusCodes() {
        createDeposit(ALICE, 1_000);

        assertEquals(403, router.route("POST", "/api/v1/deposits/1/withdraw", null, BOB, new RequestBody()).getStatusCode());
        assertEquals(409, router.route("POST", "/api/v1/deposits/1/withdraw", null, ALICE, new RequestBody()).getStatusCode());

        clock.advanceDays(30);
        ApiResponse withdrawn = router.route("POST", "/api/v1/deposits/1/withdraw", null, ALICE, new RequestBody());
        assertEquals(200, withdrawn.getStatusCode());
        assertEquals("MATURITY", json(withdrawn.getBody()).getAsJsonObject("payout").get("kind").getAsString());

        assertEquals(409, router.route("POST", "/api/v1/deposits/1/emergency-withdraw", null, ALICE, new RequestBody()).getStatusCode());
        assertEquals(404, router.route("GET", "/api/v1/deposits/2", null, ALICE, new RequestBody()).getStatusCode());
    }

    @Test
    public void testListDeposits_statusFromQueryString() {
        createDeposit(ALICE, 100);
        createDeposit(ALICE, 200);
        router.route("POST", "/api/v1/deposits/1/emergency-withdraw", null, ALICE, new RequestBody());

        ApiResponse response = router.route("GET", "/api/v1/deposits", "status=EMERGENCY_WITHDRAWN", ALICE, new RequestBody());

        assertEquals(200, response.getStatusCode());
        assertEquals(1, json(response.getBody()).getAsJsonArray("deposits").size());
    }

    @Test
    public void testInterestAndSummary() {
        createDeposit(ALICE, 1_000);
        clock.advanceDays(3);

        JsonObject interest = json(router.route("GET", "/api/v1/deposits/1/interest", null, ALICE, new RequestBody()).getBody());
        assertNotEquals("0", interest.get("interest").getAsString());

        JsonObject summary = json(router.route("GET", "/api/v1/users/me/summary", null, ALICE, new RequestBody()).getBody());
        assertEquals(1, summary.get("activeCount").getAsInt());
    }

    // ============= Admin =============

    @Test
    public void testAdminRoutes_forbiddenForSavers() {
        RequestBody body = new RequestBody();
        body.setMultiplierBps(12_000);
        assertEquals(403, router.route("PUT", "/api/v1/admin/multiplier", null, ALICE, body).getStatusCode());
        assertEquals(200, router.route("PUT", "/api/v1/admin/multiplier", null, ADMIN, body).getStatusCode());
        assertEquals(403, router.route("GET", "/api/v1/admin/reward-pool", null, ALICE, new RequestBody()).getStatusCode());
    }

    @Test
    public void testAdminSetPlan_pathParamWins() {
        RequestBody body = new RequestBody();
        body.setPlanId(1);
        body.setDurationSeconds(7 * DAY);
        body.setBaseApyBps(500);
        body.setMinAmount(units(1));
        body.setMaxAmount(units(100));

        ApiResponse response = router.route("PUT", "/api/v1/admin/plans/7", null, ADMIN, body);

        assertEquals(200, response.getStatusCode());
        assertEquals(7, json(response.getBody()).getAsJsonObject("plan").get("planId").getAsInt());
    }

    @Test
    public void testAdminEvents_depositFilterFromQuery() {
        createDeposit(ALICE, 100);
        ApiResponse response = router.route("GET", "/api/v1/admin/events", "depositId=1", ADMIN, new RequestBody());
        assertEquals(200, response.getStatusCode());
        assertEquals("DEPOSIT_CREATED", json(response.getBody()).getAsJsonArray("events")
                .get(0).getAsJsonObject().get("type").getAsString());

        assertEquals(400, router.route("GET", "/api/v1/admin/events", "depositId=x", ADMIN, new RequestBody()).getStatusCode());
    }

    // ============= Helpers =============

    @Test
    public void testParseQueryString() {
        assertEquals(Map.of(), RestRouter.parseQueryString(null));
        assertEquals(Map.of("status", "OPEN", "flag", ""), RestRouter.parseQueryString("status=OPEN&flag"));
        assertEquals(Map.of("q", "a b"), RestRouter.parseQueryString("q=a%20b"));
    }

    @Test
    public void testIsRestPath() {
        assertTrue(RestRouter.isRestPath("/api/v1/plans"));
        assertFalse(RestRouter.isRestPath("/"));
        assertFalse(RestRouter.isRestPath(null));
    }
}
