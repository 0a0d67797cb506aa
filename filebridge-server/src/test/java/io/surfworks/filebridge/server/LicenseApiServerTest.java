package io.surfworks.filebridge.server;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.surfworks.filebridge.license.AccessDecision;
import io.surfworks.filebridge.license.ActivationResult;
import io.surfworks.filebridge.license.DenialCode;
import io.surfworks.filebridge.license.EntitlementContext;
import io.surfworks.filebridge.license.FeatureGate;
import io.surfworks.filebridge.license.HttpLicenseServerClient;
import io.surfworks.filebridge.license.JsonFiles;
import io.surfworks.filebridge.license.LicenseConfig;
import io.surfworks.filebridge.license.LicenseKeyCodec;
import io.surfworks.filebridge.license.MachineFingerprint;
import io.surfworks.filebridge.license.MachineRegistry;
import io.surfworks.filebridge.license.RemoteUnavailableException;
import io.surfworks.filebridge.license.Tier;
import io.surfworks.filebridge.license.UsageTracker;
import io.surfworks.filebridge.license.ValidationRequest;
import io.surfworks.filebridge.license.ValidationResponse;
import io.surfworks.filebridge.license.billing.InMemoryBillingStore;
import io.surfworks.filebridge.license.billing.License;
import io.surfworks.filebridge.license.billing.LicenseAuthority;
import io.surfworks.filebridge.license.billing.WebhookReconciler;
import io.surfworks.filebridge.license.billing.WebhookSignatureVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the license API on an ephemeral port against in-memory billing records.
 */
class LicenseApiServerTest {

    private static final String LICENSE_SECRET = "api-test-secret";
    private static final String WEBHOOK_SECRET = "whsec_api_test";
    private static final String ADMIN_TOKEN = "admin-token";

    @TempDir
    Path dataDir;

    @TempDir
    Path clientDir;

    private final HttpClient http = HttpClient.newHttpClient();
    private final WebhookSignatureVerifier signer = new WebhookSignatureVerifier(WEBHOOK_SECRET);
    private final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);

    private InMemoryBillingStore store;
    private LicenseAuthority authority;
    private WebhookReconciler reconciler;
    private LicenseApiServer api;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        Clock clock = Clock.systemUTC();
        LicenseKeyCodec codec = LicenseKeyCodec.withSecret(LICENSE_SECRET);
        store = new InMemoryBillingStore();
        authority = new LicenseAuthority(store, codec, FeatureGate.STANDARD,
            new MachineRegistry(dataDir, clock), new UsageTracker(dataDir, clock), clock);
        reconciler = WebhookReconciler.builder(store, signer, codec)
            .clock(clock)
            .build();

        api = new LicenseApiServer(new InetSocketAddress("127.0.0.1", 0), authority, reconciler,
            Set.of("dodo-payments"), ADMIN_TOKEN);
        api.start();
        baseUrl = "http://127.0.0.1:" + api.port();
    }

    @AfterEach
    void tearDown() {
        api.close();
    }

    // ============ Helpers ============

    private HttpResponse<String> get(String path, String token) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path)).GET();
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, Map<String, String> headers) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        headers.forEach(request::header);
        return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> admin(String path, String body) throws Exception {
        return post(path, body, Map.of("Authorization", "Bearer " + ADMIN_TOKEN));
    }

    private static JsonObject json(HttpResponse<String> response) {
        return JsonParser.parseString(response.body()).getAsJsonObject();
    }

    private String generateKey(Tier tier) throws Exception {
        String body = String.format("{\"userId\": \"user_1\", \"tier\": \"%s\", \"expiresAt\": \"%s\"}",
            tier.name(), now.plus(30, ChronoUnit.DAYS));
        HttpResponse<String> response = admin("/api/generate-license", body);
        assertEquals(200, response.statusCode(), response.body());
        return json(response).get("licenseKey").getAsString();
    }

    private String webhookBody(String id, String type, Map<String, Object> data) {
        JsonObject root = new JsonObject();
        root.addProperty("id", id);
        root.addProperty("type", type);
        root.addProperty("timestamp", now.toString());
        root.add("data", JsonFiles.GSON.toJsonTree(data));
        return JsonFiles.GSON.toJson(root);
    }

    private HttpResponse<String> deliver(String body) throws Exception {
        String signature = signer.sign(body.getBytes(StandardCharsets.UTF_8));
        return post("/api/webhooks/dodo-payments", body, Map.of("X-Dodo-Signature", signature));
    }

    private String licenseFor(String subscriptionId) throws Exception {
        return store.read(state -> state.licenses().values().stream()
            .filter(license -> subscriptionId.equals(license.subscriptionId()))
            .map(License::licenseKey)
            .findFirst()
            .orElseThrow());
    }

    // ============ Health and routing ============

    @Test
    @DisplayName("Health check answers without a token")
    void health_ok() throws Exception {
        HttpResponse<String> response = get("/api/health", null);

        assertEquals(200, response.statusCode());
        assertEquals("healthy", json(response).get("status").getAsString());
    }

    @Test
    @DisplayName("Wrong method is refused with 405")
    void health_post_methodNotAllowed() throws Exception {
        assertEquals(405, post("/api/health", "{}", Map.of()).statusCode());
    }

    @Test
    @DisplayName("Closing the server stops its request threads")
    void close_stopsRequestThreads() throws Exception {
        LicenseApiServer other = new LicenseApiServer(new InetSocketAddress("127.0.0.1", 0), authority, reconciler,
            Set.of("dodo-payments"), ADMIN_TOKEN);
        other.start();
        HttpRequest health = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + other.port() + "/api/health"))
            .GET()
            .build();
        assertEquals(200, http.send(health, HttpResponse.BodyHandlers.ofString()).statusCode());

        api.close();
        other.close();

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (requestThreads() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
        assertEquals(0, requestThreads());
    }

    private static long requestThreads() {
        return Thread.getAllStackTraces().keySet().stream()
            .filter(thread -> thread.getName().equals("filebridge-license-api") && thread.isAlive())
            .count();
    }

    // ============ Validation ============

    @Test
    @DisplayName("A generated key validates over HTTP with its tier and features")
    void validate_generatedKey_valid() throws Exception {
        String key = generateKey(Tier.PRO);
        var client = new HttpLicenseServerClient(baseUrl, Duration.ofSeconds(5));

        ValidationResponse response = client.validate(
            new ValidationRequest(key, MachineFingerprint.of("laptop"), "git_log"));

        assertTrue(response.valid());
        assertEquals(Tier.PRO, response.tier());
        assertTrue(response.features().contains("git_log"));
        assertEquals(now.plus(30, ChronoUnit.DAYS), response.expiresAt());
    }

    @Test
    @DisplayName("Unknown and forged keys are reported invalid, not as server errors")
    void validate_unknownKey_invalid() throws Exception {
        var client = new HttpLicenseServerClient(baseUrl, Duration.ofSeconds(5));

        ValidationResponse unknown = client.validate(new ValidationRequest(
            LicenseKeyCodec.withSecret(LICENSE_SECRET).generate(Tier.PRO, "user_9"), null, null));
        ValidationResponse forged = client.validate(new ValidationRequest(
            LicenseKeyCodec.withSecret("someone-else").generate(Tier.PRO, "user_9"), null, null));

        assertFalse(unknown.valid());
        assertEquals(ValidationResponse.LICENSE_NOT_FOUND, unknown.code());
        assertFalse(forged.valid());
        assertEquals(ValidationResponse.INVALID_FORMAT, forged.code());
    }

    @Test
    @DisplayName("A request without a key is a 400 with a validation body")
    void validate_missingKey_badRequest() throws Exception {
        HttpResponse<String> response = post("/api/validate-license", "{}", Map.of());

        assertEquals(400, response.statusCode());
        assertEquals(ValidationResponse.INVALID_REQUEST, json(response).get("code").getAsString());
    }

    @Test
    @DisplayName("A body that is not JSON is a 400")
    void validate_garbage_badRequest() throws Exception {
        assertEquals(400, post("/api/validate-license", "not json", Map.of()).statusCode());
    }

    // ============ Admin endpoints ============

    @Test
    @DisplayName("Admin endpoints require the bearer token")
    void admin_withoutToken_unauthorized() throws Exception {
        assertEquals(401, post("/api/generate-license", "{\"userId\": \"u\", \"tier\": \"PRO\"}", Map.of()).statusCode());
        assertEquals(401, post("/api/generate-license", "{\"userId\": \"u\", \"tier\": \"PRO\"}",
            Map.of("Authorization", "Bearer wrong")).statusCode());
        assertEquals(401, post("/api/revoke-license", "{\"licenseKey\": \"x\"}", Map.of()).statusCode());
        assertEquals(401, get("/api/license/x/usage", null).statusCode());
    }

    @Test
    @DisplayName("Generation rejects unknown tiers")
    void generate_unknownTier_badRequest() throws Exception {
        HttpResponse<String> response = admin("/api/generate-license", "{\"userId\": \"u\", \"tier\": \"GOLD\"}");

        assertEquals(400, response.statusCode());
    }

    @Test
    @DisplayName("A revoked key stops validating; revoking it again is a 404")
    void revoke_thenValidate_revoked() throws Exception {
        String key = generateKey(Tier.PRO);

        HttpResponse<String> first = admin("/api/revoke-license", "{\"licenseKey\": \"" + key + "\"}");
        HttpResponse<String> second = admin("/api/revoke-license", "{\"licenseKey\": \"" + key + "\"}");

        assertEquals(200, first.statusCode());
        assertEquals(404, second.statusCode());
        ValidationResponse response = new HttpLicenseServerClient(baseUrl, Duration.ofSeconds(5))
            .validate(new ValidationRequest(key, null, null));
        assertEquals(ValidationResponse.LICENSE_REVOKED, response.code());
    }

    @Test
    @DisplayName("Usage lists bound machines and today's metered calls")
    void usage_afterValidation_reportsMachineAndCalls() throws Exception {
        String key = generateKey(Tier.PRO);
        var client = new HttpLicenseServerClient(baseUrl, Duration.ofSeconds(5));
        client.validate(new ValidationRequest(key, MachineFingerprint.of("laptop"), "git_log"));

        HttpResponse<String> response = get("/api/license/" + key + "/usage", ADMIN_TOKEN);
        HttpResponse<String> unknown = get("/api/license/PRO-00000000-00000000-AAAAAAAAAAAAAAAA-0000/usage", ADMIN_TOKEN);

        assertEquals(200, response.statusCode(), response.body());
        assertTrue(response.body().contains(MachineFingerprint.of("laptop")));
        assertEquals(404, unknown.statusCode());
    }

    // ============ Webhooks ============

    @Test
    @DisplayName("Webhooks for unknown providers are a 404")
    void webhook_unknownProvider_notFound() throws Exception {
        assertEquals(404, post("/api/webhooks/stripe", "{}", Map.of()).statusCode());
    }

    @Test
    @DisplayName("A webhook with a bad signature is a 401 and changes nothing")
    void webhook_badSignature_unauthorized() throws Exception {
        String body = webhookBody("evt_1", "subscription.created", Map.of(
            "subscriptionId", "sub_1", "userId", "user_1", "planId", "filebridge_pro_monthly",
            "expiresAt", now.plus(30, ChronoUnit.DAYS).toString()));

        HttpResponse<String> response = post("/api/webhooks/dodo-payments", body,
            Map.of("X-Webhook-Signature", "v1=deadbeef"));

        assertEquals(401, response.statusCode());
        int recorded = store.read(state -> state.inbox().size());
        assertEquals(0, recorded);
    }

    @Test
    @DisplayName("A signed event without a subscription is a 400")
    void webhook_missingSubscription_badRequest() throws Exception {
        HttpResponse<String> response = deliver(webhookBody("evt_1", "subscription.created", Map.of("userId", "u")));

        assertEquals(400, response.statusCode());
    }

    @Test
    @DisplayName("Redelivering an acknowledged event is acknowledged as a duplicate")
    void webhook_redelivery_duplicate() throws Exception {
        String body = webhookBody("evt_1", "subscription.created", Map.of(
            "subscriptionId", "sub_1", "userId", "user_1", "planId", "filebridge_pro_monthly",
            "expiresAt", now.plus(30, ChronoUnit.DAYS).toString()));

        HttpResponse<String> first = deliver(body);
        HttpResponse<String> second = deliver(body);

        assertEquals(200, first.statusCode(), first.body());
        assertEquals("APPLIED", json(first).get("outcome").getAsString());
        assertEquals(200, second.statusCode());
        assertEquals("DUPLICATE", json(second).get("outcome").getAsString());
    }

    // ============ Rate limiting ============

    private LicenseApiServer limitedServer(int apiLimit, int validateLimit) throws Exception {
        Clock fixed = Clock.fixed(now, ZoneOffset.UTC);
        LicenseApiServer limited = new LicenseApiServer(new InetSocketAddress("127.0.0.1", 0), authority, reconciler,
            Set.of("dodo-payments"), ADMIN_TOKEN,
            new RateLimiter(apiLimit, LicenseApiServer.API_RATE_WINDOW, fixed),
            new RateLimiter(validateLimit, LicenseApiServer.VALIDATE_RATE_WINDOW, fixed));
        limited.start();
        return limited;
    }

    @Test
    @DisplayName("Validation over its per-IP limit is answered 429 and the client treats it as unavailable")
    void validate_overRateLimit_tooManyRequests() throws Exception {
        try (LicenseApiServer limited = limitedServer(100, 2)) {
            String url = "http://127.0.0.1:" + limited.port();
            var client = new HttpLicenseServerClient(url, Duration.ofSeconds(5));
            ValidationRequest request = new ValidationRequest(
                LicenseKeyCodec.withSecret(LICENSE_SECRET).generate(Tier.PRO, "user_9"), null, null);

            assertEquals(ValidationResponse.LICENSE_NOT_FOUND, client.validate(request).code());
            assertEquals(ValidationResponse.LICENSE_NOT_FOUND, client.validate(request).code());
            assertThrows(RemoteUnavailableException.class, () -> client.validate(request));

            HttpResponse<String> limitedResponse = http.send(
                HttpRequest.newBuilder(URI.create(url + "/api/validate-license"))
                    .POST(HttpRequest.BodyPublishers.ofString("{}"))
                    .build(),
                HttpResponse.BodyHandlers.ofString());
            assertEquals(429, limitedResponse.statusCode());
            assertTrue(limitedResponse.headers().firstValue("Retry-After").isPresent());
            assertFalse(json(limitedResponse).get("success").getAsBoolean());

            HttpResponse<String> usage = http.send(
                HttpRequest.newBuilder(URI.create(url + "/api/license/unknown/usage"))
                    .header("Authorization", "Bearer " + ADMIN_TOKEN)
                    .GET()
                    .build(),
                HttpResponse.BodyHandlers.ofString());
            assertEquals(404, usage.statusCode(), "other endpoints keep their own budget");
        }
    }

    @Test
    @DisplayName("All API endpoints share one per-IP budget that health checks do not use")
    void api_overRateLimit_tooManyRequests() throws Exception {
        try (LicenseApiServer limited = limitedServer(2, 20)) {
            String url = "http://127.0.0.1:" + limited.port();
            HttpRequest usage = HttpRequest.newBuilder(URI.create(url + "/api/license/unknown/usage"))
                .header("Authorization", "Bearer " + ADMIN_TOKEN)
                .GET()
                .build();
            HttpRequest health = HttpRequest.newBuilder(URI.create(url + "/api/health")).GET().build();

            assertEquals(404, http.send(usage, HttpResponse.BodyHandlers.ofString()).statusCode());
            assertEquals(404, http.send(usage, HttpResponse.BodyHandlers.ofString()).statusCode());
            assertEquals(429, http.send(usage, HttpResponse.BodyHandlers.ofString()).statusCode());
            assertThrows(RemoteUnavailableException.class, () -> new HttpLicenseServerClient(url, Duration.ofSeconds(5))
                .revoke("PRO-00000000-00000000-0000000000000000-0000"));
            for (int i = 0; i < 5; i++) {
                assertEquals(200, http.send(health, HttpResponse.BodyHandlers.ofString()).statusCode());
            }
        }
    }

    // ============ End to end ============

    @Test
    @DisplayName("Purchase, activation and cancellation flow through to the MCP client")
    void subscriptionLifecycle_reachesClient() throws Exception {
        deliver(webhookBody("evt_created", "subscription.created", Map.of(
            "subscriptionId", "sub_1", "userId", "user_1", "planId", "filebridge_pro_monthly",
            "expiresAt", now.plus(30, ChronoUnit.DAYS).toString())));
        String key = licenseFor("sub_1");

        LicenseConfig config = LicenseConfig.builder()
            .configDir(clientDir)
            .validationUrl(baseUrl)
            .revalidationInterval(Duration.ZERO)
            .machineFingerprint(MachineFingerprint.of("laptop"))
            .build();
        try (EntitlementContext license = EntitlementContext.create(config)) {
            ActivationResult activation = license.activate(key);
            assertTrue(activation.success(), activation.error());
            assertEquals(Tier.PRO, activation.tier());
            assertTrue(license.checkFeatureAccess("git_log").allowed());

            HttpResponse<String> cancel = deliver(webhookBody("evt_cancel", "subscription.cancelled", Map.of(
                "subscriptionId", "sub_1", "immediate", true)));
            assertEquals(200, cancel.statusCode(), cancel.body());

            AccessDecision after = license.checkFeatureAccess("git_log");
            assertFalse(after.allowed());
            assertEquals(DenialCode.LICENSE_EXPIRED, after.code());
            assertTrue(license.checkFeatureAccess("read_file").allowed(), "free tools stay available");
        }
    }
}
