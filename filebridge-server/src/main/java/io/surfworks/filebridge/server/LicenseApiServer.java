package io.surfworks.filebridge.server;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.surfworks.filebridge.license.FeatureGate;
import io.surfworks.filebridge.license.InMemoryEntitlementStore;
import io.surfworks.filebridge.license.JsonFiles;
import io.surfworks.filebridge.license.LicenseKeyCodec;
import io.surfworks.filebridge.license.MachineRegistry;
import io.surfworks.filebridge.license.RemoteUnavailableException;
import io.surfworks.filebridge.license.Tier;
import io.surfworks.filebridge.license.UsageTracker;
import io.surfworks.filebridge.license.ValidationRequest;
import io.surfworks.filebridge.license.ValidationResponse;
import io.surfworks.filebridge.license.billing.BillingStoreException;
import io.surfworks.filebridge.license.billing.FileBillingStore;
import io.surfworks.filebridge.license.billing.InvalidWebhookPayloadException;
import io.surfworks.filebridge.license.billing.LicenseAuthority;
import io.surfworks.filebridge.license.billing.LicenseUsage;
import io.surfworks.filebridge.license.billing.WebhookReceipt;
import io.surfworks.filebridge.license.billing.WebhookReconciler;
import io.surfworks.filebridge.license.billing.WebhookSignatureException;
import io.surfworks.filebridge.license.billing.WebhookSignatureVerifier;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP license API.
 *
 * <ul>
 *   <li>{@code GET  /api/health}</li>
 *   <li>{@code POST /api/validate-license}</li>
 *   <li>{@code POST /api/generate-license} (admin)</li>
 *   <li>{@code POST /api/revoke-license} (admin)</li>
 *   <li>{@code GET  /api/license/{key}/usage} (admin)</li>
 *   <li>{@code POST /api/webhooks/{provider}}</li>
 * </ul>
 *
 * <p>Admin endpoints require {@code Authorization: Bearer <token>} when an admin token is set.
 * A webhook is answered 200 only after its transition is committed; 503 asks the provider to
 * redeliver.
 *
 * <p>Requests are rate limited per client IP: every {@code /api/} endpoint shares one budget
 * and {@code validate-license} has a tighter one on top. Over either limit the answer is 429 with
 * a {@code Retry-After} header. Health checks and signed webhooks are not counted.
 */
public class LicenseApiServer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LicenseApiServer.class.getName());

    public static final String ENV_PORT = "FILEBRIDGE_API_PORT";
    public static final String ENV_DATA_DIR = "FILEBRIDGE_DATA_DIR";
    public static final String ENV_LICENSE_SECRET = "FILEBRIDGE_LICENSE_SECRET";
    public static final String ENV_WEBHOOK_SECRET = "FILEBRIDGE_WEBHOOK_SECRET";
    public static final String ENV_ADMIN_TOKEN = "FILEBRIDGE_ADMIN_TOKEN";
    public static final int DEFAULT_PORT = 3001;

    static final Set<String> SIGNATURE_HEADERS = Set.of("X-Webhook-Signature", "X-Dodo-Signature");

    public static final int API_RATE_LIMIT = 100;
    public static final Duration API_RATE_WINDOW = Duration.ofMinutes(15);
    public static final int VALIDATE_RATE_LIMIT = 20;
    public static final Duration VALIDATE_RATE_WINDOW = Duration.ofMinutes(1);

    private final HttpServer server;
    private final ExecutorService executor;
    private final RateLimiter apiLimiter;
    private final RateLimiter validateLimiter;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final LicenseAuthority authority;
    private final WebhookReconciler reconciler;
    private final Set<String> providers;
    private final String adminToken;

    public LicenseApiServer(InetSocketAddress address, LicenseAuthority authority, WebhookReconciler reconciler,
                            Set<String> providers, String adminToken) throws IOException {
        this(address, authority, reconciler, providers, adminToken,
            new RateLimiter(API_RATE_LIMIT, API_RATE_WINDOW, Clock.systemUTC()),
            new RateLimiter(VALIDATE_RATE_LIMIT, VALIDATE_RATE_WINDOW, Clock.systemUTC()));
    }

    public LicenseApiServer(InetSocketAddress address, LicenseAuthority authority, WebhookReconciler reconciler,
                            Set<String> providers, String adminToken,
                            RateLimiter apiLimiter, RateLimiter validateLimiter) throws IOException {
        this.apiLimiter = apiLimiter;
        this.validateLimiter = validateLimiter;
        this.authority = authority;
        this.reconciler = reconciler;
        this.providers = Set.copyOf(providers);
        this.adminToken = adminToken == null || adminToken.isBlank() ? null : adminToken;

        this.server = HttpServer.create(address, 0);
        server.createContext("/api/health", exchange -> handle(exchange, "GET", List.of(), this::health));
        server.createContext("/api/validate-license",
            exchange -> handle(exchange, "POST", List.of(apiLimiter, validateLimiter), this::validate));
        server.createContext("/api/generate-license", exchange -> handle(exchange, "POST", List.of(apiLimiter), this::generate));
        server.createContext("/api/revoke-license", exchange -> handle(exchange, "POST", List.of(apiLimiter), this::revoke));
        server.createContext("/api/license/", exchange -> handle(exchange, "GET", List.of(apiLimiter), this::usage));
        server.createContext("/api/webhooks/", exchange -> handle(exchange, "POST", List.of(), this::webhook));
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "filebridge-license-api");
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executor);
    }

    public static void main(String[] args) throws IOException {
        Map<String, String> env = System.getenv();
        String licenseSecret = requireEnv(env, ENV_LICENSE_SECRET);
        String webhookSecret = requireEnv(env, ENV_WEBHOOK_SECRET);
        int port = env.containsKey(ENV_PORT) ? Integer.parseInt(env.get(ENV_PORT)) : DEFAULT_PORT;
        Path dataDir = Path.of(env.getOrDefault(ENV_DATA_DIR,
            System.getProperty("user.home") + "/.local/share/filebridge-license"));

        Clock clock = Clock.systemUTC();
        LicenseKeyCodec codec = LicenseKeyCodec.withSecret(licenseSecret);
        FileBillingStore store = new FileBillingStore(dataDir);
        InMemoryEntitlementStore verdicts = new InMemoryEntitlementStore();
        LicenseAuthority authority = new LicenseAuthority(store, codec, FeatureGate.STANDARD,
            new MachineRegistry(dataDir, clock), new UsageTracker(dataDir, clock), clock,
            verdicts, LicenseAuthority.DEFAULT_VERDICT_TTL);
        WebhookReconciler reconciler = WebhookReconciler.builder(store, new WebhookSignatureVerifier(webhookSecret), codec)
            .entitlementCache(verdicts)
            .clock(clock)
            .build();

        LicenseApiServer api = new LicenseApiServer(new InetSocketAddress(port), authority, reconciler,
            Set.of("dodo-payments"), env.get(ENV_ADMIN_TOKEN));
        BillingMaintenance maintenance = new BillingMaintenance(reconciler);

        api.start();
        maintenance.start(Duration.ofMinutes(15));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            maintenance.close();
            api.close();
        }, "filebridge-license-api-shutdown"));
    }

    public void start() {
        server.start();
        LOG.info("License API listening on port " + port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            server.stop(1);
            executor.shutdownNow();
        }
    }

    // ========== Endpoints ==========

    private Response health(HttpExchange exchange, byte[] body) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("status", "healthy");
        json.put("timestamp", Instant.now().toString());
        json.put("version", "1.0.0");
        return Response.json(200, json);
    }

    private Response validate(HttpExchange exchange, byte[] body) throws RemoteUnavailableException {
        JsonObject json = parseBody(body);
        String licenseKey = string(json, "licenseKey");
        String fingerprint = string(json, "machineFingerprint");
        if (fingerprint == null) {
            fingerprint = string(json, "machineId");
        }
        if (licenseKey == null) {
            return Response.json(400, ValidationResponse.invalid(ValidationResponse.INVALID_REQUEST,
                "licenseKey is required"));
        }
        ValidationResponse verdict = authority.validate(
            new ValidationRequest(licenseKey, fingerprint, string(json, "feature")));
        return Response.json(200, verdict);
    }

    private Response generate(HttpExchange exchange, byte[] body) throws RemoteUnavailableException {
        if (!isAdmin(exchange)) {
            return Response.error(401, "Admin token required");
        }
        JsonObject json = parseBody(body);
        String userId = string(json, "userId");
        String tierName = string(json, "tier");
        if (userId == null || tierName == null || !Set.of("FREE", "PRO", "ENTERPRISE").contains(tierName)) {
            return Response.error(400, "Invalid generation request format");
        }
        Instant expiresAt;
        try {
            String expires = string(json, "expiresAt");
            expiresAt = expires != null ? Instant.parse(expires) : null;
        } catch (DateTimeParseException e) {
            return Response.error(400, "expiresAt must be an ISO-8601 instant");
        }

        Tier tier = Tier.valueOf(tierName);
        String key = authority.generate(userId, tier, string(json, "subscriptionId"), expiresAt);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("licenseKey", key);
        response.put("tier", tier.name());
        response.put("expiresAt", expiresAt != null ? expiresAt.toString() : null);
        return Response.json(200, response);
    }

    private Response revoke(HttpExchange exchange, byte[] body) throws RemoteUnavailableException {
        if (!isAdmin(exchange)) {
            return Response.error(401, "Admin token required");
        }
        String licenseKey = string(parseBody(body), "licenseKey");
        if (licenseKey == null) {
            return Response.error(400, "License key is required");
        }
        if (!authority.revoke(licenseKey)) {
            return Response.error(404, "No active license with that key");
        }
        return Response.json(200, Map.of("success", true, "message", "License revoked successfully"));
    }

    private Response usage(HttpExchange exchange, byte[] body) throws RemoteUnavailableException {
        if (!isAdmin(exchange)) {
            return Response.error(401, "Admin token required");
        }
        // /api/license/{key}/usage
        String path = exchange.getRequestURI().getPath();
        String[] parts = path.split("/");
        if (parts.length != 5 || !"usage".equals(parts[4])) {
            return Response.error(404, "Not found");
        }
        Optional<LicenseUsage> usage = authority.usage(parts[3]);
        if (usage.isEmpty()) {
            return Response.error(404, "License not found");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("usage", usage.get());
        return Response.json(200, response);
    }

    private Response webhook(HttpExchange exchange, byte[] body) {
        String provider = exchange.getRequestURI().getPath().substring("/api/webhooks/".length());
        if (!providers.contains(provider)) {
            return Response.error(404, "Unknown webhook provider " + provider);
        }

        String signature = null;
        for (String header : SIGNATURE_HEADERS) {
            signature = exchange.getRequestHeaders().getFirst(header);
            if (signature != null) {
                break;
            }
        }

        WebhookReceipt receipt;
        try {
            receipt = reconciler.receive(body, signature);
        } catch (WebhookSignatureException e) {
            LOG.warning("Rejected " + provider + " webhook: " + e.getMessage());
            return Response.error(401, "Webhook verification failed");
        } catch (InvalidWebhookPayloadException e) {
            LOG.warning("Rejected " + provider + " webhook: " + e.getMessage());
            return Response.error(400, e.getMessage());
        } catch (BillingStoreException e) {
            LOG.log(Level.SEVERE, "Could not record " + provider + " webhook", e);
            return Response.error(503, "Webhook could not be recorded; retry later");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", receipt.acknowledged());
        response.put("eventId", receipt.eventId());
        response.put("outcome", receipt.outcome().name());
        response.put("message", receipt.message());
        return Response.json(receipt.acknowledged() ? 200 : 503, response);
    }

    // ========== Plumbing ==========

    @FunctionalInterface
    private interface Endpoint {
        Response handle(HttpExchange exchange, byte[] body) throws RemoteUnavailableException;
    }

    private record Response(int status, String body) {
        static Response json(int status, Object value) {
            return new Response(status, JsonFiles.GSON.toJson(value));
        }

        static Response error(int status, String error) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("success", false);
            json.put("error", error);
            return json(status, json);
        }
    }

    private void handle(HttpExchange exchange, String method, List<RateLimiter> limiters, Endpoint endpoint)
            throws IOException {
        try {
            Response response;
            Optional<RateLimiter> exceeded = exceededLimit(exchange, limiters);
            if (exceeded.isPresent()) {
                exchange.getResponseHeaders().set("Retry-After", Long.toString(exceeded.get().retryAfter().toSeconds()));
                response = Response.error(429, "Too many requests from this IP, please try again later");
            } else if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
                response = Response.error(405, "Method not allowed");
            } else {
                byte[] body;
                try (InputStream in = exchange.getRequestBody()) {
                    body = in.readAllBytes();
                }
                response = dispatch(exchange, endpoint, body);
            }
            byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        } finally {
            exchange.close();
        }
    }

    /**
     * Counts the request against every limiter and returns the first one it exceeds.
     */
    private static Optional<RateLimiter> exceededLimit(HttpExchange exchange, List<RateLimiter> limiters) {
        String client = exchange.getRemoteAddress().getAddress().getHostAddress();
        RateLimiter exceeded = null;
        for (RateLimiter limiter : limiters) {
            if (!limiter.tryAcquire(client) && exceeded == null) {
                exceeded = limiter;
            }
        }
        if (exceeded != null) {
            LOG.warning("Rate limit of " + exceeded.limit() + " per " + exceeded.window() + " exceeded for "
                + client + " on " + exchange.getRequestURI().getPath());
        }
        return Optional.ofNullable(exceeded);
    }

    private static Response dispatch(HttpExchange exchange, Endpoint endpoint, byte[] body) {
        try {
            return endpoint.handle(exchange, body);
        } catch (IllegalArgumentException e) {
            return Response.error(400, e.getMessage());
        } catch (RemoteUnavailableException e) {
            LOG.log(Level.SEVERE, exchange.getRequestURI().getPath() + " failed", e);
            return Response.error(503, "License records unavailable");
        } catch (RuntimeException e) {
            LOG.log(Level.SEVERE, exchange.getRequestURI().getPath() + " failed", e);
            return Response.error(500, "Internal server error");
        }
    }

    private boolean isAdmin(HttpExchange exchange) {
        if (adminToken == null) {
            return true;
        }
        String header = exchange.getRequestHeaders().getFirst("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            return false;
        }
        return MessageDigest.isEqual(
            header.substring("Bearer ".length()).getBytes(StandardCharsets.UTF_8),
            adminToken.getBytes(StandardCharsets.UTF_8));
    }

    private static JsonObject parseBody(byte[] body) {
        try {
            JsonElement element = JsonParser.parseString(new String(body, StandardCharsets.UTF_8));
            if (!element.isJsonObject()) {
                throw new IllegalArgumentException("Request body must be a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Request body is not valid JSON");
        }
    }

    private static String string(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static String requireEnv(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " must be set");
        }
        return value;
    }
}
