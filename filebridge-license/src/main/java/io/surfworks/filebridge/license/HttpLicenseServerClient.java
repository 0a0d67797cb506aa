package io.surfworks.filebridge.license;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LicenseServer} over HTTP/JSON.
 *
 * <p>Endpoints, relative to the base URL:
 * <ul>
 *   <li>{@code POST /api/validate-license} - {@code {licenseKey, machineFingerprint, feature}}</li>
 *   <li>{@code POST /api/generate-license} - {@code {userId, tier, subscriptionId, expiresAt}}</li>
 *   <li>{@code POST /api/revoke-license} - {@code {licenseKey}}</li>
 * </ul>
 *
 * <p>Any 5xx, a 429 rate-limit answer, a transport error or an unparseable body is reported as
 * {@link RemoteUnavailableException}. A 4xx with a {@code valid:false} body is a verdict.
 */
public class HttpLicenseServerClient implements LicenseServer {

    private final URI baseUri;
    private final Duration timeout;
    private final HttpClient httpClient;

    public HttpLicenseServerClient(String baseUrl, Duration timeout) {
        this.baseUri = URI.create(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/");
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public String getServerName() {
        return "FileBridge license API (" + baseUri.getHost() + ")";
    }

    @Override
    public ValidationResponse validate(ValidationRequest request) throws RemoteUnavailableException {
        JsonObject body = new JsonObject();
        body.addProperty("licenseKey", request.licenseKey());
        body.addProperty("machineFingerprint", request.machineFingerprint());
        body.addProperty("feature", request.feature());

        HttpResponse<String> response = post("api/validate-license", body);
        JsonObject json = parseObject(response);

        if (response.statusCode() >= 400 && !json.has("valid")) {
            throw new RemoteUnavailableException("Validation failed (HTTP " + response.statusCode() + ")");
        }

        try {
            return toResponse(json);
        } catch (RuntimeException e) {
            throw new RemoteUnavailableException("Malformed validation response: " + e.getMessage(), e);
        }
    }

    private static ValidationResponse toResponse(JsonObject json) {
        boolean valid = json.has("valid") && json.get("valid").getAsBoolean();
        if (!valid) {
            return ValidationResponse.invalid(
                string(json, "code", ValidationResponse.LICENSE_NOT_FOUND),
                string(json, "error", "License invalid"));
        }

        List<String> features = new ArrayList<>();
        if (json.has("features") && json.get("features").isJsonArray()) {
            for (JsonElement feature : json.getAsJsonArray("features")) {
                features.add(feature.getAsString());
            }
        }

        String expiresAt = string(json, "expiresAt", null);
        return ValidationResponse.valid(
            Tier.fromName(string(json, "tier", null)),
            features,
            expiresAt != null ? Instant.parse(expiresAt) : null);
    }

    @Override
    public String generate(String userId, Tier tier, String subscriptionId, Instant expiresAt)
            throws RemoteUnavailableException {
        JsonObject body = new JsonObject();
        body.addProperty("userId", userId);
        body.addProperty("tier", tier.name());
        body.addProperty("subscriptionId", subscriptionId);
        body.addProperty("expiresAt", expiresAt != null ? expiresAt.toString() : null);

        HttpResponse<String> response = post("api/generate-license", body);
        if (response.statusCode() != 200) {
            throw new RemoteUnavailableException("License generation failed (HTTP " + response.statusCode() + ")");
        }
        String key = string(parseObject(response), "licenseKey", null);
        if (key == null) {
            throw new RemoteUnavailableException("License generation returned no key");
        }
        return key;
    }

    @Override
    public boolean revoke(String licenseKey) throws RemoteUnavailableException {
        JsonObject body = new JsonObject();
        body.addProperty("licenseKey", licenseKey);

        HttpResponse<String> response = post("api/revoke-license", body);
        if (response.statusCode() >= 500) {
            throw new RemoteUnavailableException("Revocation failed (HTTP " + response.statusCode() + ")");
        }
        return response.statusCode() == 200;
    }

    private HttpResponse<String> post(String path, JsonObject body) throws RemoteUnavailableException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(baseUri.resolve(path))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(JsonFiles.GSON.toJson(body)))
            .timeout(timeout)
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteUnavailableException("Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteUnavailableException("Request interrupted", e);
        }

        if (response.statusCode() == 429) {
            String retryAfter = response.headers().firstValue("Retry-After").orElse("?");
            throw new RemoteUnavailableException("License API rate limit reached; retry after " + retryAfter + "s");
        }
        if (response.statusCode() >= 500) {
            throw new RemoteUnavailableException("License API error (HTTP " + response.statusCode() + ")");
        }
        return response;
    }

    private static JsonObject parseObject(HttpResponse<String> response) throws RemoteUnavailableException {
        try {
            JsonElement element = JsonParser.parseString(response.body());
            if (!element.isJsonObject()) {
                throw new RemoteUnavailableException("Unexpected response body (HTTP " + response.statusCode() + ")");
            }
            return element.getAsJsonObject();
        } catch (RuntimeException e) {
            throw new RemoteUnavailableException("Failed to parse response: " + e.getMessage(), e);
        }
    }

    private static String string(JsonObject json, String field, String fallback) {
        if (!json.has(field) || json.get(field).isJsonNull()) {
            return fallback;
        }
        return json.get(field).getAsString();
    }
}
