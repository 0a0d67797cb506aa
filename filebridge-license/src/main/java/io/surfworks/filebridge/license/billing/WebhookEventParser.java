package io.surfworks.filebridge.license.billing;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;

/**
 * Turns a provider webhook body into a pending {@link SubscriptionEvent}.
 *
 * <p>Expected shape:
 * <pre>{@code
 * {
 *   "id": "evt_123",
 *   "type": "subscription.renewed",
 *   "timestamp": "2026-01-01T00:00:00Z",
 *   "data": {
 *     "subscriptionId": "sub_1", "userId": "user_1", "planId": "filebridge_pro_monthly",
 *     "status": "active", "expiresAt": "2026-02-01T00:00:00Z", "immediate": false
 *   }
 * }
 * }</pre>
 * Bodies without an event id are identified by a hash of the body, so identical redeliveries
 * still deduplicate.
 */
public final class WebhookEventParser {

    public SubscriptionEvent parse(byte[] body, Instant receivedAt) throws InvalidWebhookPayloadException {
        String text = new String(body, StandardCharsets.UTF_8);
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                throw new InvalidWebhookPayloadException("Webhook body is not a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new InvalidWebhookPayloadException("Webhook body is not valid JSON", e);
        }

        String type = string(root, "type");
        if (type == null) {
            throw new InvalidWebhookPayloadException("Webhook has no type");
        }
        if (!root.has("data") || !root.get("data").isJsonObject()) {
            throw new InvalidWebhookPayloadException("Webhook has no data object");
        }
        JsonObject data = root.getAsJsonObject("data");

        String subscriptionId = string(data, "subscriptionId");
        if (subscriptionId == null) {
            throw new InvalidWebhookPayloadException("Webhook has no subscriptionId");
        }
        Instant occurredAt = instant(root, "timestamp");
        if (occurredAt == null) {
            throw new InvalidWebhookPayloadException("Webhook has no timestamp");
        }

        String eventId = string(root, "id");
        if (eventId == null) {
            eventId = string(root, "eventId");
        }
        if (eventId == null) {
            eventId = "body-" + sha256(body);
        }

        boolean immediate = bool(data, "immediate") || (data.has("cancelAtPeriodEnd") && !bool(data, "cancelAtPeriodEnd"));

        return new SubscriptionEvent(
            eventId,
            type,
            subscriptionId,
            string(data, "userId"),
            string(data, "planId"),
            occurredAt,
            instant(data, "expiresAt"),
            immediate,
            string(data, "status"),
            EventStatus.PENDING,
            0,
            receivedAt,
            null,
            null
        );
    }

    private static String string(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) {
            return null;
        }
        String text = value.getAsString();
        return text.isBlank() ? null : text;
    }

    private static boolean bool(JsonObject json, String field) {
        JsonElement value = json.get(field);
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean() && value.getAsBoolean();
    }

    private static Instant instant(JsonObject json, String field) throws InvalidWebhookPayloadException {
        String text = string(json, field);
        if (text == null) {
            return null;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidWebhookPayloadException("Webhook field '" + field + "' is not an ISO-8601 instant", e);
        }
    }

    private static String sha256(byte[] body) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
