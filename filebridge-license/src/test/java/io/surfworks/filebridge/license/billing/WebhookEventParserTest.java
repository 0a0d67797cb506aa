package io.surfworks.filebridge.license.billing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WebhookEventParserTest {

    private static final Instant RECEIVED = Instant.parse("2026-03-01T10:00:05Z");
    private static final Instant OCCURRED = Instant.parse("2026-03-01T10:00:00Z");

    private final WebhookEventParser parser = new WebhookEventParser();

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("A complete event is parsed as pending")
    void parse_completeEvent() throws Exception {
        byte[] body = Webhooks.event("evt_1", SubscriptionEventType.SUBSCRIPTION_CREATED, OCCURRED)
            .subscription("sub_1")
            .user("user_1")
            .plan("filebridge_pro_monthly")
            .expiresAt(Instant.parse("2026-04-01T10:00:00Z"))
            .with("status", "trialing")
            .body();

        SubscriptionEvent event = parser.parse(body, RECEIVED);

        assertEquals("evt_1", event.eventId());
        assertEquals(SubscriptionEventType.SUBSCRIPTION_CREATED, event.eventType().orElseThrow());
        assertEquals("sub_1", event.subscriptionId());
        assertEquals("user_1", event.userId());
        assertEquals("filebridge_pro_monthly", event.planId());
        assertEquals(OCCURRED, event.occurredAt());
        assertEquals(Instant.parse("2026-04-01T10:00:00Z"), event.periodEnd());
        assertEquals("trialing", event.providerStatus());
        assertEquals(EventStatus.PENDING, event.status());
        assertEquals(RECEIVED, event.receivedAt());
        assertFalse(event.immediate());
    }

    @Test
    @DisplayName("Events without an id are identified by their body")
    void parse_noId_hashesBody() throws Exception {
        byte[] body = Webhooks.event(null, SubscriptionEventType.SUBSCRIPTION_RENEWED, OCCURRED)
            .subscription("sub_1")
            .body();

        SubscriptionEvent first = parser.parse(body, RECEIVED);
        SubscriptionEvent again = parser.parse(body.clone(), RECEIVED.plusSeconds(60));

        assertTrue(first.eventId().startsWith("body-"));
        assertEquals(first.eventId(), again.eventId());
    }

    @Test
    @DisplayName("cancelAtPeriodEnd=false means an immediate cancellation")
    void parse_cancelAtPeriodEndFalse_immediate() throws Exception {
        byte[] body = Webhooks.event("evt_2", SubscriptionEventType.SUBSCRIPTION_CANCELLED, OCCURRED)
            .subscription("sub_1")
            .with("cancelAtPeriodEnd", false)
            .body();

        assertTrue(parser.parse(body, RECEIVED).immediate());
    }

    @Test
    @DisplayName("Unknown event types parse but map to no handled type")
    void parse_unknownType_kept() throws Exception {
        SubscriptionEvent event = parser.parse(json(
            "{\"id\":\"evt_3\",\"type\":\"invoice.paid\",\"timestamp\":\"2026-03-01T10:00:00Z\","
                + "\"data\":{\"subscriptionId\":\"sub_1\"}}"), RECEIVED);

        assertEquals("invoice.paid", event.type());
        assertTrue(event.eventType().isEmpty());
    }

    @Test
    @DisplayName("Bodies missing required fields are rejected")
    void parse_invalid_throws() {
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json("not json"), RECEIVED));
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json("[1,2]"), RECEIVED));
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json(
            "{\"timestamp\":\"2026-03-01T10:00:00Z\",\"data\":{\"subscriptionId\":\"sub_1\"}}"), RECEIVED));
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json(
            "{\"type\":\"subscription.renewed\",\"timestamp\":\"2026-03-01T10:00:00Z\"}"), RECEIVED));
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json(
            "{\"type\":\"subscription.renewed\",\"timestamp\":\"2026-03-01T10:00:00Z\",\"data\":{}}"), RECEIVED));
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json(
            "{\"type\":\"subscription.renewed\",\"data\":{\"subscriptionId\":\"sub_1\"}}"), RECEIVED));
        assertThrows(InvalidWebhookPayloadException.class, () -> parser.parse(json(
            "{\"type\":\"subscription.renewed\",\"timestamp\":\"yesterday\",\"data\":{\"subscriptionId\":\"sub_1\"}}"),
            RECEIVED));
    }
}
