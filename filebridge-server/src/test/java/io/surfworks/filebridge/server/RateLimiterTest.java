package io.surfworks.filebridge.server;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RateLimiterTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private final AtomicReference<Instant> time = new AtomicReference<>(T0);
    private final Clock clock = new Clock() {
        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return time.get();
        }
    };

    @Test
    @DisplayName("Requests beyond the limit are refused until the window rolls over")
    void tryAcquire_overLimit_refusedUntilNextWindow() {
        RateLimiter limiter = new RateLimiter(3, Duration.ofMinutes(1), clock);

        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertFalse(limiter.tryAcquire("10.0.0.1"));

        time.set(T0.plusSeconds(59));
        assertFalse(limiter.tryAcquire("10.0.0.1"));

        time.set(T0.plusSeconds(60));
        assertTrue(limiter.tryAcquire("10.0.0.1"));
    }

    @Test
    @DisplayName("Each client has its own budget")
    void tryAcquire_separateClients_independent() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofMinutes(15), clock);

        assertTrue(limiter.tryAcquire("10.0.0.1"));
        assertFalse(limiter.tryAcquire("10.0.0.1"));
        assertTrue(limiter.tryAcquire("10.0.0.2"));
    }

    @Test
    @DisplayName("Retry-After counts whole seconds to the end of the window")
    void retryAfter_midWindow_secondsToWindowEnd() {
        RateLimiter limiter = new RateLimiter(1, Duration.ofMinutes(1), clock);
        time.set(T0.plusMillis(20_500));

        assertEquals(Duration.ofSeconds(40), limiter.retryAfter());
    }

    @Test
    @DisplayName("A limit below one or an empty window is rejected")
    void constructor_badArguments_throws() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, Duration.ofMinutes(1), clock));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(1, Duration.ZERO, clock));
    }
}
