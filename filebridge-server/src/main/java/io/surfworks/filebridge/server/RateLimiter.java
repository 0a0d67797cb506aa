package io.surfworks.filebridge.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-window request counter per client.
 *
 * <p>Windows are aligned to the epoch, so every client's window starts and ends at the same
 * instants. Counters from earlier windows are dropped as new windows begin.
 */
public class RateLimiter {

    private final int limit;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public RateLimiter(int limit, Duration window, Clock clock) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.limit = limit;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Count one request from {@code client}.
     *
     * @return whether the request is within the limit
     */
    public boolean tryAcquire(String client) {
        long current = windowIndex(clock.instant());
        counters.values().removeIf(counter -> counter.window < current);
        Counter counter = counters.compute(client, (key, existing) ->
            existing == null || existing.window != current ? new Counter(current, 1) : new Counter(current, existing.count + 1));
        return counter.count <= limit;
    }

    /**
     * Time until the current window ends, rounded up to whole seconds.
     */
    public Duration retryAfter() {
        Instant now = clock.instant();
        Instant windowEnd = Instant.ofEpochMilli((windowIndex(now) + 1) * window.toMillis());
        long millis = Duration.between(now, windowEnd).toMillis();
        return Duration.ofSeconds(Math.max(1, (millis + 999) / 1000));
    }

    public int limit() {
        return limit;
    }

    public Duration window() {
        return window;
    }

    private long windowIndex(Instant now) {
        return Math.floorDiv(now.toEpochMilli(), window.toMillis());
    }

    private record Counter(long window, int count) {
    }
}
