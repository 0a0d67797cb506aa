package io.surfworks.filebridge.license;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class UsageTrackerTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private UsageTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-10T12:00:00Z");
        tracker = new UsageTracker(tempDir, clock);
    }

    @Test
    @DisplayName("New tracker returns zero count")
    void getTodayCount_newTracker_returnsZero() {
        assertEquals(0, tracker.getTodayCount(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("recordUsage increases the count and returns the new value")
    void recordUsage_increasesCount() {
        assertEquals(1, tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file"));
        assertEquals(2, tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file"));
        assertEquals(3, tracker.recordUsage(UsageTracker.ANONYMOUS, "list_files"));

        assertEquals(3, tracker.getTodayCount(UsageTracker.ANONYMOUS));
        assertEquals(Map.of("read_file", 2, "list_files", 1), tracker.getTodayToolCounts(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("Subjects are counted separately")
    void recordUsage_subjectsAreIsolated() {
        tracker.recordUsage("PRO-AAAA", "read_file");
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");

        assertEquals(1, tracker.getTodayCount("PRO-AAAA"));
        assertEquals(2, tracker.getTodayCount(UsageTracker.ANONYMOUS));
        assertEquals(2, tracker.getTodayCount(null), "null subject is anonymous");
    }

    @Test
    @DisplayName("Calls either side of UTC midnight land in different days")
    void recordUsage_utcMidnight_splitsDays() {
        MutableClock local = new MutableClock(Instant.parse("2026-03-10T23:59:59Z"));
        UsageTracker zoned = new UsageTracker(tempDir, local.withZone(ZoneId.of("America/Los_Angeles")));

        zoned.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        assertEquals(LocalDate.of(2026, 3, 10), zoned.today());

        local.advance(Duration.ofSeconds(2));
        zoned.recordUsage(UsageTracker.ANONYMOUS, "read_file");

        assertEquals(LocalDate.of(2026, 3, 11), zoned.today());
        assertEquals(1, zoned.getTodayCount(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("Count resets after UTC midnight")
    void getTodayCount_nextDay_resets() {
        for (int i = 0; i < 5; i++) {
            tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        }
        clock.set(Instant.parse("2026-03-11T00:00:01Z"));

        assertEquals(0, tracker.getTodayCount(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("Concurrent increments are never lost")
    void recordUsage_concurrent_noLostUpdates() throws Exception {
        int threads = 8;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, tracker.getTodayCount(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("Counts persist across tracker instances")
    void recordUsage_persists() {
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");

        UsageTracker reopened = new UsageTracker(tempDir, clock);
        assertEquals(2, reopened.getTodayCount(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("Days older than the retention window are dropped")
    void recordUsage_oldDays_cleaned() {
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        clock.advance(Duration.ofDays(8));
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");

        clock.advance(Duration.ofDays(-8));
        assertEquals(0, tracker.getTodayCount(UsageTracker.ANONYMOUS));
    }

    @Test
    @DisplayName("A corrupted usage file reads as empty")
    void getTodayCount_corruptedFile_returnsZero() throws Exception {
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        try (var files = Files.list(tempDir.resolve("usage"))) {
            for (Path file : files.toList()) {
                Files.writeString(file, "{not json");
            }
        }

        assertEquals(0, tracker.getTodayCount(UsageTracker.ANONYMOUS));
        assertEquals(1, tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file"));
    }

    @Test
    @DisplayName("getDailyUsage reports the tier limit")
    void getDailyUsage_reportsLimit() {
        for (int i = 0; i < 50; i++) {
            tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        }

        DailyUsage free = tracker.getDailyUsage(UsageTracker.ANONYMOUS, Tier.FREE);
        assertTrue(free.isExceeded());
        assertEquals(0, free.remaining());
        assertEquals("50/50 calls today", free.describe());

        DailyUsage pro = tracker.getDailyUsage(UsageTracker.ANONYMOUS, Tier.PRO);
        assertFalse(pro.isExceeded());
        assertTrue(pro.isUnlimited());
    }

    @Test
    @DisplayName("resetToday clears only today's count")
    void resetToday_clearsCount() {
        tracker.recordUsage(UsageTracker.ANONYMOUS, "read_file");
        tracker.resetToday(UsageTracker.ANONYMOUS);
        assertEquals(0, tracker.getTodayCount(UsageTracker.ANONYMOUS));
    }
}
