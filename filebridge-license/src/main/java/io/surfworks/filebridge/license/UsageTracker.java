package io.surfworks.filebridge.license;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tracks gated calls per subject per UTC day.
 *
 * <p>Each subject (license key, or {@link #ANONYMOUS} when no key is configured) has its own
 * file under {@code usage/}. Day boundaries are UTC midnight regardless of the local time zone.
 * Updates to a subject are serialized on a lock shared by every tracker in the JVM that
 * points at the same file.
 */
public class UsageTracker {

    public static final String ANONYMOUS = "anonymous";

    private static final Logger LOG = Logger.getLogger(UsageTracker.class.getName());
    private static final String USAGE_DIR = "usage";
    private static final int RETENTION_DAYS = 7;
    private static final Map<Path, Object> LOCKS = new ConcurrentHashMap<>();

    private final Path usageDir;
    private final Clock clock;

    public UsageTracker(Path configDir) {
        this(configDir, Clock.systemUTC());
    }

    public UsageTracker(Path configDir, Clock clock) {
        this.usageDir = configDir.resolve(USAGE_DIR);
        this.clock = clock;
    }

    /**
     * Record one completed gated call.
     *
     * @param subject license key or {@link #ANONYMOUS}
     * @param toolName the tool that ran
     * @return the subject's count for today after this call
     */
    public int recordUsage(String subject, String toolName) {
        Path file = fileFor(subject);
        synchronized (lockFor(file)) {
            UsageData data = load(file);
            String today = todayKey();
            int count = data.dailyCounts.getOrDefault(today, 0) + 1;
            data.dailyCounts.put(today, count);
            data.toolCounts
                .computeIfAbsent(today, d -> new HashMap<>())
                .merge(toolName, 1, Integer::sum);

            cleanOldEntries(data);
            save(file, data);
            return count;
        }
    }

    /**
     * Today's usage for a subject against the tier's limit.
     */
    public DailyUsage getDailyUsage(String subject, Tier tier) {
        return new DailyUsage(normalize(subject), today(), getTodayCount(subject), tier.getDailyCallLimit());
    }

    public int getTodayCount(String subject) {
        Path file = fileFor(subject);
        synchronized (lockFor(file)) {
            return load(file).dailyCounts.getOrDefault(todayKey(), 0);
        }
    }

    /**
     * Today's per-tool breakdown for a subject.
     */
    public Map<String, Integer> getTodayToolCounts(String subject) {
        Path file = fileFor(subject);
        synchronized (lockFor(file)) {
            return Map.copyOf(load(file).toolCounts.getOrDefault(todayKey(), Map.of()));
        }
    }

    /**
     * Reset today's count for a subject (administrative).
     */
    public void resetToday(String subject) {
        Path file = fileFor(subject);
        synchronized (lockFor(file)) {
            UsageData data = load(file);
            data.dailyCounts.remove(todayKey());
            data.toolCounts.remove(todayKey());
            save(file, data);
        }
    }

    LocalDate today() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }

    private String todayKey() {
        return today().toString();
    }

    private Path fileFor(String subject) {
        return usageDir.resolve(JsonFiles.fileNameFor(normalize(subject)));
    }

    private static String normalize(String subject) {
        return subject == null || subject.isBlank() ? ANONYMOUS : subject;
    }

    private static Object lockFor(Path file) {
        return LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new Object());
    }

    private UsageData load(Path file) {
        UsageData data = JsonFiles.read(file, UsageData.class);
        if (data == null) {
            return new UsageData();
        }
        if (data.dailyCounts == null) {
            data.dailyCounts = new HashMap<>();
        }
        if (data.toolCounts == null) {
            data.toolCounts = new HashMap<>();
        }
        return data;
    }

    private void save(Path file, UsageData data) {
        try {
            JsonFiles.writeAtomically(file, data);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to persist usage counter " + file.getFileName(), e);
        }
    }

    private void cleanOldEntries(UsageData data) {
        LocalDate cutoff = today().minusDays(RETENTION_DAYS);
        data.dailyCounts.keySet().removeIf(key -> isBefore(key, cutoff));
        data.toolCounts.keySet().removeIf(key -> isBefore(key, cutoff));
    }

    private static boolean isBefore(String dateKey, LocalDate cutoff) {
        try {
            return LocalDate.parse(dateKey).isBefore(cutoff);
        } catch (Exception e) {
            return true; // Remove malformed entries
        }
    }

    private static class UsageData {
        Map<String, Integer> dailyCounts = new HashMap<>();
        Map<String, Map<String, Integer>> toolCounts = new HashMap<>();
    }
}
