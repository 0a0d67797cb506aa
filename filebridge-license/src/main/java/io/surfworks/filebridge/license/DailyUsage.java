package io.surfworks.filebridge.license;

import java.time.LocalDate;

/**
 * Gated call count for one subject on one UTC day.
 *
 * @param subject license key or {@link UsageTracker#ANONYMOUS}
 * @param date the UTC calendar day
 * @param count calls recorded so far
 * @param limit daily limit, or {@link Tier#UNLIMITED}
 */
public record DailyUsage(String subject, LocalDate date, int count, int limit) {

    public boolean isUnlimited() {
        return limit == Tier.UNLIMITED;
    }

    public boolean isExceeded() {
        return !isUnlimited() && count >= limit;
    }

    public int remaining() {
        return isUnlimited() ? Integer.MAX_VALUE : Math.max(0, limit - count);
    }

    public String describe() {
        return isUnlimited()
            ? count + " calls today (unlimited)"
            : String.format("%d/%d calls today", count, limit);
    }
}
