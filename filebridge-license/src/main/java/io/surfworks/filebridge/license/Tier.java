package io.surfworks.filebridge.license;

import java.util.Locale;

/**
 * FileBridge subscription tiers.
 *
 * <p>Tiers are ordered: every tier grants everything the tiers before it grant.
 * <ul>
 *   <li>Free - 50 gated calls per UTC day on one machine</li>
 *   <li>Pro - unlimited calls on up to 3 machines</li>
 *   <li>Enterprise - unlimited calls on up to 10 machines, team features</li>
 * </ul>
 */
public enum Tier {

    FREE("Free", 50, 1),

    PRO("FileBridge Pro", -1, 3),

    ENTERPRISE("FileBridge Enterprise", -1, 10);

    /**
     * Daily call limit reported for unlimited tiers.
     */
    public static final int UNLIMITED = -1;

    private final String displayName;
    private final int dailyCallLimit;
    private final int machineLimit;

    Tier(String displayName, int dailyCallLimit, int machineLimit) {
        this.displayName = displayName;
        this.dailyCallLimit = dailyCallLimit;
        this.machineLimit = machineLimit;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Maximum gated calls per UTC day. {@link #UNLIMITED} means no quota.
     */
    public int getDailyCallLimit() {
        return dailyCallLimit;
    }

    /**
     * Maximum number of simultaneously bound machines.
     */
    public int getMachineLimit() {
        return machineLimit;
    }

    public boolean isUnlimited() {
        return dailyCallLimit == UNLIMITED;
    }

    public boolean isPaid() {
        return this != FREE;
    }

    /**
     * Whether this tier grants at least what {@code required} grants.
     */
    public boolean includes(Tier required) {
        return ordinal() >= required.ordinal();
    }

    /**
     * Parse a tier name leniently.
     *
     * <p>Unknown or missing names map to FREE so that a malformed provider
     * payload can never grant a paid tier.
     *
     * @param name tier or plan name (e.g. "PRO", "filebridge-enterprise-yearly")
     * @return matching tier, or FREE
     */
    public static Tier fromName(String name) {
        if (name == null || name.isBlank()) {
            return FREE;
        }

        String n = name.trim().toLowerCase(Locale.ROOT);

        if (n.contains("enterprise")) {
            return ENTERPRISE;
        }
        if (n.contains("pro")) {
            return PRO;
        }

        return FREE;
    }
}
