package io.surfworks.filebridge.license;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static tier to feature table.
 *
 * <p>The table is cumulative: {@code features(FREE) ⊆ features(PRO) ⊆ features(ENTERPRISE)}.
 * A custom table passed to the constructor is rejected if it breaks that ordering.
 *
 * <p>License management tools ({@link #MANAGEMENT_TOOLS}) are available on every tier
 * and are never metered, so a user at quota can still activate a license.
 */
public final class FeatureGate {

    public static final Set<String> MANAGEMENT_TOOLS = Set.of(
        "license_status",
        "activate_license",
        "list_machines",
        "deactivate_machine"
    );

    private static final List<String> FREE_FEATURES = List.of(
        "list_files",
        "read_file",
        "search_files",
        "get_file_stats"
    );

    private static final List<String> PRO_FEATURES = List.of(
        "write_file",
        "get_file_diff",
        "search_symbols",
        "find_references",
        "index_directory",
        "get_symbol_info",
        "run_tests",
        "detect_test_framework",
        "analyze_dependencies",
        "security_scan",
        "git_diff",
        "git_log",
        "git_blame",
        "analyze_performance",
        "monitor_files",
        "code_quality_check",
        "documentation_analysis",
        "refactor_suggestions",
        "bulk_operations",
        "advanced_search",
        "project_analytics",
        "code_metrics"
    );

    private static final List<String> ENTERPRISE_FEATURES = List.of(
        "team_collaboration",
        "audit_logging",
        "priority_support",
        "custom_integrations"
    );

    private static final Map<Tier, String> TIER_PREVIEWS = Map.of(
        Tier.FREE, "Free: file listing, reading and search, 50 calls/day",
        Tier.PRO, "Pro: unlimited calls on 3 machines, git history, test runner, code intelligence and analysis tools",
        Tier.ENTERPRISE, "Enterprise: everything in Pro on 10 machines, plus team collaboration, audit logging and custom integrations"
    );

    /**
     * The standard FileBridge feature table.
     */
    public static final FeatureGate STANDARD = new FeatureGate(standardTable());

    private final Map<Tier, Set<String>> featuresByTier;

    /**
     * Create a gate from an explicit table.
     *
     * @param table features granted by each tier; every tier must be present
     * @throws IllegalArgumentException if a tier is missing or the table is not cumulative
     */
    public FeatureGate(Map<Tier, Set<String>> table) {
        var copy = new EnumMap<Tier, Set<String>>(Tier.class);
        Set<String> previous = Set.of();
        for (Tier tier : Tier.values()) {
            Set<String> features = table.get(tier);
            if (features == null) {
                throw new IllegalArgumentException("No feature set for tier " + tier);
            }
            if (!features.containsAll(previous)) {
                throw new IllegalArgumentException(
                    "Features of " + tier + " must include every feature of the tier below it");
            }
            copy.put(tier, Collections.unmodifiableSet(new LinkedHashSet<>(features)));
            previous = features;
        }
        this.featuresByTier = Collections.unmodifiableMap(copy);
    }

    /**
     * Features granted by a tier.
     */
    public Set<String> features(Tier tier) {
        return featuresByTier.get(tier);
    }

    /**
     * Lowest tier that grants the tool.
     *
     * @param toolName tool identifier
     * @return the required tier, or empty if no tier grants the tool
     */
    public Optional<Tier> requiredTier(String toolName) {
        if (toolName == null) {
            return Optional.empty();
        }
        if (MANAGEMENT_TOOLS.contains(toolName)) {
            return Optional.of(Tier.FREE);
        }
        for (Tier tier : Tier.values()) {
            if (featuresByTier.get(tier).contains(toolName)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether {@code tier} grants {@code toolName}.
     */
    public boolean isAllowed(String toolName, Tier tier) {
        return requiredTier(toolName).map(tier::includes).orElse(false);
    }

    /**
     * Whether calls to this tool count against the daily quota.
     */
    public boolean isMetered(String toolName) {
        return !MANAGEMENT_TOOLS.contains(toolName);
    }

    /**
     * Short preview of what upgrading unlocks for a tool.
     */
    public String preview(String toolName) {
        Optional<Tier> required = requiredTier(toolName);
        if (required.isEmpty()) {
            return "'" + toolName + "' is not a FileBridge feature";
        }
        Tier tier = required.get();
        return "'" + toolName + "' is part of " + tier.getDisplayName() + ". " + TIER_PREVIEWS.get(tier);
    }

    private static Map<Tier, Set<String>> standardTable() {
        var table = new EnumMap<Tier, Set<String>>(Tier.class);
        var cumulative = new LinkedHashSet<String>(FREE_FEATURES);
        table.put(Tier.FREE, Set.copyOf(cumulative));
        cumulative.addAll(PRO_FEATURES);
        table.put(Tier.PRO, Set.copyOf(cumulative));
        cumulative.addAll(ENTERPRISE_FEATURES);
        table.put(Tier.ENTERPRISE, Set.copyOf(cumulative));
        return table;
    }
}
