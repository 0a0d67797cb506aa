package io.surfworks.filebridge.license;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verdict of {@link ValidationClient#checkFeatureAccess(String)}.
 *
 * @param allowed whether the tool may run
 * @param toolName the tool that was checked
 * @param tier tier the verdict was resolved at
 * @param code denial reason, null when allowed
 * @param reason human-readable explanation or informational message
 * @param upgradeUrl where to upgrade, set on denial
 * @param preview what upgrading unlocks, set on denial
 * @param usage today's usage when the quota was consulted, else null
 * @param bypassed true when gating was skipped by the development bypass
 */
public record AccessDecision(
    boolean allowed,
    String toolName,
    Tier tier,
    DenialCode code,
    String reason,
    String upgradeUrl,
    String preview,
    DailyUsage usage,
    boolean bypassed
) {

    public static AccessDecision allowed(String toolName, Tier tier, String reason, DailyUsage usage) {
        return new AccessDecision(true, toolName, tier, null, reason, null, null, usage, false);
    }

    public static AccessDecision bypassed(String toolName) {
        return new AccessDecision(true, toolName, Tier.ENTERPRISE, null,
            "License checks bypassed (development mode)", null, null, null, true);
    }

    public static AccessDecision denied(String toolName, Tier tier, DenialCode code, String reason,
                                        String upgradeUrl, String preview, DailyUsage usage) {
        return new AccessDecision(false, toolName, tier, code, reason, upgradeUrl, preview, usage, false);
    }

    /**
     * Structured denial returned to the tool caller:
     * {@code {success:false, error, code, upgradeUrl, preview}}.
     *
     * @throws IllegalStateException if the decision allowed the call
     */
    public Map<String, Object> toResponse() {
        if (allowed) {
            throw new IllegalStateException("Allowed decisions have no denial response");
        }
        var response = new LinkedHashMap<String, Object>();
        response.put("success", false);
        response.put("error", reason);
        response.put("code", code.name());
        response.put("upgradeUrl", upgradeUrl);
        response.put("preview", preview);
        return response;
    }
}
