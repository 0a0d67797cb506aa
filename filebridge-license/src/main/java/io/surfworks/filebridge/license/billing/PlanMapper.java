package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.Tier;

import java.util.Map;

/**
 * Maps billing-provider plan ids to tiers.
 */
public interface PlanMapper {

    /**
     * @param planId the provider's plan id, may be null
     * @return the tier, FREE if unmappable
     */
    Tier tierFor(String planId);

    /**
     * Known FileBridge plans, falling back to name matching for anything else.
     */
    PlanMapper DEFAULT = new PlanMapper() {
        private final Map<String, Tier> plans = Map.of(
            "filebridge_free", Tier.FREE,
            "filebridge_pro_monthly", Tier.PRO,
            "filebridge_pro_yearly", Tier.PRO,
            "filebridge_enterprise_monthly", Tier.ENTERPRISE,
            "filebridge_enterprise_yearly", Tier.ENTERPRISE
        );

        @Override
        public Tier tierFor(String planId) {
            if (planId == null) {
                return Tier.FREE;
            }
            Tier known = plans.get(planId);
            return known != null ? known : Tier.fromName(planId);
        }
    };
}
