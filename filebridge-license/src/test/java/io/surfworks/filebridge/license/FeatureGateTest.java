package io.surfworks.filebridge.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FeatureGateTest {

    private final FeatureGate gate = FeatureGate.STANDARD;

    @Test
    @DisplayName("Feature sets are cumulative across tiers")
    void features_areCumulative() {
        assertTrue(gate.features(Tier.PRO).containsAll(gate.features(Tier.FREE)));
        assertTrue(gate.features(Tier.ENTERPRISE).containsAll(gate.features(Tier.PRO)));
        assertTrue(gate.features(Tier.ENTERPRISE).size() > gate.features(Tier.PRO).size());
    }

    @Test
    @DisplayName("requiredTier returns the lowest granting tier")
    void requiredTier_lowestGrantingTier() {
        assertEquals(Optional.of(Tier.FREE), gate.requiredTier("read_file"));
        assertEquals(Optional.of(Tier.PRO), gate.requiredTier("git_log"));
        assertEquals(Optional.of(Tier.ENTERPRISE), gate.requiredTier("audit_logging"));
    }

    @Test
    @DisplayName("Unknown tools are granted by no tier")
    void requiredTier_unknownTool_empty() {
        assertTrue(gate.requiredTier("rm_rf").isEmpty());
        assertTrue(gate.requiredTier(null).isEmpty());
        assertFalse(gate.isAllowed("rm_rf", Tier.ENTERPRISE));
    }

    @Test
    @DisplayName("License management tools are free and unmetered")
    void managementTools_freeAndUnmetered() {
        for (String tool : FeatureGate.MANAGEMENT_TOOLS) {
            assertTrue(gate.isAllowed(tool, Tier.FREE), tool);
            assertFalse(gate.isMetered(tool), tool);
        }
        assertTrue(gate.isMetered("read_file"));
    }

    @Test
    @DisplayName("isAllowed follows tier ordering")
    void isAllowed_followsTierOrdering() {
        assertFalse(gate.isAllowed("write_file", Tier.FREE));
        assertTrue(gate.isAllowed("write_file", Tier.PRO));
        assertTrue(gate.isAllowed("write_file", Tier.ENTERPRISE));
        assertFalse(gate.isAllowed("team_collaboration", Tier.PRO));
    }

    @Test
    @DisplayName("Preview names the tier that unlocks the tool")
    void preview_namesTier() {
        assertTrue(gate.preview("git_blame").contains("Pro"));
        assertTrue(gate.preview("custom_integrations").contains("Enterprise"));
    }

    @Test
    @DisplayName("A non-cumulative table is rejected")
    void constructor_nonCumulative_throws() {
        Map<Tier, Set<String>> table = new EnumMap<>(Tier.class);
        table.put(Tier.FREE, Set.of("read_file"));
        table.put(Tier.PRO, Set.of("write_file"));
        table.put(Tier.ENTERPRISE, Set.of("read_file", "write_file"));

        assertThrows(IllegalArgumentException.class, () -> new FeatureGate(table));
    }
}
