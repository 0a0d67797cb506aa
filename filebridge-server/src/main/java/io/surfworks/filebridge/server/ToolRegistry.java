package io.surfworks.filebridge.server;

import io.surfworks.filebridge.license.AccessDecision;
import io.surfworks.filebridge.license.EntitlementContext;
import io.surfworks.filebridge.license.FeatureGate;
import io.surfworks.filebridge.license.JsonFiles;
import io.surfworks.filebridge.license.Tier;

import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Every tool the server exposes, with the tier it requires and its handler.
 *
 * <p>Built once at startup. The required tier of each tool comes from the {@link FeatureGate},
 * so a tool the gate does not know cannot be registered. {@link #call(String, Map)} is the only
 * way to run a tool: it checks access first and records usage after the handler completes.
 */
public final class ToolRegistry {

    private static final Logger LOG = Logger.getLogger(ToolRegistry.class.getName());

    /**
     * A registered tool.
     */
    public record Tool(String name, String description, String inputSchema, Tier requiredTier, ToolHandler handler) {
    }

    private final Map<String, Tool> tools;
    private final EntitlementContext license;

    private ToolRegistry(Map<String, Tool> tools, EntitlementContext license) {
        this.tools = Collections.unmodifiableMap(new LinkedHashMap<>(tools));
        this.license = license;
    }

    public static Builder builder(FeatureGate gate) {
        return new Builder(gate);
    }

    public Collection<Tool> tools() {
        return tools.values();
    }

    public Optional<Tool> tool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Check access, run the tool, and count the call if it completed.
     */
    public ToolResult call(String name, Map<String, Object> args) {
        AccessDecision decision = license.checkFeatureAccess(name);
        if (!decision.allowed()) {
            LOG.info("Tool '" + name + "' denied: " + decision.code());
            return ToolResult.error(JsonFiles.GSON.toJson(decision.toResponse()));
        }

        Tool tool = tools.get(name);
        if (tool == null) {
            return ToolResult.error("Tool '" + name + "' is not available in this server");
        }

        String text;
        try {
            text = tool.handler().handle(args != null ? args : Map.of());
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.FINE, "Tool '" + name + "' failed", e);
            return ToolResult.error(e.getMessage());
        }

        license.recordUsage(name);
        return ToolResult.ok(text);
    }

    public static final class Builder {
        private final FeatureGate gate;
        private final Map<String, Tool> tools = new LinkedHashMap<>();

        private Builder(FeatureGate gate) {
            this.gate = gate;
        }

        /**
         * @throws IllegalArgumentException if the gate does not know the tool or it is already registered
         */
        public Builder register(String name, String description, String inputSchema, ToolHandler handler) {
            Tier required = gate.requiredTier(name)
                .orElseThrow(() -> new IllegalArgumentException("'" + name + "' is not in the feature table"));
            if (tools.containsKey(name)) {
                throw new IllegalArgumentException("Tool '" + name + "' registered twice");
            }
            tools.put(name, new Tool(name, description, inputSchema, required, handler));
            return this;
        }

        public ToolRegistry build(EntitlementContext license) {
            return new ToolRegistry(tools, license);
        }
    }
}
