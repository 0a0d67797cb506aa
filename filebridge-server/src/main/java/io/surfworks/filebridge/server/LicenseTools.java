package io.surfworks.filebridge.server;

import io.surfworks.filebridge.license.ActivationResult;
import io.surfworks.filebridge.license.EntitlementContext;
import io.surfworks.filebridge.license.EntitlementSnapshot;
import io.surfworks.filebridge.license.Machine;

import java.util.List;
import java.util.Map;

/**
 * License management tools. Available on every tier and not counted against the quota.
 */
final class LicenseTools {

    private final EntitlementContext license;

    LicenseTools(EntitlementContext license) {
        this.license = license;
    }

    void registerAll(ToolRegistry.Builder tools) {
        tools.register("license_status", "Show the current FileBridge license tier, usage and machines",
                ToolSchema.empty(), this::licenseStatus)
            .register("activate_license", "Activate a FileBridge license key on this machine",
                ToolSchema.required("licenseKey").toString(), this::activateLicense)
            .register("list_machines", "List machines bound to the current license",
                ToolSchema.empty(), this::listMachines)
            .register("deactivate_machine", "Free the license seat held by a machine",
                ToolSchema.required("fingerprint").toString(), this::deactivateMachine);
    }

    String licenseStatus(Map<String, Object> args) {
        EntitlementSnapshot status = license.status();
        var sb = new StringBuilder("# FileBridge License\n\n");
        sb.append("**Tier:** ").append(status.tier().getDisplayName()).append("\n");
        if (status.bypassed()) {
            sb.append("**Mode:** license checks bypassed (development only)\n");
        }
        if (status.maskedKey() != null) {
            sb.append("**License:** ").append(status.maskedKey()).append("\n");
            sb.append("**Machines:** ").append(status.activeMachines()).append("/")
                .append(status.machineLimit()).append(" (this machine: ").append(license.machineName()).append(")\n");
        }
        if (status.licenseExpiresAt() != null) {
            sb.append("**Renews/expires:** ").append(status.licenseExpiresAt()).append("\n");
        }
        if (status.validatedAt() != null) {
            sb.append("**Last validated:** ").append(status.validatedAt()).append("\n");
        }
        if (status.usage() != null) {
            sb.append("**Usage:** ").append(status.usage().describe()).append(" (resets 00:00 UTC)\n");
        }
        if (status.notice() != null) {
            sb.append("\n").append(status.notice()).append("\n");
        }
        if (!status.tier().isPaid()) {
            sb.append("\nUpgrade at ").append(license.config().upgradeUrl()).append("\n");
        }
        return sb.toString();
    }

    String activateLicense(Map<String, Object> args) {
        ActivationResult result = license.activate(ToolArgs.require(args, "licenseKey"));
        if (!result.success()) {
            throw new IllegalArgumentException("Activation failed (" + result.errorCode() + "): " + result.error());
        }
        return "License activated: " + result.tier().getDisplayName()
            + (result.expiresAt() != null ? " until " + result.expiresAt() : "");
    }

    String listMachines(Map<String, Object> args) {
        List<Machine> machines = license.listMachines();
        if (machines.isEmpty()) {
            return "No machines are bound to a license on this installation.";
        }
        String self = license.machineFingerprint();
        var sb = new StringBuilder("# Machines\n\n");
        for (Machine machine : machines) {
            sb.append(String.format("- `%s`%s %s, first seen %s, last seen %s\n",
                machine.fingerprint(),
                machine.fingerprint().equals(self) ? " (this machine)" : "",
                machine.active() ? "active" : "inactive",
                machine.firstSeen(),
                machine.lastSeen()));
        }
        return sb.toString();
    }

    String deactivateMachine(Map<String, Object> args) {
        String fingerprint = ToolArgs.require(args, "fingerprint");
        if (!license.deactivateMachine(fingerprint)) {
            throw new IllegalArgumentException("No active machine with fingerprint " + fingerprint);
        }
        return "Machine " + fingerprint + " deactivated; its seat is free.";
    }
}
