package io.surfworks.filebridge.license;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

/**
 * Interactive license setup for {@code --setup}.
 *
 * <p>Writes to the given stream (stderr in the server, since stdout carries the MCP protocol)
 * and reads a key from the given reader when none is active.
 */
public final class LicenseSetup {

    private final EntitlementContext context;
    private final BufferedReader in;
    private final PrintStream out;

    public LicenseSetup(EntitlementContext context, BufferedReader in, PrintStream out) {
        this.context = context;
        this.in = in;
        this.out = out;
    }

    /**
     * Show the current status and offer to activate a key.
     *
     * @return true if a license is active when setup finishes
     */
    public boolean run() throws IOException {
        out.println();
        out.println("FileBridge License Setup");
        out.println("------------------------");
        EntitlementSnapshot status = context.status();
        printStatus(status);

        if (status.maskedKey() != null) {
            return status.tier().isPaid();
        }

        out.println();
        out.println("No license key found. You're currently using the FREE tier.");
        out.println("Get a license at: " + context.config().upgradeUrl());
        out.print("Enter a license key (or press Enter to stay on FREE): ");
        out.flush();

        String line = in.readLine();
        if (line == null || line.isBlank()) {
            out.println("Staying on the FREE tier.");
            return false;
        }

        ActivationResult result = context.activate(line.trim());
        if (result.success()) {
            out.println("License activated: " + result.tier().getDisplayName()
                + (result.expiresAt() != null ? " (renews " + result.expiresAt() + ")" : ""));
            return true;
        }
        out.println("Activation failed: " + result.error());
        return false;
    }

    private void printStatus(EntitlementSnapshot status) {
        out.println();
        out.println("Current Status:");
        out.println("   Tier: " + status.tier().getDisplayName());
        out.println("   Features: " + context.featureGate().features(status.tier()).size());
        if (status.usage() != null) {
            out.println("   Daily Usage: " + status.usage().describe());
        }
        if (status.maskedKey() != null) {
            out.println("   License: " + status.maskedKey());
            out.println("   Machines: " + status.activeMachines() + "/" + status.machineLimit());
        }
        if (status.notice() != null) {
            out.println("   Note: " + status.notice());
        }
    }
}
