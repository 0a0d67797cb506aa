package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.DailyUsage;
import io.surfworks.filebridge.license.Machine;
import io.surfworks.filebridge.license.Tier;

import java.util.List;

/**
 * Server-side usage report for one license.
 */
public record LicenseUsage(
    String maskedKey,
    Tier tier,
    LicenseStatus status,
    DailyUsage dailyUsage,
    int machinesUsed,
    int maxMachines,
    List<Machine> machines
) {
}
