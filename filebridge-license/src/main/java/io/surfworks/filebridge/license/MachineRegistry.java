package io.surfworks.filebridge.license;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Binds machine fingerprints to licenses and enforces the per-tier machine cap.
 *
 * <p>Re-registering a bound fingerprint is idempotent and only refreshes {@code lastSeen}.
 * Machines are never evicted automatically; a seat is freed only by
 * {@link #deactivateMachine(String, String)}.
 *
 * <p>Bindings live in {@code machines/<hash>.json}, one file per license. Updates to one
 * license are serialized.
 */
public class MachineRegistry {

    private static final Logger LOG = Logger.getLogger(MachineRegistry.class.getName());
    private static final String MACHINES_DIR = "machines";
    private static final Map<Path, Object> LOCKS = new ConcurrentHashMap<>();

    private final Path machinesDir;
    private final Clock clock;

    public MachineRegistry(Path configDir) {
        this(configDir, Clock.systemUTC());
    }

    public MachineRegistry(Path configDir, Clock clock) {
        this.machinesDir = configDir.resolve(MACHINES_DIR);
        this.clock = clock;
    }

    public MachineRegistration registerMachine(String licenseId, String fingerprint, Tier tier) {
        return registerMachine(licenseId, fingerprint, tier.getMachineLimit());
    }

    /**
     * Bind a machine to a license, or refresh an existing binding.
     *
     * @param licenseId license key
     * @param fingerprint hash from {@link MachineFingerprint}
     * @param machineLimit maximum active machines for the license
     * @return allowed, or denied with a hint when the cap is reached by other machines
     * @throws IllegalArgumentException if {@code fingerprint} is not a fingerprint hash
     */
    public MachineRegistration registerMachine(String licenseId, String fingerprint, int machineLimit) {
        if (!MachineFingerprint.isFingerprint(fingerprint)) {
            throw new IllegalArgumentException("Expected a machine fingerprint hash");
        }

        Path file = fileFor(licenseId);
        synchronized (lockFor(file)) {
            List<Machine> machines = load(file);
            Instant now = clock.instant();
            int active = countActive(machines);

            for (int i = 0; i < machines.size(); i++) {
                Machine machine = machines.get(i);
                if (!machine.fingerprint().equals(fingerprint)) {
                    continue;
                }
                if (machine.active()) {
                    Machine seen = machine.seenAt(now);
                    machines.set(i, seen);
                    save(file, machines);
                    return MachineRegistration.allowed(seen, active, machineLimit);
                }
                if (active >= machineLimit) {
                    return MachineRegistration.limitExceeded(active, machineLimit);
                }
                Machine reactivated = machine.reactivatedAt(now);
                machines.set(i, reactivated);
                save(file, machines);
                LOG.info("Reactivated machine " + abbreviate(fingerprint) + " for license "
                    + LicenseKeyCodec.mask(licenseId));
                return MachineRegistration.allowed(reactivated, active + 1, machineLimit);
            }

            if (active >= machineLimit) {
                LOG.info("Machine limit " + machineLimit + " reached for license " + LicenseKeyCodec.mask(licenseId));
                return MachineRegistration.limitExceeded(active, machineLimit);
            }

            Machine bound = new Machine(fingerprint, licenseId, now, now, true);
            machines.add(bound);
            save(file, machines);
            LOG.info("Bound machine " + abbreviate(fingerprint) + " to license " + LicenseKeyCodec.mask(licenseId)
                + " (" + (active + 1) + "/" + machineLimit + ")");
            return MachineRegistration.allowed(bound, active + 1, machineLimit);
        }
    }

    /**
     * Explicitly free a machine's seat.
     *
     * @return true if an active binding was deactivated
     */
    public boolean deactivateMachine(String licenseId, String fingerprint) {
        Path file = fileFor(licenseId);
        synchronized (lockFor(file)) {
            List<Machine> machines = load(file);
            for (int i = 0; i < machines.size(); i++) {
                Machine machine = machines.get(i);
                if (machine.fingerprint().equals(fingerprint) && machine.active()) {
                    machines.set(i, machine.deactivated());
                    save(file, machines);
                    LOG.info("Deactivated machine " + abbreviate(fingerprint) + " for license "
                        + LicenseKeyCodec.mask(licenseId));
                    return true;
                }
            }
            return false;
        }
    }

    /**
     * All machines ever bound to a license, active or not.
     */
    public List<Machine> listMachines(String licenseId) {
        Path file = fileFor(licenseId);
        synchronized (lockFor(file)) {
            return List.copyOf(load(file));
        }
    }

    public int activeCount(String licenseId) {
        return countActive(listMachines(licenseId));
    }

    private static int countActive(List<Machine> machines) {
        int active = 0;
        for (Machine machine : machines) {
            if (machine.active()) {
                active++;
            }
        }
        return active;
    }

    private Path fileFor(String licenseId) {
        return machinesDir.resolve(JsonFiles.fileNameFor(licenseId));
    }

    private static Object lockFor(Path file) {
        return LOCKS.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new Object());
    }

    private List<Machine> load(Path file) {
        MachineData data = JsonFiles.read(file, MachineData.class);
        if (data == null || data.machines == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>(data.machines);
    }

    private void save(Path file, List<Machine> machines) {
        MachineData data = new MachineData();
        data.machines = machines;
        try {
            JsonFiles.writeAtomically(file, data);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to persist machine bindings " + file.getFileName(), e);
        }
    }

    private static String abbreviate(String fingerprint) {
        return fingerprint.substring(0, 8);
    }

    private static class MachineData {
        List<Machine> machines = new ArrayList<>();
    }
}
