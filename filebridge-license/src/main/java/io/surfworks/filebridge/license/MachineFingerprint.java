package io.surfworks.filebridge.license;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * One-way machine fingerprint used to bind a license to a bounded set of devices.
 *
 * <p>Only the hash ever leaves this class; serial numbers, machine ids and MAC addresses
 * are never persisted or sent.
 */
public final class MachineFingerprint {

    private static final Logger LOG = Logger.getLogger(MachineFingerprint.class.getName());
    private static final Pattern SHAPE = Pattern.compile("^[0-9a-f]{32}$");
    private static final String SALT = "filebridge-machine-v1";

    private MachineFingerprint() {}

    /**
     * Fingerprint of the current machine.
     *
     * <p>Components (platform-dependent):
     * <ul>
     *   <li>macOS: IOPlatformSerialNumber</li>
     *   <li>Linux: /etc/machine-id + /sys/class/dmi/id/product_uuid</li>
     *   <li>otherwise: first non-loopback MAC address</li>
     * </ul>
     *
     * @return 32 lower-case hex chars
     */
    public static String generate() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);

        String rawIdentifier;
        if (os.contains("mac")) {
            rawIdentifier = getMacSerialNumber();
        } else if (os.contains("linux")) {
            rawIdentifier = getLinuxMachineId();
        } else {
            rawIdentifier = getNetworkMac();
        }

        return of(os, rawIdentifier);
    }

    /**
     * Fingerprint from explicit stable identifiers.
     */
    public static String of(String... identifiers) {
        var sb = new StringBuilder(SALT);
        for (String id : identifiers) {
            sb.append('|').append(id == null ? "" : id.trim());
        }
        return LicenseKeyCodec.sha256Hex(sb.toString()).substring(0, 32).toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a value has the shape of a fingerprint produced by this class.
     */
    public static boolean isFingerprint(String value) {
        return value != null && SHAPE.matcher(value).matches();
    }

    /**
     * Short, human-readable machine name for display.
     */
    public static String getMachineName() {
        String os = System.getProperty("os.name", "Unknown");
        return getHostname() + " (" + os + ")";
    }

    private static String getMacSerialNumber() {
        try {
            Process p = new ProcessBuilder("ioreg", "-rd1", "-c", "IOPlatformExpertDevice").start();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.contains("IOPlatformSerialNumber")) {
                        int start = line.indexOf('"', line.indexOf('=')) + 1;
                        int end = line.lastIndexOf('"');
                        if (start > 0 && end > start) {
                            return line.substring(start, end);
                        }
                    }
                }
            }
            p.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.log(Level.FINE, "ioreg unavailable, falling back to MAC address", e);
        }
        return getNetworkMac();
    }

    private static String getLinuxMachineId() {
        StringBuilder id = new StringBuilder();
        for (String candidate : new String[] {"/etc/machine-id", "/sys/class/dmi/id/product_uuid"}) {
            try {
                Path path = Path.of(candidate);
                if (Files.isReadable(path)) {
                    id.append(Files.readString(path).trim());
                }
            } catch (Exception e) {
                // product_uuid needs root on many systems
                LOG.log(Level.FINE, "Cannot read " + candidate, e);
            }
        }
        return id.length() == 0 ? getNetworkMac() : id.toString();
    }

    private static String getNetworkMac() {
        try {
            Enumeration<NetworkInterface> interfaces = NetworkInterface.getNetworkInterfaces();
            while (interfaces != null && interfaces.hasMoreElements()) {
                NetworkInterface ni = interfaces.nextElement();
                byte[] mac = ni.getHardwareAddress();
                if (mac != null && mac.length > 0 && !ni.isLoopback()) {
                    return HexFormat.of().formatHex(mac);
                }
            }
        } catch (Exception e) {
            LOG.log(Level.FINE, "Cannot enumerate network interfaces", e);
        }
        // Stable across runs, unlike a timestamp
        return System.getProperty("user.name", "unknown") + System.getProperty("user.home", "/unknown");
    }

    private static String getHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            return "unknown";
        }
    }
}
