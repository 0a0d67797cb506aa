package io.surfworks.filebridge.license;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses, validates and generates license keys.
 *
 * <p>Format: {@code TIER-TIMESTAMP8-USERHASH8-RANDOM16-CHECKSUM4}, for example
 * {@code PRO-1A2B3C4D-12345678-ABCDEFGHIJKLMNOP-A1B2}.
 * <ul>
 *   <li>TIER - FREE, PRO or ENTERPRISE</li>
 *   <li>TIMESTAMP8 - issue time as epoch seconds, 8 upper-case hex digits</li>
 *   <li>USERHASH8 - first 8 hex digits of SHA-256(userId)</li>
 *   <li>RANDOM16 - 16 chars of [A-Z0-9] from a {@link SecureRandom}</li>
 *   <li>CHECKSUM4 - first 4 hex digits of HMAC-SHA256(secret, preceding segments)</li>
 * </ul>
 *
 * <p>A codec built without the server secret (the client side) can only check the shape
 * of a key. Authenticity always needs a remote validation.
 */
public final class LicenseKeyCodec {

    private static final Pattern FORMAT = Pattern.compile(
        "^(FREE|PRO|ENTERPRISE)-([0-9A-F]{8})-([0-9A-F]{8})-([A-Z0-9]{16})-([0-9A-F]{4})$"
    );
    private static final char[] RANDOM_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
    private static final HexFormat HEX = HexFormat.of().withUpperCase();

    private final byte[] secret;
    private final Clock clock;
    private final SecureRandom random;

    /**
     * Client-side codec: shape checks only, cannot generate keys.
     */
    public LicenseKeyCodec() {
        this(null, Clock.systemUTC(), new SecureRandom());
    }

    /**
     * Server-side codec holding the checksum secret.
     *
     * @param secret HMAC secret, or null for a shape-only codec
     * @param clock clock used for the timestamp segment
     * @param random source for the random segment
     */
    public LicenseKeyCodec(byte[] secret, Clock clock, SecureRandom random) {
        this.secret = secret != null && secret.length > 0 ? secret.clone() : null;
        this.clock = clock;
        this.random = random;
    }

    public static LicenseKeyCodec withSecret(String secret) {
        return new LicenseKeyCodec(secret.getBytes(StandardCharsets.UTF_8), Clock.systemUTC(), new SecureRandom());
    }

    public boolean canVerifyChecksum() {
        return secret != null;
    }

    /**
     * Check the segment shapes and, when the secret is held, the checksum.
     *
     * @param key license key, case-insensitive, surrounding whitespace ignored
     * @return the parsed segments
     * @throws InvalidLicenseKeyException if the shape or checksum is wrong
     */
    public ParsedLicenseKey validateFormat(String key) throws InvalidLicenseKeyException {
        if (key == null || key.isBlank()) {
            throw new InvalidLicenseKeyException("License key is empty");
        }

        String normalized = key.trim().toUpperCase(Locale.ROOT);
        var matcher = FORMAT.matcher(normalized);
        if (!matcher.matches()) {
            throw new InvalidLicenseKeyException(
                "License key must look like TIER-XXXXXXXX-XXXXXXXX-XXXXXXXXXXXXXXXX-XXXX");
        }

        String checksum = matcher.group(5);
        boolean verified = false;
        if (secret != null) {
            String body = normalized.substring(0, normalized.lastIndexOf('-'));
            String expected = checksum(body);
            if (!MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.US_ASCII),
                    checksum.getBytes(StandardCharsets.US_ASCII))) {
                throw new InvalidLicenseKeyException("License key checksum mismatch");
            }
            verified = true;
        }

        return new ParsedLicenseKey(
            normalized,
            Tier.valueOf(matcher.group(1)),
            Instant.ofEpochSecond(Long.parseLong(matcher.group(2), 16)),
            matcher.group(3),
            matcher.group(4),
            checksum,
            verified
        );
    }

    public boolean isWellFormed(String key) {
        try {
            validateFormat(key);
            return true;
        } catch (InvalidLicenseKeyException e) {
            return false;
        }
    }

    /**
     * Generate a new key for a user.
     *
     * @throws IllegalStateException if this codec does not hold the secret
     */
    public String generate(Tier tier, String userId) {
        if (secret == null) {
            throw new IllegalStateException("License keys can only be generated with the server secret");
        }

        String timestamp = String.format("%08X", clock.instant().getEpochSecond() & 0xFFFFFFFFL);
        String userHash = sha256Hex(userId == null ? "" : userId).substring(0, 8);

        char[] rnd = new char[16];
        for (int i = 0; i < rnd.length; i++) {
            rnd[i] = RANDOM_ALPHABET[random.nextInt(RANDOM_ALPHABET.length)];
        }

        String body = tier.name() + "-" + timestamp + "-" + userHash + "-" + new String(rnd);
        return body + "-" + checksum(body);
    }

    /**
     * Mask a key for display and logs (e.g. "PRO-...A1B2").
     */
    public static String mask(String key) {
        if (key == null || key.length() < 8) {
            return "****";
        }
        int dash = key.indexOf('-');
        String prefix = dash > 0 && dash <= 10 ? key.substring(0, dash + 1) : key.substring(0, 4);
        return prefix + "..." + key.substring(key.length() - 4);
    }

    private String checksum(String body) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
            return HEX.formatHex(digest).substring(0, 4);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HEX.formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
