package io.surfworks.filebridge.license.billing;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the HMAC-SHA256 signature a billing provider puts on each webhook.
 *
 * <p>The signature is the hex digest of the raw request body under the shared webhook secret,
 * optionally prefixed with {@code sha256=}. Comparison is constant-time.
 */
public final class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    private static final String PREFIX = "sha256=";

    private final byte[] secret;

    public WebhookSignatureVerifier(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Webhook secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Hex signature for a body, as the provider computes it.
     */
    public String sign(byte[] body) {
        return HexFormat.of().formatHex(hmac(body));
    }

    /**
     * @throws WebhookSignatureException if the header is missing, malformed or does not match
     */
    public void verify(byte[] body, String signatureHeader) throws WebhookSignatureException {
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing webhook signature");
        }
        String hex = signatureHeader.trim().toLowerCase(Locale.ROOT);
        if (hex.startsWith(PREFIX)) {
            hex = hex.substring(PREFIX.length());
        }

        byte[] provided;
        try {
            provided = HexFormat.of().parseHex(hex);
        } catch (IllegalArgumentException e) {
            throw new WebhookSignatureException("Malformed webhook signature");
        }

        if (!MessageDigest.isEqual(provided, hmac(body))) {
            throw new WebhookSignatureException("Webhook signature does not match");
        }
    }

    private byte[] hmac(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }
}
