package io.surfworks.filebridge.license.billing;

/**
 * A webhook's signature is missing or does not match its body. The event is not recorded.
 */
public class WebhookSignatureException extends Exception {

    public WebhookSignatureException(String message) {
        super(message);
    }
}
