package io.surfworks.filebridge.license.billing;

/**
 * A correctly signed webhook body that cannot be understood.
 */
public class InvalidWebhookPayloadException extends Exception {

    public InvalidWebhookPayloadException(String message) {
        super(message);
    }

    public InvalidWebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
