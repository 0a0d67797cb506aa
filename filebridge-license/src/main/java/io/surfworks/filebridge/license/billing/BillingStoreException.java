package io.surfworks.filebridge.license.billing;

/**
 * Billing state could not be read or committed.
 */
public class BillingStoreException extends Exception {

    public BillingStoreException(String message) {
        super(message);
    }

    public BillingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
