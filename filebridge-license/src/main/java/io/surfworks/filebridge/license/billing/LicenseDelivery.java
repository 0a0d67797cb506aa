package io.surfworks.filebridge.license.billing;

import io.surfworks.filebridge.license.LicenseKeyCodec;

import java.util.logging.Logger;

/**
 * Hands a newly issued license key to its owner. Called after the issuing transaction commits.
 */
@FunctionalInterface
public interface LicenseDelivery {

    void deliver(License license, Subscription subscription);

    /**
     * Logs the issue. Deployments that email keys plug in their own delivery.
     */
    LicenseDelivery LOGGING = (license, subscription) ->
        Logger.getLogger(LicenseDelivery.class.getName()).info(String.format(
            "Issued %s license %s to user %s for subscription %s",
            license.tier(), LicenseKeyCodec.mask(license.licenseKey()), license.userId(),
            subscription.subscriptionId()));
}
