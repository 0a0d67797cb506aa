package io.surfworks.filebridge.license.billing;

/**
 * {@link BillingStore} that keeps state in memory only.
 */
public class InMemoryBillingStore extends TransactionalBillingStore {

    @Override
    protected BillingState loadState() {
        return new BillingState();
    }

    @Override
    protected void persist(BillingState state) throws BillingStoreException {
        // nothing to write
    }
}
