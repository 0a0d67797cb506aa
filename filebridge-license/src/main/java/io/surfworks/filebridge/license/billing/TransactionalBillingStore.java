package io.surfworks.filebridge.license.billing;

import java.util.function.Function;

/**
 * Copy-on-write {@link BillingStore}: a transaction mutates a copy, persists it, and only then
 * replaces the committed state.
 */
public abstract class TransactionalBillingStore implements BillingStore {

    private final Object lock = new Object();
    private BillingState committed;

    protected abstract BillingState loadState() throws BillingStoreException;

    protected abstract void persist(BillingState state) throws BillingStoreException;

    @Override
    public <T> T read(Function<BillingState, T> query) throws BillingStoreException {
        synchronized (lock) {
            return query.apply(current().copy());
        }
    }

    @Override
    public <T> T transact(Function<BillingState, T> mutation) throws BillingStoreException {
        synchronized (lock) {
            BillingState working = current().copy();
            T result = mutation.apply(working);
            persist(working);
            committed = working;
            return result;
        }
    }

    private BillingState current() throws BillingStoreException {
        if (committed == null) {
            committed = loadState();
        }
        return committed;
    }
}
