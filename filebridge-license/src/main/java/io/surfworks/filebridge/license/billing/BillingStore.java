package io.surfworks.filebridge.license.billing;

import java.util.function.Function;

/**
 * Durable billing state with all-or-nothing updates.
 */
public interface BillingStore {

    /**
     * Run a query against a snapshot of the committed state.
     */
    <T> T read(Function<BillingState, T> query) throws BillingStoreException;

    /**
     * Apply a mutation to a working copy and commit it.
     *
     * <p>If the mutation throws, or the commit fails, nothing is changed. Transactions are
     * serialized.
     *
     * @return whatever the mutation returned
     */
    <T> T transact(Function<BillingState, T> mutation) throws BillingStoreException;
}
