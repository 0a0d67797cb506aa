package io.surfworks.filebridge.license.billing;

import com.google.gson.JsonParseException;
import io.surfworks.filebridge.license.JsonFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * {@link BillingStore} persisted to {@code billing.json}.
 *
 * <p>Every commit rewrites the file through a temp file and an atomic move, so a crash leaves
 * either the old or the new state. Unlike the client caches, an unreadable file is an error:
 * silently starting empty would forget issued licenses.
 */
public class FileBillingStore extends TransactionalBillingStore {

    private static final Logger LOG = Logger.getLogger(FileBillingStore.class.getName());
    static final String BILLING_FILE = "billing.json";

    private final Path file;

    public FileBillingStore(Path dataDir) {
        this.file = dataDir.resolve(BILLING_FILE);
    }

    @Override
    protected BillingState loadState() throws BillingStoreException {
        if (!Files.exists(file)) {
            LOG.info("No billing state at " + file + "; starting empty");
            return new BillingState();
        }
        try {
            BillingState state = JsonFiles.GSON.fromJson(Files.readString(file), BillingState.class);
            return state != null ? state : new BillingState();
        } catch (IOException | JsonParseException e) {
            throw new BillingStoreException("Cannot read billing state from " + file, e);
        }
    }

    @Override
    protected void persist(BillingState state) throws BillingStoreException {
        try {
            JsonFiles.writeAtomically(file, state);
        } catch (IOException e) {
            throw new BillingStoreException("Cannot write billing state to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
