package org.ebaysf.tidepool;

import com.google.common.util.concurrent.ListenableFuture;
import org.ebaysf.tidepool.cache.MutationQueue;
import org.ebaysf.tidepool.cache.RemoteDocumentCache;
import org.ebaysf.tidepool.cache.TargetCache;
import org.ebaysf.tidepool.delegate.ReferenceDelegate;
import org.ebaysf.tidepool.model.User;
import org.ebaysf.tidepool.transaction.TransactionMode;
import org.ebaysf.tidepool.transaction.TransactionOperation;

/**
 * Owns the local caches and runs every read or write against them inside a transaction.
 */
public interface Persistence {

    boolean isStarted();

    /**
     * Releases whatever the implementation holds. No transaction may run afterwards.
     */
    void shutdown();

    /**
     * @return the queue of pending writes for the user, created on first access
     */
    MutationQueue getMutationQueue(final User user);

    TargetCache getTargetCache();

    RemoteDocumentCache getRemoteDocumentCache();

    ReferenceDelegate getReferenceDelegate();

    /**
     * Runs the operation in a new transaction, stamped with the next sequence number. Transactions never
     * overlap: one started on another thread waits until the running one has committed.
     * <p>
     * The returned future fails with the operation's checked exception, if it throws one.
     * Unchecked exceptions are programming errors and propagate to the caller.
     */
    <T> ListenableFuture<T> runTransaction(final String action,
                                           final TransactionMode mode,
                                           final TransactionOperation<T> operation);
}
