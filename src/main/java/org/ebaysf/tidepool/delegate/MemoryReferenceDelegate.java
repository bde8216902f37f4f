package org.ebaysf.tidepool.delegate;

import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

/**
 * Lifecycle hooks memory persistence calls on every transaction, whatever the policy.
 */
public interface MemoryReferenceDelegate extends ReferenceDelegate {

    void onTransactionStarted(final PersistenceTransaction txn);

    /**
     * Finishes the bookkeeping of the transaction. Any cache writes this makes are applied before it returns.
     */
    void onTransactionCommitted(final PersistenceTransaction txn);

    /**
     * @return estimated footprint of the document in bytes, used for size based collection
     */
    long documentSize(final MaybeDocument document);
}
