package org.ebaysf.tidepool.cache;

import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MutationBatch;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.List;

/**
 * One user's not yet acknowledged local writes, in the order they were made.
 */
public interface MutationQueue {

    MutationBatch addMutationBatch(final PersistenceTransaction txn, final Iterable<DocumentKey> keys);

    /**
     * @return the batch, or null when it is not queued
     */
    MutationBatch lookupMutationBatch(final PersistenceTransaction txn, final int batchId);

    List<MutationBatch> getAllMutationBatches(final PersistenceTransaction txn);

    /**
     * Removes the oldest batch once it was acknowledged or rejected; each key it touched loses a mutation reference.
     */
    void removeMutationBatch(final PersistenceTransaction txn, final MutationBatch batch);

    boolean containsKey(final PersistenceTransaction txn, final DocumentKey key);

    boolean isEmpty(final PersistenceTransaction txn);
}
