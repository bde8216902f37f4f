package org.ebaysf.tidepool.gc;

import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.Set;
import java.util.function.Consumer;

/**
 * What an {@link LruGarbageCollector} needs from persistence to pick a cutoff and collect up to it.
 */
public interface LruDelegate {

    LruGarbageCollector getGarbageCollector();

    void forEachTarget(final PersistenceTransaction txn, final Consumer<TargetData> consumer);

    /**
     * @return number of targets plus number of orphaned, unpinned documents
     */
    long getSequenceNumberCount(final PersistenceTransaction txn);

    /**
     * Visits the sequence number of every orphaned document that is not pinned.
     */
    void forEachOrphanedDocumentSequenceNumber(final PersistenceTransaction txn, final Consumer<Long> consumer);

    /**
     * Removes targets not used since {@code upperBound}, except the active ones.
     * @return number of targets removed
     */
    int removeTargets(final PersistenceTransaction txn, final long upperBound, final Set<Integer> activeTargetIds);

    /**
     * Removes every cached document that is not pinned with respect to {@code upperBound}.
     * @return number of documents removed
     */
    int removeOrphanedDocuments(final PersistenceTransaction txn, final long upperBound);

    long getCacheSize(final PersistenceTransaction txn);
}
