package org.ebaysf.tidepool.delegate;

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import org.ebaysf.tidepool.MemoryPersistence;
import org.ebaysf.tidepool.cache.RemoteDocumentChangeBuffer;
import org.ebaysf.tidepool.cache.TargetCache;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes a document in the same transaction that drops its last reference.
 * <p>
 * Every removal makes the key a candidate, every added reference withdraws it. At commit each remaining
 * candidate is checked against the target cache, the mutation queues and the in-memory pins, and the
 * unreferenced ones are removed from the remote document cache through a single change buffer.
 */
public class MemoryEagerDelegate extends AbstractMemoryReferenceDelegate {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryEagerDelegate.class);

    private OrphanedDocuments _orphanedDocuments = OrphanedDocuments.CLOSED;

    public MemoryEagerDelegate(final MemoryPersistence persistence) {

        super(persistence);
    }

    public @Override void onTransactionStarted(final PersistenceTransaction txn) {

        _orphanedDocuments = OrphanedDocuments.open(txn);
    }

    public @Override void onTransactionCommitted(final PersistenceTransaction txn) {

        final RemoteDocumentChangeBuffer changeBuffer = _persistence.getRemoteDocumentCache().newChangeBuffer();

        int removed = 0;
        for (DocumentKey key : _orphanedDocuments.of(txn).close()) {
            if (!isReferenced(txn, key)) {
                changeBuffer.removeEntry(key);
                removed += 1;
            }
        }
        _orphanedDocuments = OrphanedDocuments.CLOSED;

        changeBuffer.apply(txn);

        if (removed > 0) {
            LOG.debug("[eager gc] removed {} orphaned documents at sequence number {}", removed, txn.getCurrentSequenceNumber());
        }
    }

    public @Override void addReference(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedDocuments.of(txn).remove(key);
    }

    public @Override void removeReference(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedDocuments.of(txn).add(key);
    }

    public @Override void removeMutationReference(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedDocuments.of(txn).add(key);
    }

    public @Override void removeTarget(final PersistenceTransaction txn, final TargetData targetData) {

        final TargetCache targetCache = _persistence.getTargetCache();
        final OrphanedDocuments orphanedDocuments = _orphanedDocuments.of(txn);

        for (DocumentKey key : targetCache.getMatchingKeysForTargetId(txn, targetData.getTargetId())) {
            orphanedDocuments.add(key);
        }
        targetCache.removeTargetData(txn, targetData);
    }

    public @Override void updateLimboDocument(final PersistenceTransaction txn, final DocumentKey key) {

        if (isReferenced(txn, key)) {
            _orphanedDocuments.of(txn).remove(key);
        }
        else {
            _orphanedDocuments.of(txn).add(key);
        }
    }

    /**
     * No byte budget applies to eager collection.
     */
    public @Override long documentSize(final MaybeDocument document) {

        return 0L;
    }

    protected boolean isReferenced(final PersistenceTransaction txn, final DocumentKey key) {

        final Predicate<DocumentKey> referenced = Predicates.or(
                targetCacheContains(txn),
                mutationQueuesContain(txn),
                pinnedInMemory());

        return referenced.apply(key);
    }
}
