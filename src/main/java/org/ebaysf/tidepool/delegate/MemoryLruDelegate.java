package org.ebaysf.tidepool.delegate;

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.eventbus.EventBus;
import org.ebaysf.tidepool.MemoryPersistence;
import org.ebaysf.tidepool.cache.RemoteDocumentCache;
import org.ebaysf.tidepool.cache.RemoteDocumentChangeBuffer;
import org.ebaysf.tidepool.cache.TargetCache;
import org.ebaysf.tidepool.gc.LruDelegate;
import org.ebaysf.tidepool.gc.LruGarbageCollector;
import org.ebaysf.tidepool.gc.LruParams;
import org.ebaysf.tidepool.model.Document;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;
import org.ebaysf.tidepool.util.Gsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Defers deletion to an {@link LruGarbageCollector}. Each reference event stamps the key with the current
 * sequence number; whether a key may be removed is decided at sweep time by {@link #isPinned}.
 */
public class MemoryLruDelegate extends AbstractMemoryReferenceDelegate implements LruDelegate {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryLruDelegate.class);

    private final Map<DocumentKey, Long> _orphanedSequenceNumbers = Maps.newHashMap();
    private final LruGarbageCollector _garbageCollector;

    public MemoryLruDelegate(final MemoryPersistence persistence,
                             final LruParams lruParams,
                             final EventBus eventBus) {

        super(persistence);

        _garbageCollector = new LruGarbageCollector(this, lruParams, eventBus);
    }

    public @Override LruGarbageCollector getGarbageCollector() {
        return _garbageCollector;
    }

    // Nothing to bracket, deletion happens in removeOrphanedDocuments.
    public @Override void onTransactionStarted(final PersistenceTransaction txn) {

    }

    public @Override void onTransactionCommitted(final PersistenceTransaction txn) {

    }

    public @Override void forEachTarget(final PersistenceTransaction txn, final Consumer<TargetData> consumer) {

        _persistence.getTargetCache().forEachTarget(txn, consumer);
    }

    public @Override long getSequenceNumberCount(final PersistenceTransaction txn) {

        final long[] orphaned = {0L};
        forEachOrphanedDocumentSequenceNumber(txn, new Consumer<Long>() {
            public @Override void accept(final Long sequenceNumber) {
                orphaned[0] += 1;
            }
        });

        return _persistence.getTargetCache().getTargetCount(txn) + orphaned[0];
    }

    public @Override void forEachOrphanedDocumentSequenceNumber(final PersistenceTransaction txn,
                                                                final Consumer<Long> consumer) {

        for (Map.Entry<DocumentKey, Long> entry : ImmutableMap.copyOf(_orphanedSequenceNumbers).entrySet()) {
            // its own sequence number as the upper bound, so it can't count as too recent
            if (!isPinned(txn, entry.getKey(), entry.getValue())) {
                consumer.accept(entry.getValue());
            }
        }
    }

    public @Override int removeTargets(final PersistenceTransaction txn,
                                       final long upperBound,
                                       final Set<Integer> activeTargetIds) {

        return _persistence.getTargetCache().removeTargets(txn, upperBound, activeTargetIds);
    }

    public @Override int removeOrphanedDocuments(final PersistenceTransaction txn, final long upperBound) {

        final RemoteDocumentCache cache = _persistence.getRemoteDocumentCache();
        final RemoteDocumentChangeBuffer changeBuffer = cache.newChangeBuffer();
        final List<DocumentKey> removed = Lists.newArrayList();

        cache.forEachDocumentKey(txn, new Consumer<DocumentKey>() {
            public @Override void accept(final DocumentKey key) {
                if (!isPinned(txn, key, upperBound)) {
                    removed.add(key);
                    changeBuffer.removeEntry(key);
                }
            }
        });
        changeBuffer.apply(txn);

        _orphanedSequenceNumbers.keySet().removeAll(removed);

        LOG.debug("[lru gc] removed {} orphaned documents up to sequence number {}", removed.size(), upperBound);
        return removed.size();
    }

    public @Override long getCacheSize(final PersistenceTransaction txn) {

        return _persistence.getRemoteDocumentCache().getSize(txn);
    }

    public @Override void addReference(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedSequenceNumbers.put(key, txn.getCurrentSequenceNumber());
    }

    public @Override void removeReference(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedSequenceNumbers.put(key, txn.getCurrentSequenceNumber());
    }

    public @Override void removeMutationReference(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedSequenceNumbers.put(key, txn.getCurrentSequenceNumber());
    }

    /**
     * Stamps the documents the target still matches and the target itself with the current sequence number.
     * The target's metadata goes once a collection cutoff passes that number, see {@link #removeTargets}.
     */
    public @Override void removeTarget(final PersistenceTransaction txn, final TargetData targetData) {

        final TargetCache targetCache = _persistence.getTargetCache();

        for (DocumentKey key : targetCache.getMatchingKeysForTargetId(txn, targetData.getTargetId())) {
            _orphanedSequenceNumbers.put(key, txn.getCurrentSequenceNumber());
        }
        targetCache.updateTargetData(txn, targetData.withSequenceNumber(txn.getCurrentSequenceNumber()));
    }

    public @Override void updateLimboDocument(final PersistenceTransaction txn, final DocumentKey key) {

        _orphanedSequenceNumbers.put(key, txn.getCurrentSequenceNumber());
    }

    public @Override long documentSize(final MaybeDocument document) {

        long size = document.getKey().toString().length();
        if (document instanceof Document) {
            size += Gsons.estimateByteSize(((Document) document).getData());
        }
        return size;
    }

    /**
     * @return whether the key must survive a collection up to {@code upperBound}
     */
    public boolean isPinned(final PersistenceTransaction txn, final DocumentKey key, final long upperBound) {

        final Predicate<DocumentKey> pinned = Predicates.or(
                mutationQueuesContain(txn),
                pinnedInMemory(),
                targetCacheContains(txn),
                orphanedAfter(upperBound));

        return pinned.apply(key);
    }

    private Predicate<DocumentKey> orphanedAfter(final long upperBound) {

        return new Predicate<DocumentKey>() {
            public @Override boolean apply(final DocumentKey key) {
                final Long orphanedAt = _orphanedSequenceNumbers.get(key);
                return orphanedAt != null && orphanedAt > upperBound;
            }
        };
    }
}
