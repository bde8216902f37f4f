package org.ebaysf.tidepool.gc;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.MinMaxPriorityQueue;
import com.google.common.eventbus.EventBus;
import org.ebaysf.tidepool.event.PostGarbageCollectionEvent;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.ListenSequence;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Collects the least recently used targets and documents once the cache grows past the configured threshold.
 * A collection takes the given percentile of all sequence numbers (targets plus orphaned documents) as its
 * cutoff, then removes inactive targets and unpinned documents at or below it.
 */
public class LruGarbageCollector {

    private static final Logger LOG = LoggerFactory.getLogger(LruGarbageCollector.class);

    private final LruDelegate _delegate;
    private final LruParams _params;
    private final EventBus _eventBus;

    public LruGarbageCollector(final LruDelegate delegate,
                               final LruParams params,
                               final EventBus eventBus) {

        _delegate = Preconditions.checkNotNull(delegate);
        _params = Preconditions.checkNotNull(params);
        _eventBus = Preconditions.checkNotNull(eventBus);
    }

    public LruParams getParams() {
        return _params;
    }

    /**
     * @return how many sequence numbers make up the given percentile
     */
    public long calculateTargetCount(final PersistenceTransaction txn, final int percentile) {

        final long sequenceNumberCount = _delegate.getSequenceNumberCount(txn);
        return (long) Math.floor(percentile / 100.0d * sequenceNumberCount);
    }

    /**
     * @return the n-th smallest sequence number in use, or {@link ListenSequence#INVALID} if there is none
     */
    public long nthSequenceNumber(final PersistenceTransaction txn, final int n) {

        if (n == 0) {
            return ListenSequence.INVALID;
        }

        // bounded to n: offering to a full queue drops its greatest element
        final MinMaxPriorityQueue<Long> smallest = MinMaxPriorityQueue.maximumSize(n).create();

        _delegate.forEachTarget(txn, new Consumer<TargetData>() {
            public @Override void accept(final TargetData targetData) {
                smallest.offer(targetData.getSequenceNumber());
            }
        });
        _delegate.forEachOrphanedDocumentSequenceNumber(txn, new Consumer<Long>() {
            public @Override void accept(final Long sequenceNumber) {
                smallest.offer(sequenceNumber);
            }
        });

        return smallest.isEmpty() ? ListenSequence.INVALID : smallest.peekLast();
    }

    public int removeTargets(final PersistenceTransaction txn,
                             final long upperBound,
                             final Set<Integer> activeTargetIds) {

        return _delegate.removeTargets(txn, upperBound, activeTargetIds);
    }

    public int removeOrphanedDocuments(final PersistenceTransaction txn, final long upperBound) {

        return _delegate.removeOrphanedDocuments(txn, upperBound);
    }

    public LruResults collect(final PersistenceTransaction txn, final Set<Integer> activeTargetIds) {

        if (_params.getCacheSizeCollectionThreshold() == LruParams.COLLECTION_DISABLED) {
            LOG.debug("[lru gc] garbage collection skipped; disabled");
            return LruResults.DID_NOT_RUN;
        }

        final long cacheSize = getCacheSize(txn);
        if (cacheSize < _params.getCacheSizeCollectionThreshold()) {
            LOG.debug("[lru gc] garbage collection skipped; cache size {} is lower than threshold {}",
                    cacheSize, _params.getCacheSizeCollectionThreshold());
            return LruResults.DID_NOT_RUN;
        }

        return runGarbageCollection(txn, activeTargetIds);
    }

    public long getCacheSize(final PersistenceTransaction txn) {

        return _delegate.getCacheSize(txn);
    }

    private LruResults runGarbageCollection(final PersistenceTransaction txn, final Set<Integer> activeTargetIds) {

        final Stopwatch stopwatch = Stopwatch.createStarted();

        long sequenceNumbersToCollect = calculateTargetCount(txn, _params.getPercentileToCollect());
        if (sequenceNumbersToCollect > _params.getMaximumSequenceNumbersToCollect()) {
            LOG.debug("[lru gc] capping sequence numbers to collect down to the maximum of {} from {}",
                    _params.getMaximumSequenceNumbersToCollect(), sequenceNumbersToCollect);
            sequenceNumbersToCollect = _params.getMaximumSequenceNumbersToCollect();
        }
        final long countedTargetsMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        final long upperBound = nthSequenceNumber(txn, (int) sequenceNumbersToCollect);
        final long foundUpperBoundMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        final int targetsRemoved = removeTargets(txn, upperBound, activeTargetIds);
        final long removedTargetsMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        final int documentsRemoved = removeOrphanedDocuments(txn, upperBound);
        final long removedDocumentsMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

        LOG.debug("[lru gc] counted targets in {}ms, determined least recently used {} in {}ms, "
                        + "removed {} targets in {}ms, removed {} documents in {}ms, total {}ms",
                countedTargetsMs,
                sequenceNumbersToCollect, foundUpperBoundMs - countedTargetsMs,
                targetsRemoved, removedTargetsMs - foundUpperBoundMs,
                documentsRemoved, removedDocumentsMs - removedTargetsMs,
                removedDocumentsMs);

        final LruResults results = new LruResults(true, sequenceNumbersToCollect, targetsRemoved, documentsRemoved);
        _eventBus.post(new PostGarbageCollectionEvent(results));
        return results;
    }
}
