package org.ebaysf.tidepool;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.eventbus.EventBus;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.ebaysf.tidepool.cache.MemoryMutationQueue;
import org.ebaysf.tidepool.cache.MemoryRemoteDocumentCache;
import org.ebaysf.tidepool.cache.MemoryTargetCache;
import org.ebaysf.tidepool.cache.MutationQueue;
import org.ebaysf.tidepool.configurable.Configuration;
import org.ebaysf.tidepool.delegate.MemoryReferenceDelegate;
import org.ebaysf.tidepool.event.PostTransactionCommitEvent;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.model.User;
import org.ebaysf.tidepool.transaction.ListenSequence;
import org.ebaysf.tidepool.transaction.MemoryTransaction;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;
import org.ebaysf.tidepool.transaction.TransactionMode;
import org.ebaysf.tidepool.transaction.TransactionOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A memory-backed {@link Persistence}. Data is kept in RAM only and is lost with the process.
 * <p>
 * The reference delegate is created from the configured {@code ReferenceDelegateFactory} during construction,
 * so both sides hold final references to each other. The caches are created after it and report reference
 * changes to it.
 * <p>
 * Transactions are serialized on a single lock, whichever thread runs them: the scheduled LRU collection on
 * the async queue and callers' transactions never overlap. A transaction runs to completion, commit hook
 * included, before the next one starts. On-committed listeners and the post-commit event run after the lock
 * is released.
 */
public class MemoryPersistence implements Persistence {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryPersistence.class);

    private final EventBus _eventBus;
    private final MemoryReferenceDelegate _referenceDelegate;
    private final MemoryTargetCache _targetCache;
    private final MemoryRemoteDocumentCache _remoteDocumentCache;
    private final Map<String, MemoryMutationQueue> _mutationQueues = Maps.newLinkedHashMap();
    private final ListenSequence _listenSequence = new ListenSequence(0L);
    private final ReentrantLock _transactionLock = new ReentrantLock(true);

    private volatile boolean _started;

    public MemoryPersistence(final Configuration configuration) {

        Preconditions.checkNotNull(configuration);

        _eventBus = configuration.getEventBus();
        _started = true;
        _referenceDelegate = configuration.getReferenceDelegateFactory().create(this, configuration);
        _targetCache = new MemoryTargetCache(this);
        _remoteDocumentCache = new MemoryRemoteDocumentCache(new Function<MaybeDocument, Long>() {
            public @Override Long apply(final MaybeDocument document) {
                return _referenceDelegate.documentSize(document);
            }
        });

        LOG.debug("[persistence] memory persistence started with {}", configuration);
    }

    public @Override boolean isStarted() {

        return _started;
    }

    public @Override void shutdown() {

        // no durable state to close
        _started = false;
    }

    public @Override MutationQueue getMutationQueue(final User user) {

        MemoryMutationQueue queue = _mutationQueues.get(user.toKey());
        if (queue == null) {
            queue = new MemoryMutationQueue(_referenceDelegate);
            _mutationQueues.put(user.toKey(), queue);
        }
        return queue;
    }

    public @Override MemoryTargetCache getTargetCache() {

        return _targetCache;
    }

    public @Override MemoryRemoteDocumentCache getRemoteDocumentCache() {

        return _remoteDocumentCache;
    }

    public @Override MemoryReferenceDelegate getReferenceDelegate() {

        return _referenceDelegate;
    }

    public @Override <T> ListenableFuture<T> runTransaction(final String action,
                                                           final TransactionMode mode,
                                                           final TransactionOperation<T> operation) {

        final MemoryTransaction txn;
        final T result;
        try {
            _transactionLock.lock();

            Preconditions.checkState(_started, "Transaction '%s' requested after shutdown", action);

            LOG.debug("Starting transaction: {} ({})", action, mode);

            txn = new MemoryTransaction(_listenSequence.next());
            _referenceDelegate.onTransactionStarted(txn);

            try {
                result = operation.execute(txn);
            }
            catch (RuntimeException ex) {
                throw ex;
            }
            catch (Exception ex) {
                LOG.debug("transaction {} failed", action, ex);
                return Futures.immediateFailedFuture(ex);
            }

            _referenceDelegate.onTransactionCommitted(txn);
        }
        finally {
            _transactionLock.unlock();
        }

        final ListenableFuture<T> committed = Futures.immediateFuture(result);

        txn.raiseOnCommittedEvent();
        _eventBus.post(new PostTransactionCommitEvent(txn, action));

        return committed;
    }

    /**
     * @return whether any user's mutation queue has a pending write for the key; stops at the first that does
     */
    public boolean mutationQueuesContainKey(final PersistenceTransaction txn, final DocumentKey key) {

        return Iterables.any(_mutationQueues.values(), new Predicate<MutationQueue>() {
            public @Override boolean apply(final MutationQueue queue) {
                return queue.containsKey(txn, key);
            }
        });
    }
}
