package org.ebaysf.tidepool.gc;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.ebaysf.tidepool.Persistence;
import org.ebaysf.tidepool.transaction.MemoryTransaction;
import org.ebaysf.tidepool.transaction.TransactionMode;
import org.ebaysf.tidepool.transaction.TransactionOperation;
import org.ebaysf.tidepool.util.AsyncQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs an LRU collection on the async queue a minute after start, then every five minutes until stopped.
 */
public class LruScheduler implements GarbageCollectionScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(LruScheduler.class);

    public static final long INITIAL_GC_DELAY_MS = TimeUnit.MINUTES.toMillis(1);
    public static final long REGULAR_GC_DELAY_MS = TimeUnit.MINUTES.toMillis(5);

    private final LruGarbageCollector _garbageCollector;
    private final Persistence _persistence;
    private final AsyncQueue _asyncQueue;
    private final Supplier<? extends Set<Integer>> _activeTargetIds;

    private final ReentrantLock _lock = new ReentrantLock(true);

    // guarded by _lock
    private boolean _started = false;
    private Future<?> _gcTask;

    public LruScheduler(final LruGarbageCollector garbageCollector,
                        final Persistence persistence,
                        final AsyncQueue asyncQueue,
                        final Supplier<? extends Set<Integer>> activeTargetIds) {

        _garbageCollector = Preconditions.checkNotNull(garbageCollector);
        _persistence = Preconditions.checkNotNull(persistence);
        _asyncQueue = Preconditions.checkNotNull(asyncQueue);
        _activeTargetIds = Preconditions.checkNotNull(activeTargetIds);
    }

    public @Override void start() {

        try {
            _lock.lock();

            Preconditions.checkState(!_started, "Cannot start an already started LruScheduler");

            if (_garbageCollector.getParams().getCacheSizeCollectionThreshold() != LruParams.COLLECTION_DISABLED) {
                _started = true;
                scheduleGC(INITIAL_GC_DELAY_MS);
            }
        }
        finally {
            _lock.unlock();
        }
    }

    public @Override void stop() {

        try {
            _lock.lock();

            _started = false;
            if (_gcTask != null) {
                _gcTask.cancel(false);
                _gcTask = null;
            }
        }
        finally {
            _lock.unlock();
        }
    }

    public @Override boolean isStarted() {

        try {
            _lock.lock();
            return _started;
        }
        finally {
            _lock.unlock();
        }
    }

    /**
     * Runs one collection in its own transaction.
     */
    public LruResults collectGarbage() throws ExecutionException {

        final ListenableFuture<LruResults> results = _persistence.runTransaction("Collect garbage",
                TransactionMode.READ_WRITE_PRIMARY,
                new TransactionOperation<LruResults>() {
                    public @Override LruResults execute(final MemoryTransaction txn) {
                        return _garbageCollector.collect(txn, _activeTargetIds.get());
                    }
                });

        return Futures.getDone(results);
    }

    /**
     * Must be called holding the lock. A stop that happens while the task is being enqueued cancels it.
     */
    private void scheduleGC(final long delayMs) {

        LOG.debug("[lru gc] garbage collection scheduled in {}ms", delayMs);

        final Future<?> gcTask = _asyncQueue.enqueueAfterDelay(delayMs, TimeUnit.MILLISECONDS, new Callable<Void>() {
            public @Override Void call() {
                try {
                    LOG.debug("[lru gc] {}", collectGarbage());
                }
                catch (ExecutionException ex) {
                    LOG.error("garbage collection failed", ex);
                }
                catch (RuntimeException ex) {
                    LOG.error("garbage collection failed, scheduler stopped", ex);
                    stop();
                    return null;
                }
                rescheduleGC();
                return null;
            }
        });

        if (_started) {
            _gcTask = gcTask;
        }
        else {
            gcTask.cancel(false);
        }
    }

    private void rescheduleGC() {

        try {
            _lock.lock();

            if (_started) {
                scheduleGC(REGULAR_GC_DELAY_MS);
            }
        }
        finally {
            _lock.unlock();
        }
    }
}
