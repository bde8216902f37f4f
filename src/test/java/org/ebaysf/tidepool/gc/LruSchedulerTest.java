package org.ebaysf.tidepool.gc;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableScheduledFuture;
import com.google.common.util.concurrent.ListeningScheduledExecutorService;
import org.ebaysf.tidepool.MemoryPersistence;
import org.ebaysf.tidepool.cache.RemoteDocumentChangeBuffer;
import org.ebaysf.tidepool.configurable.ConfigurationBuilder;
import org.ebaysf.tidepool.configurable.ReferenceDelegateFactory;
import org.ebaysf.tidepool.delegate.MemoryLruDelegate;
import org.ebaysf.tidepool.delegate.ReferenceSet;
import org.ebaysf.tidepool.model.Document;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MutationBatch;
import org.ebaysf.tidepool.model.User;
import org.ebaysf.tidepool.transaction.MemoryTransaction;
import org.ebaysf.tidepool.transaction.TransactionMode;
import org.ebaysf.tidepool.transaction.TransactionOperation;
import org.ebaysf.tidepool.util.AsyncQueue;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

public class LruSchedulerTest {

    private static final DocumentKey DOC_A = DocumentKey.fromPathString("rooms/a");
    private static final User USER = new User("user");

    private ListeningScheduledExecutorService _executor;
    private ListenableScheduledFuture<?> _future;
    private RecordingAsyncQueue _asyncQueue;

    @Before
    public void setUp() {

        _executor = Mockito.mock(ListeningScheduledExecutorService.class);
        _future = Mockito.mock(ListenableScheduledFuture.class);

        Mockito.doReturn(_future).when(_executor)
                .schedule(Mockito.<Callable<Object>>any(), Mockito.anyLong(), Mockito.any(TimeUnit.class));

        _asyncQueue = new RecordingAsyncQueue(_executor);
    }

    @Test
    public void testStartSchedulesInitialThenRegularCollections() throws Exception {

        final LruScheduler scheduler = newScheduler(newPersistence(LruParams.DEFAULT), _asyncQueue);

        Assert.assertFalse(scheduler.isStarted());
        scheduler.start();
        Assert.assertTrue(scheduler.isStarted());
        Assert.assertEquals(Lists.newArrayList(LruScheduler.INITIAL_GC_DELAY_MS), _asyncQueue._delays);

        _asyncQueue._tasks.get(0).call();

        Assert.assertEquals(Lists.newArrayList(LruScheduler.INITIAL_GC_DELAY_MS, LruScheduler.REGULAR_GC_DELAY_MS),
                _asyncQueue._delays);
        Assert.assertTrue(scheduler.isStarted());
    }

    @Test
    public void testStopCancelsAndPreventsRescheduling() throws Exception {

        final LruScheduler scheduler = newScheduler(newPersistence(LruParams.DEFAULT), _asyncQueue);
        scheduler.start();

        scheduler.stop();
        Assert.assertFalse(scheduler.isStarted());
        Mockito.verify(_future).cancel(false);

        _asyncQueue._tasks.get(0).call();
        Assert.assertEquals(1, _asyncQueue._tasks.size());
    }

    @Test
    public void testStopWhileReschedulingKeepsSchedulerStopped() throws Exception {

        final AtomicReference<LruScheduler> schedulerRef = new AtomicReference<LruScheduler>(null);
        final RecordingAsyncQueue asyncQueue = new RecordingAsyncQueue(_executor) {
            public @Override <T> ListenableScheduledFuture<T> enqueueAfterDelay(final long delay,
                                                                               final TimeUnit unit,
                                                                               final Callable<T> task) {
                if (_tasks.size() == 1) {
                    schedulerRef.get().stop();
                }
                return super.enqueueAfterDelay(delay, unit, task);
            }
        };

        final LruScheduler scheduler = newScheduler(newPersistence(LruParams.DEFAULT), asyncQueue);
        schedulerRef.set(scheduler);
        scheduler.start();

        asyncQueue._tasks.get(0).call();

        Assert.assertFalse(scheduler.isStarted());
        // once for the running task by stop(), once for the task enqueued after it
        Mockito.verify(_future, Mockito.times(2)).cancel(false);

        scheduler.start();
        Assert.assertTrue(scheduler.isStarted());
    }

    @Test
    public void testFailingCollectionStopsScheduler() throws Exception {

        final MemoryPersistence persistence = newPersistence(LruParams.DEFAULT);
        final LruScheduler scheduler = newScheduler(persistence, _asyncQueue);
        scheduler.start();

        persistence.shutdown();
        _asyncQueue._tasks.get(0).call();

        Assert.assertFalse(scheduler.isStarted());
        Assert.assertEquals(1, _asyncQueue._tasks.size());
        Mockito.verify(_future).cancel(false);
    }

    @Test(expected = IllegalStateException.class)
    public void testStartTwiceFails() {

        final LruScheduler scheduler = newScheduler(newPersistence(LruParams.DEFAULT), _asyncQueue);
        scheduler.start();
        scheduler.start();
    }

    @Test
    public void testDisabledCollectionIsNeverScheduled() {

        final LruScheduler scheduler = newScheduler(newPersistence(LruParams.DISABLED), _asyncQueue);
        scheduler.start();

        Assert.assertFalse(scheduler.isStarted());
        Assert.assertTrue(_asyncQueue._tasks.isEmpty());
        Mockito.verifyNoInteractions(_executor);
    }

    @Test
    public void testCollectGarbageRunsInItsOwnTransaction() throws Exception {

        final MemoryPersistence persistence = newPersistence(new LruParams(0L, 100, 1000));

        run(persistence, new TransactionOperation<Void>() {
            public @Override Void execute(final MemoryTransaction txn) {
                final RemoteDocumentChangeBuffer changeBuffer = persistence.getRemoteDocumentCache().newChangeBuffer();
                changeBuffer.addEntry(new Document(DOC_A, 1L, ImmutableMap.of("v", 1)));
                changeBuffer.apply(txn);
                return null;
            }
        });
        final MutationBatch batch = run(persistence, new TransactionOperation<MutationBatch>() {
            public @Override MutationBatch execute(final MemoryTransaction txn) {
                return persistence.getMutationQueue(USER).addMutationBatch(txn, ImmutableSet.of(DOC_A));
            }
        });
        run(persistence, new TransactionOperation<Void>() {
            public @Override Void execute(final MemoryTransaction txn) {
                persistence.getMutationQueue(USER).removeMutationBatch(txn, batch);
                return null;
            }
        });

        final LruResults results = newScheduler(persistence, _asyncQueue).collectGarbage();

        Assert.assertTrue(results.didRun());
        Assert.assertEquals(1, results.getDocumentsRemoved());
        Assert.assertNull(persistence.getRemoteDocumentCache().getEntry(null, DOC_A));
    }

    private MemoryPersistence newPersistence(final LruParams params) {

        final MemoryPersistence persistence = new MemoryPersistence(ConfigurationBuilder.builder()
                .referenceDelegateFactory(ReferenceDelegateFactory.LRU)
                .lruParams(params)
                .asyncQueue(_asyncQueue)
                .build());

        persistence.getReferenceDelegate().setInMemoryPins(new ReferenceSet());
        return persistence;
    }

    private static LruScheduler newScheduler(final MemoryPersistence persistence, final AsyncQueue asyncQueue) {

        final MemoryLruDelegate delegate = (MemoryLruDelegate) persistence.getReferenceDelegate();
        return new LruScheduler(delegate.getGarbageCollector(),
                persistence,
                asyncQueue,
                Suppliers.<Set<Integer>>ofInstance(ImmutableSet.<Integer>of()));
    }

    private static <T> T run(final MemoryPersistence persistence, final TransactionOperation<T> operation) throws Exception {

        return Futures.getDone(persistence.runTransaction("test", TransactionMode.READ_WRITE, operation));
    }

    /**
     * Keeps every delayed task and its delay so a test can run them by hand.
     */
    private static class RecordingAsyncQueue extends AsyncQueue {

        protected final List<Callable<?>> _tasks = Lists.newArrayList();
        protected final List<Long> _delays = Lists.newArrayList();

        RecordingAsyncQueue(final ListeningScheduledExecutorService executor) {

            super(executor);
        }

        public @Override <T> ListenableScheduledFuture<T> enqueueAfterDelay(final long delay,
                                                                           final TimeUnit unit,
                                                                           final Callable<T> task) {
            _tasks.add(task);
            _delays.add(unit.toMillis(delay));
            return super.enqueueAfterDelay(delay, unit, task);
        }
    }
}
