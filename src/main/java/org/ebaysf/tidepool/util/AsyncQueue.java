package org.ebaysf.tidepool.util;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListenableScheduledFuture;
import com.google.common.util.concurrent.ListeningScheduledExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * The single execution context persistence work is serialized on. Tasks run one at a time, in order,
 * each to completion before the next one starts.
 */
public class AsyncQueue {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncQueue.class);

    private final ListeningScheduledExecutorService _executor;

    public AsyncQueue() {

        this(MoreExecutors.listeningDecorator(Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("tidepool-async-queue-%d")
                        .setDaemon(true)
                        .build())));
    }

    public AsyncQueue(final ListeningScheduledExecutorService executor) {

        _executor = Preconditions.checkNotNull(executor);
    }

    public <T> ListenableFuture<T> enqueue(final Callable<T> task) {

        return _executor.submit(task);
    }

    public <T> ListenableScheduledFuture<T> enqueueAfterDelay(final long delay,
                                                              final TimeUnit unit,
                                                              final Callable<T> task) {

        return _executor.schedule(task, delay, unit);
    }

    public boolean isShutdown() {

        return _executor.isShutdown();
    }

    public void shutdown() {

        LOG.debug("[async queue] shutting down");
        _executor.shutdownNow();
    }
}
