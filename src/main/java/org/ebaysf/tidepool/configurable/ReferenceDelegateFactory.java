package org.ebaysf.tidepool.configurable;

import com.google.common.base.Supplier;
import org.ebaysf.tidepool.MemoryPersistence;
import org.ebaysf.tidepool.delegate.MemoryEagerDelegate;
import org.ebaysf.tidepool.delegate.MemoryLruDelegate;
import org.ebaysf.tidepool.delegate.MemoryReferenceDelegate;
import org.ebaysf.tidepool.gc.EagerScheduler;
import org.ebaysf.tidepool.gc.GarbageCollectionScheduler;
import org.ebaysf.tidepool.gc.LruDelegate;
import org.ebaysf.tidepool.gc.LruScheduler;

import java.util.Set;

/**
 * Picks the garbage collection policy. Memory persistence calls {@link #create} while it is being
 * constructed, so the delegate and persistence can both hold final references to each other.
 */
public interface ReferenceDelegateFactory {

    ReferenceDelegateFactory EAGER = new ReferenceDelegateFactory() {

        public @Override MemoryReferenceDelegate create(final MemoryPersistence persistence,
                                                        final Configuration configuration) {

            return new MemoryEagerDelegate(persistence);
        }

        public @Override GarbageCollectionScheduler newScheduler(final MemoryPersistence persistence,
                                                                 final Configuration configuration,
                                                                 final Supplier<? extends Set<Integer>> activeTargetIds) {

            return new EagerScheduler();
        }

        public @Override String toString() {
            return "EAGER";
        }
    };

    ReferenceDelegateFactory LRU = new ReferenceDelegateFactory() {

        public @Override MemoryReferenceDelegate create(final MemoryPersistence persistence,
                                                        final Configuration configuration) {

            return new MemoryLruDelegate(persistence, configuration.getLruParams(), configuration.getEventBus());
        }

        public @Override GarbageCollectionScheduler newScheduler(final MemoryPersistence persistence,
                                                                 final Configuration configuration,
                                                                 final Supplier<? extends Set<Integer>> activeTargetIds) {

            final LruDelegate delegate = (LruDelegate) persistence.getReferenceDelegate();
            return new LruScheduler(delegate.getGarbageCollector(), persistence, configuration.getAsyncQueue(), activeTargetIds);
        }

        public @Override String toString() {
            return "LRU";
        }
    };

    MemoryReferenceDelegate create(final MemoryPersistence persistence, final Configuration configuration);

    GarbageCollectionScheduler newScheduler(final MemoryPersistence persistence,
                                            final Configuration configuration,
                                            final Supplier<? extends Set<Integer>> activeTargetIds);
}
