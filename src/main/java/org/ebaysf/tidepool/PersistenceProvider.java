package org.ebaysf.tidepool;

import com.google.common.base.Supplier;
import org.ebaysf.tidepool.configurable.Configuration;
import org.ebaysf.tidepool.gc.GarbageCollectionScheduler;

import java.util.Set;

/**
 * Builds persistence and the garbage collection scheduler that goes with it.
 */
public interface PersistenceProvider {

    /**
     * @param activeTargetIds ids of the targets currently listened to, which collection must never remove
     */
    void initialize(final Configuration configuration, final Supplier<? extends Set<Integer>> activeTargetIds);

    Persistence getPersistence();

    GarbageCollectionScheduler getGarbageCollectionScheduler();

    void clearPersistence();
}
