package org.ebaysf.tidepool;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import org.ebaysf.tidepool.configurable.Configuration;
import org.ebaysf.tidepool.gc.GarbageCollectionScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

public class MemoryPersistenceProvider implements PersistenceProvider {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryPersistenceProvider.class);

    public static final String MEMORY_ONLY_PERSISTENCE_ERROR_MESSAGE =
            "You are using the memory-only build of Tidepool. Persistence support is "
                    + "only available via a build that ships a durable storage backend.";

    private static final String NOT_INITIALIZED = "initialize() not called";

    private MemoryPersistence _persistence;
    private GarbageCollectionScheduler _garbageCollectionScheduler;

    public @Override void initialize(final Configuration configuration,
                                     final Supplier<? extends Set<Integer>> activeTargetIds) {

        if (configuration.isDurable()) {
            throw new TidepoolException(TidepoolException.Code.FAILED_PRECONDITION, MEMORY_ONLY_PERSISTENCE_ERROR_MESSAGE);
        }

        _persistence = new MemoryPersistence(configuration);
        _garbageCollectionScheduler = configuration.getReferenceDelegateFactory()
                .newScheduler(_persistence, configuration, Preconditions.checkNotNull(activeTargetIds));

        LOG.info("[provider] memory persistence initialized");
    }

    public @Override MemoryPersistence getPersistence() {

        Preconditions.checkState(_persistence != null, NOT_INITIALIZED);
        return _persistence;
    }

    public @Override GarbageCollectionScheduler getGarbageCollectionScheduler() {

        Preconditions.checkState(_garbageCollectionScheduler != null, NOT_INITIALIZED);
        return _garbageCollectionScheduler;
    }

    /**
     * Always fails; there is nothing durable to clear.
     */
    public @Override void clearPersistence() {

        throw new TidepoolException(TidepoolException.Code.FAILED_PRECONDITION, MEMORY_ONLY_PERSISTENCE_ERROR_MESSAGE);
    }
}
