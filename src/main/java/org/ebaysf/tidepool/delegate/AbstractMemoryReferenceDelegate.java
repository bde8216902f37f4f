package org.ebaysf.tidepool.delegate;

import com.google.common.base.Preconditions;
import com.google.common.base.Predicate;
import org.ebaysf.tidepool.MemoryPersistence;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

/**
 * Holds what both policies share: the back reference to persistence, the borrowed pins, and the
 * reachability checks that get combined (in policy specific order) with {@code Predicates.or}.
 */
public abstract class AbstractMemoryReferenceDelegate implements MemoryReferenceDelegate {

    protected final MemoryPersistence _persistence;

    private ReferenceSet _inMemoryPins;

    protected AbstractMemoryReferenceDelegate(final MemoryPersistence persistence) {

        _persistence = Preconditions.checkNotNull(persistence);
    }

    public @Override void setInMemoryPins(final ReferenceSet inMemoryPins) {

        _inMemoryPins = Preconditions.checkNotNull(inMemoryPins);
    }

    protected ReferenceSet inMemoryPins() {

        Preconditions.checkState(_inMemoryPins != null, "in-memory pins must be set before use");
        return _inMemoryPins;
    }

    protected Predicate<DocumentKey> targetCacheContains(final PersistenceTransaction txn) {

        return new Predicate<DocumentKey>() {
            public @Override boolean apply(final DocumentKey key) {
                return _persistence.getTargetCache().containsKey(txn, key);
            }
        };
    }

    protected Predicate<DocumentKey> mutationQueuesContain(final PersistenceTransaction txn) {

        return new Predicate<DocumentKey>() {
            public @Override boolean apply(final DocumentKey key) {
                return _persistence.mutationQueuesContainKey(txn, key);
            }
        };
    }

    protected Predicate<DocumentKey> pinnedInMemory() {

        return new Predicate<DocumentKey>() {
            public @Override boolean apply(final DocumentKey key) {
                return inMemoryPins().containsKey(key);
            }
        };
    }
}
