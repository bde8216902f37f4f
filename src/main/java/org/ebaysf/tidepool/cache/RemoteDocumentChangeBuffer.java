package org.ebaysf.tidepool.cache;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.Map;

/**
 * Stages writes to a remote document cache and applies them together. The last staged change for a key wins,
 * an absent value stands for a removal. A buffer applies once.
 */
public abstract class RemoteDocumentChangeBuffer {

    private final Map<DocumentKey, Optional<MaybeDocument>> _changes = Maps.newLinkedHashMap();
    private boolean _applied = false;

    public void addEntry(final MaybeDocument document) {

        assertNotApplied();
        _changes.put(document.getKey(), Optional.of(document));
    }

    public void removeEntry(final DocumentKey key) {

        assertNotApplied();
        _changes.put(key, Optional.<MaybeDocument>absent());
    }

    /**
     * @return the staged entry for the key if there is one, otherwise what the cache holds
     */
    public MaybeDocument getEntry(final PersistenceTransaction txn, final DocumentKey key) {

        final Optional<MaybeDocument> staged = _changes.get(key);
        if (staged != null) {
            return staged.orNull();
        }
        return getFromCache(txn, key);
    }

    public void apply(final PersistenceTransaction txn) {

        assertNotApplied();
        _applied = true;

        applyChanges(txn, ImmutableMap.copyOf(_changes));
    }

    protected abstract MaybeDocument getFromCache(final PersistenceTransaction txn, final DocumentKey key);

    protected abstract void applyChanges(final PersistenceTransaction txn,
                                         final Map<DocumentKey, Optional<MaybeDocument>> changes);

    private void assertNotApplied() {

        Preconditions.checkState(!_applied, "Changes have already been applied.");
    }
}
