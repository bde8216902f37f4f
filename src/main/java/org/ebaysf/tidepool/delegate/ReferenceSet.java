package org.ebaysf.tidepool.delegate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import org.ebaysf.tidepool.model.DocumentKey;

/**
 * A collection of (document key, id) references, searchable both ways.
 * <p>
 * Used by the target cache (id is the target id), by mutation queues (id is the batch id) and by
 * callers as the set of in-memory pins that persistence only borrows.
 */
public class ReferenceSet {

    private final SetMultimap<DocumentKey, Integer> _idsByKey = LinkedHashMultimap.create();
    private final SetMultimap<Integer, DocumentKey> _keysById = LinkedHashMultimap.create();

    public boolean isEmpty() {

        return _idsByKey.isEmpty();
    }

    public void addReference(final DocumentKey key, final int id) {

        Preconditions.checkNotNull(key);

        _idsByKey.put(key, id);
        _keysById.put(id, key);
    }

    public void addReferences(final Iterable<DocumentKey> keys, final int id) {

        for (DocumentKey key : keys) {
            addReference(key, id);
        }
    }

    public void removeReference(final DocumentKey key, final int id) {

        _idsByKey.remove(key, id);
        _keysById.remove(id, key);
    }

    public void removeReferences(final Iterable<DocumentKey> keys, final int id) {

        for (DocumentKey key : keys) {
            removeReference(key, id);
        }
    }

    /**
     * @return the keys that were referenced by the id
     */
    public ImmutableSet<DocumentKey> removeReferencesForId(final int id) {

        final ImmutableSet<DocumentKey> removed = ImmutableSet.copyOf(_keysById.removeAll(id));
        for (DocumentKey key : removed) {
            _idsByKey.remove(key, id);
        }
        return removed;
    }

    public void removeAllReferences() {

        _idsByKey.clear();
        _keysById.clear();
    }

    public ImmutableSet<DocumentKey> referencesForId(final int id) {

        return ImmutableSet.copyOf(_keysById.get(id));
    }

    public boolean containsKey(final DocumentKey key) {

        return _idsByKey.containsKey(key);
    }
}
