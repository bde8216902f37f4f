package org.ebaysf.tidepool.model;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

/**
 * A group of local writes enqueued together; only the keys they touch matter to persistence.
 */
public final class MutationBatch {

    private final int _batchId;
    private final ImmutableSet<DocumentKey> _keys;

    public MutationBatch(final int batchId, final Iterable<DocumentKey> keys) {

        _batchId = batchId;
        _keys = ImmutableSet.copyOf(keys);
    }

    public int getBatchId() {
        return _batchId;
    }

    public ImmutableSet<DocumentKey> getKeys() {
        return _keys;
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("batchId", _batchId)
                .add("keys", _keys)
                .toString();
    }
}
