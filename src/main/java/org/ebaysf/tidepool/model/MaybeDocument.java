package org.ebaysf.tidepool.model;

import com.google.common.base.Preconditions;

/**
 * Either a found {@link Document} or a {@link NoDocument} marker, as stored in the remote document cache.
 */
public abstract class MaybeDocument {

    private final DocumentKey _key;
    private final long _version;

    protected MaybeDocument(final DocumentKey key, final long version) {

        _key = Preconditions.checkNotNull(key);
        _version = version;
    }

    public DocumentKey getKey() {
        return _key;
    }

    public long getVersion() {
        return _version;
    }

    public abstract boolean exists();
}
