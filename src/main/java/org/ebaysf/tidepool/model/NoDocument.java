package org.ebaysf.tidepool.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Marks a document known not to exist at the given version.
 */
public class NoDocument extends MaybeDocument {

    public NoDocument(final DocumentKey key, final long version) {

        super(key, version);
    }

    public @Override boolean exists() {
        return false;
    }

    public @Override boolean equals(final Object other) {

        if (!(other instanceof NoDocument)) {
            return false;
        }
        final NoDocument that = (NoDocument) other;
        return getKey().equals(that.getKey()) && getVersion() == that.getVersion();
    }

    public @Override int hashCode() {

        return Objects.hashCode(getKey(), getVersion());
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("key", getKey())
                .add("version", getVersion())
                .toString();
    }
}
