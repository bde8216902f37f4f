package org.ebaysf.tidepool.model;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A document known to exist at the given version, with its field data.
 */
public class Document extends MaybeDocument {

    private final ImmutableMap<String, Object> _data;

    public Document(final DocumentKey key, final long version, final Map<String, ?> data) {

        super(key, version);

        _data = ImmutableMap.copyOf(data);
    }

    public ImmutableMap<String, Object> getData() {
        return _data;
    }

    public @Override boolean exists() {
        return true;
    }

    public @Override boolean equals(final Object other) {

        if (!(other instanceof Document)) {
            return false;
        }
        final Document that = (Document) other;
        return getKey().equals(that.getKey()) && getVersion() == that.getVersion() && _data.equals(that._data);
    }

    public @Override int hashCode() {

        return Objects.hashCode(getKey(), getVersion(), _data);
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("key", getKey())
                .add("version", getVersion())
                .add("data", _data)
                .toString();
    }
}
