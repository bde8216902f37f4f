package org.ebaysf.tidepool.model;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;

/**
 * Immutable key of a document, the path of alternating collection and document ids.
 */
public final class DocumentKey implements Comparable<DocumentKey> {

    private static final Splitter SPLITTER = Splitter.on('/').omitEmptyStrings();
    private static final Joiner JOINER = Joiner.on('/');
    private static final Ordering<Iterable<String>> PATH_ORDER = Ordering.<String>natural().lexicographical();

    private final ImmutableList<String> _segments;

    private DocumentKey(final ImmutableList<String> segments) {

        Preconditions.checkArgument(!segments.isEmpty() && segments.size() % 2 == 0,
                "Invalid document key path, must have an even number of segments: %s", segments);

        _segments = segments;
    }

    public static DocumentKey fromPathString(final String path) {

        return new DocumentKey(ImmutableList.copyOf(SPLITTER.split(Preconditions.checkNotNull(path))));
    }

    public static DocumentKey fromSegments(final List<String> segments) {

        return new DocumentKey(ImmutableList.copyOf(segments));
    }

    public List<String> getSegments() {
        return _segments;
    }

    public String getCollectionGroup() {
        return _segments.get(_segments.size() - 2);
    }

    public @Override int compareTo(final DocumentKey other) {

        return PATH_ORDER.compare(_segments, other._segments);
    }

    public @Override boolean equals(final Object other) {

        return other instanceof DocumentKey && _segments.equals(((DocumentKey) other)._segments);
    }

    public @Override int hashCode() {

        return _segments.hashCode();
    }

    public @Override String toString() {

        return JOINER.join(_segments);
    }
}
