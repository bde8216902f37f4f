package org.ebaysf.tidepool.cache;

import com.google.common.base.Function;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;
import org.javatuples.Pair;

import java.util.Map;
import java.util.NavigableMap;
import java.util.function.Consumer;

/**
 * Keeps each entry together with its size as computed by the sizer when it was written.
 */
public class MemoryRemoteDocumentCache implements RemoteDocumentCache {

    private final NavigableMap<DocumentKey, Pair<MaybeDocument, Long>> _docs = Maps.newTreeMap();
    private final Function<MaybeDocument, Long> _sizer;

    private long _size = 0L;

    public MemoryRemoteDocumentCache(final Function<MaybeDocument, Long> sizer) {

        _sizer = Preconditions.checkNotNull(sizer);
    }

    public @Override MaybeDocument getEntry(final PersistenceTransaction txn, final DocumentKey key) {

        final Pair<MaybeDocument, Long> entry = _docs.get(key);
        return entry != null ? entry.getValue0() : null;
    }

    public @Override void forEachDocumentKey(final PersistenceTransaction txn, final Consumer<DocumentKey> consumer) {

        for (DocumentKey key : ImmutableList.copyOf(_docs.keySet())) {
            consumer.accept(key);
        }
    }

    public @Override long getSize(final PersistenceTransaction txn) {

        return _size;
    }

    public int getEntryCount() {

        return _docs.size();
    }

    public @Override RemoteDocumentChangeBuffer newChangeBuffer() {

        return new RemoteDocumentChangeBuffer() {

            protected @Override MaybeDocument getFromCache(final PersistenceTransaction txn, final DocumentKey key) {

                return MemoryRemoteDocumentCache.this.getEntry(txn, key);
            }

            protected @Override void applyChanges(final PersistenceTransaction txn,
                                                  final Map<DocumentKey, Optional<MaybeDocument>> changes) {

                for (Map.Entry<DocumentKey, Optional<MaybeDocument>> change : changes.entrySet()) {
                    if (change.getValue().isPresent()) {
                        putEntry(change.getValue().get());
                    }
                    else {
                        deleteEntry(change.getKey());
                    }
                }
            }
        };
    }

    private void putEntry(final MaybeDocument document) {

        final long size = _sizer.apply(document);
        final Pair<MaybeDocument, Long> previous = _docs.put(document.getKey(), Pair.with(document, size));

        _size += size - (previous != null ? previous.getValue1() : 0L);
    }

    private void deleteEntry(final DocumentKey key) {

        final Pair<MaybeDocument, Long> previous = _docs.remove(key);
        if (previous != null) {
            _size -= previous.getValue1();
        }
    }
}
