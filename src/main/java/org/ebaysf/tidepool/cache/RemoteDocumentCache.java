package org.ebaysf.tidepool.cache;

import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.function.Consumer;

/**
 * The partial mirror of server documents. Writes go through a {@link RemoteDocumentChangeBuffer}.
 */
public interface RemoteDocumentCache {

    /**
     * @return the cached entry, or null when nothing is cached for the key
     */
    MaybeDocument getEntry(final PersistenceTransaction txn, final DocumentKey key);

    void forEachDocumentKey(final PersistenceTransaction txn, final Consumer<DocumentKey> consumer);

    /**
     * @return sum of the sizes of the cached entries, as estimated by the reference delegate
     */
    long getSize(final PersistenceTransaction txn);

    RemoteDocumentChangeBuffer newChangeBuffer();
}
