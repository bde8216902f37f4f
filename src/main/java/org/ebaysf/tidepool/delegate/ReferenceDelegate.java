package org.ebaysf.tidepool.delegate;

import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

/**
 * Receives notice of every reference a target, a mutation or an in-memory pin gains or drops, and decides
 * when unreferenced documents leave the remote document cache. The caches report to it without knowing
 * which collection policy sits behind it.
 */
public interface ReferenceDelegate {

    /**
     * Lends the caller's in-memory pins. Persistence reads them but never modifies or releases them.
     */
    void setInMemoryPins(final ReferenceSet inMemoryPins);

    /**
     * A target or pin started referencing the document.
     */
    void addReference(final PersistenceTransaction txn, final DocumentKey key);

    /**
     * A target or pin stopped referencing the document.
     */
    void removeReference(final PersistenceTransaction txn, final DocumentKey key);

    /**
     * A pending write for the document was acknowledged or rejected.
     */
    void removeMutationReference(final PersistenceTransaction txn, final DocumentKey key);

    /**
     * Tears down a target: the documents it still matches lose that reference first, then its metadata goes.
     */
    void removeTarget(final PersistenceTransaction txn, final TargetData targetData);

    /**
     * The document is in limbo; its reference state is recomputed.
     */
    void updateLimboDocument(final PersistenceTransaction txn, final DocumentKey key);
}
