package org.ebaysf.tidepool.delegate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.transaction.ListenSequence;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.Set;

/**
 * Scratch set of keys that lost a reference during one transaction. Opened when the transaction starts,
 * closed when it commits, and unusable by anyone else or at any other time.
 */
final class OrphanedDocuments {

    static final String OUTSIDE_TRANSACTION = "orphanedDocuments is only valid during a transaction.";

    static final OrphanedDocuments CLOSED = new OrphanedDocuments(ListenSequence.INVALID, false);

    private final long _sequenceNumber;
    private final Set<DocumentKey> _keys = Sets.newLinkedHashSet();
    private boolean _open;

    private OrphanedDocuments(final long sequenceNumber, final boolean open) {

        _sequenceNumber = sequenceNumber;
        _open = open;
    }

    static OrphanedDocuments open(final PersistenceTransaction txn) {

        return new OrphanedDocuments(txn.getCurrentSequenceNumber(), true);
    }

    OrphanedDocuments of(final PersistenceTransaction txn) {

        Preconditions.checkState(_open && txn.getCurrentSequenceNumber() == _sequenceNumber, OUTSIDE_TRANSACTION);
        return this;
    }

    void add(final DocumentKey key) {

        _keys.add(key);
    }

    void remove(final DocumentKey key) {

        _keys.remove(key);
    }

    /**
     * @return the candidates; the guard is invalid afterwards
     */
    ImmutableSet<DocumentKey> close() {

        Preconditions.checkState(_open, OUTSIDE_TRANSACTION);
        _open = false;
        return ImmutableSet.copyOf(_keys);
    }
}
