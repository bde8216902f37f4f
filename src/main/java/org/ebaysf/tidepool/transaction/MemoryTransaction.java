package org.ebaysf.tidepool.transaction;

import com.google.common.base.MoreObjects;

/**
 * Memory persistence is not actually transactional; this only carries the sequence number assigned to
 * the running transaction.
 */
public class MemoryTransaction extends PersistenceTransaction {

    private final long _currentSequenceNumber;

    public MemoryTransaction(final long currentSequenceNumber) {

        _currentSequenceNumber = currentSequenceNumber;
    }

    public @Override long getCurrentSequenceNumber() {
        return _currentSequenceNumber;
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("sequenceNumber", _currentSequenceNumber)
                .toString();
    }
}
