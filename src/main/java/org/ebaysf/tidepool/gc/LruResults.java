package org.ebaysf.tidepool.gc;

import com.google.common.base.MoreObjects;

/**
 * Outcome of one {@link LruGarbageCollector#collect} call.
 */
public final class LruResults {

    public static final LruResults DID_NOT_RUN = new LruResults(false, 0L, 0, 0);

    private final boolean _didRun;
    private final long _sequenceNumbersCollected;
    private final int _targetsRemoved;
    private final int _documentsRemoved;

    public LruResults(final boolean didRun,
                      final long sequenceNumbersCollected,
                      final int targetsRemoved,
                      final int documentsRemoved) {

        _didRun = didRun;
        _sequenceNumbersCollected = sequenceNumbersCollected;
        _targetsRemoved = targetsRemoved;
        _documentsRemoved = documentsRemoved;
    }

    public boolean didRun() {
        return _didRun;
    }

    public long getSequenceNumbersCollected() {
        return _sequenceNumbersCollected;
    }

    public int getTargetsRemoved() {
        return _targetsRemoved;
    }

    public int getDocumentsRemoved() {
        return _documentsRemoved;
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("didRun", _didRun)
                .add("sequenceNumbersCollected", _sequenceNumbersCollected)
                .add("targetsRemoved", _targetsRemoved)
                .add("documentsRemoved", _documentsRemoved)
                .toString();
    }
}
