package org.ebaysf.tidepool.transaction;

/**
 * Hands out the sequence numbers that stamp transactions. Each call to {@link #next()} returns a value
 * strictly greater than every value returned before.
 */
public class ListenSequence {

    public static final long INVALID = -1L;

    private long _previousValue;

    public ListenSequence(final long previousValue) {

        _previousValue = previousValue;
    }

    public long next() {

        _previousValue += 1;
        return _previousValue;
    }

    public long current() {

        return _previousValue;
    }
}
