package org.ebaysf.tidepool.gc;

/**
 * Eager collection finishes inside each transaction, so there is nothing to schedule; only the flag is kept.
 */
public class EagerScheduler implements GarbageCollectionScheduler {

    private volatile boolean _started = false;

    public @Override void start() {

        _started = true;
    }

    public @Override void stop() {

        _started = false;
    }

    public @Override boolean isStarted() {

        return _started;
    }
}
