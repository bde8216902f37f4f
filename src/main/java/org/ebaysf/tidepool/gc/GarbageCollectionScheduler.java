package org.ebaysf.tidepool.gc;

/**
 * Drives garbage collection on whatever schedule the policy needs.
 */
public interface GarbageCollectionScheduler {

    void start();

    void stop();

    boolean isStarted();
}
