package org.ebaysf.tidepool.cache;

import com.google.common.collect.ImmutableSet;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Metadata of the cached targets and the document keys each one currently matches.
 */
public interface TargetCache {

    void addTargetData(final PersistenceTransaction txn, final TargetData targetData);

    void updateTargetData(final PersistenceTransaction txn, final TargetData targetData);

    /**
     * Removes the target and every key it matched, without reporting those keys to the reference delegate.
     */
    void removeTargetData(final PersistenceTransaction txn, final TargetData targetData);

    /**
     * Removes every target whose sequence number is at most {@code upperBound}, except the active ones.
     * @return number of targets removed
     */
    int removeTargets(final PersistenceTransaction txn, final long upperBound, final Set<Integer> activeTargetIds);

    TargetData getTargetData(final PersistenceTransaction txn, final String target);

    long getTargetCount(final PersistenceTransaction txn);

    void forEachTarget(final PersistenceTransaction txn, final Consumer<TargetData> consumer);

    long getHighestSequenceNumber(final PersistenceTransaction txn);

    int getHighestTargetId(final PersistenceTransaction txn);

    void addMatchingKeys(final PersistenceTransaction txn, final Iterable<DocumentKey> keys, final int targetId);

    void removeMatchingKeys(final PersistenceTransaction txn, final Iterable<DocumentKey> keys, final int targetId);

    ImmutableSet<DocumentKey> getMatchingKeysForTargetId(final PersistenceTransaction txn, final int targetId);

    boolean containsKey(final PersistenceTransaction txn, final DocumentKey key);
}
