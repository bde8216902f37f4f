package org.ebaysf.tidepool.cache;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.ebaysf.tidepool.Persistence;
import org.ebaysf.tidepool.delegate.ReferenceDelegate;
import org.ebaysf.tidepool.delegate.ReferenceSet;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

public class MemoryTargetCache implements TargetCache {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryTargetCache.class);

    private final Persistence _persistence;
    private final Map<String, TargetData> _targets = Maps.newLinkedHashMap();
    private final ReferenceSet _references = new ReferenceSet();

    private long _highestSequenceNumber = 0L;
    private int _highestTargetId = 0;

    public MemoryTargetCache(final Persistence persistence) {

        _persistence = Preconditions.checkNotNull(persistence);
    }

    public @Override void addTargetData(final PersistenceTransaction txn, final TargetData targetData) {

        Preconditions.checkArgument(!_targets.containsKey(targetData.getTarget()),
                "Adding a target that already exists: %s", targetData.getTarget());

        saveTargetData(targetData);
    }

    public @Override void updateTargetData(final PersistenceTransaction txn, final TargetData targetData) {

        Preconditions.checkArgument(_targets.containsKey(targetData.getTarget()),
                "Updating a nonexistent target: %s", targetData.getTarget());

        saveTargetData(targetData);
    }

    public @Override void removeTargetData(final PersistenceTransaction txn, final TargetData targetData) {

        Preconditions.checkState(_targets.remove(targetData.getTarget()) != null,
                "Removing a nonexistent target: %s", targetData.getTarget());

        _references.removeReferencesForId(targetData.getTargetId());
    }

    public @Override int removeTargets(final PersistenceTransaction txn,
                                       final long upperBound,
                                       final Set<Integer> activeTargetIds) {

        int count = 0;
        for (Iterator<TargetData> it = _targets.values().iterator(); it.hasNext(); ) {
            final TargetData targetData = it.next();
            if (targetData.getSequenceNumber() <= upperBound && !activeTargetIds.contains(targetData.getTargetId())) {
                it.remove();
                _references.removeReferencesForId(targetData.getTargetId());
                count += 1;
            }
        }

        LOG.debug("[target cache] removed {} targets up to sequence number {}", count, upperBound);
        return count;
    }

    public @Override TargetData getTargetData(final PersistenceTransaction txn, final String target) {

        return _targets.get(target);
    }

    public @Override long getTargetCount(final PersistenceTransaction txn) {

        return _targets.size();
    }

    public @Override void forEachTarget(final PersistenceTransaction txn, final Consumer<TargetData> consumer) {

        for (TargetData targetData : ImmutableList.copyOf(_targets.values())) {
            consumer.accept(targetData);
        }
    }

    public @Override long getHighestSequenceNumber(final PersistenceTransaction txn) {

        return _highestSequenceNumber;
    }

    public @Override int getHighestTargetId(final PersistenceTransaction txn) {

        return _highestTargetId;
    }

    public @Override void addMatchingKeys(final PersistenceTransaction txn,
                                          final Iterable<DocumentKey> keys,
                                          final int targetId) {

        _references.addReferences(keys, targetId);

        final ReferenceDelegate referenceDelegate = _persistence.getReferenceDelegate();
        for (DocumentKey key : keys) {
            referenceDelegate.addReference(txn, key);
        }
    }

    public @Override void removeMatchingKeys(final PersistenceTransaction txn,
                                             final Iterable<DocumentKey> keys,
                                             final int targetId) {

        _references.removeReferences(keys, targetId);

        final ReferenceDelegate referenceDelegate = _persistence.getReferenceDelegate();
        for (DocumentKey key : keys) {
            referenceDelegate.removeReference(txn, key);
        }
    }

    public @Override ImmutableSet<DocumentKey> getMatchingKeysForTargetId(final PersistenceTransaction txn,
                                                                          final int targetId) {

        return _references.referencesForId(targetId);
    }

    public @Override boolean containsKey(final PersistenceTransaction txn, final DocumentKey key) {

        return _references.containsKey(key);
    }

    private void saveTargetData(final TargetData targetData) {

        _targets.put(targetData.getTarget(), targetData);

        _highestTargetId = Math.max(_highestTargetId, targetData.getTargetId());
        _highestSequenceNumber = Math.max(_highestSequenceNumber, targetData.getSequenceNumber());
    }
}
