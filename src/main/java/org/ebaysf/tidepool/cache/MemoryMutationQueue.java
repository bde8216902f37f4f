package org.ebaysf.tidepool.cache;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.ebaysf.tidepool.delegate.ReferenceDelegate;
import org.ebaysf.tidepool.delegate.ReferenceSet;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MutationBatch;
import org.ebaysf.tidepool.transaction.PersistenceTransaction;

import java.util.LinkedList;
import java.util.List;

public class MemoryMutationQueue implements MutationQueue {

    private final ReferenceDelegate _referenceDelegate;
    private final LinkedList<MutationBatch> _queue = Lists.newLinkedList();
    private final ReferenceSet _batchesByDocumentKey = new ReferenceSet();

    private int _nextBatchId = 1;

    public MemoryMutationQueue(final ReferenceDelegate referenceDelegate) {

        _referenceDelegate = Preconditions.checkNotNull(referenceDelegate);
    }

    public @Override MutationBatch addMutationBatch(final PersistenceTransaction txn, final Iterable<DocumentKey> keys) {

        final MutationBatch batch = new MutationBatch(_nextBatchId, keys);
        _nextBatchId += 1;

        _queue.addLast(batch);
        _batchesByDocumentKey.addReferences(batch.getKeys(), batch.getBatchId());

        return batch;
    }

    public @Override MutationBatch lookupMutationBatch(final PersistenceTransaction txn, final int batchId) {

        for (MutationBatch batch : _queue) {
            if (batch.getBatchId() == batchId) {
                return batch;
            }
        }
        return null;
    }

    public @Override List<MutationBatch> getAllMutationBatches(final PersistenceTransaction txn) {

        return ImmutableList.copyOf(_queue);
    }

    public @Override void removeMutationBatch(final PersistenceTransaction txn, final MutationBatch batch) {

        Preconditions.checkArgument(!_queue.isEmpty() && _queue.getFirst().getBatchId() == batch.getBatchId(),
                "Can only remove the first entry of the mutation queue, tried batch %s", batch.getBatchId());

        _queue.removeFirst();

        for (DocumentKey key : batch.getKeys()) {
            _batchesByDocumentKey.removeReference(key, batch.getBatchId());
            _referenceDelegate.removeMutationReference(txn, key);
        }
    }

    public @Override boolean containsKey(final PersistenceTransaction txn, final DocumentKey key) {

        return _batchesByDocumentKey.containsKey(key);
    }

    public @Override boolean isEmpty(final PersistenceTransaction txn) {

        return _queue.isEmpty();
    }
}
