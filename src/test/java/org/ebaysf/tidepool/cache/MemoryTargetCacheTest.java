package org.ebaysf.tidepool.cache;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import org.ebaysf.tidepool.Persistence;
import org.ebaysf.tidepool.delegate.ReferenceDelegate;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.TargetData;
import org.ebaysf.tidepool.transaction.MemoryTransaction;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.List;
import java.util.function.Consumer;

public class MemoryTargetCacheTest {

    private static final DocumentKey DOC_A = DocumentKey.fromPathString("rooms/a");
    private static final DocumentKey DOC_B = DocumentKey.fromPathString("rooms/b");

    private final MemoryTransaction _txn = new MemoryTransaction(7L);
    private ReferenceDelegate _referenceDelegate;
    private MemoryTargetCache _targetCache;

    @Before
    public void setUp() {

        _referenceDelegate = Mockito.mock(ReferenceDelegate.class);

        final Persistence persistence = Mockito.mock(Persistence.class);
        Mockito.when(persistence.getReferenceDelegate()).thenReturn(_referenceDelegate);

        _targetCache = new MemoryTargetCache(persistence);
    }

    @Test
    public void testAddAndUpdateTargetData() {

        _targetCache.addTargetData(_txn, new TargetData("rooms", 1, 3L));
        _targetCache.addTargetData(_txn, new TargetData("users", 4, 2L));
        _targetCache.updateTargetData(_txn, new TargetData("rooms", 1, 5L));

        Assert.assertEquals(2L, _targetCache.getTargetCount(_txn));
        Assert.assertEquals(5L, _targetCache.getTargetData(_txn, "rooms").getSequenceNumber());
        Assert.assertEquals(5L, _targetCache.getHighestSequenceNumber(_txn));
        Assert.assertEquals(4, _targetCache.getHighestTargetId(_txn));
        Assert.assertNull(_targetCache.getTargetData(_txn, "missing"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAddExistingTargetFails() {

        _targetCache.addTargetData(_txn, new TargetData("rooms", 1, 3L));
        _targetCache.addTargetData(_txn, new TargetData("rooms", 1, 4L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUpdateMissingTargetFails() {

        _targetCache.updateTargetData(_txn, new TargetData("rooms", 1, 3L));
    }

    @Test
    public void testMatchingKeysNotifyReferenceDelegate() {

        _targetCache.addMatchingKeys(_txn, ImmutableSet.of(DOC_A, DOC_B), 1);
        Mockito.verify(_referenceDelegate).addReference(_txn, DOC_A);
        Mockito.verify(_referenceDelegate).addReference(_txn, DOC_B);
        Assert.assertEquals(ImmutableSet.of(DOC_A, DOC_B), _targetCache.getMatchingKeysForTargetId(_txn, 1));

        _targetCache.removeMatchingKeys(_txn, ImmutableSet.of(DOC_A), 1);
        Mockito.verify(_referenceDelegate).removeReference(_txn, DOC_A);

        Assert.assertFalse(_targetCache.containsKey(_txn, DOC_A));
        Assert.assertTrue(_targetCache.containsKey(_txn, DOC_B));
    }

    @Test
    public void testRemoveTargetDataDropsItsKeysSilently() {

        final TargetData targetData = new TargetData("rooms", 1, 3L);
        _targetCache.addTargetData(_txn, targetData);
        _targetCache.addMatchingKeys(_txn, ImmutableSet.of(DOC_A), 1);

        _targetCache.removeTargetData(_txn, targetData);

        Assert.assertEquals(0L, _targetCache.getTargetCount(_txn));
        Assert.assertFalse(_targetCache.containsKey(_txn, DOC_A));
        Mockito.verify(_referenceDelegate, Mockito.never()).removeReference(_txn, DOC_A);
    }

    @Test
    public void testRemoveTargetsSparesActiveAndRecent() {

        _targetCache.addTargetData(_txn, new TargetData("old", 1, 2L));
        _targetCache.addTargetData(_txn, new TargetData("active", 2, 2L));
        _targetCache.addTargetData(_txn, new TargetData("recent", 3, 9L));
        _targetCache.addMatchingKeys(_txn, ImmutableSet.of(DOC_A), 1);

        Assert.assertEquals(1, _targetCache.removeTargets(_txn, 5L, ImmutableSet.of(2)));

        final List<String> remaining = Lists.newArrayList();
        _targetCache.forEachTarget(_txn, new Consumer<TargetData>() {
            public @Override void accept(final TargetData targetData) {
                remaining.add(targetData.getTarget());
            }
        });

        Assert.assertEquals(Lists.newArrayList("active", "recent"), remaining);
        Assert.assertFalse(_targetCache.containsKey(_txn, DOC_A));
    }
}
