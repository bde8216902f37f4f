package org.ebaysf.tidepool.cache;

import com.google.common.base.Function;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import org.ebaysf.tidepool.model.Document;
import org.ebaysf.tidepool.model.DocumentKey;
import org.ebaysf.tidepool.model.MaybeDocument;
import org.ebaysf.tidepool.model.NoDocument;
import org.ebaysf.tidepool.transaction.MemoryTransaction;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.function.Consumer;

public class MemoryRemoteDocumentCacheTest {

    private static final DocumentKey DOC_A = DocumentKey.fromPathString("rooms/a");
    private static final DocumentKey DOC_B = DocumentKey.fromPathString("rooms/b");

    private final MemoryTransaction _txn = new MemoryTransaction(1L);
    private MemoryRemoteDocumentCache _cache;

    @Before
    public void setUp() {

        // a document weighs its version, a missing one nothing
        _cache = new MemoryRemoteDocumentCache(new Function<MaybeDocument, Long>() {
            public @Override Long apply(final MaybeDocument document) {
                return document.exists() ? document.getVersion() : 0L;
            }
        });
    }

    @Test
    public void testApplyWritesAndTracksSize() {

        final RemoteDocumentChangeBuffer changeBuffer = _cache.newChangeBuffer();
        changeBuffer.addEntry(new Document(DOC_A, 10L, ImmutableMap.of("v", 1)));
        changeBuffer.addEntry(new NoDocument(DOC_B, 3L));

        Assert.assertNull(_cache.getEntry(_txn, DOC_A));
        Assert.assertEquals(0L, _cache.getSize(_txn));

        changeBuffer.apply(_txn);

        Assert.assertEquals(2, _cache.getEntryCount());
        Assert.assertEquals(10L, _cache.getSize(_txn));
        Assert.assertTrue(_cache.getEntry(_txn, DOC_A).exists());
        Assert.assertFalse(_cache.getEntry(_txn, DOC_B).exists());
    }

    @Test
    public void testOverwriteAndRemoveAdjustSize() {

        write(new Document(DOC_A, 10L, ImmutableMap.of("v", 1)));
        write(new Document(DOC_A, 4L, ImmutableMap.of("v", 2)));
        Assert.assertEquals(4L, _cache.getSize(_txn));

        final RemoteDocumentChangeBuffer changeBuffer = _cache.newChangeBuffer();
        changeBuffer.removeEntry(DOC_A);
        changeBuffer.removeEntry(DOC_B);
        changeBuffer.apply(_txn);

        Assert.assertEquals(0, _cache.getEntryCount());
        Assert.assertEquals(0L, _cache.getSize(_txn));
    }

    @Test
    public void testChangeBufferReadsStagedChangesFirst() {

        write(new Document(DOC_A, 1L, ImmutableMap.of("v", 1)));

        final RemoteDocumentChangeBuffer changeBuffer = _cache.newChangeBuffer();
        Assert.assertEquals(1L, changeBuffer.getEntry(_txn, DOC_A).getVersion());

        changeBuffer.addEntry(new Document(DOC_A, 2L, ImmutableMap.of("v", 2)));
        Assert.assertEquals(2L, changeBuffer.getEntry(_txn, DOC_A).getVersion());

        changeBuffer.removeEntry(DOC_A);
        Assert.assertNull(changeBuffer.getEntry(_txn, DOC_A));
        Assert.assertNotNull(_cache.getEntry(_txn, DOC_A));

        changeBuffer.apply(_txn);
        Assert.assertNull(_cache.getEntry(_txn, DOC_A));
    }

    @Test
    public void testChangeBufferAppliesOnlyOnce() {

        final RemoteDocumentChangeBuffer changeBuffer = _cache.newChangeBuffer();
        changeBuffer.apply(_txn);

        try {
            changeBuffer.apply(_txn);
            Assert.fail("expected IllegalStateException");
        }
        catch (IllegalStateException ex) {
            Assert.assertEquals("Changes have already been applied.", ex.getMessage());
        }

        try {
            changeBuffer.removeEntry(DOC_A);
            Assert.fail("expected IllegalStateException");
        }
        catch (IllegalStateException ex) {
            Assert.assertEquals("Changes have already been applied.", ex.getMessage());
        }
    }

    @Test
    public void testForEachDocumentKeyToleratesRemoval() {

        write(new Document(DOC_A, 1L, ImmutableMap.of("v", 1)));
        write(new Document(DOC_B, 1L, ImmutableMap.of("v", 1)));

        final List<DocumentKey> visited = Lists.newArrayList();
        _cache.forEachDocumentKey(_txn, new Consumer<DocumentKey>() {
            public @Override void accept(final DocumentKey key) {
                visited.add(key);
                final RemoteDocumentChangeBuffer changeBuffer = _cache.newChangeBuffer();
                changeBuffer.removeEntry(key);
                changeBuffer.apply(_txn);
            }
        });

        Assert.assertEquals(Lists.newArrayList(DOC_A, DOC_B), visited);
        Assert.assertEquals(0, _cache.getEntryCount());
    }

    private void write(final MaybeDocument document) {

        final RemoteDocumentChangeBuffer changeBuffer = _cache.newChangeBuffer();
        changeBuffer.addEntry(document);
        changeBuffer.apply(_txn);
    }
}
