package org.ebaysf.tidepool.delegate;

import com.google.common.collect.ImmutableSet;
import org.ebaysf.tidepool.model.DocumentKey;
import org.junit.Assert;
import org.junit.Test;

public class ReferenceSetTest {

    private static final DocumentKey DOC_A = DocumentKey.fromPathString("rooms/a");
    private static final DocumentKey DOC_B = DocumentKey.fromPathString("rooms/b");

    @Test
    public void testKeyStaysReferencedUntilLastIdIsGone() {

        final ReferenceSet references = new ReferenceSet();
        Assert.assertTrue(references.isEmpty());

        references.addReference(DOC_A, 1);
        references.addReference(DOC_A, 2);

        references.removeReference(DOC_A, 1);
        Assert.assertTrue(references.containsKey(DOC_A));

        references.removeReference(DOC_A, 2);
        Assert.assertFalse(references.containsKey(DOC_A));
        Assert.assertTrue(references.isEmpty());
    }

    @Test
    public void testRemoveReferencesForId() {

        final ReferenceSet references = new ReferenceSet();
        references.addReferences(ImmutableSet.of(DOC_A, DOC_B), 1);
        references.addReference(DOC_B, 2);

        Assert.assertEquals(ImmutableSet.of(DOC_A, DOC_B), references.removeReferencesForId(1));
        Assert.assertFalse(references.containsKey(DOC_A));
        Assert.assertTrue(references.containsKey(DOC_B));
        Assert.assertEquals(ImmutableSet.of(DOC_B), references.referencesForId(2));
        Assert.assertTrue(references.referencesForId(1).isEmpty());

        references.removeAllReferences();
        Assert.assertTrue(references.isEmpty());
    }
}
