package org.ebaysf.tidepool.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

public class DocumentKeyTest {

    @Test
    public void testPathRoundTrip() {

        final DocumentKey key = DocumentKey.fromPathString("/rooms/eros/messages/1/");

        Assert.assertEquals("rooms/eros/messages/1", key.toString());
        Assert.assertEquals(ImmutableList.of("rooms", "eros", "messages", "1"), key.getSegments());
        Assert.assertEquals("messages", key.getCollectionGroup());
        Assert.assertEquals(key, DocumentKey.fromSegments(key.getSegments()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOddSegmentsRejected() {

        DocumentKey.fromPathString("rooms/eros/messages");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyPathRejected() {

        DocumentKey.fromPathString("");
    }

    @Test
    public void testOrderedSegmentBySegment() {

        final List<DocumentKey> keys = Lists.newArrayList(
                DocumentKey.fromPathString("rooms/b"),
                DocumentKey.fromPathString("rooms/a/messages/1"),
                DocumentKey.fromPathString("rooms/a"));
        Collections.sort(keys);

        Assert.assertEquals(Lists.newArrayList(
                DocumentKey.fromPathString("rooms/a"),
                DocumentKey.fromPathString("rooms/a/messages/1"),
                DocumentKey.fromPathString("rooms/b")), keys);
    }
}
