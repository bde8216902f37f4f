package org.ebaysf.tidepool.event;

import org.ebaysf.tidepool.gc.LruResults;

import java.util.EventObject;

public class PostGarbageCollectionEvent extends EventObject {

    public PostGarbageCollectionEvent(final LruResults source) {

        super(source);
    }

    public @Override LruResults getSource() {

        return (LruResults) super.getSource();
    }
}
