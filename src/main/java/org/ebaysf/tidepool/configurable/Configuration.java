package org.ebaysf.tidepool.configurable;

import com.google.common.eventbus.EventBus;
import org.ebaysf.tidepool.gc.LruParams;
import org.ebaysf.tidepool.util.AsyncQueue;

public interface Configuration {

    /**
     * Durable storage is not available in the memory-only build; asking for it fails initialization.
     */
    boolean isDurable();

    ReferenceDelegateFactory getReferenceDelegateFactory();

    LruParams getLruParams();

    EventBus getEventBus();

    AsyncQueue getAsyncQueue();
}
