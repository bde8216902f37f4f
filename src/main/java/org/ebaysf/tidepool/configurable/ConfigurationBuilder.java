package org.ebaysf.tidepool.configurable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.eventbus.EventBus;
import org.ebaysf.tidepool.gc.LruParams;
import org.ebaysf.tidepool.util.AsyncQueue;

public class ConfigurationBuilder implements Configuration {

    private boolean _durable = false;
    private ReferenceDelegateFactory _referenceDelegateFactory = ReferenceDelegateFactory.EAGER;
    private LruParams _lruParams = LruParams.DEFAULT;
    private EventBus _eventBus = new EventBus();//synchronous
    private AsyncQueue _asyncQueue;

    public static ConfigurationBuilder builder() {

        return new ConfigurationBuilder();
    }

    private ConfigurationBuilder() {

    }

    public @Override boolean isDurable() {
        return _durable;
    }

    public ConfigurationBuilder durable(final boolean durable) {
        _durable = durable;
        return this;
    }

    public @Override ReferenceDelegateFactory getReferenceDelegateFactory() {
        return _referenceDelegateFactory;
    }

    public ConfigurationBuilder referenceDelegateFactory(final ReferenceDelegateFactory referenceDelegateFactory) {
        _referenceDelegateFactory = Preconditions.checkNotNull(referenceDelegateFactory);
        return this;
    }

    public @Override LruParams getLruParams() {
        return _lruParams;
    }

    public ConfigurationBuilder lruParams(final LruParams lruParams) {
        _lruParams = Preconditions.checkNotNull(lruParams);
        return this;
    }

    public ConfigurationBuilder cacheSizeBytes(final long cacheSizeBytes) {
        _lruParams = LruParams.withCacheSize(cacheSizeBytes);
        return this;
    }

    public @Override EventBus getEventBus() {
        return _eventBus;
    }

    public ConfigurationBuilder eventBus(final EventBus eventBus) {
        _eventBus = Preconditions.checkNotNull(eventBus);
        return this;
    }

    public @Override AsyncQueue getAsyncQueue() {
        if (_asyncQueue == null) {
            _asyncQueue = new AsyncQueue();
        }
        return _asyncQueue;
    }

    public ConfigurationBuilder asyncQueue(final AsyncQueue asyncQueue) {
        _asyncQueue = Preconditions.checkNotNull(asyncQueue);
        return this;
    }

    public Configuration build() {

        return new ConfigurationImpl(isDurable(),
                getReferenceDelegateFactory(),
                getLruParams(),
                getEventBus(),
                getAsyncQueue());
    }

    public static class ConfigurationImpl implements Configuration {

        private final boolean _durable;
        private final ReferenceDelegateFactory _referenceDelegateFactory;
        private final LruParams _lruParams;
        private final EventBus _eventBus;
        private final AsyncQueue _asyncQueue;

        public ConfigurationImpl(final boolean durable,
                                 final ReferenceDelegateFactory referenceDelegateFactory,
                                 final LruParams lruParams,
                                 final EventBus eventBus,
                                 final AsyncQueue asyncQueue) {

            _durable = durable;
            _referenceDelegateFactory = referenceDelegateFactory;
            _lruParams = lruParams;
            _eventBus = eventBus;
            _asyncQueue = asyncQueue;
        }

        public @Override boolean isDurable() {
            return _durable;
        }

        public @Override ReferenceDelegateFactory getReferenceDelegateFactory() {
            return _referenceDelegateFactory;
        }

        public @Override LruParams getLruParams() {
            return _lruParams;
        }

        public @Override EventBus getEventBus() {
            return _eventBus;
        }

        public @Override AsyncQueue getAsyncQueue() {
            return _asyncQueue;
        }

        public @Override String toString() {

            return MoreObjects.toStringHelper(this)
                    .add("durable", _durable)
                    .add("referenceDelegateFactory", _referenceDelegateFactory)
                    .add("lruParams", _lruParams)
                    .toString();
        }
    }
}
