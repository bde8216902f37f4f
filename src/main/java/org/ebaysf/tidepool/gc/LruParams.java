package org.ebaysf.tidepool.gc;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Tuning of LRU collection: the cache size that triggers a collection, the percentile of sequence numbers
 * collected each time, and a cap on how many sequence numbers one collection may cover.
 */
public final class LruParams {

    public static final long COLLECTION_DISABLED = -1L;

    public static final long MINIMUM_CACHE_SIZE_BYTES = 1L * 1024 * 1024;
    public static final long DEFAULT_CACHE_SIZE_BYTES = 40L * 1024 * 1024;

    private static final int DEFAULT_COLLECTION_PERCENTILE = 10;
    private static final int DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT = 1000;

    public static final LruParams DEFAULT = new LruParams(DEFAULT_CACHE_SIZE_BYTES,
            DEFAULT_COLLECTION_PERCENTILE,
            DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT);

    public static final LruParams DISABLED = new LruParams(COLLECTION_DISABLED, 0, 0);

    private final long _cacheSizeCollectionThreshold;
    private final int _percentileToCollect;
    private final int _maximumSequenceNumbersToCollect;

    public LruParams(final long cacheSizeCollectionThreshold,
                     final int percentileToCollect,
                     final int maximumSequenceNumbersToCollect) {

        Preconditions.checkArgument(percentileToCollect >= 0 && percentileToCollect <= 100,
                "percentile must be within [0, 100]: %s", percentileToCollect);
        Preconditions.checkArgument(maximumSequenceNumbersToCollect >= 0);

        _cacheSizeCollectionThreshold = cacheSizeCollectionThreshold;
        _percentileToCollect = percentileToCollect;
        _maximumSequenceNumbersToCollect = maximumSequenceNumbersToCollect;
    }

    public static LruParams withCacheSize(final long cacheSize) {

        Preconditions.checkArgument(cacheSize == COLLECTION_DISABLED || cacheSize >= MINIMUM_CACHE_SIZE_BYTES,
                "cache size must be at least %s bytes, or disabled", MINIMUM_CACHE_SIZE_BYTES);

        return new LruParams(cacheSize, DEFAULT_COLLECTION_PERCENTILE, DEFAULT_MAX_SEQUENCE_NUMBERS_TO_COLLECT);
    }

    public long getCacheSizeCollectionThreshold() {
        return _cacheSizeCollectionThreshold;
    }

    public int getPercentileToCollect() {
        return _percentileToCollect;
    }

    public int getMaximumSequenceNumbersToCollect() {
        return _maximumSequenceNumbersToCollect;
    }

    public @Override String toString() {

        return MoreObjects.toStringHelper(this)
                .add("cacheSizeCollectionThreshold", _cacheSizeCollectionThreshold)
                .add("percentileToCollect", _percentileToCollect)
                .add("maximumSequenceNumbersToCollect", _maximumSequenceNumbersToCollect)
                .toString();
    }
}
