package com.github.dimitryivaniuta.dbgateway.cache;

/**
 * Point-in-time statistics of a cache provider.
 *
 * <p>Counters are monotonic for the process lifetime until {@link CacheProvider#resetStats()};
 * {@code entryCount} and {@code sizeBytes} describe the current contents.
 */
public record CacheStats(
        long hitCount,
        long missCount,
        long setCount,
        long deleteCount,
        long evictionCount,
        long expirationCount,
        long rejectionCount,
        long errorCount,
        long entryCount,
        long sizeBytes
) {

    private static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    public static CacheStats empty() {
        return EMPTY;
    }

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
