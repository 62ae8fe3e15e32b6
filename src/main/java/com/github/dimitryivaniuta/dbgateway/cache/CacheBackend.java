package com.github.dimitryivaniuta.dbgateway.cache;

/**
 * Store implementation behind {@link CacheProvider}, chosen once at startup.
 */
public enum CacheBackend {
    /** caching disabled */
    NOOP,
    /** sharded in-process store, strict LRU */
    MEMORY,
    /** Caffeine, approximate (W-TinyLFU) eviction */
    CAFFEINE
}
