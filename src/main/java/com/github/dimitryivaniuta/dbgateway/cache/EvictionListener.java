package com.github.dimitryivaniuta.dbgateway.cache;

/**
 * Called once per entry removed by the size bound, after the store released it.
 * Not called for deletes, expiry or {@code clear()}.
 */
@FunctionalInterface
public interface EvictionListener {

    void onEviction(CacheKey key);
}
