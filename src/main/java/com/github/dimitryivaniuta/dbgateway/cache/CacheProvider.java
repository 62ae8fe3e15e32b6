package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;

import java.time.Duration;
import java.util.Optional;

/**
 * Contract of every cache store. All operations may be called concurrently.
 *
 * <p>Implementations report backend trouble as a miss on reads and as
 * {@link SetOutcome#NOT_STORED} on writes. Callers must still tolerate a
 * {@link RuntimeException}; {@link CachedFetcher} does.
 *
 * <p>The concrete provider is chosen once at startup
 * (see {@code com.github.dimitryivaniuta.dbgateway.config.CacheConfig}).
 */
public interface CacheProvider {

    /**
     * Returns the value if present and not expired. A hit refreshes recency.
     */
    Optional<byte[]> get(CacheKey key);

    /**
     * Stores {@code value} until {@code now + ttl}. A {@code null} ttl means the
     * provider default. Oversized values are not stored and leave the store unchanged.
     */
    SetOutcome set(CacheKey key, byte[] value, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    boolean delete(CacheKey key);

    /**
     * Presence check; does not refresh recency.
     */
    boolean exists(CacheKey key);

    /**
     * Removes every entry of the namespace, across all tenants.
     *
     * @return number of removed entries
     */
    long deleteByPrefix(CacheNamespace namespace);

    /**
     * Removes every entry of the namespace owned by {@code tenant}.
     */
    long deleteByPrefix(CacheNamespace namespace, TenantId tenant);

    Optional<CacheEntryMetadata> metadata(CacheKey key);

    void clear();

    /**
     * Liveness signal for reporting. Never throws, never gates request handling.
     */
    boolean healthCheck();

    CacheStats stats();

    default void resetStats() {
    }

    /**
     * Drops expired entries eagerly.
     *
     * @return number of removed entries
     */
    default long purgeExpired() {
        return 0;
    }

    /**
     * Registers a callback for size-bound evictions. Stores without a size bound ignore it.
     */
    default void addEvictionListener(EvictionListener listener) {
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
