package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;

import java.time.Duration;
import java.util.Optional;

/**
 * Disabled cache: every read misses, nothing is stored, stats stay at zero.
 */
public final class NoopCache implements CacheProvider {

    public static final NoopCache INSTANCE = new NoopCache();

    private NoopCache() {
    }

    @Override
    public Optional<byte[]> get(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public SetOutcome set(CacheKey key, byte[] value, Duration ttl) {
        return SetOutcome.NOT_STORED;
    }

    @Override
    public boolean delete(CacheKey key) {
        return false;
    }

    @Override
    public boolean exists(CacheKey key) {
        return false;
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace) {
        return 0;
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace, TenantId tenant) {
        return 0;
    }

    @Override
    public Optional<CacheEntryMetadata> metadata(CacheKey key) {
        return Optional.empty();
    }

    @Override
    public void clear() {
    }

    @Override
    public boolean healthCheck() {
        return true;
    }

    @Override
    public CacheStats stats() {
        return CacheStats.empty();
    }
}
