package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class NoopCacheTest {

    private final CacheProvider cache = NoopCache.INSTANCE;
    private final CacheKey key = CacheKey.schemaList(TenantId.SYSTEM, "public");

    @Test
    void neverHitsAndNeverFails() {
        assertThat(cache.set(key, new byte[]{1}, Duration.ofMinutes(1))).isEqualTo(SetOutcome.NOT_STORED);
        assertThat(cache.get(key)).isEmpty();
        assertThat(cache.exists(key)).isFalse();
        assertThat(cache.metadata(key)).isEmpty();
        assertThat(cache.delete(key)).isFalse();
        assertThat(cache.deleteByPrefix(CacheNamespace.SCHEMA_LIST)).isZero();
        assertThat(cache.deleteByPrefix(CacheNamespace.SCHEMA_LIST, TenantId.SYSTEM)).isZero();
        assertThat(cache.purgeExpired()).isZero();
        cache.clear();
        cache.resetStats();
        assertThat(cache.healthCheck()).isTrue();
    }

    @Test
    void statsStayAtZero() {
        cache.get(key);
        cache.set(key, new byte[10], null);

        assertThat(cache.stats()).isEqualTo(CacheStats.empty());
        assertThat(cache.stats().hitRate()).isZero();
    }
}
