package com.github.dimitryivaniuta.dbgateway.config;

import com.github.dimitryivaniuta.dbgateway.cache.CacheBackend;
import com.github.dimitryivaniuta.dbgateway.cache.CacheProvider;
import com.github.dimitryivaniuta.dbgateway.cache.CaffeineCacheProvider;
import com.github.dimitryivaniuta.dbgateway.cache.InMemoryCache;
import com.github.dimitryivaniuta.dbgateway.cache.NoopCache;
import com.github.dimitryivaniuta.dbgateway.cache.TracedCache;
import com.github.dimitryivaniuta.dbgateway.metrics.GatewayCacheMetrics;
import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Cache configuration:
 * - one {@link CacheProvider} singleton, chosen here from {@code gateway.cache.*}
 * - {@code enabled=false} or {@code backend=noop} -> {@link NoopCache}
 * - {@code traced=true} wraps the store in {@link TracedCache}
 *
 * The store's default TTL is the runtime default TTL at startup; callers normally pass
 * the namespace TTL of the current runtime snapshot.
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheProvider cacheProvider(GatewayProperties properties,
                                       GatewayCacheMetrics metrics,
                                       Clock clock) {
        GatewayProperties.CacheSettings settings = properties.getCache();
        Duration defaultTtl = properties.getRuntime().getTtl().getDefault();

        CacheProvider provider = createProvider(settings, defaultTtl, clock, metrics);
        metrics.bindCacheGauges(provider);
        log.info("Cache provider {} (enabled={}, backend={}, maxEntries={}, maxValueSize={})",
                provider.name(), settings.isEnabled(), settings.getBackend(),
                settings.getMaxEntries(), settings.getMaxValueSize());
        return provider;
    }

    static CacheProvider createProvider(GatewayProperties.CacheSettings settings,
                                        Duration defaultTtl,
                                        Clock clock,
                                        GatewayCacheMetrics metrics) {
        if (!settings.isEnabled() || settings.getBackend() == CacheBackend.NOOP) {
            return NoopCache.INSTANCE;
        }
        Duration ttl = (defaultTtl != null) ? defaultTtl : RuntimeConfig.DEFAULT_TTL;

        CacheProvider store = switch (settings.getBackend()) {
            case CAFFEINE -> new CaffeineCacheProvider(
                    settings.getMaxEntries(), settings.getMaxValueSize(), ttl, clock);
            default -> InMemoryCache.builder()
                    .maxEntries(settings.getMaxEntries())
                    .maxValueSize(settings.getMaxValueSize())
                    .defaultTtl(ttl)
                    .shardCount(settings.getShardCount())
                    .clock(clock)
                    .build();
        };
        return settings.isTraced() ? new TracedCache(store, metrics) : store;
    }
}
