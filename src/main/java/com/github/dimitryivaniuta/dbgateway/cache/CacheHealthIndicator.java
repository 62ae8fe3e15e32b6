package com.github.dimitryivaniuta.dbgateway.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports {@link CacheProvider#healthCheck()} under {@code /actuator/health} as "cache".
 * Reporting only; request handling never consults it.
 */
@Component("cache")
@RequiredArgsConstructor
public class CacheHealthIndicator implements HealthIndicator {

    private final CacheProvider cache;

    @Override
    public Health health() {
        boolean healthy;
        try {
            healthy = cache.healthCheck();
        } catch (RuntimeException ex) {
            return Health.down(ex).withDetail("provider", cache.name()).build();
        }
        CacheStats stats = cache.stats();
        Health.Builder builder = healthy ? Health.up() : Health.down();
        return builder
                .withDetail("provider", cache.name())
                .withDetail("entries", stats.entryCount())
                .withDetail("sizeBytes", stats.sizeBytes())
                .withDetail("hitRate", stats.hitRate())
                .build();
    }
}
