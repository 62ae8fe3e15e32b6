package com.github.dimitryivaniuta.dbgateway.cache;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically reclaims expired entries nobody reads again.
 * Lazy expiry on access keeps working without it.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.cache", name = "sweep-enabled", havingValue = "true", matchIfMissing = true)
public class CacheSweepJob {

    private static final Logger log = LoggerFactory.getLogger(CacheSweepJob.class);

    private final CacheProvider cache;

    @Scheduled(fixedDelayString = "${gateway.cache.sweep-interval:PT1M}",
            initialDelayString = "${gateway.cache.sweep-interval:PT1M}")
    public void sweepExpired() {
        try {
            long purged = cache.purgeExpired();
            if (purged > 0) {
                log.info("Cache sweep removed {} expired entries", purged);
            }
        } catch (RuntimeException ex) {
            log.warn("Cache sweep failed provider={} reason={}", cache.name(), ex.toString());
        }
    }
}
