package com.github.dimitryivaniuta.dbgateway.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Entry bookkeeping without the value, for diagnostics.
 */
public record CacheEntryMetadata(Instant insertedAt, Instant expiresAt, long sizeBytes) {

    public Duration ttlRemaining(Instant now) {
        return now.isBefore(expiresAt) ? Duration.between(now, expiresAt) : Duration.ZERO;
    }
}
