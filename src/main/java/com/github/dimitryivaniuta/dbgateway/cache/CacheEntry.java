package com.github.dimitryivaniuta.dbgateway.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored value plus bookkeeping. Owned by the provider that created it; the recency
 * marker is only written while the owning shard lock is held.
 */
final class CacheEntry {

    /** Store-level cap; longer TTLs are stored with this TTL. */
    static final Duration MAX_TTL = Duration.ofDays(365);

    private final byte[] value;
    private final Instant insertedAt;
    private final Instant expiresAt;
    private volatile long recencyMarker;

    CacheEntry(byte[] value, Instant insertedAt, Instant expiresAt) {
        this.value = value;
        this.insertedAt = insertedAt;
        this.expiresAt = expiresAt;
    }

    static CacheEntry create(byte[] value, Instant now, Duration ttl) {
        Duration capped = (ttl.compareTo(MAX_TTL) > 0) ? MAX_TTL : ttl;
        return new CacheEntry(value, now, now.plus(capped));
    }

    boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    void touch(long marker) {
        this.recencyMarker = marker;
    }

    long recencyMarker() {
        return recencyMarker;
    }

    long ttlNanos() {
        return Duration.between(insertedAt, expiresAt).toNanos();
    }

    long sizeBytes() {
        return value.length;
    }

    byte[] copyValue() {
        return value.clone();
    }

    CacheEntryMetadata metadata() {
        return new CacheEntryMetadata(insertedAt, expiresAt, value.length);
    }
}
