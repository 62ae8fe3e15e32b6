package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed provider with per-entry TTL (variable expiry).
 *
 * Notes:
 * - Size bound uses Caffeine's W-TinyLFU policy, so the victim is the entry Caffeine
 *   predicts is least valuable, not necessarily the least recently used one.
 *   Use {@link InMemoryCache} where strict LRU matters.
 * - Maintenance runs on the calling thread ({@code executor(Runnable::run)}), so eviction
 *   and removal accounting happen before the triggering call returns.
 * - Expiry and the metadata timestamps read the same {@link Clock}.
 */
@Slf4j
public final class CaffeineCacheProvider implements CacheProvider {

    private final Cache<CacheKey, CacheEntry> cache;
    private final long maxValueSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private final AtomicLong sizeBytes = new AtomicLong();

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder sets = new LongAdder();
    private final LongAdder deletes = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();
    private final LongAdder rejections = new LongAdder();
    private final LongAdder errors = new LongAdder();

    private final List<EvictionListener> evictionListeners = new CopyOnWriteArrayList<>();

    public CaffeineCacheProvider(long maxEntries, long maxValueSize, Duration defaultTtl, Clock clock) {
        this.maxValueSize = maxValueSize;
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (defaultTtl.isZero() || defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }

        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .ticker(clockTicker(clock))
                .executor(Runnable::run);
        if (maxEntries > 0) {
            builder.maximumSize(maxEntries);
        }
        this.cache = builder
                .expireAfter(new EntryExpiry())
                .removalListener(this::onRemoval)
                .build();
    }

    @Override
    public Optional<byte[]> get(CacheKey key) {
        Objects.requireNonNull(key, "key");
        try {
            CacheEntry entry = cache.getIfPresent(key);
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }
            hits.increment();
            return Optional.of(entry.copyValue());
        } catch (RuntimeException ex) {
            errors.increment();
            misses.increment();
            log.warn("Caffeine cache read failed, treating as miss namespace={} reason={}",
                    key.namespace(), ex.toString());
            return Optional.empty();
        }
    }

    @Override
    public SetOutcome set(CacheKey key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        if (value.length > maxValueSize) {
            rejections.increment();
            return SetOutcome.REJECTED_TOO_LARGE;
        }
        Duration effectiveTtl = (ttl != null) ? ttl : defaultTtl;
        if (effectiveTtl.isZero() || effectiveTtl.isNegative()) {
            return SetOutcome.NOT_STORED;
        }

        CacheEntry entry = CacheEntry.create(value.clone(), clock.instant(), effectiveTtl);
        try {
            // add before put: a replaced or immediately evicted entry is released by the listener
            sizeBytes.addAndGet(entry.sizeBytes());
            cache.put(key, entry);
            sets.increment();
            return SetOutcome.STORED;
        } catch (RuntimeException ex) {
            errors.increment();
            log.warn("Caffeine cache write failed, value not stored namespace={} reason={}",
                    key.namespace(), ex.toString());
            return SetOutcome.NOT_STORED;
        }
    }

    @Override
    public boolean delete(CacheKey key) {
        Objects.requireNonNull(key, "key");
        CacheEntry removed = cache.asMap().remove(key);
        if (removed == null) return false;
        deletes.increment();
        return true;
    }

    @Override
    public boolean exists(CacheKey key) {
        return live(key) != null;
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace) {
        Objects.requireNonNull(namespace, "namespace");
        return removeAll(keysMatching(namespace, null));
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace, TenantId tenant) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(tenant, "tenant");
        return removeAll(keysMatching(namespace, tenant));
    }

    @Override
    public Optional<CacheEntryMetadata> metadata(CacheKey key) {
        CacheEntry entry = live(key);
        return entry == null ? Optional.empty() : Optional.of(entry.metadata());
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    @Override
    public boolean healthCheck() {
        try {
            return cache.estimatedSize() >= 0 && sizeBytes.get() >= 0;
        } catch (RuntimeException ex) {
            return false;
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>{@code entryCount} is Caffeine's estimate.
     */
    @Override
    public CacheStats stats() {
        return new CacheStats(
                hits.sum(),
                misses.sum(),
                sets.sum(),
                deletes.sum(),
                evictions.sum(),
                expirations.sum(),
                rejections.sum(),
                errors.sum(),
                Math.max(0, cache.estimatedSize()),
                Math.max(0, sizeBytes.get())
        );
    }

    @Override
    public void resetStats() {
        hits.reset();
        misses.reset();
        sets.reset();
        deletes.reset();
        evictions.reset();
        expirations.reset();
        rejections.reset();
        errors.reset();
    }

    @Override
    public long purgeExpired() {
        long before = expirations.sum();
        cache.cleanUp();
        return expirations.sum() - before;
    }

    @Override
    public void addEvictionListener(EvictionListener listener) {
        evictionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public String toString() {
        return "CaffeineCacheProvider{maxValueSize=" + maxValueSize
                + ", defaultTtl=" + defaultTtl
                + ", estimatedSize=" + cache.estimatedSize() + "}";
    }

    private CacheEntry live(CacheKey key) {
        Objects.requireNonNull(key, "key");
        CacheEntry entry = cache.policy().getIfPresentQuietly(key);
        if (entry == null || entry.isExpired(clock.instant())) return null;
        return entry;
    }

    private List<CacheKey> keysMatching(CacheNamespace namespace, TenantId tenant) {
        List<CacheKey> keys = new ArrayList<>();
        for (CacheKey k : cache.asMap().keySet()) {
            if (tenant == null ? k.belongsTo(namespace) : k.belongsTo(namespace, tenant)) {
                keys.add(k);
            }
        }
        return keys;
    }

    private long removeAll(List<CacheKey> keys) {
        long removed = 0;
        for (CacheKey k : keys) {
            if (cache.asMap().remove(k) != null) removed++;
        }
        deletes.add(removed);
        return removed;
    }

    private void onRemoval(CacheKey key, CacheEntry entry, RemovalCause cause) {
        if (entry != null) {
            sizeBytes.addAndGet(-entry.sizeBytes());
        }
        if (cause == RemovalCause.SIZE) {
            evictions.increment();
            log.debug("Evicted entry by size policy namespace={}", key == null ? null : key.namespace());
            if (key != null) notifyEviction(key);
        } else if (cause == RemovalCause.EXPIRED) {
            expirations.increment();
        }
    }

    private void notifyEviction(CacheKey key) {
        for (EvictionListener l : evictionListeners) {
            try {
                l.onEviction(key);
            } catch (RuntimeException ex) {
                log.warn("Eviction listener failed listener={} reason={}", l.getClass().getName(), ex.toString());
            }
        }
    }

    private static Ticker clockTicker(Clock clock) {
        return () -> {
            Instant now = clock.instant();
            return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    }

    private static final class EntryExpiry implements Expiry<CacheKey, CacheEntry> {

        @Override
        public long expireAfterCreate(CacheKey key, CacheEntry value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(CacheKey key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
