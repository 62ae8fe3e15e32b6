package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded in-process cache with TTL and strict LRU eviction.
 *
 * <p>Keys are spread over lock-partitioned shards. Every write and every hit stamps the
 * entry with the next value of a global sequence (the recency marker) and moves it to the
 * tail of its shard, so each shard stays ordered by marker and its head is the shard's
 * least recently used entry. When an insert pushes the entry count over {@code maxEntries},
 * the inserting caller evicts the globally smallest marker among the shard heads until the
 * store is back within bounds. Markers are unique, so insertion order breaks ties.
 *
 * <p>Expiry is lazy: an expired entry is removed by the access that finds it. {@link #purgeExpired()}
 * reclaims entries that are never read again (see {@code CacheSweepJob}).
 *
 * <p>Example:
 * <pre>
 *   InMemoryCache cache = InMemoryCache.builder()
 *           .maxEntries(10_000)
 *           .maxValueSize(1_048_576L)
 *           .defaultTtl(Duration.ofMinutes(5))
 *           .build();
 * </pre>
 */
public final class InMemoryCache implements CacheProvider {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCache.class);

    public static final long DEFAULT_MAX_VALUE_SIZE = 1_048_576L; // 1 MiB
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_SHARD_COUNT = 16;

    private final Shard[] shards;
    private final int maxEntries; // <= 0: unbounded
    private final long maxValueSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private final AtomicLong recencySequence = new AtomicLong();
    private final AtomicLong entryCount = new AtomicLong();
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

    @Builder
    private InMemoryCache(Integer maxEntries, Long maxValueSize, Duration defaultTtl, Integer shardCount, Clock clock) {
        this.maxEntries = (maxEntries == null) ? 0 : maxEntries;
        this.maxValueSize = (maxValueSize == null) ? DEFAULT_MAX_VALUE_SIZE : maxValueSize;
        this.defaultTtl = (defaultTtl == null) ? DEFAULT_TTL : defaultTtl;
        this.clock = (clock == null) ? Clock.systemUTC() : clock;

        if (this.maxValueSize < 0) {
            throw new IllegalArgumentException("maxValueSize must be >= 0");
        }
        if (this.defaultTtl.isZero() || this.defaultTtl.isNegative()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }

        int n = powerOfTwo((shardCount == null) ? DEFAULT_SHARD_COUNT : shardCount);
        this.shards = new Shard[n];
        for (int i = 0; i < n; i++) shards[i] = new Shard();
    }

    public static InMemoryCache create() {
        return builder().build();
    }

    @Override
    public Optional<byte[]> get(CacheKey key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            CacheEntry entry = shard.entries.get(key);
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                shard.entries.remove(key);
                release(entry);
                expirations.increment();
                misses.increment();
                return Optional.empty();
            }
            entry.touch(recencySequence.incrementAndGet());
            shard.entries.remove(key);
            shard.entries.put(key, entry);
            hits.increment();
            return Optional.of(entry.copyValue());
        } catch (RuntimeException ex) {
            errors.increment();
            misses.increment();
            log.warn("In-memory cache read failed, treating as miss namespace={} reason={}",
                    key.namespace(), ex.toString());
            return Optional.empty();
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public SetOutcome set(CacheKey key, byte[] value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        if (value.length > maxValueSize) {
            rejections.increment();
            log.debug("Value not cached, too large namespace={} sizeBytes={} maxValueSize={}",
                    key.namespace(), value.length, maxValueSize);
            return SetOutcome.REJECTED_TOO_LARGE;
        }

        Duration effectiveTtl = (ttl != null) ? ttl : defaultTtl;
        if (effectiveTtl.isZero() || effectiveTtl.isNegative()) {
            return SetOutcome.NOT_STORED;
        }

        CacheEntry entry = CacheEntry.create(value.clone(), clock.instant(), effectiveTtl);

        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            entry.touch(recencySequence.incrementAndGet());
            CacheEntry previous = shard.entries.remove(key);
            if (previous != null) {
                release(previous);
            }
            shard.entries.put(key, entry);
            entryCount.incrementAndGet();
            sizeBytes.addAndGet(entry.sizeBytes());
            sets.increment();
        } catch (RuntimeException ex) {
            errors.increment();
            log.warn("In-memory cache write failed, value not stored namespace={} reason={}",
                    key.namespace(), ex.toString());
            return SetOutcome.NOT_STORED;
        } finally {
            shard.lock.unlock();
        }

        evictOverflow();
        return SetOutcome.STORED;
    }

    @Override
    public boolean delete(CacheKey key) {
        Objects.requireNonNull(key, "key");
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            CacheEntry removed = shard.entries.remove(key);
            if (removed == null) return false;
            release(removed);
            deletes.increment();
            return true;
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public boolean exists(CacheKey key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            return liveEntry(shard, key, now) != null;
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace) {
        Objects.requireNonNull(namespace, "namespace");
        long removed = removeWhere(k -> k.belongsTo(namespace));
        deletes.add(removed);
        return removed;
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace, TenantId tenant) {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(tenant, "tenant");
        long removed = removeWhere(k -> k.belongsTo(namespace, tenant));
        deletes.add(removed);
        return removed;
    }

    @Override
    public Optional<CacheEntryMetadata> metadata(CacheKey key) {
        Objects.requireNonNull(key, "key");
        Instant now = clock.instant();
        Shard shard = shardFor(key);
        shard.lock.lock();
        try {
            CacheEntry entry = liveEntry(shard, key, now);
            return (entry == null) ? Optional.empty() : Optional.of(entry.metadata());
        } finally {
            shard.lock.unlock();
        }
    }

    @Override
    public void clear() {
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                for (CacheEntry entry : shard.entries.values()) {
                    release(entry);
                }
                shard.entries.clear();
            } finally {
                shard.lock.unlock();
            }
        }
    }

    @Override
    public boolean healthCheck() {
        return entryCount.get() >= 0 && sizeBytes.get() >= 0;
    }

    /**
     * {@inheritDoc}
     *
     * <p>{@code entryCount} and {@code sizeBytes} include expired entries that no access or
     * sweep has reclaimed yet.
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
                Math.max(0, entryCount.get()),
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
        Instant now = clock.instant();
        long removed = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<CacheEntry> it = shard.entries.values().iterator();
                while (it.hasNext()) {
                    CacheEntry entry = it.next();
                    if (entry.isExpired(now)) {
                        it.remove();
                        release(entry);
                        removed++;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        expirations.add(removed);
        return removed;
    }

    public int maxEntries() {
        return maxEntries;
    }

    public long maxValueSize() {
        return maxValueSize;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    @Override
    public void addEvictionListener(EvictionListener listener) {
        evictionListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public String toString() {
        return "InMemoryCache{maxEntries=" + maxEntries
                + ", maxValueSize=" + maxValueSize
                + ", defaultTtl=" + defaultTtl
                + ", shards=" + shards.length
                + ", entryCount=" + entryCount.get() + "}";
    }

    // ---- eviction ----

    private void evictOverflow() {
        if (maxEntries <= 0) return;
        while (entryCount.get() > maxEntries) {
            if (!evictLeastRecentlyUsed()) return;
        }
    }

    /**
     * @return false when every shard is empty
     */
    private boolean evictLeastRecentlyUsed() {
        Shard victim = null;
        long oldest = Long.MAX_VALUE;

        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<CacheEntry> it = shard.entries.values().iterator();
                if (it.hasNext()) {
                    long marker = it.next().recencyMarker();
                    if (marker < oldest) {
                        oldest = marker;
                        victim = shard;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }

        if (victim == null) return false;

        CacheKey evicted;
        victim.lock.lock();
        try {
            Iterator<Map.Entry<CacheKey, CacheEntry>> it = victim.entries.entrySet().iterator();
            if (!it.hasNext()) return true; // raced with a delete; rescan
            Map.Entry<CacheKey, CacheEntry> head = it.next();
            if (head.getValue().recencyMarker() != oldest) return true; // touched meanwhile; rescan
            it.remove();
            release(head.getValue());
            evictions.increment();
            evicted = head.getKey();
        } finally {
            victim.lock.unlock();
        }
        log.debug("Evicted least recently used entry namespace={}", evicted.namespace());
        notifyEviction(evicted);
        return true;
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

    // ---- internals ----

    /**
     * Entry for {@code key} if present and not expired; an expired entry is removed here.
     * Caller holds the shard lock.
     */
    private CacheEntry liveEntry(Shard shard, CacheKey key, Instant now) {
        CacheEntry entry = shard.entries.get(key);
        if (entry == null) return null;
        if (entry.isExpired(now)) {
            shard.entries.remove(key);
            release(entry);
            expirations.increment();
            return null;
        }
        return entry;
    }

    private long removeWhere(Predicate<CacheKey> predicate) {
        long removed = 0;
        for (Shard shard : shards) {
            shard.lock.lock();
            try {
                Iterator<Map.Entry<CacheKey, CacheEntry>> it = shard.entries.entrySet().iterator();
                while (it.hasNext()) {
                    Map.Entry<CacheKey, CacheEntry> e = it.next();
                    if (predicate.test(e.getKey())) {
                        it.remove();
                        release(e.getValue());
                        removed++;
                    }
                }
            } finally {
                shard.lock.unlock();
            }
        }
        return removed;
    }

    private void release(CacheEntry entry) {
        entryCount.decrementAndGet();
        sizeBytes.addAndGet(-entry.sizeBytes());
    }

    private Shard shardFor(CacheKey key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return shards[h & (shards.length - 1)];
    }

    private static int powerOfTwo(int requested) {
        int n = Math.max(1, Math.min(requested, 1 << 10));
        return (Integer.bitCount(n) == 1) ? n : Integer.highestOneBit(n) << 1;
    }

    private static final class Shard {
        final ReentrantLock lock = new ReentrantLock();
        // insertion-ordered; every hit re-appends, so iteration order is recency order
        final LinkedHashMap<CacheKey, CacheEntry> entries = new LinkedHashMap<>();
    }
}
