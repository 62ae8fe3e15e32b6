package com.github.dimitryivaniuta.dbgateway.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Cache-first lookup with fallback to the source, used by every tool handler.
 *
 * <ol>
 *   <li>{@code get(key)}; a hit is returned as is</li>
 *   <li>on a miss, or if the read fails, {@code fetch} is invoked</li>
 *   <li>the fresh value is stored best-effort; rejection or failure is only logged</li>
 *   <li>the fresh value is returned</li>
 * </ol>
 *
 * Cache faults never reach the caller. Exceptions thrown by {@code fetch} propagate unchanged.
 * Concurrent misses on the same key are not deduplicated: each caller fetches.
 * {@code null} results are returned but never stored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CachedFetcher {

    private final CacheProvider cache;
    private final ObjectMapper objectMapper;

    public byte[] cachedOrFetch(CacheKey key, Duration ttl, Supplier<byte[]> fetch) {
        Optional<byte[]> hit = lookup(key);
        if (hit.isPresent()) {
            return hit.get();
        }
        byte[] fresh = fetch.get();
        if (fresh != null) {
            store(key, fresh, ttl);
        }
        return fresh;
    }

    public <T> T cachedOrFetch(CacheKey key, Duration ttl, Class<T> type, Supplier<T> fetch) {
        return typed(key, ttl, objectMapper.getTypeFactory().constructType(type), fetch);
    }

    public <T> T cachedOrFetch(CacheKey key, Duration ttl, TypeReference<T> type, Supplier<T> fetch) {
        return typed(key, ttl, objectMapper.getTypeFactory().constructType(type), fetch);
    }

    /**
     * Async variant. The value is stored only once {@code fetch} completes normally, so a
     * cancelled or failed fetch leaves the cache untouched. Cancelling the returned future
     * before the fetch completes also skips the store.
     */
    public <T> CompletableFuture<T> cachedOrFetchAsync(CacheKey key,
                                                       Duration ttl,
                                                       Class<T> type,
                                                       Supplier<CompletableFuture<T>> fetch) {
        JavaType javaType = objectMapper.getTypeFactory().constructType(type);
        Optional<T> cached = lookup(key).flatMap(bytes -> decode(key, bytes, javaType));
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return fetch.get().thenApply(value -> {
            storeEncoded(key, value, ttl);
            return value;
        });
    }

    private <T> T typed(CacheKey key, Duration ttl, JavaType type, Supplier<T> fetch) {
        Optional<T> cached = lookup(key).flatMap(bytes -> decode(key, bytes, type));
        if (cached.isPresent()) {
            return cached.get();
        }
        T fresh = fetch.get();
        storeEncoded(key, fresh, ttl);
        return fresh;
    }

    private Optional<byte[]> lookup(CacheKey key) {
        try {
            return cache.get(key);
        } catch (RuntimeException ex) {
            log.warn("Cache read failed, falling back to source key={} reason={}", key, ex.toString());
            return Optional.empty();
        }
    }

    private <T> Optional<T> decode(CacheKey key, byte[] bytes, JavaType type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(bytes, type));
        } catch (IOException ex) {
            log.warn("Cached payload unreadable, treating as miss key={} reason={}", key, ex.getMessage());
            return Optional.empty();
        }
    }

    private void storeEncoded(CacheKey key, Object value, Duration ttl) {
        if (value == null) return;
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(value);
        } catch (IOException ex) {
            log.warn("Value not cacheable, serialization failed key={} reason={}", key, ex.getMessage());
            return;
        }
        store(key, bytes, ttl);
    }

    private void store(CacheKey key, byte[] value, Duration ttl) {
        try {
            SetOutcome outcome = cache.set(key, value, ttl);
            if (!outcome.isStored()) {
                log.debug("Value not cached key={} outcome={} sizeBytes={}", key, outcome, value.length);
            }
        } catch (RuntimeException ex) {
            log.warn("Cache write failed, value returned uncached key={} reason={}", key, ex.toString());
        }
    }
}
