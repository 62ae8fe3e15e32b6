package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.metrics.GatewayCacheMetrics;
import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Observability decorator for any {@link CacheProvider}.
 *
 * <p>Every call is forwarded unchanged and its result returned as is; exceptions of the
 * wrapped provider are rethrown untouched after an error event. Keys are logged at DEBUG
 * only because they reveal schema and table names.
 */
@Slf4j
public final class TracedCache implements CacheProvider {

    private final CacheProvider delegate;
    private final GatewayCacheMetrics metrics;

    public TracedCache(CacheProvider delegate, GatewayCacheMetrics metrics) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        delegate.addEvictionListener(this::onEvicted);
    }

    public CacheProvider delegate() {
        return delegate;
    }

    @Override
    public Optional<byte[]> get(CacheKey key) {
        Optional<byte[]> result = observe("get", () -> delegate.get(key));
        String ns = key.namespace().prefix();
        if (result.isPresent()) {
            metrics.cacheHit(ns);
            log.debug("cache hit key={} sizeBytes={}", key, result.get().length);
        } else {
            metrics.cacheMiss(ns);
            log.debug("cache miss key={}", key);
        }
        return result;
    }

    @Override
    public SetOutcome set(CacheKey key, byte[] value, Duration ttl) {
        SetOutcome outcome = observe("set", () -> delegate.set(key, value, ttl));

        if (outcome == SetOutcome.REJECTED_TOO_LARGE) {
            metrics.cacheRejected(key.namespace().prefix());
            log.debug("cache set rejected key={} sizeBytes={}", key, value.length);
        } else {
            log.debug("cache set key={} sizeBytes={} ttl={} outcome={}",
                    key, value == null ? 0 : value.length, ttl, outcome);
        }
        return outcome;
    }

    @Override
    public boolean delete(CacheKey key) {
        boolean deleted = observe("delete", () -> delegate.delete(key));
        log.debug("cache delete key={} deleted={}", key, deleted);
        return deleted;
    }

    @Override
    public boolean exists(CacheKey key) {
        return observe("exists", () -> delegate.exists(key));
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace) {
        long count = observe("delete_by_prefix", () -> delegate.deleteByPrefix(namespace));
        log.debug("cache delete_by_prefix namespace={} deleted={}", namespace.prefix(), count);
        return count;
    }

    @Override
    public long deleteByPrefix(CacheNamespace namespace, TenantId tenant) {
        long count = observe("delete_by_prefix", () -> delegate.deleteByPrefix(namespace, tenant));
        log.debug("cache delete_by_prefix namespace={} tenant={} deleted={}", namespace.prefix(), tenant, count);
        return count;
    }

    @Override
    public Optional<CacheEntryMetadata> metadata(CacheKey key) {
        return observe("metadata", () -> delegate.metadata(key));
    }

    @Override
    public void clear() {
        observe("clear", () -> {
            delegate.clear();
            return null;
        });
        log.debug("cache cleared provider={}", delegate.name());
    }

    @Override
    public boolean healthCheck() {
        return delegate.healthCheck();
    }

    @Override
    public CacheStats stats() {
        return delegate.stats();
    }

    @Override
    public void resetStats() {
        delegate.resetStats();
    }

    @Override
    public long purgeExpired() {
        long purged = observe("purge_expired", delegate::purgeExpired);
        if (purged > 0) {
            log.debug("cache purged {} expired entries", purged);
        }
        return purged;
    }

    @Override
    public void addEvictionListener(EvictionListener listener) {
        delegate.addEvictionListener(listener);
    }

    @Override
    public String name() {
        return "traced(" + delegate.name() + ")";
    }

    private void onEvicted(CacheKey key) {
        metrics.cacheEvictions(1);
        log.debug("cache evicted key={}", key);
    }

    private <T> T observe(String operation, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            return call.get();
        } catch (RuntimeException ex) {
            metrics.cacheError(operation);
            log.warn("cache {} failed provider={} reason={}", operation, delegate.name(), ex.toString());
            throw ex;
        } finally {
            metrics.recordOperation(operation, System.nanoTime() - start);
        }
    }
}
