package com.github.dimitryivaniuta.dbgateway.metrics;

import com.github.dimitryivaniuta.dbgateway.cache.CacheProvider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Component
public class GatewayCacheMetrics {

    private final MeterRegistry registry;

    public GatewayCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Cache events ----
    public void cacheHit(String namespace) {
        Counter.builder("gateway_cache_hits_total")
                .tag("namespace", namespace)
                .register(registry)
                .increment();
    }

    public void cacheMiss(String namespace) {
        Counter.builder("gateway_cache_misses_total")
                .tag("namespace", namespace)
                .register(registry)
                .increment();
    }

    public void cacheEvictions(long count) {
        Counter.builder("gateway_cache_evictions_total")
                .register(registry)
                .increment(count);
    }

    public void cacheRejected(String namespace) {
        Counter.builder("gateway_cache_rejections_total")
                .tag("namespace", namespace)
                .tag("reason", "too_large")
                .register(registry)
                .increment();
    }

    public void cacheError(String operation) {
        Counter.builder("gateway_cache_errors_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordOperation(String operation, long nanos) {
        Timer.builder("gateway_cache_operation_seconds")
                .tag("operation", operation)
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    // ---- Runtime config ----
    public void configReload(String trigger, boolean success) {
        Counter.builder("gateway_runtime_config_reloads_total")
                .tag("trigger", trigger)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    // ---- Gauges ----
    public void bindCacheGauges(CacheProvider provider) {
        Gauge.builder("gateway_cache_entries", provider, p -> p.stats().entryCount())
                .tag("provider", provider.name())
                .register(registry);
        Gauge.builder("gateway_cache_size_bytes", provider, p -> p.stats().sizeBytes())
                .tag("provider", provider.name())
                .register(registry);
    }
}
