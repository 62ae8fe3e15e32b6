package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/cache")
public class CacheAdminController {

    private final CacheProvider cache;

    // ---------- DTOs ----------
    public record CacheStatsResponse(
            String provider,
            long hits,
            long misses,
            double hitRate,
            long sets,
            long deletes,
            long evictions,
            long expirations,
            long rejections,
            long errors,
            long entries,
            long sizeBytes
    ) {}

    public record InvalidationResponse(
            String namespace,
            String tenant,  // null: all tenants
            long removed
    ) {}

    // ---------- endpoints ----------

    @GetMapping("/stats")
    public CacheStatsResponse stats() {
        return toResponse(cache.stats());
    }

    @PostMapping("/stats/reset")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void resetStats() {
        cache.resetStats();
        log.info("Cache statistics reset provider={}", cache.name());
    }

    @DeleteMapping("/{namespace}")
    public InvalidationResponse invalidate(@PathVariable String namespace,
                                           @RequestParam(required = false) String tenant) {
        CacheNamespace ns = CacheNamespace.parse(namespace)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown cache namespace: " + namespace));

        long removed;
        if (tenant == null || tenant.isBlank()) {
            removed = cache.deleteByPrefix(ns);
        } else {
            removed = cache.deleteByPrefix(ns, TenantId.of(tenant));
        }
        log.info("Cache invalidated namespace={} tenant={} removed={}", ns.prefix(), tenant, removed);
        return new InvalidationResponse(ns.prefix(), (tenant == null || tenant.isBlank()) ? null : tenant, removed);
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear() {
        cache.clear();
        log.info("Cache cleared provider={}", cache.name());
    }

    // ---------- mapping ----------
    private CacheStatsResponse toResponse(CacheStats s) {
        return new CacheStatsResponse(
                cache.name(),
                s.hitCount(),
                s.missCount(),
                s.hitRate(),
                s.setCount(),
                s.deleteCount(),
                s.evictionCount(),
                s.expirationCount(),
                s.rejectionCount(),
                s.errorCount(),
                s.entryCount(),
                s.sizeBytes()
        );
    }
}
