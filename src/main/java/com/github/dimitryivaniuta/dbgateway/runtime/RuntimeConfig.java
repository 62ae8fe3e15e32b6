package com.github.dimitryivaniuta.dbgateway.runtime;

import com.github.dimitryivaniuta.dbgateway.cache.CacheNamespace;
import lombok.Builder;
import org.springframework.boot.logging.LogLevel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of the settings that may change without a restart.
 *
 * <p>Every field is validated on construction, so an invalid snapshot cannot exist.
 * A reload builds a new instance; an instance is never modified.
 *
 * @param rowLimit        maximum rows returned per query, {@code null} for unlimited
 * @param queryTimeout    statement timeout applied per query
 * @param logLevel        level applied to the gateway logger at startup and on reload
 * @param cacheTtlDefault TTL of the custom namespace
 * @param cacheTtlSchema  TTL of schema metadata (tables, procedures)
 * @param cacheTtlQuery   TTL of query results
 */
@Builder(toBuilder = true)
public record RuntimeConfig(
        Integer rowLimit,
        Duration queryTimeout,
        LogLevel logLevel,
        Duration cacheTtlDefault,
        Duration cacheTtlSchema,
        Duration cacheTtlQuery
) {

    public static final int DEFAULT_ROW_LIMIT = 1000;
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_SCHEMA_TTL = Duration.ofSeconds(3600);
    public static final Duration DEFAULT_QUERY_TTL = Duration.ofSeconds(60);

    private static final Duration MAX_QUERY_TIMEOUT = Duration.ofHours(1);
    private static final Duration MAX_TTL = Duration.ofDays(1);

    public RuntimeConfig {
        if (rowLimit != null && rowLimit <= 0) {
            throw new InvalidRuntimeConfigException("rowLimit must be positive, got " + rowLimit);
        }
        requireBetween("queryTimeout", queryTimeout, Duration.ofSeconds(1), MAX_QUERY_TIMEOUT);
        if (logLevel == null) {
            throw new InvalidRuntimeConfigException("logLevel must not be null");
        }
        requireBetween("cacheTtlDefault", cacheTtlDefault, Duration.ofSeconds(1), MAX_TTL);
        requireBetween("cacheTtlSchema", cacheTtlSchema, Duration.ofSeconds(1), MAX_TTL);
        requireBetween("cacheTtlQuery", cacheTtlQuery, Duration.ofSeconds(1), MAX_TTL);
    }

    public static RuntimeConfig defaults() {
        return new RuntimeConfig(
                DEFAULT_ROW_LIMIT,
                DEFAULT_QUERY_TIMEOUT,
                LogLevel.INFO,
                DEFAULT_TTL,
                DEFAULT_SCHEMA_TTL,
                DEFAULT_QUERY_TTL
        );
    }

    public Duration ttlFor(CacheNamespace namespace) {
        return switch (namespace.ttlPolicy()) {
            case SCHEMA -> cacheTtlSchema;
            case QUERY -> cacheTtlQuery;
            case DEFAULT -> cacheTtlDefault;
        };
    }

    /**
     * Fields that differ from {@code previous}, formatted {@code "field: old -> new"}.
     * No field of this snapshot is secret, so values are printed as is.
     */
    public List<String> diff(RuntimeConfig previous) {
        List<String> changed = new ArrayList<>();
        if (previous == null) return changed;
        compare(changed, "rowLimit", previous.rowLimit, rowLimit);
        compare(changed, "queryTimeout", previous.queryTimeout, queryTimeout);
        compare(changed, "logLevel", previous.logLevel, logLevel);
        compare(changed, "cacheTtlDefault", previous.cacheTtlDefault, cacheTtlDefault);
        compare(changed, "cacheTtlSchema", previous.cacheTtlSchema, cacheTtlSchema);
        compare(changed, "cacheTtlQuery", previous.cacheTtlQuery, cacheTtlQuery);
        return changed;
    }

    private static void compare(List<String> out, String field, Object before, Object after) {
        if (!Objects.equals(before, after)) {
            out.add(field + ": " + display(before) + " -> " + display(after));
        }
    }

    private static String display(Object v) {
        return v == null ? "unlimited" : v.toString();
    }

    private static void requireBetween(String field, Duration value, Duration min, Duration max) {
        if (value == null) {
            throw new InvalidRuntimeConfigException(field + " must not be null");
        }
        if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
            throw new InvalidRuntimeConfigException(field + " must be between " + min + " and " + max + ", got " + value);
        }
    }
}
