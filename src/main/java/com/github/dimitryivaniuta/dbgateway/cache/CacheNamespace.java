package com.github.dimitryivaniuta.dbgateway.cache;

import java.util.Locale;
import java.util.Optional;

/**
 * Category of cached data. Each namespace maps to one TTL policy of the runtime config.
 */
public enum CacheNamespace {

    SCHEMA_LIST("tbl_list", TtlPolicy.SCHEMA),
    TABLE_DESCRIBE("tbl_schema", TtlPolicy.SCHEMA),
    PROCEDURE_LIST("proc_list", TtlPolicy.SCHEMA),
    PROCEDURE_DESCRIBE("proc_schema", TtlPolicy.SCHEMA),
    QUERY_RESULT("query", TtlPolicy.QUERY),
    CUSTOM("custom", TtlPolicy.DEFAULT);

    public enum TtlPolicy { SCHEMA, QUERY, DEFAULT }

    private final String prefix;
    private final TtlPolicy ttlPolicy;

    CacheNamespace(String prefix, TtlPolicy ttlPolicy) {
        this.prefix = prefix;
        this.ttlPolicy = ttlPolicy;
    }

    public String prefix() {
        return prefix;
    }

    public TtlPolicy ttlPolicy() {
        return ttlPolicy;
    }

    /**
     * Accepts either the enum name ("QUERY_RESULT", any case) or the key prefix ("query").
     */
    public static Optional<CacheNamespace> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String v = raw.trim();
        for (CacheNamespace ns : values()) {
            if (ns.prefix.equalsIgnoreCase(v) || ns.name().equals(v.toUpperCase(Locale.ROOT).replace('-', '_'))) {
                return Optional.of(ns);
            }
        }
        return Optional.empty();
    }
}
