package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;

/**
 * Tenant-scoped cache key.
 *
 * <p>Equality is structural over namespace, tenant and discriminator. The tenant is
 * mandatory, so two tenants never share a key for the same logical request. Absent
 * optional discriminator fields are kept as {@code null} (distinct from any text value).
 *
 * <p>Query keys hold {@code sha256(sql)}, the UTF-8 length of the SQL and the row limit
 * instead of the SQL text itself.
 */
public record CacheKey(CacheNamespace namespace, TenantId tenant, List<String> discriminator) {

    private static final String ABSENT = "_";
    private static final String ALL = "_all";

    public CacheKey {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(tenant, "tenant must not be null");
        discriminator = (discriminator == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(discriminator));
    }

    public static CacheKey schemaList(TenantId tenant, String schema) {
        return of(CacheNamespace.SCHEMA_LIST, tenant, schema, ALL);
    }

    public static CacheKey tableDescribe(TenantId tenant, String schema, String table) {
        return of(CacheNamespace.TABLE_DESCRIBE, tenant, schema, Objects.requireNonNull(table, "table"));
    }

    public static CacheKey procedureList(TenantId tenant, String schema, String pattern) {
        return of(CacheNamespace.PROCEDURE_LIST, tenant, schema, ALL, pattern);
    }

    public static CacheKey procedureDescribe(TenantId tenant, String schema, String procedure) {
        return of(CacheNamespace.PROCEDURE_DESCRIBE, tenant, schema, Objects.requireNonNull(procedure, "procedure"));
    }

    public static CacheKey queryResult(TenantId tenant, String sql, Integer rowLimit) {
        Objects.requireNonNull(sql, "sql");
        byte[] utf8 = sql.getBytes(StandardCharsets.UTF_8);
        return of(CacheNamespace.QUERY_RESULT, tenant,
                sha256Hex(utf8),
                Integer.toString(utf8.length),
                rowLimit == null ? null : rowLimit.toString());
    }

    public static CacheKey custom(TenantId tenant, String identifier, String variant) {
        return of(CacheNamespace.CUSTOM, tenant, Objects.requireNonNull(identifier, "identifier"), variant);
    }

    private static CacheKey of(CacheNamespace ns, TenantId tenant, String... parts) {
        return new CacheKey(ns, tenant, Arrays.asList(parts));
    }

    public boolean belongsTo(CacheNamespace ns) {
        return namespace == ns;
    }

    public boolean belongsTo(CacheNamespace ns, TenantId owner) {
        return namespace == ns && tenant.equals(owner);
    }

    /** Canonical textual form {@code namespace:tenant:part...}, used for logs and diagnostics. */
    public String toKeyString() {
        StringBuilder sb = new StringBuilder(namespace.prefix()).append(':').append(tenant.value());
        for (String part : discriminator) {
            sb.append(':').append(part == null ? ABSENT : part);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toKeyString();
    }

    private static String sha256Hex(byte[] input) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(input));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
