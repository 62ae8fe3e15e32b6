package com.github.dimitryivaniuta.dbgateway.tenant;

/**
 * Isolation unit for cache visibility.
 *
 * <p>Values are case-sensitive and never blank. Deployments without authentication
 * run every request as {@link #SYSTEM}.
 */
public record TenantId(String value) {

    public static final TenantId SYSTEM = new TenantId("system");

    public TenantId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tenant id must not be blank");
        }
    }

    public static TenantId of(String value) {
        return new TenantId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
