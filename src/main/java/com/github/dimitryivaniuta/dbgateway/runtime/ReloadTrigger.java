package com.github.dimitryivaniuta.dbgateway.runtime;

import java.util.Locale;

/**
 * Who asked for a reload. Recorded in the audit log and the reload metric.
 */
public record ReloadTrigger(Source source, String remoteAddress) {

    public enum Source { SIGNAL, HTTP_ENDPOINT, MANUAL }

    private static final ReloadTrigger SIGNAL = new ReloadTrigger(Source.SIGNAL, null);
    private static final ReloadTrigger MANUAL = new ReloadTrigger(Source.MANUAL, null);

    public ReloadTrigger {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
    }

    public static ReloadTrigger signal() {
        return SIGNAL;
    }

    public static ReloadTrigger httpEndpoint(String remoteAddress) {
        return new ReloadTrigger(Source.HTTP_ENDPOINT, remoteAddress);
    }

    public static ReloadTrigger manual() {
        return MANUAL;
    }

    /** Low-cardinality name for metric tags. */
    public String tag() {
        return source.name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return switch (source) {
            case SIGNAL -> "SIGHUP";
            case HTTP_ENDPOINT -> (remoteAddress == null || remoteAddress.isBlank())
                    ? "HTTP /admin/reload"
                    : "HTTP /admin/reload from " + remoteAddress;
            case MANUAL -> "manual";
        };
    }
}
