package com.github.dimitryivaniuta.dbgateway.web;

/**
 * Header and MDC names shared by filters, resolvers and the error body.
 */
public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    // raw key is hashed before it scopes anything
    public static final String API_KEY_HEADER = "X-Api-Key";
}
