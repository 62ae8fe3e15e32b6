package com.github.dimitryivaniuta.dbgateway.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags each request with an id for log correlation. A well-formed {@code X-Correlation-Id}
 * from the client is kept; anything else is replaced by a random UUID. The id is returned
 * in the response header of the same name.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter implements Filter {

    private static final Pattern ACCEPTED_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        String id = resolve(((HttpServletRequest) req).getHeader(RequestContextKeys.CORRELATION_ID_HEADER));
        ((HttpServletResponse) res).setHeader(RequestContextKeys.CORRELATION_ID_HEADER, id);

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, id);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    /** Client id if it is short and printable-safe, a new UUID otherwise. */
    static String resolve(String header) {
        return (header != null && ACCEPTED_ID.matcher(header).matches())
                ? header
                : UUID.randomUUID().toString();
    }
}
