package com.github.dimitryivaniuta.dbgateway.tenant;

import com.github.dimitryivaniuta.dbgateway.web.RequestContextKeys;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.security.Principal;

/**
 * Maps an inbound request to the tenant that scopes its cache entries.
 *
 * Resolution order:
 * - X-Api-Key header   -> apiKey:&lt;sha256 of key + pepper&gt;
 * - authenticated user -> user:&lt;principal name&gt;
 * - otherwise          -> {@link TenantId#SYSTEM}
 */
@Component
public class TenantResolver {

    private final ApiKeyHashService hashService;

    public TenantResolver(ApiKeyHashService hashService) {
        this.hashService = hashService;
    }

    public TenantId resolve(HttpServletRequest req) {
        if (req == null) return TenantId.SYSTEM;

        String rawApiKey = header(req, RequestContextKeys.API_KEY_HEADER);
        if (rawApiKey != null) {
            return TenantId.of("apiKey:" + hashService.hash(rawApiKey));
        }

        Principal p = req.getUserPrincipal();
        if (p != null && p.getName() != null && !p.getName().isBlank()) {
            return TenantId.of("user:" + p.getName());
        }

        return TenantId.SYSTEM;
    }

    private static String header(HttpServletRequest req, String name) {
        String v = req.getHeader(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
