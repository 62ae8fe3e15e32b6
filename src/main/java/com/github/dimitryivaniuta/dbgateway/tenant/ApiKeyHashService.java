package com.github.dimitryivaniuta.dbgateway.tenant;

import com.github.dimitryivaniuta.dbgateway.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

@Service
public class ApiKeyHashService {

    private final String pepper;

    public ApiKeyHashService(GatewayProperties properties) {
        String p = properties.getSecurity().getApiKeyPepper();
        this.pepper = p == null ? "" : p;
    }

    /** Hashes raw API key with optional pepper (server-side secret). Returns lowercase hex. */
    public String hash(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new IllegalArgumentException("rawApiKey must not be blank");
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            // hash(raw + ":" + pepper); the raw key never reaches a cache key or a log line
            byte[] digest = md.digest((rawApiKey + ":" + pepper).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to hash API key", e);
        }
    }
}
