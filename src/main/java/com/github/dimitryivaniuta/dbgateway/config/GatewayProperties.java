package com.github.dimitryivaniuta.dbgateway.config;

import com.github.dimitryivaniuta.dbgateway.cache.CacheBackend;
import com.github.dimitryivaniuta.dbgateway.cache.InMemoryCache;
import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    private CacheSettings cache = new CacheSettings();
    private RuntimeSettings runtime = new RuntimeSettings();
    private Reload reload = new Reload();
    private Security security = new Security();

    /** Fixed at startup; changing these needs a restart. */
    @Getter
    @Setter
    public static class CacheSettings {
        private boolean enabled = true;
        private CacheBackend backend = CacheBackend.MEMORY;
        private int maxEntries = 10_000; // <= 0: unbounded
        private long maxValueSize = InMemoryCache.DEFAULT_MAX_VALUE_SIZE;
        private int shardCount = InMemoryCache.DEFAULT_SHARD_COUNT;
        private boolean traced = true;
        private boolean sweepEnabled = true;
        private Duration sweepInterval = Duration.ofMinutes(1);
    }

    /**
     * Initial values of the reloadable {@link RuntimeConfig}. Re-bound from the environment
     * on every reload.
     */
    @Getter
    @Setter
    public static class RuntimeSettings {
        private Integer rowLimit = RuntimeConfig.DEFAULT_ROW_LIMIT; // null: unlimited
        private Duration queryTimeout = RuntimeConfig.DEFAULT_QUERY_TIMEOUT;
        private LogLevel logLevel = LogLevel.INFO;
        // logger whose level follows logLevel
        private String loggerName = LoggingSystem.ROOT_LOGGER_NAME;
        private Ttl ttl = new Ttl();

        public RuntimeConfig toRuntimeConfig() {
            return RuntimeConfig.builder()
                    .rowLimit(rowLimit)
                    .queryTimeout(queryTimeout)
                    .logLevel(logLevel)
                    .cacheTtlDefault(ttl.getDefaultTtl())
                    .cacheTtlSchema(ttl.getSchema())
                    .cacheTtlQuery(ttl.getQuery())
                    .build();
        }
    }

    @Getter
    @Setter
    public static class Ttl {
        private Duration defaultTtl = RuntimeConfig.DEFAULT_TTL;
        private Duration schema = RuntimeConfig.DEFAULT_SCHEMA_TTL;
        private Duration query = RuntimeConfig.DEFAULT_QUERY_TTL;

        // gateway.runtime.ttl.default
        public Duration getDefault() {
            return defaultTtl;
        }

        public void setDefault(Duration value) {
            this.defaultTtl = value;
        }
    }

    @Getter
    @Setter
    public static class Reload {
        private boolean signalEnabled = true;
        private String signalName = "HUP";
        // optional file re-read on every reload, e.g. "file:./config/runtime.yml"
        private String configFile;
    }

    @Getter
    @Setter
    public static class Security {
        private String apiKeyPepper = "";
    }
}
