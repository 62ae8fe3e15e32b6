package com.github.dimitryivaniuta.dbgateway.runtime;

import com.github.dimitryivaniuta.dbgateway.config.GatewayProperties;
import com.github.dimitryivaniuta.dbgateway.metrics.GatewayCacheMetrics;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.PropertiesPropertySourceLoader;
import org.springframework.boot.env.PropertySourceLoader;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Entry point of every reload trigger.
 *
 * <p>A reload re-reads {@code gateway.runtime.*} from, in order of precedence:
 * the optional {@code gateway.reload.config-file}, the current process environment and
 * system properties, then the property sources the application started with. The result
 * is validated before it can replace the active snapshot.
 */
@Slf4j
@Service
public class RuntimeConfigService {

    private static final String RUNTIME_PREFIX = "gateway.runtime";

    private final RuntimeConfigHolder holder;
    private final ConfigurableEnvironment environment;
    private final LoggingSystem loggingSystem;
    private final GatewayCacheMetrics metrics;
    private final GatewayProperties properties;

    public RuntimeConfigService(RuntimeConfigHolder holder,
                                ConfigurableEnvironment environment,
                                LoggingSystem loggingSystem,
                                GatewayCacheMetrics metrics,
                                GatewayProperties properties) {
        this.holder = holder;
        this.environment = environment;
        this.loggingSystem = loggingSystem;
        this.metrics = metrics;
        this.properties = properties;
    }

    @PostConstruct
    void initLogLevel() {
        applyLogLevel(holder.read());
        holder.addListener((previous, current) -> {
            if (previous.logLevel() != current.logLevel()) {
                applyLogLevel(current);
            }
        });
    }

    public RuntimeConfig current() {
        return holder.read();
    }

    public ReloadResult reloadFromEnvironment(ReloadTrigger trigger) {
        return record(trigger, holder.reload(this::loadCandidate, trigger));
    }

    /**
     * Applies explicit values on top of the active snapshot. Absent fields keep their value.
     */
    public ReloadResult reloadWithOverrides(RuntimeConfigOverrides overrides, ReloadTrigger trigger) {
        return record(trigger, holder.reload(() -> overrides.applyTo(holder.read()), trigger));
    }

    public ReloadResult reloadManually() {
        return reloadFromEnvironment(ReloadTrigger.manual());
    }

    private ReloadResult record(ReloadTrigger trigger, ReloadResult result) {
        metrics.configReload(trigger.tag(), result.success());
        return result;
    }

    RuntimeConfig loadCandidate() {
        List<PropertySource<?>> sources = new ArrayList<>(reloadFileSources());
        new StandardEnvironment().getPropertySources().forEach(sources::add);
        environment.getPropertySources().forEach(sources::add);

        Binder binder = new Binder(ConfigurationPropertySources.from(sources));
        return binder.bind(RUNTIME_PREFIX, GatewayProperties.RuntimeSettings.class)
                .orElseGet(GatewayProperties.RuntimeSettings::new)
                .toRuntimeConfig();
    }

    private List<PropertySource<?>> reloadFileSources() {
        String location = properties.getReload().getConfigFile();
        if (location == null || location.isBlank()) {
            return List.of();
        }
        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            throw new InvalidRuntimeConfigException("Reload config file not found: " + location);
        }
        PropertySourceLoader loader = isYaml(location)
                ? new YamlPropertySourceLoader()
                : new PropertiesPropertySourceLoader();
        try {
            return loader.load("gatewayReloadFile", resource);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read reload config file " + location, ex);
        }
    }

    private void applyLogLevel(RuntimeConfig config) {
        String loggerName = properties.getRuntime().getLoggerName();
        loggingSystem.setLogLevel(loggerName, config.logLevel());
        log.info("Log level of {} set to {}", loggerName, config.logLevel());
    }

    private static boolean isYaml(String location) {
        String l = location.toLowerCase(Locale.ROOT);
        return l.endsWith(".yml") || l.endsWith(".yaml");
    }

    /**
     * Partial update requested by an administrator. {@code null} keeps the active value,
     * except that {@code unlimitedRows} clears the row limit.
     */
    public record RuntimeConfigOverrides(
            Integer rowLimit,
            Boolean unlimitedRows,
            Duration queryTimeout,
            LogLevel logLevel,
            Duration cacheTtlDefault,
            Duration cacheTtlSchema,
            Duration cacheTtlQuery
    ) {

        public boolean isEmpty() {
            return rowLimit == null && unlimitedRows == null && queryTimeout == null && logLevel == null
                    && cacheTtlDefault == null && cacheTtlSchema == null && cacheTtlQuery == null;
        }

        RuntimeConfig applyTo(RuntimeConfig base) {
            RuntimeConfig.RuntimeConfigBuilder b = base.toBuilder();
            if (Boolean.TRUE.equals(unlimitedRows)) b.rowLimit(null);
            else if (rowLimit != null) b.rowLimit(rowLimit);
            if (queryTimeout != null) b.queryTimeout(queryTimeout);
            if (logLevel != null) b.logLevel(logLevel);
            if (cacheTtlDefault != null) b.cacheTtlDefault(cacheTtlDefault);
            if (cacheTtlSchema != null) b.cacheTtlSchema(cacheTtlSchema);
            if (cacheTtlQuery != null) b.cacheTtlQuery(cacheTtlQuery);
            return b.build();
        }
    }
}
