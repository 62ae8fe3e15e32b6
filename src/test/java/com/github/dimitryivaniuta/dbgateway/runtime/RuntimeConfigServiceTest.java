package com.github.dimitryivaniuta.dbgateway.runtime;

import com.github.dimitryivaniuta.dbgateway.config.GatewayProperties;
import com.github.dimitryivaniuta.dbgateway.metrics.GatewayCacheMetrics;
import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfigService.RuntimeConfigOverrides;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.StandardEnvironment;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class RuntimeConfigServiceTest {

    private static final String LOGGER = "com.github.dimitryivaniuta.dbgateway";

    private final Map<String, Object> appProps = new HashMap<>();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LoggingSystem loggingSystem = mock(LoggingSystem.class);

    private GatewayProperties properties;
    private RuntimeConfigHolder holder;
    private RuntimeConfigService service;

    @BeforeEach
    void setUp() {
        StandardEnvironment env = new StandardEnvironment();
        env.getPropertySources().addLast(new MapPropertySource("app", appProps));

        properties = new GatewayProperties();
        properties.getRuntime().setLoggerName(LOGGER);

        holder = new RuntimeConfigHolder(RuntimeConfig.defaults());
        service = new RuntimeConfigService(holder, env, loggingSystem, new GatewayCacheMetrics(registry), properties);
        service.initLogLevel();
        clearInvocations(loggingSystem);
    }

    private double reloads(String trigger, String outcome) {
        var counter = registry.find("gateway_runtime_config_reloads_total")
                .tag("trigger", trigger)
                .tag("outcome", outcome)
                .counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void startupSnapshotLogLevelIsApplied() {
        RuntimeConfig debug = RuntimeConfig.defaults().toBuilder().logLevel(LogLevel.DEBUG).build();
        LoggingSystem logging = mock(LoggingSystem.class);
        RuntimeConfigService fresh = new RuntimeConfigService(new RuntimeConfigHolder(debug),
                new StandardEnvironment(), logging, new GatewayCacheMetrics(registry), properties);

        fresh.initLogLevel();

        verify(logging).setLogLevel(LOGGER, LogLevel.DEBUG);
    }

    @Test
    void reloadPicksUpChangedEnvironmentValues() {
        appProps.put("gateway.runtime.row-limit", "250");
        appProps.put("gateway.runtime.ttl.query", "PT2M");
        appProps.put("gateway.runtime.log-level", "debug");

        ReloadResult result = service.reloadManually();

        assertThat(result.success()).isTrue();
        assertThat(result.changed()).containsExactlyInAnyOrder(
                "rowLimit: 1000 -> 250",
                "cacheTtlQuery: PT1M -> PT2M",
                "logLevel: INFO -> DEBUG");
        assertThat(service.current().rowLimit()).isEqualTo(250);
        assertThat(service.current().cacheTtlQuery()).isEqualTo(Duration.ofMinutes(2));
        verify(loggingSystem).setLogLevel(LOGGER, LogLevel.DEBUG);
        assertThat(reloads("manual", "success")).isEqualTo(1.0);
    }

    @Test
    void invalidEnvironmentValueIsRejectedAndCounted() {
        appProps.put("gateway.runtime.query-timeout", "PT0S");
        RuntimeConfig before = holder.read();

        ReloadResult result = service.reloadFromEnvironment(ReloadTrigger.signal());

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("queryTimeout");
        assertThat(holder.read()).isSameAs(before);
        verify(loggingSystem, never()).setLogLevel(anyString(), any());
        assertThat(reloads("signal", "failure")).isEqualTo(1.0);
    }

    @Test
    void malformedValueIsRejected() {
        appProps.put("gateway.runtime.row-limit", "lots");

        ReloadResult result = service.reloadFromEnvironment(ReloadTrigger.httpEndpoint("127.0.0.1"));

        assertThat(result.success()).isFalse();
        assertThat(service.current().rowLimit()).isEqualTo(RuntimeConfig.DEFAULT_ROW_LIMIT);
        assertThat(reloads("http_endpoint", "failure")).isEqualTo(1.0);
    }

    @Test
    void reloadFileTakesPrecedenceOverStartupValues(@TempDir Path dir) throws Exception {
        appProps.put("gateway.runtime.row-limit", "250");
        Path file = dir.resolve("runtime.yml");
        Files.writeString(file, """
                gateway:
                  runtime:
                    row-limit: 75
                    ttl:
                      schema: PT10M
                """);
        properties.getReload().setConfigFile(file.toUri().toString());

        ReloadResult result = service.reloadManually();

        assertThat(result.success()).isTrue();
        assertThat(service.current().rowLimit()).isEqualTo(75);
        assertThat(service.current().cacheTtlSchema()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void missingReloadFileFailsTheReload() {
        properties.getReload().setConfigFile("file:/nonexistent/runtime.yml");

        ReloadResult result = service.reloadManually();

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not found");
    }

    @Test
    void overridesApplyOnTopOfActiveSnapshot() {
        holder.reload(RuntimeConfig.defaults().toBuilder().rowLimit(500).build(), ReloadTrigger.manual());

        ReloadResult result = service.reloadWithOverrides(
                new RuntimeConfigOverrides(null, null, Duration.ofSeconds(5), null, null, null, null),
                ReloadTrigger.httpEndpoint("10.1.1.1"));

        assertThat(result.success()).isTrue();
        assertThat(result.changed()).containsExactly("queryTimeout: PT30S -> PT5S");
        assertThat(service.current().rowLimit()).isEqualTo(500);
        assertThat(reloads("http_endpoint", "success")).isEqualTo(1.0);
    }

    @Test
    void unlimitedRowsOverrideClearsTheLimit() {
        ReloadResult result = service.reloadWithOverrides(
                new RuntimeConfigOverrides(10, true, null, null, null, null, null),
                ReloadTrigger.manual());

        assertThat(result.success()).isTrue();
        assertThat(service.current().rowLimit()).isNull();
    }

    @Test
    void invalidOverrideKeepsActiveSnapshot() {
        ReloadResult result = service.reloadWithOverrides(
                new RuntimeConfigOverrides(null, null, null, null, null, null, Duration.ofDays(7)),
                ReloadTrigger.manual());

        assertThat(result.success()).isFalse();
        assertThat(service.current()).isEqualTo(RuntimeConfig.defaults());
    }

    @Test
    void emptyOverridesAreDetected() {
        assertThat(new RuntimeConfigOverrides(null, null, null, null, null, null, null).isEmpty()).isTrue();
        assertThat(new RuntimeConfigOverrides(null, false, null, null, null, null, null).isEmpty()).isFalse();
    }
}
