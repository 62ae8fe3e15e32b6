package com.github.dimitryivaniuta.dbgateway.runtime;

import com.github.dimitryivaniuta.dbgateway.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import sun.misc.Signal;

/**
 * Reloads the runtime configuration when the process receives {@code SIGHUP}
 * (or the signal named by {@code gateway.reload.signal-name}).
 *
 * <p>The handler replaces the JVM default for that signal. Platforms without the signal
 * only log a warning; the HTTP and manual triggers keep working.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gateway.reload", name = "signal-enabled", havingValue = "true", matchIfMissing = true)
public class SignalReloadListener {

    private final RuntimeConfigService service;
    private final GatewayProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void install() {
        String name = properties.getReload().getSignalName();
        try {
            Signal.handle(new Signal(name), this::onSignal);
            log.info("Runtime config reload on SIG{} enabled", name);
        } catch (IllegalArgumentException ex) {
            log.warn("Signal SIG{} not available on this platform, reload by signal disabled: {}", name, ex.getMessage());
        }
    }

    void onSignal(Signal signal) {
        ReloadResult result = service.reloadFromEnvironment(ReloadTrigger.signal());
        if (!result.success()) {
            log.warn("Reload on SIG{} failed, previous configuration kept: {}", signal.getName(), result.error());
        }
    }
}
