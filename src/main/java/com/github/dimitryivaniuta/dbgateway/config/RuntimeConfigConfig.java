package com.github.dimitryivaniuta.dbgateway.config;

import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfig;
import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfigHolder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuntimeConfigConfig {

    /**
     * Initial snapshot from {@code gateway.runtime.*}. Invalid values fail startup.
     */
    @Bean
    public RuntimeConfigHolder runtimeConfigHolder(GatewayProperties properties) {
        RuntimeConfig initial = properties.getRuntime().toRuntimeConfig();
        return new RuntimeConfigHolder(initial);
    }
}
