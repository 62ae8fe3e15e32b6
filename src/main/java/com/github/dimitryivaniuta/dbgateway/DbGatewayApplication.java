package com.github.dimitryivaniuta.dbgateway;

import com.github.dimitryivaniuta.dbgateway.config.GatewayProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class DbGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbGatewayApplication.class, args);
    }
}
