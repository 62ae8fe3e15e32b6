package com.github.dimitryivaniuta.dbgateway.infra;

import com.github.dimitryivaniuta.dbgateway.cache.CacheProvider;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * PostgreSQL-backed base for endpoint tests. Each test starts with a fresh
 * {@code inventory} schema, an empty cache and zeroed cache statistics.
 */
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "management.endpoints.web.exposure.include=health,info,metrics,prometheus",
        "management.prometheus.metrics.export.enabled=true"
})
@Testcontainers(disabledWithoutDocker = true)
// the container is per test class, so is the context
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class BaseIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES =
            new PostgreSQLContainer<>("postgres:16-alpine")
                    .withDatabaseName("gateway")
                    .withUsername("gateway")
                    .withPassword("gateway");

    @DynamicPropertySource
    static void dbProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired protected JdbcTemplate jdbc;
    @Autowired protected CacheProvider cache;

    @BeforeEach
    void resetState() {
        jdbc.execute("DROP SCHEMA IF EXISTS inventory CASCADE");
        jdbc.execute("CREATE SCHEMA inventory");
        jdbc.execute("""
            CREATE TABLE inventory.products (
              id    BIGSERIAL PRIMARY KEY,
              name  TEXT NOT NULL,
              price NUMERIC(10, 2)
            )
            """);
        jdbc.execute("CREATE VIEW inventory.cheap_products AS SELECT * FROM inventory.products WHERE price < 10");
        jdbc.execute("""
            CREATE FUNCTION inventory.price_with_tax(p_price NUMERIC, p_rate NUMERIC DEFAULT 0.23)
            RETURNS NUMERIC LANGUAGE sql IMMUTABLE AS $$ SELECT p_price * (1 + p_rate) $$
            """);
        jdbc.execute("""
            CREATE PROCEDURE inventory.restock(p_id BIGINT)
            LANGUAGE sql AS $$ UPDATE inventory.products SET price = price WHERE id = p_id $$
            """);
        jdbc.update("INSERT INTO inventory.products(name, price) VALUES ('pen', 2.50), ('lamp', 35.00)");

        cache.clear();
        cache.resetStats();
    }
}
