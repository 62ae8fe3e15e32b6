package com.github.dimitryivaniuta.dbgateway.runtime;

import com.github.dimitryivaniuta.dbgateway.infra.BaseIntegrationTest;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
class AdminEndpointsTest extends BaseIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired RuntimeConfigHolder holder;
    @Autowired MeterRegistry registry;

    @AfterEach
    void restoreRuntimeConfig() {
        holder.reload(RuntimeConfig.defaults(), ReloadTrigger.manual());
    }

    @Test
    void runtimeConfig_isReadable() throws Exception {
        mvc.perform(get("/api/admin/runtime-config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowLimit").value(1000))
                .andExpect(jsonPath("$.queryTimeout").value("PT30S"))
                .andExpect(jsonPath("$.cacheTtlQuery").value("PT1M"));
    }

    @Test
    void reloadWithOverrides_appliesAndReportsChanges() throws Exception {
        mvc.perform(post("/api/admin/runtime-config/reload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"rowLimit":1,"cacheTtlQuery":"PT2M"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.changed", hasItem("rowLimit: 1000 -> 1")))
                .andExpect(jsonPath("$.changed", hasItem("cacheTtlQuery: PT1M -> PT2M")))
                .andExpect(jsonPath("$.trigger", containsString("HTTP /admin/reload")));

        assertThat(holder.read().rowLimit()).isEqualTo(1);

        // the next query reads the new limit
        mvc.perform(post("/api/tools/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sql":"SELECT id FROM inventory.products"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rowCount").value(1))
                .andExpect(jsonPath("$.truncated").value(true));

        var reloads = registry.find("gateway_runtime_config_reloads_total")
                .tag("trigger", "http_endpoint")
                .tag("outcome", "success")
                .counter();
        assertThat(reloads).isNotNull();
        assertThat(reloads.count()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    void reloadWithInvalidValue_is422AndKeepsConfig() throws Exception {
        RuntimeConfig before = holder.read();

        mvc.perform(post("/api/admin/runtime-config/reload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"queryTimeout":"PT2H"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error", containsString("queryTimeout")));

        assertThat(holder.read()).isSameAs(before);
    }

    @Test
    void reloadWithoutBody_rereadsEnvironment() throws Exception {
        holder.reload(RuntimeConfig.defaults().toBuilder().rowLimit(7).build(), ReloadTrigger.manual());

        mvc.perform(post("/api/admin/runtime-config/reload"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.changed", hasItem("rowLimit: 7 -> 1000")));
    }

    @Test
    void cacheInvalidation_byTenantAndUnknownNamespace() throws Exception {
        for (String key : new String[]{"k1", "k2"}) {
            mvc.perform(get("/api/tools/schemas/{schema}/tables", "inventory").header("X-Api-Key", key))
                    .andExpect(status().isOk());
        }
        mvc.perform(get("/api/tools/schemas/{schema}/tables", "inventory"))
                .andExpect(status().isOk());

        mvc.perform(delete("/api/admin/cache/{namespace}", "schema_list").queryParam("tenant", "system"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.namespace").value("tbl_list"))
                .andExpect(jsonPath("$.tenant").value("system"))
                .andExpect(jsonPath("$.removed").value(1));

        mvc.perform(delete("/api/admin/cache/{namespace}", "tbl_list"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2));

        mvc.perform(delete("/api/admin/cache/{namespace}", "bogus"))
                .andExpect(status().isNotFound());
    }

    @Test
    void cacheStats_resetAndClear() throws Exception {
        mvc.perform(get("/api/tools/schemas/{schema}/tables", "inventory")).andExpect(status().isOk());

        mvc.perform(get("/api/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.misses").value(1))
                .andExpect(jsonPath("$.sets").value(1))
                .andExpect(jsonPath("$.entries").value(1))
                .andExpect(jsonPath("$.provider", containsString("InMemoryCache")));

        mvc.perform(delete("/api/admin/cache")).andExpect(status().isNoContent());
        mvc.perform(post("/api/admin/cache/stats/reset")).andExpect(status().isNoContent());

        mvc.perform(get("/api/admin/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.misses").value(0))
                .andExpect(jsonPath("$.entries").value(0));
    }

    @Test
    void actuator_reportsCacheHealthAndMetrics() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.cache.status").value("UP"));

        mvc.perform(get("/actuator/prometheus"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("gateway_cache_entries")));
    }
}
