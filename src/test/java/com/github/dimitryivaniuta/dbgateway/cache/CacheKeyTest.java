package com.github.dimitryivaniuta.dbgateway.cache;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheKeyTest {

    private static final TenantId ALICE = TenantId.of("user:alice");
    private static final TenantId BOB = TenantId.of("user:bob");

    @Test
    void identicalRequestsFromSameTenantProduceEqualKeys() {
        CacheKey a = CacheKey.queryResult(ALICE, "SELECT * FROM orders", 100);
        CacheKey b = CacheKey.queryResult(ALICE, "SELECT * FROM orders", 100);

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void differentTenantsNeverShareAKey() {
        assertThat(CacheKey.queryResult(ALICE, "SELECT 1", 10))
                .isNotEqualTo(CacheKey.queryResult(BOB, "SELECT 1", 10));
        assertThat(CacheKey.tableDescribe(ALICE, "public", "orders"))
                .isNotEqualTo(CacheKey.tableDescribe(BOB, "public", "orders"));
    }

    @Test
    void tenantIsCaseSensitive() {
        assertThat(CacheKey.schemaList(TenantId.of("user:Alice"), "public"))
                .isNotEqualTo(CacheKey.schemaList(TenantId.of("user:alice"), "public"));
    }

    @Test
    void rowLimitAndNamespaceAreDiscriminators() {
        CacheKey limited = CacheKey.queryResult(ALICE, "SELECT 1", 10);
        CacheKey other = CacheKey.queryResult(ALICE, "SELECT 1", 20);
        CacheKey unlimited = CacheKey.queryResult(ALICE, "SELECT 1", null);

        assertThat(limited).isNotEqualTo(other).isNotEqualTo(unlimited);
        assertThat(CacheKey.tableDescribe(ALICE, "public", "x"))
                .isNotEqualTo(CacheKey.procedureDescribe(ALICE, "public", "x"));
    }

    @Test
    void absentPartDiffersFromAnyTextValue() {
        CacheKey noPattern = CacheKey.procedureList(ALICE, "public", null);
        CacheKey underscore = CacheKey.procedureList(ALICE, "public", "_");

        assertThat(noPattern).isNotEqualTo(underscore);
    }

    @Test
    void queryKeyHoldsHashAndUtf8LengthInsteadOfText() {
        String sql = "SELECT 'zażółć' FROM dual";
        CacheKey key = CacheKey.queryResult(ALICE, sql, 5);

        assertThat(key.discriminator()).hasSize(3);
        assertThat(key.discriminator().get(0)).hasSize(64).matches("[0-9a-f]+");
        assertThat(key.discriminator().get(1)).isEqualTo(String.valueOf(sql.getBytes(java.nio.charset.StandardCharsets.UTF_8).length));
        assertThat(key.discriminator().get(2)).isEqualTo("5");
        assertThat(key.toKeyString()).doesNotContain("SELECT");
    }

    @Test
    void canonicalStringFormat() {
        assertThat(CacheKey.schemaList(ALICE, "public").toKeyString()).isEqualTo("tbl_list:user:alice:public:_all");
        assertThat(CacheKey.procedureList(ALICE, "public", null).toKeyString()).isEqualTo("proc_list:user:alice:public:_all:_");
        assertThat(CacheKey.custom(ALICE, "report", null).toString()).isEqualTo("custom:user:alice:report:_");
    }

    @Test
    void discriminatorIsDefensivelyCopied() {
        String[] parts = {"a", "b"};
        CacheKey key = new CacheKey(CacheNamespace.CUSTOM, ALICE, Arrays.asList(parts));
        parts[0] = "changed";

        assertThat(key.discriminator()).containsExactly("a", "b");
        assertThatThrownBy(() -> key.discriminator().add("c")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void tenantIsMandatory() {
        assertThatThrownBy(() -> CacheKey.schemaList(null, "public")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> TenantId.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void belongsToMatchesNamespaceAndTenant() {
        CacheKey key = CacheKey.tableDescribe(ALICE, "public", "orders");

        assertThat(key.belongsTo(CacheNamespace.TABLE_DESCRIBE)).isTrue();
        assertThat(key.belongsTo(CacheNamespace.TABLE_DESCRIBE, ALICE)).isTrue();
        assertThat(key.belongsTo(CacheNamespace.TABLE_DESCRIBE, BOB)).isFalse();
        assertThat(key.belongsTo(CacheNamespace.SCHEMA_LIST)).isFalse();
    }

    @Test
    void namespaceParsesPrefixOrName() {
        assertThat(CacheNamespace.parse("query")).contains(CacheNamespace.QUERY_RESULT);
        assertThat(CacheNamespace.parse("table-describe")).contains(CacheNamespace.TABLE_DESCRIBE);
        assertThat(CacheNamespace.parse("TBL_LIST")).contains(CacheNamespace.SCHEMA_LIST);
        assertThat(CacheNamespace.parse("nope")).isEmpty();
    }
}
