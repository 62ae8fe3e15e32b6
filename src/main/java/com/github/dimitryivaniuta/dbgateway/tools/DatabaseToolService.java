package com.github.dimitryivaniuta.dbgateway.tools;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.dimitryivaniuta.dbgateway.cache.CacheKey;
import com.github.dimitryivaniuta.dbgateway.cache.CacheNamespace;
import com.github.dimitryivaniuta.dbgateway.cache.CachedFetcher;
import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfig;
import com.github.dimitryivaniuta.dbgateway.runtime.RuntimeConfigHolder;
import com.github.dimitryivaniuta.dbgateway.tenant.TenantId;
import com.github.dimitryivaniuta.dbgateway.tools.dto.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only database tools. Every call reads the runtime config once and uses that
 * snapshot for row limit, timeout and TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseToolService {

    private static final String LIST_TABLES = """
            SELECT table_name, table_type
              FROM information_schema.tables
             WHERE table_schema = ?
             ORDER BY table_name
            """;

    private static final String DESCRIBE_TABLE = """
            SELECT column_name, data_type, is_nullable, column_default, ordinal_position
              FROM information_schema.columns
             WHERE table_schema = ? AND table_name = ?
             ORDER BY ordinal_position
            """;

    private static final String LIST_ROUTINES = """
            SELECT DISTINCT routine_name, routine_type, data_type
              FROM information_schema.routines
             WHERE routine_schema = ? AND routine_name LIKE ?
             ORDER BY routine_name
            """;

    private static final String FIND_ROUTINE = """
            SELECT specific_name, routine_type, data_type
              FROM information_schema.routines
             WHERE routine_schema = ? AND routine_name = ?
             ORDER BY specific_name
            """;

    private static final String ROUTINE_PARAMETERS = """
            SELECT parameter_name, data_type, parameter_mode, ordinal_position
              FROM information_schema.parameters
             WHERE specific_schema = ? AND specific_name = ?
             ORDER BY ordinal_position
            """;

    private static final TypeReference<List<TableInfo>> TABLE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<ProcedureInfo>> PROCEDURE_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final CachedFetcher fetcher;
    private final RuntimeConfigHolder runtimeConfig;
    private final QueryClassifier classifier;

    public List<TableInfo> listTables(TenantId tenant, String schema) {
        String s = SqlIdentifiers.normalize(schema, "schema name");
        RuntimeConfig cfg = runtimeConfig.read();

        return fetcher.cachedOrFetch(
                CacheKey.schemaList(tenant, s),
                cfg.ttlFor(CacheNamespace.SCHEMA_LIST),
                TABLE_LIST,
                () -> jdbc.query(LIST_TABLES,
                        (rs, i) -> new TableInfo(rs.getString("table_name"), rs.getString("table_type")),
                        s));
    }

    public TableDescription describeTable(TenantId tenant, String schema, String table) {
        String s = SqlIdentifiers.normalize(schema, "schema name");
        String t = SqlIdentifiers.normalize(table, "table name");
        RuntimeConfig cfg = runtimeConfig.read();

        return fetcher.cachedOrFetch(
                CacheKey.tableDescribe(tenant, s, t),
                cfg.ttlFor(CacheNamespace.TABLE_DESCRIBE),
                TableDescription.class,
                () -> {
                    List<ColumnInfo> columns = jdbc.query(DESCRIBE_TABLE,
                            (rs, i) -> new ColumnInfo(
                                    rs.getString("column_name"),
                                    rs.getString("data_type"),
                                    "YES".equalsIgnoreCase(rs.getString("is_nullable")),
                                    rs.getString("column_default"),
                                    rs.getInt("ordinal_position")),
                            s, t);
                    if (columns.isEmpty()) {
                        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Table not found: " + s + "." + t);
                    }
                    return new TableDescription(s, t, columns);
                });
    }

    public List<ProcedureInfo> listProcedures(TenantId tenant, String schema, String pattern) {
        String s = SqlIdentifiers.normalize(schema, "schema name");
        String p = SqlIdentifiers.normalizePattern(pattern);
        RuntimeConfig cfg = runtimeConfig.read();

        return fetcher.cachedOrFetch(
                CacheKey.procedureList(tenant, s, p),
                cfg.ttlFor(CacheNamespace.PROCEDURE_LIST),
                PROCEDURE_LIST,
                () -> jdbc.query(LIST_ROUTINES,
                        (rs, i) -> new ProcedureInfo(
                                rs.getString("routine_name"),
                                rs.getString("routine_type"),
                                rs.getString("data_type")),
                        s, p));
    }

    /**
     * Describes the procedure or function; for overloaded names the first overload by
     * specific name is returned.
     */
    public ProcedureDescription describeProcedure(TenantId tenant, String schema, String procedure) {
        String s = SqlIdentifiers.normalize(schema, "schema name");
        String name = SqlIdentifiers.normalize(procedure, "procedure name");
        RuntimeConfig cfg = runtimeConfig.read();

        return fetcher.cachedOrFetch(
                CacheKey.procedureDescribe(tenant, s, name),
                cfg.ttlFor(CacheNamespace.PROCEDURE_DESCRIBE),
                ProcedureDescription.class,
                () -> {
                    List<String[]> routines = jdbc.query(FIND_ROUTINE,
                            (rs, i) -> new String[]{
                                    rs.getString("specific_name"),
                                    rs.getString("routine_type"),
                                    rs.getString("data_type")},
                            s, name);
                    if (routines.isEmpty()) {
                        throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Procedure not found: " + s + "." + name);
                    }
                    String[] routine = routines.get(0);
                    List<ParameterInfo> params = jdbc.query(ROUTINE_PARAMETERS,
                            (rs, i) -> new ParameterInfo(
                                    rs.getString("parameter_name"),
                                    rs.getString("data_type"),
                                    rs.getString("parameter_mode"),
                                    rs.getInt("ordinal_position")),
                            s, routine[0]);
                    return new ProcedureDescription(s, name, routine[1], routine[2], params);
                });
    }

    /**
     * Runs one read-only statement. Deterministic statements are served from the query
     * cache; statements using time, random or sequence functions always hit the database.
     */
    public QueryResult executeQuery(TenantId tenant, QueryRequest request) {
        String sql = request.sql();
        classifier.requireReadOnly(sql);

        RuntimeConfig cfg = runtimeConfig.read();
        Integer limit = effectiveLimit(request.limit(), cfg.rowLimit());

        if (!classifier.isCacheable(sql)) {
            log.debug("Query not cacheable, executing directly tenant={}", tenant);
            return runQuery(sql, limit, cfg);
        }
        return fetcher.cachedOrFetch(
                CacheKey.queryResult(tenant, sql, limit),
                cfg.ttlFor(CacheNamespace.QUERY_RESULT),
                QueryResult.class,
                () -> runQuery(sql, limit, cfg));
    }

    static Integer effectiveLimit(Integer requested, Integer configured) {
        if (requested == null) return configured;
        if (configured == null) return requested;
        return Math.min(requested, configured);
    }

    /**
     * JDBC max rows for a row limit: one extra row tells whether the result was cut.
     * 0 (no driver limit) when there is no limit or the extra row does not fit an int.
     */
    static int maxRowsFor(Integer limit) {
        if (limit == null || limit == Integer.MAX_VALUE) return 0;
        return limit + 1;
    }

    private QueryResult runQuery(String sql, Integer limit, RuntimeConfig cfg) {
        ResultSetExtractor<QueryResult> extractor = rs -> {
            ResultSetMetaData md = rs.getMetaData();
            int cols = md.getColumnCount();
            List<String> columns = new ArrayList<>(cols);
            for (int c = 1; c <= cols; c++) {
                columns.add(md.getColumnLabel(c));
            }

            List<List<String>> rows = new ArrayList<>();
            boolean truncated = false;
            while (rs.next()) {
                if (limit != null && rows.size() >= limit) {
                    truncated = true;
                    break;
                }
                List<String> row = new ArrayList<>(cols);
                for (int c = 1; c <= cols; c++) {
                    row.add(rs.getString(c));
                }
                rows.add(row);
            }
            return new QueryResult(columns, rows, rows.size(), truncated);
        };

        return jdbc.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            int maxRows = maxRowsFor(limit);
            if (maxRows > 0) ps.setMaxRows(maxRows);
            ps.setQueryTimeout((int) Math.max(1, cfg.queryTimeout().toSeconds()));
            return ps;
        }, extractor);
    }
}
