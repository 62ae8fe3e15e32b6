package com.github.dimitryivaniuta.dbgateway.tools;

import com.github.dimitryivaniuta.dbgateway.tenant.TenantResolver;
import com.github.dimitryivaniuta.dbgateway.tools.dto.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Tool endpoints invoked by agents. Each request is scoped to the tenant resolved from
 * its credentials.
 */
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tools")
public class DatabaseToolController {

    private final DatabaseToolService tools;
    private final TenantResolver tenantResolver;

    @GetMapping("/schemas/{schema}/tables")
    public List<TableInfo> listTables(@PathVariable String schema, HttpServletRequest request) {
        return tools.listTables(tenantResolver.resolve(request), schema);
    }

    @GetMapping("/schemas/{schema}/tables/{table}")
    public TableDescription describeTable(@PathVariable String schema,
                                          @PathVariable String table,
                                          HttpServletRequest request) {
        return tools.describeTable(tenantResolver.resolve(request), schema, table);
    }

    @GetMapping("/schemas/{schema}/procedures")
    public List<ProcedureInfo> listProcedures(@PathVariable String schema,
                                              @RequestParam(required = false) String pattern,
                                              HttpServletRequest request) {
        return tools.listProcedures(tenantResolver.resolve(request), schema, pattern);
    }

    @GetMapping("/schemas/{schema}/procedures/{procedure}")
    public ProcedureDescription describeProcedure(@PathVariable String schema,
                                                  @PathVariable String procedure,
                                                  HttpServletRequest request) {
        return tools.describeProcedure(tenantResolver.resolve(request), schema, procedure);
    }

    @PostMapping("/query")
    public QueryResult query(@Valid @RequestBody QueryRequest body, HttpServletRequest request) {
        return tools.executeQuery(tenantResolver.resolve(request), body);
    }
}
