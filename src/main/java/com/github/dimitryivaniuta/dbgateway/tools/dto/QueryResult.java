package com.github.dimitryivaniuta.dbgateway.tools.dto;

import java.util.List;

/**
 * Tabular result. Cells are the driver's text rendering ({@code ResultSet#getString}), so a
 * cached result reads exactly like a fresh one.
 *
 * @param truncated more rows existed beyond the applied limit
 */
public record QueryResult(
        List<String> columns,
        List<List<String>> rows,
        int rowCount,
        boolean truncated
) {}
