package com.github.dimitryivaniuta.dbgateway.tools.dto;

import java.util.List;

public record TableDescription(String schema, String table, List<ColumnInfo> columns) {}
