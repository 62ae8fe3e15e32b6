package com.github.dimitryivaniuta.dbgateway.tools.dto;

public record ColumnInfo(
        String name,
        String dataType,
        boolean nullable,
        String defaultValue,
        int position
) {}
