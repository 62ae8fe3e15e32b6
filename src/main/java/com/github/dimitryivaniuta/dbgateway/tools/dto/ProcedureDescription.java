package com.github.dimitryivaniuta.dbgateway.tools.dto;

import java.util.List;

public record ProcedureDescription(
        String schema,
        String name,
        String type,
        String returnType,
        List<ParameterInfo> parameters
) {}
