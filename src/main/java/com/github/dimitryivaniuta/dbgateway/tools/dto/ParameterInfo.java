package com.github.dimitryivaniuta.dbgateway.tools.dto;

/**
 * @param mode IN, OUT or INOUT
 */
public record ParameterInfo(String name, String dataType, String mode, int position) {}
