package com.github.dimitryivaniuta.dbgateway.tools.dto;

/**
 * @param type       PROCEDURE or FUNCTION
 * @param returnType null for procedures
 */
public record ProcedureInfo(String name, String type, String returnType) {}
