package com.github.dimitryivaniuta.dbgateway.tools.dto;

public record TableInfo(String name, String type) {}
