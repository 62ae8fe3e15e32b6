package com.github.dimitryivaniuta.dbgateway.tools.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * @param limit optional row limit; capped by the runtime row limit
 */
public record QueryRequest(
        @NotBlank @Size(max = 100_000) String sql,
        @Positive Integer limit
) {}
