package com.commerce.diagnostics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Equality predicate {@code column = value} applied to a dimension query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DimensionFilter {
    private String column;
    private Object value;
}
