package com.commerce.diagnostics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The current window of an alert and the baseline it is measured against.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonWindows {
    private TimeWindow current;
    private TimeWindow baseline;
}
