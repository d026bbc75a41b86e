package com.nextactiontracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Due action counts per urgency tier.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DueSummaryResponse {
    private long total;
    private long red;
    private long yellow;
    private long blue;
}
