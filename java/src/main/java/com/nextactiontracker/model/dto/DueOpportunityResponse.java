package com.nextactiontracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Dashboard projection of an opportunity whose next action is due.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DueOpportunityResponse {
    private UUID id;
    private String name;
    private Integer value;
    private String stage;
    private OffsetDateTime nextActionAt;
    private String nextActionDetails;
}
