package com.nextactiontracker.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Confirmation returned after an action is completed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteActionResponse {
    private String message;
    private UUID opportunityId;
    private OffsetDateTime updatedAt;
}
