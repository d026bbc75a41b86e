package com.nextactiontracker.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Request DTO for completing the current action and scheduling the next one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteActionRequest {

    @NotNull(message = "New next action date is required")
    private OffsetDateTime newNextActionAt;

    @NotBlank(message = "New next action details are required")
    @Size(max = 1000, message = "New next action details cannot exceed 1000 characters")
    private String newNextActionDetails;
}
