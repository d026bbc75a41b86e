package com.nextactiontracker.service;

import com.nextactiontracker.exception.InvalidTenantException;
import com.nextactiontracker.exception.ResourceNotFoundException;
import com.nextactiontracker.exception.ValidationFailedException;
import com.nextactiontracker.model.UrgencyTier;
import com.nextactiontracker.model.dto.CompleteActionRequest;
import com.nextactiontracker.model.dto.CompleteActionResponse;
import com.nextactiontracker.model.dto.DueOpportunityResponse;
import com.nextactiontracker.model.dto.DueSummaryResponse;
import com.nextactiontracker.model.entity.Opportunity;
import com.nextactiontracker.repository.OpportunityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for the opportunity ledger: due actions and action completion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpportunityService {

    static final int MIN_DETAILS_LENGTH = 5;
    static final int MAX_DETAILS_LENGTH = 1000;
    static final String COMPLETED_MESSAGE = "Action completed and next action scheduled successfully";

    private final OpportunityRepository opportunityRepository;
    private final Clock clock;

    /**
     * List opportunities whose next action is due now or overdue.
     *
     * @param tenantId Tenant ID
     * @return Flux of due opportunities, most overdue first
     */
    public Flux<DueOpportunityResponse> listDueActions(UUID tenantId) {
        return listDueActions(tenantId, OffsetDateTime.now(clock));
    }

    /**
     * List opportunities whose next action is due at or before {@code now}.
     *
     * @param tenantId Tenant ID
     * @param now Reference instant
     * @return Flux of due opportunities ordered by next action time ascending
     */
    public Flux<DueOpportunityResponse> listDueActions(UUID tenantId, OffsetDateTime now) {
        if (tenantId == null) {
            return Flux.error(new InvalidTenantException("Tenant ID is required"));
        }
        log.info("Fetching due opportunities: tenant={}", tenantId);
        return opportunityRepository.findDueByTenantId(tenantId, now)
                .map(this::toDueResponse);
    }

    /**
     * Count due opportunities per urgency tier.
     *
     * @param tenantId Tenant ID
     * @return Summary of due actions
     */
    public Mono<DueSummaryResponse> summarizeDueActions(UUID tenantId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate today = toLocalDate(now);
        return listDueActions(tenantId, now)
                .map(due -> UrgencyTier.classify(toLocalDate(due.getNextActionAt()), today))
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()))
                .map(this::toSummary);
    }

    /**
     * Complete the current action and schedule the next one.
     *
     * @param tenantId Tenant ID
     * @param opportunityId Opportunity ID
     * @param request New next action
     * @return Completion confirmation
     */
    @Transactional
    public Mono<CompleteActionResponse> completeAction(UUID tenantId, UUID opportunityId, CompleteActionRequest request) {
        return completeAction(tenantId, opportunityId, request.getNewNextActionAt(),
                request.getNewNextActionDetails(), OffsetDateTime.now(clock));
    }

    /**
     * Complete the current action and schedule the next one as of {@code now}.
     *
     * Nothing is written unless every input passes validation. An opportunity owned by
     * another tenant is reported exactly like a missing one.
     */
    @Transactional
    public Mono<CompleteActionResponse> completeAction(UUID tenantId, UUID opportunityId,
                                                       OffsetDateTime newNextActionAt,
                                                       String newNextActionDetails,
                                                       OffsetDateTime now) {
        if (tenantId == null) {
            return Mono.error(new InvalidTenantException("Tenant ID is required"));
        }
        try {
            validateCompletion(opportunityId, newNextActionAt, newNextActionDetails, now);
        } catch (ValidationFailedException e) {
            return Mono.error(e);
        }

        log.info("Completing action: tenant={}, opportunity={}, newActionAt={}",
                tenantId, opportunityId, newNextActionAt);

        return opportunityRepository.completeAction(opportunityId, tenantId, newNextActionAt,
                        newNextActionDetails, now)
                .flatMap(updated -> {
                    if (updated == 0) {
                        return Mono.error(new ResourceNotFoundException("Opportunity", opportunityId.toString()));
                    }
                    log.info("Action completed: tenant={}, opportunity={}", tenantId, opportunityId);
                    return Mono.just(CompleteActionResponse.builder()
                            .message(COMPLETED_MESSAGE)
                            .opportunityId(opportunityId)
                            .updatedAt(now)
                            .build());
                });
    }

    /**
     * The new date must fall on today or later in the dashboard's zone; the time of day
     * is ignored. Details must carry at least five non-blank characters and at most 1000 in total.
     */
    private void validateCompletion(UUID opportunityId, OffsetDateTime newNextActionAt,
                                    String newNextActionDetails, OffsetDateTime now) {
        if (opportunityId == null) {
            throw new ValidationFailedException("opportunity_id", "is required");
        }
        if (newNextActionAt == null) {
            throw new ValidationFailedException("new_next_action_at", "is required");
        }
        if (toLocalDate(newNextActionAt).isBefore(toLocalDate(now))) {
            throw new ValidationFailedException("new_next_action_at", "must be today or in the future");
        }
        if (newNextActionDetails == null || newNextActionDetails.trim().isEmpty()) {
            throw new ValidationFailedException("new_next_action_details", "is required");
        }
        if (newNextActionDetails.trim().length() < MIN_DETAILS_LENGTH) {
            throw new ValidationFailedException("new_next_action_details",
                    "must be at least " + MIN_DETAILS_LENGTH + " characters");
        }
        if (newNextActionDetails.length() > MAX_DETAILS_LENGTH) {
            throw new ValidationFailedException("new_next_action_details",
                    "cannot exceed " + MAX_DETAILS_LENGTH + " characters");
        }
    }

    private LocalDate toLocalDate(OffsetDateTime timestamp) {
        return timestamp.atZoneSameInstant(clock.getZone()).toLocalDate();
    }

    private DueOpportunityResponse toDueResponse(Opportunity opportunity) {
        return DueOpportunityResponse.builder()
                .id(opportunity.getId())
                .name(opportunity.getName())
                .value(opportunity.getValue())
                .stage(opportunity.getStage())
                .nextActionAt(opportunity.getNextActionAt())
                .nextActionDetails(opportunity.getNextActionDetails())
                .build();
    }

    private DueSummaryResponse toSummary(Map<UrgencyTier, Long> counts) {
        long red = counts.getOrDefault(UrgencyTier.RED, 0L);
        long yellow = counts.getOrDefault(UrgencyTier.YELLOW, 0L);
        long blue = counts.getOrDefault(UrgencyTier.BLUE, 0L);
        return DueSummaryResponse.builder()
                .total(red + yellow + blue)
                .red(red)
                .yellow(yellow)
                .blue(blue)
                .build();
    }
}
