package com.nextactiontracker.controller;

import com.nextactiontracker.model.dto.CompleteActionRequest;
import com.nextactiontracker.model.dto.CompleteActionResponse;
import com.nextactiontracker.model.dto.DueOpportunityResponse;
import com.nextactiontracker.model.dto.DueSummaryResponse;
import com.nextactiontracker.service.OpportunityService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller for the due-actions dashboard and action completion.
 */
@RestController
@RequestMapping("/api/v1/opportunities")
@RequiredArgsConstructor
public class OpportunityController {

    private final OpportunityService opportunityService;

    @GetMapping("/due")
    public Flux<DueOpportunityResponse> listDueActions(@AuthenticationPrincipal UUID tenantId) {
        return opportunityService.listDueActions(tenantId);
    }

    @GetMapping("/due/summary")
    public Mono<DueSummaryResponse> summarizeDueActions(@AuthenticationPrincipal UUID tenantId) {
        return opportunityService.summarizeDueActions(tenantId);
    }

    @PostMapping("/{opportunityId}/complete_action")
    public Mono<CompleteActionResponse> completeAction(
            @AuthenticationPrincipal UUID tenantId,
            @PathVariable UUID opportunityId,
            @Valid @RequestBody CompleteActionRequest request) {
        return opportunityService.completeAction(tenantId, opportunityId, request);
    }
}
