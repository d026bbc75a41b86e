package com.nextactiontracker.controller;

import com.nextactiontracker.model.dto.TenantResponse;
import com.nextactiontracker.service.TenantService;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Controller exposing the calling tenant.
 */
@RestController
@RequestMapping("/api/v1/tenant")
@RequiredArgsConstructor
public class TenantController {

    private final TenantService tenantService;

    @GetMapping
    public Mono<TenantResponse> getCurrentTenant(@AuthenticationPrincipal UUID tenantId) {
        return tenantService.getTenant(tenantId);
    }
}
