package com.nextactiontracker.service;

import com.nextactiontracker.exception.ResourceNotFoundException;
import com.nextactiontracker.model.dto.TenantResponse;
import com.nextactiontracker.repository.TenantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Service for tenant lookup.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TenantService {

    private final TenantRepository tenantRepository;

    /**
     * Get the tenant making the request.
     *
     * @param tenantId Tenant ID
     * @return Tenant response
     */
    public Mono<TenantResponse> getTenant(UUID tenantId) {
        return tenantRepository.findById(tenantId)
                .map(tenant -> TenantResponse.builder()
                        .id(tenant.getId())
                        .name(tenant.getName())
                        .createdAt(tenant.getCreatedAt())
                        .build())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tenant", tenantId.toString())));
    }
}
