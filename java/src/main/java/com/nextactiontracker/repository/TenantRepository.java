package com.nextactiontracker.repository;

import com.nextactiontracker.model.entity.Tenant;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository for Tenant entities.
 */
@Repository
public interface TenantRepository extends ReactiveCrudRepository<Tenant, UUID> {
}
