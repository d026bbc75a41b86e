package com.nextactiontracker.repository;

import com.nextactiontracker.model.entity.Opportunity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Repository for Opportunity entities.
 *
 * Every query is scoped by tenant_id; none of these methods can read or
 * touch a row owned by another tenant.
 */
@Repository
public interface OpportunityRepository extends ReactiveCrudRepository<Opportunity, UUID> {

    /**
     * Find opportunities whose next action is due at or before the given instant,
     * oldest first. Served by idx_opportunities_tenant_due.
     */
    @Query("SELECT * FROM opportunities " +
            "WHERE tenant_id = :tenantId " +
            "AND next_action_at IS NOT NULL " +
            "AND next_action_at <= :now " +
            "ORDER BY next_action_at ASC")
    Flux<Opportunity> findDueByTenantId(UUID tenantId, OffsetDateTime now);

    /**
     * Replace the next action in a single conditional statement.
     *
     * @return number of rows updated, 0 when the id does not exist for the tenant
     */
    @Modifying
    @Query("UPDATE opportunities SET " +
            "next_action_at = :nextActionAt, " +
            "next_action_details = :nextActionDetails, " +
            "last_activity_at = GREATEST(last_activity_at, :now), " +
            "updated_at = :now " +
            "WHERE id = :id AND tenant_id = :tenantId")
    Mono<Integer> completeAction(UUID id, UUID tenantId, OffsetDateTime nextActionAt,
                                 String nextActionDetails, OffsetDateTime now);
}
