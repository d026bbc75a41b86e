package com.nextactiontracker.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Sales opportunity owned by exactly one tenant, carrying its next scheduled action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("opportunities")
public class Opportunity {

    @Id
    private UUID id;

    @Column("tenant_id")
    private UUID tenantId;

    @Column("name")
    private String name;

    @Column("value")
    private Integer value;

    @Column("stage")
    private String stage;

    @Column("next_action_at")
    private OffsetDateTime nextActionAt; // null for rows with nothing scheduled yet

    @Column("next_action_details")
    private String nextActionDetails;

    @Column("last_activity_at")
    private OffsetDateTime lastActivityAt;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;
}
