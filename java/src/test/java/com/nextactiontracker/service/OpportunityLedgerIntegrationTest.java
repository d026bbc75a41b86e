package com.nextactiontracker.service;

import com.nextactiontracker.exception.ResourceNotFoundException;
import com.nextactiontracker.exception.ValidationFailedException;
import com.nextactiontracker.model.dto.DueOpportunityResponse;
import com.nextactiontracker.repository.OpportunityRepository;
import com.nextactiontracker.support.LedgerFixtures;
import io.r2dbc.spi.ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.r2dbc.DataR2dbcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.test.context.ActiveProfiles;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * End-to-end ledger scenarios: service, repository and embedded H2 together.
 */
@DataR2dbcTest
@ActiveProfiles("h2")
@Import({OpportunityService.class, TenantService.class, OpportunityLedgerIntegrationTest.FixedClockConfig.class})
class OpportunityLedgerIntegrationTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 1, 10, 12, 0, 0, 0, ZoneOffset.UTC);

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.from(NOW), ZoneOffset.UTC);
        }
    }

    @Autowired
    private OpportunityService opportunityService;

    @Autowired
    private TenantService tenantService;

    @Autowired
    private OpportunityRepository opportunityRepository;

    @Autowired
    private ConnectionFactory connectionFactory;

    @Autowired
    private DatabaseClient databaseClient;

    private LedgerFixtures fixtures;
    private UUID tenantId;
    private UUID otherTenantId;

    @BeforeEach
    void setUp() {
        LedgerFixtures.createSchema(connectionFactory);
        fixtures = new LedgerFixtures(databaseClient);
        fixtures.clear();
        tenantId = fixtures.tenant("Demo Company");
        otherTenantId = fixtures.tenant("Test Organization");
    }

    @Test
    void listDueActions_SeededDashboardScenario() {
        UUID sevenDays = fixtures.opportunity(tenantId, "Enterprise Deal - Acme Corp", NOW.minusDays(7), NOW.minusDays(8));
        UUID twoDays = fixtures.opportunity(tenantId, "Mid-Market - TechStart Inc", NOW.minusDays(2), NOW.minusDays(3));
        UUID dueNow = fixtures.opportunity(tenantId, "SMB Deal - Local Business", NOW, NOW.minusHours(6));
        UUID oneDay = fixtures.opportunity(tenantId, "Renewal - Existing Customer", NOW.minusDays(1), NOW.minusDays(2));
        fixtures.opportunity(tenantId, "Future Opportunity", NOW.plusDays(3), NOW.minusHours(2));

        StepVerifier.create(opportunityService.listDueActions(tenantId).map(DueOpportunityResponse::getId))
                .expectNext(sevenDays, twoDays, oneDay, dueNow)
                .verifyComplete();

        StepVerifier.create(opportunityService.summarizeDueActions(tenantId))
                .expectNextMatches(summary ->
                        summary.getTotal() == 4 &&
                        summary.getRed() == 1 &&
                        summary.getYellow() == 2 &&
                        summary.getBlue() == 1)
                .verifyComplete();
    }

    @Test
    void completeAction_RearmsOpportunityAndLeavesOthersAlone() {
        UUID target = fixtures.opportunity(tenantId, "Renewal - Existing Customer", NOW.minusDays(1), NOW.minusDays(2));
        UUID bystander = fixtures.opportunity(tenantId, "Enterprise Deal - Acme Corp", NOW.minusDays(7), NOW.minusDays(8));
        OffsetDateTime next = NOW.plusDays(14);

        StepVerifier.create(opportunityService.completeAction(tenantId, target, next, "Send renewal contract", NOW))
                .expectNextMatches(response -> response.getOpportunityId().equals(target) && response.getUpdatedAt().equals(NOW))
                .verifyComplete();

        StepVerifier.create(opportunityRepository.findById(target))
                .expectNextMatches(row ->
                        row.getNextActionAt().isEqual(next) &&
                        row.getNextActionDetails().equals("Send renewal contract") &&
                        row.getLastActivityAt().isEqual(NOW))
                .verifyComplete();

        StepVerifier.create(opportunityRepository.findById(bystander))
                .expectNextMatches(row ->
                        row.getNextActionAt().isEqual(NOW.minusDays(7)) &&
                        row.getLastActivityAt().isEqual(NOW.minusDays(8)))
                .verifyComplete();

        StepVerifier.create(opportunityService.listDueActions(tenantId).map(DueOpportunityResponse::getId))
                .expectNext(bystander)
                .verifyComplete();
    }

    @Test
    void completeAction_ForeignOpportunityLooksMissing() {
        UUID foreign = fixtures.opportunity(otherTenantId, "Different Tenant Deal", NOW.minusHours(2), NOW.minusHours(3));

        StepVerifier.create(opportunityService.completeAction(tenantId, foreign, NOW.plusDays(1), "Send renewal contract", NOW))
                .expectErrorMatches(error -> error instanceof ResourceNotFoundException &&
                        error.getMessage().equals("Opportunity with identifier '" + foreign + "' not found"))
                .verify();

        StepVerifier.create(opportunityService.listDueActions(otherTenantId).map(DueOpportunityResponse::getNextActionDetails))
                .expectNext("Follow up with Different Tenant Deal")
                .verifyComplete();
    }

    @Test
    void completeAction_PastDateLeavesRowUnchanged() {
        UUID id = fixtures.opportunity(tenantId, "Mid-Market - TechStart Inc", NOW.minusDays(2), NOW.minusDays(3));

        StepVerifier.create(opportunityService.completeAction(tenantId, id, NOW.minusDays(1), "Send revised pricing", NOW))
                .expectError(ValidationFailedException.class)
                .verify();

        StepVerifier.create(opportunityRepository.findById(id))
                .expectNextMatches(row ->
                        row.getNextActionAt().isEqual(NOW.minusDays(2)) &&
                        row.getNextActionDetails().equals("Follow up with Mid-Market - TechStart Inc"))
                .verifyComplete();
    }

    @Test
    void completeAction_OverlongDetailsRejectedBeforeStorage() {
        UUID id = fixtures.opportunity(tenantId, "SMB Deal - Local Business", NOW, NOW.minusHours(6));

        StepVerifier.create(opportunityService.completeAction(tenantId, id, NOW.plusDays(1), "a".repeat(1001), NOW))
                .expectErrorMatches(error -> error instanceof ValidationFailedException &&
                        ((ValidationFailedException) error).getField().equals("new_next_action_details"))
                .verify();

        StepVerifier.create(opportunityRepository.findById(id))
                .expectNextMatches(row ->
                        row.getNextActionAt().isEqual(NOW) &&
                        row.getNextActionDetails().equals("Follow up with SMB Deal - Local Business"))
                .verifyComplete();
    }

    @Test
    void getTenant_ReadsSeededTenant() {
        StepVerifier.create(tenantService.getTenant(tenantId))
                .expectNextMatches(tenant -> tenant.getName().equals("Demo Company"))
                .verifyComplete();
    }
}
