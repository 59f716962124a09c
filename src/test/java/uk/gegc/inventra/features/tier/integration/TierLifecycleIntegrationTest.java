package uk.gegc.inventra.features.tier.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import uk.gegc.inventra.BaseIntegrationTest;
import uk.gegc.inventra.config.TestClockConfig;
import uk.gegc.inventra.features.tier.application.EntitlementService;
import uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;
import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;
import uk.gegc.inventra.features.tier.infra.repository.TierFeatureDefinitionRepository;
import uk.gegc.inventra.features.tier.infra.repository.TierHistoryRepository;
import uk.gegc.inventra.features.tier.infra.repository.UserTierFeatureRepository;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@Import(TestClockConfig.class)
@TestPropertySource(properties = "tier.seed-defaults=true")
@DisplayName("Tier lifecycle integration")
class TierLifecycleIntegrationTest extends BaseIntegrationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 12, 0);

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private UserTierFeatureRepository usageRepository;

    @Autowired
    private TierHistoryRepository historyRepository;

    @Autowired
    private TierFeatureDefinitionRepository definitionRepository;

    @Autowired
    private EntitlementService entitlementService;

    private UUID adminId;

    @BeforeEach
    void setUp() {
        adminId = UUID.randomUUID();
    }

    private User persistUser(SubscriptionPlan plan, LocalDateTime expiresAt) {
        User user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("user-" + user.getId());
        user.setEmail(user.getId() + "@example.com");
        user.setSubscriptionPlan(plan);
        user.setSubscriptionExpiresAt(expiresAt);
        return userRepository.saveAndFlush(user);
    }

    private RequestPostProcessor admin() {
        return jwt().jwt(token -> token.subject(adminId.toString()))
                .authorities(new SimpleGrantedAuthority("TIER_ADMIN"));
    }

    private RequestPostProcessor asUser(UUID userId) {
        return jwt().jwt(token -> token.subject(userId.toString()));
    }

    @Test
    @DisplayName("default catalog is seeded at startup")
    void catalogSeeded() {
        assertThat(definitionRepository.findByTierAndFeatureName(SubscriptionPlan.FREE, "max_products"))
                .get().extracting(d -> d.getFeatureLimit()).isEqualTo(50);
        assertThat(definitionRepository.findByTierAndFeatureName(SubscriptionPlan.PREMIUM, "max_products"))
                .get().extracting(d -> d.getFeatureLimit()).isNull();
    }

    @Test
    @DisplayName("admin upgrade provisions premium counters and the user sees premium status")
    void upgradeThenStatus() throws Exception {
        User user = persistUser(SubscriptionPlan.FREE, null);

        mockMvc.perform(post("/api/v1/admin/tier/users/{userId}/upgrade", user.getId())
                        .with(admin())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"expiresAt\":\"2024-02-01T12:00:00\",\"notes\":\"annual\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.performed").value(true))
                .andExpect(jsonPath("$.previousPlan").value("free"))
                .andExpect(jsonPath("$.currentPlan").value("premium"));

        mockMvc.perform(get("/api/v1/tier/status").with(asUser(user.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscriptionPlan").value("premium"))
                .andExpect(jsonPath("$.daysUntilExpiration").value(31))
                .andExpect(jsonPath("$.subscriptionState").value("ACTIVE"))
                .andExpect(jsonPath("$.gracePeriodExpiresAt").value(nullValue()))
                .andExpect(jsonPath("$.tierFeatures.max_products.unlimited").value(true))
                .andExpect(jsonPath("$.currentUsage.max_products.current").value(0));

        assertThat(historyRepository.findByUserIdOrderByEffectiveDateAscCreatedAtAsc(user.getId()))
                .singleElement()
                .satisfies(entry -> {
                    assertThat(entry.getChangeReason()).isEqualTo(TierChangeReason.UPGRADE);
                    assertThat(entry.getChangedBy()).isEqualTo(adminId);
                    assertThat(entry.getEffectiveDate()).isEqualTo(NOW);
                });
        assertThat(usageRepository.findByUserIdAndFeatureName(user.getId(), "max_products"))
                .get().extracting(UserTierFeature::getUsageLimit).isNull();
    }

    @Test
    @DisplayName("automatic downgrade only fires once the grace period is over")
    void automaticDowngrade() throws Exception {
        User inGrace = persistUser(SubscriptionPlan.PREMIUM, NOW.minusDays(3));
        User pastGrace = persistUser(SubscriptionPlan.PREMIUM, NOW.minusDays(10));

        mockMvc.perform(post("/api/v1/admin/tier/users/{userId}/auto-downgrade", inGrace.getId()).with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.performed").value(false))
                .andExpect(jsonPath("$.currentPlan").value("premium"));

        mockMvc.perform(post("/api/v1/admin/tier/users/{userId}/auto-downgrade", pastGrace.getId()).with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.performed").value(true))
                .andExpect(jsonPath("$.currentPlan").value("free"));

        assertThat(historyRepository.findByUserIdOrderByEffectiveDateAscCreatedAtAsc(pastGrace.getId()))
                .extracting(TierHistory::getChangeReason, TierHistory::getChangedBy)
                .containsExactly(tuple(TierChangeReason.EXPIRATION, null));
    }

    @Test
    @DisplayName("user in grace still sees premium features with a grace end")
    void graceStatus() throws Exception {
        User user = persistUser(SubscriptionPlan.PREMIUM, NOW.minusDays(2));

        mockMvc.perform(get("/api/v1/tier/status").with(asUser(user.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscriptionState").value("EXPIRED_IN_GRACE"))
                .andExpect(jsonPath("$.gracePeriodActive").value(true))
                .andExpect(jsonPath("$.gracePeriodExpiresAt").value("2024-01-06T12:00:00"))
                .andExpect(jsonPath("$.daysUntilExpiration").value(-2));
    }

    @Test
    @DisplayName("missing usage record surfaces as a server error problem")
    void missingUsageRecord() throws Exception {
        User user = persistUser(SubscriptionPlan.FREE, null);

        mockMvc.perform(post("/api/v1/admin/tier/users/{userId}/usage/{feature}", user.getId(), "max_products")
                        .with(admin())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"delta\":1,\"atomic\":true}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("https://inventra.app/docs/errors/usage-record-missing"));
    }

    @Test
    @DisplayName("provisioned free user hits the product slot limit")
    void provisionAndHitLimit() throws Exception {
        User user = persistUser(SubscriptionPlan.FREE, null);

        mockMvc.perform(post("/api/v1/admin/tier/users/{userId}/provision", user.getId()).with(admin()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.plan").value("free"));

        jdbcTemplate.update("UPDATE user_tier_features SET current_usage = 50 WHERE feature_name = 'product_slot'");
        entityManager.clear();

        mockMvc.perform(get("/api/v1/tier/features/{feature}/access", "product_slot").with(asUser(user.getId())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accessGranted").value(false))
                .andExpect(jsonPath("$.reason").value("usage_limit_exceeded"))
                .andExpect(jsonPath("$.remaining").value(0));

        assertThatThrownBy(() -> entitlementService.consumeQuota(user.getId(), "product_slot", 1))
                .isInstanceOf(FeatureLimitExceededException.class)
                .hasMessage("You have reached your products limit (50)");
    }

    @Test
    @DisplayName("tier endpoints require authentication and admin endpoints require TIER_ADMIN")
    void security() throws Exception {
        User user = persistUser(SubscriptionPlan.FREE, null);

        mockMvc.perform(get("/api/v1/tier/status"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/v1/admin/tier/users/{userId}/status", user.getId()).with(asUser(user.getId())))
                .andExpect(status().isForbidden());
    }
}
