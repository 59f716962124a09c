package uk.gegc.inventra.features.tier.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.context.ApplicationEventPublisher;
import uk.gegc.inventra.BaseUnitTest;
import uk.gegc.inventra.features.tier.api.dto.TierChangeResultDto;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierHistoryService;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.application.TierProperties;
import uk.gegc.inventra.features.tier.application.UsageCounterService;
import uk.gegc.inventra.features.tier.domain.event.TierChangedEvent;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;
import uk.gegc.inventra.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("SubscriptionLifecycleServiceImpl")
class SubscriptionLifecycleServiceImplTest extends BaseUnitTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 12, 0);

    @Mock
    private UserRepository userRepository;

    @Mock
    private TierHistoryService tierHistoryService;

    @Mock
    private UsageCounterService usageCounterService;

    @Mock
    private TierMetricsService metricsService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private SubscriptionLifecycleServiceImpl lifecycleService;
    private UUID userId;
    private UUID adminId;

    @BeforeEach
    void setUp() {
        SubscriptionPeriodCalculator calculator = new SubscriptionPeriodCalculator(
                Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC), new TierProperties());
        lifecycleService = new SubscriptionLifecycleServiceImpl(
                userRepository, tierHistoryService, usageCounterService, calculator, metricsService, eventPublisher);
        userId = UUID.randomUUID();
        adminId = UUID.randomUUID();
    }

    private User user(SubscriptionPlan plan, LocalDateTime expiresAt) {
        User user = new User();
        user.setId(userId);
        user.setUsername("shopkeeper");
        user.setEmail("shop@example.com");
        user.setSubscriptionPlan(plan);
        user.setSubscriptionExpiresAt(expiresAt);
        return user;
    }

    private TierHistory capturedHistory() {
        ArgumentCaptor<TierHistory> captor = ArgumentCaptor.forClass(TierHistory.class);
        verify(tierHistoryService).append(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("upgradeToPremium")
    class Upgrade {

        @Test
        @DisplayName("sets plan and expiry, records history and provisions premium counters")
        void upgradesFreeUser() {
            User user = user(SubscriptionPlan.FREE, null);
            when(userRepository.findById(userId)).thenReturn(Optional.of(user));

            TierChangeResultDto result = lifecycleService.upgradeToPremium(userId, NOW.plusDays(30), adminId, "annual plan");

            assertThat(result.performed()).isTrue();
            assertThat(result.previousPlan()).isEqualTo(SubscriptionPlan.FREE);
            assertThat(user.getSubscriptionPlan()).isEqualTo(SubscriptionPlan.PREMIUM);
            assertThat(user.getSubscriptionExpiresAt()).isEqualTo(NOW.plusDays(30));

            TierHistory history = capturedHistory();
            assertThat(history.getChangeReason()).isEqualTo(TierChangeReason.UPGRADE);
            assertThat(history.getChangedBy()).isEqualTo(adminId);
            assertThat(history.getNotes()).isEqualTo("annual plan");
            assertThat(history.getEffectiveDate()).isEqualTo(NOW);

            verify(usageCounterService).provisionForPlan(userId, SubscriptionPlan.PREMIUM);
            verify(metricsService).incrementTransition(userId, TierChangeReason.UPGRADE);
            verify(eventPublisher).publishEvent(any(TierChangedEvent.class));
        }

        @Test
        @DisplayName("premium renewal without an expiry keeps the existing expiry and still records history")
        void renewalKeepsExpiry() {
            User user = user(SubscriptionPlan.PREMIUM, NOW.plusDays(3));
            when(userRepository.findById(userId)).thenReturn(Optional.of(user));

            TierChangeResultDto result = lifecycleService.upgradeToPremium(userId, null, adminId, null);

            assertThat(result.subscriptionExpiresAt()).isEqualTo(NOW.plusDays(3));
            assertThat(capturedHistory().getPreviousPlan()).isEqualTo(SubscriptionPlan.PREMIUM);
        }

        @Test
        @DisplayName("unknown user is not found")
        void unknownUser() {
            when(userRepository.findById(userId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> lifecycleService.upgradeToPremium(userId, null, adminId, null))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(tierHistoryService, eventPublisher);
        }
    }

    @Nested
    @DisplayName("downgradeToFree")
    class Downgrade {

        @Test
        @DisplayName("clears expiry and records a downgrade")
        void downgradesPremium() {
            User user = user(SubscriptionPlan.PREMIUM, NOW.plusDays(10));
            when(userRepository.findById(userId)).thenReturn(Optional.of(user));

            TierChangeResultDto result = lifecycleService.downgradeToFree(userId, adminId, "refund");

            assertThat(result.performed()).isTrue();
            assertThat(result.currentPlan()).isEqualTo(SubscriptionPlan.FREE);
            assertThat(user.getSubscriptionExpiresAt()).isNull();
            assertThat(capturedHistory().getChangeReason()).isEqualTo(TierChangeReason.DOWNGRADE);
            verify(usageCounterService).provisionForPlan(userId, SubscriptionPlan.FREE);
        }

        @Test
        @DisplayName("free user is a no-op")
        void alreadyFree() {
            when(userRepository.findById(userId)).thenReturn(Optional.of(user(SubscriptionPlan.FREE, null)));

            TierChangeResultDto result = lifecycleService.downgradeToFree(userId, adminId, null);

            assertThat(result.performed()).isFalse();
            verify(userRepository, never()).save(any());
            verifyNoInteractions(tierHistoryService, metricsService, eventPublisher);
        }
    }

    @Nested
    @DisplayName("performAutomaticDowngrade")
    class AutomaticDowngrade {

        @Test
        @DisplayName("downgrades once the grace period is over, with no actor")
        void outOfGrace() {
            User user = user(SubscriptionPlan.PREMIUM, NOW.minusDays(8));
            when(userRepository.findById(userId)).thenReturn(Optional.of(user));

            assertThat(lifecycleService.performAutomaticDowngrade(userId)).isTrue();

            TierHistory history = capturedHistory();
            assertThat(history.getChangeReason()).isEqualTo(TierChangeReason.EXPIRATION);
            assertThat(history.getChangedBy()).isNull();
            assertThat(user.getSubscriptionPlan()).isEqualTo(SubscriptionPlan.FREE);
        }

        @Test
        @DisplayName("leaves users in grace alone")
        void inGrace() {
            when(userRepository.findById(userId)).thenReturn(Optional.of(user(SubscriptionPlan.PREMIUM, NOW.minusDays(2))));

            assertThat(lifecycleService.performAutomaticDowngrade(userId)).isFalse();
            verifyNoInteractions(tierHistoryService);
        }

        @Test
        @DisplayName("leaves free users and missing users alone")
        void freeOrMissing() {
            when(userRepository.findById(userId)).thenReturn(Optional.of(user(SubscriptionPlan.FREE, NOW.minusDays(30))));
            assertThat(lifecycleService.performAutomaticDowngrade(userId)).isFalse();

            UUID missing = UUID.randomUUID();
            when(userRepository.findById(missing)).thenReturn(Optional.empty());
            assertThat(lifecycleService.performAutomaticDowngrade(missing)).isFalse();
            verifyNoInteractions(tierHistoryService);
        }
    }
}
