package uk.gegc.inventra.features.tier.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.inventra.BaseUnitTest;
import uk.gegc.inventra.features.tier.api.dto.IncrementResultDto;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.application.TierProperties;
import uk.gegc.inventra.features.tier.domain.exception.FeatureLimitExceededException;
import uk.gegc.inventra.features.tier.domain.exception.UsageRecordAlreadyExistsException;
import uk.gegc.inventra.features.tier.domain.exception.UsageRecordNotFoundException;
import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierFeatureDefinition;
import uk.gegc.inventra.features.tier.domain.model.UsageResetType;
import uk.gegc.inventra.features.tier.domain.model.UserTierFeature;
import uk.gegc.inventra.features.tier.infra.mapping.UserTierFeatureMapper;
import uk.gegc.inventra.features.tier.infra.repository.TierFeatureDefinitionRepository;
import uk.gegc.inventra.features.tier.infra.repository.UserTierFeatureRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("UsageCounterServiceImpl")
class UsageCounterServiceImplTest extends BaseUnitTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 12, 0);

    @Mock
    private UserTierFeatureRepository usageRepository;

    @Mock
    private TierFeatureDefinitionRepository definitionRepository;

    @Mock
    private UserTierFeatureMapper usageMapper;

    @Mock
    private TierMetricsService metricsService;

    private TierProperties tierProperties;
    private UsageCounterServiceImpl usageCounterService;
    private UUID userId;

    @BeforeEach
    void setUp() {
        tierProperties = new TierProperties();
        SubscriptionPeriodCalculator calculator = new SubscriptionPeriodCalculator(
                Clock.fixed(Instant.parse("2024-01-01T12:00:00Z"), ZoneOffset.UTC), tierProperties);
        usageCounterService = new UsageCounterServiceImpl(
                usageRepository, definitionRepository, usageMapper, calculator, metricsService, tierProperties);
        userId = UUID.randomUUID();
    }

    private UserTierFeature record(String feature, int usage, Integer limit) {
        UserTierFeature record = new UserTierFeature();
        record.setId(UUID.randomUUID());
        record.setUserId(userId);
        record.setFeatureName(feature);
        record.setCurrentUsage(usage);
        record.setUsageLimit(limit);
        return record;
    }

    @Nested
    @DisplayName("increment")
    class Increment {

        @Test
        @DisplayName("atomic mode locks the row and persists the new count")
        void atomic() {
            UserTierFeature record = record("max_products", 4, 50);
            when(usageRepository.findForUpdate(userId, "max_products")).thenReturn(Optional.of(record));
            when(usageRepository.saveAndFlush(record)).thenReturn(record);

            IncrementResultDto result = usageCounterService.increment(userId, "max_products", 3, true);

            assertThat(result.currentUsage()).isEqualTo(7);
            assertThat(result.limit()).isEqualTo(50);
            assertThat(result.updatedAt()).isEqualTo(NOW);
            verify(usageRepository, never()).incrementUsage(any(), any(), anyInt(), any());
            verify(metricsService).incrementUsage(userId, "max_products", 3, true);
        }

        @Test
        @DisplayName("non-atomic mode issues a relative update and reads back")
        void relative() {
            UserTierFeature after = record("max_products", 5, 50);
            after.setUpdatedAt(NOW);
            when(usageRepository.incrementUsage(userId, "max_products", 1, NOW)).thenReturn(1);
            when(usageRepository.findCurrent(userId, "max_products")).thenReturn(Optional.of(after));

            IncrementResultDto result = usageCounterService.increment(userId, "max_products", 1, false);

            assertThat(result.currentUsage()).isEqualTo(5);
            verify(usageRepository, never()).findForUpdate(any(), any());
        }

        @Test
        @DisplayName("missing record fails in both modes")
        void missingRecord() {
            when(usageRepository.findForUpdate(userId, "max_products")).thenReturn(Optional.empty());
            when(usageRepository.incrementUsage(userId, "max_products", 1, NOW)).thenReturn(0);

            assertThatThrownBy(() -> usageCounterService.increment(userId, "max_products", 1, true))
                    .isInstanceOf(UsageRecordNotFoundException.class);
            assertThatThrownBy(() -> usageCounterService.increment(userId, "max_products", 1, false))
                    .isInstanceOf(UsageRecordNotFoundException.class)
                    .hasMessageContaining("max_products");
            verify(metricsService, never()).incrementUsage(any(), any(), anyInt(), eq(true));
        }

        @Test
        @DisplayName("negative delta can take usage below zero")
        void negativeDelta() {
            UserTierFeature record = record("max_products", 0, 50);
            when(usageRepository.findForUpdate(userId, "max_products")).thenReturn(Optional.of(record));
            when(usageRepository.saveAndFlush(record)).thenReturn(record);

            assertThat(usageCounterService.increment(userId, "max_products", -2, true).currentUsage()).isEqualTo(-2);
        }
    }

    @Nested
    @DisplayName("incrementWithinLimit")
    class IncrementWithinLimit {

        @Test
        @DisplayName("increments up to exactly the limit")
        void upToLimit() {
            UserTierFeature record = record("product_slot", 9, 10);
            when(usageRepository.findForUpdate(userId, "product_slot")).thenReturn(Optional.of(record));
            when(usageRepository.saveAndFlush(record)).thenReturn(record);

            assertThat(usageCounterService.incrementWithinLimit(userId, "product_slot", 1, 10).currentUsage()).isEqualTo(10);
        }

        @Test
        @DisplayName("rejects an increment past the limit without writing")
        void pastLimit() {
            UserTierFeature record = record("product_slot", 10, 10);
            when(usageRepository.findForUpdate(userId, "product_slot")).thenReturn(Optional.of(record));

            assertThatThrownBy(() -> usageCounterService.incrementWithinLimit(userId, "product_slot", 1, 10))
                    .isInstanceOf(FeatureLimitExceededException.class)
                    .hasMessage("You have reached your products limit (10)")
                    .satisfies(ex -> {
                        FeatureLimitExceededException limitEx = (FeatureLimitExceededException) ex;
                        assertThat(limitEx.getReason()).isEqualTo(AccessDenialReason.USAGE_LIMIT_EXCEEDED);
                        assertThat(limitEx.getLimit()).isEqualTo(10);
                        assertThat(limitEx.getCurrentUsage()).isEqualTo(10);
                    });
            verify(usageRepository, never()).saveAndFlush(any());
            verify(metricsService).incrementAccessDenied(userId, "product_slot", AccessDenialReason.USAGE_LIMIT_EXCEEDED);
        }

        @Test
        @DisplayName("null limit never rejects")
        void unlimited() {
            UserTierFeature record = record("product_slot", 1_000, null);
            when(usageRepository.findForUpdate(userId, "product_slot")).thenReturn(Optional.of(record));
            when(usageRepository.saveAndFlush(record)).thenReturn(record);

            assertThat(usageCounterService.incrementWithinLimit(userId, "product_slot", 5, null).currentUsage()).isEqualTo(1_005);
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("existing pair is a conflict")
        void existing() {
            when(usageRepository.existsByUserIdAndFeatureName(userId, "max_products")).thenReturn(true);

            assertThatThrownBy(() -> usageCounterService.create(userId, "max_products", 50, 0))
                    .isInstanceOf(UsageRecordAlreadyExistsException.class);
            verify(usageRepository, never()).saveAndFlush(any());
        }

        @Test
        @DisplayName("lost insert race is reported as a conflict")
        void insertRace() {
            when(usageRepository.existsByUserIdAndFeatureName(userId, "max_products")).thenReturn(false);
            when(usageRepository.saveAndFlush(any(UserTierFeature.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_user_feature"));

            assertThatThrownBy(() -> usageCounterService.create(userId, "max_products", 50, 0))
                    .isInstanceOf(UsageRecordAlreadyExistsException.class);
        }

        @Test
        @DisplayName("new record starts at the initial usage with the limit snapshot")
        void creates() {
            when(usageRepository.existsByUserIdAndFeatureName(userId, "max_products")).thenReturn(false);
            when(usageRepository.saveAndFlush(any(UserTierFeature.class))).thenAnswer(inv -> inv.getArgument(0));

            usageCounterService.create(userId, "max_products", 50, 3);

            ArgumentCaptor<UserTierFeature> captor = ArgumentCaptor.forClass(UserTierFeature.class);
            verify(usageRepository).saveAndFlush(captor.capture());
            assertThat(captor.getValue().getCurrentUsage()).isEqualTo(3);
            assertThat(captor.getValue().getUsageLimit()).isEqualTo(50);
            assertThat(captor.getValue().getLastResetAt()).isEqualTo(NOW);
            verify(usageMapper).toRecordDto(captor.getValue());
        }
    }

    @Test
    @DisplayName("provisionForPlan creates only missing records for enabled features")
    void provisionForPlan() {
        when(definitionRepository.findByTierOrderByFeatureNameAsc(SubscriptionPlan.FREE)).thenReturn(List.of(
                new TierFeatureDefinition(SubscriptionPlan.FREE, "analytics_access", null, false, null),
                new TierFeatureDefinition(SubscriptionPlan.FREE, "max_categories", 10, true, null),
                new TierFeatureDefinition(SubscriptionPlan.FREE, "max_products", 50, true, null)));
        when(usageRepository.existsByUserIdAndFeatureName(userId, "max_categories")).thenReturn(true);
        when(usageRepository.existsByUserIdAndFeatureName(userId, "max_products")).thenReturn(false);

        int created = usageCounterService.provisionForPlan(userId, SubscriptionPlan.FREE);

        assertThat(created).isEqualTo(1);
        verify(usageRepository, times(1)).save(any(UserTierFeature.class));
        verify(usageRepository).flush();
    }

    @Nested
    @DisplayName("resetCounters")
    class ResetCounters {

        @Test
        @DisplayName("no configured features resets nothing")
        void nothingConfigured() {
            assertThat(usageCounterService.resetCounters(UsageResetType.DAILY, NOW)).isZero();
            verify(usageRepository, never()).resetUsage(anyList(), any());
        }

        @Test
        @DisplayName("resets only the features of the requested cadence")
        void configured() {
            tierProperties.getUsageReset().setMonthly(List.of("max_products_per_import"));
            when(usageRepository.resetUsage(List.of("max_products_per_import"), NOW)).thenReturn(4);

            assertThat(usageCounterService.resetCounters(UsageResetType.MONTHLY, NOW)).isEqualTo(4);
            assertThat(usageCounterService.resetCounters(UsageResetType.WEEKLY, NOW)).isZero();
        }
    }
}
