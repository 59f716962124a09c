package uk.gegc.inventra.features.tier.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.inventra.features.tier.api.dto.TierChangeResultDto;
import uk.gegc.inventra.features.tier.application.SubscriptionLifecycleService;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierHistoryService;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.application.UsageCounterService;
import uk.gegc.inventra.features.tier.domain.event.TierChangedEvent;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionState;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.tier.domain.model.TierHistory;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;
import uk.gegc.inventra.shared.exception.ResourceNotFoundException;

import java.time.LocalDateTime;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionLifecycleServiceImpl implements SubscriptionLifecycleService {

    private final UserRepository userRepository;
    private final TierHistoryService tierHistoryService;
    private final UsageCounterService usageCounterService;
    private final SubscriptionPeriodCalculator periodCalculator;
    private final TierMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public TierChangeResultDto upgradeToPremium(UUID userId, LocalDateTime expiresAt, UUID changedBy, String notes) {
        User user = loadUser(userId);
        SubscriptionPlan previous = user.getSubscriptionPlan();

        user.setSubscriptionPlan(SubscriptionPlan.PREMIUM);
        if (expiresAt != null) {
            user.setSubscriptionExpiresAt(expiresAt);
        }
        applyTransition(user, previous, TierChangeReason.UPGRADE, changedBy, notes);
        usageCounterService.provisionForPlan(userId, SubscriptionPlan.PREMIUM);

        log.info("User {} upgraded from {} to premium (expires at {})",
                userId, previous.getValue(), user.getSubscriptionExpiresAt());
        return new TierChangeResultDto(userId, true, previous, SubscriptionPlan.PREMIUM, user.getSubscriptionExpiresAt());
    }

    @Override
    @Transactional
    public TierChangeResultDto downgradeToFree(UUID userId, UUID changedBy, String notes) {
        User user = loadUser(userId);
        SubscriptionPlan previous = user.getSubscriptionPlan();
        if (previous == SubscriptionPlan.FREE) {
            log.debug("User {} is already on the free plan, nothing to downgrade", userId);
            return new TierChangeResultDto(userId, false, previous, SubscriptionPlan.FREE, user.getSubscriptionExpiresAt());
        }

        downgrade(user, TierChangeReason.DOWNGRADE, changedBy, notes);
        log.info("User {} downgraded from premium to free", userId);
        return new TierChangeResultDto(userId, true, previous, SubscriptionPlan.FREE, null);
    }

    @Override
    @Transactional
    public boolean performAutomaticDowngrade(UUID userId) {
        User user = userRepository.findById(userId).orElse(null);
        if (user == null) {
            log.debug("Skipping automatic downgrade: user {} not found", userId);
            return false;
        }
        SubscriptionState state = periodCalculator.resolveState(user.getSubscriptionPlan(), user.getSubscriptionExpiresAt());
        if (state != SubscriptionState.EXPIRED_OUT_OF_GRACE) {
            return false;
        }

        downgrade(user, TierChangeReason.EXPIRATION, null, null);
        log.info("User {} automatically downgraded from premium to free due to expiration", userId);
        return true;
    }

    private void downgrade(User user, TierChangeReason reason, UUID changedBy, String notes) {
        SubscriptionPlan previous = user.getSubscriptionPlan();
        user.setSubscriptionPlan(SubscriptionPlan.FREE);
        user.setSubscriptionExpiresAt(null);
        applyTransition(user, previous, reason, changedBy, notes);
        usageCounterService.provisionForPlan(user.getId(), SubscriptionPlan.FREE);
    }

    private void applyTransition(User user, SubscriptionPlan previous, TierChangeReason reason,
                                 UUID changedBy, String notes) {
        LocalDateTime now = periodCalculator.now();
        user.setUpdatedAt(now);
        userRepository.save(user);

        TierHistory entry = new TierHistory();
        entry.setUserId(user.getId());
        entry.setPreviousPlan(previous);
        entry.setNewPlan(user.getSubscriptionPlan());
        entry.setChangeReason(reason);
        entry.setChangedBy(changedBy);
        entry.setEffectiveDate(now);
        entry.setNotes(notes);
        entry.setCreatedAt(now);
        tierHistoryService.append(entry);

        metricsService.incrementTransition(user.getId(), reason);
        eventPublisher.publishEvent(new TierChangedEvent(this, user.getId(), previous, user.getSubscriptionPlan(), reason));
    }

    private User loadUser(UUID userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("User " + userId + " not found"));
    }
}
