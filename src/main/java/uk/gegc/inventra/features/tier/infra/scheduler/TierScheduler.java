package uk.gegc.inventra.features.tier.infra.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.inventra.features.tier.application.SubscriptionLifecycleService;
import uk.gegc.inventra.features.tier.application.SubscriptionPeriodCalculator;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.application.TierNotificationService;
import uk.gegc.inventra.features.tier.application.TierProperties;
import uk.gegc.inventra.features.tier.application.UsageCounterService;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.UsageResetType;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background jobs of the tier engine: expiration downgrades, expiry notifications and usage resets.
 * A trigger that fires while the same job is still running is skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "tier.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class TierScheduler {

    private final UserRepository userRepository;
    private final SubscriptionLifecycleService lifecycleService;
    private final TierNotificationService notificationService;
    private final UsageCounterService usageCounterService;
    private final SubscriptionPeriodCalculator periodCalculator;
    private final TierMetricsService metricsService;
    private final TierProperties tierProperties;

    private final AtomicBoolean downgradeRunning = new AtomicBoolean(false);
    private final AtomicBoolean notificationRunning = new AtomicBoolean(false);
    private final AtomicBoolean resetRunning = new AtomicBoolean(false);

    /**
     * Downgrades premium users whose grace period is over, one batch at a time.
     * Users that fail or are left untouched are skipped by later batches of the same run,
     * so they never hold back the users queued behind them.
     *
     * @return number of users downgraded, -1 when skipped
     */
    @Scheduled(fixedDelayString = "${tier.scheduler.downgrade-fixed-delay-ms:900000}",
            initialDelayString = "${tier.scheduler.initial-delay-ms:60000}")
    public int runDowngradeSweep() {
        if (!downgradeRunning.compareAndSet(false, true)) {
            log.warn("Downgrade sweep already running, skipping this trigger");
            return -1;
        }
        try {
            LocalDateTime cutoff = periodCalculator.now().minusDays(tierProperties.getGracePeriodDays());
            int batchSize = tierProperties.getScheduler().getDowngradeBatchSize();
            Set<UUID> attempted = new HashSet<>();

            int downgraded = 0;
            int failed = 0;
            while (true) {
                int fetchSize = batchSize + attempted.size();
                List<UUID> fetched = userRepository.findExpiredIdsBefore(
                        SubscriptionPlan.PREMIUM, cutoff, PageRequest.of(0, fetchSize));
                List<UUID> batch = fetched.stream()
                        .filter(id -> !attempted.contains(id))
                        .toList();
                if (batch.isEmpty()) {
                    break;
                }
                for (UUID userId : batch) {
                    attempted.add(userId);
                    try {
                        if (lifecycleService.performAutomaticDowngrade(userId)) {
                            downgraded++;
                        }
                    } catch (Exception e) {
                        failed++;
                        log.error("Automatic downgrade failed for user {}", userId, e);
                    }
                }
                if (fetched.size() < fetchSize) {
                    break;
                }
            }
            metricsService.recordSweepDowngrades(downgraded, failed);
            if (!attempted.isEmpty()) {
                log.info("Downgrade sweep processed {} candidates: {} downgraded, {} failed",
                        attempted.size(), downgraded, failed);
            }
            return downgraded;
        } catch (Exception e) {
            log.error("Error during scheduled downgrade sweep", e);
            return 0;
        } finally {
            downgradeRunning.set(false);
        }
    }

    /**
     * Sends expiration warnings and grace period notices.
     *
     * @return number of notifications sent, -1 when skipped
     */
    @Scheduled(cron = "${tier.scheduler.notification-cron:0 0 9 * * *}")
    public int runNotificationJob() {
        if (!notificationRunning.compareAndSet(false, true)) {
            log.warn("Tier notification job already running, skipping this trigger");
            return -1;
        }
        try {
            LocalDateTime now = periodCalculator.now();
            int sent = 0;

            List<User> expiringSoon = userRepository.findActiveWithExpiryBetween(
                    SubscriptionPlan.PREMIUM, now, now.plusDays(tierProperties.getScheduler().getExpirationWarningDays()));
            for (User user : expiringSoon) {
                Long daysLeft = periodCalculator.daysUntilExpiration(user.getSubscriptionExpiresAt());
                if (notificationService.sendExpirationWarning(user, daysLeft)) {
                    sent++;
                }
            }

            List<User> justExpired = userRepository.findActiveWithExpiryBetween(
                    SubscriptionPlan.PREMIUM, now.minusDays(1), now);
            for (User user : justExpired) {
                LocalDateTime graceEnd = periodCalculator.gracePeriodEnd(user.getSubscriptionExpiresAt());
                if (notificationService.sendGracePeriodNotification(user, graceEnd)) {
                    sent++;
                }
            }

            log.info("Tier notification job sent {} notifications ({} expiring, {} in grace)",
                    sent, expiringSoon.size(), justExpired.size());
            return sent;
        } catch (Exception e) {
            log.error("Error during scheduled tier notification job", e);
            return 0;
        } finally {
            notificationRunning.set(false);
        }
    }

    @Scheduled(cron = "${tier.scheduler.daily-reset-cron:0 0 0 * * *}")
    public int runDailyReset() {
        return runReset(UsageResetType.DAILY);
    }

    @Scheduled(cron = "${tier.scheduler.weekly-reset-cron:0 0 0 * * MON}")
    public int runWeeklyReset() {
        return runReset(UsageResetType.WEEKLY);
    }

    @Scheduled(cron = "${tier.scheduler.monthly-reset-cron:0 0 0 1 * *}")
    public int runMonthlyReset() {
        return runReset(UsageResetType.MONTHLY);
    }

    private int runReset(UsageResetType type) {
        if (!resetRunning.compareAndSet(false, true)) {
            log.warn("Usage reset already running, skipping {} trigger", type);
            return -1;
        }
        try {
            return usageCounterService.resetCounters(type, periodCalculator.now());
        } catch (Exception e) {
            log.error("Error during scheduled {} usage reset", type, e);
            return 0;
        } finally {
            resetRunning.set(false);
        }
    }
}
