package uk.gegc.inventra.features.tier.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionState;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Pure expiry and grace-period arithmetic against the application {@link Clock}.
 */
@Component
@RequiredArgsConstructor
public class SubscriptionPeriodCalculator {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;
    private final TierProperties tierProperties;

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    public boolean isExpired(LocalDateTime expiresAt) {
        return expiresAt != null && expiresAt.isBefore(now());
    }

    public LocalDateTime gracePeriodEnd(LocalDateTime expiresAt) {
        return expiresAt == null ? null : expiresAt.plusDays(tierProperties.getGracePeriodDays());
    }

    public boolean isGracePeriodActive(LocalDateTime gracePeriodEnd) {
        return gracePeriodEnd != null && gracePeriodEnd.isAfter(now());
    }

    /**
     * Whole days until expiry, rounded towards positive infinity. Negative once expired.
     */
    public Long daysUntilExpiration(LocalDateTime expiresAt) {
        if (expiresAt == null) {
            return null;
        }
        long millis = Duration.between(now(), expiresAt).toMillis();
        return (long) Math.ceil((double) millis / MILLIS_PER_DAY);
    }

    public SubscriptionState resolveState(SubscriptionPlan plan, LocalDateTime expiresAt) {
        if (plan != SubscriptionPlan.PREMIUM || !isExpired(expiresAt)) {
            return SubscriptionState.ACTIVE;
        }
        return isGracePeriodActive(gracePeriodEnd(expiresAt))
                ? SubscriptionState.EXPIRED_IN_GRACE
                : SubscriptionState.EXPIRED_OUT_OF_GRACE;
    }
}
