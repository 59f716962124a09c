package uk.gegc.inventra.features.tier.application;

import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.user.domain.model.User;

import java.time.LocalDateTime;

/**
 * Best-effort user notifications about the subscription lifecycle.
 * Every method returns {@code false} on failure instead of throwing.
 */
public interface TierNotificationService {

    boolean notifyTierChange(User user, SubscriptionPlan previous, SubscriptionPlan next, TierChangeReason reason);

    boolean sendExpirationWarning(User user, long daysLeft);

    boolean sendGracePeriodNotification(User user, LocalDateTime gracePeriodEnd);
}
