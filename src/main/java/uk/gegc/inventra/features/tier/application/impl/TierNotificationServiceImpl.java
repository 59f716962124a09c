package uk.gegc.inventra.features.tier.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import uk.gegc.inventra.features.tier.application.TierNotificationService;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.shared.email.EmailService;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class TierNotificationServiceImpl implements TierNotificationService {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("d MMM yyyy HH:mm", Locale.ENGLISH);

    private final EmailService emailService;

    @Value("${app.frontend.base-url:http://localhost:3000}")
    private String baseUrl;

    @Override
    public boolean notifyTierChange(User user, SubscriptionPlan previous, SubscriptionPlan next, TierChangeReason reason) {
        String subject = next == SubscriptionPlan.PREMIUM
                ? "Welcome to Inventra Premium"
                : "Your Inventra plan has changed";
        String body = """
                Hello %s,

                Your subscription plan changed from %s to %s (%s).

                Manage your subscription: %s/settings/subscription

                Best regards,
                Inventra Team
                """.formatted(user.getUsername(), label(previous), label(next), describe(reason), baseUrl);
        boolean sent = send(user, subject, body, "tier change");
        if (sent) {
            log.info("Tier change notification sent to user {}: {} -> {} ({})",
                    user.getId(), label(previous), label(next), reason.getValue());
        }
        return sent;
    }

    @Override
    public boolean sendExpirationWarning(User user, long daysLeft) {
        String body = """
                Hello %s,

                Your Inventra Premium subscription expires in %d day(s), on %s.
                Renew now to keep unlimited products and premium features.

                Renew: %s/settings/subscription

                Best regards,
                Inventra Team
                """.formatted(user.getUsername(), daysLeft, format(user.getSubscriptionExpiresAt()), baseUrl);
        boolean sent = send(user, "Your Inventra Premium subscription is expiring soon", body, "expiration warning");
        if (sent) {
            log.info("Expiration warning sent to user {} ({} days left)", user.getId(), daysLeft);
        }
        return sent;
    }

    @Override
    public boolean sendGracePeriodNotification(User user, LocalDateTime gracePeriodEnd) {
        String body = """
                Hello %s,

                Your Inventra Premium subscription has expired. Premium features remain available
                until %s. After that your account moves to the free plan.

                Renew: %s/settings/subscription

                Best regards,
                Inventra Team
                """.formatted(user.getUsername(), format(gracePeriodEnd), baseUrl);
        boolean sent = send(user, "Your Inventra Premium subscription has expired", body, "grace period");
        if (sent) {
            log.info("Grace period notification sent to user {}", user.getId());
        }
        return sent;
    }

    private boolean send(User user, String subject, String body, String kind) {
        try {
            return emailService.sendPlainTextEmail(user.getEmail(), subject, body);
        } catch (RuntimeException e) {
            log.error("Failed to send {} notification to user {}", kind, user.getId(), e);
            return false;
        }
    }

    private static String label(SubscriptionPlan plan) {
        return plan == null ? "none" : plan.getValue();
    }

    private static String describe(TierChangeReason reason) {
        return switch (reason) {
            case UPGRADE -> "upgrade";
            case DOWNGRADE -> "downgrade";
            case EXPIRATION -> "subscription expired";
        };
    }

    private static String format(LocalDateTime time) {
        return time == null ? "-" : DATE_FORMAT.format(time);
    }
}
