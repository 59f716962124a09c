package uk.gegc.inventra.features.tier.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.springframework.test.util.ReflectionTestUtils;
import uk.gegc.inventra.BaseUnitTest;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.shared.email.EmailService;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("TierNotificationServiceImpl")
class TierNotificationServiceImplTest extends BaseUnitTest {

    @Mock
    private EmailService emailService;

    @InjectMocks
    private TierNotificationServiceImpl notificationService;

    private User user;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(notificationService, "baseUrl", "https://app.inventra.test");
        user = new User();
        user.setId(UUID.randomUUID());
        user.setUsername("shopkeeper");
        user.setEmail("shop@example.com");
        user.setSubscriptionPlan(SubscriptionPlan.PREMIUM);
        user.setSubscriptionExpiresAt(LocalDateTime.of(2024, 1, 4, 9, 30));
    }

    @Test
    @DisplayName("expiration warning names the days left and the expiry date")
    void expirationWarning() {
        when(emailService.sendPlainTextEmail(eq("shop@example.com"), anyString(), anyString())).thenReturn(true);

        assertThat(notificationService.sendExpirationWarning(user, 3)).isTrue();

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(emailService).sendPlainTextEmail(eq("shop@example.com"),
                eq("Your Inventra Premium subscription is expiring soon"), body.capture());
        assertThat(body.getValue())
                .contains("Hello shopkeeper")
                .contains("expires in 3 day(s), on 4 Jan 2024 09:30")
                .contains("https://app.inventra.test/settings/subscription");
    }

    @Test
    @DisplayName("grace period notice names the grace end")
    void gracePeriod() {
        when(emailService.sendPlainTextEmail(anyString(), anyString(), anyString())).thenReturn(true);

        assertThat(notificationService.sendGracePeriodNotification(user, LocalDateTime.of(2024, 1, 11, 9, 30))).isTrue();

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(emailService).sendPlainTextEmail(anyString(), anyString(), body.capture());
        assertThat(body.getValue()).contains("until 11 Jan 2024 09:30");
    }

    @Test
    @DisplayName("upgrade uses the welcome subject")
    void tierChangeUpgrade() {
        when(emailService.sendPlainTextEmail(anyString(), anyString(), anyString())).thenReturn(true);

        notificationService.notifyTierChange(user, SubscriptionPlan.FREE, SubscriptionPlan.PREMIUM, TierChangeReason.UPGRADE);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(emailService).sendPlainTextEmail(eq("shop@example.com"), eq("Welcome to Inventra Premium"), body.capture());
        assertThat(body.getValue()).contains("from free to premium (upgrade)");
    }

    @Test
    @DisplayName("email failures are reported as false instead of thrown")
    void failureIsSwallowedAsFalse() {
        when(emailService.sendPlainTextEmail(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("smtp down"));

        assertThat(notificationService.notifyTierChange(
                user, SubscriptionPlan.PREMIUM, SubscriptionPlan.FREE, TierChangeReason.EXPIRATION)).isFalse();
    }

    @Test
    @DisplayName("provider refusal is reported as false")
    void providerRefusal() {
        when(emailService.sendPlainTextEmail(anyString(), anyString(), anyString())).thenReturn(false);

        assertThat(notificationService.sendExpirationWarning(user, 1)).isFalse();
    }
}
