package uk.gegc.inventra.features.tier.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.inventra.BaseUnitTest;
import uk.gegc.inventra.features.tier.application.TierNotificationService;
import uk.gegc.inventra.features.tier.domain.event.TierChangedEvent;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;
import uk.gegc.inventra.features.user.domain.model.User;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("TierChangeNotificationListener")
class TierChangeNotificationListenerTest extends BaseUnitTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private TierNotificationService notificationService;

    @InjectMocks
    private TierChangeNotificationListener listener;

    @Test
    @DisplayName("notifies the user about a committed transition")
    void notifies() {
        UUID userId = UUID.randomUUID();
        User user = new User();
        user.setId(userId);
        when(userRepository.findById(userId)).thenReturn(Optional.of(user));

        listener.handleTierChanged(new TierChangedEvent(this, userId,
                SubscriptionPlan.PREMIUM, SubscriptionPlan.FREE, TierChangeReason.EXPIRATION));

        verify(notificationService).notifyTierChange(user, SubscriptionPlan.PREMIUM, SubscriptionPlan.FREE, TierChangeReason.EXPIRATION);
    }

    @Test
    @DisplayName("missing user is skipped and lookup failures do not propagate")
    void failuresContained() {
        UUID missing = UUID.randomUUID();
        UUID broken = UUID.randomUUID();
        when(userRepository.findById(missing)).thenReturn(Optional.empty());
        when(userRepository.findById(broken)).thenThrow(new IllegalStateException("pool exhausted"));

        listener.handleTierChanged(new TierChangedEvent(this, missing,
                SubscriptionPlan.FREE, SubscriptionPlan.PREMIUM, TierChangeReason.UPGRADE));
        assertThatCode(() -> listener.handleTierChanged(new TierChangedEvent(this, broken,
                SubscriptionPlan.FREE, SubscriptionPlan.PREMIUM, TierChangeReason.UPGRADE)))
                .doesNotThrowAnyException();

        verifyNoInteractions(notificationService);
    }
}
