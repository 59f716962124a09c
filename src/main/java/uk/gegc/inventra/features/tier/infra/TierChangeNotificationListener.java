package uk.gegc.inventra.features.tier.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.inventra.features.tier.application.TierNotificationService;
import uk.gegc.inventra.features.tier.domain.event.TierChangedEvent;
import uk.gegc.inventra.features.user.domain.repository.UserRepository;

/**
 * Sends the tier change notification once the transition has committed.
 * A rolled back transition never notifies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TierChangeNotificationListener {

    private final UserRepository userRepository;
    private final TierNotificationService tierNotificationService;

    @Async("generalTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleTierChanged(TierChangedEvent event) {
        try {
            userRepository.findById(event.getUserId()).ifPresentOrElse(
                    user -> tierNotificationService.notifyTierChange(
                            user, event.getPreviousPlan(), event.getNewPlan(), event.getReason()),
                    () -> log.warn("Tier change notification skipped: user {} no longer exists", event.getUserId()));
        } catch (Exception e) {
            // The transition already committed
            log.warn("Failed to notify user {} about tier change: {}", event.getUserId(), e.getMessage());
        }
    }
}
