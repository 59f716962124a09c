package uk.gegc.inventra.features.tier.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.inventra.features.tier.domain.model.SubscriptionPlan;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;

import java.util.UUID;

/**
 * Published inside a plan transition. Listeners act on it only after the transaction commits.
 */
public class TierChangedEvent extends ApplicationEvent {

    private final UUID userId;
    private final SubscriptionPlan previousPlan;
    private final SubscriptionPlan newPlan;
    private final TierChangeReason reason;

    public TierChangedEvent(Object source, UUID userId, SubscriptionPlan previousPlan,
                            SubscriptionPlan newPlan, TierChangeReason reason) {
        super(source);
        this.userId = userId;
        this.previousPlan = previousPlan;
        this.newPlan = newPlan;
        this.reason = reason;
    }

    public UUID getUserId() {
        return userId;
    }

    public SubscriptionPlan getPreviousPlan() {
        return previousPlan;
    }

    public SubscriptionPlan getNewPlan() {
        return newPlan;
    }

    public TierChangeReason getReason() {
        return reason;
    }
}
