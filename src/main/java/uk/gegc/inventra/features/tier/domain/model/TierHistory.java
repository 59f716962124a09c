package uk.gegc.inventra.features.tier.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only record of a plan transition.
 */
@Entity
@Immutable
@Getter
@Setter
@NoArgsConstructor
@Table(name = "tier_history", indexes = {
        @Index(name = "idx_tier_history_user_effective", columnList = "user_id, effective_date")
})
public class TierHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_plan", updatable = false, length = 16)
    private SubscriptionPlan previousPlan;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_plan", nullable = false, updatable = false, length = 16)
    private SubscriptionPlan newPlan;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_reason", nullable = false, updatable = false, length = 16)
    private TierChangeReason changeReason;

    @Column(name = "changed_by", updatable = false)
    private UUID changedBy;

    @Column(name = "effective_date", nullable = false, updatable = false)
    private LocalDateTime effectiveDate;

    @Column(name = "notes", updatable = false, length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
