package uk.gegc.inventra.features.tier.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-user usage counter for one feature. {@code usageLimit} is a snapshot taken when the
 * record was created and may drift from the catalog. Rows are never deleted.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "user_tier_features",
        uniqueConstraints = @UniqueConstraint(name = "uk_user_feature", columnNames = {"user_id", "feature_name"}))
public class UserTierFeature {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "feature_name", nullable = false, updatable = false, length = 100)
    private String featureName;

    @Column(name = "current_usage", nullable = false)
    private int currentUsage;

    @Column(name = "usage_limit")
    private Integer usageLimit;

    @Column(name = "last_reset_at")
    private LocalDateTime lastResetAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.updatedAt == null) {
            this.updatedAt = this.createdAt;
        }
    }
}
