package uk.gegc.inventra.features.tier.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Catalog row: whether {@code featureName} is enabled on {@code tier} and its limit.
 * A {@code null} limit means unlimited.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "tier_feature_definitions",
        uniqueConstraints = @UniqueConstraint(name = "uk_tier_feature", columnNames = {"tier", "feature_name"}))
public class TierFeatureDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "tier", nullable = false, length = 16)
    private SubscriptionPlan tier;

    @Column(name = "feature_name", nullable = false, length = 100)
    private String featureName;

    @Column(name = "feature_limit")
    private Integer featureLimit;

    @Column(name = "feature_enabled", nullable = false)
    private boolean featureEnabled;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public TierFeatureDefinition(SubscriptionPlan tier, String featureName, Integer featureLimit,
                                 boolean featureEnabled, String description) {
        this.tier = tier;
        this.featureName = featureName;
        this.featureLimit = featureLimit;
        this.featureEnabled = featureEnabled;
        this.description = description;
    }

    public boolean isUnlimited() {
        return featureLimit == null;
    }

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        this.updatedAt = this.createdAt;
    }
}
