package uk.gegc.inventra.features.tier.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;
import uk.gegc.inventra.features.tier.domain.model.UsageResetType;

import java.util.ArrayList;
import java.util.List;

/**
 * Tier engine configuration: grace period, usage counters, background jobs.
 */
@Configuration
@ConfigurationProperties(prefix = "tier")
@Validated
@Data
public class TierProperties {

    /**
     * Days after expiry during which an expired premium user keeps premium features.
     */
    @Min(0)
    private int gracePeriodDays = 7;

    /**
     * Default ratio of usage to limit at which threshold checks report a warning.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double warningThreshold = 0.8d;

    /**
     * Seed the default feature catalog at startup when the table is empty.
     */
    private boolean seedDefaults = true;

    @Valid
    private Usage usage = new Usage();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private UsageReset usageReset = new UsageReset();

    @Data
    public static class Usage {
        /**
         * Maximum time an atomic increment waits for the row lock.
         */
        @Min(0)
        private long lockTimeoutMs = 5000L;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;

        @Positive
        private int downgradeBatchSize = 200;

        /**
         * Premium users expiring within this many days receive a warning.
         */
        @Positive
        private int expirationWarningDays = 7;
    }

    /**
     * Features zeroed by each reset cadence. Features listed nowhere are never reset.
     */
    @Data
    public static class UsageReset {
        private List<String> daily = new ArrayList<>();
        private List<String> weekly = new ArrayList<>();
        private List<String> monthly = new ArrayList<>();

        public List<String> featuresFor(UsageResetType type) {
            return switch (type) {
                case DAILY -> daily;
                case WEEKLY -> weekly;
                case MONTHLY -> monthly;
            };
        }
    }
}
