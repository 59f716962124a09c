package uk.gegc.inventra.features.tier.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.inventra.features.tier.application.TierMetricsService;
import uk.gegc.inventra.features.tier.domain.model.AccessDenialReason;
import uk.gegc.inventra.features.tier.domain.model.TierChangeReason;

import java.util.UUID;

/**
 * Micrometer-backed tier metrics. Tagged counters are resolved per call; the registry caches them.
 */
@Slf4j
@Service
public class TierMetricsServiceImpl implements TierMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter sweepDowngradedCounter;
    private final Counter sweepFailedCounter;

    public TierMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.sweepDowngradedCounter = Counter.builder("tier.sweep.downgrades")
                .description("Users downgraded by the expiration sweep")
                .tag("outcome", "downgraded")
                .register(meterRegistry);
        this.sweepFailedCounter = Counter.builder("tier.sweep.downgrades")
                .description("Users downgraded by the expiration sweep")
                .tag("outcome", "failed")
                .register(meterRegistry);
    }

    @Override
    public void incrementTransition(UUID userId, TierChangeReason reason) {
        log.info("METRIC: tier.transitions userId={} reason={}", userId, reason.getValue());
        Counter.builder("tier.transitions")
                .description("Plan transitions by reason")
                .tag("reason", reason.getValue())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementAccessDenied(UUID userId, String feature, AccessDenialReason reason) {
        log.info("METRIC: tier.access.denied userId={} feature={} reason={}", userId, feature, reason.getValue());
        Counter.builder("tier.access.denied")
                .description("Entitlement checks that denied access")
                .tag("reason", reason.getValue())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementUsage(UUID userId, String feature, int delta, boolean atomic) {
        log.debug("METRIC: tier.usage.increments userId={} feature={} delta={} atomic={}", userId, feature, delta, atomic);
        Counter.builder("tier.usage.increments")
                .description("Usage counter increments")
                .tag("mode", atomic ? "atomic" : "relative")
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordSweepDowngrades(int downgraded, int failed) {
        log.info("METRIC: tier.sweep.downgrades downgraded={} failed={}", downgraded, failed);
        sweepDowngradedCounter.increment(downgraded);
        sweepFailedCounter.increment(failed);
    }
}
