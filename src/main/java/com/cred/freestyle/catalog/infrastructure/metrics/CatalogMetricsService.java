package com.cred.freestyle.catalog.infrastructure.metrics;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.infrastructure.messaging.events.CatalogRevisionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Catalog metrics, published to CloudWatch through Micrometer.
 *
 * Key Metrics:
 * - Revisions published per family and cause
 * - Propagation passes, republished parents and failures
 * - Publish conflicts
 * - Revision cache hit/miss rates
 * - Stale references repaired
 *
 * @author Catalog Team
 */
@Service
public class CatalogMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "catalog.";
    private static final String REVISION_PREFIX = METRIC_PREFIX + "revision.";
    private static final String PROPAGATION_PREFIX = METRIC_PREFIX + "propagation.";
    private static final String CACHE_PREFIX = METRIC_PREFIX + "cache.";

    public CatalogMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a new current revision.
     *
     * @param family Aggregate family
     * @param cause What triggered the publish
     */
    public void recordRevisionPublished(CatalogFamily family, CatalogRevisionEvent.Cause cause) {
        Counter.builder(REVISION_PREFIX + "published")
                .tag("family", family.name())
                .tag("cause", cause.name())
                .description("Revisions published")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded revision published for {} ({})", family, cause);
    }

    public void recordAggregateDeleted(CatalogFamily family) {
        Counter.builder(REVISION_PREFIX + "deleted")
                .tag("family", family.name())
                .description("Aggregates soft-deleted")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a publish that lost the race for the next revision number.
     *
     * @param family Aggregate family
     */
    public void recordPublishConflict(CatalogFamily family) {
        Counter.builder(REVISION_PREFIX + "conflict")
                .tag("family", family.name())
                .description("Publish attempts rejected as conflicting")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded publish conflict for {}", family);
    }

    /**
     * Record a completed propagation pass.
     *
     * @param family Family of the aggregate that triggered the pass
     * @param republished Parents republished during the pass, all levels
     * @param failed Parents that could not be republished
     * @param durationMs Duration in milliseconds
     */
    public void recordPropagation(CatalogFamily family, int republished, int failed, long durationMs) {
        Counter.builder(PROPAGATION_PREFIX + "republished")
                .tag("family", family.name())
                .description("Parents republished by propagation")
                .register(meterRegistry)
                .increment(republished);

        if (failed > 0) {
            Counter.builder(PROPAGATION_PREFIX + "failure")
                    .tag("family", family.name())
                    .description("Parents that failed to republish during propagation")
                    .register(meterRegistry)
                    .increment(failed);
        }

        Timer.builder(PROPAGATION_PREFIX + "latency")
                .tag("family", family.name())
                .description("Propagation pass latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded propagation for {}: {} republished, {} failed, {}ms",
                family, republished, failed, durationMs);
    }

    public void recordStaleReferencesRepaired(int count) {
        Counter.builder(PROPAGATION_PREFIX + "repaired")
                .description("Parents republished by the stale reference repair job")
                .register(meterRegistry)
                .increment(count);
    }

    public void recordCacheHit(String cacheType) {
        Counter.builder(CACHE_PREFIX + "hit")
                .tag("cache_type", cacheType)
                .description("Cache hits")
                .register(meterRegistry)
                .increment();
    }

    public void recordCacheMiss(String cacheType) {
        Counter.builder(CACHE_PREFIX + "miss")
                .tag("cache_type", cacheType)
                .description("Cache misses")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an application error.
     *
     * @param errorType Error type (e.g., "PROPAGATION_ERROR")
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
