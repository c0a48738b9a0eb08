package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.RevisionSnapshot;
import com.cred.freestyle.catalog.domain.model.RevisionedBase;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.messaging.events.CatalogRevisionEvent;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Carries a child's new revision up to the parents that list it.
 *
 * Propagation flow (Product → Container → Point of Sale):
 * 1. Find parents whose current revision references (child, previousRevision)
 * 2. De-duplicate by parent id
 * 3. Republish each parent, one at a time, with that reference moved to the child's current revision
 * 4. Repeat one level up for every parent that was republished
 *
 * Each parent republish is its own transaction and takes the parent's row lock.
 * A failing parent is recorded in the report and the pass continues; the child's
 * committed revision is never rolled back.
 *
 * @author Catalog Team
 */
@Service
public class PropagationEngine {

    private static final Logger logger = LoggerFactory.getLogger(PropagationEngine.class);

    private final CatalogStores stores;
    private final RevisionPublisher publisher;
    private final RevisionCacheService cacheService;
    private final CatalogEventPublisher eventPublisher;
    private final CatalogMetricsService metricsService;

    public PropagationEngine(
            CatalogStores stores,
            RevisionPublisher publisher,
            RevisionCacheService cacheService,
            CatalogEventPublisher eventPublisher,
            CatalogMetricsService metricsService
    ) {
        this.stores = stores;
        this.publisher = publisher;
        this.cacheService = cacheService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Propagate a new revision of a child to every level of parents.
     *
     * @param family Family of the republished aggregate
     * @param aggregateId Republished aggregate ID
     * @param previousRevision Revision the aggregate had before the publish
     * @return Report of republished, skipped and failed parents
     */
    public PropagationReport propagate(CatalogFamily family, Long aggregateId, int previousRevision) {
        PropagationReport report = new PropagationReport(family, aggregateId);
        if (previousRevision < 1) {
            return report;
        }

        long startTime = System.currentTimeMillis();
        propagateRevision(family, aggregateId, previousRevision, report);
        finish(report, startTime);
        return report;
    }

    /**
     * Remove a soft-deleted child from the current revision of every parent, then propagate
     * those parents' new revisions upwards.
     *
     * @param family Family of the deleted aggregate
     * @param aggregateId Deleted aggregate ID
     * @return Report of republished, skipped and failed parents
     */
    public PropagationReport propagateDeletion(CatalogFamily family, Long aggregateId) {
        PropagationReport report = new PropagationReport(family, aggregateId);
        Optional<CatalogFamily> parentFamily = family.parent();
        if (parentFamily.isEmpty()) {
            return report;
        }

        long startTime = System.currentTimeMillis();
        CatalogFamily parent = parentFamily.get();
        List<Long> parentIds = distinctAggregateIds(stores.forFamily(parent).findCurrentReferencingChild(aggregateId));
        logger.info("Removing deleted {} {} from {} {}(s)",
                family.getDisplayName(), aggregateId, parentIds.size(), parent.getDisplayName());

        for (Long parentId : parentIds) {
            try {
                Optional<PublishedRevision<?>> republished = publisher.republishWithout(parent, parentId, aggregateId);
                if (republished.isPresent()) {
                    onRepublished(republished.get(), report);
                    propagateRevision(parent, parentId, republished.get().getPreviousRevision(), report);
                } else {
                    report.recordSkipped(parent, parentId, "no longer references the deleted child");
                }
            } catch (RuntimeException e) {
                onFailure(parent, parentId, e, report);
            }
        }

        finish(report, startTime);
        return report;
    }

    private void propagateRevision(CatalogFamily childFamily, Long childId, int previousRevision,
                                   PropagationReport report) {
        Optional<CatalogFamily> parentFamily = childFamily.parent();
        if (parentFamily.isEmpty()) {
            return;
        }

        Integer currentRevision = stores.forFamily(childFamily).findBase(childId)
                .map(RevisionedBase::getCurrentRevision)
                .orElse(null);
        if (currentRevision == null || currentRevision <= previousRevision) {
            logger.debug("{} {} has not moved past revision {}, nothing to propagate",
                    childFamily.getDisplayName(), childId, previousRevision);
            return;
        }

        CatalogFamily parent = parentFamily.get();
        List<Long> parentIds = distinctAggregateIds(
                stores.forFamily(parent).findCurrentReferencing(childId, previousRevision));
        if (parentIds.isEmpty()) {
            return;
        }

        logger.info("Propagating {} {} revision {} -> {} to {} {}(s)",
                childFamily.getDisplayName(), childId, previousRevision, currentRevision,
                parentIds.size(), parent.getDisplayName());

        for (Long parentId : parentIds) {
            try {
                Optional<PublishedRevision<?>> republished = publisher.republishWithSubstitution(
                        parent, parentId, childId, previousRevision, currentRevision);
                if (republished.isPresent()) {
                    onRepublished(republished.get(), report);
                    propagateRevision(parent, parentId, republished.get().getPreviousRevision(), report);
                } else {
                    report.recordSkipped(parent, parentId, "not a propagation target at its current revision");
                }
            } catch (RuntimeException e) {
                onFailure(parent, parentId, e, report);
            }
        }
    }

    private void onRepublished(PublishedRevision<?> published, PropagationReport report) {
        report.recordRepublished(published.getFamily(), published.getAggregateId(), published.getRevisionNumber());
        cacheService.cacheRevision(published.getFamily(), published.getRevision());
        eventPublisher.publish(CatalogRevisionEvent.published(
                published.getFamily(),
                published.getAggregateId(),
                published.getRevisionNumber(),
                published.getPreviousRevision(),
                CatalogRevisionEvent.Cause.PROPAGATION
        ));
        metricsService.recordRevisionPublished(published.getFamily(), CatalogRevisionEvent.Cause.PROPAGATION);
    }

    private void onFailure(CatalogFamily family, Long aggregateId, RuntimeException e, PropagationReport report) {
        logger.error("Failed to republish {} {} during propagation", family.getDisplayName(), aggregateId, e);
        report.recordFailure(family, aggregateId, e);
        metricsService.recordError("PROPAGATION_ERROR", "republish" + family.getDisplayName());
    }

    private void finish(PropagationReport report, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordPropagation(report.getSourceFamily(),
                report.getRepublished().size(), report.getFailures().size(), duration);
        if (report.hasFailures()) {
            logger.warn("Propagation from {} {} finished with failures: {}",
                    report.getSourceFamily(), report.getSourceId(), report);
        } else {
            logger.info("Propagation from {} {} finished: {} in {}ms",
                    report.getSourceFamily(), report.getSourceId(), report, duration);
        }
    }

    private static List<Long> distinctAggregateIds(List<? extends RevisionSnapshot> revisions) {
        Set<Long> ids = new LinkedHashSet<>();
        for (RevisionSnapshot revision : revisions) {
            ids.add(revision.getAggregateId());
        }
        return new ArrayList<>(ids);
    }
}
