package com.cred.freestyle.catalog.infrastructure.scheduler;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import com.cred.freestyle.catalog.domain.model.ChildReference;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.PropagationEngine;
import com.cred.freestyle.catalog.service.PropagationReport;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scheduled job that re-runs propagation for references left behind by failed propagation passes.
 *
 * A reference is stale when a live parent's current revision points at a child revision older
 * than the child's current one, or at a child that has since been deleted. Such references
 * only exist after a propagation failure (lock timeout, crash between publish and propagation).
 *
 * This scheduler:
 * 1. Scans container revisions, then point-of-sale revisions, for stale references
 * 2. Propagates each stale (child, revision) pair as if the child had just been published
 * 3. Removes deleted children from their parents
 *
 * Every step is idempotent: a reference repaired by a concurrent publish is simply skipped.
 * References held by parents that are not propagation targets (deactivated owners) are found
 * again on every pass but only parents actually republished count as repaired.
 *
 * @author Catalog Team
 */
@Service
public class StaleReferenceRepairScheduler {

    private static final Logger logger = LoggerFactory.getLogger(StaleReferenceRepairScheduler.class);

    private static final CatalogFamily[] PARENT_FAMILIES = {CatalogFamily.CONTAINER, CatalogFamily.POINT_OF_SALE};

    private final CatalogStores stores;
    private final PropagationEngine propagationEngine;
    private final CatalogMetricsService metricsService;

    @Value("${catalog.repair.enabled:true}")
    private boolean repairEnabled = true;

    public StaleReferenceRepairScheduler(
            CatalogStores stores,
            PropagationEngine propagationEngine,
            CatalogMetricsService metricsService
    ) {
        this.stores = stores;
        this.propagationEngine = propagationEngine;
        this.metricsService = metricsService;
    }

    @Scheduled(fixedDelayString = "${catalog.repair.fixed-delay-ms:60000}")
    public void repairStaleReferences() {
        if (!repairEnabled) {
            logger.debug("Stale reference repair is disabled");
            return;
        }
        runRepair();
    }

    /**
     * Run a repair pass now, regardless of the enabled flag.
     *
     * @return Number of stale references found
     */
    public int triggerRepairNow() {
        logger.info("Manually triggering stale reference repair");
        return runRepair();
    }

    private int runRepair() {
        long startTime = System.currentTimeMillis();
        int found = 0;
        int republished = 0;
        int failed = 0;

        for (CatalogFamily parentFamily : PARENT_FAMILIES) {
            CatalogFamily childFamily = parentFamily.child().orElseThrow();

            Set<ChildReference> staleReferences = new LinkedHashSet<>(stores.forFamily(parentFamily).findStaleReferences());
            for (ChildReference reference : staleReferences) {
                found++;
                try {
                    PropagationReport report = propagationEngine.propagate(
                            childFamily, reference.getChildId(), reference.getChildRevision());
                    republished += report.getRepublished().size();
                    if (report.hasFailures()) {
                        failed++;
                    }
                } catch (Exception e) {
                    logger.error("Error repairing {} references to {} {} revision {}",
                            parentFamily.getDisplayName(), childFamily.getDisplayName(),
                            reference.getChildId(), reference.getChildRevision(), e);
                    failed++;
                    metricsService.recordError("STALE_REFERENCE_REPAIR_ERROR", "repairStaleReferences");
                }
            }

            List<Long> deletedChildIds = stores.forFamily(parentFamily).findDeletedChildReferences();
            for (Long childId : deletedChildIds) {
                found++;
                try {
                    PropagationReport report = propagationEngine.propagateDeletion(childFamily, childId);
                    republished += report.getRepublished().size();
                    if (report.hasFailures()) {
                        failed++;
                    }
                } catch (Exception e) {
                    logger.error("Error removing deleted {} {} from {} revisions",
                            childFamily.getDisplayName(), childId, parentFamily.getDisplayName(), e);
                    failed++;
                    metricsService.recordError("STALE_REFERENCE_REPAIR_ERROR", "repairDeletedReferences");
                }
            }
        }

        long duration = System.currentTimeMillis() - startTime;
        if (found == 0) {
            logger.debug("No stale references found");
        } else {
            logger.info("Stale reference repair completed: {} found, {} parents republished, {} failed, duration: {}ms",
                    found, republished, failed, duration);
            if (republished > 0) {
                metricsService.recordStaleReferencesRepaired(republished);
            }
        }
        return found;
    }
}
