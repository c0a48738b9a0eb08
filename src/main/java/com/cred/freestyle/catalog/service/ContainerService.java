package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.Container;
import com.cred.freestyle.catalog.domain.model.ContainerFields;
import com.cred.freestyle.catalog.domain.model.ContainerRevision;
import com.cred.freestyle.catalog.domain.model.PendingContainerUpdate;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import org.springframework.stereotype.Service;

/**
 * Container catalog operations.
 *
 * @author Catalog Team
 */
@Service
public class ContainerService
        extends RevisionedCatalogService<Container, ContainerRevision, PendingContainerUpdate, ContainerFields> {

    public ContainerService(
            CatalogStores stores,
            RevisionPublisher publisher,
            PropagationEngine propagationEngine,
            RevisionCacheService cacheService,
            CatalogEventPublisher eventPublisher,
            CatalogMetricsService metricsService
    ) {
        super(stores.containers(), ContainerRevision.class, stores, publisher, propagationEngine,
                cacheService, eventPublisher, metricsService);
    }
}
