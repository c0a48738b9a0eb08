package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.PointOfSale;
import com.cred.freestyle.catalog.domain.model.PointOfSaleFields;
import com.cred.freestyle.catalog.domain.model.PointOfSaleRevision;
import com.cred.freestyle.catalog.domain.model.PendingPointOfSaleUpdate;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import org.springframework.stereotype.Service;

/**
 * Point-of-sale catalog operations. Points of sale are roots, so nothing propagates above them.
 *
 * @author Catalog Team
 */
@Service
public class PointOfSaleService
        extends RevisionedCatalogService<PointOfSale, PointOfSaleRevision, PendingPointOfSaleUpdate, PointOfSaleFields> {

    public PointOfSaleService(
            CatalogStores stores,
            RevisionPublisher publisher,
            PropagationEngine propagationEngine,
            RevisionCacheService cacheService,
            CatalogEventPublisher eventPublisher,
            CatalogMetricsService metricsService
    ) {
        super(stores.pointsOfSale(), PointOfSaleRevision.class, stores, publisher, propagationEngine,
                cacheService, eventPublisher, metricsService);
    }
}
