package com.cred.freestyle.catalog.service;

import com.cred.freestyle.catalog.domain.model.Product;
import com.cred.freestyle.catalog.domain.model.ProductFields;
import com.cred.freestyle.catalog.domain.model.ProductRevision;
import com.cred.freestyle.catalog.domain.model.PendingProductUpdate;
import com.cred.freestyle.catalog.infrastructure.cache.RevisionCacheService;
import com.cred.freestyle.catalog.infrastructure.messaging.CatalogEventPublisher;
import com.cred.freestyle.catalog.infrastructure.metrics.CatalogMetricsService;
import com.cred.freestyle.catalog.service.store.CatalogStores;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collections;

/**
 * Product catalog operations. Products are leaves: publishing one propagates to the
 * containers that list it and, through them, to points of sale.
 *
 * @author Catalog Team
 */
@Service
public class ProductService extends RevisionedCatalogService<Product, ProductRevision, PendingProductUpdate, ProductFields> {

    public ProductService(
            CatalogStores stores,
            RevisionPublisher publisher,
            PropagationEngine propagationEngine,
            RevisionCacheService cacheService,
            CatalogEventPublisher eventPublisher,
            CatalogMetricsService metricsService
    ) {
        super(stores.products(), ProductRevision.class, stores, publisher, propagationEngine,
                cacheService, eventPublisher, metricsService);
    }

    @Transactional
    public Long createDraft(String ownerId, ProductFields fields) {
        return createDraft(ownerId, fields, Collections.emptyList());
    }

    @Transactional
    public PendingProductUpdate stageUpdate(Long productId, ProductFields fields) {
        return stageUpdate(productId, fields, Collections.emptyList());
    }

    public ProductRevision publishDirect(Long productId, ProductFields fields) {
        return publishDirect(productId, fields, Collections.emptyList());
    }
}
