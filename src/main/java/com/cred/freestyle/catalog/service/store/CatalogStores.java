package com.cred.freestyle.catalog.service.store;

import com.cred.freestyle.catalog.domain.model.CatalogFamily;
import org.springframework.stereotype.Component;

/**
 * Lookup of the store responsible for each aggregate family.
 *
 * @author Catalog Team
 */
@Component
public class CatalogStores {

    private final ProductStore productStore;
    private final ContainerStore containerStore;
    private final PointOfSaleStore pointOfSaleStore;

    public CatalogStores(ProductStore productStore, ContainerStore containerStore, PointOfSaleStore pointOfSaleStore) {
        this.productStore = productStore;
        this.containerStore = containerStore;
        this.pointOfSaleStore = pointOfSaleStore;
    }

    public RevisionedAggregateStore<?, ?, ?, ?> forFamily(CatalogFamily family) {
        switch (family) {
            case PRODUCT:
                return productStore;
            case CONTAINER:
                return containerStore;
            case POINT_OF_SALE:
                return pointOfSaleStore;
            default:
                throw new IllegalArgumentException("Unknown catalog family: " + family);
        }
    }

    public ProductStore products() {
        return productStore;
    }

    public ContainerStore containers() {
        return containerStore;
    }

    public PointOfSaleStore pointsOfSale() {
        return pointOfSaleStore;
    }
}
